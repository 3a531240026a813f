package com.can.ringcache.cluster;

import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.codec.digest.MurmurHash3;

import java.util.Locale;

/**
 * Built-in ring hash functions. Digest based variants take the first eight bytes of
 * the digest, big-endian, as the ring coordinate.
 */
public enum HashAlgorithm implements HashFn
{
    MD5 {
        @Override
        public long hash(byte[] bytes)
        {
            return firstLong(DigestUtils.md5(bytes));
        }
    },
    SHA1 {
        @Override
        public long hash(byte[] bytes)
        {
            return firstLong(DigestUtils.sha1(bytes));
        }
    },
    SHA256 {
        @Override
        public long hash(byte[] bytes)
        {
            return firstLong(DigestUtils.sha256(bytes));
        }
    },
    MURMUR3 {
        @Override
        public long hash(byte[] bytes)
        {
            return MurmurHash3.hash128x64(bytes)[0];
        }
    };

    static long firstLong(byte[] digest)
    {
        long v = 0L;
        for (int i = 0; i < Long.BYTES; i++) {
            v = (v << 8) | (digest[i] & 0xffL);
        }
        return v;
    }

    public static HashAlgorithm fromConfig(String value)
    {
        if (value == null || value.isBlank()) return SHA256;
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace("-", "");
        try {
            return HashAlgorithm.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown hash algorithm: " + value, ex);
        }
    }
}
