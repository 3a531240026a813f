package com.can.ringcache.core;

import java.nio.charset.StandardCharsets;

/**
 * Önbellekte tutulan tek bir değeri, TTL bilgisini ve tahliye politikalarının
 * ihtiyaç duyduğu erişim meta verilerini taşıyan sınıftır. Değer baytları
 * değişmez; yalnızca erişim zamanı, erişim sayısı ve son kullanma zamanı
 * {@link LocalCache} kilidi altında güncellenir.
 */
public final class CacheEntry
{
    static final int ENTRY_OVERHEAD_BYTES = 64;

    private final String key;
    private final byte[] value;
    private final long createdAtMillis;
    private final long sequence;
    private final long sizeBytes;
    private long ttlSeconds;
    private long expiresAtMillis;
    private long lastAccessedAtMillis;
    private long accessCount;

    CacheEntry(String key, byte[] value, long ttlSeconds, long nowMillis, long sequence)
    {
        this.key = key;
        this.value = value;
        this.createdAtMillis = nowMillis;
        this.lastAccessedAtMillis = nowMillis;
        this.sequence = sequence;
        this.sizeBytes = estimateSize(key, value);
        applyTtl(ttlSeconds, nowMillis);
    }

    static long estimateSize(String key, byte[] value)
    {
        return (long) key.getBytes(StandardCharsets.UTF_8).length + value.length + ENTRY_OVERHEAD_BYTES;
    }

    /** ttl <= 0 removes the expiry. */
    void applyTtl(long ttlSeconds, long nowMillis)
    {
        this.ttlSeconds = Math.max(0L, ttlSeconds);
        if (this.ttlSeconds == 0L) {
            this.expiresAtMillis = 0L;
            return;
        }
        long expiresAt = nowMillis + this.ttlSeconds * 1000L;
        this.expiresAtMillis = expiresAt <= 0L ? Long.MAX_VALUE : expiresAt;
    }

    public boolean isExpired(long nowMillis)
    {
        return expiresAtMillis > 0L && nowMillis > expiresAtMillis;
    }

    void touch(long nowMillis)
    {
        accessCount++;
        lastAccessedAtMillis = nowMillis;
    }

    public boolean hasTtl()
    {
        return expiresAtMillis > 0L;
    }

    public String key() { return key; }
    public byte[] value() { return value; }
    public long ttlSeconds() { return ttlSeconds; }
    public long createdAtMillis() { return createdAtMillis; }
    public long lastAccessedAtMillis() { return lastAccessedAtMillis; }
    public long accessCount() { return accessCount; }
    public long sizeBytes() { return sizeBytes; }

    /** @return 0 when the entry never expires by time */
    public long expiresAtMillis() { return expiresAtMillis; }

    /** Monotonic insertion number, used to break ties between entries created in the same millisecond. */
    long sequence() { return sequence; }
}
