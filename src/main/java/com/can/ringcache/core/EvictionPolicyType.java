package com.can.ringcache.core;

import java.util.Locale;

public enum EvictionPolicyType
{
    LRU {
        @Override
        EvictionPolicy create()
        {
            return new LruEvictionPolicy();
        }
    },
    LFU {
        @Override
        EvictionPolicy create()
        {
            return new LfuEvictionPolicy();
        }
    },
    FIFO {
        @Override
        EvictionPolicy create()
        {
            return new FifoEvictionPolicy();
        }
    },
    TTL {
        @Override
        EvictionPolicy create()
        {
            return new TtlEvictionPolicy();
        }
    };

    abstract EvictionPolicy create();

    public String configName()
    {
        return name().toLowerCase(Locale.ROOT);
    }

    public static EvictionPolicyType fromConfig(String value)
    {
        if (value == null || value.isBlank()) return LRU;
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return EvictionPolicyType.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown eviction policy: " + value, ex);
        }
    }
}
