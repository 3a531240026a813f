package com.can.ringcache.core;

import java.util.Map;

/** Oldest {@code createdAt} goes first, regardless of how often it was read. */
final class FifoEvictionPolicy implements EvictionPolicy
{
    @Override
    public void recordInsert(String key, CacheEntry entry) {}

    @Override
    public void recordAccess(String key, CacheEntry entry) {}

    @Override
    public void onRemove(String key) {}

    @Override
    public void clear() {}

    @Override
    public String selectVictim(Map<String, CacheEntry> entries, long nowMillis)
    {
        CacheEntry victim = null;
        for (CacheEntry entry : entries.values()) {
            if (victim == null || olderThan(entry, victim)) {
                victim = entry;
            }
        }
        return victim == null ? null : victim.key();
    }

    private static boolean olderThan(CacheEntry a, CacheEntry b)
    {
        if (a.createdAtMillis() != b.createdAtMillis()) {
            return a.createdAtMillis() < b.createdAtMillis();
        }
        return a.sequence() < b.sequence();
    }
}
