package com.can.ringcache.core;

import java.util.Map;

/**
 * En az erişilen anahtarı kurban seçer. Eşitlik durumunda önce eklenen girdi
 * tahliye edilir; erişim sayısı doğrudan {@link CacheEntry} üzerinde tutulduğu
 * için ek takip yapısına gerek yoktur.
 */
final class LfuEvictionPolicy implements EvictionPolicy
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
            if (victim == null
                    || entry.accessCount() < victim.accessCount()
                    || (entry.accessCount() == victim.accessCount() && entry.sequence() < victim.sequence())) {
                victim = entry;
            }
        }
        return victim == null ? null : victim.key();
    }
}
