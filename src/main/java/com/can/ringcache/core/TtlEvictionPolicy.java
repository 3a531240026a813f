package com.can.ringcache.core;

import java.util.Map;

/**
 * Süresi dolmuş bir girdi varsa onu, yoksa son kullanma zamanı en yakın olanı
 * kurban seçer. TTL tanımlanmamış girdiler en son sırada, eklenme sırasına göre
 * tahliye edilir.
 */
final class TtlEvictionPolicy implements EvictionPolicy
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
        CacheEntry nearest = null;
        CacheEntry oldestWithoutTtl = null;
        for (CacheEntry entry : entries.values()) {
            if (entry.isExpired(nowMillis)) {
                return entry.key();
            }
            if (entry.hasTtl()) {
                if (nearest == null || entry.expiresAtMillis() < nearest.expiresAtMillis()) {
                    nearest = entry;
                }
            } else if (oldestWithoutTtl == null) {
                oldestWithoutTtl = entry;
            }
        }
        if (nearest != null) {
            return nearest.key();
        }
        return oldestWithoutTtl == null ? null : oldestWithoutTtl.key();
    }
}
