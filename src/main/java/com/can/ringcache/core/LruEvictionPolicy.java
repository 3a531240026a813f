package com.can.ringcache.core;

import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Map;

/**
 * En uzun süredir erişilmeyen anahtarı kurban seçer. Erişim sırası her okuma ve
 * yazmada güncellenen ayrı bir {@link LinkedHashSet} içinde tutulur.
 */
final class LruEvictionPolicy implements EvictionPolicy
{
    private final LinkedHashSet<String> accessOrder = new LinkedHashSet<>();

    @Override
    public void recordInsert(String key, CacheEntry entry)
    {
        moveToTail(key);
    }

    @Override
    public void recordAccess(String key, CacheEntry entry)
    {
        moveToTail(key);
    }

    private void moveToTail(String key)
    {
        accessOrder.remove(key);
        accessOrder.add(key);
    }

    @Override
    public void onRemove(String key)
    {
        accessOrder.remove(key);
    }

    @Override
    public void clear()
    {
        accessOrder.clear();
    }

    @Override
    public String selectVictim(Map<String, CacheEntry> entries, long nowMillis)
    {
        Iterator<String> it = accessOrder.iterator();
        while (it.hasNext()) {
            String candidate = it.next();
            if (entries.containsKey(candidate)) {
                return candidate;
            }
        }
        return entries.isEmpty() ? null : entries.keySet().iterator().next();
    }
}
