package com.can.ringcache.core;

import java.util.Map;

/**
 * Abstraction that decides which entry a bounded store gives up when it is full.
 * Implementations may keep their own tracking state (for example an access-order
 * list) which the store updates on every insert, read and removal. Victim selection
 * itself never mutates the store, so it can be tested without any I/O.
 */
interface EvictionPolicy
{
    /** Called after a new entry has been placed in the store. */
    void recordInsert(String key, CacheEntry entry);

    /** Called after a successful read touched the entry. */
    void recordAccess(String key, CacheEntry entry);

    /** Called after the entry left the store for any reason. */
    void onRemove(String key);

    void clear();

    /**
     * @param entries current store content in insertion order
     * @param nowMillis current time, used by time-aware policies
     * @return key to evict, or {@code null} when the store is empty
     */
    String selectVictim(Map<String, CacheEntry> entries, long nowMillis);
}
