package com.can.ringcache.core;

/**
 * TTL süpürücüsünün min-heap'inde tutulan, son kullanma zamanına göre sıralanan
 * kayıt türüdür. Girdi sonradan yeniden yazılırsa kayıt bayatlar; süpürücü
 * {@code expiresAtMillis} eşleşmediğinde kaydı sessizce atar.
 */
record ExpiringKey(String key, long expiresAtMillis) implements Comparable<ExpiringKey>
{
    @Override
    public int compareTo(ExpiringKey o)
    {
        return Long.compare(expiresAtMillis, o.expiresAtMillis);
    }
}
