package com.can.ringcache.backend;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Yerel bellek motoru ya da uzak bir düğüm istemcisi olsun, her depolama
 * biriminin sunması gereken önbellek sözleşmesidir. Koordinatör yalnızca bu
 * arayüze bağımlıdır; anahtarın bulunamaması bir hata değil, boş bir
 * {@link Optional} ya da {@code -1} TTL değeri olarak döner. Gerçek işlem
 * hataları {@link CacheOperationException} ile bildirilir.
 */
public interface CacheBackend
{
    /** Key used by the default {@link #ping()} check. */
    String PING_KEY = "__ringcache:ping__";

    void connect();

    void disconnect();

    boolean isConnected();

    Optional<byte[]> get(String key);

    /**
     * Stores the value.
     *
     * @param ttlSeconds {@code null} for the backend default, otherwise a non-negative TTL
     */
    void set(String key, byte[] value, Integer ttlSeconds);

    /** @return true if an entry was actually removed */
    boolean delete(String key);

    boolean exists(String key);

    void expire(String key, int ttlSeconds);

    /** @return remaining seconds, or -1 when the key has no TTL or is absent */
    long ttl(String key);

    /** @return number of entries removed, or -1 when the backend cannot tell */
    long clear();

    /**
     * Lightweight liveness check used by health checks. Throws when the backend
     * is unreachable.
     */
    default void ping()
    {
        exists(PING_KEY);
    }

    default Map<String, byte[]> getMany(Collection<String> keys)
    {
        Map<String, byte[]> out = new LinkedHashMap<>();
        for (String key : keys) {
            get(key).ifPresent(value -> out.put(key, value));
        }
        return out;
    }

    default void setMany(Map<String, byte[]> entries, Integer ttlSeconds)
    {
        entries.forEach((key, value) -> set(key, value, ttlSeconds));
    }
}
