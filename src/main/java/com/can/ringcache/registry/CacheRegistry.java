package com.can.ringcache.registry;

import com.can.ringcache.backend.CacheBackend;
import com.can.ringcache.backend.CacheOperationException;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * İsimlendirilmiş önbellekleri bir arada tutan ve yaşam döngülerini yöneten
 * kayıt nesnesidir. Global tekil yöneticiler yerine yapıcı ya da CDI
 * üzerinden açıkça aktarılır; böylece testlerde birbirinden bağımsız birden
 * fazla kayıt aynı anda var olabilir. {@link #init()} tüm önbellekleri bağlar,
 * {@link #shutdown()} kayıt sırasının tersiyle bağlantıları kapatır.
 */
public final class CacheRegistry implements AutoCloseable
{
    private static final Logger LOG = Logger.getLogger(CacheRegistry.class);

    private final Map<String, CacheBackend> caches = new LinkedHashMap<>();
    private boolean initialized;

    public synchronized CacheRegistry register(String name, CacheBackend backend)
    {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(backend, "backend");
        if (caches.containsKey(name)) {
            throw new IllegalArgumentException("Cache already registered: " + name);
        }
        caches.put(name, backend);
        if (initialized) {
            backend.connect();
        }
        return this;
    }

    public synchronized Optional<CacheBackend> find(String name)
    {
        return Optional.ofNullable(caches.get(name));
    }

    public synchronized CacheBackend get(String name)
    {
        CacheBackend backend = caches.get(name);
        if (backend == null) {
            throw new CacheOperationException(CacheOperationException.Kind.INVALID_ARGUMENT, "Unknown cache: " + name);
        }
        return backend;
    }

    public <T extends CacheBackend> T get(String name, Class<T> type)
    {
        CacheBackend backend = get(name);
        if (!type.isInstance(backend)) {
            throw new IllegalArgumentException("Cache " + name + " is a " + backend.getClass().getSimpleName()
                    + ", not a " + type.getSimpleName());
        }
        return type.cast(backend);
    }

    public synchronized Map<String, CacheBackend> caches()
    {
        return Collections.unmodifiableMap(new LinkedHashMap<>(caches));
    }

    /** Connects every registered cache. A failure disconnects the ones already connected. */
    public synchronized void init()
    {
        if (initialized) {
            return;
        }
        List<Map.Entry<String, CacheBackend>> started = new ArrayList<>();
        for (Map.Entry<String, CacheBackend> e : caches.entrySet()) {
            try {
                e.getValue().connect();
                started.add(e);
            } catch (RuntimeException ex) {
                LOG.errorf(ex, "Cache %s failed to start", e.getKey());
                Collections.reverse(started);
                started.forEach(s -> disconnectQuietly(s.getKey(), s.getValue()));
                throw ex;
            }
        }
        initialized = true;
        LOG.infof("Cache registry initialised with %d caches %s", caches.size(), caches.keySet());
    }

    public synchronized void shutdown()
    {
        if (!initialized) {
            return;
        }
        List<Map.Entry<String, CacheBackend>> entries = new ArrayList<>(caches.entrySet());
        Collections.reverse(entries);
        for (Map.Entry<String, CacheBackend> e : entries) {
            disconnectQuietly(e.getKey(), e.getValue());
        }
        initialized = false;
        LOG.info("Cache registry shut down");
    }

    public synchronized boolean isInitialized()
    {
        return initialized;
    }

    private static void disconnectQuietly(String name, CacheBackend backend)
    {
        try {
            backend.disconnect();
        } catch (RuntimeException e) {
            LOG.warnf(e, "Cache %s failed to stop cleanly", name);
        }
    }

    @Override
    public void close()
    {
        shutdown();
    }
}
