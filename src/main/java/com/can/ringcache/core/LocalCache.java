package com.can.ringcache.core;

import com.can.ringcache.backend.CacheBackend;
import com.can.ringcache.backend.CacheOperationException;
import com.can.ringcache.metric.Counter;
import com.can.ringcache.metric.MetricsRegistry;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Öğe sayısı ve bellek sınırları altında çalışan, seçilebilir tahliye
 * politikasıyla yer açan yerel önbellek motorudur. Girdi haritası, politika
 * takip yapısı ve TTL min-heap'i tek bir kilit altında birlikte güncellenir.
 * Süresi dolan girdiler erişimde tembel olarak, erişilmeyenler ise arka planda
 * periyodik çalışan süpürücü tarafından temizlenir.
 * <p>
 * Tek düğümlü kullanımda doğrudan, dağıtık kullanımda ise her düğümün depolama
 * birimi olarak {@link CacheBackend} sözleşmesi üzerinden kullanılır.
 */
public final class LocalCache implements CacheBackend, AutoCloseable
{
    private static final Logger LOG = Logger.getLogger(LocalCache.class);
    private static final int MIN_HEAP_COMPACTION_SIZE = 32;

    private final String name;
    private final int maxSize;
    private final long memoryLimitBytes;
    private final EvictionPolicyType policyType;
    private final EvictionPolicy policy;
    private final long sweepIntervalSeconds;
    private final boolean lazyExpiration;
    private final String namespacePrefix;
    private final long defaultTtlSeconds;
    private final long maxTtlSeconds;
    private final LongSupplier clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<String, CacheEntry> entries = new LinkedHashMap<>();
    private final PriorityQueue<ExpiringKey> ttlHeap = new PriorityQueue<>();
    private final AtomicLong sequence = new AtomicLong();
    private long memoryUsed;

    private final Counter hits, misses, sets, deletes, evictions, expirations, errors, oversizedInserts;

    private ScheduledExecutorService sweeper;
    private volatile boolean connected;

    private LocalCache(Builder b)
    {
        this.name = b.name;
        this.maxSize = b.maxSize;
        this.memoryLimitBytes = b.memoryLimitBytes;
        this.policyType = b.evictionPolicy;
        this.policy = b.evictionPolicy.create();
        this.sweepIntervalSeconds = b.ttlSweepIntervalSeconds;
        this.lazyExpiration = b.lazyExpiration;
        this.namespacePrefix = b.namespace == null || b.namespace.isBlank() ? null : b.namespace + ":";
        this.defaultTtlSeconds = b.defaultTtlSeconds;
        this.maxTtlSeconds = b.maxTtlSeconds;
        this.clock = b.clock;

        MetricsRegistry metrics = b.metrics != null ? b.metrics : new MetricsRegistry();
        this.hits = metrics.counter(name, "hits");
        this.misses = metrics.counter(name, "misses");
        this.sets = metrics.counter(name, "sets");
        this.deletes = metrics.counter(name, "deletes");
        this.evictions = metrics.counter(name, "evictions");
        this.expirations = metrics.counter(name, "expirations");
        this.errors = metrics.counter(name, "errors");
        this.oversizedInserts = metrics.counter(name, "oversized_inserts");
    }

    public static Builder builder() { return new Builder(); }

    /**
     * Yerel önbelleğin kapasite, bellek sınırı, tahliye politikası ve TTL
     * davranışını ayarlayan akıcı yapılandırma sınıfıdır. Geçersiz değerler
     * {@link #build()} sırasında reddedilir.
     */
    public static final class Builder
    {
        private String name = "local";
        private int maxSize = 1000;
        private long memoryLimitBytes = 100L * 1024 * 1024;
        private EvictionPolicyType evictionPolicy = EvictionPolicyType.LRU;
        private long ttlSweepIntervalSeconds = 300;
        private boolean lazyExpiration = true;
        private String namespace;
        private long defaultTtlSeconds;
        private long maxTtlSeconds;
        private MetricsRegistry metrics;
        private LongSupplier clock = System::currentTimeMillis;

        public Builder name(String n){ this.name = Objects.requireNonNull(n, "name"); return this; }
        public Builder maxSize(int s){ this.maxSize = s; return this; }
        public Builder memoryLimitBytes(long l){ this.memoryLimitBytes = l; return this; }
        public Builder evictionPolicy(EvictionPolicyType p){ this.evictionPolicy = Objects.requireNonNull(p); return this; }
        public Builder evictionPolicy(String p){ this.evictionPolicy = EvictionPolicyType.fromConfig(p); return this; }
        public Builder ttlSweepIntervalSeconds(long s){ this.ttlSweepIntervalSeconds = s; return this; }
        public Builder lazyExpiration(boolean l){ this.lazyExpiration = l; return this; }
        public Builder namespace(String ns){ this.namespace = ns; return this; }
        public Builder defaultTtlSeconds(long s){ this.defaultTtlSeconds = s; return this; }
        public Builder maxTtlSeconds(long s){ this.maxTtlSeconds = s; return this; }
        public Builder metrics(MetricsRegistry m){ this.metrics = m; return this; }
        public Builder clock(LongSupplier c){ this.clock = Objects.requireNonNull(c, "clock"); return this; }

        public LocalCache build()
        {
            if (maxSize <= 0) throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
            if (memoryLimitBytes <= 0) throw new IllegalArgumentException("memoryLimitBytes must be positive: " + memoryLimitBytes);
            if (ttlSweepIntervalSeconds < 0) throw new IllegalArgumentException("ttlSweepIntervalSeconds must not be negative");
            if (defaultTtlSeconds < 0) throw new IllegalArgumentException("defaultTtlSeconds must not be negative");
            if (maxTtlSeconds < 0) throw new IllegalArgumentException("maxTtlSeconds must not be negative");
            return new LocalCache(this);
        }
    }

    @Override
    public void connect()
    {
        lock.lock();
        try {
            if (connected) {
                return;
            }
            if (sweepIntervalSeconds > 0) {
                sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
                    Thread t = new Thread(r, "ringcache-ttl-sweeper-" + name);
                    t.setDaemon(true);
                    return t;
                });
                sweeper.scheduleWithFixedDelay(this::runSweep, sweepIntervalSeconds, sweepIntervalSeconds, TimeUnit.SECONDS);
            }
            connected = true;
        } finally {
            lock.unlock();
        }
        LOG.infof("Local cache %s started (policy=%s, maxSize=%d, memoryLimit=%d)", name,
                policyType.configName(), maxSize, memoryLimitBytes);
    }

    @Override
    public void disconnect()
    {
        ScheduledExecutorService toStop;
        lock.lock();
        try {
            if (!connected) {
                return;
            }
            toStop = sweeper;
            sweeper = null;
            clearAll();
            connected = false;
        } finally {
            lock.unlock();
        }
        if (toStop != null) {
            toStop.shutdownNow();
        }
        LOG.infof("Local cache %s stopped", name);
    }

    @Override
    public boolean isConnected()
    {
        return connected;
    }

    @Override
    public Optional<byte[]> get(String key)
    {
        String k = makeKey(key);
        long now = clock.getAsLong();
        lock.lock();
        try {
            CacheEntry entry = entries.get(k);
            if (entry == null) {
                misses.inc();
                return Optional.empty();
            }
            if (lazyExpiration && entry.isExpired(now)) {
                removeEntry(k);
                expirations.inc();
                misses.inc();
                return Optional.empty();
            }
            entry.touch(now);
            policy.recordAccess(k, entry);
            hits.inc();
            return Optional.of(entry.value());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void set(String key, byte[] value, Integer ttlSeconds)
    {
        Objects.requireNonNull(value, "value");
        String k = makeKey(key);
        long ttl = resolveTtl(ttlSeconds);
        long now = clock.getAsLong();
        lock.lock();
        try {
            removeEntry(k);
            CacheEntry entry = new CacheEntry(k, value, ttl, now, sequence.incrementAndGet());
            ensureSpace(entry.sizeBytes(), now);
            entries.put(k, entry);
            memoryUsed += entry.sizeBytes();
            policy.recordInsert(k, entry);
            if (entry.hasTtl()) {
                offerExpiry(k, entry);
            }
            sets.inc();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Evicts until one more entry of {@code needed} bytes fits. When the store runs
     * empty without satisfying the memory bound the entry is still stored and the
     * over-limit state becomes visible through {@link #stats()}.
     */
    private void ensureSpace(long needed, long now)
    {
        while (entries.size() >= maxSize || memoryUsed + needed > memoryLimitBytes) {
            if (entries.isEmpty()) {
                oversizedInserts.inc();
                LOG.debugf("Entry of %d bytes exceeds memory limit %d of cache %s", needed, memoryLimitBytes, name);
                return;
            }
            String victim = policy.selectVictim(entries, now);
            if (victim == null || !entries.containsKey(victim)) {
                return;
            }
            removeEntry(victim);
            evictions.inc();
        }
    }

    @Override
    public boolean delete(String key)
    {
        String k = makeKey(key);
        lock.lock();
        try {
            boolean removed = removeEntry(k);
            if (removed) {
                deletes.inc();
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean exists(String key)
    {
        String k = makeKey(key);
        long now = clock.getAsLong();
        lock.lock();
        try {
            CacheEntry entry = entries.get(k);
            if (entry == null) {
                return false;
            }
            if (lazyExpiration && entry.isExpired(now)) {
                removeEntry(k);
                expirations.inc();
                return false;
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void expire(String key, int ttlSeconds)
    {
        String k = makeKey(key);
        long ttl = validateTtl(ttlSeconds);
        long now = clock.getAsLong();
        lock.lock();
        try {
            CacheEntry entry = entries.get(k);
            if (entry == null) {
                return;
            }
            if (lazyExpiration && entry.isExpired(now)) {
                removeEntry(k);
                expirations.inc();
                return;
            }
            entry.applyTtl(ttl, now);
            if (entry.hasTtl()) {
                offerExpiry(k, entry);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long ttl(String key)
    {
        String k = makeKey(key);
        long now = clock.getAsLong();
        lock.lock();
        try {
            CacheEntry entry = entries.get(k);
            if (entry == null || !entry.hasTtl()) {
                return -1L;
            }
            if (lazyExpiration && entry.isExpired(now)) {
                removeEntry(k);
                expirations.inc();
                return -1L;
            }
            return Math.max(0L, (entry.expiresAtMillis() - now) / 1000L);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long clear()
    {
        lock.lock();
        try {
            if (namespacePrefix == null) {
                return clearAll();
            }
            List<String> doomed = new ArrayList<>();
            for (String k : entries.keySet()) {
                if (k.startsWith(namespacePrefix)) {
                    doomed.add(k);
                }
            }
            doomed.forEach(this::removeEntry);
            return doomed.size();
        } finally {
            lock.unlock();
        }
    }

    private int clearAll()
    {
        int removed = entries.size();
        entries.clear();
        ttlHeap.clear();
        policy.clear();
        memoryUsed = 0L;
        return removed;
    }

    /**
     * Pops every heap record whose expiry time has passed and removes the matching
     * entry if it is still the same generation and still expired.
     *
     * @return number of entries removed
     */
    public int sweepExpired()
    {
        long now = clock.getAsLong();
        int removed = 0;
        lock.lock();
        try {
            ExpiringKey head;
            while ((head = ttlHeap.peek()) != null && head.expiresAtMillis() < now) {
                ttlHeap.poll();
                CacheEntry entry = entries.get(head.key());
                if (entry != null && entry.expiresAtMillis() == head.expiresAtMillis() && entry.isExpired(now)) {
                    removeEntry(head.key());
                    removed++;
                }
            }
        } finally {
            lock.unlock();
        }
        if (removed > 0) {
            expirations.add(removed);
            LOG.debugf("TTL sweep removed %d expired entries from cache %s", removed, name);
        }
        return removed;
    }

    private void runSweep()
    {
        try {
            sweepExpired();
        } catch (RuntimeException e) {
            LOG.errorf(e, "TTL sweep failed for cache %s", name);
        }
    }

    /**
     * Overwrites and {@code expire} calls leave stale heap records behind. The heap is
     * rebuilt from the live entries once it holds more than twice as many records.
     */
    private void offerExpiry(String k, CacheEntry entry)
    {
        ttlHeap.offer(new ExpiringKey(k, entry.expiresAtMillis()));
        if (ttlHeap.size() > Math.max(MIN_HEAP_COMPACTION_SIZE, 2 * entries.size())) {
            ttlHeap.clear();
            for (CacheEntry e : entries.values()) {
                if (e.hasTtl()) {
                    ttlHeap.offer(new ExpiringKey(e.key(), e.expiresAtMillis()));
                }
            }
        }
    }

    int ttlHeapSize()
    {
        lock.lock();
        try { return ttlHeap.size(); } finally { lock.unlock(); }
    }

    private boolean removeEntry(String k)
    {
        CacheEntry removed = entries.remove(k);
        if (removed == null) {
            return false;
        }
        memoryUsed -= removed.sizeBytes();
        policy.onRemove(k);
        return true;
    }

    private String makeKey(String key)
    {
        Objects.requireNonNull(key, "key");
        return namespacePrefix == null ? key : namespacePrefix + key;
    }

    private long resolveTtl(Integer ttlSeconds)
    {
        if (ttlSeconds == null) {
            return defaultTtlSeconds;
        }
        return validateTtl(ttlSeconds);
    }

    private long validateTtl(long ttlSeconds)
    {
        if (ttlSeconds < 0) {
            errors.inc();
            throw new CacheOperationException(CacheOperationException.Kind.INVALID_ARGUMENT,
                    "TTL must not be negative: " + ttlSeconds);
        }
        if (maxTtlSeconds > 0 && ttlSeconds > maxTtlSeconds) {
            return maxTtlSeconds;
        }
        return ttlSeconds;
    }

    public int size()
    {
        lock.lock();
        try { return entries.size(); } finally { lock.unlock(); }
    }

    /** Keys in insertion order, without the namespace prefix. */
    public List<String> keys()
    {
        lock.lock();
        try {
            List<String> out = new ArrayList<>(entries.size());
            Iterator<String> it = entries.keySet().iterator();
            while (it.hasNext()) {
                String k = it.next();
                out.add(namespacePrefix != null && k.startsWith(namespacePrefix) ? k.substring(namespacePrefix.length()) : k);
            }
            return out;
        } finally {
            lock.unlock();
        }
    }

    public CacheStats stats()
    {
        lock.lock();
        try {
            return new CacheStats(hits.get(), misses.get(), sets.get(), deletes.get(), evictions.get(),
                    expirations.get(), errors.get(), entries.size(), maxSize, memoryUsed, memoryLimitBytes,
                    policyType.configName(), memoryUsed > memoryLimitBytes);
        } finally {
            lock.unlock();
        }
    }

    public String name()
    {
        return name;
    }

    public EvictionPolicyType evictionPolicy()
    {
        return policyType;
    }

    @Override
    public void close()
    {
        disconnect();
    }
}
