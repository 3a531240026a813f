package com.can.ringcache.cluster;

import com.can.ringcache.backend.CacheBackend;
import com.can.ringcache.backend.CacheOperationException;
import com.can.ringcache.backend.CacheOperationException.Kind;
import com.can.ringcache.metric.Counter;
import com.can.ringcache.metric.MetricsRegistry;
import io.vertx.core.Vertx;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.LongSupplier;

/**
 * Önbellek girdilerini tutarlı hash halkası üzerinden birden fazla depolama
 * düğümüne dağıtan ve replike eden koordinatördür. Okuma ve yazmalar
 * yapılandırılan tutarlılık seviyesine göre replikalara eşzamanlı olarak
 * gönderilir; yalnızca gereken sayıda yanıt beklenir. Eksik replikalar okuma
 * sırasında arka planda onarılır.
 * <p>
 * Ardışık hata sayısı eşiğe ulaşan düğüm karantinaya alınır ve hemen halkadan
 * çıkarılır. Periyodik sağlık kontrolü karantinadaki düğümleri yoklar, başarılı
 * olanları aynı sanal konumlarıyla halkaya geri ekler. Halka ve karantina
 * tablosu yalnızca üyelik kilidi altında değişir; bu kilit hiçbir düğüm
 * çağrısı boyunca tutulmaz.
 */
public final class DistributedCache implements CacheBackend, AutoCloseable
{
    private static final Logger LOG = Logger.getLogger(DistributedCache.class);

    private final String name;
    private final Map<CacheNode, CacheBackend> backends;
    private final ConsistentHashRing ring;
    private final QuarantineTable quarantine;
    private final Object membershipLock = new Object();
    private final int replicationFactor;
    private final ConsistencyLevel readConsistency;
    private final ConsistencyLevel writeConsistency;
    private final boolean readRepair;
    private final long healthCheckIntervalMillis;
    private final long recoveryIntervalMillis;
    private final long operationTimeoutMillis;
    private final Vertx vertx;
    private final LongSupplier clock;

    private final Counter hits, misses, sets, deletes, errors, readRepairs, readRepairFailures, quarantines, recoveries;

    private volatile ExecutorService executor;
    private volatile boolean connected;
    private long healthTimerId = -1L;

    private DistributedCache(Builder b)
    {
        this.name = b.name;
        this.backends = new LinkedHashMap<>(b.backends);
        this.ring = new ConsistentHashRing(b.hashFn, b.virtualNodesPerNode);
        this.quarantine = new QuarantineTable(b.failureThreshold);
        this.replicationFactor = b.replicationFactor;
        this.readConsistency = b.readConsistency;
        this.writeConsistency = b.writeConsistency;
        this.readRepair = b.readRepair;
        this.healthCheckIntervalMillis = TimeUnit.SECONDS.toMillis(b.healthCheckIntervalSeconds);
        this.recoveryIntervalMillis = TimeUnit.SECONDS.toMillis(b.recoveryIntervalSeconds);
        this.operationTimeoutMillis = b.operationTimeoutMillis;
        this.vertx = b.vertx;
        this.clock = b.clock;

        MetricsRegistry metrics = b.metrics != null ? b.metrics : new MetricsRegistry();
        this.hits = metrics.counter(name, "hits");
        this.misses = metrics.counter(name, "misses");
        this.sets = metrics.counter(name, "sets");
        this.deletes = metrics.counter(name, "deletes");
        this.errors = metrics.counter(name, "errors");
        this.readRepairs = metrics.counter(name, "read_repairs");
        this.readRepairFailures = metrics.counter(name, "read_repair_failures");
        this.quarantines = metrics.counter(name, "quarantines");
        this.recoveries = metrics.counter(name, "recoveries");
    }

    public static Builder builder() { return new Builder(); }

    /**
     * Koordinatörün düğüm listesini, halka parametrelerini, replikasyon ve
     * tutarlılık ayarlarını toplayan yapılandırma sınıfıdır. Tutarsız ayarlar
     * (pozitif olmayan replikasyon faktörü, düğüm sayısını aşan tutarlılık
     * gereksinimi gibi) {@link #build()} sırasında reddedilir.
     */
    public static final class Builder
    {
        private String name = "distributed";
        private final Map<CacheNode, CacheBackend> backends = new LinkedHashMap<>();
        private int virtualNodesPerNode = 160;
        private HashFn hashFn = HashAlgorithm.SHA256;
        private int replicationFactor = 1;
        private ConsistencyLevel readConsistency = ConsistencyLevel.ONE;
        private ConsistencyLevel writeConsistency = ConsistencyLevel.ONE;
        private boolean readRepair = true;
        private int failureThreshold = 3;
        private long healthCheckIntervalSeconds = 30;
        private long recoveryIntervalSeconds = 60;
        private long operationTimeoutMillis = 1000;
        private MetricsRegistry metrics;
        private Vertx vertx;
        private LongSupplier clock = System::currentTimeMillis;

        public Builder name(String n){ this.name = Objects.requireNonNull(n, "name"); return this; }
        public Builder node(CacheNode node, CacheBackend backend)
        {
            Objects.requireNonNull(node, "node");
            Objects.requireNonNull(backend, "backend");
            if (backends.putIfAbsent(node, backend) != null) {
                throw new IllegalArgumentException("Duplicate node id: " + node.id());
            }
            return this;
        }
        public Builder nodes(List<CacheNode> nodes, Function<CacheNode, CacheBackend> backendFactory)
        {
            for (CacheNode node : nodes) {
                node(node, backendFactory.apply(node));
            }
            return this;
        }
        public Builder virtualNodesPerNode(int v){ this.virtualNodesPerNode = v; return this; }
        public Builder hashFn(HashFn h){ this.hashFn = Objects.requireNonNull(h, "hashFn"); return this; }
        public Builder hashAlgorithm(String a){ this.hashFn = HashAlgorithm.fromConfig(a); return this; }
        public Builder replicationFactor(int r){ this.replicationFactor = r; return this; }
        public Builder readConsistency(ConsistencyLevel c){ this.readConsistency = Objects.requireNonNull(c); return this; }
        public Builder readConsistency(String c){ this.readConsistency = ConsistencyLevel.fromConfig(c); return this; }
        public Builder writeConsistency(ConsistencyLevel c){ this.writeConsistency = Objects.requireNonNull(c); return this; }
        public Builder writeConsistency(String c){ this.writeConsistency = ConsistencyLevel.fromConfig(c); return this; }
        public Builder readRepair(boolean r){ this.readRepair = r; return this; }
        public Builder failureThreshold(int t){ this.failureThreshold = t; return this; }
        public Builder healthCheckIntervalSeconds(long s){ this.healthCheckIntervalSeconds = s; return this; }
        public Builder recoveryIntervalSeconds(long s){ this.recoveryIntervalSeconds = s; return this; }
        public Builder operationTimeoutMillis(long ms){ this.operationTimeoutMillis = ms; return this; }
        public Builder metrics(MetricsRegistry m){ this.metrics = m; return this; }
        public Builder vertx(Vertx v){ this.vertx = v; return this; }
        public Builder clock(LongSupplier c){ this.clock = Objects.requireNonNull(c, "clock"); return this; }

        public DistributedCache build()
        {
            if (backends.isEmpty()) throw new IllegalArgumentException("At least one node is required");
            if (replicationFactor <= 0) throw new IllegalArgumentException("replicationFactor must be positive: " + replicationFactor);
            if (virtualNodesPerNode <= 0) throw new IllegalArgumentException("virtualNodesPerNode must be positive: " + virtualNodesPerNode);
            if (failureThreshold <= 0) throw new IllegalArgumentException("failureThreshold must be positive: " + failureThreshold);
            if (healthCheckIntervalSeconds < 0) throw new IllegalArgumentException("healthCheckIntervalSeconds must not be negative");
            if (recoveryIntervalSeconds < 0) throw new IllegalArgumentException("recoveryIntervalSeconds must not be negative");
            if (operationTimeoutMillis <= 0) throw new IllegalArgumentException("operationTimeoutMillis must be positive");
            checkSatisfiable("read", readConsistency);
            checkSatisfiable("write", writeConsistency);
            return new DistributedCache(this);
        }

        private void checkSatisfiable(String op, ConsistencyLevel level)
        {
            int needed = level.required(replicationFactor);
            if (needed > backends.size()) {
                throw new IllegalArgumentException(String.format(
                        "%s consistency %s needs %d replicas but only %d nodes are configured",
                        op, level.configName(), needed, backends.size()));
            }
        }
    }

    @Override
    public void connect()
    {
        synchronized (membershipLock) {
            if (connected) {
                return;
            }
            executor = Executors.newCachedThreadPool(daemonThreads("ringcache-" + name + "-io-"));
            connected = true;
        }
        for (Map.Entry<CacheNode, CacheBackend> e : backendSnapshot().entrySet()) {
            connectNode(e.getKey(), e.getValue());
        }
        if (ring.size() == 0) {
            disconnect();
            throw new CacheOperationException(Kind.NO_NODES_AVAILABLE, "No cache node could be connected");
        }
        startHealthChecks();
        LOG.infof("Distributed cache %s connected: %d/%d nodes active (rf=%d, read=%s, write=%s)", name,
                ring.size(), backends.size(), replicationFactor, readConsistency.configName(),
                writeConsistency.configName());
    }

    private void connectNode(CacheNode node, CacheBackend backend)
    {
        try {
            backend.connect();
            synchronized (membershipLock) {
                ring.addNode(node);
            }
            LOG.infof("Node %s connected", node.id());
        } catch (RuntimeException e) {
            synchronized (membershipLock) {
                quarantine.quarantine(node.id(), clock.getAsLong());
            }
            quarantines.inc();
            LOG.warnf(e, "Node %s failed to connect, placed in quarantine", node.id());
        }
    }

    private void startHealthChecks()
    {
        if (vertx == null || healthCheckIntervalMillis <= 0) {
            return;
        }
        healthTimerId = vertx.setPeriodic(healthCheckIntervalMillis, id ->
                vertx.<Void>executeBlocking(promise -> {
                    try {
                        checkHealth();
                    } catch (RuntimeException e) {
                        LOG.errorf(e, "Health check of cache %s failed", name);
                    }
                    promise.complete();
                }, false));
    }

    @Override
    public void disconnect()
    {
        ExecutorService toStop;
        synchronized (membershipLock) {
            if (!connected) {
                return;
            }
            connected = false;
            if (healthTimerId >= 0L) {
                vertx.cancelTimer(healthTimerId);
                healthTimerId = -1L;
            }
            ring.clear();
            quarantine.clear();
            toStop = executor;
            executor = null;
        }
        for (Map.Entry<CacheNode, CacheBackend> e : backendSnapshot().entrySet()) {
            try {
                e.getValue().disconnect();
            } catch (RuntimeException ex) {
                LOG.warnf(ex, "Failed to disconnect node %s", e.getKey().id());
            }
        }
        if (toStop != null) {
            toStop.shutdown();
        }
        LOG.infof("Distributed cache %s disconnected", name);
    }

    @Override
    public boolean isConnected()
    {
        return connected;
    }

    @Override
    public void close()
    {
        disconnect();
    }

    /**
     * Adds a node at runtime. A node that fails to connect goes straight to
     * quarantine and joins the ring once a health check succeeds.
     */
    public void addNode(CacheNode node, CacheBackend backend)
    {
        Objects.requireNonNull(node, "node");
        Objects.requireNonNull(backend, "backend");
        synchronized (membershipLock) {
            if (backends.putIfAbsent(node, backend) != null) {
                throw new IllegalArgumentException("Duplicate node id: " + node.id());
            }
        }
        if (connected) {
            connectNode(node, backend);
        }
    }

    /** Removes the node from routing and disconnects its backend. */
    public boolean removeNode(CacheNode node)
    {
        CacheBackend backend;
        synchronized (membershipLock) {
            backend = backends.remove(node);
            if (backend == null) {
                return false;
            }
            ring.removeNode(node);
            quarantine.release(node.id());
        }
        try {
            backend.disconnect();
        } catch (RuntimeException e) {
            LOG.warnf(e, "Failed to disconnect removed node %s", node.id());
        }
        LOG.infof("Node %s removed from cache %s", node.id(), name);
        return true;
    }

    private void recordFailure(CacheNode node, Throwable error)
    {
        LOG.debugf(error, "Operation failed on node %s", node.id());
        boolean quarantined;
        int failures;
        synchronized (membershipLock) {
            if (!backends.containsKey(node)) {
                return;
            }
            quarantined = quarantine.recordFailure(node.id(), clock.getAsLong(), recoveryIntervalMillis);
            failures = quarantine.failureCount(node.id());
            if (quarantined) {
                ring.removeNode(node);
            }
        }
        if (quarantined) {
            quarantines.inc();
            LOG.warnf("Node %s reached %d consecutive failures and was quarantined", node.id(), failures);
        }
    }

    private void recordSuccess(CacheNode node)
    {
        synchronized (membershipLock) {
            quarantine.recordSuccess(node.id());
        }
    }

    /**
     * Checks every quarantined node whose recovery delay has passed. A node that
     * never connected is connected first. Successful nodes rejoin the ring with a
     * reset failure counter.
     *
     * @return number of recovered nodes
     */
    public int checkHealth()
    {
        List<CacheNode> due = new ArrayList<>();
        synchronized (membershipLock) {
            if (!connected) {
                return 0;
            }
            for (String id : quarantine.dueForCheck(clock.getAsLong())) {
                backends.keySet().stream().filter(n -> n.id().equals(id)).findFirst().ifPresent(due::add);
            }
        }
        int recovered = 0;
        for (CacheNode node : due) {
            CacheBackend backend = backendIfPresent(node);
            if (backend == null) {
                continue;
            }
            try {
                if (!backend.isConnected()) {
                    backend.connect();
                }
                backend.ping();
            } catch (RuntimeException e) {
                synchronized (membershipLock) {
                    quarantine.checkFailed(node.id(), clock.getAsLong() + recoveryIntervalMillis);
                }
                LOG.debugf(e, "Health check of node %s failed", node.id());
                continue;
            }
            synchronized (membershipLock) {
                if (!connected || !backends.containsKey(node)) {
                    continue;
                }
                quarantine.release(node.id());
                ring.addNode(node);
            }
            recovered++;
            recoveries.inc();
            LOG.infof("Node %s recovered and rejoined the ring", node.id());
        }
        return recovered;
    }

    @Override
    public Optional<byte[]> get(String key)
    {
        ReadResult<Optional<byte[]>> read = read(key, backend -> backend.get(key), "get");
        CacheNode source = null;
        byte[] value = null;
        for (Map.Entry<CacheNode, Optional<byte[]>> e : read.answers().entrySet()) {
            if (e.getValue().isPresent()) {
                source = e.getKey();
                value = e.getValue().get();
                break;
            }
        }
        if (value == null) {
            misses.inc();
            return Optional.empty();
        }
        hits.inc();
        if (readRepair && read.replicas().size() > 1) {
            scheduleReadRepair(key, value, source, read);
        }
        return Optional.of(value);
    }

    @Override
    public boolean exists(String key)
    {
        ReadResult<Boolean> read = read(key, backend -> backend.exists(key), "exists");
        return read.answers().values().stream().anyMatch(Boolean::booleanValue);
    }

    @Override
    public long ttl(String key)
    {
        ReadResult<Long> read = read(key, backend -> backend.ttl(key), "ttl");
        for (long ttl : read.answers().values()) {
            if (ttl >= 0) {
                return ttl;
            }
        }
        return -1L;
    }

    @Override
    public void set(String key, byte[] value, Integer ttlSeconds)
    {
        Objects.requireNonNull(value, "value");
        if (ttlSeconds != null && ttlSeconds < 0) {
            errors.inc();
            throw new CacheOperationException(Kind.INVALID_ARGUMENT, "TTL must not be negative: " + ttlSeconds);
        }
        write(key, backend -> {
            backend.set(key, value, ttlSeconds);
            return Boolean.TRUE;
        }, "set");
        sets.inc();
    }

    @Override
    public void expire(String key, int ttlSeconds)
    {
        if (ttlSeconds < 0) {
            errors.inc();
            throw new CacheOperationException(Kind.INVALID_ARGUMENT, "TTL must not be negative: " + ttlSeconds);
        }
        write(key, backend -> {
            backend.expire(key, ttlSeconds);
            return Boolean.TRUE;
        }, "expire");
    }

    /**
     * Best effort: replicas that fail are logged and counted against the node, but
     * the call itself only fails when no replica is available at all.
     */
    @Override
    public boolean delete(String key)
    {
        List<CacheNode> targets = replicasFor(key);
        ReplicaFanout.Outcome<Boolean> outcome = fanOut(targets, backend -> backend.delete(key),
                writeConsistency.required(targets.size()), true);
        if (!outcome.failures().isEmpty()) {
            LOG.debugf("delete of %s failed on %d of %d replicas", key, outcome.failures().size(), targets.size());
        }
        boolean removed = outcome.successes().values().stream().anyMatch(Boolean::booleanValue);
        if (removed) {
            deletes.inc();
        }
        return removed;
    }

    /**
     * Best effort across every registered node, quarantined ones included, so a node that
     * comes back later does not serve entries from before the clear. Failures here do not
     * count towards quarantine.
     */
    @Override
    public long clear()
    {
        ensureConnected();
        Map<CacheNode, CacheBackend> snapshot = backendSnapshot();
        if (snapshot.isEmpty()) {
            errors.inc();
            throw new CacheOperationException(Kind.NO_NODES_AVAILABLE, "No cache node available for clear");
        }
        ExecutorService ex = executor;
        if (ex == null) {
            throw new CacheOperationException(Kind.NOT_CONNECTED, "Distributed cache " + name + " is not connected");
        }
        List<CacheNode> targets = new ArrayList<>(snapshot.keySet());
        ReplicaFanout.Outcome<Long> outcome = ReplicaFanout.run(targets, node -> snapshot.get(node).clear(),
                targets.size(), true, ex, operationTimeoutMillis, node -> { },
                (node, e) -> LOG.debugf(e, "clear failed on node %s", node.id()));
        if (!outcome.failures().isEmpty()) {
            LOG.warnf("clear failed on nodes %s", outcome.failures().keySet());
        }
        long total = 0L;
        for (long removed : outcome.successes().values()) {
            if (removed > 0) {
                total += removed;
            }
        }
        return total;
    }

    @Override
    public void ping()
    {
        ensureConnected();
        if (ring.size() == 0) {
            throw new CacheOperationException(Kind.NO_NODES_AVAILABLE, "No cache node available");
        }
    }

    private <T> void write(String key, Function<CacheBackend, T> call, String op)
    {
        List<CacheNode> targets = replicasFor(key);
        int required = writeConsistency.required(targets.size());
        ReplicaFanout.Outcome<T> outcome = fanOut(targets, call, required, false);
        if (outcome.successCount() < required) {
            errors.inc();
            String message = String.format("%s of %s reached %d of %d required replicas (%s)", op, key,
                    outcome.successCount(), required, writeConsistency.configName());
            LOG.warn(message);
            throw new CacheOperationException(Kind.CONSISTENCY_NOT_MET, message, outcome.firstFailure());
        }
    }

    /**
     * Reads from as many replicas as the read consistency asks for, in ring order.
     * Replicas that fail are replaced by the next spare replica until enough answers
     * arrived or no replica is left.
     */
    private <T> ReadResult<T> read(String key, Function<CacheBackend, T> call, String op)
    {
        List<CacheNode> replicas = replicasFor(key);
        int required = readConsistency == ConsistencyLevel.ALL
                ? replicas.size()
                : readConsistency.required(replicationFactor);
        int first = Math.min(required, replicas.size());

        Map<CacheNode, T> answers = new LinkedHashMap<>();
        Throwable firstFailure = null;
        ReplicaFanout.Outcome<T> outcome = fanOut(replicas.subList(0, first), call, first, false);
        answers.putAll(outcome.successes());
        firstFailure = outcome.firstFailure();

        for (int i = first; i < replicas.size() && answers.size() < required; i++) {
            ReplicaFanout.Outcome<T> spare = fanOut(List.of(replicas.get(i)), call, 1, true);
            answers.putAll(spare.successes());
            if (firstFailure == null) {
                firstFailure = spare.firstFailure();
            }
        }

        if (answers.size() < required) {
            errors.inc();
            String message = String.format("%s of %s got %d of %d required replica answers (%s)", op, key,
                    answers.size(), required, readConsistency.configName());
            LOG.warn(message);
            throw new CacheOperationException(Kind.CONSISTENCY_NOT_MET, message, firstFailure);
        }
        Map<CacheNode, T> ordered = new LinkedHashMap<>();
        for (CacheNode node : replicas) {
            if (answers.containsKey(node)) {
                ordered.put(node, answers.get(node));
            }
        }
        return new ReadResult<>(replicas, ordered);
    }

    private record ReadResult<T>(List<CacheNode> replicas, Map<CacheNode, T> answers) {}

    /**
     * Copies the value found on {@code source} to the other replicas that do not
     * hold it. Runs in the background; failures are counted and dropped.
     */
    private void scheduleReadRepair(String key, byte[] value, CacheNode source, ReadResult<Optional<byte[]>> read)
    {
        ExecutorService ex = executor;
        if (ex == null) {
            return;
        }
        List<CacheNode> missing = new ArrayList<>();
        List<CacheNode> unknown = new ArrayList<>();
        for (CacheNode node : read.replicas()) {
            Optional<byte[]> answer = read.answers().get(node);
            if (answer == null) {
                unknown.add(node);
            } else if (answer.isEmpty()) {
                missing.add(node);
            }
        }
        if (missing.isEmpty() && unknown.isEmpty()) {
            return;
        }
        try {
            ex.execute(() -> repair(key, value, source, missing, unknown));
        } catch (RejectedExecutionException e) {
            readRepairFailures.inc();
            LOG.debugf("Read repair of %s skipped, executor is shut down", key);
        }
    }

    private void repair(String key, byte[] value, CacheNode source, List<CacheNode> missing, List<CacheNode> unknown)
    {
        long remaining = repairTtl(source, key);
        if (remaining == 0) {
            LOG.debugf("Read repair of %s skipped, the entry is gone from node %s", key, source.id());
            return;
        }
        // 0 asks the backend for no expiry, null would apply its default TTL
        Integer ttl = remaining < 0 ? 0 : (int) Math.min(Integer.MAX_VALUE, remaining);
        for (CacheNode node : unknown) {
            CacheBackend backend = backendIfPresent(node);
            if (backend == null || !isRoutable(node)) {
                continue;
            }
            try {
                if (backend.get(key).isEmpty()) {
                    missing.add(node);
                }
            } catch (RuntimeException e) {
                readRepairFailures.inc();
                LOG.debugf(e, "Read repair lookup of %s on node %s failed", key, node.id());
            }
        }
        for (CacheNode node : missing) {
            CacheBackend backend = backendIfPresent(node);
            if (backend == null || !isRoutable(node)) {
                continue;
            }
            try {
                backend.set(key, value, ttl);
                readRepairs.inc();
                LOG.debugf("Read repair wrote %s to node %s", key, node.id());
            } catch (RuntimeException e) {
                readRepairFailures.inc();
                LOG.debugf(e, "Read repair of %s on node %s failed", key, node.id());
            }
        }
    }

    /** @return seconds for the repaired copy, -1 for no expiry, 0 when nothing may be written */
    private long repairTtl(CacheNode source, String key)
    {
        CacheBackend backend = backendIfPresent(source);
        if (backend == null) {
            return 0;
        }
        try {
            long ttl = backend.ttl(key);
            if (ttl > 0) {
                return ttl;
            }
            if (ttl == 0) {
                // under a second left, rounded up so the copy still expires
                return 1;
            }
            return backend.exists(key) ? -1 : 0;
        } catch (RuntimeException e) {
            LOG.debugf(e, "Could not read TTL of %s from node %s for read repair", key, source.id());
            return 0;
        }
    }

    private boolean isRoutable(CacheNode node)
    {
        synchronized (membershipLock) {
            return !quarantine.isQuarantined(node.id());
        }
    }

    private void ensureConnected()
    {
        if (!connected) {
            throw new CacheOperationException(Kind.NOT_CONNECTED, "Distributed cache " + name + " is not connected");
        }
    }

    private List<CacheNode> replicasFor(String key)
    {
        Objects.requireNonNull(key, "key");
        ensureConnected();
        List<CacheNode> candidates = ring.getNodes(key, replicationFactor);
        List<CacheNode> available = new ArrayList<>(candidates.size());
        synchronized (membershipLock) {
            for (CacheNode node : candidates) {
                if (backends.containsKey(node) && !quarantine.isQuarantined(node.id())) {
                    available.add(node);
                }
            }
        }
        if (available.isEmpty()) {
            errors.inc();
            throw new CacheOperationException(Kind.NO_NODES_AVAILABLE, "No cache node available for key " + key);
        }
        return available;
    }

    private <T> ReplicaFanout.Outcome<T> fanOut(List<CacheNode> targets, Function<CacheBackend, T> call,
                                                int required, boolean waitForAll)
    {
        ExecutorService ex = executor;
        if (ex == null) {
            throw new CacheOperationException(Kind.NOT_CONNECTED, "Distributed cache " + name + " is not connected");
        }
        return ReplicaFanout.run(targets, node -> call.apply(backendOf(node)), required, waitForAll, ex,
                operationTimeoutMillis, this::recordSuccess, this::recordFailure);
    }

    private CacheBackend backendIfPresent(CacheNode node)
    {
        synchronized (membershipLock) {
            return backends.get(node);
        }
    }

    private Map<CacheNode, CacheBackend> backendSnapshot()
    {
        synchronized (membershipLock) {
            return new LinkedHashMap<>(backends);
        }
    }

    private CacheBackend backendOf(CacheNode node)
    {
        CacheBackend backend = backendIfPresent(node);
        if (backend == null) {
            throw new CacheOperationException(Kind.BACKEND_FAILURE, "Node " + node.id() + " was removed");
        }
        return backend;
    }

    public List<CacheNode> nodesFor(String key)
    {
        return ring.getNodes(key, replicationFactor);
    }

    public ConsistentHashRing ring()
    {
        return ring;
    }

    public boolean isQuarantined(CacheNode node)
    {
        synchronized (membershipLock) {
            return quarantine.isQuarantined(node.id());
        }
    }

    public int failureCount(CacheNode node)
    {
        synchronized (membershipLock) {
            return quarantine.failureCount(node.id());
        }
    }

    public ClusterStats clusterStats()
    {
        List<MemberView> members = new ArrayList<>();
        synchronized (membershipLock) {
            for (Map.Entry<CacheNode, CacheBackend> e : backends.entrySet()) {
                CacheNode node = e.getKey();
                members.add(new MemberView(node, e.getValue(), ring.contains(node),
                        quarantine.isQuarantined(node.id()), quarantine.failureCount(node.id())));
            }
        }
        // isConnected may block on a remote backend, so it runs outside the membership lock
        List<ClusterStats.NodeStatus> nodes = new ArrayList<>();
        int active = 0;
        for (MemberView m : members) {
            if (m.onRing() && !m.quarantined()) {
                active++;
            }
            nodes.add(new ClusterStats.NodeStatus(m.node().id(), m.backend().isConnected(), m.onRing(),
                    m.quarantined(), m.failures()));
        }
        return new ClusterStats(nodes.size(), active, List.copyOf(nodes), hits.get(), misses.get(), sets.get(),
                errors.get(), readRepairs.get(), quarantines.get(), recoveries.get());
    }

    public String name()
    {
        return name;
    }

    private record MemberView(CacheNode node, CacheBackend backend, boolean onRing, boolean quarantined, int failures)
    {
    }

    private static ThreadFactory daemonThreads(String prefix)
    {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
