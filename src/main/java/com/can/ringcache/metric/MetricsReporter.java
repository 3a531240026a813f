package com.can.ringcache.metric;

import com.can.ringcache.backend.CacheBackend;
import com.can.ringcache.cluster.DistributedCache;
import com.can.ringcache.config.AppProperties;
import com.can.ringcache.core.LocalCache;
import com.can.ringcache.registry.CacheRegistry;
import io.quarkus.runtime.Startup;
import io.vertx.core.Vertx;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Kayıtlı önbelleklerin istatistiklerini ve sayaçlarını belirli aralıklarla
 * log'a yazan yardımcı servistir. Vert.x periyodik zamanlayıcısı ile tetiklenir,
 * raporlama işi worker thread üzerinde çalışır ve kapatıldığında zamanlayıcı
 * iptal edilir.
 */
@Startup
@Singleton
public class MetricsReporter implements AutoCloseable
{
    private static final Logger LOG = Logger.getLogger(MetricsReporter.class);

    private final CacheRegistry registry;
    private final MetricsRegistry metrics;
    private final long intervalSeconds;
    private final Vertx vertx;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private long timerId = -1L;

    @Inject
    public MetricsReporter(CacheRegistry registry, MetricsRegistry metrics, AppProperties properties, Vertx vertx)
    {
        this(registry, metrics, properties.metrics().reportIntervalSeconds(), vertx);
    }

    public MetricsReporter(CacheRegistry registry, MetricsRegistry metrics, long intervalSeconds, Vertx vertx)
    {
        this.registry = registry;
        this.metrics = metrics;
        this.intervalSeconds = intervalSeconds;
        this.vertx = vertx;
    }

    @PostConstruct
    void init()
    {
        start(intervalSeconds);
    }

    public synchronized void start(long intervalSeconds)
    {
        if (intervalSeconds <= 0 || !running.compareAndSet(false, true)) {
            return;
        }
        long periodMillis = TimeUnit.SECONDS.toMillis(intervalSeconds);
        timerId = vertx.setPeriodic(periodMillis, id ->
                vertx.<Void>executeBlocking(promise -> {
                    report();
                    promise.complete();
                }, false)
        );
    }

    public boolean isRunning()
    {
        return running.get();
    }

    /** Logs one line per registered cache and returns how many were reported. */
    public int report()
    {
        int reported = 0;
        for (Map.Entry<String, CacheBackend> e : registry.caches().entrySet()) {
            CacheBackend cache = e.getValue();
            if (cache instanceof LocalCache local) {
                LOG.infof("cache %s: %s", e.getKey(), local.stats().summary());
            } else if (cache instanceof DistributedCache distributed) {
                var stats = distributed.clusterStats();
                LOG.infof("cache %s: nodes=%d/%d quarantined=%s hits=%d misses=%d sets=%d errors=%d readRepairs=%d",
                        e.getKey(), stats.activeNodes(), stats.totalNodes(), stats.quarantinedNodes(), stats.hits(),
                        stats.misses(), stats.sets(), stats.errors(), stats.readRepairs());
            } else {
                LOG.infof("cache %s: counters=%s", e.getKey(), metrics.snapshot(e.getKey()));
            }
            reported++;
        }
        return reported;
    }

    @PreDestroy
    void shutdown()
    {
        close();
    }

    @Override
    public synchronized void close()
    {
        running.set(false);
        if (timerId >= 0L) {
            vertx.cancelTimer(timerId);
            timerId = -1L;
        }
    }
}
