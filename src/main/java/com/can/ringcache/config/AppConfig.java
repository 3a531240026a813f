package com.can.ringcache.config;

import com.can.ringcache.cluster.CacheNode;
import com.can.ringcache.cluster.DistributedCache;
import com.can.ringcache.core.LocalCache;
import com.can.ringcache.metric.MetricsRegistry;
import com.can.ringcache.registry.CacheRegistry;
import io.vertx.core.Vertx;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.util.List;

/**
 * CDI tarafından yönetilen bu yapılandırma sınıfı, metrik kayıt defterini ve
 * yerel ile dağıtık önbellekleri barındıran {@link CacheRegistry} bean'ini
 * üretir. Değerler {@link AppProperties} üzerinden okunur; kayıt uygulama
 * açılırken başlatılır, kapanırken tüm önbellek bağlantıları kapatılır.
 */
@ApplicationScoped
public class AppConfig
{
    public static final String LOCAL_CACHE = "local";
    public static final String DISTRIBUTED_CACHE = "distributed";

    private final AppProperties properties;

    @Inject
    public AppConfig(AppProperties properties)
    {
        this.properties = properties;
    }

    @Produces
    @Singleton
    public MetricsRegistry metricsRegistry()
    {
        return new MetricsRegistry();
    }

    @Produces
    @Singleton
    public CacheRegistry cacheRegistry(MetricsRegistry metrics, Vertx vertx)
    {
        CacheRegistry registry = new CacheRegistry();
        registry.register(LOCAL_CACHE, localCache(LOCAL_CACHE, metrics));
        if (properties.cluster().enabled()) {
            registry.register(DISTRIBUTED_CACHE, distributedCache(metrics, vertx));
        }
        registry.init();
        return registry;
    }

    void disposeCacheRegistry(@Disposes CacheRegistry registry)
    {
        registry.shutdown();
    }

    LocalCache localCache(String name, MetricsRegistry metrics)
    {
        var local = properties.local();
        return LocalCache.builder()
                .name(name)
                .maxSize(local.maxSize())
                .memoryLimitBytes(local.memoryLimitBytes())
                .evictionPolicy(local.evictionPolicy())
                .ttlSweepIntervalSeconds(local.ttlSweepIntervalSeconds())
                .lazyExpiration(local.lazyExpiration())
                .namespace(local.namespace().orElse(null))
                .defaultTtlSeconds(local.defaultTtlSeconds())
                .maxTtlSeconds(local.maxTtlSeconds())
                .metrics(metrics)
                .build();
    }

    DistributedCache distributedCache(MetricsRegistry metrics, Vertx vertx)
    {
        var cluster = properties.cluster();
        List<CacheNode> nodes = cluster.nodes().stream().map(CacheNode::parse).toList();
        return DistributedCache.builder()
                .name(DISTRIBUTED_CACHE)
                .nodes(nodes, node -> localCache(DISTRIBUTED_CACHE + "." + node.id(), metrics))
                .virtualNodesPerNode(cluster.virtualNodesPerNode())
                .hashAlgorithm(cluster.hashAlgorithm())
                .replicationFactor(cluster.replicationFactor())
                .readConsistency(cluster.readConsistency())
                .writeConsistency(cluster.writeConsistency())
                .readRepair(cluster.readRepair())
                .failureThreshold(cluster.failureThreshold())
                .healthCheckIntervalSeconds(cluster.healthCheckIntervalSeconds())
                .recoveryIntervalSeconds(cluster.recoveryIntervalSeconds())
                .operationTimeoutMillis(cluster.operationTimeoutMillis())
                .metrics(metrics)
                .vertx(vertx)
                .build();
    }
}
