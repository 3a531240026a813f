package com.can.ringcache.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.util.List;
import java.util.Optional;

/**
 * Uygulama yapılandırma değerlerini tip güvenli şekilde okumak için kullanılan
 * konfigürasyon arayüzüdür. Yerel motorun kapasite, bellek ve TTL ayarları,
 * dağıtık koordinatörün halka, replikasyon, tutarlılık ve sağlık kontrolü
 * parametreleri ile metrik raporlama sıklığı {@code application.properties}
 * içindeki "ringcache" önekiyle başlayan değerlerden okunur.
 */
@ConfigMapping(prefix = "ringcache")
public interface AppProperties
{
    Local local();
    Cluster cluster();
    Metrics metrics();

    interface Local {
        @WithDefault("1000")
        int maxSize();

        @WithDefault("104857600")
        long memoryLimitBytes();

        @WithDefault("lru")
        String evictionPolicy();

        @WithDefault("300")
        long ttlSweepIntervalSeconds();

        @WithDefault("true")
        boolean lazyExpiration();

        Optional<String> namespace();

        @WithDefault("0")
        long defaultTtlSeconds();

        @WithDefault("0")
        long maxTtlSeconds();
    }

    interface Cluster {
        @WithDefault("false")
        boolean enabled();

        /** Entries of the form {@code id} or {@code id=weight}. */
        @WithDefault("node-a,node-b,node-c")
        List<String> nodes();

        @WithDefault("160")
        int virtualNodesPerNode();

        @WithDefault("sha256")
        String hashAlgorithm();

        @WithDefault("1")
        int replicationFactor();

        @WithDefault("one")
        String readConsistency();

        @WithDefault("one")
        String writeConsistency();

        @WithDefault("true")
        boolean readRepair();

        @WithDefault("3")
        int failureThreshold();

        @WithDefault("30")
        long healthCheckIntervalSeconds();

        @WithDefault("60")
        long recoveryIntervalSeconds();

        @WithDefault("1000")
        long operationTimeoutMillis();
    }

    interface Metrics {
        @WithDefault("60")
        long reportIntervalSeconds();
    }
}
