package com.can.ringcache.cluster;

import com.can.ringcache.backend.CacheOperationException;
import com.can.ringcache.backend.CacheOperationException.Kind;
import com.can.ringcache.core.LocalCache;
import com.can.ringcache.metric.MetricsRegistry;
import io.vertx.core.Vertx;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class DistributedCacheTest
{
    private static final CacheNode A = CacheNode.of("A");
    private static final CacheNode B = CacheNode.of("B");
    private static final CacheNode C = CacheNode.of("C");

    // k50 -> [A, B, C], k150 -> [B, C, A], k250 -> [C, A, B]
    private final ControlledHash hash = new ControlledHash()
            .node("A", 100).node("B", 200).node("C", 300).node("D", 400)
            .key("k50", 50).key("k150", 150).key("k250", 250).key("user:1", 50);

    private final Map<String, FakeBackend> fakes = new LinkedHashMap<>();
    private DistributedCache cache;
    private Vertx vertx;

    private DistributedCache.Builder builder(String... ids)
    {
        DistributedCache.Builder b = DistributedCache.builder()
                .hashFn(hash)
                .virtualNodesPerNode(3)
                .replicationFactor(2)
                .failureThreshold(10)
                .healthCheckIntervalSeconds(0)
                .recoveryIntervalSeconds(0)
                .operationTimeoutMillis(500);
        for (String id : ids) {
            FakeBackend fake = new FakeBackend();
            fakes.put(id, fake);
            b.node(CacheNode.of(id), fake);
        }
        return b;
    }

    private DistributedCache start(DistributedCache.Builder b)
    {
        cache = b.build();
        cache.connect();
        return cache;
    }

    private DistributedCache.Builder localBuilder(Map<String, LocalCache> nodes)
    {
        DistributedCache.Builder b = DistributedCache.builder()
                .hashFn(hash)
                .virtualNodesPerNode(3)
                .replicationFactor(3)
                .failureThreshold(10)
                .healthCheckIntervalSeconds(0)
                .recoveryIntervalSeconds(0)
                .operationTimeoutMillis(500);
        nodes.forEach((id, local) -> b.node(CacheNode.of(id), local));
        return b;
    }

    private FakeBackend fake(String id)
    {
        return fakes.get(id);
    }

    private static byte[] bytes(String s)
    {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static String text(byte[] b)
    {
        return new String(b, StandardCharsets.UTF_8);
    }

    private static void await(BooleanSupplier condition, String message) throws InterruptedException
    {
        long deadline = System.currentTimeMillis() + 5_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail(message);
            }
            Thread.sleep(20);
        }
    }

    @AfterEach
    void tearDown()
    {
        if (cache != null) {
            cache.close();
        }
        if (vertx != null) {
            vertx.close();
        }
    }

    @Nested
    class Writes
    {
        // Bu test üç replikadan biri erişilemezken çoğunluk yazmasının başarılı olduğunu doğrular.
        @Test
        void quorum_write_survives_one_unreachable_replica()
        {
            DistributedCache c = start(builder("A", "B", "C").replicationFactor(3).writeConsistency("quorum"));
            fake("B").down = true;

            c.set("k50", bytes("v"), null);

            assertEquals("v", text(fake("A").store.get("k50")));
            assertEquals("v", text(fake("C").store.get("k50")));
            assertEquals("v", text(c.get("k50").orElseThrow()));
        }

        // Bu test çoğunluk sağlanamadığında yazmanın tutarlılık hatasıyla reddedildiğini gösterir.
        @Test
        void quorum_write_fails_without_majority()
        {
            DistributedCache c = start(builder("A", "B", "C").replicationFactor(3).writeConsistency(ConsistencyLevel.QUORUM));
            fake("B").down = true;
            fake("C").down = true;

            CacheOperationException ex = assertThrows(CacheOperationException.class, () -> c.set("k50", bytes("v"), null));
            assertEquals(Kind.CONSISTENCY_NOT_MET, ex.kind());
            assertEquals(1L, c.clusterStats().errors());
        }

        // Bu test ALL seviyesinde tek bir hatalı replikanın yazmayı başarısız kıldığını doğrular.
        @Test
        void all_write_needs_every_replica()
        {
            DistributedCache c = start(builder("A", "B", "C").writeConsistency("all"));
            fake("C").down = true;

            CacheOperationException ex = assertThrows(CacheOperationException.class, () -> c.set("k150", bytes("v"), null));
            assertEquals(Kind.CONSISTENCY_NOT_MET, ex.kind());
        }

        // Bu test TTL değerinin tüm replikalara iletildiğini gösterir.
        @Test
        void ttl_is_forwarded_to_replicas()
        {
            DistributedCache c = start(builder("A", "B", "C").writeConsistency("all"));
            c.set("k50", bytes("v"), 30);

            assertEquals(30L, fake("A").ttls.get("k50"));
            assertEquals(30L, fake("B").ttls.get("k50"));
            assertEquals(30L, c.ttl("k50"));

            c.expire("k50", 5);
            assertEquals(5L, fake("A").ttls.get("k50"));
            assertEquals(5L, fake("B").ttls.get("k50"));
        }

        // Bu test negatif TTL değerinin hiçbir düğüme gitmeden reddedildiğini doğrular.
        @Test
        void negative_ttl_is_rejected_before_fan_out()
        {
            DistributedCache c = start(builder("A", "B", "C"));
            CacheOperationException ex = assertThrows(CacheOperationException.class, () -> c.set("k50", bytes("v"), -1));
            assertEquals(Kind.INVALID_ARGUMENT, ex.kind());
            assertThrows(CacheOperationException.class, () -> c.expire("k50", -1));
            assertEquals(0, fake("A").calls.get());
        }

        // Bu test zaman aşımına uğrayan replikanın hata sayıldığını gösterir.
        @Test
        void slow_replica_times_out() throws InterruptedException
        {
            DistributedCache c = start(builder("A", "B", "C").writeConsistency("all").operationTimeoutMillis(100));
            fake("B").delayMillis = 1_000;

            CacheOperationException ex = assertThrows(CacheOperationException.class, () -> c.set("k150", bytes("v"), null));
            assertEquals(Kind.CONSISTENCY_NOT_MET, ex.kind());
            CacheOperationException cause = assertInstanceOf(CacheOperationException.class, ex.getCause());
            assertEquals(Kind.TIMEOUT, cause.kind());
            await(() -> c.failureCount(B) == 1, "timeout was not counted as failure");
        }
    }

    @Nested
    class Reads
    {
        // Bu test birincil replika erişilemezken ONE okumasının yedek replikaya geçtiğini doğrular.
        @Test
        void read_one_falls_back_to_spare_replica()
        {
            DistributedCache c = start(builder("A", "B", "C"));
            fake("B").down = true;
            fake("C").store.put("k150", bytes("v"));

            assertEquals("v", text(c.get("k150").orElseThrow()));
        }

        // Bu test iki replikadan biri erişilemezken ONE yazmasının geçtiğini, QUORUM okumasının ise başarısız olduğunu gösterir.
        @Test
        void quorum_read_needs_both_of_two_replicas()
        {
            DistributedCache c = start(builder("A", "B", "C").readConsistency("quorum").writeConsistency("one"));
            fake("B").down = true;

            c.set("user:1", bytes("v"), null);
            assertEquals("v", text(fake("A").store.get("user:1")));

            CacheOperationException ex = assertThrows(CacheOperationException.class, () -> c.get("user:1"));
            assertEquals(Kind.CONSISTENCY_NOT_MET, ex.kind());
        }

        // Bu test bulunmayan anahtarın boş döndüğünü ve ıska sayıldığını doğrular.
        @Test
        void missing_key_counts_as_miss()
        {
            DistributedCache c = start(builder("A", "B", "C"));
            assertTrue(c.get("k50").isEmpty());
            assertFalse(c.exists("k50"));
            assertEquals(-1L, c.ttl("k50"));
            assertEquals(1L, c.clusterStats().misses());
        }

        // Bu test herhangi bir replikada bulunan anahtarın var sayıldığını gösterir.
        @Test
        void exists_is_true_when_any_answer_has_key()
        {
            DistributedCache c = start(builder("A", "B", "C").readConsistency("all").readRepair(false));
            fake("B").store.put("k50", bytes("v"));
            assertTrue(c.exists("k50"));
        }

        // Bu test bağlanmadan yapılan işlemin reddedildiğini doğrular.
        @Test
        void operations_require_connect()
        {
            cache = builder("A", "B", "C").build();
            CacheOperationException ex = assertThrows(CacheOperationException.class, () -> cache.get("k50"));
            assertEquals(Kind.NOT_CONNECTED, ex.kind());
        }
    }

    @Nested
    class ReadRepair
    {
        // Bu test okunmayan replikaların arka planda onarıldığını ve kalan TTL'in taşındığını doğrular.
        @Test
        void repairs_uncontacted_replicas() throws InterruptedException
        {
            DistributedCache c = start(builder("A", "B", "C").replicationFactor(3));
            fake("A").store.put("k50", bytes("v"));
            fake("A").ttls.put("k50", 40L);

            assertEquals("v", text(c.get("k50").orElseThrow()));

            await(() -> fake("B").store.containsKey("k50") && fake("C").store.containsKey("k50"),
                    "replicas were not repaired");
            assertEquals(40L, fake("B").ttls.get("k50"));
            await(() -> c.clusterStats().readRepairs() == 2, "read repairs were not counted");
        }

        // Bu test boş yanıt veren replikaya değerin yazıldığını gösterir.
        @Test
        void repairs_replica_that_answered_empty() throws InterruptedException
        {
            DistributedCache c = start(builder("A", "B", "C").readConsistency("all"));
            fake("A").store.put("k50", bytes("v"));

            assertTrue(c.get("k50").isPresent());
            await(() -> fake("B").store.containsKey("k50"), "replica was not repaired");
            assertNull(fake("B").ttls.get("k50"));
        }

        // Bu test onarım kapalıyken eksik replikaya dokunulmadığını doğrular.
        @Test
        void disabled_repair_leaves_replicas_alone() throws InterruptedException
        {
            DistributedCache c = start(builder("A", "B", "C").readConsistency("all").readRepair(false));
            fake("A").store.put("k50", bytes("v"));

            assertTrue(c.get("k50").isPresent());
            Thread.sleep(200);
            assertFalse(fake("B").store.containsKey("k50"));
        }

        // Bu test onarılan kopyanın kaynaktaki kalan süreyle yazıldığını ve birlikte sona erdiğini doğrular.
        @Test
        void repaired_copy_expires_with_source() throws InterruptedException
        {
            AtomicLong now = new AtomicLong(1_000_000L);
            Map<String, LocalCache> nodes = new LinkedHashMap<>();
            for (String id : List.of("A", "B", "C")) {
                nodes.put(id, LocalCache.builder().name(id).ttlSweepIntervalSeconds(0).clock(now::get).build());
            }
            DistributedCache c = start(localBuilder(nodes));
            nodes.get("A").set("k50", bytes("v"), 10);

            assertEquals("v", text(c.get("k50").orElseThrow()));
            await(() -> nodes.get("B").exists("k50") && nodes.get("C").exists("k50"), "replicas were not repaired");
            assertEquals(10L, nodes.get("B").ttl("k50"));

            now.addAndGet(11_000L);
            assertTrue(nodes.get("B").get("k50").isEmpty());
            assertTrue(nodes.get("C").get("k50").isEmpty());
        }

        // Bu test süresiz kaynaktan onarılan kopyaya düğümün varsayılan TTL'inin uygulanmadığını gösterir.
        @Test
        void repaired_copy_of_entry_without_ttl_stays_without_ttl() throws InterruptedException
        {
            AtomicLong now = new AtomicLong(1_000_000L);
            Map<String, LocalCache> nodes = new LinkedHashMap<>();
            for (String id : List.of("A", "B", "C")) {
                nodes.put(id, LocalCache.builder().name(id).ttlSweepIntervalSeconds(0).defaultTtlSeconds(30)
                        .clock(now::get).build());
            }
            DistributedCache c = start(localBuilder(nodes));
            nodes.get("A").set("k50", bytes("v"), 0);

            assertTrue(c.get("k50").isPresent());
            await(() -> nodes.get("B").exists("k50"), "replica was not repaired");
            assertEquals(-1L, nodes.get("B").ttl("k50"));

            now.addAndGet(60_000L);
            assertTrue(nodes.get("B").get("k50").isPresent());
        }

        // Bu test bir saniyeden az süresi kalan kaydın süresiz değil en az bir saniyelik kopyalandığını doğrular.
        @Test
        void sub_second_ttl_is_rounded_up() throws InterruptedException
        {
            DistributedCache c = start(builder("A", "B", "C").readConsistency("all"));
            fake("A").store.put("k50", bytes("v"));
            fake("A").ttls.put("k50", 0L);

            assertTrue(c.get("k50").isPresent());
            await(() -> fake("B").store.containsKey("k50"), "replica was not repaired");
            assertEquals(1L, fake("B").ttls.get("k50"));
        }
    }

    @Nested
    class Quarantine
    {
        // Bu test eşiğe ulaşan düğümün karantinaya alınıp halkadan çıkarıldığını doğrular.
        @Test
        void failing_node_is_quarantined() throws InterruptedException
        {
            DistributedCache c = start(builder("A", "B", "C").failureThreshold(2));
            fake("B").down = true;

            c.set("k150", bytes("v1"), null);
            c.set("k150", bytes("v2"), null);

            await(() -> c.isQuarantined(B), "node was not quarantined");
            assertFalse(c.ring().contains(B));
            assertEquals(List.of(C, A), c.nodesFor("k150"));

            ClusterStats stats = c.clusterStats();
            assertEquals(List.of("B"), stats.quarantinedNodes());
            assertEquals(2, stats.activeNodes());
            assertEquals(3, stats.totalNodes());
            assertEquals(1L, stats.quarantines());
        }

        // Bu test başarılı işlemin ardışık hata sayacını sıfırladığını gösterir.
        @Test
        void success_resets_failure_count() throws InterruptedException
        {
            DistributedCache c = start(builder("A", "B", "C").failureThreshold(3));
            fake("B").down = true;
            c.set("k150", bytes("v"), null);
            await(() -> c.failureCount(B) == 1, "failure was not recorded");

            fake("B").down = false;
            c.set("k150", bytes("v"), null);
            await(() -> c.failureCount(B) == 0, "failure count was not reset");
            assertFalse(c.isQuarantined(B));
        }

        // Bu test sağlık kontrolünün iyileşen düğümü aynı konumlarla halkaya geri eklediğini doğrular.
        @Test
        void health_check_restores_recovered_node() throws InterruptedException
        {
            DistributedCache c = start(builder("A", "B", "C").failureThreshold(1));
            NavigableMap<Long, CacheNode> before = c.ring().positions();
            fake("B").down = true;
            c.set("k150", bytes("v"), null);
            await(() -> c.isQuarantined(B), "node was not quarantined");

            assertEquals(0, c.checkHealth());
            assertTrue(c.isQuarantined(B));

            fake("B").down = false;
            assertEquals(1, c.checkHealth());
            assertFalse(c.isQuarantined(B));
            assertEquals(0, c.failureCount(B));
            assertEquals(before, c.ring().positions());
            assertEquals(1L, c.clusterStats().recoveries());
        }

        // Bu test açılışta bağlanamayan düğümün karantinaya alındığını ve sonra katıldığını gösterir.
        @Test
        void node_failing_at_startup_joins_after_health_check()
        {
            FakeBackend placeholder = new FakeBackend();
            placeholder.failConnect = true;
            DistributedCache.Builder b = builder("A", "C").node(B, placeholder);
            fakes.put("B", placeholder);
            DistributedCache c = start(b);

            assertTrue(c.isQuarantined(B));
            assertEquals(List.of(A, C), c.ring().nodes());

            placeholder.failConnect = false;
            assertEquals(1, c.checkHealth());
            assertTrue(placeholder.isConnected());
            assertTrue(c.ring().contains(B));
        }

        // Bu test periyodik sağlık kontrolünün Vert.x zamanlayıcısıyla çalıştığını doğrular.
        @Test
        void periodic_health_check_runs_on_vertx() throws InterruptedException
        {
            vertx = Vertx.vertx();
            FakeBackend flaky = new FakeBackend();
            flaky.failConnect = true;
            DistributedCache c = start(builder("A", "C").node(B, flaky).vertx(vertx).healthCheckIntervalSeconds(1));
            assertTrue(c.isQuarantined(B));

            flaky.failConnect = false;
            await(() -> c.ring().contains(B), "periodic health check did not restore node");
        }

        // Bu test hiçbir düğüm bağlanamadığında açılışın başarısız olduğunu gösterir.
        @Test
        void connect_fails_when_no_node_is_reachable()
        {
            DistributedCache.Builder b = builder("A", "B", "C");
            fakes.values().forEach(f -> f.failConnect = true);
            cache = b.build();

            CacheOperationException ex = assertThrows(CacheOperationException.class, cache::connect);
            assertEquals(Kind.NO_NODES_AVAILABLE, ex.kind());
            assertFalse(cache.isConnected());
        }

        // Bu test tüm replikalar karantinadayken işlemlerin düğüm yok hatası verdiğini doğrular.
        @Test
        void no_available_replica_raises_no_nodes() throws InterruptedException
        {
            DistributedCache c = start(builder("A").replicationFactor(1).failureThreshold(1));
            fake("A").down = true;
            assertThrows(CacheOperationException.class, () -> c.set("k50", bytes("v"), null));
            await(() -> c.isQuarantined(A), "node was not quarantined");

            CacheOperationException ex = assertThrows(CacheOperationException.class, () -> c.get("k50"));
            assertEquals(Kind.NO_NODES_AVAILABLE, ex.kind());
            assertThrows(CacheOperationException.class, c::ping);
        }
    }

    @Nested
    class DeleteAndClear
    {
        // Bu test silmenin en iyi çabayla yapıldığını ve tekrarında hata vermediğini doğrular.
        @Test
        void delete_is_best_effort_and_idempotent()
        {
            DistributedCache c = start(builder("A", "B", "C"));
            fake("B").down = true;
            fake("C").store.put("k150", bytes("v"));

            assertTrue(c.delete("k150"));
            assertFalse(fake("C").store.containsKey("k150"));
            assertFalse(c.delete("k150"));
        }

        // Bu test clear çağrısının halkadaki tüm düğümlerde silinen sayıları topladığını gösterir.
        @Test
        void clear_sums_every_node()
        {
            DistributedCache c = start(builder("A", "B", "C"));
            fake("A").store.put("x", bytes("1"));
            fake("B").store.put("y", bytes("2"));
            fake("C").store.put("z", bytes("3"));
            fake("C").store.put("w", bytes("4"));

            assertEquals(4L, c.clear());
            fakes.values().forEach(f -> assertTrue(f.store.isEmpty()));
        }

        // Bu test karantinadaki düğümün de temizlendiğini ve geri döndüğünde eski değeri sunmadığını doğrular.
        @Test
        void clear_reaches_quarantined_node() throws InterruptedException
        {
            DistributedCache c = start(builder("A", "B", "C").failureThreshold(1));
            fake("B").down = true;
            c.set("k150", bytes("v"), null);
            await(() -> c.isQuarantined(B), "node was not quarantined");

            fake("B").down = false;
            fake("B").store.put("k150", bytes("stale"));
            c.clear();
            assertFalse(fake("B").store.containsKey("k150"));

            assertEquals(1, c.checkHealth());
            assertTrue(c.get("k150").isEmpty());
        }

        // Bu test geç yanıt veren replika anahtarı silse bile sonucun ve sayacın doğru olduğunu gösterir.
        @Test
        void delete_counts_removal_on_slow_replica()
        {
            MetricsRegistry metrics = new MetricsRegistry();
            DistributedCache c = start(builder("A", "B", "C").writeConsistency("one").name("slow").metrics(metrics));
            fake("C").store.put("k150", bytes("v"));
            fake("C").delayMillis = 100;

            assertTrue(c.delete("k150"));
            assertFalse(fake("C").store.containsKey("k150"));
            assertEquals(1L, metrics.counter("slow", "deletes").get());
        }
    }

    @Nested
    class Membership
    {
        // Bu test çalışma anında eklenen ve çıkarılan düğümlerin yönlendirmeye yansıdığını doğrular.
        @Test
        void runtime_add_and_remove()
        {
            DistributedCache c = start(builder("A", "B", "C"));
            FakeBackend d = new FakeBackend();
            c.addNode(CacheNode.of("D"), d);
            assertTrue(d.isConnected());
            assertTrue(c.ring().contains(CacheNode.of("D")));
            assertThrows(IllegalArgumentException.class, () -> c.addNode(CacheNode.of("D"), new FakeBackend()));

            assertTrue(c.removeNode(C));
            assertFalse(c.ring().contains(C));
            assertFalse(fake("C").isConnected());
            assertEquals(List.of(CacheNode.of("D"), A), c.nodesFor("k250"));
            assertFalse(c.removeNode(C));
        }

        // Bu test yavaş yanıt veren durum sorgusu sürerken düğüm eklemenin beklemediğini doğrular.
        @Test
        void slow_status_check_does_not_block_membership() throws Exception
        {
            DistributedCache c = start(builder("A", "B", "C"));
            CountDownLatch gate = new CountDownLatch(1);
            fake("A").statusGate = gate;
            try {
                CompletableFuture<ClusterStats> stats = CompletableFuture.supplyAsync(c::clusterStats);
                assertTrue(fake("A").statusEntered.await(5, TimeUnit.SECONDS));

                CompletableFuture.runAsync(() -> c.addNode(CacheNode.of("D"), new FakeBackend()))
                        .get(2, TimeUnit.SECONDS);
                assertTrue(c.ring().contains(CacheNode.of("D")));

                gate.countDown();
                assertEquals(3, stats.get(5, TimeUnit.SECONDS).nodes().size());
            } finally {
                gate.countDown();
                fake("A").statusGate = null;
            }
        }

        // Bu test bağlantı kesildiğinde tüm düğümlerin kapatıldığını gösterir.
        @Test
        void disconnect_closes_every_node()
        {
            DistributedCache c = start(builder("A", "B", "C"));
            c.disconnect();
            assertFalse(c.isConnected());
            fakes.values().forEach(f -> assertFalse(f.isConnected()));
            assertEquals(0, c.ring().size());
        }

        // Bu test sayaçların paylaşılan metrik kayıt defterine yazıldığını doğrular.
        @Test
        void counters_are_registered_under_cache_name()
        {
            MetricsRegistry metrics = new MetricsRegistry();
            DistributedCache c = start(builder("A", "B", "C").name("users").metrics(metrics));
            c.set("k50", bytes("v"), null);
            c.get("k50");
            assertEquals(1L, metrics.counter("users", "sets").get());
            assertEquals(1L, metrics.counter("users", "hits").get());
        }
    }

    @Nested
    class Configuration
    {
        // Bu test tutarsız yapılandırmaların build sırasında reddedildiğini doğrular.
        @Test
        void invalid_configuration_is_rejected()
        {
            assertThrows(IllegalArgumentException.class, () -> DistributedCache.builder().build());
            assertThrows(IllegalArgumentException.class, () -> builder("A", "B").replicationFactor(0).build());
            assertThrows(IllegalArgumentException.class, () -> builder("A", "B").virtualNodesPerNode(0).build());
            assertThrows(IllegalArgumentException.class, () -> builder("A", "B").failureThreshold(0).build());
            assertThrows(IllegalArgumentException.class, () -> builder("A", "B").operationTimeoutMillis(0).build());
            assertThrows(IllegalArgumentException.class,
                    () -> builder("A", "B", "C").replicationFactor(4).writeConsistency("all").build());
            assertThrows(IllegalArgumentException.class, () -> builder("A").readConsistency("strong"));
        }

        // Bu test aynı kimlikli düğümün iki kez eklenemeyeceğini gösterir.
        @Test
        void duplicate_node_is_rejected()
        {
            assertThrows(IllegalArgumentException.class,
                    () -> builder("A").node(CacheNode.of("A"), new FakeBackend()));
        }

        // Bu test karşılanabilir en büyük çoğunluk ayarının kabul edildiğini doğrular.
        @Test
        void quorum_of_five_replicas_fits_three_nodes()
        {
            assertDoesNotThrow(() -> builder("A", "B", "C").replicationFactor(5).readConsistency("quorum").build());
        }
    }
}
