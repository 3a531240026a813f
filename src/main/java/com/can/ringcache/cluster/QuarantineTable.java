package com.can.ringcache.cluster;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Düğüm başına ardışık hata sayısını ve karantinaya alınan düğümleri tutar.
 * Eşik aşıldığında düğüm karantinaya alınır; başarılı bir sağlık yoklamasına
 * kadar yönlendirme dışında kalır. Sınıf kendi başına thread-safe değildir,
 * {@link DistributedCache} üyelik kilidi altında kullanır.
 */
final class QuarantineTable
{
    private final int failureThreshold;
    private final Map<String, Integer> failures = new HashMap<>();
    /** node id -> earliest time the next health check may run */
    private final Map<String, Long> quarantined = new LinkedHashMap<>();

    QuarantineTable(int failureThreshold)
    {
        this.failureThreshold = failureThreshold;
    }

    /** @return true when this failure moved the node into quarantine */
    boolean recordFailure(String nodeId, long nowMillis, long recoveryMillis)
    {
        int count = failures.merge(nodeId, 1, Integer::sum);
        if (count >= failureThreshold && !quarantined.containsKey(nodeId)) {
            quarantined.put(nodeId, nowMillis + recoveryMillis);
            return true;
        }
        return false;
    }

    void recordSuccess(String nodeId)
    {
        if (!quarantined.containsKey(nodeId)) {
            failures.remove(nodeId);
        }
    }

    /** Places the node straight into quarantine with its counter preset to the threshold. */
    void quarantine(String nodeId, long checkAtMillis)
    {
        failures.put(nodeId, failureThreshold);
        quarantined.put(nodeId, checkAtMillis);
    }

    List<String> dueForCheck(long nowMillis)
    {
        List<String> due = new ArrayList<>();
        quarantined.forEach((id, checkAt) -> {
            if (checkAt <= nowMillis) {
                due.add(id);
            }
        });
        return due;
    }

    void checkFailed(String nodeId, long nextCheckAtMillis)
    {
        quarantined.computeIfPresent(nodeId, (id, previous) -> nextCheckAtMillis);
    }

    void release(String nodeId)
    {
        quarantined.remove(nodeId);
        failures.remove(nodeId);
    }

    boolean isQuarantined(String nodeId)
    {
        return quarantined.containsKey(nodeId);
    }

    int failureCount(String nodeId)
    {
        return failures.getOrDefault(nodeId, 0);
    }

    List<String> quarantinedIds()
    {
        return new ArrayList<>(quarantined.keySet());
    }

    void clear()
    {
        failures.clear();
        quarantined.clear();
    }
}
