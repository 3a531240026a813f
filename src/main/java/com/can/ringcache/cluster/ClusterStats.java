package com.can.ringcache.cluster;

import java.util.List;

/**
 * Koordinatörün anlık küme görünümü: düğüm başına karantina durumu ve hata
 * sayısı ile koordinatör seviyesindeki sayaçlar.
 */
public record ClusterStats(
        int totalNodes,
        int activeNodes,
        List<NodeStatus> nodes,
        long hits,
        long misses,
        long sets,
        long errors,
        long readRepairs,
        long quarantines,
        long recoveries
) {
    public List<String> quarantinedNodes()
    {
        return nodes.stream().filter(NodeStatus::quarantined).map(NodeStatus::id).toList();
    }

    public record NodeStatus(String id, boolean connected, boolean onRing, boolean quarantined, int consecutiveFailures) {}
}
