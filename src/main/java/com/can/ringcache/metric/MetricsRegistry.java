package com.can.ringcache.metric;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sayaçları isimleriyle tutan merkezi kayıt yapısıdır. Her önbellek kendi
 * sayaçlarını {@code <önbellek-adı>.<olay>} biçiminde kaydeder; böylece birden
 * fazla bağımsız önbellek aynı kayıt defterini paylaşabilir.
 */
public final class MetricsRegistry
{
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();

    public Counter counter(String name) { return counters.computeIfAbsent(name, Counter::new); }

    public Counter counter(String scope, String name) { return counter(scope + "." + name); }

    public Map<String, Counter> counters() { return counters; }

    /** Sorted snapshot of the counters whose name starts with {@code scope + "."}. */
    public Map<String, Long> snapshot(String scope)
    {
        String prefix = scope + ".";
        Map<String, Long> out = new TreeMap<>();
        counters.forEach((name, counter) -> {
            if (name.startsWith(prefix)) {
                out.put(name.substring(prefix.length()), counter.get());
            }
        });
        return out;
    }
}
