package com.can.ringcache.cluster;

import java.util.Objects;

/**
 * Halkadaki tek bir fiziksel düğümü temsil eder. Kimlik {@code host:port} ya da
 * mantıksal bir addır; eşitlik ve hash yalnızca kimliğe göre hesaplanır, ağırlık
 * ise düğümün halkada kaç sanal konum alacağını çarpan olarak belirler.
 */
public final class CacheNode
{
    private final String id;
    private final int weight;

    public CacheNode(String id, int weight)
    {
        this.id = Objects.requireNonNull(id, "id");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Node id must not be blank");
        }
        if (weight <= 0) {
            throw new IllegalArgumentException("Node weight must be positive: " + weight);
        }
        this.weight = weight;
    }

    public static CacheNode of(String id)
    {
        return new CacheNode(id, 1);
    }

    /** Parses {@code id} or {@code id=weight}. */
    public static CacheNode parse(String spec)
    {
        Objects.requireNonNull(spec, "spec");
        String trimmed = spec.trim();
        int eq = trimmed.lastIndexOf('=');
        if (eq < 0) {
            return of(trimmed);
        }
        String weight = trimmed.substring(eq + 1).trim();
        try {
            return new CacheNode(trimmed.substring(0, eq).trim(), Integer.parseInt(weight));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid node weight in '" + spec + "'", e);
        }
    }

    public String id() { return id; }
    public int weight() { return weight; }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (!(o instanceof CacheNode)) return false;
        return id.equals(((CacheNode) o).id);
    }

    @Override
    public int hashCode()
    {
        return id.hashCode();
    }

    @Override
    public String toString()
    {
        return id;
    }
}
