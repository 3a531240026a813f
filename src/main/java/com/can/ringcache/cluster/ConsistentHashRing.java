package com.can.ringcache.cluster;

import org.jboss.logging.Logger;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Küme düğümlerini ve anahtarları aynı 64 bitlik hash uzayına yerleştirerek
 * yük dağılımını sağlayan veri yapısıdır. Her düğüm {@code "{id}:{i}"}
 * değerlerinin hash'i ile sanal konumlar alır; bir düğümün çıkarılması yalnızca
 * kendi konumlarını siler, diğer anahtarların sahipliği değişmez.
 * <p>
 * Okumalar paylaşımlı kilitle eşzamanlı ilerler, üyelik değişiklikleri ise
 * yazma kilidiyle tek yazar disipliniyle uygulanır.
 */
public final class ConsistentHashRing
{
    private static final Logger LOG = Logger.getLogger(ConsistentHashRing.class);

    private final NavigableMap<Long, CacheNode> ring = new TreeMap<>();
    private final Set<CacheNode> members = new LinkedHashSet<>();
    private final ReentrantReadWriteLock rw = new ReentrantReadWriteLock();
    private final HashFn hash;
    private final int vnodes;

    public ConsistentHashRing(HashFn hash, int virtualNodesPerNode)
    {
        this.hash = Objects.requireNonNull(hash, "hash");
        if (virtualNodesPerNode <= 0) {
            throw new IllegalArgumentException("virtualNodesPerNode must be positive: " + virtualNodesPerNode);
        }
        this.vnodes = virtualNodesPerNode;
    }

    /** @return false when a node with the same id is already on the ring */
    public boolean addNode(CacheNode node)
    {
        Objects.requireNonNull(node, "node");
        rw.writeLock().lock();
        try {
            if (!members.add(node)) {
                return false;
            }
            for (long position : positionsFor(node)) {
                ring.put(position, node);
            }
        } finally {
            rw.writeLock().unlock();
        }
        LOG.debugf("Node %s added to ring with %d virtual nodes", node.id(), vnodes * node.weight());
        return true;
    }

    /** @return false when the node was not on the ring */
    public boolean removeNode(CacheNode node)
    {
        Objects.requireNonNull(node, "node");
        rw.writeLock().lock();
        try {
            if (!members.remove(node)) {
                return false;
            }
            for (long position : positionsFor(node)) {
                // a colliding position may have been taken over by another node
                if (node.equals(ring.get(position))) {
                    ring.remove(position);
                }
            }
        } finally {
            rw.writeLock().unlock();
        }
        LOG.debugf("Node %s removed from ring", node.id());
        return true;
    }

    public Optional<CacheNode> getNode(String key)
    {
        rw.readLock().lock();
        try {
            if (ring.isEmpty()) {
                return Optional.empty();
            }
            Map.Entry<Long, CacheNode> e = ring.ceilingEntry(hashKey(key));
            if (e == null) {
                e = ring.firstEntry();
            }
            return Optional.of(e.getValue());
        } finally {
            rw.readLock().unlock();
        }
    }

    /**
     * Walks clockwise from the key's position and collects distinct physical nodes.
     * Returns fewer than {@code count} nodes when the ring holds fewer.
     */
    public List<CacheNode> getNodes(String key, int count)
    {
        rw.readLock().lock();
        try {
            if (count <= 0 || ring.isEmpty()) {
                return new ArrayList<>();
            }
            long h = hashKey(key);
            int wanted = Math.min(count, members.size());
            Set<CacheNode> unique = new LinkedHashSet<>();
            collect(ring.tailMap(h, true), unique, wanted);
            if (unique.size() < wanted) {
                collect(ring.headMap(h, false), unique, wanted);
            }
            return new ArrayList<>(unique);
        } finally {
            rw.readLock().unlock();
        }
    }

    private static void collect(SortedMap<Long, CacheNode> segment, Set<CacheNode> out, int wanted)
    {
        for (CacheNode node : segment.values()) {
            out.add(node);
            if (out.size() >= wanted) {
                return;
            }
        }
    }

    public List<CacheNode> nodes()
    {
        rw.readLock().lock();
        try {
            return new ArrayList<>(members);
        } finally {
            rw.readLock().unlock();
        }
    }

    public boolean contains(CacheNode node)
    {
        rw.readLock().lock();
        try {
            return members.contains(node);
        } finally {
            rw.readLock().unlock();
        }
    }

    public int size()
    {
        rw.readLock().lock();
        try {
            return members.size();
        } finally {
            rw.readLock().unlock();
        }
    }

    /** Copy of the current position to node mapping. */
    public NavigableMap<Long, CacheNode> positions()
    {
        rw.readLock().lock();
        try {
            return new TreeMap<>(ring);
        } finally {
            rw.readLock().unlock();
        }
    }

    public void clear()
    {
        rw.writeLock().lock();
        try {
            ring.clear();
            members.clear();
        } finally {
            rw.writeLock().unlock();
        }
    }

    private long[] positionsFor(CacheNode node)
    {
        int count = vnodes * node.weight();
        long[] out = new long[count];
        for (int i = 0; i < count; i++) {
            out[i] = hash.hash((node.id() + ":" + i).getBytes(StandardCharsets.UTF_8));
        }
        return out;
    }

    private long hashKey(String key)
    {
        return hash.hash(Objects.requireNonNull(key, "key").getBytes(StandardCharsets.UTF_8));
    }
}
