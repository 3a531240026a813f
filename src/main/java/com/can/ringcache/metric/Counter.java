package com.can.ringcache.metric;

import java.util.concurrent.atomic.LongAdder;

/**
 * Önbellek olaylarını (isabet, ıskalama, tahliye, düğüm hatası) sayan
 * thread-safe sayaçtır. Yoğun yazma altında çekişmeyi azaltmak için
 * {@link LongAdder} kullanır.
 */
public final class Counter
{
    private final String name;
    private final LongAdder value = new LongAdder();

    public Counter(String name) { this.name = name; }

    public void inc() { value.increment(); }
    public void add(long delta) { value.add(delta); }
    public long get() { return value.sum(); }
    public void reset() { value.reset(); }
    public String name() { return name; }
}
