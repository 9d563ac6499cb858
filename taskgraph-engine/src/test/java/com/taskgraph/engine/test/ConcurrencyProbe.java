package com.taskgraph.engine.test;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Tracks how many task bodies run at once, overall and per type.
 */
public class ConcurrencyProbe {

    private final AtomicInteger current = new AtomicInteger();
    private final AtomicInteger peak = new AtomicInteger();
    private final Map<String, AtomicInteger> currentByType = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> peakByType = new ConcurrentHashMap<>();
    private final long holdMillis;

    public ConcurrencyProbe(long holdMillis) {
        this.holdMillis = holdMillis;
    }

    void enter(String type) throws InterruptedException {
        peak.accumulateAndGet(current.incrementAndGet(), Math::max);
        int typeCount = currentByType.computeIfAbsent(type, t -> new AtomicInteger()).incrementAndGet();
        peakByType.computeIfAbsent(type, t -> new AtomicInteger()).accumulateAndGet(typeCount, Math::max);
        // Hold the slot so overlapping tasks are observable
        Thread.sleep(holdMillis);
    }

    void exit(String type) {
        current.decrementAndGet();
        currentByType.get(type).decrementAndGet();
    }

    public int peak() {
        return peak.get();
    }

    public int peak(String type) {
        AtomicInteger value = peakByType.get(type);
        return value == null ? 0 : value.get();
    }
}
