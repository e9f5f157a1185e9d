package io.github.jbellis.mobilize.stats;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.github.jbellis.mobilize.util.Json;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide named counters. Many rewrite passes may merge into one registry
 * concurrently; each counter is an {@link AtomicLong} so merges never lose
 * increments.
 */
public class StatisticsRegistry {

    private final ConcurrentHashMap<String, AtomicLong> counters = new ConcurrentHashMap<>();

    /**
     * Shape read by the statistics dashboard for a snapshot request: one
     * timestamp and a scalar per variable.
     */
    public record Snapshot(List<Long> timestamps, Map<String, Long> variables) {
    }

    /**
     * Registers {@code name} with a zero value if it is not already present.
     */
    public void register(String name) {
        counters.computeIfAbsent(name, k -> new AtomicLong());
    }

    public long add(String name, long delta) {
        return counters.computeIfAbsent(name, k -> new AtomicLong()).addAndGet(delta);
    }

    /**
     * Returns the value of {@code name}, or zero if it was never registered.
     */
    public long get(String name) {
        var counter = counters.get(name);
        return counter == null ? 0 : counter.get();
    }

    public void reset() {
        counters.values().forEach(c -> c.set(0));
    }

    /**
     * Returns a point-in-time copy sorted by counter name.
     */
    public Map<String, Long> snapshot() {
        var copy = new TreeMap<String, Long>();
        counters.forEach((name, value) -> copy.put(name, value.get()));
        return copy;
    }

    public String snapshotJson(long timestampMillis) {
        var snapshot = new Snapshot(List.of(timestampMillis), snapshot());
        try {
            return Json.mapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            // a record of longs always serializes
            throw new IllegalStateException("Failed to serialize statistics snapshot", e);
        }
    }

    public String snapshotJson() {
        return snapshotJson(System.currentTimeMillis());
    }
}
