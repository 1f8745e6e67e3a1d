package de.upb.sse.opweave.stats;

import de.upb.sse.opweave.model.OperatorCategory;

import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe outcome counters. {@link #global()} is the process-wide sink; per-file
 * collectors are merged into it. Nothing in the pipeline reads these values back.
 */
public class UsageStatistics {
    private static final UsageStatistics GLOBAL = new UsageStatistics();

    // maps are filled once in the constructor and never restructured afterwards
    private final Map<Counter, AtomicLong> counters = new EnumMap<>(Counter.class);
    private final Map<OperatorCategory, AtomicLong> committedByCategory = new EnumMap<>(OperatorCategory.class);
    private final ConcurrentMap<String, AtomicLong> rejectionsByReason = new ConcurrentHashMap<>();

    public UsageStatistics() {
        for (Counter counter : Counter.values()) {
            counters.put(counter, new AtomicLong());
        }
        for (OperatorCategory category : OperatorCategory.values()) {
            committedByCategory.put(category, new AtomicLong());
        }
    }

    public static UsageStatistics global() {
        return GLOBAL;
    }

    public void increment(Counter counter) {
        add(counter, 1);
    }

    public void add(Counter counter, long amount) {
        counters.get(counter).addAndGet(amount);
    }

    public long get(Counter counter) {
        return counters.get(counter).get();
    }

    public void recordCommitted(OperatorCategory category) {
        increment(Counter.COMMITTED);
        committedByCategory.get(category).incrementAndGet();
    }

    /** Counts a context rejection under {@code reason}. */
    public void recordRejection(String reason) {
        increment(Counter.CONTEXT_REJECTED);
        rejectionsByReason.computeIfAbsent(reason, r -> new AtomicLong()).incrementAndGet();
    }

    public StatisticsSnapshot snapshot() {
        Map<Counter, Long> counterValues = new EnumMap<>(Counter.class);
        counters.forEach((k, v) -> counterValues.put(k, v.get()));
        Map<OperatorCategory, Long> categoryValues = new EnumMap<>(OperatorCategory.class);
        committedByCategory.forEach((k, v) -> categoryValues.put(k, v.get()));
        Map<String, Long> reasonValues = new TreeMap<>();
        rejectionsByReason.forEach((k, v) -> reasonValues.put(k, v.get()));
        return new StatisticsSnapshot(counterValues, categoryValues, reasonValues);
    }

    public void mergeFrom(StatisticsSnapshot snapshot) {
        for (Counter counter : Counter.values()) {
            add(counter, snapshot.get(counter));
        }
        snapshot.getCommittedByCategory().forEach((k, v) -> committedByCategory.get(k).addAndGet(v));
        snapshot.getRejectionsByReason().forEach((k, v) ->
                rejectionsByReason.computeIfAbsent(k, r -> new AtomicLong()).addAndGet(v));
    }

    public void reset() {
        counters.values().forEach(c -> c.set(0));
        committedByCategory.values().forEach(c -> c.set(0));
        rejectionsByReason.clear();
    }
}
