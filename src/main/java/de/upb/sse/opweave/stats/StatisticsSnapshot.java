package de.upb.sse.opweave.stats;

import de.upb.sse.opweave.model.OperatorCategory;

import java.io.PrintStream;
import java.util.Collections;
import java.util.Map;

/**
 * Immutable copy of a {@link UsageStatistics} at one point in time.
 */
public final class StatisticsSnapshot {
    private final Map<Counter, Long> counters;
    private final Map<OperatorCategory, Long> committedByCategory;
    private final Map<String, Long> rejectionsByReason;

    StatisticsSnapshot(Map<Counter, Long> counters, Map<OperatorCategory, Long> committedByCategory,
                       Map<String, Long> rejectionsByReason) {
        this.counters = Collections.unmodifiableMap(counters);
        this.committedByCategory = Collections.unmodifiableMap(committedByCategory);
        this.rejectionsByReason = Collections.unmodifiableMap(rejectionsByReason);
    }

    public long get(Counter counter) {
        return counters.getOrDefault(counter, 0L);
    }

    public long getCommitted() {
        return get(Counter.COMMITTED);
    }

    /** Context rejections plus conflict rejections. */
    public long getTotalRejected() {
        return get(Counter.CONTEXT_REJECTED) + get(Counter.CONFLICT_REJECTED);
    }

    public long getCommitted(OperatorCategory category) {
        return committedByCategory.getOrDefault(category, 0L);
    }

    public long getRejections(String reason) {
        return rejectionsByReason.getOrDefault(reason, 0L);
    }

    public Map<OperatorCategory, Long> getCommittedByCategory() {
        return committedByCategory;
    }

    public Map<String, Long> getRejectionsByReason() {
        return rejectionsByReason;
    }

    public String toSummaryString() {
        StringBuilder sb = new StringBuilder();
        sb.append("==================================================\n");
        sb.append("INSTRUMENTATION SUMMARY\n");
        sb.append("==================================================\n");
        sb.append(String.format("Files processed:       %d%n", get(Counter.FILES_PROCESSED)));
        sb.append(String.format("Files changed:         %d%n", get(Counter.FILES_CHANGED)));
        sb.append(String.format("Files failed:          %d%n", get(Counter.FILES_FAILED)));
        sb.append(String.format("Candidates classified: %d%n", get(Counter.CLASSIFIED)));
        sb.append(String.format("  category disabled:   %d%n", get(Counter.CATEGORY_DISABLED)));
        sb.append(String.format("  already processed:   %d%n", get(Counter.ALREADY_PROCESSED)));
        sb.append(String.format("  context rejected:    %d%n", get(Counter.CONTEXT_REJECTED)));
        sb.append(String.format("  concrete:            %d%n", get(Counter.ANALYZED_CONCRETE)));
        sb.append(String.format("  deferred:            %d%n", get(Counter.ANALYZED_DEFERRED)));
        sb.append(String.format("  extraction failed:   %d%n", get(Counter.EXTRACTION_FAILED)));
        sb.append(String.format("  conflict rejected:   %d%n", get(Counter.CONFLICT_REJECTED)));
        sb.append(String.format("  committed:           %d%n", get(Counter.COMMITTED)));
        sb.append(String.format("  dry run, not applied: %d%n", get(Counter.DRY_RUN_SKIPPED)));
        sb.append(String.format("Commit failures:       %d%n", get(Counter.COMMIT_FAILED)));
        committedByCategory.forEach((category, count) -> {
            if (count > 0) sb.append(String.format("Committed %-12s %d%n", category + ":", count));
        });
        rejectionsByReason.forEach((reason, count) ->
                sb.append(String.format("Rejected %-28s %d%n", reason + ":", count)));
        return sb.toString();
    }

    public void print(PrintStream out) {
        out.print(toSummaryString());
    }

    @Override
    public String toString() {
        return "StatisticsSnapshot" + counters;
    }
}
