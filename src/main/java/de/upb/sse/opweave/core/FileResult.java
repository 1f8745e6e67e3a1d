package de.upb.sse.opweave.core;

import de.upb.sse.opweave.rewrite.SafeRewriteEngine;
import de.upb.sse.opweave.stats.StatisticsSnapshot;
import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Result of instrumenting one file: the output text (the original when nothing was
 * committed), the fate of every candidate and the file's own counters.
 */
@Getter
public class FileResult {
    private final String fileName;
    private final String original;
    private final String output;
    private final SafeRewriteEngine.State engineState;
    private final List<CandidateOutcome> outcomes;
    private final StatisticsSnapshot statistics;

    public FileResult(String fileName, String original, String output, SafeRewriteEngine.State engineState,
                      List<CandidateOutcome> outcomes, StatisticsSnapshot statistics) {
        this.fileName = fileName;
        this.original = original;
        this.output = output;
        this.engineState = engineState;
        this.outcomes = List.copyOf(outcomes);
        this.statistics = statistics;
    }

    public boolean isChanged() {
        return !original.equals(output);
    }

    public List<CandidateOutcome> outcomesOf(OutcomeKind kind) {
        return outcomes.stream().filter(o -> o.getOutcome() == kind).collect(Collectors.toList());
    }

    public long count(OutcomeKind kind) {
        return outcomes.stream().filter(o -> o.getOutcome() == kind).count();
    }

    /** Candidates that were rejected or failed, formatted as diagnostics. */
    public List<String> describeProblems() {
        return outcomes.stream()
                .filter(o -> o.getOutcome() == OutcomeKind.CONTEXT_REJECTED || o.getOutcome().isFailure())
                .map(o -> o.describe(fileName))
                .collect(Collectors.toList());
    }
}
