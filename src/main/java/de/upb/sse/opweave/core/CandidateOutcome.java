package de.upb.sse.opweave.core;

import de.upb.sse.opweave.model.CandidateKind;
import de.upb.sse.opweave.model.OperatorCategory;
import de.upb.sse.opweave.model.SourceSpan;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * What happened to one candidate of a file.
 */
@Getter
@AllArgsConstructor
public class CandidateOutcome {
    private final int candidateId;
    private final CandidateKind kind;
    private final OperatorCategory category;
    private final SourceSpan span;
    private final int line;
    private final int column;
    private final OutcomeKind outcome;
    private final String reason;
    private final String replacement;

    CandidateOutcome withOutcome(OutcomeKind newOutcome, String newReason) {
        return new CandidateOutcome(candidateId, kind, category, span, line, column, newOutcome, newReason,
                replacement);
    }

    /** {@code file:line:column: outcome: reason}, the usual diagnostic layout. */
    public String describe(String fileName) {
        return fileName + ":" + line + ":" + column + ": " + outcome.name().toLowerCase()
                + (reason != null ? ": " + reason : "");
    }

    @Override
    public String toString() {
        return "#" + candidateId + " " + kind + " " + span + " " + outcome + (reason != null ? " (" + reason + ")" : "");
    }
}
