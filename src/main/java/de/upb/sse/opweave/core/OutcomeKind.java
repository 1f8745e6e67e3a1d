package de.upb.sse.opweave.core;

public enum OutcomeKind {
    /** Matched an operator shape but was not taken up (category off, span seen before). Not an error. */
    CLASSIFICATION_SKIP,
    CONTEXT_REJECTED,
    EXTRACTION_FAILURE,
    CONFLICT_REJECTED,
    COMMIT_FAILURE,
    COMMITTED,
    /** Would have been committed; the run was a dry run. */
    DRY_RUN;

    public boolean isFailure() {
        return this == EXTRACTION_FAILURE || this == CONFLICT_REJECTED || this == COMMIT_FAILURE;
    }
}
