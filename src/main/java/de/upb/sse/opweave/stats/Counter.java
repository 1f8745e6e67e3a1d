package de.upb.sse.opweave.stats;

/**
 * Named outcome counters. Per-candidate counters follow the candidate lifecycle
 * {@code classified -> filtered | analyzed -> generated | failed -> proposed -> committed | conflicted}.
 */
public enum Counter {
    CLASSIFIED,
    CATEGORY_DISABLED,
    ALREADY_PROCESSED,
    CONTEXT_REJECTED,
    ANALYZED_CONCRETE,
    ANALYZED_DEFERRED,
    GENERATED,
    EXTRACTION_FAILED,
    PROPOSED,
    CONFLICT_REJECTED,
    COMMITTED,
    DRY_RUN_SKIPPED,
    COMMIT_FAILED,
    FILES_PROCESSED,
    FILES_CHANGED,
    FILES_FAILED
}
