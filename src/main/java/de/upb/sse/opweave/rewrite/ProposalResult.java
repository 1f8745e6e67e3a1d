package de.upb.sse.opweave.rewrite;

public enum ProposalResult {
    ACCEPTED,
    /** Span conflicts with an edit accepted earlier. */
    CONFLICT,
    /** Span reaches past the end of the buffer. */
    OUT_OF_BOUNDS
}
