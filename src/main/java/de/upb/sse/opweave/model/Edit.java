package de.upb.sse.opweave.model;

import java.util.Objects;

/**
 * Replacement of one span of a file buffer, proposed on behalf of one candidate.
 */
public final class Edit {
    public final SourceSpan span;
    public final String replacementText;
    public final int candidateId;

    public Edit(SourceSpan span, String replacementText, int candidateId) {
        this.span = Objects.requireNonNull(span, "span");
        this.replacementText = Objects.requireNonNull(replacementText, "replacementText");
        this.candidateId = candidateId;
    }

    @Override
    public String toString() {
        return "Edit#" + candidateId + span + " -> \"" + replacementText + "\"";
    }
}
