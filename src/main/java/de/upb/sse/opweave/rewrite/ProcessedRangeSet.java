package de.upb.sse.opweave.rewrite;

import de.upb.sse.opweave.model.SourceSpan;

import java.util.HashSet;
import java.util.Set;

/**
 * Spans of one file that have already been turned into an edit.
 */
public class ProcessedRangeSet {
    private final Set<SourceSpan> spans = new HashSet<>();

    public boolean isProcessed(SourceSpan span) {
        return spans.contains(span);
    }

    /** @return false when the span was already marked */
    public boolean markProcessed(SourceSpan span) {
        return spans.add(span);
    }

    public int size() {
        return spans.size();
    }

    public void clear() {
        spans.clear();
    }
}
