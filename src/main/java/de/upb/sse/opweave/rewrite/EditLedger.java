package de.upb.sse.opweave.rewrite;

import de.upb.sse.opweave.model.Edit;
import de.upb.sse.opweave.model.SourceSpan;

import java.util.*;

/**
 * Accepted edits of one file, ordered by span. No two entries conflict.
 */
public class EditLedger {
    private static final Comparator<Edit> ORDER = Comparator
            .comparing((Edit e) -> e.span)
            .thenComparingInt(e -> e.candidateId);

    private final NavigableSet<Edit> edits = new TreeSet<>(ORDER);

    /** First accepted edit whose span conflicts with {@code span}. */
    public Optional<Edit> findConflict(SourceSpan span) {
        // an entry starting after span.end can neither overlap nor share an insertion point
        for (Edit edit : edits) {
            if (edit.span.getStart() > span.getEnd()) break;
            if (edit.span.conflictsWith(span)) return Optional.of(edit);
        }
        return Optional.empty();
    }

    public boolean add(Edit edit) {
        if (findConflict(edit.span).isPresent()) return false;
        return edits.add(edit);
    }

    /**
     * Scans the ledger for a pair of conflicting entries.
     *
     * @return a description of the first violation found
     */
    public Optional<String> findViolation() {
        List<Edit> ordered = new ArrayList<>(edits);
        for (int i = 0; i < ordered.size(); i++) {
            Edit a = ordered.get(i);
            for (int j = i + 1; j < ordered.size(); j++) {
                Edit b = ordered.get(j);
                if (b.span.getStart() > a.span.getEnd()) break;
                if (a.span.conflictsWith(b.span)) {
                    return Optional.of("edits #" + a.candidateId + " " + a.span + " and #" + b.candidateId
                            + " " + b.span + " conflict");
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Edits in splice order: descending start, and at a shared start the
     * replacement before the insertion so the insertion lands in front of it.
     */
    public List<Edit> inApplicationOrder() {
        List<Edit> ordered = new ArrayList<>(edits);
        ordered.sort(Comparator.comparingInt((Edit e) -> e.span.getStart())
                .thenComparingInt(e -> e.span.getEnd())
                .reversed());
        return ordered;
    }

    public List<Edit> getEdits() {
        return List.copyOf(edits);
    }

    public int size() {
        return edits.size();
    }

    public boolean isEmpty() {
        return edits.isEmpty();
    }

    public void clear() {
        edits.clear();
    }
}
