package de.upb.sse.opweave.rewrite;

import de.upb.sse.opweave.model.Edit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Collects the edits proposed for one file and applies them all at once.
 * <p>
 * States: {@code IDLE -> ACCUMULATING -> COMMITTED}, or {@code -> ROLLED_BACK}.
 * The original buffer is never modified; {@link #commitAll()} splices into a copy,
 * from the highest start offset down, so earlier offsets stay valid.
 * <p>
 * When two edits conflict the one proposed first is kept. A rejected proposal is
 * recorded and never merged into the accepted one. If conflicts come in disjoint
 * pairs, the number of accepted edits is the same for every proposal order. An edit
 * that overlaps two otherwise disjoint edits makes it order dependent: proposed first
 * it keeps only itself, proposed last it leaves both of the others.
 */
public class SafeRewriteEngine {
    private static final Logger logger = Logger.getLogger(SafeRewriteEngine.class.getName());

    public enum State { IDLE, ACCUMULATING, COMMITTED, ROLLED_BACK }

    private final String fileName;
    private final String original;
    private final OutputVerifier verifier;
    private final EditLedger ledger = new EditLedger();
    private final List<RejectedEdit> rejected = new ArrayList<>();
    private State state = State.IDLE;
    private String output;

    public SafeRewriteEngine(String fileName, String original) {
        this(fileName, original, null);
    }

    public SafeRewriteEngine(String fileName, String original, OutputVerifier verifier) {
        this.fileName = fileName;
        this.original = original;
        this.verifier = verifier;
    }

    public ProposalResult proposeEdit(Edit edit) {
        requireOpen("proposeEdit");
        state = State.ACCUMULATING;

        if (!edit.span.fitsIn(original.length())) {
            rejected.add(new RejectedEdit(edit, ProposalResult.OUT_OF_BOUNDS, null));
            return ProposalResult.OUT_OF_BOUNDS;
        }
        Optional<Edit> conflict = ledger.findConflict(edit.span);
        if (conflict.isPresent()) {
            rejected.add(new RejectedEdit(edit, ProposalResult.CONFLICT, conflict.get()));
            logger.fine(() -> fileName + ": edit #" + edit.candidateId + " " + edit.span
                    + " conflicts with #" + conflict.get().candidateId + " " + conflict.get().span);
            return ProposalResult.CONFLICT;
        }
        ledger.add(edit);
        return ProposalResult.ACCEPTED;
    }

    /**
     * Applies every accepted edit and returns the resulting text. Committing no
     * edits returns the original text unchanged.
     *
     * @throws CommitFailureException when the ledger is inconsistent or the verifier
     *                                objects; the engine is rolled back first
     */
    public String commitAll() throws CommitFailureException {
        requireOpen("commitAll");
        if (ledger.isEmpty()) {
            output = original;
            state = State.COMMITTED;
            return output;
        }

        Optional<String> violation = ledger.findViolation();
        if (violation.isPresent()) {
            rollback();
            throw new CommitFailureException(fileName + ": " + violation.get());
        }

        StringBuilder text = new StringBuilder(original);
        for (Edit edit : ledger.inApplicationOrder()) {
            if (!edit.span.fitsIn(original.length())) {
                rollback();
                throw new CommitFailureException(fileName + ": edit #" + edit.candidateId + " " + edit.span
                        + " exceeds buffer of length " + original.length());
            }
            text.replace(edit.span.getStart(), edit.span.getEnd(), edit.replacementText);
        }
        String result = text.toString();

        if (verifier != null) {
            List<String> problems;
            try {
                problems = verifier.verify(fileName, result);
            } catch (RuntimeException e) {
                rollback();
                throw new CommitFailureException(fileName + ": output verification failed", e);
            }
            if (!problems.isEmpty()) {
                rollback();
                throw new CommitFailureException(fileName + ": rewritten text rejected: " + problems.get(0));
            }
        }

        output = result;
        state = State.COMMITTED;
        return output;
    }

    /** Drops every accepted edit. The original text stays the output. */
    public void rollback() {
        requireOpen("rollback");
        ledger.clear();
        output = original;
        state = State.ROLLED_BACK;
    }

    private void requireOpen(String operation) {
        if (state == State.COMMITTED || state == State.ROLLED_BACK) {
            throw new IllegalStateException(operation + " not allowed in state " + state);
        }
    }

    public State getState() {
        return state;
    }

    /** Committed text, or the original before a commit and after a rollback. */
    public String getOutput() {
        return output != null ? output : original;
    }

    public String getOriginal() {
        return original;
    }

    public String getFileName() {
        return fileName;
    }

    public List<Edit> getAcceptedEdits() {
        return ledger.getEdits();
    }

    public List<RejectedEdit> getRejectedEdits() {
        return Collections.unmodifiableList(rejected);
    }
}
