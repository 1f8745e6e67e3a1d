package de.upb.sse.opweave.rewrite;

/**
 * The accepted edits of a file could not be applied. The file has been rolled back.
 */
public class CommitFailureException extends Exception {
    public CommitFailureException(String message) {
        super(message);
    }

    public CommitFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
