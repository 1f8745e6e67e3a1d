package de.upb.sse.opweave.generation;

/**
 * Operand text could not be taken from the buffer; no replacement was produced.
 */
public class ExtractionException extends Exception {
    public ExtractionException(String message) {
        super(message);
    }
}
