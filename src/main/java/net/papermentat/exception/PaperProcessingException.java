package net.papermentat.exception;

/**
 * Identifier-level failure inside entry processing. Converted into a failed result,
 * never propagated past the orchestrator.
 */
public class PaperProcessingException extends RuntimeException {

    public PaperProcessingException(String message) {
        super(message);
    }

    public PaperProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
