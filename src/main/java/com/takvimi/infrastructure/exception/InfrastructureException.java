package com.takvimi.infrastructure.exception;

/**
 * Base unchecked exception for the PDF backend and the result cache. Always wraps the library or I/O
 * failure that caused it.
 */
public abstract class InfrastructureException extends RuntimeException {

    protected InfrastructureException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * @return message of the innermost cause, or this exception's own message when there is no cause
     */
    public String rootCauseMessage() {
        Throwable root = this;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage();
    }
}
