package com.takvimi.application.exception;

import java.util.Map;

/**
 * Base unchecked exception for use cases that cannot produce their result, such as an export of a page
 * that carries no table. Subclasses may attach structured details for the caller.
 */
public abstract class ApplicationException extends RuntimeException {

    private final Map<String, Object> details;

	/**
	 * @param message human readable error description suitable for surfacing to the caller
	 * @param details structured context, empty when there is none
	 */
    protected ApplicationException(String message, Map<String, Object> details) {
        super(message);
        this.details = details == null ? Map.of() : Map.copyOf(details);
    }

    public Map<String, Object> details() {
        return details;
    }
}
