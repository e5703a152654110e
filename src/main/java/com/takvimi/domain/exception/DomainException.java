package com.takvimi.domain.exception;

/**
 * Base type for rejected calendar references (years, months, source files).
 * Carries the value that was refused so the API can echo it back.
 */
public abstract class DomainException extends RuntimeException {

    private final String rejectedValue;

	/**
	 * @param message       explanation of which rule broke
	 * @param rejectedValue the offending input, may be {@code null}
	 */
    protected DomainException(String message, String rejectedValue) {
        super(message);
        this.rejectedValue = rejectedValue;
    }

    public String rejectedValue() {
        return rejectedValue;
    }
}
