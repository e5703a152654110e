package com.takvimi.application.exception;

import java.util.Map;

/**
 * Signals that a use case was asked for something its input cannot provide.
 */
public class UseCaseValidationException extends ApplicationException {

    public UseCaseValidationException(String message) {
        this(message, Map.of());
    }

    protected UseCaseValidationException(String message, Map<String, Object> details) {
        super(message, details);
    }
}
