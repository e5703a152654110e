package com.takvimi.infrastructure.exception;

/**
 * Signals that a cached calendar file could not be written or read.
 */
public class CalendarCacheException extends InfrastructureException {

    public CalendarCacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
