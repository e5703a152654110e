package com.takvimi.domain.exception;

/**
 * Raised when a month reference is outside 01..12.
 */
public class InvalidMonthException extends DomainException {

    public InvalidMonthException(String month) {
        super("Month must be a number between 01 and 12.", month);
    }
}
