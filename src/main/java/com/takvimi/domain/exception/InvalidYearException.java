package com.takvimi.domain.exception;

/**
 * Raised when a year reference is not a four-digit calendar year.
 */
public class InvalidYearException extends DomainException {

    public InvalidYearException(String year) {
        super("Year must be a four-digit number.", year);
    }
}
