package com.takvimi.domain.exception;

/**
 * Raised when no calendar PDF exists for the requested year.
 */
public class CalendarPdfNotFoundException extends DomainException {

	/**
	 * Creates the exception and records the requested year as part of the message.
	 *
	 * @param year four-digit year that has no source document
	 */
    public CalendarPdfNotFoundException(String year) {
        super("PDF file not found for the year " + year + ".", year);
    }
}
