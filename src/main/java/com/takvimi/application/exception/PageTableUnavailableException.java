package com.takvimi.application.exception;

import java.util.Map;

/**
 * Raised when a page export finds no table to export. The message carries the page's raw text, or the
 * reason the page could not be read, so the caller can still inspect it.
 */
public class PageTableUnavailableException extends UseCaseValidationException {

	/**
	 * @param page    1-based page number that was requested
	 * @param message page text or reason reported by the export
	 */
    public PageTableUnavailableException(int page, String message) {
        super(message, Map.of("page", page));
    }
}
