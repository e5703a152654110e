package com.takvimi.infrastructure.exception;

/**
 * Signals that the calendar document cannot be opened or one of its pages cannot be read.
 * This is the only failure that aborts an extraction run.
 */
public class DocumentUnreadableException extends InfrastructureException {
	/**
	 * @param message names the document or page that failed
	 * @param cause   PDFBox or I/O failure reported while reading it
	 */
    public DocumentUnreadableException(String message, Throwable cause) {
        super(message, cause);
    }
}
