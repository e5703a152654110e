package com.takvimi.domain.exception;

/**
 * Raised when the configured directory of calendar PDFs does not exist.
 */
public class PdfDirectoryNotFoundException extends DomainException {

    public PdfDirectoryNotFoundException(String directory) {
        super("PDF directory not found.", directory);
    }
}
