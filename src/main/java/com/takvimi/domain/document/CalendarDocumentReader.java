package com.takvimi.domain.document;

import java.nio.file.Path;

/**
 * Opens calendar documents. Failures to open are reported as unchecked exceptions by the implementation;
 * the returned document must be closed by the caller.
 */
public interface CalendarDocumentReader {

    CalendarDocument open(Path path);

    CalendarDocument open(byte[] content);
}
