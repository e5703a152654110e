package com.takvimi.domain.document;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;

/**
 * Read-only view of an opened calendar document. Pages are addressed by 0-based index.
 * Implementations report backend failures as {@link IOException}; callers treat them as fatal.
 */
public interface CalendarDocument extends Closeable {

    int pageCount();

    /**
     * @param pageIndex 0-based page index
     * @return raw text of the page, empty when the page carries no text
     * @throws IOException when the backend cannot read the page
     */
    String pageText(int pageIndex) throws IOException;

    /**
     * @param pageIndex 0-based page index
     * @return tables detected on the page, top to bottom; empty when none
     * @throws IOException when the backend cannot read the page
     */
    List<DetectedTable> pageTables(int pageIndex) throws IOException;
}
