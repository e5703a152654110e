package com.takvimi.application.service;

import com.takvimi.domain.document.CalendarDocument;
import com.takvimi.domain.document.DetectedTable;

import java.io.IOException;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory document: blank pages unless text or tables are registered for an index.
 */
class FakeCalendarDocument implements CalendarDocument {

    private final int pageCount;
    private final Map<Integer, String> texts = new HashMap<>();
    private final Map<Integer, List<DetectedTable>> tables = new HashMap<>();
    private Integer unreadablePage;
    private boolean closed;

    FakeCalendarDocument(int pageCount) {
        this.pageCount = pageCount;
    }

    @SafeVarargs
    final FakeCalendarDocument page(int index, String text, List<List<String>>... pageTables) {
        texts.put(index, text);
        tables.put(index, Arrays.stream(pageTables).map(DetectedTable::of).toList());
        return this;
    }

    FakeCalendarDocument unreadable(int index) {
        this.unreadablePage = index;
        return this;
    }

    boolean closed() {
        return closed;
    }

    @Override
    public int pageCount() {
        return pageCount;
    }

    @Override
    public String pageText(int pageIndex) throws IOException {
        check(pageIndex);
        return texts.getOrDefault(pageIndex, "");
    }

    @Override
    public List<DetectedTable> pageTables(int pageIndex) throws IOException {
        check(pageIndex);
        return tables.getOrDefault(pageIndex, List.of());
    }

    @Override
    public void close() {
        closed = true;
    }

    private void check(int pageIndex) throws IOException {
        if (unreadablePage != null && unreadablePage == pageIndex) {
            throw new IOException("corrupt page stream");
        }
    }
}
