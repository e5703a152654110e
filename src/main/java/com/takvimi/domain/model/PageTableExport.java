package com.takvimi.domain.model;

import java.util.List;

/**
 * Result of exporting a single page: the rows of its first detected table, or a message explaining why
 * there is none (the page text when the page has no table).
 */
public record PageTableExport(List<List<String>> rows, String message) {

    public PageTableExport {
        rows = rows == null ? List.of() : rows.stream().map(List::copyOf).toList();
    }

    public static PageTableExport table(List<List<String>> rows) {
        return new PageTableExport(rows, null);
    }

    public static PageTableExport noTable(String message) {
        return new PageTableExport(List.of(), message);
    }

    public boolean hasTable() {
        return !rows.isEmpty();
    }
}
