package com.takvimi.domain.document;

import java.util.List;

/**
 * A table found on a page: ordered rows of ordered cell texts. Cells are never {@code null} but may be empty.
 * The first row is the header when the layout has one.
 */
public record DetectedTable(List<List<String>> rows) {

    public DetectedTable {
        rows = rows == null
                ? List.of()
                : rows.stream()
                .map(row -> row == null
                        ? List.<String>of()
                        : row.stream().map(cell -> cell == null ? "" : cell.strip()).toList())
                .toList();
    }

    public static DetectedTable of(List<List<String>> rows) {
        return new DetectedTable(rows);
    }

    public List<String> header() {
        return rows.isEmpty() ? List.of() : rows.get(0);
    }

    public List<List<String>> dataRows() {
        return rows.size() <= 1 ? List.of() : rows.subList(1, rows.size());
    }

    public int rowCount() {
        return rows.size();
    }
}
