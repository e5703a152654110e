package com.takvimi.application.parsing;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One unit handed to the row cascade: either the cells of a table row or a single line of page text.
 * {@link #text()} is always populated; for table rows it is the non-empty cells joined by a space.
 */
public record RowInput(List<String> cells, String text) {

    public RowInput {
        cells = cells == null ? List.of() : List.copyOf(cells);
        text = text == null ? "" : text;
    }

    public static RowInput ofCells(List<String> cells) {
        List<String> safe = cells == null ? List.of() : cells.stream()
                .map(cell -> cell == null ? "" : cell.strip())
                .toList();
        String joined = safe.stream()
                .filter(cell -> !cell.isEmpty())
                .collect(Collectors.joining(" "));
        return new RowInput(safe, joined);
    }

    public static RowInput ofLine(String line) {
        return new RowInput(List.of(), line);
    }
}
