package com.takvimi.application.extraction;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Null-safe cell access for detected table rows.
 */
final class TableCells {

    private static final Pattern FIRST_NUMBER = Pattern.compile("(\\d+)");

    private TableCells() {
    }

    static String cell(List<String> row, int index) {
        if (row == null || index < 0 || index >= row.size()) {
            return "";
        }
        String value = row.get(index);
        return value == null ? "" : value.strip();
    }

    /**
     * Reads the first run of digits in a cell as a day number.
     */
    static Optional<Integer> firstNumber(String cell) {
        if (cell == null) {
            return Optional.empty();
        }
        Matcher matcher = FIRST_NUMBER.matcher(cell);
        if (!matcher.find()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Integer.parseInt(matcher.group(1)));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }
}
