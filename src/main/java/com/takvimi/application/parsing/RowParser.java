package com.takvimi.application.parsing;

import java.util.Optional;

/**
 * One strategy of the row cascade.
 */
public interface RowParser {

    /**
     * Short identifier used in logs.
     */
    String name();

    /**
     * Attempts to read a day from the row.
     *
     * @param input   table row or text line
     * @param context year and month the row belongs to
     * @return the candidate, or empty when the row does not have this strategy's shape
     */
    Optional<DayCandidate> tryParse(RowInput input, RowContext context);

    /**
     * Parses a leading day number; absurdly long digit runs count as no day.
     */
    static Optional<Integer> parseDay(String digits) {
        if (digits == null || digits.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Integer.parseInt(digits.trim()));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }
}
