package com.takvimi.application.parsing;

import com.takvimi.domain.model.CalendarDates;

/**
 * The resolved year and month a row is parsed for.
 */
public record RowContext(int year, String monthCode) {

    public String weekdayOf(int day) {
        return CalendarDates.weekdayName(year, monthCode, day).orElse("");
    }

    public boolean isValidDay(int day) {
        return CalendarDates.isValidDay(year, monthCode, day);
    }
}
