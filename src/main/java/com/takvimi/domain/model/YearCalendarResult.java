package com.takvimi.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Persisted / served shape of a full year: {@code {"year", "data"}} plus an optional notice.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record YearCalendarResult(String year, CalendarYear data, String message) {

    public static YearCalendarResult of(String year, CalendarYear data) {
        return new YearCalendarResult(year, data, null);
    }
}
