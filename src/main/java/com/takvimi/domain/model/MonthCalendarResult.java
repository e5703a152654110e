package com.takvimi.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Persisted / served shape of one month: {@code {"year", "month", "data"}} plus an optional notice.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MonthCalendarResult(String year, String month, MonthBucket data, String message) {

    public static MonthCalendarResult of(String year, String month, MonthBucket data) {
        return new MonthCalendarResult(year, month, data, null);
    }
}
