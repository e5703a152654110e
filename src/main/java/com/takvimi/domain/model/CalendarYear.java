package com.takvimi.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable extraction result: all twelve months keyed "01".."12", each present even when empty.
 */
public final class CalendarYear {

    private final Map<String, MonthBucket> months;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public CalendarYear(Map<String, MonthBucket> months) {
        Map<String, MonthBucket> copy = new TreeMap<>();
        for (String code : CalendarDates.MONTH_CODES) {
            MonthBucket bucket = months == null ? null : months.get(code);
            copy.put(code, bucket == null ? MonthBucket.empty() : bucket);
        }
        this.months = Collections.unmodifiableMap(copy);
    }

    public static CalendarYear empty() {
        return new CalendarYear(Map.of());
    }

    @JsonValue
    public Map<String, MonthBucket> months() {
        return months;
    }

    /**
     * @param monthCode two-digit month code
     * @return the month's bucket, empty for unknown codes
     */
    public MonthBucket month(String monthCode) {
        return months.getOrDefault(monthCode, MonthBucket.empty());
    }

    public int totalDays() {
        return months.values().stream().mapToInt(MonthBucket::size).sum();
    }

    public boolean hasNoDays() {
        return totalDays() == 0;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof CalendarYear year && months.equals(year.months);
    }

    @Override
    public int hashCode() {
        return months.hashCode();
    }

    @Override
    public String toString() {
        return "CalendarYear{days=" + totalDays() + "}";
    }
}
