package com.takvimi.domain.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Mutable year under construction. Owned by a single extraction run; {@link #build()} hands out the
 * immutable {@link CalendarYear}.
 * <p>
 * Every write is guarded by the month length of {@link #year()}: out-of-range day numbers are refused.
 */
public final class CalendarYearBuilder {

    private final int year;
    private final Map<String, Map<String, DayRecord>> months = new LinkedHashMap<>();

    public CalendarYearBuilder(int year) {
        this.year = year;
        for (String code : CalendarDates.MONTH_CODES) {
            months.put(code, new TreeMap<>());
        }
    }

    public int year() {
        return year;
    }

    /**
     * Stores a record, merging it into an existing record of the same day.
     *
     * @param monthCode two-digit month code
     * @param record    record to write
     * @return {@code false} when the day number is not valid for the month
     */
    public boolean mergeDay(String monthCode, DayRecord record) {
        if (record == null || !accepts(monthCode, record.day())) {
            return false;
        }
        months.get(monthCode).merge(CalendarDates.dayCode(record.day()), record, DayRecord::mergedWith);
        return true;
    }

    /**
     * Sets the festival text of a day, creating a placeholder record with empty times when the day is new.
     *
     * @return {@code false} when the day number is not valid for the month
     */
    public boolean putFestival(String monthCode, int day, String festival) {
        if (!accepts(monthCode, day)) {
            return false;
        }
        months.get(monthCode).compute(CalendarDates.dayCode(day), (key, existing) -> existing == null
                ? DayRecord.placeholder(day, CalendarDates.weekdayName(year, monthCode, day).orElse(""), festival)
                : existing.withFestival(festival));
        return true;
    }

    /**
     * Rewrites every stored record in place; used by the overlay stages that run after extraction.
     */
    public void updateEach(DayUpdate update) {
        months.forEach((monthCode, days) ->
                days.replaceAll((dayCode, record) -> update.apply(monthCode, dayCode, record)));
    }

    public int dayCount(String monthCode) {
        Map<String, DayRecord> days = months.get(monthCode);
        return days == null ? 0 : days.size();
    }

    public List<String> emptyMonths() {
        List<String> empty = new ArrayList<>();
        months.forEach((code, days) -> {
            if (days.isEmpty()) {
                empty.add(code);
            }
        });
        return empty;
    }

    public int totalDays() {
        return months.values().stream().mapToInt(Map::size).sum();
    }

    public CalendarYear build() {
        Map<String, MonthBucket> snapshot = new TreeMap<>();
        months.forEach((code, days) -> snapshot.put(code, new MonthBucket(days)));
        return new CalendarYear(snapshot);
    }

    private boolean accepts(String monthCode, int day) {
        return CalendarDates.isMonthCode(monthCode) && CalendarDates.isValidDay(year, monthCode, day);
    }

    /**
     * Per-record rewrite applied by {@link #updateEach(DayUpdate)}.
     */
    @FunctionalInterface
    public interface DayUpdate {
        DayRecord apply(String monthCode, String dayCode, DayRecord record);
    }
}
