package com.takvimi.domain.model;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;

/**
 * Calendar arithmetic shared by the extraction pipeline: month/day codes, month lengths and weekday names.
 */
public final class CalendarDates {

    /**
     * Albanian weekday names, Monday first.
     */
    public static final List<String> WEEKDAY_NAMES = List.of(
            "e hënë", "e martë", "e mërkurë", "e enjte", "e premte", "e shtunë", "e diel");

    public static final List<String> MONTH_CODES = IntStream.rangeClosed(1, 12)
            .mapToObj(CalendarDates::monthCode)
            .toList();

    private CalendarDates() {
    }

    public static String monthCode(int month) {
        return String.format("%02d", month);
    }

    public static String dayCode(int day) {
        return String.format("%02d", day);
    }

    public static boolean isLeapYear(int year) {
        return (year % 4 == 0 && year % 100 != 0) || year % 400 == 0;
    }

    /**
     * Number of days of the given month, leap-year aware for February.
     *
     * @param year  four-digit year
     * @param month month number 1..12
     * @return 28..31
     */
    public static int daysInMonth(int year, int month) {
        return switch (month) {
            case 2 -> isLeapYear(year) ? 29 : 28;
            case 4, 6, 9, 11 -> 30;
            default -> 31;
        };
    }

    public static int daysInMonth(int year, String monthCode) {
        return daysInMonth(year, Integer.parseInt(monthCode));
    }

    public static boolean isValidDay(int year, String monthCode, int day) {
        return day >= 1 && day <= daysInMonth(year, monthCode);
    }

    /**
     * Computes the weekday name of a date, or empty when the date does not exist.
     */
    public static Optional<String> weekdayName(int year, String monthCode, int day) {
        try {
            LocalDate date = LocalDate.of(year, Integer.parseInt(monthCode), day);
            return Optional.of(WEEKDAY_NAMES.get(date.getDayOfWeek().getValue() - 1));
        } catch (DateTimeException | NumberFormatException ex) {
            return Optional.empty();
        }
    }

    public static boolean isMonthCode(String value) {
        return value != null && MONTH_CODES.contains(value);
    }
}
