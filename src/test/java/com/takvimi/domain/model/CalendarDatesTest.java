package com.takvimi.domain.model;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CalendarDatesTest {

    @ParameterizedTest
    @CsvSource({"2024, 29", "2023, 28", "2000, 29", "1900, 28"})
    void februaryFollowsTheLeapYearRule(int year, int days) {
        assertThat(CalendarDates.daysInMonth(year, "02")).isEqualTo(days);
    }

    @Test
    void shortMonthsHaveThirtyDays() {
        assertThat(CalendarDates.daysInMonth(2024, 4)).isEqualTo(30);
        assertThat(CalendarDates.daysInMonth(2024, 11)).isEqualTo(30);
        assertThat(CalendarDates.daysInMonth(2024, 12)).isEqualTo(31);
        assertThat(CalendarDates.isValidDay(2024, "06", 31)).isFalse();
        assertThat(CalendarDates.isValidDay(2024, "06", 0)).isFalse();
    }

    @Test
    void weekdayNamesStartOnMonday() {
        assertThat(CalendarDates.weekdayName(2024, "01", 1)).contains("e hënë");
        assertThat(CalendarDates.weekdayName(2024, "01", 7)).contains("e diel");
        assertThat(CalendarDates.weekdayName(2023, "02", 29)).isEmpty();
    }

    @Test
    void codesAreZeroPadded() {
        assertThat(CalendarDates.MONTH_CODES).hasSize(12).startsWith("01").endsWith("12");
        assertThat(CalendarDates.dayCode(5)).isEqualTo("05");
        assertThat(CalendarDates.isMonthCode("13")).isFalse();
    }
}
