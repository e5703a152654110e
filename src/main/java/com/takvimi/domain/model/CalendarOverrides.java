package com.takvimi.domain.model;

/**
 * Static per-year tables overlaid on the extracted calendar: holidays first, then time corrections.
 */
public record CalendarOverrides(HolidayTable holidays, CorrectionTable corrections) {

    public CalendarOverrides {
        holidays = holidays == null ? HolidayTable.empty() : holidays;
        corrections = corrections == null ? CorrectionTable.empty() : corrections;
    }

    public static CalendarOverrides none() {
        return new CalendarOverrides(HolidayTable.empty(), CorrectionTable.empty());
    }
}
