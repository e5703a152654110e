package com.takvimi.application.service;

import com.takvimi.domain.model.CalendarOverrides;

/**
 * Supplies the holiday and correction tables that are overlaid on an extracted year.
 */
public interface CalendarOverridesProvider {

    /**
     * @param year calendar year being extracted
     * @return tables for the year, never {@code null}
     */
    CalendarOverrides overridesFor(int year);
}
