package com.takvimi.domain.model;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Known festival texts keyed by {@code "MM-DD"}. Read-only once built.
 */
public final class HolidayTable {

    private static final HolidayTable EMPTY = new HolidayTable(Map.of());

    private final Map<String, String> holidays;

    public HolidayTable(Map<String, String> holidays) {
        this.holidays = holidays == null ? Map.of() : Map.copyOf(new TreeMap<>(holidays));
    }

    public static HolidayTable empty() {
        return EMPTY;
    }

    public Optional<String> lookup(String monthCode, String dayCode) {
        String text = holidays.get(monthCode + "-" + dayCode);
        return text == null || text.isBlank() ? Optional.empty() : Optional.of(text.trim());
    }

    public Map<String, String> entries() {
        return holidays;
    }

    public int size() {
        return holidays.size();
    }
}
