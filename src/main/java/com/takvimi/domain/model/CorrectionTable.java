package com.takvimi.domain.model;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Authoritative manual time overrides keyed by {@code "YYYY-MM-DD"}. Each entry names a subset of the
 * eight time fields. Read-only once built.
 */
public final class CorrectionTable {

    private static final CorrectionTable EMPTY = new CorrectionTable(Map.of());

    private final Map<String, Map<PrayerTimeField, String>> corrections;

    public CorrectionTable(Map<String, Map<PrayerTimeField, String>> corrections) {
        Map<String, Map<PrayerTimeField, String>> copy = new HashMap<>();
        if (corrections != null) {
            corrections.forEach((date, fields) -> {
                if (fields != null && !fields.isEmpty()) {
                    copy.put(date, Map.copyOf(new EnumMap<>(fields)));
                }
            });
        }
        this.corrections = Map.copyOf(copy);
    }

    public static CorrectionTable empty() {
        return EMPTY;
    }

    public Optional<Map<PrayerTimeField, String>> lookup(int year, String monthCode, String dayCode) {
        return Optional.ofNullable(corrections.get(year + "-" + monthCode + "-" + dayCode));
    }

    public int size() {
        return corrections.size();
    }
}
