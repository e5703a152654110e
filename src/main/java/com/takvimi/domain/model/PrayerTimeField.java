package com.takvimi.domain.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * The eight daily time columns of the calendar, in the order they are printed.
 * Each constant carries the key used in the persisted JSON and in the correction tables.
 */
public enum PrayerTimeField {
    DAWN_START("imsaku"),
    DAWN_END("sabahu"),
    SUNRISE("lindja_e_diellit"),
    MIDDAY("dreka"),
    AFTERNOON("ikindia"),
    SUNSET("akshami"),
    NIGHTFALL("jacia"),
    DAY_LENGTH("gjatesia_e_dites");

    private final String key;

    PrayerTimeField(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    /**
     * Resolves a persisted key such as {@code "imsaku"} back to its field.
     *
     * @param key JSON / correction-table key
     * @return matching field or empty when the key is unknown
     */
    public static Optional<PrayerTimeField> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(field -> field.key.equals(normalized))
                .findFirst();
    }
}
