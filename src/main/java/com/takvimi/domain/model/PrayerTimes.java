package com.takvimi.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * The eight time values of one calendar day. Every field is either an {@code HH:MM} string or empty,
 * never {@code null}.
 */
@JsonPropertyOrder({"imsaku", "sabahu", "lindja_e_diellit", "dreka", "ikindia", "akshami", "jacia", "gjatesia_e_dites"})
public record PrayerTimes(
        @JsonProperty("imsaku") String dawnStart,
        @JsonProperty("sabahu") String dawnEnd,
        @JsonProperty("lindja_e_diellit") String sunrise,
        @JsonProperty("dreka") String midday,
        @JsonProperty("ikindia") String afternoon,
        @JsonProperty("akshami") String sunset,
        @JsonProperty("jacia") String nightfall,
        @JsonProperty("gjatesia_e_dites") String dayLength
) {

    private static final PrayerTimes EMPTY = new PrayerTimes("", "", "", "", "", "", "", "");

    public PrayerTimes {
        dawnStart = normalize(dawnStart);
        dawnEnd = normalize(dawnEnd);
        sunrise = normalize(sunrise);
        midday = normalize(midday);
        afternoon = normalize(afternoon);
        sunset = normalize(sunset);
        nightfall = normalize(nightfall);
        dayLength = normalize(dayLength);
    }

    public static PrayerTimes empty() {
        return EMPTY;
    }

    /**
     * Builds the times from values listed in column order; missing trailing values stay empty.
     *
     * @param values up to eight values, dawn-start first
     * @return populated times
     */
    public static PrayerTimes ofOrdered(List<String> values) {
        String[] slots = new String[PrayerTimeField.values().length];
        for (int i = 0; i < slots.length && values != null && i < values.size(); i++) {
            slots[i] = values.get(i);
        }
        return new PrayerTimes(slots[0], slots[1], slots[2], slots[3], slots[4], slots[5], slots[6], slots[7]);
    }

    public String get(PrayerTimeField field) {
        return switch (field) {
            case DAWN_START -> dawnStart;
            case DAWN_END -> dawnEnd;
            case SUNRISE -> sunrise;
            case MIDDAY -> midday;
            case AFTERNOON -> afternoon;
            case SUNSET -> sunset;
            case NIGHTFALL -> nightfall;
            case DAY_LENGTH -> dayLength;
        };
    }

    /**
     * Returns a copy where the given fields are replaced, all others untouched.
     *
     * @param overrides replacement values keyed by field
     * @return updated times
     */
    public PrayerTimes with(Map<PrayerTimeField, String> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return this;
        }
        Map<PrayerTimeField, String> values = asMap();
        values.putAll(overrides);
        return fromMap(values);
    }

    /**
     * Overlays the non-empty values of {@code newer} onto this instance.
     */
    public PrayerTimes mergedWith(PrayerTimes newer) {
        if (newer == null) {
            return this;
        }
        Map<PrayerTimeField, String> values = asMap();
        for (PrayerTimeField field : PrayerTimeField.values()) {
            String candidate = newer.get(field);
            if (!candidate.isEmpty()) {
                values.put(field, candidate);
            }
        }
        return fromMap(values);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return this.equals(EMPTY);
    }

    private Map<PrayerTimeField, String> asMap() {
        Map<PrayerTimeField, String> values = new EnumMap<>(PrayerTimeField.class);
        for (PrayerTimeField field : PrayerTimeField.values()) {
            values.put(field, get(field));
        }
        return values;
    }

    private static PrayerTimes fromMap(Map<PrayerTimeField, String> values) {
        return new PrayerTimes(
                values.get(PrayerTimeField.DAWN_START),
                values.get(PrayerTimeField.DAWN_END),
                values.get(PrayerTimeField.SUNRISE),
                values.get(PrayerTimeField.MIDDAY),
                values.get(PrayerTimeField.AFTERNOON),
                values.get(PrayerTimeField.SUNSET),
                values.get(PrayerTimeField.NIGHTFALL),
                values.get(PrayerTimeField.DAY_LENGTH)
        );
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim();
    }
}
