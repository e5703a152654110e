package com.takvimi.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Immutable set of day records of one month, keyed by the zero-padded day code ("01".."31").
 */
public final class MonthBucket {

    private static final MonthBucket EMPTY = new MonthBucket(Map.of());

    private final Map<String, DayRecord> days;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public MonthBucket(Map<String, DayRecord> days) {
        this.days = days == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new TreeMap<>(days));
    }

    public static MonthBucket empty() {
        return EMPTY;
    }

    @JsonValue
    public Map<String, DayRecord> days() {
        return days;
    }

    public Optional<DayRecord> day(String dayCode) {
        return Optional.ofNullable(days.get(dayCode));
    }

    public int size() {
        return days.size();
    }

    public boolean isEmpty() {
        return days.isEmpty();
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof MonthBucket bucket && days.equals(bucket.days);
    }

    @Override
    public int hashCode() {
        return days.hashCode();
    }

    @Override
    public String toString() {
        return "MonthBucket" + days.keySet();
    }
}
