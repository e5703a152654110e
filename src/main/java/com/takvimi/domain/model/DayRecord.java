package com.takvimi.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One day of the calendar: its ordinal day number, weekday name, festival annotation and the daily times.
 */
@JsonPropertyOrder({"data_sipas_kal_boteror", "dita_javes", "festat_fetare_dhe_shenime_te_tjera_astronomike", "kohet"})
public record DayRecord(
        @JsonProperty("data_sipas_kal_boteror") int day,
        @JsonProperty("dita_javes") String weekday,
        @JsonProperty("festat_fetare_dhe_shenime_te_tjera_astronomike") String festival,
        @JsonProperty("kohet") PrayerTimes times
) {

    public DayRecord {
        weekday = weekday == null ? "" : weekday.trim();
        festival = festival == null ? "" : festival.trim();
        times = times == null ? PrayerTimes.empty() : times;
    }

    /**
     * Creates a record that only carries a festival annotation.
     */
    public static DayRecord placeholder(int day, String weekday, String festival) {
        return new DayRecord(day, weekday, festival, PrayerTimes.empty());
    }

    public DayRecord withFestival(String newFestival) {
        return new DayRecord(day, weekday, newFestival, times);
    }

    public DayRecord withTimes(PrayerTimes newTimes) {
        return new DayRecord(day, weekday, festival, newTimes);
    }

    /**
     * Combines this record with a later write for the same day. Non-empty values of {@code newer} win,
     * empty ones keep what is already stored.
     *
     * @param newer record produced by a later extraction step
     * @return merged record
     */
    public DayRecord mergedWith(DayRecord newer) {
        if (newer == null) {
            return this;
        }
        return new DayRecord(
                day,
                newer.weekday().isEmpty() ? weekday : newer.weekday(),
                newer.festival().isEmpty() ? festival : newer.festival(),
                times.mergedWith(newer.times())
        );
    }
}
