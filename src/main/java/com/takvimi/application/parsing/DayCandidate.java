package com.takvimi.application.parsing;

import com.takvimi.domain.model.DayRecord;
import com.takvimi.domain.model.PrayerTimes;

/**
 * A day parsed from one row or line, tagged with the strategy that produced it.
 */
public record DayCandidate(int day, String weekday, String festival, PrayerTimes times, String strategy) {

    public DayRecord toRecord() {
        return new DayRecord(day, weekday, festival, times);
    }
}
