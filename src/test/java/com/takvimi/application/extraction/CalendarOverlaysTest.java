package com.takvimi.application.extraction;

import com.takvimi.domain.model.CalendarYear;
import com.takvimi.domain.model.CalendarYearBuilder;
import com.takvimi.domain.model.CorrectionTable;
import com.takvimi.domain.model.DayRecord;
import com.takvimi.domain.model.HolidayTable;
import com.takvimi.domain.model.PrayerTimeField;
import com.takvimi.domain.model.PrayerTimes;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CalendarOverlaysTest {

    private static final PrayerTimes EXTRACTED = PrayerTimes.ofOrdered(
            List.of("05:21", "06:10", "07:45", "12:30", "15:10", "18:05", "19:30", "13:09"));

    private final CalendarOverlays overlays = new CalendarOverlays();

    private static CalendarYearBuilder januaryFirst(String festival) {
        CalendarYearBuilder builder = new CalendarYearBuilder(2024);
        builder.mergeDay("01", new DayRecord(1, "e hënë", festival, EXTRACTED));
        return builder;
    }

    private static DayRecord januaryFirstOf(CalendarYearBuilder builder) {
        return builder.build().month("01").day("01").orElseThrow();
    }

    @Test
    void holidayFillsEmptyFestivalWithoutSeparator() {
        CalendarYearBuilder builder = januaryFirst("");

        overlays.mergeFestivals(builder, new HolidayTable(Map.of("01-01", "Viti i Ri 2024")));

        assertThat(januaryFirstOf(builder).festival()).isEqualTo("Viti i Ri 2024");
    }

    @Test
    void holidayIsAppendedToExtractedFestival() {
        CalendarYearBuilder builder = januaryFirst("Festë");

        overlays.mergeFestivals(builder, new HolidayTable(Map.of("01-01", "Viti i Ri 2024")));

        assertThat(januaryFirstOf(builder).festival()).isEqualTo("Festë, Viti i Ri 2024").startsWith("Festë");
    }

    @Test
    void mergingTwiceDoesNotRepeatTheHoliday() {
        CalendarYearBuilder builder = januaryFirst("Festë");
        HolidayTable holidays = new HolidayTable(Map.of("01-01", "Viti i Ri 2024"));

        overlays.mergeFestivals(builder, holidays);
        int changed = overlays.mergeFestivals(builder, holidays);

        assertThat(changed).isZero();
        assertThat(januaryFirstOf(builder).festival()).isEqualTo("Festë, Viti i Ri 2024");
    }

    @Test
    void holidayContainedInALongerFestivalIsStillAppended() {
        CalendarYearBuilder builder = januaryFirst("Fitër Bajrami i dytë");

        int changed = overlays.mergeFestivals(builder, new HolidayTable(Map.of("01-01", "Fitër Bajrami")));

        assertThat(changed).isEqualTo(1);
        assertThat(januaryFirstOf(builder).festival()).isEqualTo("Fitër Bajrami i dytë, Fitër Bajrami");
    }

    @Test
    void holidaysForDaysThatWereNotExtractedAreIgnored() {
        CalendarYearBuilder builder = januaryFirst("");

        overlays.mergeFestivals(builder, new HolidayTable(Map.of("11-28", "Dita e Pavarësisë")));

        assertThat(builder.totalDays()).isEqualTo(1);
        assertThat(builder.build().month("11").isEmpty()).isTrue();
    }

    @Test
    void correctionOverwritesOnlyTheNamedField() {
        CalendarYearBuilder builder = januaryFirst("");
        CorrectionTable corrections = new CorrectionTable(
                Map.of("2024-01-01", Map.of(PrayerTimeField.DAWN_START, "05:20")));

        int corrected = overlays.applyCorrections(builder, corrections);

        PrayerTimes times = januaryFirstOf(builder).times();
        assertThat(corrected).isEqualTo(1);
        assertThat(times.dawnStart()).isEqualTo("05:20");
        assertThat(times.dawnEnd()).isEqualTo(EXTRACTED.dawnEnd());
        assertThat(times.dayLength()).isEqualTo(EXTRACTED.dayLength());
    }

    @Test
    void applyingCorrectionsTwiceIsIdempotent() {
        CalendarYearBuilder builder = januaryFirst("");
        CorrectionTable corrections = new CorrectionTable(
                Map.of("2024-01-01", Map.of(PrayerTimeField.DAWN_START, "05:20", PrayerTimeField.SUNSET, "16:30")));

        overlays.applyCorrections(builder, corrections);
        CalendarYear once = builder.build();
        overlays.applyCorrections(builder, corrections);

        assertThat(builder.build()).isEqualTo(once);
    }

    @Test
    void correctionsForOtherYearsDoNotApply() {
        CalendarYearBuilder builder = januaryFirst("");

        overlays.applyCorrections(builder, new CorrectionTable(
                Map.of("2023-01-01", Map.of(PrayerTimeField.DAWN_START, "05:20"))));

        assertThat(januaryFirstOf(builder).times()).isEqualTo(EXTRACTED);
    }
}
