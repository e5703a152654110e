package com.takvimi.application.extraction;

import com.takvimi.application.parsing.DayCandidate;
import com.takvimi.application.parsing.RowContext;
import com.takvimi.domain.model.PrayerTimes;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class FixedOffsetTableExtractorTest {

    private static final RowContext JANUARY_2024 = new RowContext(2024, "01");

    private final FixedOffsetTableExtractor extractor = new FixedOffsetTableExtractor();

    @Test
    void readsEveryColumnOfAFullRow() {
        Optional<DayCandidate> candidate = extractor.parseRow(List.of(
                "1", "e hënë", "19", "Viti i Ri",
                "05:21", "06:10", "07:45", "12:30", "15:10", "18:05", "19:30", "13:09"), JANUARY_2024);

        assertThat(candidate).isPresent();
        assertThat(candidate.get().festival()).isEqualTo("Viti i Ri");
        assertThat(candidate.get().times()).isEqualTo(new PrayerTimes(
                "05:21", "06:10", "07:45", "12:30", "15:10", "18:05", "19:30", "13:09"));
    }

    @Test
    void rowWithoutFestivalCellIsRefused() {
        Optional<DayCandidate> candidate = extractor.parseRow(List.of(
                "1", "e hënë", "19",
                "05:21", "06:10", "07:45", "12:30", "15:10", "18:05", "19:30", "13:09"), JANUARY_2024);

        assertThat(candidate).isEmpty();
    }

    @Test
    void rowWhoseTimesDoNotStartInTheFirstTimeColumnIsRefused() {
        Optional<DayCandidate> candidate = extractor.parseRow(List.of(
                "2", "e martë", "20", "Festë", "shih shënimin",
                "06:10", "07:45", "12:30", "15:10", "18:05", "19:30", "13:09"), JANUARY_2024);

        assertThat(candidate).isEmpty();
    }
}
