package com.takvimi.application.extraction;

import com.takvimi.application.parsing.DayCandidate;
import com.takvimi.application.parsing.RowContext;
import com.takvimi.application.parsing.RowParserCascade;
import com.takvimi.domain.document.DetectedTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PrayerTimesPageExtractorTest {

    private static final RowContext JANUARY_2024 = new RowContext(2024, "01");
    private static final List<String> KEYWORD_HEADER = List.of(
            "Data", "Dita", "Hëna", "Imsaku", "Sabahu", "Lindja", "Dreka", "Ikindia", "Akshami", "Jacia", "Gjatësia");

    private PrayerTimesPageExtractor extractor;
    private HeaderKeywordTableExtractor headerKeywordExtractor;

    @BeforeEach
    void setUp() {
        RowParserCascade cascade = new RowParserCascade();
        headerKeywordExtractor = new HeaderKeywordTableExtractor();
        extractor = new PrayerTimesPageExtractor(headerKeywordExtractor, new FixedOffsetTableExtractor(),
                cascade, new TextLineExtractor(cascade));
    }

    @Test
    void headerKeywordTableReadsTimeCellsInOrder() {
        DetectedTable table = DetectedTable.of(List.of(KEYWORD_HEADER,
                List.of("2", "e martë", "21", "05:22", "06:11", "07:45", "12:31", "15:11", "18:06", "19:31", "9:20")));

        List<DayCandidate> days = extractor.extract(List.of(table), "", JANUARY_2024);

        assertThat(headerKeywordExtractor.accepts(table)).isTrue();
        assertThat(days).singleElement().satisfies(day -> {
            assertThat(day.day()).isEqualTo(2);
            assertThat(day.weekday()).isEqualTo("e martë");
            assertThat(day.times().dawnStart()).isEqualTo("05:22");
            assertThat(day.times().nightfall()).isEqualTo("19:31");
            assertThat(day.times().dayLength()).isEqualTo("9:20");
            assertThat(day.strategy()).isEqualTo("header-keyword");
        });
    }

    @Test
    void headerKeywordTableFallsBackToFixedOffsetsForSparseRows() {
        DetectedTable table = DetectedTable.of(List.of(KEYWORD_HEADER,
                List.of("3", "e mërkurë", "22", "05:23", "06:12", "07:46", "", "", "", "", "")));

        DayCandidate day = headerKeywordExtractor.extract(table, JANUARY_2024).get(0);

        assertThat(day.times().dawnStart()).isEqualTo("05:23");
        assertThat(day.times().sunrise()).isEqualTo("07:46");
        assertThat(day.times().midday()).isEmpty();
        assertThat(day.times().dayLength()).isEmpty();
    }

    @Test
    void tableWithoutKeywordsIsReadByPositionThenByCascade() {
        DetectedTable table = DetectedTable.of(List.of(
                List.of("Data", "Dita", "H", "Festat", "1", "2", "3", "4", "5", "6", "7", "8"),
                List.of("4", "e enjte", "23", "Festë", "05:24", "06:13", "07:47", "12:32", "15:12", "18:07", "19:32", "9:22"),
                List.of("5 e premte 24", "05:25 06:14 07:48 12:33 15:13 18:08 19:33 9:24")));

        List<DayCandidate> days = extractor.extract(List.of(table), "", JANUARY_2024);

        assertThat(days).extracting(DayCandidate::strategy).containsExactly("fixed-offset", "fixed-schema");
        assertThat(days.get(0).festival()).isEqualTo("Festë");
        assertThat(days.get(1).day()).isEqualTo(5);
        assertThat(days.get(1).times().dayLength()).isEqualTo("9:24");
    }

    @Test
    void rowWithoutFestivalCellIsReadByTheCascade() {
        DetectedTable table = DetectedTable.of(List.of(
                List.of("Data", "Dita", "H", "Festat", "1", "2", "3", "4", "5", "6", "7", "8"),
                List.of("1", "e hënë", "19", "05:21", "06:10", "07:45", "12:30", "15:10", "18:05", "19:30", "13:09")));

        List<DayCandidate> days = extractor.extract(List.of(table), "", JANUARY_2024);

        assertThat(days).hasSize(1);
        DayCandidate day = days.get(0);
        assertThat(day.strategy()).isEqualTo("fixed-schema");
        assertThat(day.festival()).isEmpty();
        assertThat(day.times().dawnStart()).isEqualTo("05:21");
        assertThat(day.times().dayLength()).isEqualTo("13:09");
    }

    @Test
    void pageTextIsScannedWhenTablesYieldNothing() {
        String text = "JANAR 2024\n6 8 05:26 06:15 07:49 12:34 15:14 18:09 19:34 9:25\nfaqe 9";

        List<DayCandidate> days = extractor.extract(List.of(), text, JANUARY_2024);

        assertThat(days).singleElement().satisfies(day -> {
            assertThat(day.day()).isEqualTo(6);
            assertThat(day.weekday()).isEqualTo("e shtunë");
            assertThat(day.times().dayLength()).isEqualTo("9:25");
        });
    }

    @Test
    void pageWithoutTablesOrTimesYieldsNothing() {
        assertThat(extractor.extract(List.of(), "Parathënie\nKy takvim ...", JANUARY_2024)).isEmpty();
        assertThat(extractor.extract(null, null, JANUARY_2024)).isEmpty();
    }

    @Test
    void rowsOutsideTheMonthAreDropped() {
        DetectedTable table = DetectedTable.of(List.of(KEYWORD_HEADER,
                List.of("30", "e premte", "19", "05:22", "06:11", "07:45", "12:31", "15:11", "18:06", "19:31", "9:20")));

        assertThat(extractor.extract(List.of(table), "", new RowContext(2023, "02"))).isEmpty();
    }
}
