package com.takvimi.application.extraction;

import com.takvimi.application.parsing.RowContext;
import com.takvimi.domain.document.DetectedTable;
import com.takvimi.domain.model.CalendarYear;
import com.takvimi.domain.model.CalendarYearBuilder;
import com.takvimi.domain.model.DayRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FestivalPageExtractorTest {

    private final FestivalPageExtractor extractor = new FestivalPageExtractor();

    @Test
    void writesFestivalTextForDaysWithAnAnnotation() {
        CalendarYearBuilder builder = new CalendarYearBuilder(2024);
        DetectedTable table = DetectedTable.of(List.of(
                List.of("Data", "Dita", "Hëna", "Festat fetare"),
                List.of("10.", "e mërkurë", "28", "Nata e Miraxhit"),
                List.of("11", "e enjte", "29", ""),
                List.of("12", "e premte")));

        int written = extractor.extract(List.of(table), new RowContext(2024, "01"), builder);

        assertThat(written).isEqualTo(1);
        DayRecord day = builder.build().month("01").day("10").orElseThrow();
        assertThat(day.festival()).isEqualTo("Nata e Miraxhit");
        assertThat(day.weekday()).isEqualTo("e mërkurë");
        assertThat(day.times().isEmpty()).isTrue();
    }

    @Test
    void headerRowIsNeverStoredAsAFestival() {
        CalendarYearBuilder builder = new CalendarYearBuilder(2024);
        DetectedTable table = DetectedTable.of(List.of(
                List.of("1. Janar", "Dita", "Hëna", "Festat"),
                List.of("6", "e shtunë", "24", "Nata e Regaibit")));

        int written = extractor.extract(List.of(table), new RowContext(2024, "01"), builder);

        assertThat(written).isEqualTo(1);
        assertThat(builder.build().month("01").days()).containsOnlyKeys("06");
    }

    @Test
    void rerunningThePageGivesTheSameState() {
        CalendarYearBuilder builder = new CalendarYearBuilder(2024);
        List<DetectedTable> tables = List.of(DetectedTable.of(List.of(
                List.of("Data", "Dita", "Hëna", "Festat"),
                List.of("27", "e shtunë", "16", "Nata e Beratit"))));
        RowContext february = new RowContext(2024, "02");

        extractor.extract(tables, february, builder);
        CalendarYear first = builder.build();
        extractor.extract(tables, february, builder);

        assertThat(builder.build()).isEqualTo(first);
    }
}
