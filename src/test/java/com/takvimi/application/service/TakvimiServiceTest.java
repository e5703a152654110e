package com.takvimi.application.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.takvimi.application.exception.PageTableUnavailableException;
import com.takvimi.config.TakvimiProperties;
import com.takvimi.domain.document.CalendarDocument;
import com.takvimi.domain.document.CalendarDocumentReader;
import com.takvimi.domain.exception.CalendarPdfNotFoundException;
import com.takvimi.domain.exception.InvalidMonthException;
import com.takvimi.domain.exception.InvalidYearException;
import com.takvimi.domain.exception.PdfDirectoryNotFoundException;
import com.takvimi.domain.model.AvailableCalendars;
import com.takvimi.domain.model.CalendarYear;
import com.takvimi.domain.model.CalendarYearBuilder;
import com.takvimi.domain.model.DayRecord;
import com.takvimi.domain.model.MonthCalendarResult;
import com.takvimi.domain.model.PageTableExport;
import com.takvimi.domain.model.PrayerTimes;
import com.takvimi.domain.model.YearCalendarResult;
import com.takvimi.infrastructure.cache.JsonCalendarCache;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class TakvimiServiceTest {

    @TempDir
    Path workDir;

    private Path pdfDir;
    private JsonCalendarCache cache;
    private CalendarExtractionService extractionService;
    private CalendarDocumentReader documentReader;
    private CalendarDocument document;
    private TakvimiService service;

    @BeforeEach
    void setUp() throws IOException {
        pdfDir = Files.createDirectories(workDir.resolve("pdf"));
        Files.write(pdfDir.resolve("takvimi2024.pdf"), new byte[]{1, 2, 3});
        Files.write(pdfDir.resolve("notes.txt"), new byte[]{1});
        TakvimiProperties properties = new TakvimiProperties(pdfDir.toString(),
                workDir.resolve("json").toString(), TakvimiProperties.Layout.standard());

        cache = new JsonCalendarCache(new ObjectMapper(), properties);
        extractionService = mock(CalendarExtractionService.class);
        documentReader = mock(CalendarDocumentReader.class);
        document = mock(CalendarDocument.class);
        given(documentReader.open(any(Path.class))).willReturn(document);
        service = new TakvimiService(extractionService, documentReader, cache, new PageTableCsvService(), properties);
    }

    private static CalendarYear januaryOnly() {
        CalendarYearBuilder builder = new CalendarYearBuilder(2024);
        builder.mergeDay("01", new DayRecord(1, "e hënë", "Viti i Ri", PrayerTimes.ofOrdered(
                List.of("05:21", "06:10", "07:45", "12:30", "15:10", "18:05", "19:30", "13:09"))));
        return builder.build();
    }

    @Test
    void yearMustHaveFourDigits() {
        assertThatThrownBy(() -> service.year("24", false)).isInstanceOf(InvalidYearException.class);
        assertThatThrownBy(() -> service.year("20x4", false)).isInstanceOf(InvalidYearException.class);
    }

    @Test
    void missingPdfIsReported() {
        assertThatThrownBy(() -> service.year("2023", false))
                .isInstanceOf(CalendarPdfNotFoundException.class)
                .hasMessageContaining("2023");
    }

    @Test
    void extractedYearIsCachedAndServedFromCacheOnRequest() throws IOException {
        given(extractionService.extract(document, 2024)).willReturn(januaryOnly());

        YearCalendarResult extracted = service.year("2024", false);
        YearCalendarResult cached = service.year("2024", true);

        assertThat(extracted.message()).isNull();
        assertThat(cached.data()).isEqualTo(extracted.data());
        assertThat(workDir.resolve("json/2024.json")).exists();
        assertThat(workDir.resolve("json/2024/01.json")).exists();
        assertThat(workDir.resolve("json/2024/02.json")).doesNotExist();
        verify(extractionService, times(1)).extract(document, 2024);
        verify(document).close();
    }

    @Test
    void cacheIsIgnoredUnlessRequested() {
        given(extractionService.extract(document, 2024)).willReturn(januaryOnly());

        service.year("2024", false);
        service.year("2024", false);

        verify(extractionService, times(2)).extract(document, 2024);
    }

    @Test
    void emptyExtractionCarriesAMessageAndIsNotCached() {
        given(extractionService.extract(document, 2024)).willReturn(CalendarYear.empty());

        YearCalendarResult result = service.year("2024", false);

        assertThat(result.message()).isEqualTo(TakvimiService.NO_DATA_MESSAGE);
        assertThat(result.data().months()).hasSize(12);
        assertThat(workDir.resolve("json/2024.json")).doesNotExist();
    }

    @Test
    void monthIsPaddedAndServedFromTheCachedYear() {
        given(extractionService.extract(document, 2024)).willReturn(januaryOnly());
        service.year("2024", false);

        MonthCalendarResult january = service.month("2024", "1", true);
        MonthCalendarResult february = service.month("2024", "02", true);

        assertThat(january.month()).isEqualTo("01");
        assertThat(january.data().day("01")).isPresent();
        assertThat(january.message()).isNull();
        assertThat(february.data().isEmpty()).isTrue();
        assertThat(february.message()).contains("02");
        verify(extractionService, times(1)).extract(document, 2024);
    }

    @Test
    void monthWithoutCacheRunsTheExtraction() {
        given(extractionService.extract(document, 2024)).willReturn(januaryOnly());

        MonthCalendarResult january = service.month("2024", "01", false);

        assertThat(january.data().size()).isEqualTo(1);
        verify(extractionService).extract(document, 2024);
    }

    @Test
    void monthOutsideTheYearIsRejected() {
        assertThatThrownBy(() -> service.month("2024", "13", true)).isInstanceOf(InvalidMonthException.class);
        assertThatThrownBy(() -> service.month("2024", "0", true)).isInstanceOf(InvalidMonthException.class);
        assertThatThrownBy(() -> service.month("2024", "mars", true)).isInstanceOf(InvalidMonthException.class);
        verify(extractionService, never()).extract(any(), anyInt());
    }

    @Test
    void pageWithoutTableIsReportedWithItsText() {
        given(extractionService.extractPageTable(document, 3)).willReturn(PageTableExport.noTable("Parathënie"));

        assertThatThrownBy(() -> service.pageCsv("2024", 4))
                .isInstanceOf(PageTableUnavailableException.class)
                .hasMessage("Parathënie");
    }

    @Test
    void pageTableIsRenderedAsCsv() {
        given(extractionService.extractPageTable(eq(document), eq(0)))
                .willReturn(PageTableExport.table(List.of(List.of("Data", "Dita"), List.of("1", "e hënë"))));

        assertThat(service.pageCsv("2024", 1)).isEqualTo("Data,Dita\n1,e hënë\n");
    }

    @Test
    void listingShowsPdfsAndCachedYears() {
        given(extractionService.extract(document, 2024)).willReturn(januaryOnly());
        service.year("2024", false);

        AvailableCalendars calendars = service.listCalendars();

        assertThat(calendars.availableYears()).containsExactly("2024");
        assertThat(calendars.availableFiles()).containsExactly("takvimi2024.pdf");
        assertThat(calendars.processedYears()).containsExactly("2024");
        assertThat(calendars.processedMonths()).containsEntry("2024", List.of("01"));
        assertThat(calendars.cachingInfo()).isNotBlank();
    }

    @Test
    void listingFailsWithoutPdfDirectory() throws IOException {
        Files.delete(pdfDir.resolve("takvimi2024.pdf"));
        Files.delete(pdfDir.resolve("notes.txt"));
        Files.delete(pdfDir);

        assertThatThrownBy(() -> service.listCalendars()).isInstanceOf(PdfDirectoryNotFoundException.class);
    }
}
