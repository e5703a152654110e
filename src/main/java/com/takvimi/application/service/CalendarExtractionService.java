package com.takvimi.application.service;

import com.takvimi.application.extraction.CalendarOverlays;
import com.takvimi.application.extraction.FestivalPageExtractor;
import com.takvimi.application.extraction.PrayerTimesPageExtractor;
import com.takvimi.application.parsing.DayCandidate;
import com.takvimi.application.parsing.MonthResolver;
import com.takvimi.application.parsing.RowContext;
import com.takvimi.config.TakvimiProperties;
import com.takvimi.domain.document.CalendarDocument;
import com.takvimi.domain.document.DetectedTable;
import com.takvimi.domain.model.CalendarDates;
import com.takvimi.domain.model.CalendarOverrides;
import com.takvimi.domain.model.CalendarYear;
import com.takvimi.domain.model.CalendarYearBuilder;
import com.takvimi.domain.model.PageTableExport;
import com.takvimi.infrastructure.exception.DocumentUnreadableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Application service that turns an opened calendar document into a {@link CalendarYear}.
 * <p>
 * A run goes through fixed stages:
 * <ol>
 *     <li>per-month pass: each month's festival page and prayer-times page are read at the positions given
 *     by {@link TakvimiProperties.Layout};</li>
 *     <li>gap fill: months that are still empty are searched on every page whose text names that month;</li>
 *     <li>known holidays are merged into the festival text;</li>
 *     <li>manual time corrections are applied.</li>
 * </ol>
 * A page or row that cannot be interpreted is logged and skipped. Only a document that cannot be read
 * aborts the run, with {@link DocumentUnreadableException}.
 */
@Service
public class CalendarExtractionService {

    private static final Logger log = LoggerFactory.getLogger(CalendarExtractionService.class);

    private final MonthResolver monthResolver;
    private final FestivalPageExtractor festivalPageExtractor;
    private final PrayerTimesPageExtractor prayerTimesPageExtractor;
    private final CalendarOverlays overlays;
    private final CalendarOverridesProvider overridesProvider;
    private final TakvimiProperties.Layout layout;

    public CalendarExtractionService(MonthResolver monthResolver,
                                     FestivalPageExtractor festivalPageExtractor,
                                     PrayerTimesPageExtractor prayerTimesPageExtractor,
                                     CalendarOverlays overlays,
                                     CalendarOverridesProvider overridesProvider,
                                     TakvimiProperties properties) {
        this.monthResolver = monthResolver;
        this.festivalPageExtractor = festivalPageExtractor;
        this.prayerTimesPageExtractor = prayerTimesPageExtractor;
        this.overlays = overlays;
        this.overridesProvider = overridesProvider;
        this.layout = properties.layout();
    }

    /**
     * Extracts a year using the overrides registered for it.
     *
     * @param document opened calendar document; not closed by this method
     * @param year     calendar year the document describes
     * @return the year, always holding all twelve months
     * @throws DocumentUnreadableException when the document cannot be read
     */
    public CalendarYear extract(CalendarDocument document, int year) {
        return extract(document, year, overridesProvider.overridesFor(year));
    }

    /**
     * Extracts a year with explicit holiday and correction tables.
     *
     * @param document  opened calendar document; not closed by this method
     * @param year      calendar year the document describes
     * @param overrides tables applied after extraction
     * @return the year, always holding all twelve months
     * @throws DocumentUnreadableException when the document cannot be read
     */
    public CalendarYear extract(CalendarDocument document, int year, CalendarOverrides overrides) {
        CalendarYearBuilder builder = new CalendarYearBuilder(year);
        PageReader pages = new PageReader(document);
        int pageCount = document.pageCount();
        log.info("Extracting calendar {} from {} pages", year, pageCount);

        perMonthPass(pages, pageCount, builder);
        gapFillPass(pages, pageCount, builder);

        CalendarOverrides tables = overrides == null ? CalendarOverrides.none() : overrides;
        int merged = overlays.mergeFestivals(builder, tables.holidays());
        int corrected = overlays.applyCorrections(builder, tables.corrections());

        CalendarYear result = builder.build();
        log.info("Calendar {} extracted: {} days, {} holidays merged, {} corrections applied, empty months {}",
                year, result.totalDays(), merged, corrected, builder.emptyMonths());
        return result;
    }

    /**
     * Exports the first table detected on a page.
     *
     * @param document  opened calendar document
     * @param pageIndex 0-based page index
     * @return the table rows, or a message: {@code "Invalid page number"}, the page text when no table was
     * found, or {@code "No tables found on this page"} when the page has no text either
     * @throws DocumentUnreadableException when the page cannot be read
     */
    public PageTableExport extractPageTable(CalendarDocument document, int pageIndex) {
        if (pageIndex < 0 || pageIndex >= document.pageCount()) {
            return PageTableExport.noTable("Invalid page number");
        }
        PageReader pages = new PageReader(document);
        List<DetectedTable> tables = pages.tables(pageIndex);
        if (!tables.isEmpty()) {
            return PageTableExport.table(tables.get(0).rows());
        }
        String text = pages.text(pageIndex);
        return PageTableExport.noTable(text == null || text.isBlank() ? "No tables found on this page" : text);
    }

    private void perMonthPass(PageReader pages, int pageCount, CalendarYearBuilder builder) {
        for (int monthIndex = 0; monthIndex < 12; monthIndex++) {
            String monthCode = CalendarDates.monthCode(monthIndex + 1);
            int festivalPage = layout.festivalPageIndex(monthIndex);
            int prayerPage = layout.prayerTimesPageIndex(monthIndex);
            if (festivalPage >= pageCount || prayerPage >= pageCount) {
                log.debug("Month {}: pages {}/{} are beyond the document", monthCode, festivalPage, prayerPage);
                continue;
            }
            RowContext context = new RowContext(builder.year(), monthCode);

            List<DetectedTable> festivalTables = pages.tables(festivalPage);
            try {
                festivalPageExtractor.extract(festivalTables, context, builder);
            } catch (RuntimeException ex) {
                log.warn("Skipping festival page {} for month {}: {}", festivalPage, monthCode, ex.getMessage());
            }

            List<DetectedTable> prayerTables = pages.tables(prayerPage);
            String prayerText = pages.text(prayerPage);
            int written = writeCandidates(builder, monthCode,
                    () -> prayerTimesPageExtractor.extract(prayerTables, prayerText, context), prayerPage);
            log.debug("Month {}: {} days from page {}", monthCode, written, prayerPage);
        }
    }

    private void gapFillPass(PageReader pages, int pageCount, CalendarYearBuilder builder) {
        Set<String> missing = new HashSet<>(builder.emptyMonths());
        if (missing.isEmpty()) {
            return;
        }
        log.info("Searching all pages for months without data: {}", builder.emptyMonths());
        for (int pageIndex = 0; pageIndex < pageCount; pageIndex++) {
            String text = pages.text(pageIndex);
            Optional<String> month = monthResolver.detectByName(text);
            if (month.isEmpty()) {
                log.debug("Page {}: no month name in the text, skipped", pageIndex);
                continue;
            }
            if (!missing.contains(month.get())) {
                continue;
            }
            String monthCode = month.get();
            RowContext context = new RowContext(builder.year(), monthCode);
            List<DetectedTable> tables = pages.tables(pageIndex);
            int written = writeCandidates(builder, monthCode,
                    () -> prayerTimesPageExtractor.extract(tables, text, context), pageIndex);
            if (written > 0) {
                log.info("Month {}: recovered {} days from page {}", monthCode, written, pageIndex);
            }
        }
    }

    private int writeCandidates(CalendarYearBuilder builder, String monthCode,
                                CandidateSource source, int pageIndex) {
        List<DayCandidate> candidates;
        try {
            candidates = source.candidates();
        } catch (RuntimeException ex) {
            log.warn("Skipping page {} for month {}: {}", pageIndex, monthCode, ex.getMessage());
            return 0;
        }
        int written = 0;
        for (DayCandidate candidate : candidates) {
            if (builder.mergeDay(monthCode, candidate.toRecord())) {
                written++;
            } else {
                log.debug("Rejected day {} for month {} from page {}", candidate.day(), monthCode, pageIndex);
            }
        }
        return written;
    }

    @FunctionalInterface
    private interface CandidateSource {
        List<DayCandidate> candidates();
    }

    /**
     * Reads pages once per run and turns backend failures into {@link DocumentUnreadableException}.
     */
    private static final class PageReader {

        private final CalendarDocument document;
        private final Map<Integer, String> texts = new HashMap<>();
        private final Map<Integer, List<DetectedTable>> tables = new HashMap<>();

        PageReader(CalendarDocument document) {
            this.document = document;
        }

        String text(int pageIndex) {
            String cached = texts.get(pageIndex);
            if (cached != null) {
                return cached;
            }
            try {
                String text = document.pageText(pageIndex);
                texts.put(pageIndex, text == null ? "" : text);
                return texts.get(pageIndex);
            } catch (IOException e) {
                throw new DocumentUnreadableException("Unable to read the text of page " + pageIndex, e);
            }
        }

        List<DetectedTable> tables(int pageIndex) {
            List<DetectedTable> cached = tables.get(pageIndex);
            if (cached != null) {
                return cached;
            }
            try {
                List<DetectedTable> detected = document.pageTables(pageIndex);
                tables.put(pageIndex, detected == null ? List.of() : detected);
                return tables.get(pageIndex);
            } catch (IOException e) {
                throw new DocumentUnreadableException("Unable to read the tables of page " + pageIndex, e);
            }
        }
    }
}
