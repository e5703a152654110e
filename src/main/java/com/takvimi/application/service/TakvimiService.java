package com.takvimi.application.service;

import com.takvimi.application.exception.PageTableUnavailableException;
import com.takvimi.config.TakvimiProperties;
import com.takvimi.domain.document.CalendarDocument;
import com.takvimi.domain.document.CalendarDocumentReader;
import com.takvimi.domain.exception.CalendarPdfNotFoundException;
import com.takvimi.domain.exception.InvalidMonthException;
import com.takvimi.domain.exception.InvalidYearException;
import com.takvimi.domain.exception.PdfDirectoryNotFoundException;
import com.takvimi.domain.model.AvailableCalendars;
import com.takvimi.domain.model.CalendarDates;
import com.takvimi.domain.model.CalendarYear;
import com.takvimi.domain.model.MonthBucket;
import com.takvimi.domain.model.MonthCalendarResult;
import com.takvimi.domain.model.PageTableExport;
import com.takvimi.domain.model.YearCalendarResult;
import com.takvimi.infrastructure.cache.JsonCalendarCache;
import com.takvimi.infrastructure.exception.DocumentUnreadableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Application service behind the HTTP endpoints: validates calendar references, consults the cache and
 * runs the extraction against {@code takvimi<YEAR>.pdf}.
 */
@Service
public class TakvimiService {

    private static final Logger log = LoggerFactory.getLogger(TakvimiService.class);

    static final String CACHING_INFO =
            "Add ?use_cache=true to serve previously extracted data; otherwise the PDF is processed again.";
    static final String NO_DATA_MESSAGE = "No data could be extracted from the PDF.";

    private static final Pattern YEAR = Pattern.compile("^\\d{4}$");
    private static final Pattern MONTH = Pattern.compile("^\\d{1,2}$");
    private static final Pattern PDF_FILE = Pattern.compile("^takvimi(\\d{4})\\.pdf$");

    private final CalendarExtractionService extractionService;
    private final CalendarDocumentReader documentReader;
    private final JsonCalendarCache cache;
    private final PageTableCsvService csvService;
    private final Path pdfDir;

    public TakvimiService(CalendarExtractionService extractionService,
                          CalendarDocumentReader documentReader,
                          JsonCalendarCache cache,
                          PageTableCsvService csvService,
                          TakvimiProperties properties) {
        this.extractionService = extractionService;
        this.documentReader = documentReader;
        this.cache = cache;
        this.csvService = csvService;
        this.pdfDir = properties.pdfPath();
    }

    /**
     * Lists the PDFs on disk and what has already been cached.
     *
     * @throws PdfDirectoryNotFoundException when the PDF directory is missing
     */
    public AvailableCalendars listCalendars() {
        if (!Files.isDirectory(pdfDir)) {
            throw new PdfDirectoryNotFoundException(pdfDir.toString());
        }
        List<String> files = new ArrayList<>();
        List<String> years = new ArrayList<>();
        try (Stream<Path> entries = Files.list(pdfDir)) {
            entries.map(path -> path.getFileName().toString())
                    .sorted()
                    .forEach(name -> {
                        Matcher matcher = PDF_FILE.matcher(name);
                        if (matcher.matches()) {
                            files.add(name);
                            years.add(matcher.group(1));
                        }
                    });
        } catch (IOException e) {
            throw new DocumentUnreadableException("Unable to list the PDF directory " + pdfDir, e);
        }
        return new AvailableCalendars(years, cache.processedYears(), cache.processedMonths(), files, CACHING_INFO);
    }

    /**
     * Returns a full year, from the cache when allowed and present, otherwise by extracting the PDF.
     *
     * @param year     four-digit year
     * @param useCache whether a cached result may be served
     * @return the year, with a message when nothing could be extracted
     */
    public YearCalendarResult year(String year, boolean useCache) {
        String validYear = validateYear(year);
        if (useCache) {
            Optional<YearCalendarResult> cached = cache.findYear(validYear);
            if (cached.isPresent()) {
                log.debug("Serving {} from the cache", validYear);
                return cached.get();
            }
        }
        CalendarYear data = extractAndCache(validYear);
        return data.hasNoDays()
                ? new YearCalendarResult(validYear, data, NO_DATA_MESSAGE)
                : YearCalendarResult.of(validYear, data);
    }

    /**
     * Returns one month. Lookup order with the cache enabled: month file, year file, extraction.
     *
     * @param year     four-digit year
     * @param month    month number, with or without a leading zero
     * @param useCache whether cached results may be served
     * @return the month, with a message when it holds no day
     */
    public MonthCalendarResult month(String year, String month, boolean useCache) {
        String validYear = validateYear(year);
        String monthCode = normalizeMonth(month);
        if (useCache) {
            Optional<MonthCalendarResult> cachedMonth = cache.findMonth(validYear, monthCode);
            if (cachedMonth.isPresent()) {
                return cachedMonth.get();
            }
            Optional<YearCalendarResult> cachedYear = cache.findYear(validYear);
            if (cachedYear.isPresent() && cachedYear.get().data() != null) {
                return toMonthResult(validYear, monthCode, cachedYear.get().data().month(monthCode));
            }
        }
        CalendarYear data = extractAndCache(validYear);
        return toMonthResult(validYear, monthCode, data.month(monthCode));
    }

    /**
     * Exports the first table of a page as CSV.
     *
     * @param year four-digit year
     * @param page 1-based page number
     * @return CSV content
     * @throws PageTableUnavailableException when the page has no table; the message explains why
     */
    public String pageCsv(String year, int page) {
        String validYear = validateYear(year);
        Path pdf = requirePdf(validYear);
        try (CalendarDocument document = documentReader.open(pdf)) {
            PageTableExport export = extractionService.extractPageTable(document, page - 1);
            if (!export.hasTable()) {
                throw new PageTableUnavailableException(page, export.message());
            }
            return csvService.toCsv(export.rows());
        } catch (IOException e) {
            throw new DocumentUnreadableException("Unable to close the PDF at " + pdf, e);
        }
    }

    static String normalizeMonth(String month) {
        if (month == null || !MONTH.matcher(month).matches()) {
            throw new InvalidMonthException(month);
        }
        int value = Integer.parseInt(month);
        if (value < 1 || value > 12) {
            throw new InvalidMonthException(month);
        }
        return CalendarDates.monthCode(value);
    }

    static String validateYear(String year) {
        if (year == null || !YEAR.matcher(year).matches()) {
            throw new InvalidYearException(year);
        }
        return year;
    }

    private CalendarYear extractAndCache(String year) {
        Path pdf = requirePdf(year);
        CalendarYear data;
        try (CalendarDocument document = documentReader.open(pdf)) {
            data = extractionService.extract(document, Integer.parseInt(year));
        } catch (IOException e) {
            throw new DocumentUnreadableException("Unable to close the PDF at " + pdf, e);
        }
        cache.saveCalendar(year, data);
        return data;
    }

    private Path requirePdf(String year) {
        Path pdf = pdfDir.resolve("takvimi" + year + ".pdf");
        if (!Files.isRegularFile(pdf)) {
            throw new CalendarPdfNotFoundException(year);
        }
        return pdf;
    }

    private MonthCalendarResult toMonthResult(String year, String monthCode, MonthBucket bucket) {
        MonthBucket data = bucket == null ? MonthBucket.empty() : bucket;
        if (data.isEmpty()) {
            return new MonthCalendarResult(year, monthCode, data, "No data found for month " + monthCode + ".");
        }
        return MonthCalendarResult.of(year, monthCode, data);
    }
}
