package com.takvimi.interfaces.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.takvimi.application.service.CalendarExtractionService;
import com.takvimi.domain.document.CalendarDocument;
import com.takvimi.domain.document.CalendarDocumentReader;
import com.takvimi.domain.exception.CalendarPdfNotFoundException;
import com.takvimi.domain.exception.InvalidYearException;
import com.takvimi.domain.model.CalendarDates;
import com.takvimi.domain.model.CalendarYear;
import com.takvimi.domain.model.YearCalendarResult;
import com.takvimi.infrastructure.exception.CalendarCacheException;
import com.takvimi.infrastructure.exception.DocumentUnreadableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * Extracts one PDF and writes {@code extracted_data_<YEAR>.json} without going through the HTTP layer.
 */
@Component
public class CalendarExtractionCommand {

    private static final Logger log = LoggerFactory.getLogger(CalendarExtractionCommand.class);
    private static final Pattern YEAR = Pattern.compile("^\\d{4}$");

    private final CalendarDocumentReader documentReader;
    private final CalendarExtractionService extractionService;
    private final ObjectMapper objectMapper;

    public CalendarExtractionCommand(CalendarDocumentReader documentReader,
                                     CalendarExtractionService extractionService,
                                     ObjectMapper objectMapper) {
        this.documentReader = documentReader;
        this.extractionService = extractionService;
        this.objectMapper = objectMapper;
    }

    /**
     * @param pdf       calendar PDF
     * @param year      four-digit year the PDF describes
     * @param outputDir directory the result file is written to
     * @return the written file
     */
    public Path run(Path pdf, String year, Path outputDir) {
        if (year == null || !YEAR.matcher(year).matches()) {
            throw new InvalidYearException(year);
        }
        if (!Files.isRegularFile(pdf)) {
            throw new CalendarPdfNotFoundException(year);
        }
        log.info("Extracting {} from {}", year, pdf.toAbsolutePath());
        CalendarYear data;
        try (CalendarDocument document = documentReader.open(pdf)) {
            data = extractionService.extract(document, Integer.parseInt(year));
        } catch (IOException e) {
            throw new DocumentUnreadableException("Unable to close the PDF at " + pdf, e);
        }

        for (String monthCode : CalendarDates.MONTH_CODES) {
            log.info("Month {}: {} days", monthCode, data.month(monthCode).size());
        }

        Path output = outputDir.resolve("extracted_data_" + year + ".json");
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(output.toFile(), YearCalendarResult.of(year, data));
        } catch (IOException e) {
            throw new CalendarCacheException("Unable to write " + output, e);
        }
        log.info("Wrote {} days to {}", data.totalDays(), output.toAbsolutePath());
        return output;
    }
}
