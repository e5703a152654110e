package com.takvimi.application.extraction;

import com.takvimi.application.parsing.DayCandidate;
import com.takvimi.application.parsing.RowContext;
import com.takvimi.application.parsing.RowInput;
import com.takvimi.application.parsing.RowParserCascade;
import com.takvimi.domain.document.DetectedTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads the daily times of one page.
 * <ol>
 *     <li>Tables whose header names a time column go through {@link HeaderKeywordTableExtractor}.</li>
 *     <li>Other tables are read row by row with {@link FixedOffsetTableExtractor}; rows it refuses are
 *     handed to the {@link RowParserCascade}.</li>
 *     <li>When the tables yield nothing, the page text is scanned line by line.</li>
 * </ol>
 */
@Component
public class PrayerTimesPageExtractor {

    private static final Logger log = LoggerFactory.getLogger(PrayerTimesPageExtractor.class);

    private final HeaderKeywordTableExtractor headerKeywordExtractor;
    private final FixedOffsetTableExtractor fixedOffsetExtractor;
    private final RowParserCascade cascade;
    private final TextLineExtractor textLineExtractor;

    public PrayerTimesPageExtractor(HeaderKeywordTableExtractor headerKeywordExtractor,
                                    FixedOffsetTableExtractor fixedOffsetExtractor,
                                    RowParserCascade cascade,
                                    TextLineExtractor textLineExtractor) {
        this.headerKeywordExtractor = headerKeywordExtractor;
        this.fixedOffsetExtractor = fixedOffsetExtractor;
        this.cascade = cascade;
        this.textLineExtractor = textLineExtractor;
    }

    /**
     * @param tables   tables detected on the page
     * @param pageText raw page text
     * @param context  year and month the page belongs to
     * @return candidates in reading order; later candidates for the same day supersede earlier ones
     */
    public List<DayCandidate> extract(List<DetectedTable> tables, String pageText, RowContext context) {
        List<DayCandidate> candidates = new ArrayList<>();
        for (DetectedTable table : tables == null ? List.<DetectedTable>of() : tables) {
            if (table.rowCount() <= 1) {
                continue;
            }
            if (headerKeywordExtractor.accepts(table)) {
                candidates.addAll(headerKeywordExtractor.extract(table, context));
            } else {
                candidates.addAll(extractByPosition(table, context));
            }
        }
        if (candidates.isEmpty()) {
            candidates.addAll(textLineExtractor.extract(pageText, context));
            if (!candidates.isEmpty()) {
                log.debug("Month {}: tables yielded nothing, read {} days from the page text",
                        context.monthCode(), candidates.size());
            }
        }
        return candidates;
    }

    private List<DayCandidate> extractByPosition(DetectedTable table, RowContext context) {
        List<DayCandidate> candidates = new ArrayList<>();
        for (List<String> row : table.dataRows()) {
            try {
                Optional<DayCandidate> candidate = fixedOffsetExtractor.parseRow(row, context);
                if (candidate.isEmpty()) {
                    candidate = cascade.parse(RowInput.ofCells(row), context);
                }
                candidate.ifPresent(candidates::add);
            } catch (RuntimeException ex) {
                log.warn("Skipping unreadable row {} for month {}: {}", row, context.monthCode(), ex.getMessage());
            }
        }
        return candidates;
    }
}
