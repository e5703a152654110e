package com.takvimi.application.extraction;

import com.takvimi.application.parsing.DayCandidate;
import com.takvimi.application.parsing.RowContext;
import com.takvimi.application.parsing.TimeTokens;
import com.takvimi.domain.document.DetectedTable;
import com.takvimi.domain.model.PrayerTimes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Reads tables whose header row names at least one of the daily times. Each data row is read from the
 * cells that hold a time, with any text between the secondary-calendar column and the first time kept as
 * festival text; rows with fewer than seven such cells fall back to fixed column offsets.
 */
@Component
public class HeaderKeywordTableExtractor {

    private static final Logger log = LoggerFactory.getLogger(HeaderKeywordTableExtractor.class);

    static final List<String> HEADER_KEYWORDS = List.of("imsak", "sabah", "dreka", "ikindia", "akshami", "jacia");

    private static final int MIN_TIME_CELLS = 7;
    private static final int TIME_COLUMN_OFFSET = 3;
    private static final int FESTIVAL_FROM_COLUMN = 3;

    /**
     * @param table detected table
     * @return {@code true} when the header row mentions one of the time names
     */
    public boolean accepts(DetectedTable table) {
        if (table == null || table.rowCount() <= 1) {
            return false;
        }
        String header = String.join(" ", table.header()).toLowerCase(Locale.ROOT);
        return HEADER_KEYWORDS.stream().anyMatch(header::contains);
    }

    /**
     * Extracts every readable data row of an accepted table.
     *
     * @param table   table whose header passed {@link #accepts(DetectedTable)}
     * @param context year and month of the page
     * @return candidates in row order
     */
    public List<DayCandidate> extract(DetectedTable table, RowContext context) {
        List<DayCandidate> candidates = new ArrayList<>();
        for (List<String> row : table.dataRows()) {
            try {
                parseRow(row, context).ifPresent(candidates::add);
            } catch (RuntimeException ex) {
                log.warn("Skipping unreadable row {} for month {}: {}", row, context.monthCode(), ex.getMessage());
            }
        }
        log.debug("Header-keyword table produced {} days for month {}", candidates.size(), context.monthCode());
        return candidates;
    }

    Optional<DayCandidate> parseRow(List<String> row, RowContext context) {
        if (row == null || row.isEmpty()) {
            return Optional.empty();
        }
        Optional<Integer> day = TableCells.firstNumber(TableCells.cell(row, 0));
        if (day.isEmpty() || !context.isValidDay(day.get())) {
            return Optional.empty();
        }

        List<Integer> timeColumns = new ArrayList<>();
        for (int i = 0; i < row.size(); i++) {
            if (TimeTokens.containsTime(TableCells.cell(row, i))) {
                timeColumns.add(i);
            }
        }

        List<String> times = new ArrayList<>(8);
        String festival = "";
        if (timeColumns.size() >= MIN_TIME_CELLS) {
            festival = festivalBetween(row, timeColumns.get(0));
            for (int i = 0; i < MIN_TIME_CELLS; i++) {
                times.add(TimeTokens.firstOrEmpty(TableCells.cell(row, timeColumns.get(i))));
            }
            times.add(timeColumns.size() > MIN_TIME_CELLS
                    ? TimeTokens.firstOrEmpty(TableCells.cell(row, timeColumns.get(MIN_TIME_CELLS)))
                    : "");
        } else {
            for (int i = 0; i < MIN_TIME_CELLS; i++) {
                times.add(TimeTokens.firstOrEmpty(TableCells.cell(row, TIME_COLUMN_OFFSET + i)));
            }
            times.add(row.size() > TIME_COLUMN_OFFSET + MIN_TIME_CELLS
                    ? TimeTokens.firstOrEmpty(TableCells.cell(row, row.size() - 1))
                    : "");
        }

        PrayerTimes prayerTimes = PrayerTimes.ofOrdered(times);
        if (prayerTimes.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new DayCandidate(day.get(), TableCells.cell(row, 1), festival, prayerTimes, "header-keyword"));
    }

    // Text cells after the secondary-calendar column and before the first time.
    private static String festivalBetween(List<String> row, int firstTimeColumn) {
        List<String> parts = new ArrayList<>();
        for (int i = FESTIVAL_FROM_COLUMN; i < firstTimeColumn; i++) {
            String cell = TableCells.cell(row, i);
            if (!cell.isEmpty()) {
                parts.add(cell);
            }
        }
        return String.join(" ", parts);
    }
}
