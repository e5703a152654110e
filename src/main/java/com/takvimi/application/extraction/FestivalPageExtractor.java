package com.takvimi.application.extraction;

import com.takvimi.application.parsing.RowContext;
import com.takvimi.domain.document.DetectedTable;
import com.takvimi.domain.model.CalendarYearBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Reads the festival page of a month: tables of at least four columns with the day number in the first
 * column and the festival text in the fourth. The first row is the header. Only the festival field of a day
 * is written.
 */
@Component
public class FestivalPageExtractor {

    private static final Logger log = LoggerFactory.getLogger(FestivalPageExtractor.class);

    private static final int MIN_COLUMNS = 4;
    private static final int FESTIVAL_COLUMN = 3;

    /**
     * @param tables  tables of the festival page
     * @param context year and month of the page
     * @param builder year under construction
     * @return number of days that received a festival text
     */
    public int extract(List<DetectedTable> tables, RowContext context, CalendarYearBuilder builder) {
        int written = 0;
        for (DetectedTable table : tables == null ? List.<DetectedTable>of() : tables) {
            for (List<String> row : table.dataRows()) {
                try {
                    if (applyRow(row, context, builder)) {
                        written++;
                    }
                } catch (RuntimeException ex) {
                    log.warn("Skipping festival row {} for month {}: {}", row, context.monthCode(), ex.getMessage());
                }
            }
        }
        log.debug("Month {}: {} festival annotations", context.monthCode(), written);
        return written;
    }

    private boolean applyRow(List<String> row, RowContext context, CalendarYearBuilder builder) {
        if (row == null || row.size() < MIN_COLUMNS) {
            return false;
        }
        Optional<Integer> day = TableCells.firstNumber(TableCells.cell(row, 0));
        String festival = TableCells.cell(row, FESTIVAL_COLUMN);
        if (day.isEmpty() || festival.isEmpty()) {
            return false;
        }
        return builder.putFestival(context.monthCode(), day.get(), festival);
    }
}
