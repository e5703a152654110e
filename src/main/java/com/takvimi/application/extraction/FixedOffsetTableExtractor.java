package com.takvimi.application.extraction;

import com.takvimi.application.parsing.DayCandidate;
import com.takvimi.application.parsing.RowContext;
import com.takvimi.application.parsing.TimeTokens;
import com.takvimi.domain.model.PrayerTimes;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Rigid column schema: day, weekday, secondary-calendar day, festival, then the eight times. Rows whose
 * cells are shifted against that schema are refused and left to the row cascade.
 */
@Component
public class FixedOffsetTableExtractor {

    private static final Pattern DAY_CELL = Pattern.compile("^\\d+$");
    private static final int MIN_COLUMNS = 7;
    private static final int FESTIVAL_COLUMN = 3;
    private static final int FIRST_TIME_COLUMN = 4;

    /**
     * Reads one data row by position.
     *
     * @param row     cells of the row
     * @param context year and month of the page
     * @return candidate, or empty when the row does not follow the schema
     */
    public Optional<DayCandidate> parseRow(List<String> row, RowContext context) {
        if (row == null || row.size() < MIN_COLUMNS) {
            return Optional.empty();
        }
        String dayCell = TableCells.cell(row, 0);
        if (!DAY_CELL.matcher(dayCell).matches()) {
            return Optional.empty();
        }
        Optional<Integer> day = TableCells.firstNumber(dayCell);
        if (day.isEmpty() || !context.isValidDay(day.get())) {
            return Optional.empty();
        }
        // A row without festival has no empty cell for it, so its times start one column early.
        if (TimeTokens.containsTime(TableCells.cell(row, FESTIVAL_COLUMN))
                || !TimeTokens.containsTime(TableCells.cell(row, FIRST_TIME_COLUMN))) {
            return Optional.empty();
        }
        List<String> times = new ArrayList<>(8);
        for (int i = 0; i < 8; i++) {
            times.add(TimeTokens.firstOrEmpty(TableCells.cell(row, FIRST_TIME_COLUMN + i)));
        }
        PrayerTimes prayerTimes = PrayerTimes.ofOrdered(times);
        if (prayerTimes.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new DayCandidate(day.get(), TableCells.cell(row, 1),
                TableCells.cell(row, FESTIVAL_COLUMN), prayerTimes, "fixed-offset"));
    }
}
