package com.takvimi.application.parsing;

import com.takvimi.domain.model.PrayerTimes;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fully regular layout: day, weekday, secondary-calendar day, festival text, then eight contiguous times.
 * The weekday is read from the row, including the Albanian article ("e hënë").
 */
public class FixedSchemaRowParser implements RowParser {

    private static final String T = "(" + TimeTokens.TIME_REGEX + ")";
    private static final Pattern PATTERN = Pattern.compile(
            "^\\s*(\\d{1,2})\\s+((?:e\\s+)?[^\\s\\d]+)\\s+(\\d{1,2})\\s+(?:(.*?)\\s+)?"
                    + T + "\\s+" + T + "\\s+" + T + "\\s+" + T + "\\s+"
                    + T + "\\s+" + T + "\\s+" + T + "\\s+" + T + "(?!\\d)");

    @Override
    public String name() {
        return "fixed-schema";
    }

    @Override
    public Optional<DayCandidate> tryParse(RowInput input, RowContext context) {
        Matcher matcher = PATTERN.matcher(input.text());
        if (!matcher.find()) {
            return Optional.empty();
        }
        Optional<Integer> day = RowParser.parseDay(matcher.group(1));
        if (day.isEmpty()) {
            return Optional.empty();
        }
        List<String> times = new ArrayList<>(8);
        for (int group = 5; group <= 12; group++) {
            times.add(matcher.group(group));
        }
        String festival = matcher.group(4) == null ? "" : matcher.group(4).strip();
        return Optional.of(new DayCandidate(day.get(), matcher.group(2).strip(), festival,
                PrayerTimes.ofOrdered(times), name()));
    }
}
