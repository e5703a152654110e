package com.takvimi.application.parsing;

import com.takvimi.domain.model.PrayerTimes;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Last resort: a leading day number plus at least seven times anywhere in the line, taken in reading order.
 * Festival text is not recoverable at this level and stays empty.
 */
public class BruteForceRowParser implements RowParser {

    private static final Pattern LEADING_DAY = Pattern.compile("^\\s*(\\d+)(?![\\d:])");
    private static final int MIN_TIMES = 7;

    @Override
    public String name() {
        return "brute-force";
    }

    @Override
    public Optional<DayCandidate> tryParse(RowInput input, RowContext context) {
        Matcher matcher = LEADING_DAY.matcher(input.text());
        if (!matcher.find()) {
            return Optional.empty();
        }
        List<String> times = TimeTokens.all(input.text());
        if (times.size() < MIN_TIMES) {
            return Optional.empty();
        }
        return RowParser.parseDay(matcher.group(1))
                .map(day -> new DayCandidate(day, context.weekdayOf(day), "",
                        PrayerTimes.ofOrdered(times.subList(0, Math.min(times.size(), 8))), name()));
    }
}
