package com.takvimi.application.parsing;

import com.takvimi.domain.model.PrayerTimes;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tolerant reading of a line that starts with a day number followed by up to eight loosely separated
 * fields. Fields that are present are kept, the rest stay empty; at least one time must be found.
 */
public class PermissivePositionalRowParser implements RowParser {

    private static final String OPTIONAL_TIME = "(?:\\D*(" + TimeTokens.TIME_REGEX + "))?";
    private static final Pattern PATTERN = Pattern.compile(
            "^\\s*(\\d+)(?![\\d:])(?:\\D+?(\\d{1,2})(?![\\d:]))?([^\\d]*)" + OPTIONAL_TIME.repeat(8));

    @Override
    public String name() {
        return "permissive";
    }

    @Override
    public Optional<DayCandidate> tryParse(RowInput input, RowContext context) {
        Matcher matcher = PATTERN.matcher(input.text());
        if (!matcher.find()) {
            return Optional.empty();
        }
        List<String> times = new ArrayList<>(8);
        boolean anyTime = false;
        for (int group = 4; group <= 11; group++) {
            String value = matcher.group(group);
            anyTime |= value != null;
            times.add(value);
        }
        if (!anyTime) {
            return Optional.empty();
        }
        Optional<Integer> day = RowParser.parseDay(matcher.group(1));
        if (day.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new DayCandidate(day.get(), context.weekdayOf(day.get()),
                FestivalText.clean(matcher.group(3)), PrayerTimes.ofOrdered(times), name()));
    }
}
