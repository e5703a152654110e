package com.takvimi.application.parsing;

import com.takvimi.domain.model.PrayerTimes;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Day and secondary-calendar day separated by arbitrary non-digits, festival text, six times, then a
 * trailing segment holding nightfall and, when printed, the day length. The weekday is computed from the date.
 */
public class LooselyDelimitedRowParser implements RowParser {

    private static final String T = "(" + TimeTokens.TIME_REGEX + ")";
    private static final Pattern PATTERN = Pattern.compile(
            "^\\s*(\\d{1,2})(?![\\d:])[^\\d]+(\\d{1,2})(?![\\d:])[^\\d]+?(.*?)"
                    + T + "\\s+" + T + "\\s+" + T + "\\s+" + T + "\\s+" + T + "\\s+" + T
                    + "(.*)$");

    @Override
    public String name() {
        return "loosely-delimited";
    }

    @Override
    public Optional<DayCandidate> tryParse(RowInput input, RowContext context) {
        Matcher matcher = PATTERN.matcher(input.text());
        if (!matcher.find()) {
            return Optional.empty();
        }
        List<String> trailing = TimeTokens.all(matcher.group(10));
        if (trailing.isEmpty()) {
            return Optional.empty();
        }
        Optional<Integer> day = RowParser.parseDay(matcher.group(1));
        if (day.isEmpty()) {
            return Optional.empty();
        }
        List<String> times = new ArrayList<>(8);
        for (int group = 4; group <= 9; group++) {
            times.add(matcher.group(group));
        }
        times.add(trailing.get(0));
        times.add(trailing.size() > 1 ? trailing.get(1) : "");
        return Optional.of(new DayCandidate(day.get(), context.weekdayOf(day.get()),
                FestivalText.clean(matcher.group(3)), PrayerTimes.ofOrdered(times), name()));
    }
}
