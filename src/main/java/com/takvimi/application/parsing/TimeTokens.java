package com.takvimi.application.parsing;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds {@code H:MM} / {@code HH:MM} tokens in free text. Values are returned verbatim; hour and minute
 * ranges are not validated.
 */
public final class TimeTokens {

    public static final String TIME_REGEX = "\\d{1,2}:\\d{2}";

    private static final Pattern TIME_PATTERN = Pattern.compile("(?<!\\d)" + TIME_REGEX + "(?!\\d)");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TimeTokens() {
    }

    public static Optional<String> first(String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        Matcher matcher = TIME_PATTERN.matcher(text);
        return matcher.find() ? Optional.of(matcher.group()) : Optional.empty();
    }

    /**
     * @return the first token of {@code text}, or an empty string
     */
    public static String firstOrEmpty(String text) {
        return first(text).orElse("");
    }

    /**
     * @return every token of {@code text} in reading order
     */
    public static List<String> all(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return tokens;
        }
        Matcher matcher = TIME_PATTERN.matcher(text);
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        return tokens;
    }

    public static boolean containsTime(String text) {
        return first(text).isPresent();
    }

    /**
     * Removes time tokens from a free-text fragment and collapses the remaining whitespace.
     */
    public static String stripTimes(String text) {
        if (text == null) {
            return "";
        }
        String withoutTimes = TIME_PATTERN.matcher(text).replaceAll(" ");
        return WHITESPACE.matcher(withoutTimes).replaceAll(" ").strip();
    }
}
