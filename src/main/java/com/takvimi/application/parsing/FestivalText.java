package com.takvimi.application.parsing;

import com.takvimi.domain.model.CalendarDates;

import java.util.Locale;

/**
 * Cleans the free-text festival fragment captured by the tolerant strategies.
 * Time tokens are removed and a leading weekday name is dropped; what remains is trimmed.
 */
final class FestivalText {

    private FestivalText() {
    }

    static String clean(String fragment) {
        String text = TimeTokens.stripTimes(fragment);
        String lower = text.toLowerCase(Locale.ROOT);
        for (String weekday : CalendarDates.WEEKDAY_NAMES) {
            if (lower.equals(weekday)) {
                return "";
            }
            if (lower.startsWith(weekday + " ")) {
                return text.substring(weekday.length()).strip();
            }
        }
        return text;
    }
}
