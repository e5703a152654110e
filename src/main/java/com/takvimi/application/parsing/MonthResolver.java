package com.takvimi.application.parsing;

import com.takvimi.domain.model.CalendarDates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides which month a page belongs to: an explicit month name in the page text wins, otherwise the
 * month is inferred from the page position for the first twelve pages.
 */
@Component
public class MonthResolver {

    private static final Logger log = LoggerFactory.getLogger(MonthResolver.class);

    static final List<String> MONTH_NAMES = List.of(
            "janar", "shkurt", "mars", "prill", "maj", "qershor",
            "korrik", "gusht", "shtator", "tetor", "nëntor", "dhjetor");

    private static final Pattern MONTH_NAME_PATTERN = Pattern.compile(
            "\\b(" + String.join("|", MONTH_NAMES) + ")\\b",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS);

    /**
     * Resolves the month of a page.
     *
     * @param pageText  raw page text (may be {@code null})
     * @param pageIndex 0-based page index
     * @return two-digit month code, or empty when the page is unresolved
     */
    public Optional<String> resolve(String pageText, int pageIndex) {
        Optional<String> explicit = detectByName(pageText);
        if (explicit.isPresent()) {
            log.debug("Page {} names month {}", pageIndex + 1, explicit.get());
            return explicit;
        }
        if (pageIndex >= 0 && pageIndex < CalendarDates.MONTH_CODES.size()) {
            String inferred = CalendarDates.monthCode(pageIndex + 1);
            log.debug("Inferred month {} from the position of page {}", inferred, pageIndex + 1);
            return Optional.of(inferred);
        }
        return Optional.empty();
    }

    /**
     * Scans the text for the first whole-word month name, ignoring case.
     *
     * @param text page text
     * @return month code of the earliest month name in the text
     */
    public Optional<String> detectByName(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        Matcher matcher = MONTH_NAME_PATTERN.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String name = matcher.group(1).toLowerCase(Locale.ROOT);
        return Optional.of(CalendarDates.monthCode(MONTH_NAMES.indexOf(name) + 1));
    }
}
