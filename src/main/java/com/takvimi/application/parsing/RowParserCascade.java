package com.takvimi.application.parsing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Tries the row strategies in priority order and commits to the first match. Rows that no strategy reads,
 * or whose day number does not exist in the month, yield nothing.
 */
@Component
public class RowParserCascade {

    private static final Logger log = LoggerFactory.getLogger(RowParserCascade.class);

    private final List<RowParser> parsers;

    public RowParserCascade() {
        this(List.of(
                new FixedSchemaRowParser(),
                new LooselyDelimitedRowParser(),
                new PermissivePositionalRowParser(),
                new BruteForceRowParser()));
    }

    RowParserCascade(List<RowParser> parsers) {
        this.parsers = List.copyOf(parsers);
    }

    public List<RowParser> parsers() {
        return parsers;
    }

    /**
     * Runs the cascade over one row or line.
     *
     * @param input   row cells or text line
     * @param context resolved year and month
     * @return the first strategy's candidate, if it passes the day-range guard
     */
    public Optional<DayCandidate> parse(RowInput input, RowContext context) {
        if (input == null || input.text().isBlank()) {
            return Optional.empty();
        }
        for (RowParser parser : parsers) {
            Optional<DayCandidate> candidate = parser.tryParse(input, context);
            if (candidate.isEmpty()) {
                continue;
            }
            DayCandidate day = candidate.get();
            if (!context.isValidDay(day.day())) {
                log.debug("Rejected day {} for {}-{} from '{}'", day.day(), context.year(), context.monthCode(), input.text());
                return Optional.empty();
            }
            log.trace("Parsed day {} of month {} using {}", day.day(), context.monthCode(), parser.name());
            return candidate;
        }
        log.debug("No row strategy matched '{}'", input.text());
        return Optional.empty();
    }
}
