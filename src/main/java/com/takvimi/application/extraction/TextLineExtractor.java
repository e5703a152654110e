package com.takvimi.application.extraction;

import com.takvimi.application.parsing.DayCandidate;
import com.takvimi.application.parsing.RowContext;
import com.takvimi.application.parsing.RowInput;
import com.takvimi.application.parsing.RowParserCascade;
import com.takvimi.application.parsing.TimeTokens;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the row cascade over the text lines of a page. Lines without any time token are ignored.
 */
@Component
public class TextLineExtractor {

    private static final Logger log = LoggerFactory.getLogger(TextLineExtractor.class);

    private final RowParserCascade cascade;

    public TextLineExtractor(RowParserCascade cascade) {
        this.cascade = cascade;
    }

    public List<DayCandidate> extract(String pageText, RowContext context) {
        List<DayCandidate> candidates = new ArrayList<>();
        if (pageText == null || pageText.isBlank()) {
            return candidates;
        }
        pageText.lines()
                .filter(TimeTokens::containsTime)
                .forEach(line -> {
                    try {
                        cascade.parse(RowInput.ofLine(line), context).ifPresent(candidates::add);
                    } catch (RuntimeException ex) {
                        log.warn("Skipping unreadable line '{}': {}", line, ex.getMessage());
                    }
                });
        return candidates;
    }
}
