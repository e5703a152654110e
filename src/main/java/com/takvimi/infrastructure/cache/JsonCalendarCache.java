package com.takvimi.infrastructure.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.takvimi.config.TakvimiProperties;
import com.takvimi.domain.model.CalendarDates;
import com.takvimi.domain.model.CalendarYear;
import com.takvimi.domain.model.MonthBucket;
import com.takvimi.domain.model.MonthCalendarResult;
import com.takvimi.domain.model.YearCalendarResult;
import com.takvimi.infrastructure.exception.CalendarCacheException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * File cache of extraction results:
 * <pre>
 * &lt;json-dir&gt;/&lt;YEAR&gt;.json          full year
 * &lt;json-dir&gt;/&lt;YEAR&gt;/&lt;MM&gt;.json     one file per non-empty month
 * </pre>
 * Writes are best-effort: failures are logged and the caller still gets its result.
 */
@Component
public class JsonCalendarCache {

    private static final Logger log = LoggerFactory.getLogger(JsonCalendarCache.class);

    private static final Pattern YEAR_FILE = Pattern.compile("^(\\d{4})\\.json$");
    private static final Pattern MONTH_FILE = Pattern.compile("^(\\d{2})\\.json$");
    private static final Pattern YEAR_DIR = Pattern.compile("^\\d{4}$");

    private final ObjectMapper objectMapper;
    private final Path root;

    @Autowired
    public JsonCalendarCache(ObjectMapper objectMapper, TakvimiProperties properties) {
        this(objectMapper, properties.jsonPath());
    }

    public JsonCalendarCache(ObjectMapper objectMapper, Path root) {
        this.objectMapper = objectMapper;
        this.root = root;
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            log.warn("Unable to create cache directory {}: {}", root.toAbsolutePath(), e.getMessage());
        }
    }

    /**
     * Stores a year and its non-empty months. A year without any day record is not stored.
     *
     * @return {@code true} when the year file was written
     */
    public boolean saveCalendar(String year, CalendarYear data) {
        if (data == null || data.hasNoDays()) {
            log.info("Not caching {}: no day records were extracted", year);
            return false;
        }
        try {
            write(root.resolve(year + ".json"), YearCalendarResult.of(year, data));
            for (Map.Entry<String, MonthBucket> month : data.months().entrySet()) {
                if (!month.getValue().isEmpty()) {
                    write(root.resolve(year).resolve(month.getKey() + ".json"),
                            MonthCalendarResult.of(year, month.getKey(), month.getValue()));
                }
            }
            log.info("Cached {} ({} days) under {}", year, data.totalDays(), root.toAbsolutePath());
            return true;
        } catch (CalendarCacheException e) {
            log.warn("{}", e.getMessage(), e.getCause());
            return false;
        }
    }

    public Optional<YearCalendarResult> findYear(String year) {
        return read(root.resolve(year + ".json"), YearCalendarResult.class);
    }

    public Optional<MonthCalendarResult> findMonth(String year, String month) {
        return read(root.resolve(year).resolve(month + ".json"), MonthCalendarResult.class);
    }

    /**
     * @return years that have a cached year file, ascending
     */
    public List<String> processedYears() {
        List<String> years = new ArrayList<>();
        for (Path file : list(root)) {
            Matcher matcher = YEAR_FILE.matcher(file.getFileName().toString());
            if (Files.isRegularFile(file) && matcher.matches()) {
                years.add(matcher.group(1));
            }
        }
        years.sort(null);
        return years;
    }

    /**
     * @return cached month codes per year, both ascending
     */
    public Map<String, List<String>> processedMonths() {
        Map<String, List<String>> months = new TreeMap<>();
        for (Path dir : list(root)) {
            String name = dir.getFileName().toString();
            if (!Files.isDirectory(dir) || !YEAR_DIR.matcher(name).matches()) {
                continue;
            }
            List<String> codes = new ArrayList<>();
            for (Path file : list(dir)) {
                Matcher matcher = MONTH_FILE.matcher(file.getFileName().toString());
                if (matcher.matches() && CalendarDates.isMonthCode(matcher.group(1))) {
                    codes.add(matcher.group(1));
                }
            }
            if (!codes.isEmpty()) {
                codes.sort(null);
                months.put(name, codes);
            }
        }
        return months;
    }

    private void write(Path file, Object value) {
        try {
            Files.createDirectories(file.getParent());
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), value);
        } catch (IOException e) {
            throw new CalendarCacheException("Unable to write cache file " + file, e);
        }
    }

    private <T> Optional<T> read(Path file, Class<T> type) {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), type));
        } catch (IOException e) {
            log.warn("Ignoring unreadable cache file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    private List<Path> list(Path dir) {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.toList();
        } catch (IOException e) {
            log.warn("Unable to list cache directory {}: {}", dir, e.getMessage());
            return List.of();
        }
    }
}
