package com.takvimi.infrastructure.overrides;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.takvimi.application.service.CalendarOverridesProvider;
import com.takvimi.domain.model.CalendarOverrides;
import com.takvimi.domain.model.CorrectionTable;
import com.takvimi.domain.model.HolidayTable;
import com.takvimi.domain.model.PrayerTimeField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Loads per-year overrides from the classpath resource {@code overrides/<YEAR>.json}:
 * <pre>
 * {"holidays": {"MM-DD": "text"}, "corrections": {"YYYY-MM-DD": {"imsaku": "HH:MM"}}}
 * </pre>
 * Years without a resource get the New Year annotation only. Loaded tables are kept per year.
 */
@Component
public class ClasspathCalendarOverridesProvider implements CalendarOverridesProvider {

    private static final Logger log = LoggerFactory.getLogger(ClasspathCalendarOverridesProvider.class);

    static final String RESOURCE_PATTERN = "overrides/%d.json";
    private static final Pattern HOLIDAY_KEY = Pattern.compile("^\\d{2}-\\d{2}$");
    private static final Pattern CORRECTION_KEY = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");

    private final ObjectMapper objectMapper;
    private final Map<Integer, CalendarOverrides> loaded = new ConcurrentHashMap<>();

    public ClasspathCalendarOverridesProvider(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public CalendarOverrides overridesFor(int year) {
        return loaded.computeIfAbsent(year, this::load);
    }

    static CalendarOverrides defaultsFor(int year) {
        return new CalendarOverrides(new HolidayTable(Map.of("01-01", "Viti i Ri " + year)), CorrectionTable.empty());
    }

    private CalendarOverrides load(int year) {
        Resource resource = new ClassPathResource(String.format(RESOURCE_PATTERN, year));
        if (!resource.exists()) {
            log.debug("No overrides resource for {}, using the New Year annotation only", year);
            return defaultsFor(year);
        }
        try (InputStream in = resource.getInputStream()) {
            JsonNode root = objectMapper.readTree(in);
            HolidayTable holidays = new HolidayTable(readHolidays(root.path("holidays"), year));
            CorrectionTable corrections = new CorrectionTable(readCorrections(root.path("corrections"), year));
            log.info("Loaded overrides for {}: {} holidays, {} corrections", year, holidays.size(), corrections.size());
            return new CalendarOverrides(holidays, corrections);
        } catch (IOException e) {
            log.warn("Overrides resource for {} is unreadable, using the New Year annotation only: {}", year, e.getMessage());
            return defaultsFor(year);
        }
    }

    private Map<String, String> readHolidays(JsonNode node, int year) {
        Map<String, String> holidays = new LinkedHashMap<>();
        node.fields().forEachRemaining(entry -> {
            JsonNode value = entry.getValue();
            if (!HOLIDAY_KEY.matcher(entry.getKey()).matches() || !value.isTextual() || value.asText().isBlank()) {
                log.warn("Ignoring holiday entry '{}' in overrides for {}", entry.getKey(), year);
                return;
            }
            holidays.put(entry.getKey(), value.asText().trim());
        });
        return holidays;
    }

    private Map<String, Map<PrayerTimeField, String>> readCorrections(JsonNode node, int year) {
        Map<String, Map<PrayerTimeField, String>> corrections = new LinkedHashMap<>();
        node.fields().forEachRemaining(entry -> {
            if (!CORRECTION_KEY.matcher(entry.getKey()).matches() || !entry.getValue().isObject()) {
                log.warn("Ignoring correction entry '{}' in overrides for {}", entry.getKey(), year);
                return;
            }
            Map<PrayerTimeField, String> fields = new EnumMap<>(PrayerTimeField.class);
            entry.getValue().fields().forEachRemaining(field -> PrayerTimeField.fromKey(field.getKey())
                    .filter(key -> field.getValue().isTextual())
                    .ifPresentOrElse(
                            key -> fields.put(key, field.getValue().asText().trim()),
                            () -> log.warn("Ignoring unknown correction field '{}' for {}", field.getKey(), entry.getKey())));
            if (!fields.isEmpty()) {
                corrections.put(entry.getKey(), fields);
            }
        });
        return corrections;
    }
}
