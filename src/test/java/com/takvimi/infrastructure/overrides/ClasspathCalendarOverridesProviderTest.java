package com.takvimi.infrastructure.overrides;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.takvimi.domain.model.CalendarOverrides;
import com.takvimi.domain.model.PrayerTimeField;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ClasspathCalendarOverridesProviderTest {

    private final ClasspathCalendarOverridesProvider provider = new ClasspathCalendarOverridesProvider(new ObjectMapper());

    @Test
    void yearWithoutResourceGetsTheNewYearAnnotation() {
        CalendarOverrides overrides = provider.overridesFor(1999);

        assertThat(overrides.holidays().entries()).containsExactly(Map.entry("01-01", "Viti i Ri 1999"));
        assertThat(overrides.corrections().size()).isZero();
    }

    @Test
    void resourceEntriesAreLoadedAndMalformedOnesSkipped() {
        CalendarOverrides overrides = provider.overridesFor(2099);

        assertThat(overrides.holidays().entries()).containsOnlyKeys("01-01");
        assertThat(overrides.holidays().lookup("01", "01")).contains("Viti i Ri 2099");
        assertThat(overrides.corrections().size()).isEqualTo(1);
        assertThat(overrides.corrections().lookup(2099, "01", "01"))
                .contains(Map.of(PrayerTimeField.DAWN_START, "05:20"));
    }

    @Test
    void tablesAreLoadedOncePerYear() {
        assertThat(provider.overridesFor(2024)).isSameAs(provider.overridesFor(2024));
        assertThat(provider.overridesFor(2024).holidays().lookup("01", "01")).contains("Viti i Ri 2024");
    }
}
