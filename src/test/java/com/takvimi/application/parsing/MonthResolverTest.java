package com.takvimi.application.parsing;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MonthResolverTest {

    private final MonthResolver resolver = new MonthResolver();

    @Test
    void explicitMonthNameWinsOverPosition() {
        assertThat(resolver.resolve("TAKVIMI 2024\nMARS\n1 e premte", 0)).contains("03");
    }

    @Test
    void matchIsCaseInsensitiveAndHandlesDiacritics() {
        assertThat(resolver.detectByName("Nëntor 2024")).contains("11");
        assertThat(resolver.detectByName("NËNTOR")).contains("11");
    }

    @Test
    void onlyWholeWordsCount() {
        assertThat(resolver.detectByName("Marsejë")).isEmpty();
        assertThat(resolver.detectByName("majmun")).isEmpty();
    }

    @Test
    void earliestNameInTheTextIsUsed() {
        assertThat(resolver.detectByName("Prill ... vazhdon nga Mars")).contains("04");
    }

    @Test
    void positionIsUsedForTheFirstTwelvePagesOnly() {
        assertThat(resolver.resolve("", 0)).contains("01");
        assertThat(resolver.resolve(null, 11)).contains("12");
        assertThat(resolver.resolve("1 2 05:21", 12)).isEmpty();
    }
}
