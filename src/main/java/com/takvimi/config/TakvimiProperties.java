package com.takvimi.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.file.Path;

/**
 * Externalized settings bound from {@code takvimi.*}.
 *
 * @param pdfDir  directory holding the {@code takvimi<YEAR>.pdf} sources
 * @param jsonDir directory the extracted results are cached in
 * @param layout  page arithmetic of the printed calendar
 */
@ConfigurationProperties(prefix = "takvimi")
public record TakvimiProperties(
        @DefaultValue("takvimi-pdf") String pdfDir,
        @DefaultValue("api/takvimi") String jsonDir,
        @DefaultValue Layout layout
) {

    public TakvimiProperties {
        layout = layout == null ? Layout.standard() : layout;
    }

    public static TakvimiProperties defaults() {
        return new TakvimiProperties("takvimi-pdf", "api/takvimi", Layout.standard());
    }

    public Path pdfPath() {
        return Path.of(pdfDir);
    }

    public Path jsonPath() {
        return Path.of(jsonDir);
    }

    /**
     * Position of each month inside the document. The calendar opens with front-matter pages; every month
     * then takes a festival page followed by its prayer-times page.
     *
     * @param frontMatterPages 0-based index of January's festival page
     * @param pagesPerMonth    pages occupied by one month
     */
    public record Layout(
            @DefaultValue("7") int frontMatterPages,
            @DefaultValue("2") int pagesPerMonth
    ) {

        public static Layout standard() {
            return new Layout(7, 2);
        }

        /**
         * @param monthIndex 0-based month index (January is 0)
         */
        public int festivalPageIndex(int monthIndex) {
            return frontMatterPages + monthIndex * pagesPerMonth;
        }

        public int prayerTimesPageIndex(int monthIndex) {
            return festivalPageIndex(monthIndex) + 1;
        }
    }
}
