package com.takvimi.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Index of the calendar sources and of what has already been extracted into the cache.
 */
public record AvailableCalendars(
        @JsonProperty("available_years") List<String> availableYears,
        @JsonProperty("processed_years") List<String> processedYears,
        @JsonProperty("processed_months") Map<String, List<String>> processedMonths,
        @JsonProperty("available_files") List<String> availableFiles,
        @JsonProperty("caching_info") String cachingInfo
) {
}
