package com.takvimi.interfaces.api;

import com.takvimi.application.service.TakvimiService;
import com.takvimi.domain.model.AvailableCalendars;
import com.takvimi.domain.model.MonthCalendarResult;
import com.takvimi.domain.model.YearCalendarResult;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Interfaces-layer REST controller serving the extracted calendar as JSON and single pages as CSV.
 */
@RestController
public class TakvimiController {

    private final TakvimiService takvimiService;

    /**
     * Creates the controller with the application service that owns the use cases.
     *
     * @param takvimiService calendar use cases
     */
    public TakvimiController(TakvimiService takvimiService) {
        this.takvimiService = takvimiService;
    }

    /**
     * Describes the service and its endpoints.
     *
     * @return static description
     */
    @GetMapping(value = "/", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> index() {
        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("/api/takvimi", "Lists available PDFs and cached years");
        endpoints.put("/api/takvimi/{year}.json", "Calendar of a full year");
        endpoints.put("/api/takvimi/{year}/{month}.json", "Calendar of one month");
        endpoints.put("/api/takvimi/{year}/page/{page}.csv", "First table of a PDF page as CSV");

        Map<String, Object> description = new LinkedHashMap<>();
        description.put("name", "Takvimi API");
        description.put("description", "Prayer times and festivals extracted from the yearly Takvimi PDF");
        description.put("endpoints", endpoints);
        description.put("caching", "Year requests extract the PDF unless use_cache=true; month requests use the cache by default.");
        return description;
    }

    @GetMapping(value = "/api/takvimi", produces = MediaType.APPLICATION_JSON_VALUE)
    public AvailableCalendars listCalendars() {
        return takvimiService.listCalendars();
    }

    /**
     * Full year as JSON.
     *
     * @param year     four-digit year
     * @param useCache serve a cached result when one exists
     * @return year result
     */
    @GetMapping(value = "/api/takvimi/{year}.json", produces = MediaType.APPLICATION_JSON_VALUE)
    public YearCalendarResult year(@PathVariable("year") String year,
                                   @RequestParam(value = "use_cache", defaultValue = "false") boolean useCache) {
        return takvimiService.year(year, useCache);
    }

    /**
     * One month as JSON.
     *
     * @param year     four-digit year
     * @param month    month number, with or without leading zero
     * @param useCache serve cached results when they exist
     * @return month result
     */
    @GetMapping(value = "/api/takvimi/{year}/{month}.json", produces = MediaType.APPLICATION_JSON_VALUE)
    public MonthCalendarResult month(@PathVariable("year") String year,
                                     @PathVariable("month") String month,
                                     @RequestParam(value = "use_cache", defaultValue = "true") boolean useCache) {
        return takvimiService.month(year, month, useCache);
    }

    /**
     * Streams the first table of a page as a CSV download.
     *
     * @param year four-digit year
     * @param page 1-based page number
     * @return CSV document as a {@link ResponseEntity}
     */
    @GetMapping("/api/takvimi/{year}/page/{page}.csv")
    public ResponseEntity<byte[]> pageCsv(@PathVariable("year") String year, @PathVariable("page") int page) {
        String csv = takvimiService.pageCsv(year, page);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        "attachment; filename=\"takvimi" + year + "_page" + page + ".csv\"")
                .contentType(new MediaType("text", "csv", StandardCharsets.UTF_8))
                .body(csv.getBytes(StandardCharsets.UTF_8));
    }
}
