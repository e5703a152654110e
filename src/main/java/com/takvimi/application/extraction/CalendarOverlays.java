package com.takvimi.application.extraction;

import com.takvimi.domain.model.CalendarYearBuilder;
import com.takvimi.domain.model.CorrectionTable;
import com.takvimi.domain.model.DayRecord;
import com.takvimi.domain.model.HolidayTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * The two stages that run after extraction: known holidays are merged into the festival text, then manual
 * time corrections overwrite the named fields. Neither stage creates records for dates that were not extracted.
 */
@Component
public class CalendarOverlays {

    private static final Logger log = LoggerFactory.getLogger(CalendarOverlays.class);

    static final String FESTIVAL_SEPARATOR = ", ";

    /**
     * Appends the holiday text of every matching day; an empty festival is simply set. A festival that
     * already lists the holiday as one of its entries is left as is.
     *
     * @return number of records that changed
     */
    public int mergeFestivals(CalendarYearBuilder builder, HolidayTable holidays) {
        AtomicInteger merged = new AtomicInteger();
        builder.updateEach((monthCode, dayCode, record) -> holidays.lookup(monthCode, dayCode)
                .map(holiday -> {
                    DayRecord updated = record.withFestival(mergeFestival(record.festival(), holiday));
                    if (!updated.equals(record)) {
                        merged.incrementAndGet();
                        log.debug("Added known holiday for {}-{}: {}", monthCode, dayCode, holiday);
                    }
                    return updated;
                })
                .orElse(record));
        return merged.get();
    }

    /**
     * Overwrites exactly the fields named by the correction of every matching date.
     *
     * @return number of records that were corrected
     */
    public int applyCorrections(CalendarYearBuilder builder, CorrectionTable corrections) {
        AtomicInteger corrected = new AtomicInteger();
        builder.updateEach((monthCode, dayCode, record) -> corrections.lookup(builder.year(), monthCode, dayCode)
                .map(fields -> {
                    corrected.incrementAndGet();
                    log.debug("Applied time correction for {}-{}-{}: {}", builder.year(), monthCode, dayCode, fields);
                    return record.withTimes(record.times().with(fields));
                })
                .orElse(record));
        return corrected.get();
    }

    static String mergeFestival(String extracted, String holiday) {
        if (extracted == null || extracted.isBlank()) {
            return holiday;
        }
        for (String entry : extracted.split(FESTIVAL_SEPARATOR)) {
            if (entry.strip().equals(holiday.strip())) {
                return extracted;
            }
        }
        return extracted + FESTIVAL_SEPARATOR + holiday;
    }
}
