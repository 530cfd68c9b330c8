package com.ruralhome.listingtracker.scrape.service;

import com.ruralhome.listingtracker.config.ScraperProperties;
import com.ruralhome.listingtracker.scrape.model.ListingRecord;
import com.ruralhome.listingtracker.scrape.model.NewsworthyPolicy;
import com.ruralhome.listingtracker.scrape.model.UpsertResult;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Picks the listings worth reporting after a run: inserted during this run, septic or well found, and listed
 * inside the window of the configured {@link NewsworthyPolicy}.
 */
@Component
public class NewsworthyFilter {
    private final ScraperProperties properties;

    public NewsworthyFilter(ScraperProperties properties) {
        this.properties = properties;
    }

    public List<ListingRecord> select(List<UpsertResult> upserts, Instant now) {
        if (upserts == null || upserts.isEmpty()) {
            return List.of();
        }
        return upserts.stream()
            .filter(result -> isNewsworthy(result, now))
            .map(UpsertResult::stored)
            .toList();
    }

    public boolean isNewsworthy(UpsertResult result, Instant now) {
        if (result == null || !result.isNew() || result.stored() == null || !result.stored().hasAnyMatch()) {
            return false;
        }
        Instant listedAt = parseListDate(result.stored().listDate());
        if (listedAt == null) {
            return true;
        }
        NewsworthyPolicy policy = properties.getNotify().getPolicy();
        return switch (policy) {
            case ALL_NEW -> true;
            case ROLLING_WINDOW -> !listedAt.isBefore(now.minus(Duration.ofHours(properties.getNotify().getWindowHours())));
            case DAILY_CUTOFF -> {
                Instant[] window = dailyWindow(now, properties.getNotify().getCutoffHourUtc());
                yield !listedAt.isBefore(window[0]) && listedAt.isBefore(window[1]);
            }
        };
    }

    /**
     * The cutoff-to-cutoff UTC day containing {@code now}, as [start, end).
     */
    static Instant[] dailyWindow(Instant now, int cutoffHourUtc) {
        ZonedDateTime todayCutoff = now.atZone(ZoneOffset.UTC)
            .toLocalDate()
            .atStartOfDay(ZoneOffset.UTC)
            .plusHours(cutoffHourUtc);
        ZonedDateTime start = now.isBefore(todayCutoff.toInstant()) ? todayCutoff.minusDays(1) : todayCutoff;
        return new Instant[] {start.toInstant(), start.plusDays(1).toInstant()};
    }

    static Instant parseListDate(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim();
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException ignored) {
            // fall through to the offset and date-only forms
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException ignored) {
            // fall through
        }
        if (value.length() >= 10) {
            try {
                return LocalDate.parse(value.substring(0, 10)).atStartOfDay(ZoneOffset.UTC).toInstant();
            } catch (DateTimeParseException ignored) {
                return null;
            }
        }
        return null;
    }
}
