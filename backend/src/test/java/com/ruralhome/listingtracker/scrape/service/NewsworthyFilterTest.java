package com.ruralhome.listingtracker.scrape.service;

import com.ruralhome.listingtracker.config.ScraperProperties;
import com.ruralhome.listingtracker.scrape.model.ListingRecord;
import com.ruralhome.listingtracker.scrape.model.NewsworthyPolicy;
import com.ruralhome.listingtracker.scrape.model.UpsertResult;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class NewsworthyFilterTest {
    private static final Instant NOW = Instant.parse("2024-06-10T15:00:00Z");

    @Test
    void allNewRequiresInsertAndMatch() {
        NewsworthyFilter filter = filter(NewsworthyPolicy.ALL_NEW);

        assertThat(filter.isNewsworthy(new UpsertResult(true, listing(true, false, "2020-01-01")), NOW)).isTrue();
        assertThat(filter.isNewsworthy(new UpsertResult(false, listing(true, true, "2024-06-10")), NOW)).isFalse();
        assertThat(filter.isNewsworthy(new UpsertResult(true, listing(false, false, "2024-06-10")), NOW)).isFalse();
    }

    @Test
    void rollingWindowUsesListDate() {
        NewsworthyFilter filter = filter(NewsworthyPolicy.ROLLING_WINDOW);

        assertThat(filter.isNewsworthy(new UpsertResult(true, listing(false, true, "2024-06-09T16:00:00Z")), NOW)).isTrue();
        assertThat(filter.isNewsworthy(new UpsertResult(true, listing(false, true, "2024-06-09T14:00:00Z")), NOW)).isFalse();
        assertThat(filter.isNewsworthy(new UpsertResult(true, listing(false, true, "2024-06-01")), NOW)).isFalse();
    }

    @Test
    void dailyCutoffWindowStartsAtCutoffHour() {
        Instant[] afterCutoff = NewsworthyFilter.dailyWindow(NOW, 2);
        assertThat(afterCutoff[0]).isEqualTo(Instant.parse("2024-06-10T02:00:00Z"));
        assertThat(afterCutoff[1]).isEqualTo(Instant.parse("2024-06-11T02:00:00Z"));

        Instant[] beforeCutoff = NewsworthyFilter.dailyWindow(Instant.parse("2024-06-10T01:30:00Z"), 2);
        assertThat(beforeCutoff[0]).isEqualTo(Instant.parse("2024-06-09T02:00:00Z"));
        assertThat(beforeCutoff[1]).isEqualTo(Instant.parse("2024-06-10T02:00:00Z"));

        NewsworthyFilter filter = filter(NewsworthyPolicy.DAILY_CUTOFF);
        assertThat(filter.isNewsworthy(new UpsertResult(true, listing(true, false, "2024-06-10T03:00:00Z")), NOW)).isTrue();
        assertThat(filter.isNewsworthy(new UpsertResult(true, listing(true, false, "2024-06-10T01:00:00Z")), NOW)).isFalse();
    }

    @Test
    void unparseableListDateIsIncluded() {
        NewsworthyFilter filter = filter(NewsworthyPolicy.ROLLING_WINDOW);

        assertThat(filter.isNewsworthy(new UpsertResult(true, listing(true, false, null)), NOW)).isTrue();
        assertThat(filter.isNewsworthy(new UpsertResult(true, listing(true, false, "soon")), NOW)).isTrue();
    }

    @Test
    void selectReturnsStoredRecordsInOrder() {
        NewsworthyFilter filter = filter(NewsworthyPolicy.ALL_NEW);
        ListingRecord first = listing(true, false, "2024-06-10");
        ListingRecord skipped = listing(false, false, "2024-06-10");
        ListingRecord second = listing(false, true, "2024-06-10");

        List<ListingRecord> selected = filter.select(List.of(
            new UpsertResult(true, first),
            new UpsertResult(true, skipped),
            new UpsertResult(true, second)
        ), NOW);

        assertThat(selected).containsExactly(first, second);
    }

    private NewsworthyFilter filter(NewsworthyPolicy policy) {
        ScraperProperties properties = new ScraperProperties();
        properties.getNotify().setPolicy(policy);
        properties.getNotify().setWindowHours(24);
        properties.getNotify().setCutoffHourUtc(2);
        return new NewsworthyFilter(properties);
    }

    private ListingRecord listing(boolean septic, boolean well, String listDate) {
        return new ListingRecord(
            "https://www.realtor.com/realestateandhomes-detail/x-" + septic + well + listDate,
            "1",
            "1 Road",
            "Town",
            null,
            "WI",
            null,
            100000L,
            null,
            null,
            null,
            listDate,
            septic,
            well,
            septic ? List.of("utilities: Septic") : List.of(),
            well ? List.of("utilities: Private Well") : List.of(),
            null,
            null,
            null,
            null,
            NOW,
            NOW,
            1,
            NOW
        );
    }
}
