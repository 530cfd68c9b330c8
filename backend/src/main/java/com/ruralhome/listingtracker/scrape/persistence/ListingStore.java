package com.ruralhome.listingtracker.scrape.persistence;

import com.ruralhome.listingtracker.scrape.model.ListingQuery;
import com.ruralhome.listingtracker.scrape.model.ListingRecord;
import com.ruralhome.listingtracker.scrape.model.ListingStoreStats;
import com.ruralhome.listingtracker.scrape.model.UpsertResult;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for listings keyed by listing URL.
 * <p>
 * The pipeline only calls {@link #upsert} and {@link #isReachable}; the query methods serve readers outside the
 * scrape run.
 */
public interface ListingStore {

    /**
     * Inserts a new row with {@code timesSeen=1}, or bumps {@code timesSeen} and {@code lastSeenAt} on an existing
     * row while overwriting price, agent and classification fields. {@code firstSeenAt} never changes.
     */
    UpsertResult upsert(ListingRecord record);

    boolean isReachable();

    Optional<ListingRecord> findByUrl(String listingUrl);

    List<ListingRecord> findListings(ListingQuery query);

    List<ListingRecord> findNewSepticWellListings(Duration window);

    List<String> findAllCities();

    ListingStoreStats stats();
}
