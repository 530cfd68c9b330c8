package com.ruralhome.listingtracker.scrape.graphql;

import com.ruralhome.listingtracker.scrape.model.SearchResult;

import java.time.LocalDate;

public interface ListingSearchClient {

    /**
     * Runs one search for a partition (a county name, or blank for the whole state).
     * Never throws for remote failures; those come back as a {@link SearchResult} with an error code.
     *
     * @param dateFloor only listings listed on or after this date; null for no floor
     * @param pageLimit requested page size, capped at the source maximum
     */
    SearchResult search(String partitionFilter, LocalDate dateFloor, int pageLimit);
}
