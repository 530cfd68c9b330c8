package com.ruralhome.listingtracker.scrape.graphql;

import com.ruralhome.listingtracker.scrape.model.EnrichedRecord;

import java.util.Optional;

@FunctionalInterface
public interface ListingDetailFetcher {

    /**
     * Single attempt. Empty when the listing has no detail or the call failed in any way.
     */
    Optional<EnrichedRecord> fetchDetails(String propertyId);
}
