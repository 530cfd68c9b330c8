package com.ruralhome.listingtracker.scrape.model;

/**
 * Outcome of one store upsert. {@code isNew=false} means the row existed and its visit counter was bumped.
 */
public record UpsertResult(boolean isNew, ListingRecord stored) {
}
