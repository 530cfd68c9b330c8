package com.ruralhome.listingtracker.scrape.model;

public record ListingStoreStats(
    long totalListings,
    long withSeptic,
    long withWell,
    long newLast24Hours
) {
}
