package com.ruralhome.listingtracker.scrape.model;

import java.time.Instant;

public record ListingQuery(
    Instant since,
    boolean septicOnly,
    boolean wellOnly,
    String city,
    String search,
    int limit
) {
    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 500;

    public ListingQuery {
        limit = limit <= 0 ? DEFAULT_LIMIT : Math.min(limit, MAX_LIMIT);
        city = city == null || city.isBlank() ? null : city.trim();
        search = search == null || search.isBlank() ? null : search.trim();
    }

    public static ListingQuery all() {
        return new ListingQuery(null, false, false, null, null, DEFAULT_LIMIT);
    }
}
