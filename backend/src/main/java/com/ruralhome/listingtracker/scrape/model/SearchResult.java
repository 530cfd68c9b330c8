package com.ruralhome.listingtracker.scrape.model;

import java.util.List;

/**
 * Candidates for one partition. A non-null {@code errorCode} separates a failed call from a legitimately empty page.
 */
public record SearchResult(
    String partition,
    List<Candidate> candidates,
    String errorCode,
    String errorMessage
) {
    public SearchResult {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    public static SearchResult of(String partition, List<Candidate> candidates) {
        return new SearchResult(partition, candidates, null, null);
    }

    public static SearchResult failure(String partition, String errorCode, String errorMessage) {
        return new SearchResult(partition, List.of(), errorCode, errorMessage);
    }

    public boolean failed() {
        return errorCode != null;
    }
}
