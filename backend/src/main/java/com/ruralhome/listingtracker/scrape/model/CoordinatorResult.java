package com.ruralhome.listingtracker.scrape.model;

import java.util.List;

public record CoordinatorResult(
    List<UpsertResult> upserts,
    int skipped,
    boolean timedOut
) {
    public CoordinatorResult {
        upserts = upserts == null ? List.of() : List.copyOf(upserts);
    }

    public List<ListingRecord> storedRecords() {
        return upserts.stream().map(UpsertResult::stored).toList();
    }
}
