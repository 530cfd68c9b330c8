package com.ruralhome.listingtracker.scrape.model;

import java.util.List;

public record ScrapeRunSummary(
    Long runId,
    RunState state,
    RunStats stats,
    List<ListingRecord> records,
    List<ListingRecord> newsworthy
) {
    public boolean succeeded() {
        return state == RunState.COMPLETED;
    }
}
