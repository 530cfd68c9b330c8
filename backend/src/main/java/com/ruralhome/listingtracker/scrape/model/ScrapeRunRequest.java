package com.ruralhome.listingtracker.scrape.model;

import java.util.List;

public record ScrapeRunRequest(
    List<String> partitions,
    Integer daysOld,
    Integer pageLimit
) {
    public static ScrapeRunRequest defaults() {
        return new ScrapeRunRequest(null, null, null);
    }
}
