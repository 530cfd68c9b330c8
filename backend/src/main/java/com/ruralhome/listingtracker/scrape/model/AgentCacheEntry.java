package com.ruralhome.listingtracker.scrape.model;

import java.time.Instant;

public record AgentCacheEntry(
    String agentUrl,
    String agentName,
    String agentPhone,
    Instant fetchedAt
) {
}
