package com.ruralhome.listingtracker.scrape.persistence;

import com.ruralhome.listingtracker.scrape.model.AgentCacheEntry;

import java.util.Optional;

public interface AgentCache {

    Optional<AgentCacheEntry> lookup(String agentUrl);

    void store(String agentUrl, String agentName, String agentPhone);
}
