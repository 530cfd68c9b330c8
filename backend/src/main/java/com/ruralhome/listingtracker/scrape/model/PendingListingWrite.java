package com.ruralhome.listingtracker.scrape.model;

public record PendingListingWrite(ListingRecord listing, AgentContact agentContact) {
}
