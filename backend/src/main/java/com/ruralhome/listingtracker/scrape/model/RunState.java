package com.ruralhome.listingtracker.scrape.model;

public enum RunState {
    IDLE,
    SEARCHING,
    DEDUPLICATING,
    ENRICHING,
    FINALIZING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
