package com.ruralhome.listingtracker.scrape.service;

public class ActiveScrapeRunException extends RuntimeException {
    public ActiveScrapeRunException(String message) {
        super(message);
    }
}
