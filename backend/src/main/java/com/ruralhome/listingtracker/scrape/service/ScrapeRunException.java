package com.ruralhome.listingtracker.scrape.service;

/**
 * A failure that ends the whole run.
 */
public class ScrapeRunException extends RuntimeException {
    public ScrapeRunException(String message) {
        super(message);
    }

    public ScrapeRunException(String message, Throwable cause) {
        super(message, cause);
    }
}
