package com.ruralhome.listingtracker.scrape.model;

/**
 * Time filter applied to newly inserted septic/well listings before they are reported.
 */
public enum NewsworthyPolicy {
    /** Every new matching listing. */
    ALL_NEW,
    /** List date within the last {@code scraper.notify.window-hours}. */
    ROLLING_WINDOW,
    /** List date inside the UTC day that starts at {@code scraper.notify.cutoff-hour-utc}. */
    DAILY_CUTOFF
}
