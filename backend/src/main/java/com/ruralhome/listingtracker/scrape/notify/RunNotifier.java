package com.ruralhome.listingtracker.scrape.notify;

import com.ruralhome.listingtracker.scrape.model.ListingRecord;
import com.ruralhome.listingtracker.scrape.model.RunStats;

import java.util.List;

/**
 * Receives the outcome of a scrape run. Exceptions thrown here are logged by the caller and never change the run
 * result.
 */
public interface RunNotifier {

    void reportSuccess(RunStats stats, List<ListingRecord> allRecords, List<ListingRecord> matchedRecords);

    void reportFailure(String errorDetail);
}
