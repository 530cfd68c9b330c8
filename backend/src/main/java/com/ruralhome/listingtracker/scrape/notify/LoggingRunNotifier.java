package com.ruralhome.listingtracker.scrape.notify;

import com.ruralhome.listingtracker.scrape.model.ListingRecord;
import com.ruralhome.listingtracker.scrape.model.RunStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class LoggingRunNotifier implements RunNotifier {
    private static final Logger log = LoggerFactory.getLogger(LoggingRunNotifier.class);

    @Override
    public void reportSuccess(RunStats stats, List<ListingRecord> allRecords, List<ListingRecord> matchedRecords) {
        log.info(
            "Scrape run finished in {}s: processed={} new={} updated={} septic={} well={} errors={}",
            stats.getDuration().toSeconds(),
            stats.getTotalProcessed(),
            stats.getNewListings(),
            stats.getUpdatedListings(),
            stats.getSepticMatches(),
            stats.getWellMatches(),
            stats.getErrors().size()
        );
        if (matchedRecords.isEmpty()) {
            log.info("No new septic/well listings this run ({} listings stored)", allRecords.size());
            return;
        }
        log.info("{} new septic/well listings:", matchedRecords.size());
        for (ListingRecord record : matchedRecords) {
            log.info(
                "  {} {} | price={} | septic={} well={} | agent={} {} | {}",
                record.address(),
                record.city(),
                record.price(),
                record.hasSepticSystem(),
                record.hasPrivateWell(),
                record.agentName(),
                record.agentPhone(),
                record.listingUrl()
            );
        }
    }

    @Override
    public void reportFailure(String errorDetail) {
        log.error("Scrape run failed: {}", errorDetail);
    }
}
