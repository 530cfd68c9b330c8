package com.ruralhome.listingtracker.scrape.service;

import com.ruralhome.listingtracker.config.ScraperProperties;
import com.ruralhome.listingtracker.scrape.persistence.ListingStore;
import com.ruralhome.listingtracker.scrape.persistence.ScrapeRunJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Closes out run rows left open by a process that died mid-run.
 */
@Component
@Order(1)
public class ScrapeRunLifecycleRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ScrapeRunLifecycleRunner.class);

    private final ListingStore listingStore;
    private final ScrapeRunJdbcRepository runRepository;
    private final ScraperProperties properties;

    public ScrapeRunLifecycleRunner(
        ListingStore listingStore,
        ScrapeRunJdbcRepository runRepository,
        ScraperProperties properties
    ) {
        this.listingStore = listingStore;
        this.runRepository = runRepository;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!listingStore.isReachable()) {
            log.warn("Skipping scrape run cleanup because database is unreachable");
            return;
        }
        Instant cutoff = Instant.now().minus(Duration.ofMinutes(properties.getRun().getStaleRunMinutes()));
        int failed = runRepository.failStaleRuns(cutoff, "abandoned_before_completion");
        if (failed > 0) {
            log.info("Marked {} abandoned scrape runs as FAILED", failed);
        }
    }
}
