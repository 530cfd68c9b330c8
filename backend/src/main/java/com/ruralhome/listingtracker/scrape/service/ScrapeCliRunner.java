package com.ruralhome.listingtracker.scrape.service;

import com.ruralhome.listingtracker.config.ScraperProperties;
import com.ruralhome.listingtracker.scrape.model.ScrapeRunRequest;
import com.ruralhome.listingtracker.scrape.model.ScrapeRunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(2)
public class ScrapeCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ScrapeCliRunner.class);

    private final ScraperProperties properties;
    private final ScrapeRunOrchestrator orchestrator;
    private final ConfigurableApplicationContext applicationContext;

    public ScrapeCliRunner(
        ScraperProperties properties,
        ScrapeRunOrchestrator orchestrator,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.orchestrator = orchestrator;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        ScrapeRunSummary summary = orchestrator.run(new ScrapeRunRequest(
            properties.getSearch().getPartitions(),
            properties.getRun().getDaysOld(),
            properties.getSearch().getPageLimit()
        ));
        log.info(
            "Scrape run {} finished with state {}: {} listings stored, {} newsworthy",
            summary.runId(),
            summary.state(),
            summary.records().size(),
            summary.newsworthy().size()
        );
        if (summary.stats().hasErrors()) {
            log.warn("Scrape run {} errors: {}", summary.runId(), summary.stats().getErrors());
        }

        if (properties.getCli().isExitAfterRun()) {
            int status = exitStatus(summary);
            int exitCode = SpringApplication.exit(applicationContext, () -> status);
            System.exit(exitCode);
        }
    }

    static int exitStatus(ScrapeRunSummary summary) {
        return summary != null && summary.succeeded() ? 0 : 1;
    }
}
