package com.ruralhome.listingtracker.scrape.service;

import com.ruralhome.listingtracker.config.ScraperProperties;
import com.ruralhome.listingtracker.scrape.graphql.ListingSearchClient;
import com.ruralhome.listingtracker.scrape.model.Candidate;
import com.ruralhome.listingtracker.scrape.model.CoordinatorResult;
import com.ruralhome.listingtracker.scrape.model.ListingRecord;
import com.ruralhome.listingtracker.scrape.model.RunState;
import com.ruralhome.listingtracker.scrape.model.RunStats;
import com.ruralhome.listingtracker.scrape.model.ScrapeRunRequest;
import com.ruralhome.listingtracker.scrape.model.ScrapeRunSummary;
import com.ruralhome.listingtracker.scrape.model.SearchResult;
import com.ruralhome.listingtracker.scrape.model.UpsertResult;
import com.ruralhome.listingtracker.scrape.notify.RunNotifier;
import com.ruralhome.listingtracker.scrape.persistence.ListingStore;
import com.ruralhome.listingtracker.scrape.persistence.ScrapeRunJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one scrape: search every partition, dedupe, enrich and store, then report.
 * <p>
 * States move IDLE, SEARCHING, DEDUPLICATING, ENRICHING, FINALIZING and end in COMPLETED or FAILED. A failed run
 * is not retried. Only one run may execute at a time.
 */
@Service
public class ScrapeRunOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(ScrapeRunOrchestrator.class);

    private final ListingSearchClient searchClient;
    private final CandidateDeduplicator deduplicator;
    private final EnrichmentCoordinator coordinator;
    private final NewsworthyFilter newsworthyFilter;
    private final ListingStore listingStore;
    private final ScrapeRunJdbcRepository runRepository;
    private final RunNotifier notifier;
    private final ScraperProperties properties;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile RunState state = RunState.IDLE;

    public ScrapeRunOrchestrator(
        ListingSearchClient searchClient,
        CandidateDeduplicator deduplicator,
        EnrichmentCoordinator coordinator,
        NewsworthyFilter newsworthyFilter,
        ListingStore listingStore,
        ScrapeRunJdbcRepository runRepository,
        RunNotifier notifier,
        ScraperProperties properties
    ) {
        this.searchClient = searchClient;
        this.deduplicator = deduplicator;
        this.coordinator = coordinator;
        this.newsworthyFilter = newsworthyFilter;
        this.listingStore = listingStore;
        this.runRepository = runRepository;
        this.notifier = notifier;
        this.properties = properties;
    }

    public RunState currentState() {
        return state;
    }

    public ScrapeRunSummary run(ScrapeRunRequest request) {
        if (!running.compareAndSet(false, true)) {
            throw new ActiveScrapeRunException("A scrape run is already in progress (state=" + state + ")");
        }
        try {
            state = RunState.IDLE;
            return execute(request == null ? ScrapeRunRequest.defaults() : request);
        } finally {
            running.set(false);
        }
    }

    private ScrapeRunSummary execute(ScrapeRunRequest request) {
        RunStats stats = RunStats.startNow();
        List<String> partitions = resolvePartitions(request);
        int pageLimit = request.pageLimit() == null ? properties.getSearch().getPageLimit() : request.pageLimit();
        int daysOld = request.daysOld() == null ? properties.getRun().getDaysOld() : request.daysOld();
        LocalDate dateFloor = daysOld > 0 ? LocalDate.now(ZoneOffset.UTC).minusDays(daysOld) : null;

        Long runId = null;
        List<UpsertResult> upserts = List.of();
        try {
            if (!listingStore.isReachable()) {
                throw new ScrapeRunException("Listing store is not reachable");
            }
            runId = recordRunStart(stats.getStartedAt(), partitions);

            transition(runId, RunState.SEARCHING);
            List<Candidate> found = searchPartitions(partitions, dateFloor, pageLimit, stats);

            transition(runId, RunState.DEDUPLICATING);
            List<Candidate> unique = deduplicator.dedupe(found);
            stats.setTotalProcessed(unique.size());
            log.info("Found {} listings ({} unique) across {} partitions", found.size(), unique.size(), partitions.size());

            transition(runId, RunState.ENRICHING);
            CoordinatorResult result = coordinator.process(unique, deadline(stats.getStartedAt()), stats);
            upserts = result.upserts();

            transition(runId, RunState.FINALIZING);
            if (result.timedOut()) {
                throw new ScrapeRunException(
                    "Run deadline of " + properties.getRun().getMaxDurationSeconds() + "s exceeded; "
                        + result.skipped() + " listings skipped"
                );
            }
            List<ListingRecord> records = result.storedRecords();
            List<ListingRecord> newsworthy = newsworthyFilter.select(upserts, Instant.now());
            stats.setNewSepticWellCount(newsworthy.size());
            stats.markCompleted(Instant.now());
            state = RunState.COMPLETED;
            finishRun(runId, RunState.COMPLETED, stats);
            log.info("Scrape run {} completed: {}", runId, stats);

            try {
                notifier.reportSuccess(stats, records, newsworthy);
            } catch (Exception e) {
                log.warn("Run notifier failed after successful run {}", runId, e);
            }
            return new ScrapeRunSummary(runId, RunState.COMPLETED, stats, records, newsworthy);
        } catch (Exception e) {
            String detail = describeFailure(e);
            log.error("Scrape run {} failed in state {}: {}", runId, state, detail, e);
            stats.addError(detail);
            stats.markCompleted(Instant.now());
            state = RunState.FAILED;
            finishRun(runId, RunState.FAILED, stats);
            try {
                notifier.reportFailure(detail);
            } catch (Exception notifyError) {
                log.warn("Run notifier failed while reporting failure of run {}", runId, notifyError);
            }
            List<ListingRecord> records = upserts.stream().map(UpsertResult::stored).toList();
            return new ScrapeRunSummary(runId, RunState.FAILED, stats, records, List.of());
        }
    }

    private List<Candidate> searchPartitions(List<String> partitions, LocalDate dateFloor, int pageLimit, RunStats stats) {
        List<Candidate> found = new ArrayList<>();
        for (int i = 0; i < partitions.size(); i++) {
            if (i > 0) {
                pauseBetweenPartitions();
            }
            String partition = partitions.get(i);
            SearchResult result = searchClient.search(partition, dateFloor, pageLimit);
            if (result.failed()) {
                stats.addError("search " + partition + ": " + result.errorCode()
                    + (result.errorMessage() == null ? "" : " " + result.errorMessage()));
                continue;
            }
            log.info("Partition {}: {} listings", partition, result.candidates().size());
            found.addAll(result.candidates());
        }
        return found;
    }

    private void pauseBetweenPartitions() {
        int delayMs = properties.getSearch().getPartitionDelayMs();
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ScrapeRunException("Interrupted between search partitions", e);
        }
    }

    private List<String> resolvePartitions(ScrapeRunRequest request) {
        List<String> source = request.partitions() == null || request.partitions().isEmpty()
            ? properties.getSearch().getPartitions()
            : request.partitions();
        List<String> partitions = new ArrayList<>();
        if (source != null) {
            for (String partition : source) {
                if (partition != null && !partition.isBlank()) {
                    partitions.add(partition.trim());
                }
            }
        }
        if (partitions.isEmpty()) {
            // state-wide search
            partitions.add("");
        }
        return partitions;
    }

    private Instant deadline(Instant startedAt) {
        int maxDurationSeconds = properties.getRun().getMaxDurationSeconds();
        return maxDurationSeconds <= 0 ? null : startedAt.plusSeconds(maxDurationSeconds);
    }

    private Long recordRunStart(Instant startedAt, List<String> partitions) {
        try {
            return runRepository.insertRun(startedAt, partitions);
        } catch (Exception e) {
            log.warn("Unable to record scrape run start: {}", e.getMessage());
            return null;
        }
    }

    private void transition(Long runId, RunState next) {
        state = next;
        log.debug("Scrape run {} -> {}", runId, next);
        if (runId == null) {
            return;
        }
        try {
            runRepository.updateRunStatus(runId, next);
        } catch (Exception e) {
            log.warn("Unable to record state {} for scrape run {}: {}", next, runId, e.getMessage());
        }
    }

    private void finishRun(Long runId, RunState finalState, RunStats stats) {
        if (runId == null) {
            return;
        }
        try {
            runRepository.completeRun(runId, finalState, stats);
        } catch (Exception e) {
            log.warn("Unable to record completion of scrape run {}: {}", runId, e.getMessage());
        }
    }

    private String describeFailure(Exception e) {
        if (e instanceof ScrapeRunException) {
            return e.getMessage();
        }
        String message = e.getMessage();
        return e.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }
}
