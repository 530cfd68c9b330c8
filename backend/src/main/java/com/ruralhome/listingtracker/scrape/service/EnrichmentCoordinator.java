package com.ruralhome.listingtracker.scrape.service;

import com.ruralhome.listingtracker.config.ScraperProperties;
import com.ruralhome.listingtracker.scrape.classify.SepticWellClassifier;
import com.ruralhome.listingtracker.scrape.graphql.ListingDetailFetcher;
import com.ruralhome.listingtracker.scrape.model.AgentContact;
import com.ruralhome.listingtracker.scrape.model.Candidate;
import com.ruralhome.listingtracker.scrape.model.ClassificationResult;
import com.ruralhome.listingtracker.scrape.model.CoordinatorResult;
import com.ruralhome.listingtracker.scrape.model.EnrichedRecord;
import com.ruralhome.listingtracker.scrape.model.ListingRecord;
import com.ruralhome.listingtracker.scrape.model.PendingListingWrite;
import com.ruralhome.listingtracker.scrape.model.RunStats;
import com.ruralhome.listingtracker.scrape.model.UpsertResult;
import com.ruralhome.listingtracker.scrape.persistence.AgentCache;
import com.ruralhome.listingtracker.scrape.persistence.ListingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fetches, classifies and assembles listings on the detail pool with at most
 * {@code scraper.max-concurrent-details} in flight, and hands every finished listing to one writer task that
 * performs all store writes for the run.
 */
@Service
public class EnrichmentCoordinator {
    private static final Logger log = LoggerFactory.getLogger(EnrichmentCoordinator.class);

    private final ListingDetailFetcher detailFetcher;
    private final SepticWellClassifier classifier;
    private final AgentProfileService agentProfileService;
    private final ListingRecordAssembler assembler;
    private final ListingStore listingStore;
    private final AgentCache agentCache;
    private final ExecutorService detailExecutor;
    private final ExecutorService writerExecutor;
    private final ScraperProperties properties;

    public EnrichmentCoordinator(
        ListingDetailFetcher detailFetcher,
        SepticWellClassifier classifier,
        AgentProfileService agentProfileService,
        ListingRecordAssembler assembler,
        ListingStore listingStore,
        AgentCache agentCache,
        @Qualifier("detailExecutor") ExecutorService detailExecutor,
        @Qualifier("listingWriterExecutor") ExecutorService writerExecutor,
        ScraperProperties properties
    ) {
        this.detailFetcher = detailFetcher;
        this.classifier = classifier;
        this.agentProfileService = agentProfileService;
        this.assembler = assembler;
        this.listingStore = listingStore;
        this.agentCache = agentCache;
        this.detailExecutor = detailExecutor;
        this.writerExecutor = writerExecutor;
        this.properties = properties;
    }

    /**
     * Returns once every candidate has been processed or skipped and the writer has drained the channel.
     *
     * @param deadline candidates not started by this instant are skipped; null means no deadline
     */
    public CoordinatorResult process(List<Candidate> candidates, Instant deadline, RunStats stats) {
        if (candidates == null || candidates.isEmpty()) {
            return new CoordinatorResult(List.of(), 0, false);
        }
        ListingWriteChannel channel = new ListingWriteChannel(properties.getWriteQueueCapacity());
        Semaphore permits = new Semaphore(properties.getMaxConcurrentDetails());
        AtomicBoolean timedOut = new AtomicBoolean(false);
        AtomicInteger skipped = new AtomicInteger();

        Future<List<UpsertResult>> writer = writerExecutor.submit(() -> drain(channel, stats));
        List<CompletableFuture<Void>> tasks = new ArrayList<>(candidates.size());
        try {
            for (Candidate candidate : candidates) {
                tasks.add(CompletableFuture.runAsync(
                    () -> processCandidate(candidate, deadline, permits, channel, stats, timedOut, skipped),
                    detailExecutor
                ));
            }
            CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0])).join();
        } finally {
            channel.close();
        }

        List<UpsertResult> upserts = awaitWriter(writer, stats);
        if (timedOut.get()) {
            log.warn("Run deadline reached: skipped {} of {} listings", skipped.get(), candidates.size());
        }
        return new CoordinatorResult(upserts, skipped.get(), timedOut.get());
    }

    private void processCandidate(
        Candidate candidate,
        Instant deadline,
        Semaphore permits,
        ListingWriteChannel channel,
        RunStats stats,
        AtomicBoolean timedOut,
        AtomicInteger skipped
    ) {
        if (pastDeadline(deadline)) {
            markSkipped(stats, timedOut, skipped);
            return;
        }
        PendingListingWrite pending;
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stats.addError(describe(candidate) + ": interrupted before detail fetch");
            return;
        }
        try {
            if (pastDeadline(deadline)) {
                markSkipped(stats, timedOut, skipped);
                return;
            }
            pending = enrich(candidate);
        } catch (Exception e) {
            log.warn("Failed to process {}", describe(candidate), e);
            stats.addError(describe(candidate) + ": " + e.getClass().getSimpleName() + ": " + e.getMessage());
            return;
        } finally {
            permits.release();
        }

        try {
            channel.put(pending);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stats.addError(describe(candidate) + ": interrupted before write");
        } catch (IllegalStateException e) {
            stats.addError(describe(candidate) + ": listing writer stopped before write");
        }
    }

    PendingListingWrite enrich(Candidate candidate) {
        Optional<EnrichedRecord> detail = properties.getDetails().isEnabled()
            ? detailFetcher.fetchDetails(candidate.propertyId())
            : Optional.empty();
        ClassificationResult classification = detail
            .map(classifier::classify)
            .orElseGet(() -> classifier.classify(candidate));
        ListingRecord record = assembler.assemble(candidate, detail.orElse(null), classification, Instant.now());
        AgentContact contact = agentProfileService.enrich(record.agentUrl(), record.agentName(), record.agentPhone());
        ListingRecord withAgent = record.withAgent(contact.agentUrl(), contact.name(), contact.phone());
        if (classification.hasAny()) {
            log.debug(
                "{} septic={} well={}",
                withAgent.listingUrl(),
                classification.septicMentions(),
                classification.wellMentions()
            );
        }
        return new PendingListingWrite(withAgent, contact);
    }

    private List<UpsertResult> drain(ListingWriteChannel channel, RunStats stats) {
        List<UpsertResult> results = new ArrayList<>();
        try {
            while (true) {
                Optional<PendingListingWrite> next = channel.take();
                if (next.isEmpty()) {
                    break;
                }
                write(next.get(), stats, results);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stats.addError("listing writer interrupted");
        } finally {
            channel.close();
        }
        return results;
    }

    private void write(PendingListingWrite pending, RunStats stats, List<UpsertResult> results) {
        AgentContact contact = pending.agentContact();
        if (contact != null && contact.fresh() && contact.hasUrl()) {
            try {
                agentCache.store(contact.agentUrl(), contact.name(), contact.phone());
            } catch (RuntimeException e) {
                log.warn("Failed to cache agent {}: {}", contact.agentUrl(), e.getMessage());
            }
        }
        ListingRecord listing = pending.listing();
        try {
            UpsertResult result = listingStore.upsert(listing);
            stats.recordUpsert(result);
            results.add(result);
        } catch (RuntimeException e) {
            log.warn("Failed to store listing {}", listing.listingUrl(), e);
            stats.addError(listing.listingUrl() + ": " + e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private List<UpsertResult> awaitWriter(Future<List<UpsertResult>> writer, RunStats stats) {
        try {
            return writer.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stats.addError("interrupted while waiting for listing writer");
            writer.cancel(true);
            return List.of();
        } catch (ExecutionException e) {
            throw new IllegalStateException("listing writer failed", e.getCause());
        }
    }

    private boolean pastDeadline(Instant deadline) {
        return deadline != null && !Instant.now().isBefore(deadline);
    }

    private void markSkipped(RunStats stats, AtomicBoolean timedOut, AtomicInteger skipped) {
        timedOut.set(true);
        skipped.incrementAndGet();
        stats.incrementSkipped();
    }

    private String describe(Candidate candidate) {
        if (candidate.hasPropertyId()) {
            return "property " + candidate.propertyId();
        }
        return "permalink " + candidate.permalink();
    }
}
