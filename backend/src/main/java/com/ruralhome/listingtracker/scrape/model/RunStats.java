package com.ruralhome.listingtracker.scrape.model;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counters for one scrape run. Updated concurrently by fetch workers and the listing writer.
 */
public class RunStats {
    private final Instant startedAt;
    private final AtomicInteger totalProcessed = new AtomicInteger();
    private final AtomicInteger newListings = new AtomicInteger();
    private final AtomicInteger updatedListings = new AtomicInteger();
    private final AtomicInteger septicMatches = new AtomicInteger();
    private final AtomicInteger wellMatches = new AtomicInteger();
    private final AtomicInteger newSepticWellCount = new AtomicInteger();
    private final AtomicInteger skippedCount = new AtomicInteger();
    private final List<String> errors = Collections.synchronizedList(new ArrayList<>());
    private volatile Instant completedAt;

    public RunStats(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public static RunStats startNow() {
        return new RunStats(Instant.now());
    }

    public void setTotalProcessed(int value) {
        totalProcessed.set(Math.max(0, value));
    }

    public void recordUpsert(UpsertResult result) {
        if (result.isNew()) {
            newListings.incrementAndGet();
        } else {
            updatedListings.incrementAndGet();
        }
        ListingRecord stored = result.stored();
        if (stored.hasSepticSystem()) {
            septicMatches.incrementAndGet();
        }
        if (stored.hasPrivateWell()) {
            wellMatches.incrementAndGet();
        }
    }

    public void setNewSepticWellCount(int value) {
        newSepticWellCount.set(Math.max(0, value));
    }

    public void incrementSkipped() {
        skippedCount.incrementAndGet();
    }

    public void addError(String message) {
        errors.add(message == null || message.isBlank() ? "unknown error" : message);
    }

    public void markCompleted(Instant at) {
        if (completedAt == null) {
            completedAt = at;
        }
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public Duration getDuration() {
        Instant end = completedAt == null ? Instant.now() : completedAt;
        return Duration.between(startedAt, end);
    }

    public int getTotalProcessed() {
        return totalProcessed.get();
    }

    public int getNewListings() {
        return newListings.get();
    }

    public int getUpdatedListings() {
        return updatedListings.get();
    }

    public int getSepticMatches() {
        return septicMatches.get();
    }

    public int getWellMatches() {
        return wellMatches.get();
    }

    public int getNewSepticWellCount() {
        return newSepticWellCount.get();
    }

    public int getSkippedCount() {
        return skippedCount.get();
    }

    public List<String> getErrors() {
        synchronized (errors) {
            return List.copyOf(errors);
        }
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    @Override
    public String toString() {
        return "RunStats{processed=" + getTotalProcessed()
            + ", new=" + getNewListings()
            + ", updated=" + getUpdatedListings()
            + ", septic=" + getSepticMatches()
            + ", well=" + getWellMatches()
            + ", newsworthy=" + getNewSepticWellCount()
            + ", skipped=" + getSkippedCount()
            + ", errors=" + errors.size()
            + ", duration=" + getDuration().toMillis() + "ms}";
    }
}
