package com.ruralhome.listingtracker.scrape.support;

import com.ruralhome.listingtracker.scrape.model.AgentCacheEntry;
import com.ruralhome.listingtracker.scrape.model.ListingQuery;
import com.ruralhome.listingtracker.scrape.model.ListingRecord;
import com.ruralhome.listingtracker.scrape.model.ListingStoreStats;
import com.ruralhome.listingtracker.scrape.model.UpsertResult;
import com.ruralhome.listingtracker.scrape.persistence.AgentCache;
import com.ruralhome.listingtracker.scrape.persistence.ListingStore;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Store double that also records how many upserts ran at the same time.
 */
public class InMemoryListingStore implements ListingStore, AgentCache {
    private final Map<String, ListingRecord> listings = new LinkedHashMap<>();
    private final Map<String, AgentCacheEntry> agents = new LinkedHashMap<>();
    private final List<String> upsertedUrls = new ArrayList<>();
    private final AtomicInteger activeWriters = new AtomicInteger();
    private final AtomicInteger maxActiveWriters = new AtomicInteger();
    private volatile boolean reachable = true;
    private volatile String failOnUrl;

    @Override
    public UpsertResult upsert(ListingRecord record) {
        int active = activeWriters.incrementAndGet();
        maxActiveWriters.accumulateAndGet(active, Math::max);
        try {
            Thread.sleep(1);
            if (record.listingUrl().equals(failOnUrl)) {
                throw new IllegalStateException("simulated write failure");
            }
            synchronized (this) {
                upsertedUrls.add(record.listingUrl());
                ListingRecord existing = listings.get(record.listingUrl());
                if (existing == null) {
                    listings.put(record.listingUrl(), record);
                    return new UpsertResult(true, record);
                }
                Instant now = Instant.now();
                ListingRecord updated = new ListingRecord(
                    existing.listingUrl(),
                    existing.propertyId(),
                    existing.address(),
                    existing.city(),
                    existing.county(),
                    existing.stateCode(),
                    existing.postalCode(),
                    record.price(),
                    existing.beds(),
                    existing.baths(),
                    existing.sqft(),
                    existing.listDate(),
                    record.hasSepticSystem(),
                    record.hasPrivateWell(),
                    record.septicMentions(),
                    record.wellMentions(),
                    record.agentUrl(),
                    record.agentName(),
                    record.agentPhone(),
                    record.brokerageName(),
                    existing.firstSeenAt(),
                    now,
                    existing.timesSeen() + 1,
                    now
                );
                listings.put(record.listingUrl(), updated);
                return new UpsertResult(false, updated);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        } finally {
            activeWriters.decrementAndGet();
        }
    }

    @Override
    public boolean isReachable() {
        return reachable;
    }

    public void setReachable(boolean reachable) {
        this.reachable = reachable;
    }

    public void failOnUrl(String url) {
        this.failOnUrl = url;
    }

    @Override
    public synchronized Optional<ListingRecord> findByUrl(String listingUrl) {
        return Optional.ofNullable(listings.get(listingUrl));
    }

    @Override
    public synchronized List<ListingRecord> findListings(ListingQuery query) {
        return new ArrayList<>(listings.values());
    }

    @Override
    public synchronized List<ListingRecord> findNewSepticWellListings(Duration window) {
        return listings.values().stream().filter(ListingRecord::hasAnyMatch).toList();
    }

    @Override
    public synchronized List<String> findAllCities() {
        return listings.values().stream().map(ListingRecord::city).distinct().sorted().toList();
    }

    @Override
    public synchronized ListingStoreStats stats() {
        long septic = listings.values().stream().filter(ListingRecord::hasSepticSystem).count();
        long well = listings.values().stream().filter(ListingRecord::hasPrivateWell).count();
        return new ListingStoreStats(listings.size(), septic, well, listings.size());
    }

    @Override
    public synchronized Optional<AgentCacheEntry> lookup(String agentUrl) {
        return Optional.ofNullable(agents.get(agentUrl));
    }

    @Override
    public synchronized void store(String agentUrl, String agentName, String agentPhone) {
        agents.put(agentUrl, new AgentCacheEntry(agentUrl, agentName, agentPhone, Instant.now()));
    }

    public synchronized List<String> upsertedUrls() {
        return List.copyOf(upsertedUrls);
    }

    public synchronized int size() {
        return listings.size();
    }

    public int maxConcurrentWriters() {
        return maxActiveWriters.get();
    }
}
