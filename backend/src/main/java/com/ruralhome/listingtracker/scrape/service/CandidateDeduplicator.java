package com.ruralhome.listingtracker.scrape.service;

import com.ruralhome.listingtracker.scrape.model.Candidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Drops repeated property ids across partitions. First occurrence wins; candidates without an id always pass.
 */
@Component
public class CandidateDeduplicator {
    private static final Logger log = LoggerFactory.getLogger(CandidateDeduplicator.class);

    public List<Candidate> dedupe(List<Candidate> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }
        Set<String> seen = new HashSet<>();
        List<Candidate> unique = new ArrayList<>(candidates.size());
        for (Candidate candidate : candidates) {
            if (candidate == null) {
                continue;
            }
            if (!candidate.hasPropertyId() || seen.add(candidate.propertyId().trim())) {
                unique.add(candidate);
            }
        }
        int removed = candidates.size() - unique.size();
        if (removed > 0) {
            log.info("Removed {} duplicate listings ({} unique)", removed, unique.size());
        }
        return unique;
    }
}
