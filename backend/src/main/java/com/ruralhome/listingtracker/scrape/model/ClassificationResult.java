package com.ruralhome.listingtracker.scrape.model;

import java.util.List;

/**
 * Septic/well detection outcome. The flags are derived from the mention lists so they can never disagree.
 */
public record ClassificationResult(List<String> septicMentions, List<String> wellMentions) {
    private static final ClassificationResult NONE = new ClassificationResult(List.of(), List.of());

    public ClassificationResult {
        septicMentions = septicMentions == null ? List.of() : List.copyOf(septicMentions);
        wellMentions = wellMentions == null ? List.of() : List.copyOf(wellMentions);
    }

    public static ClassificationResult none() {
        return NONE;
    }

    public boolean hasSepticSystem() {
        return !septicMentions.isEmpty();
    }

    public boolean hasPrivateWell() {
        return !wellMentions.isEmpty();
    }

    public boolean hasAny() {
        return hasSepticSystem() || hasPrivateWell();
    }
}
