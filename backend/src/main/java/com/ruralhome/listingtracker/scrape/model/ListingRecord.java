package com.ruralhome.listingtracker.scrape.model;

import java.time.Instant;
import java.util.List;

public record ListingRecord(
    String listingUrl,
    String propertyId,
    String address,
    String city,
    String county,
    String stateCode,
    String postalCode,
    Long price,
    Integer beds,
    Double baths,
    Integer sqft,
    String listDate,
    boolean hasSepticSystem,
    boolean hasPrivateWell,
    List<String> septicMentions,
    List<String> wellMentions,
    String agentUrl,
    String agentName,
    String agentPhone,
    String brokerageName,
    Instant firstSeenAt,
    Instant lastSeenAt,
    int timesSeen,
    Instant scrapedAt
) {
    public ListingRecord {
        septicMentions = septicMentions == null ? List.of() : List.copyOf(septicMentions);
        wellMentions = wellMentions == null ? List.of() : List.copyOf(wellMentions);
        if (hasSepticSystem == septicMentions.isEmpty()) {
            throw new IllegalArgumentException("septic flag does not match septic mentions for " + listingUrl);
        }
        if (hasPrivateWell == wellMentions.isEmpty()) {
            throw new IllegalArgumentException("well flag does not match well mentions for " + listingUrl);
        }
    }

    public boolean hasAnyMatch() {
        return hasSepticSystem || hasPrivateWell;
    }

    public ListingRecord withAgent(String url, String name, String phone) {
        return new ListingRecord(
            listingUrl,
            propertyId,
            address,
            city,
            county,
            stateCode,
            postalCode,
            price,
            beds,
            baths,
            sqft,
            listDate,
            hasSepticSystem,
            hasPrivateWell,
            septicMentions,
            wellMentions,
            url,
            name,
            phone,
            brokerageName,
            firstSeenAt,
            lastSeenAt,
            timesSeen,
            scrapedAt
        );
    }
}
