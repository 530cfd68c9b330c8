package com.ruralhome.listingtracker.scrape.model;

import java.util.List;

/**
 * Full listing detail. Carries the free text the classifier scans.
 */
public record EnrichedRecord(
    String propertyId,
    String listingId,
    String permalink,
    String status,
    ListingAddress address,
    Long price,
    Integer beds,
    Double baths,
    Integer sqft,
    Integer lotSqft,
    Integer yearBuilt,
    String listDate,
    String description,
    List<DetailEntry> details,
    AdvertiserInfo advertiser
) {
    public EnrichedRecord {
        address = address == null ? ListingAddress.empty() : address;
        details = details == null ? List.of() : List.copyOf(details);
        advertiser = advertiser == null ? AdvertiserInfo.empty() : advertiser;
    }
}
