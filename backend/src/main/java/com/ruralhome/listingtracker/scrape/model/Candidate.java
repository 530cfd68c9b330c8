package com.ruralhome.listingtracker.scrape.model;

/**
 * A listing as returned by the bulk search call. Only lives for one run.
 */
public record Candidate(
    String propertyId,
    String listingId,
    String permalink,
    ListingAddress address,
    Long price,
    Integer beds,
    Double baths,
    Integer sqft,
    String listDate,
    AdvertiserInfo advertiser
) {
    public Candidate {
        address = address == null ? ListingAddress.empty() : address;
        advertiser = advertiser == null ? AdvertiserInfo.empty() : advertiser;
    }

    public boolean hasPropertyId() {
        return propertyId != null && !propertyId.isBlank();
    }
}
