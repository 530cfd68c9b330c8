package com.ruralhome.listingtracker.scrape.model;

/**
 * Listing agent as reported by the listing source. Any field may be null.
 */
public record AdvertiserInfo(
    String name,
    String profileUrl,
    String phone,
    String brokerageName
) {
    public static AdvertiserInfo empty() {
        return new AdvertiserInfo(null, null, null, null);
    }

    public boolean hasName() {
        return name != null && !name.isBlank();
    }

    public boolean hasPhone() {
        return phone != null && !phone.isBlank();
    }
}
