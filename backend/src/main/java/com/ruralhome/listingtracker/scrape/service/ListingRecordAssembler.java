package com.ruralhome.listingtracker.scrape.service;

import com.ruralhome.listingtracker.config.ScraperProperties;
import com.ruralhome.listingtracker.scrape.model.AdvertiserInfo;
import com.ruralhome.listingtracker.scrape.model.Candidate;
import com.ruralhome.listingtracker.scrape.model.ClassificationResult;
import com.ruralhome.listingtracker.scrape.model.EnrichedRecord;
import com.ruralhome.listingtracker.scrape.model.ListingAddress;
import com.ruralhome.listingtracker.scrape.model.ListingRecord;
import com.ruralhome.listingtracker.scrape.util.PhoneNumbers;
import org.springframework.stereotype.Component;

import java.time.Instant;

@Component
public class ListingRecordAssembler {
    static final String DETAIL_PATH = "/realestateandhomes-detail/";

    private final ScraperProperties properties;

    public ListingRecordAssembler(ScraperProperties properties) {
        this.properties = properties;
    }

    public String listingUrl(String permalink) {
        if (permalink == null || permalink.isBlank()) {
            throw new IllegalArgumentException("listing has no permalink");
        }
        String trimmed = permalink.trim();
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        return properties.getSiteBaseUrl() + DETAIL_PATH + trimmed;
    }

    /**
     * Detail data wins over search data field by field; the search candidate fills whatever the detail lacks.
     *
     * @param detail may be null when no detail was available
     */
    public ListingRecord assemble(Candidate candidate, EnrichedRecord detail, ClassificationResult classification, Instant observedAt) {
        String permalink = candidate.permalink();
        if ((permalink == null || permalink.isBlank()) && detail != null) {
            permalink = detail.permalink();
        }
        ListingAddress address = mergeAddress(candidate.address(), detail == null ? null : detail.address());
        AdvertiserInfo advertiser = mergeAdvertiser(candidate.advertiser(), detail == null ? null : detail.advertiser());
        ClassificationResult safeClassification = classification == null ? ClassificationResult.none() : classification;

        return new ListingRecord(
            listingUrl(permalink),
            firstNonNull(candidate.propertyId(), detail == null ? null : detail.propertyId()),
            address.line(),
            address.city(),
            address.county(),
            address.stateCode(),
            address.postalCode(),
            firstNonNull(detail == null ? null : detail.price(), candidate.price()),
            firstNonNull(detail == null ? null : detail.beds(), candidate.beds()),
            firstNonNull(detail == null ? null : detail.baths(), candidate.baths()),
            firstNonNull(detail == null ? null : detail.sqft(), candidate.sqft()),
            firstNonNull(candidate.listDate(), detail == null ? null : detail.listDate()),
            safeClassification.hasSepticSystem(),
            safeClassification.hasPrivateWell(),
            safeClassification.septicMentions(),
            safeClassification.wellMentions(),
            advertiser.profileUrl(),
            advertiser.name(),
            PhoneNumbers.normalize(advertiser.phone()),
            advertiser.brokerageName(),
            observedAt,
            observedAt,
            1,
            observedAt
        );
    }

    private ListingAddress mergeAddress(ListingAddress search, ListingAddress detail) {
        if (detail == null) {
            return search;
        }
        return new ListingAddress(
            firstNonNull(detail.line(), search.line()),
            firstNonNull(detail.city(), search.city()),
            firstNonNull(detail.county(), search.county()),
            firstNonNull(detail.stateCode(), search.stateCode()),
            firstNonNull(detail.postalCode(), search.postalCode())
        );
    }

    private AdvertiserInfo mergeAdvertiser(AdvertiserInfo search, AdvertiserInfo detail) {
        if (detail == null) {
            return search;
        }
        return new AdvertiserInfo(
            firstNonNull(detail.name(), search.name()),
            firstNonNull(detail.profileUrl(), search.profileUrl()),
            firstNonNull(detail.phone(), search.phone()),
            firstNonNull(detail.brokerageName(), search.brokerageName())
        );
    }

    private static <T> T firstNonNull(T first, T second) {
        return first != null ? first : second;
    }
}
