package com.ruralhome.listingtracker.scrape.model;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;

public record HttpFetchResult(
    String requestedUrl,
    URI finalUri,
    int statusCode,
    String body,
    String contentType,
    Instant fetchedAt,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    /**
     * Transport error code when the request never produced a response, otherwise {@code http_<status>}.
     * Null for successful responses.
     */
    public String failureCode() {
        if (isSuccessful()) {
            return null;
        }
        if (errorCode != null) {
            return errorCode;
        }
        return "http_" + statusCode;
    }
}
