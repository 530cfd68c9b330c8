package com.ruralhome.listingtracker.scrape.graphql;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ruralhome.listingtracker.config.ScraperProperties;
import com.ruralhome.listingtracker.scrape.http.ListingHttpClient;
import com.ruralhome.listingtracker.scrape.model.EnrichedRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
public class GraphqlListingDetailFetcher extends GraphqlRequestSupport implements ListingDetailFetcher {
    private static final Logger log = LoggerFactory.getLogger(GraphqlListingDetailFetcher.class);

    private final ListingPayloadMapper mapper;

    public GraphqlListingDetailFetcher(
        ListingHttpClient httpClient,
        ObjectMapper objectMapper,
        ScraperProperties properties,
        ListingPayloadMapper mapper
    ) {
        super(httpClient, objectMapper, properties);
        this.mapper = mapper;
    }

    @Override
    public Optional<EnrichedRecord> fetchDetails(String propertyId) {
        if (propertyId == null || propertyId.isBlank()) {
            return Optional.empty();
        }
        ObjectNode variables = objectMapper.createObjectNode();
        variables.put("propertyId", propertyId.trim());

        GraphqlResponse response = execute(
            GraphqlQueries.DETAIL_OPERATION,
            GraphqlQueries.DETAIL_QUERY,
            variables,
            properties.getDetails().getClientName(),
            properties.getDetails().getClientVersion()
        );
        if (response.failed()) {
            log.warn("Detail fetch for property {} failed: {} {}", propertyId, response.errorCode(), response.errorMessage());
            return Optional.empty();
        }
        JsonNode home = response.data().get("home");
        if (home == null || home.isNull()) {
            log.debug("No detail available for property {}", propertyId);
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.toEnrichedRecord(home));
        } catch (IllegalArgumentException e) {
            log.warn("Detail payload for property {} unreadable: {}", propertyId, e.getMessage());
            return Optional.empty();
        }
    }
}
