package com.ruralhome.listingtracker.scrape.graphql;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ruralhome.listingtracker.config.ScraperProperties;
import com.ruralhome.listingtracker.scrape.http.ListingHttpClient;
import com.ruralhome.listingtracker.scrape.model.Candidate;
import com.ruralhome.listingtracker.scrape.model.SearchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Service
public class GraphqlListingSearchClient extends GraphqlRequestSupport implements ListingSearchClient {
    private static final Logger log = LoggerFactory.getLogger(GraphqlListingSearchClient.class);

    private final ListingPayloadMapper mapper;

    public GraphqlListingSearchClient(
        ListingHttpClient httpClient,
        ObjectMapper objectMapper,
        ScraperProperties properties,
        ListingPayloadMapper mapper
    ) {
        super(httpClient, objectMapper, properties);
        this.mapper = mapper;
    }

    @Override
    public SearchResult search(String partitionFilter, LocalDate dateFloor, int pageLimit) {
        String partition = partitionFilter == null ? "" : partitionFilter.trim();
        int limit = Math.max(1, Math.min(pageLimit, properties.getSearch().getMaxPageSize()));
        ObjectNode variables = buildVariables(partition, dateFloor, limit);

        GraphqlResponse response = execute(
            GraphqlQueries.SEARCH_OPERATION,
            GraphqlQueries.SEARCH_QUERY,
            variables,
            properties.getSearch().getClientName(),
            properties.getSearch().getClientVersion()
        );
        if (response.failed()) {
            log.warn("Search for partition '{}' failed: {} {}", describe(partition), response.errorCode(), response.errorMessage());
            return SearchResult.failure(partition, response.errorCode(), response.errorMessage());
        }

        JsonNode homeSearch = response.data().get("home_search");
        if (homeSearch == null || homeSearch.isNull()) {
            log.warn("Search for partition '{}' returned no home_search node", describe(partition));
            return SearchResult.failure(partition, MALFORMED_PAYLOAD, "missing home_search");
        }
        JsonNode results = homeSearch.get("results");
        if (results == null || results.isNull()) {
            return SearchResult.of(partition, List.of());
        }
        if (!results.isArray()) {
            log.warn("Search for partition '{}' returned non-array results", describe(partition));
            return SearchResult.failure(partition, MALFORMED_PAYLOAD, "results is not an array");
        }

        List<Candidate> candidates = new ArrayList<>();
        int dropped = 0;
        for (JsonNode node : results) {
            try {
                candidates.add(mapper.toCandidate(node));
            } catch (IllegalArgumentException e) {
                dropped++;
            }
        }
        if (dropped > 0) {
            log.warn("Dropped {} unreadable search results for partition '{}'", dropped, describe(partition));
        }
        log.info(
            "Search partition '{}' returned {} listings (total available: {})",
            describe(partition),
            candidates.size(),
            homeSearch.path("total").asInt(candidates.size())
        );
        return SearchResult.of(partition, candidates);
    }

    ObjectNode buildVariables(String partition, LocalDate dateFloor, int limit) {
        ObjectNode query = objectMapper.createObjectNode();
        query.put("primary", true);
        ArrayNode statuses = query.putArray("status");
        statuses.add("for_sale");
        statuses.add("ready_to_build");
        String stateCode = properties.getSearch().getStateCode();
        if (partition.isEmpty()) {
            query.put("state_code", stateCode);
        } else {
            query.putObject("search_location").put("location", partition + " County, " + stateCode);
        }
        if (dateFloor != null) {
            query.putObject("list_date").put("min", dateFloor.toString());
        }

        ObjectNode variables = objectMapper.createObjectNode();
        variables.set("query", query);
        variables.put("limit", limit);
        variables.put("offset", 0);
        ObjectNode sort = variables.putArray("sort").addObject();
        sort.put("field", "list_date");
        sort.put("direction", "desc");
        return variables;
    }

    private String describe(String partition) {
        return partition.isEmpty() ? properties.getSearch().getStateCode() : partition;
    }
}
