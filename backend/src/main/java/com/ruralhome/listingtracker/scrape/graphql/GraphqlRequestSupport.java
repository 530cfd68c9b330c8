package com.ruralhome.listingtracker.scrape.graphql;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ruralhome.listingtracker.config.ScraperProperties;
import com.ruralhome.listingtracker.scrape.http.ListingHttpClient;
import com.ruralhome.listingtracker.scrape.model.HttpFetchResult;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shared request/response handling for the GraphQL endpoint.
 */
abstract class GraphqlRequestSupport {
    static final String GRAPHQL_ERRORS = "graphql_errors";
    static final String MALFORMED_PAYLOAD = "malformed_payload";

    protected final ListingHttpClient httpClient;
    protected final ObjectMapper objectMapper;
    protected final ScraperProperties properties;

    protected GraphqlRequestSupport(ListingHttpClient httpClient, ObjectMapper objectMapper, ScraperProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    protected GraphqlResponse execute(String operationName, String query, ObjectNode variables, String clientName, String clientVersion) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("operationName", operationName);
        payload.set("variables", variables);
        payload.put("query", query);
        String body;
        try {
            body = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            return GraphqlResponse.failure(MALFORMED_PAYLOAD, e.getOriginalMessage());
        }

        HttpFetchResult fetch = httpClient.postJson(properties.getGraphqlUrl(), body, headers(clientName, clientVersion));
        if (!fetch.isSuccessful()) {
            return GraphqlResponse.failure(fetch.failureCode(), fetch.errorMessage());
        }
        if (fetch.body() == null || fetch.body().isBlank()) {
            return GraphqlResponse.failure(MALFORMED_PAYLOAD, "empty response body");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(fetch.body());
        } catch (JsonProcessingException e) {
            return GraphqlResponse.failure(MALFORMED_PAYLOAD, e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            return GraphqlResponse.failure(MALFORMED_PAYLOAD, "response is not a JSON object");
        }
        JsonNode errors = root.get("errors");
        if (errors != null && !errors.isNull() && (!errors.isArray() || !errors.isEmpty())) {
            return GraphqlResponse.failure(GRAPHQL_ERRORS, abbreviate(errors.toString()));
        }
        JsonNode data = root.get("data");
        if (data == null || !data.isObject()) {
            return GraphqlResponse.failure(MALFORMED_PAYLOAD, "response has no data object");
        }
        return GraphqlResponse.success(data);
    }

    private Map<String, String> headers(String clientName, String clientVersion) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Origin", properties.getSiteBaseUrl());
        headers.put("Referer", properties.getSiteBaseUrl() + "/");
        headers.put("x-is-bot", "false");
        if (clientName != null && !clientName.isBlank()) {
            headers.put("rdc-client-name", clientName);
        }
        if (clientVersion != null && !clientVersion.isBlank()) {
            headers.put("rdc-client-version", clientVersion);
        }
        return headers;
    }

    private String abbreviate(String value) {
        if (value == null || value.length() <= 500) {
            return value;
        }
        return value.substring(0, 500) + "...";
    }

    record GraphqlResponse(JsonNode data, String errorCode, String errorMessage) {
        static GraphqlResponse success(JsonNode data) {
            return new GraphqlResponse(data, null, null);
        }

        static GraphqlResponse failure(String errorCode, String errorMessage) {
            return new GraphqlResponse(null, errorCode, errorMessage);
        }

        boolean failed() {
            return errorCode != null;
        }
    }
}
