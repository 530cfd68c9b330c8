package com.ruralhome.listingtracker.scrape.graphql;

import com.fasterxml.jackson.databind.JsonNode;
import com.ruralhome.listingtracker.scrape.model.AdvertiserInfo;
import com.ruralhome.listingtracker.scrape.model.Candidate;
import com.ruralhome.listingtracker.scrape.model.DetailEntry;
import com.ruralhome.listingtracker.scrape.model.EnrichedRecord;
import com.ruralhome.listingtracker.scrape.model.ListingAddress;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Maps home_search results and home detail nodes onto typed records.
 */
@Component
public class ListingPayloadMapper {

    public Candidate toCandidate(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("search result is not an object");
        }
        JsonNode description = node.path("description");
        return new Candidate(
            text(node, "property_id"),
            text(node, "listing_id"),
            text(node, "permalink"),
            address(node.path("location")),
            longValue(node, "list_price"),
            intValue(description, "beds"),
            doubleValue(description, "baths"),
            intValue(description, "sqft"),
            text(node, "list_date"),
            searchAdvertiser(node.path("advertisers"))
        );
    }

    public EnrichedRecord toEnrichedRecord(JsonNode home) {
        if (home == null || !home.isObject()) {
            throw new IllegalArgumentException("home node is not an object");
        }
        JsonNode description = home.path("description");
        return new EnrichedRecord(
            text(home, "property_id"),
            text(home, "listing_id"),
            text(home, "permalink"),
            text(home, "status"),
            address(home.path("location")),
            longValue(home, "list_price"),
            intValue(description, "beds"),
            doubleValue(description, "baths"),
            intValue(description, "sqft"),
            intValue(description, "lot_sqft"),
            intValue(description, "year_built"),
            text(home, "list_date"),
            text(description, "text"),
            details(home.path("details")),
            detailAdvertiser(home.path("advertisers"), home.path("source").path("agents"))
        );
    }

    private ListingAddress address(JsonNode location) {
        JsonNode address = location.path("address");
        return new ListingAddress(
            text(address, "line"),
            text(address, "city"),
            text(location.path("county"), "name"),
            text(address, "state_code"),
            text(address, "postal_code")
        );
    }

    private List<DetailEntry> details(JsonNode details) {
        if (!details.isArray()) {
            return List.of();
        }
        List<DetailEntry> out = new ArrayList<>();
        for (JsonNode detail : details) {
            if (!detail.isObject()) {
                continue;
            }
            List<String> texts = new ArrayList<>();
            JsonNode textNode = detail.get("text");
            if (textNode != null && textNode.isArray()) {
                for (JsonNode line : textNode) {
                    if (line.isTextual() && !line.asText().isBlank()) {
                        texts.add(line.asText().trim());
                    }
                }
            } else if (textNode != null && textNode.isTextual() && !textNode.asText().isBlank()) {
                texts.add(textNode.asText().trim());
            }
            out.add(new DetailEntry(text(detail, "category"), texts));
        }
        return out;
    }

    private AdvertiserInfo searchAdvertiser(JsonNode advertisers) {
        JsonNode agent = firstElement(advertisers);
        if (agent == null) {
            return AdvertiserInfo.empty();
        }
        return new AdvertiserInfo(
            text(agent, "name"),
            text(agent, "href"),
            pickPhone(agent.path("phones"), false),
            null
        );
    }

    private AdvertiserInfo detailAdvertiser(JsonNode advertisers, JsonNode sourceAgents) {
        String name = null;
        String href = null;
        String phone = null;
        String brokerage = null;
        JsonNode agent = firstElement(advertisers);
        if (agent != null) {
            name = text(agent, "name");
            href = text(agent, "href");
            phone = firstNonBlank(pickPhone(agent.path("phones"), true), text(agent, "phone"));
            brokerage = firstNonBlank(text(agent.path("broker"), "name"), text(agent.path("office"), "name"));
        }
        JsonNode sourceAgent = firstElement(sourceAgents);
        if (sourceAgent != null && isBlank(name)) {
            name = text(sourceAgent, "agent_name");
            phone = firstNonBlank(text(sourceAgent, "agent_phone"), phone);
            if (isBlank(brokerage)) {
                brokerage = text(sourceAgent, "office_name");
            }
        }
        return new AdvertiserInfo(name, href, phone, brokerage);
    }

    private String pickPhone(JsonNode phones, boolean acceptMobile) {
        if (!phones.isArray() || phones.isEmpty()) {
            return null;
        }
        for (JsonNode phone : phones) {
            boolean primary = phone.path("primary").asBoolean(false);
            boolean mobile = acceptMobile && "mobile".equals(lower(text(phone, "type")));
            if ((primary || mobile) && !isBlank(text(phone, "number"))) {
                return text(phone, "number");
            }
        }
        return text(phones.get(0), "number");
    }

    private JsonNode firstElement(JsonNode array) {
        if (array == null || !array.isArray() || array.isEmpty()) {
            return null;
        }
        JsonNode first = array.get(0);
        return first != null && first.isObject() ? first : null;
    }

    private String text(JsonNode node, String field) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isTextual() || value.isNumber() || value.isBoolean()) {
            String text = value.asText().trim();
            return text.isEmpty() ? null : text;
        }
        return null;
    }

    private Long longValue(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.asLong();
        }
        try {
            return (long) Double.parseDouble(value.asText().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private Integer intValue(JsonNode node, String field) {
        Long value = longValue(node, field);
        return value == null ? null : value.intValue();
    }

    private Double doubleValue(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.asDouble();
        }
        try {
            return Double.parseDouble(value.asText().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private String firstNonBlank(String... values) {
        for (String value : values) {
            if (!isBlank(value)) {
                return value.trim();
            }
        }
        return null;
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private String lower(String value) {
        return value == null ? null : value.toLowerCase(Locale.ROOT);
    }
}
