package com.ruralhome.listingtracker.scrape.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ruralhome.listingtracker.scrape.model.AgentCacheEntry;
import com.ruralhome.listingtracker.scrape.model.ListingQuery;
import com.ruralhome.listingtracker.scrape.model.ListingRecord;
import com.ruralhome.listingtracker.scrape.model.ListingStoreStats;
import com.ruralhome.listingtracker.scrape.model.UpsertResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

@Repository
public class ListingJdbcRepository implements ListingStore, AgentCache {
    private static final Logger log = LoggerFactory.getLogger(ListingJdbcRepository.class);
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private static final String SELECT_LISTING = """
        SELECT listing_url, property_id, address, city, county, state_code, postal_code,
               price, beds, baths, sqft, list_date,
               has_septic, has_well, septic_mentions, well_mentions,
               agent_url, agent_name, agent_phone, brokerage_name,
               first_seen_at, last_seen_at, times_seen, scraped_at
        FROM listings
        """;

    private static final String UPDATE_LISTING = """
        UPDATE listings
        SET property_id = COALESCE(property_id, :propertyId),
            address = COALESCE(address, :address),
            city = COALESCE(city, :city),
            county = COALESCE(county, :county),
            state_code = COALESCE(state_code, :stateCode),
            postal_code = COALESCE(postal_code, :postalCode),
            beds = COALESCE(beds, :beds),
            baths = COALESCE(baths, :baths),
            sqft = COALESCE(sqft, :sqft),
            list_date = COALESCE(list_date, :listDate),
            price = :price,
            has_septic = :hasSeptic,
            has_well = :hasWell,
            septic_mentions = :septicMentions,
            well_mentions = :wellMentions,
            agent_url = :agentUrl,
            agent_name = :agentName,
            agent_phone = :agentPhone,
            brokerage_name = :brokerageName,
            last_seen_at = :seenAt,
            times_seen = times_seen + 1,
            scraped_at = :seenAt
        WHERE listing_url = :listingUrl
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public ListingJdbcRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean isReachable() {
        try {
            Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
            return value != null && value == 1;
        } catch (Exception e) {
            log.warn("Listing store not reachable: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public UpsertResult upsert(ListingRecord record) {
        if (record == null || record.listingUrl() == null || record.listingUrl().isBlank()) {
            throw new IllegalArgumentException("listing record requires a listing URL");
        }
        Instant seenAt = record.scrapedAt() == null ? Instant.now() : record.scrapedAt();
        MapSqlParameterSource params = listingParams(record, seenAt);

        boolean isNew = false;
        int updated = jdbc.update(UPDATE_LISTING, params);
        if (updated == 0) {
            try {
                jdbc.update(
                    """
                        INSERT INTO listings (
                            listing_url, property_id, address, city, county, state_code, postal_code,
                            price, beds, baths, sqft, list_date,
                            has_septic, has_well, septic_mentions, well_mentions,
                            agent_url, agent_name, agent_phone, brokerage_name,
                            first_seen_at, last_seen_at, times_seen, scraped_at
                        )
                        VALUES (
                            :listingUrl, :propertyId, :address, :city, :county, :stateCode, :postalCode,
                            :price, :beds, :baths, :sqft, :listDate,
                            :hasSeptic, :hasWell, :septicMentions, :wellMentions,
                            :agentUrl, :agentName, :agentPhone, :brokerageName,
                            :seenAt, :seenAt, 1, :seenAt
                        )
                        """,
                    params
                );
                isNew = true;
            } catch (DataIntegrityViolationException e) {
                log.debug("Listing {} inserted concurrently; updating instead", record.listingUrl());
                jdbc.update(UPDATE_LISTING, params);
            }
        }

        ListingRecord stored = findByUrl(record.listingUrl())
            .orElseThrow(() -> new IllegalStateException("listing vanished after upsert: " + record.listingUrl()));
        return new UpsertResult(isNew, stored);
    }

    @Override
    public Optional<ListingRecord> findByUrl(String listingUrl) {
        if (listingUrl == null || listingUrl.isBlank()) {
            return Optional.empty();
        }
        List<ListingRecord> rows = jdbc.query(
            SELECT_LISTING + " WHERE listing_url = :listingUrl",
            new MapSqlParameterSource("listingUrl", listingUrl),
            listingRowMapper()
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public List<ListingRecord> findListings(ListingQuery query) {
        ListingQuery safeQuery = query == null ? ListingQuery.all() : query;
        StringBuilder sql = new StringBuilder(SELECT_LISTING).append(" WHERE 1 = 1");
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("limit", safeQuery.limit());
        if (safeQuery.since() != null) {
            sql.append(" AND last_seen_at >= :since");
            params.addValue("since", toTimestamp(safeQuery.since()));
        }
        if (safeQuery.septicOnly()) {
            sql.append(" AND has_septic = TRUE");
        }
        if (safeQuery.wellOnly()) {
            sql.append(" AND has_well = TRUE");
        }
        if (safeQuery.city() != null) {
            sql.append(" AND LOWER(city) = :city");
            params.addValue("city", safeQuery.city().toLowerCase(Locale.ROOT));
        }
        if (safeQuery.search() != null) {
            sql.append(" AND (LOWER(address) LIKE :pattern OR LOWER(city) LIKE :pattern OR postal_code LIKE :pattern)");
            params.addValue("pattern", "%" + safeQuery.search().toLowerCase(Locale.ROOT) + "%");
        }
        sql.append(" ORDER BY last_seen_at DESC, listing_url LIMIT :limit");
        return jdbc.query(sql.toString(), params, listingRowMapper());
    }

    @Override
    public List<ListingRecord> findNewSepticWellListings(Duration window) {
        Duration safeWindow = window == null || window.isNegative() ? Duration.ofHours(24) : window;
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("cutoff", toTimestamp(Instant.now().minus(safeWindow)));
        return jdbc.query(
            SELECT_LISTING + """
                 WHERE first_seen_at >= :cutoff
                   AND (has_septic = TRUE OR has_well = TRUE)
                 ORDER BY first_seen_at DESC, listing_url
                """,
            params,
            listingRowMapper()
        );
    }

    @Override
    public List<String> findAllCities() {
        return jdbc.queryForList(
            """
                SELECT DISTINCT city
                FROM listings
                WHERE city IS NOT NULL
                ORDER BY city
                """,
            new MapSqlParameterSource(),
            String.class
        );
    }

    @Override
    public ListingStoreStats stats() {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("cutoff", toTimestamp(Instant.now().minus(Duration.ofHours(24))));
        return jdbc.queryForObject(
            """
                SELECT COUNT(*) AS total,
                       SUM(CASE WHEN has_septic = TRUE THEN 1 ELSE 0 END) AS septic,
                       SUM(CASE WHEN has_well = TRUE THEN 1 ELSE 0 END) AS well,
                       SUM(CASE WHEN first_seen_at >= :cutoff THEN 1 ELSE 0 END) AS recent
                FROM listings
                """,
            params,
            (rs, rowNum) -> new ListingStoreStats(
                rs.getLong("total"),
                rs.getLong("septic"),
                rs.getLong("well"),
                rs.getLong("recent")
            )
        );
    }

    @Override
    public Optional<AgentCacheEntry> lookup(String agentUrl) {
        if (agentUrl == null || agentUrl.isBlank()) {
            return Optional.empty();
        }
        List<AgentCacheEntry> rows = jdbc.query(
            """
                SELECT agent_url, agent_name, agent_phone, fetched_at
                FROM agents
                WHERE agent_url = :agentUrl
                """,
            new MapSqlParameterSource("agentUrl", agentUrl),
            (rs, rowNum) -> new AgentCacheEntry(
                rs.getString("agent_url"),
                rs.getString("agent_name"),
                rs.getString("agent_phone"),
                toInstant(rs.getTimestamp("fetched_at"))
            )
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public void store(String agentUrl, String agentName, String agentPhone) {
        if (agentUrl == null || agentUrl.isBlank()) {
            return;
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("agentUrl", agentUrl)
            .addValue("agentName", agentName)
            .addValue("agentPhone", agentPhone)
            .addValue("fetchedAt", toTimestamp(Instant.now()));
        String update = """
            UPDATE agents
            SET agent_name = COALESCE(:agentName, agent_name),
                agent_phone = COALESCE(:agentPhone, agent_phone),
                fetched_at = :fetchedAt
            WHERE agent_url = :agentUrl
            """;
        int updated = jdbc.update(update, params);
        if (updated == 0) {
            try {
                jdbc.update(
                    """
                        INSERT INTO agents (agent_url, agent_name, agent_phone, fetched_at)
                        VALUES (:agentUrl, :agentName, :agentPhone, :fetchedAt)
                        """,
                    params
                );
            } catch (DataIntegrityViolationException e) {
                jdbc.update(update, params);
            }
        }
    }

    private MapSqlParameterSource listingParams(ListingRecord record, Instant seenAt) {
        return new MapSqlParameterSource()
            .addValue("listingUrl", record.listingUrl())
            .addValue("propertyId", record.propertyId())
            .addValue("address", record.address())
            .addValue("city", record.city())
            .addValue("county", record.county())
            .addValue("stateCode", record.stateCode())
            .addValue("postalCode", record.postalCode())
            .addValue("price", record.price(), Types.BIGINT)
            .addValue("beds", record.beds(), Types.INTEGER)
            .addValue("baths", record.baths(), Types.DOUBLE)
            .addValue("sqft", record.sqft(), Types.INTEGER)
            .addValue("listDate", record.listDate())
            .addValue("hasSeptic", record.hasSepticSystem())
            .addValue("hasWell", record.hasPrivateWell())
            .addValue("septicMentions", writeJson(record.septicMentions()))
            .addValue("wellMentions", writeJson(record.wellMentions()))
            .addValue("agentUrl", record.agentUrl())
            .addValue("agentName", record.agentName())
            .addValue("agentPhone", record.agentPhone())
            .addValue("brokerageName", record.brokerageName())
            .addValue("seenAt", toTimestamp(seenAt));
    }

    private RowMapper<ListingRecord> listingRowMapper() {
        return (rs, rowNum) -> new ListingRecord(
            rs.getString("listing_url"),
            rs.getString("property_id"),
            rs.getString("address"),
            rs.getString("city"),
            rs.getString("county"),
            rs.getString("state_code"),
            rs.getString("postal_code"),
            nullableLong(rs, "price"),
            nullableInt(rs, "beds"),
            nullableDouble(rs, "baths"),
            nullableInt(rs, "sqft"),
            rs.getString("list_date"),
            rs.getBoolean("has_septic"),
            rs.getBoolean("has_well"),
            readJson(rs.getString("septic_mentions")),
            readJson(rs.getString("well_mentions")),
            rs.getString("agent_url"),
            rs.getString("agent_name"),
            rs.getString("agent_phone"),
            rs.getString("brokerage_name"),
            toInstant(rs.getTimestamp("first_seen_at")),
            toInstant(rs.getTimestamp("last_seen_at")),
            rs.getInt("times_seen"),
            toInstant(rs.getTimestamp("scraped_at"))
        );
    }

    private Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    private Double nullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }

    private List<String> readJson(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            List<String> parsed = objectMapper.readValue(json, STRING_LIST);
            return parsed == null ? List.of() : new ArrayList<>(parsed);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable mention list in listings table: {}", e.getOriginalMessage());
            return List.of();
        }
    }

    private String writeJson(List<String> values) {
        try {
            return objectMapper.writeValueAsString(values == null ? List.of() : values);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize mention list", e);
        }
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
