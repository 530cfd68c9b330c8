package com.ruralhome.listingtracker.scrape.persistence;

import com.ruralhome.listingtracker.scrape.model.RunState;
import com.ruralhome.listingtracker.scrape.model.RunStats;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Run history in {@code scrape_runs}. One row per orchestrator execution.
 */
@Repository
public class ScrapeRunJdbcRepository {
    private static final int MAX_ERROR_LENGTH = 2000;

    private final NamedParameterJdbcTemplate jdbc;

    public ScrapeRunJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public long insertRun(Instant startedAt, List<String> partitions) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("startedAt", toTimestamp(startedAt))
            .addValue("status", RunState.SEARCHING.name())
            .addValue("partitions", partitions == null ? null : String.join(",", partitions));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO scrape_runs (started_at, status, partitions)
                VALUES (:startedAt, :status, :partitions)
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        return key == null ? 0L : key.longValue();
    }

    public void updateRunStatus(long runId, RunState state) {
        jdbc.update(
            """
                UPDATE scrape_runs
                SET status = :status
                WHERE id = :runId
                """,
            new MapSqlParameterSource()
                .addValue("runId", runId)
                .addValue("status", state.name())
        );
    }

    public void completeRun(long runId, RunState state, RunStats stats) {
        List<String> errors = stats.getErrors();
        String lastError = errors.isEmpty() ? null : truncate(errors.get(errors.size() - 1));
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("runId", runId)
            .addValue("status", state.name())
            .addValue("completedAt", toTimestamp(stats.getCompletedAt()))
            .addValue("totalProcessed", stats.getTotalProcessed())
            .addValue("newListings", stats.getNewListings())
            .addValue("updatedListings", stats.getUpdatedListings())
            .addValue("septicMatches", stats.getSepticMatches())
            .addValue("wellMatches", stats.getWellMatches())
            .addValue("newsworthyCount", stats.getNewSepticWellCount())
            .addValue("skippedCount", stats.getSkippedCount())
            .addValue("errorCount", errors.size())
            .addValue("lastError", lastError);
        jdbc.update(
            """
                UPDATE scrape_runs
                SET status = :status,
                    completed_at = :completedAt,
                    total_processed = :totalProcessed,
                    new_listings = :newListings,
                    updated_listings = :updatedListings,
                    septic_matches = :septicMatches,
                    well_matches = :wellMatches,
                    newsworthy_count = :newsworthyCount,
                    skipped_count = :skippedCount,
                    error_count = :errorCount,
                    last_error = :lastError
                WHERE id = :runId
                """,
            params
        );
    }

    /**
     * Marks runs that never reached a terminal state and started before {@code cutoff} as FAILED.
     */
    public int failStaleRuns(Instant cutoff, String reason) {
        return jdbc.update(
            """
                UPDATE scrape_runs
                SET status = :failed,
                    completed_at = :now,
                    last_error = :reason
                WHERE status NOT IN (:completed, :failed)
                  AND started_at < :cutoff
                """,
            new MapSqlParameterSource()
                .addValue("failed", RunState.FAILED.name())
                .addValue("completed", RunState.COMPLETED.name())
                .addValue("now", toTimestamp(Instant.now()))
                .addValue("reason", reason)
                .addValue("cutoff", toTimestamp(cutoff))
        );
    }

    public Optional<String> findRunStatus(long runId) {
        List<String> rows = jdbc.queryForList(
            "SELECT status FROM scrape_runs WHERE id = :runId",
            new MapSqlParameterSource("runId", runId),
            String.class
        );
        return rows.isEmpty() ? Optional.empty() : Optional.ofNullable(rows.get(0));
    }

    private String truncate(String value) {
        if (value == null || value.length() <= MAX_ERROR_LENGTH) {
            return value;
        }
        return value.substring(0, MAX_ERROR_LENGTH);
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }
}
