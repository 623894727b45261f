package com.eventsourcing.engine.health;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.HashMap;
import java.util.Map;

/**
 * Health indicator for the PostgreSQL stream store.
 * Reports health status based on:
 * - Database connectivity
 * - Presence of the stream_events table, with stream and event counts
 */
public class EventStoreHealthIndicator implements HealthIndicator {

    private final JdbcTemplate jdbcTemplate;

    public EventStoreHealthIndicator(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();

        try {
            if (!checkDatabase(details)) {
                return Health.down()
                    .withDetails(details)
                    .build();
            }

            if (!checkStreams(details)) {
                return Health.outOfService()
                    .withDetails(details)
                    .build();
            }

            return Health.up()
                .withDetails(details)
                .build();

        } catch (Exception e) {
            return Health.down()
                .withException(e)
                .withDetails(details)
                .build();
        }
    }

    private boolean checkDatabase(Map<String, Object> details) {
        try {
            Integer result = jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            boolean ok = result != null && result == 1;
            details.put("database", "connected");
            details.put("databaseCheck", ok ? "OK" : "FAILED");
            return ok;
        } catch (Exception e) {
            details.put("database", "disconnected");
            details.put("databaseError", e.getMessage());
            return false;
        }
    }

    private boolean checkStreams(Map<String, Object> details) {
        try {
            String sql = """
                SELECT COUNT(DISTINCT stream_id) AS streams, COUNT(*) AS events
                FROM stream_events
                """;
            jdbcTemplate.query(sql, rs -> {
                details.put("streams", rs.getLong("streams"));
                details.put("events", rs.getLong("events"));
            });
            return true;
        } catch (Exception e) {
            details.put("streamsError", e.getMessage());
            return false;
        }
    }
}
