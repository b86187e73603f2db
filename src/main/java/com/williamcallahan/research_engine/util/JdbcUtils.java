package com.williamcallahan.research_engine.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Optional;

/**
 * Shared JDBC helper methods for optional lookups and JSONB columns.
 */
public final class JdbcUtils {

    private JdbcUtils() {
    }

    /**
     * Query for an optional single row, handling EmptyResultDataAccessException gracefully.
     */
    public static <T> Optional<T> queryForOptional(JdbcTemplate jdbc, String sql, RowMapper<T> mapper, Object... params) {
        try {
            return Optional.ofNullable(jdbc.queryForObject(sql, mapper, params));
        } catch (EmptyResultDataAccessException e) {
            return Optional.empty();
        }
    }

    public static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }

    /**
     * Serializes a JSON tree for binding to a {@code jsonb} parameter via {@code ?::jsonb}.
     */
    public static String toJsonb(ObjectMapper objectMapper, JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unable to serialize JSON column value", e);
        }
    }

    public static JsonNode fromJsonb(ObjectMapper objectMapper, String raw) {
        if (raw == null) {
            return objectMapper.nullNode();
        }
        try {
            return objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new DataRetrievalFailureException("Stored JSON column is not valid JSON", e);
        }
    }
}
