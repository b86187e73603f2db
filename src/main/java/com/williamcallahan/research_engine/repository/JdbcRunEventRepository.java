package com.williamcallahan.research_engine.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.research_engine.config.AppConfigurationProperties;
import com.williamcallahan.research_engine.model.RunEvent;
import com.williamcallahan.research_engine.util.JdbcUtils;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;

/**
 * Postgres backed run event log. Statements carry their own query timeout so a slow database
 * cannot hold up a job that is emitting progress.
 */
@Repository
@ConditionalOnExpression("'${spring.datasource.url:}'.length() > 0")
public class JdbcRunEventRepository implements RunEventRepository {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<RunEvent> eventRowMapper;

    public JdbcRunEventRepository(JdbcTemplate jdbcTemplate,
                                  ObjectMapper objectMapper,
                                  AppConfigurationProperties appProperties) {
        JdbcTemplate bounded = new JdbcTemplate(jdbcTemplate.getDataSource());
        bounded.setQueryTimeout(appProperties.getEvents().getQueryTimeoutSeconds());
        this.jdbcTemplate = bounded;
        this.objectMapper = objectMapper;
        this.eventRowMapper = (rs, rowNum) -> new RunEvent(
            rs.getLong("id"),
            rs.getString("run_id"),
            rs.getString("agent_name"),
            rs.getString("event_type"),
            JdbcUtils.fromJsonb(objectMapper, rs.getString("payload")),
            JdbcUtils.toInstant(rs.getTimestamp("created_at"))
        );
    }

    @Override
    public RunEvent append(RunEvent event) {
        Long id = jdbcTemplate.queryForObject(
            "INSERT INTO run_events (run_id, agent_name, event_type, payload, created_at) "
                + "VALUES (?, ?, ?, ?::jsonb, ?) RETURNING id",
            Long.class,
            event.runId(),
            event.sourceName(),
            event.eventKind(),
            JdbcUtils.toJsonb(objectMapper, event.payload()),
            Timestamp.from(event.createdAt())
        );
        return new RunEvent(id, event.runId(), event.sourceName(), event.eventKind(), event.payload(), event.createdAt());
    }

    @Override
    public List<RunEvent> findByRunId(String runId) {
        return jdbcTemplate.query(
            "SELECT id, run_id, agent_name, event_type, payload::text AS payload, created_at "
                + "FROM run_events WHERE run_id = ? ORDER BY id ASC",
            eventRowMapper, runId);
    }
}
