package com.williamcallahan.research_engine.repository;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.research_engine.model.Artifact;
import com.williamcallahan.research_engine.util.JdbcUtils;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Postgres backed artifact storage.
 *
 * The next version is computed inside the insert itself. Two writers that read the same
 * maximum collide on the {@code (run_id, step_name, version)} unique constraint, which surfaces
 * as {@link org.springframework.dao.DuplicateKeyException} for the caller to retry.
 */
@Repository
@ConditionalOnExpression("'${spring.datasource.url:}'.length() > 0")
public class JdbcArtifactRepository implements ArtifactRepository {

    private static final String COLUMNS = "id, run_id, step_name, version, content::text AS content, created_at";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<Artifact> artifactRowMapper;

    public JdbcArtifactRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.artifactRowMapper = (rs, rowNum) -> new Artifact(
            rs.getLong("id"),
            rs.getString("run_id"),
            rs.getString("step_name"),
            rs.getInt("version"),
            JdbcUtils.fromJsonb(objectMapper, rs.getString("content")),
            JdbcUtils.toInstant(rs.getTimestamp("created_at"))
        );
    }

    @Override
    public Artifact insertNextVersion(String runId, String stepName, JsonNode content, Instant createdAt) {
        return jdbcTemplate.queryForObject(
            "INSERT INTO artifacts (run_id, step_name, version, content, created_at) "
                + "SELECT ?, ?, COALESCE(MAX(version), 0) + 1, ?::jsonb, ? "
                + "FROM artifacts WHERE run_id = ? AND step_name = ? "
                + "RETURNING " + COLUMNS,
            artifactRowMapper,
            runId,
            stepName,
            JdbcUtils.toJsonb(objectMapper, content),
            Timestamp.from(createdAt),
            runId,
            stepName
        );
    }

    @Override
    public Optional<Artifact> findLatest(String runId, String stepName) {
        return JdbcUtils.queryForOptional(jdbcTemplate,
            "SELECT " + COLUMNS + " FROM artifacts WHERE run_id = ? AND step_name = ? ORDER BY version DESC LIMIT 1",
            artifactRowMapper, runId, stepName);
    }

    @Override
    public List<Artifact> findLatestPerStep(String runId) {
        return jdbcTemplate.query(
            "SELECT DISTINCT ON (step_name) " + COLUMNS
                + " FROM artifacts WHERE run_id = ? ORDER BY step_name, version DESC",
            artifactRowMapper, runId);
    }
}
