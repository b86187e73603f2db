package com.williamcallahan.research_engine.repository;

import com.williamcallahan.research_engine.model.Run;
import com.williamcallahan.research_engine.model.RunStatus;
import com.williamcallahan.research_engine.util.JdbcUtils;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Optional;

/**
 * Postgres backed run storage.
 */
@Repository
@ConditionalOnExpression("'${spring.datasource.url:}'.length() > 0")
public class JdbcRunRepository implements RunRepository {

    private static final RowMapper<Run> RUN_ROW_MAPPER = (rs, rowNum) -> new Run(
        rs.getString("id"),
        rs.getString("step"),
        RunStatus.fromWireValue(rs.getString("status")),
        JdbcUtils.toInstant(rs.getTimestamp("created_at")),
        JdbcUtils.toInstant(rs.getTimestamp("updated_at"))
    );

    private final JdbcTemplate jdbcTemplate;

    public JdbcRunRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Run save(Run run) {
        jdbcTemplate.update(
            "INSERT INTO runs (id, step, status, created_at, updated_at) VALUES (?, ?, ?, ?, ?)",
            run.getId(),
            run.getStep(),
            run.getStatus().getWireValue(),
            Timestamp.from(run.getCreatedAt()),
            Timestamp.from(run.getUpdatedAt())
        );
        return run;
    }

    @Override
    public Optional<Run> findById(String runId) {
        return JdbcUtils.queryForOptional(jdbcTemplate,
            "SELECT id, step, status, created_at, updated_at FROM runs WHERE id = ?",
            RUN_ROW_MAPPER, runId);
    }

    @Override
    public boolean updateStepAndStatus(String runId, String step, RunStatus status) {
        int updated = jdbcTemplate.update(
            "UPDATE runs SET step = COALESCE(?, step), status = ?, updated_at = ? WHERE id = ?",
            step,
            status.getWireValue(),
            Timestamp.from(Instant.now()),
            runId
        );
        return updated > 0;
    }
}
