package com.guardrails.engine.persistence.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.guardrails.core.exception.LedgerException;
import com.guardrails.core.exception.NotFoundException;
import com.guardrails.core.exception.OptimisticLockException;
import com.guardrails.core.model.ActionExecution;
import com.guardrails.core.model.ExecutionMode;
import com.guardrails.core.model.ExecutionStatus;
import com.guardrails.core.model.GuardrailAction;
import com.guardrails.core.model.PrincipalType;
import com.guardrails.core.model.StateDiff;
import com.guardrails.core.model.TargetPrincipal;
import com.guardrails.core.repository.ExecutionRepository;
import com.guardrails.core.repository.LedgerCursor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL-backed implementation of ExecutionRepository.
 *
 * The one-active-execution-per-(policy, target) rule is a partial unique index, so
 * {@link #tryInsert} is a single {@code INSERT ... ON CONFLICT DO NOTHING}. Updates are
 * compare-and-swap on the version column.
 */
public class JdbcExecutionRepository implements ExecutionRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcExecutionRepository.class);

    private static final TypeReference<List<GuardrailAction>> ACTIONS = new TypeReference<>() { };
    private static final TypeReference<List<StateDiff>> DIFFS = new TypeReference<>() { };

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final ActionExecutionRowMapper rowMapper;

    public JdbcExecutionRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.rowMapper = new ActionExecutionRowMapper();
    }

    @Override
    @Transactional
    public boolean tryInsert(ActionExecution execution) {
        String sql = """
            INSERT INTO action_executions (
                execution_id, policy_id, event_id, idempotency_key, mode,
                status, executed_by, actions_json, target_type, target_arn,
                diffs_json, ttl_minutes, created_at, approval_deadline,
                executed_at, ttl_expires_at, resolved_at, resolved_by,
                rolled_back_at, last_error, rollback_failures,
                rollback_claimed_until, version
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?::jsonb, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT DO NOTHING
            """;

        int rows = jdbcTemplate.update(sql,
            execution.executionId(),
            execution.policyId(),
            execution.eventId(),
            execution.idempotencyKey(),
            execution.mode().name(),
            execution.status().name(),
            execution.executedBy(),
            toJson(execution.actions()),
            execution.target().type().name(),
            execution.target().arn(),
            toJson(execution.diffs()),
            execution.ttlMinutes(),
            toTimestamp(execution.createdAt()),
            toTimestamp(execution.approvalDeadline()),
            toTimestamp(execution.executedAt()),
            toTimestamp(execution.ttlExpiresAt()),
            toTimestamp(execution.resolvedAt()),
            execution.resolvedBy(),
            toTimestamp(execution.rolledBackAt()),
            execution.lastError(),
            execution.rollbackFailures(),
            toTimestamp(execution.rollbackClaimedUntil()),
            execution.version()
        );

        if (rows == 0) {
            log.debug("Execution not inserted, slot or idempotency key taken: {}", execution.idempotencyKey());
        }
        return rows > 0;
    }

    @Override
    @Transactional
    public void update(ActionExecution execution) {
        String sql = """
            UPDATE action_executions SET
                status = ?,
                executed_by = ?,
                diffs_json = ?::jsonb,
                executed_at = ?,
                ttl_expires_at = ?,
                resolved_at = ?,
                resolved_by = ?,
                rolled_back_at = ?,
                last_error = ?,
                rollback_failures = ?,
                rollback_claimed_until = ?,
                version = ?
            WHERE execution_id = ? AND version = ?
            """;

        long expected = execution.version() - 1;
        int rows = jdbcTemplate.update(sql,
            execution.status().name(),
            execution.executedBy(),
            toJson(execution.diffs()),
            toTimestamp(execution.executedAt()),
            toTimestamp(execution.ttlExpiresAt()),
            toTimestamp(execution.resolvedAt()),
            execution.resolvedBy(),
            toTimestamp(execution.rolledBackAt()),
            execution.lastError(),
            execution.rollbackFailures(),
            toTimestamp(execution.rollbackClaimedUntil()),
            execution.version(),
            execution.executionId(),
            expected
        );

        if (rows == 0) {
            Long actual = currentVersion(execution.executionId());
            if (actual == null) {
                throw new NotFoundException("ActionExecution", execution.executionId().toString());
            }
            throw new OptimisticLockException("ActionExecution", execution.executionId().toString(), expected, actual);
        }
    }

    @Override
    public Optional<ActionExecution> findById(UUID executionId) {
        String sql = "SELECT * FROM action_executions WHERE execution_id = ?";
        return first(jdbcTemplate.query(sql, rowMapper, executionId));
    }

    @Override
    public Optional<ActionExecution> findByIdempotencyKey(String idempotencyKey) {
        String sql = "SELECT * FROM action_executions WHERE idempotency_key = ?";
        return first(jdbcTemplate.query(sql, rowMapper, idempotencyKey));
    }

    @Override
    public Optional<ActionExecution> findActive(String policyId, String targetArn) {
        String sql = """
            SELECT * FROM action_executions
            WHERE policy_id = ? AND target_arn = ?
              AND status IN ('PLANNED', 'APPROVED', 'EXECUTED')
            """;
        return first(jdbcTemplate.query(sql, rowMapper, policyId, targetArn));
    }

    @Override
    public List<ActionExecution> findDueForRollback(Instant now, LedgerCursor after, int limit) {
        String sql = """
            SELECT * FROM action_executions
            WHERE status = 'EXECUTED'
              AND ttl_expires_at <= ?
              AND (rollback_claimed_until IS NULL OR rollback_claimed_until <= ?)
            """;
        Timestamp at = Timestamp.from(now);
        return page(sql, "ttl_expires_at", after, limit, at, at);
    }

    @Override
    public List<ActionExecution> findOverdueApprovals(Instant now, LedgerCursor after, int limit) {
        String sql = """
            SELECT * FROM action_executions
            WHERE status = 'PLANNED' AND mode = 'APPROVE' AND approval_deadline <= ?
            """;
        return page(sql, "approval_deadline", after, limit, Timestamp.from(now));
    }

    @Override
    public List<ActionExecution> findInterrupted(Instant startedBefore, LedgerCursor after, int limit) {
        String sql = """
            SELECT * FROM action_executions
            WHERE (status = 'APPROVED' OR (status = 'PLANNED' AND mode = 'AUTOMATIC'))
              AND COALESCE(resolved_at, created_at) <= ?
            """;
        return page(sql, "COALESCE(resolved_at, created_at)", after, limit, Timestamp.from(startedBefore));
    }

    /**
     * Append the keyset condition, ordering and limit to a sweep query.
     */
    private List<ActionExecution> page(String sql, String position, LedgerCursor after, int limit, Object... args) {
        List<Object> params = new ArrayList<>(List.of(args));
        StringBuilder query = new StringBuilder(sql);
        if (after != null) {
            query.append("  AND (").append(position).append(", execution_id) > (?, ?)\n");
            params.add(Timestamp.from(after.position()));
            params.add(after.executionId());
        }
        query.append("ORDER BY ").append(position).append(", execution_id\nLIMIT ?");
        params.add(limit);
        return jdbcTemplate.query(query.toString(), rowMapper, params.toArray());
    }

    @Override
    public List<ActionExecution> findByEventId(String eventId) {
        String sql = "SELECT * FROM action_executions WHERE event_id = ? ORDER BY created_at";
        return jdbcTemplate.query(sql, rowMapper, eventId);
    }

    @Override
    public List<ActionExecution> findByStatus(ExecutionStatus status, int limit) {
        String sql = "SELECT * FROM action_executions WHERE status = ? ORDER BY created_at DESC LIMIT ?";
        return jdbcTemplate.query(sql, rowMapper, status.name(), limit);
    }

    @Override
    public List<ActionExecution> findRecent(int limit) {
        String sql = "SELECT * FROM action_executions ORDER BY created_at DESC LIMIT ?";
        return jdbcTemplate.query(sql, rowMapper, limit);
    }

    @Override
    public Map<ExecutionStatus, Long> countByStatus() {
        String sql = "SELECT status, COUNT(*) AS count FROM action_executions GROUP BY status";

        Map<ExecutionStatus, Long> counts = new EnumMap<>(ExecutionStatus.class);
        jdbcTemplate.query(sql, rs -> {
            counts.put(ExecutionStatus.valueOf(rs.getString("status")), rs.getLong("count"));
        });
        return counts;
    }

    // ========== Helper Methods ==========

    private Long currentVersion(UUID executionId) {
        List<Long> versions = jdbcTemplate.queryForList(
            "SELECT version FROM action_executions WHERE execution_id = ?", Long.class, executionId);
        return versions.isEmpty() ? null : versions.get(0);
    }

    private static <T> Optional<T> first(List<T> results) {
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    private String toJson(Object obj) {
        if (obj == null) return null;
        try {
            return objectMapper.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new LedgerException("Failed to serialize execution column", e);
        }
    }

    private Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private class ActionExecutionRowMapper implements RowMapper<ActionExecution> {
        @Override
        public ActionExecution mapRow(ResultSet rs, int rowNum) throws SQLException {
            try {
                return new ActionExecution(
                    UUID.fromString(rs.getString("execution_id")),
                    rs.getString("policy_id"),
                    rs.getString("event_id"),
                    rs.getString("idempotency_key"),
                    ExecutionMode.valueOf(rs.getString("mode")),
                    ExecutionStatus.valueOf(rs.getString("status")),
                    rs.getString("executed_by"),
                    parse(rs.getString("actions_json"), ACTIONS),
                    new TargetPrincipal(
                        PrincipalType.valueOf(rs.getString("target_type")),
                        rs.getString("target_arn")),
                    parse(rs.getString("diffs_json"), DIFFS),
                    rs.getInt("ttl_minutes"),
                    toInstant(rs.getTimestamp("created_at")),
                    toInstant(rs.getTimestamp("approval_deadline")),
                    toInstant(rs.getTimestamp("executed_at")),
                    toInstant(rs.getTimestamp("ttl_expires_at")),
                    toInstant(rs.getTimestamp("resolved_at")),
                    rs.getString("resolved_by"),
                    toInstant(rs.getTimestamp("rolled_back_at")),
                    rs.getString("last_error"),
                    rs.getInt("rollback_failures"),
                    toInstant(rs.getTimestamp("rollback_claimed_until")),
                    rs.getLong("version")
                );
            } catch (JsonProcessingException e) {
                throw new SQLException("Failed to map action execution row", e);
            }
        }

        private <T> List<T> parse(String json, TypeReference<List<T>> type) throws JsonProcessingException {
            if (json == null || json.isEmpty()) return List.of();
            return objectMapper.readValue(json, type);
        }

        private Instant toInstant(Timestamp ts) {
            return ts != null ? ts.toInstant() : null;
        }
    }
}
