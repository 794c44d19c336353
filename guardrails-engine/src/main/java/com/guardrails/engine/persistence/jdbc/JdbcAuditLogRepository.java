package com.guardrails.engine.persistence.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.guardrails.core.exception.LedgerException;
import com.guardrails.core.model.AuditRecord;
import com.guardrails.core.model.AuditRecordType;
import com.guardrails.core.repository.AuditLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.UUID;

/**
 * PostgreSQL-backed implementation of AuditLogRepository.
 * Append-only; a record id that already exists is skipped, so retried appends are harmless.
 */
public class JdbcAuditLogRepository implements AuditLogRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcAuditLogRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final AuditRecordRowMapper rowMapper;

    public JdbcAuditLogRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.rowMapper = new AuditRecordRowMapper();
    }

    @Override
    public void append(AuditRecord record) {
        String sql = """
            INSERT INTO audit_records (
                record_id, execution_id, event_id, policy_id,
                record_type, recorded_at, payload, actor
            ) VALUES (?, ?, ?, ?, ?, ?, ?::jsonb, ?)
            ON CONFLICT (record_id) DO NOTHING
            """;

        int rows = jdbcTemplate.update(sql,
            record.recordId(),
            record.executionId(),
            record.eventId(),
            record.policyId(),
            record.type().name(),
            Timestamp.from(record.timestamp()),
            serializePayload(record.payload()),
            record.actor()
        );

        if (rows == 0) {
            log.debug("Audit record {} already exists, skipped", record.recordId());
        }
    }

    @Override
    public List<AuditRecord> findByExecution(UUID executionId) {
        String sql = "SELECT * FROM audit_records WHERE execution_id = ? ORDER BY recorded_at, seq";
        return jdbcTemplate.query(sql, rowMapper, executionId);
    }

    @Override
    public List<AuditRecord> findByEvent(String eventId) {
        String sql = "SELECT * FROM audit_records WHERE event_id = ? ORDER BY recorded_at, seq";
        return jdbcTemplate.query(sql, rowMapper, eventId);
    }

    @Override
    public List<AuditRecord> findByType(AuditRecordType type, int limit) {
        String sql = "SELECT * FROM audit_records WHERE record_type = ? ORDER BY recorded_at DESC, seq DESC LIMIT ?";
        return jdbcTemplate.query(sql, rowMapper, type.name(), limit);
    }

    private String serializePayload(JsonNode payload) {
        if (payload == null) return null;
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new LedgerException("Failed to serialize audit payload", e);
        }
    }

    private class AuditRecordRowMapper implements RowMapper<AuditRecord> {
        @Override
        public AuditRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
            String executionId = rs.getString("execution_id");
            String payload = rs.getString("payload");
            try {
                return new AuditRecord(
                    UUID.fromString(rs.getString("record_id")),
                    executionId != null ? UUID.fromString(executionId) : null,
                    rs.getString("event_id"),
                    rs.getString("policy_id"),
                    AuditRecordType.valueOf(rs.getString("record_type")),
                    rs.getTimestamp("recorded_at").toInstant(),
                    payload != null ? objectMapper.readTree(payload) : null,
                    rs.getString("actor")
                );
            } catch (JsonProcessingException e) {
                throw new SQLException("Failed to parse audit payload", e);
            }
        }
    }
}
