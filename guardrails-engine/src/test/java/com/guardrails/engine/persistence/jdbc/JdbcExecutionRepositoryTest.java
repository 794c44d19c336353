package com.guardrails.engine.persistence.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.guardrails.core.json.GuardrailJson;
import com.guardrails.core.model.ActionExecution;
import com.guardrails.core.model.AuditRecord;
import com.guardrails.core.model.AuditRecordType;
import com.guardrails.core.repository.ExecutionRepository;
import com.guardrails.engine.persistence.AbstractExecutionRepositoryTest;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.List;

import static com.guardrails.testsupport.GuardrailFixtures.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Ledger behavior against a real PostgreSQL, including the partial unique index on active slots.
 */
@Testcontainers(disabledWithoutDocker = true)
class JdbcExecutionRepositoryTest extends AbstractExecutionRepositoryTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15")
        .withDatabaseName("guardrails_test")
        .withUsername("test")
        .withPassword("test");

    private static JdbcTemplate jdbcTemplate;
    private static final ObjectMapper objectMapper = GuardrailJson.newObjectMapper();

    @BeforeAll
    static void createSchema() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
            postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
        new ResourceDatabasePopulator(new ClassPathResource("db/schema.sql")).execute(dataSource);
        jdbcTemplate = new JdbcTemplate(dataSource);
    }

    @BeforeEach
    void truncate() {
        jdbcTemplate.execute("TRUNCATE action_executions, audit_records");
    }

    @Override
    protected ExecutionRepository createRepository() {
        return new JdbcExecutionRepository(jdbcTemplate, objectMapper);
    }

    @Test
    void auditLog_shouldKeepAppendOrderAndIgnoreReplays() {
        JdbcAuditLogRepository auditLog = new JdbcAuditLogRepository(jdbcTemplate, objectMapper);
        ActionExecution execution = planned("e1", ROLE_R1);
        AuditRecord planned = AuditRecord.create(execution.executionId(), "e1", "p1",
            AuditRecordType.EXECUTION_PLANNED, NOW, objectMapper.createObjectNode().put("mode", "APPROVE"), "system");
        AuditRecord requested = AuditRecord.create(execution.executionId(), "e1", "p1",
            AuditRecordType.APPROVAL_REQUESTED, NOW, objectMapper.createObjectNode(), "system");

        auditLog.append(planned);
        auditLog.append(requested);
        auditLog.append(planned);

        List<AuditRecord> records = auditLog.findByExecution(execution.executionId());
        assertThat(records).extracting(AuditRecord::type)
            .containsExactly(AuditRecordType.EXECUTION_PLANNED, AuditRecordType.APPROVAL_REQUESTED);
        assertThat(records.get(0).payload().get("mode").asText()).isEqualTo("APPROVE");
        assertThat(auditLog.findByType(AuditRecordType.APPROVAL_REQUESTED, 10)).hasSize(1);
    }
}
