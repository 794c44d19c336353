package com.guardrails.api.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.guardrails.core.json.GuardrailJson;
import com.guardrails.core.repository.AuditLogRepository;
import com.guardrails.core.repository.ExecutionRepository;
import com.guardrails.engine.execution.BoundedCalls;
import com.guardrails.engine.persistence.InMemoryAuditLogRepository;
import com.guardrails.engine.persistence.InMemoryExecutionRepository;
import com.guardrails.engine.persistence.TimeBoundedAuditLogRepository;
import com.guardrails.engine.persistence.TimeBoundedExecutionRepository;
import com.guardrails.engine.persistence.jdbc.JdbcAuditLogRepository;
import com.guardrails.engine.persistence.jdbc.JdbcExecutionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Selects the ledger implementation from {@code guardrails.ledger.type}.
 */
@Configuration
public class PersistenceConfiguration {

    private static final Logger log = LoggerFactory.getLogger(PersistenceConfiguration.class);

    /**
     * Process-local ledger. Executions do not survive a restart.
     */
    @Configuration
    @ConditionalOnProperty(name = "guardrails.ledger.type", havingValue = "memory", matchIfMissing = true)
    static class InMemoryLedger {

        @Bean
        public ExecutionRepository executionRepository() {
            log.warn("Using the in-memory ledger; executions are lost on restart");
            return new InMemoryExecutionRepository();
        }

        @Bean
        public AuditLogRepository auditLogRepository() {
            return new InMemoryAuditLogRepository();
        }
    }

    /**
     * PostgreSQL ledger. Every call is bounded by {@code guardrails.timeouts.ledger}.
     */
    @Configuration
    @ConditionalOnProperty(name = "guardrails.ledger.type", havingValue = "jdbc")
    static class JdbcLedger {

        private final ObjectMapper ledgerMapper = GuardrailJson.newObjectMapper();

        @Bean(destroyMethod = "shutdown")
        public ExecutorService ledgerCallPool() {
            return Executors.newCachedThreadPool();
        }

        @Bean
        public ExecutionRepository executionRepository(
                JdbcTemplate jdbcTemplate,
                GuardrailProperties properties,
                @Qualifier("ledgerCallPool") ExecutorService ledgerCallPool) {
            return new TimeBoundedExecutionRepository(
                new JdbcExecutionRepository(jdbcTemplate, ledgerMapper),
                BoundedCalls.forLedger(properties.timeouts().ledger(), ledgerCallPool));
        }

        @Bean
        public AuditLogRepository auditLogRepository(
                JdbcTemplate jdbcTemplate,
                GuardrailProperties properties,
                @Qualifier("ledgerCallPool") ExecutorService ledgerCallPool) {
            return new TimeBoundedAuditLogRepository(
                new JdbcAuditLogRepository(jdbcTemplate, ledgerMapper),
                BoundedCalls.forLedger(properties.timeouts().ledger(), ledgerCallPool));
        }
    }
}
