package com.guardrails.api.config;

import com.guardrails.core.model.NotificationRoute;
import com.guardrails.core.repository.AuditLogRepository;
import com.guardrails.core.repository.ExecutionRepository;
import com.guardrails.core.spi.GuardrailExecutor;
import com.guardrails.core.spi.NotificationSink;
import com.guardrails.engine.approval.ApprovalGateway;
import com.guardrails.engine.approval.ApprovalTokenSigner;
import com.guardrails.engine.execution.BoundedCalls;
import com.guardrails.engine.execution.LoggingGuardrailExecutor;
import com.guardrails.engine.matching.PolicyMatcher;
import com.guardrails.engine.metrics.GuardrailMetrics;
import com.guardrails.engine.notification.LoggingNotificationSink;
import com.guardrails.engine.notification.NotificationDispatcher;
import com.guardrails.engine.orchestrator.ExecutionOrchestrator;
import com.guardrails.engine.orchestrator.OrchestratorSettings;
import com.guardrails.engine.plan.ActionPlanBuilder;
import com.guardrails.engine.policy.DirectoryPolicySource;
import com.guardrails.engine.policy.PolicyLoadReport;
import com.guardrails.engine.policy.PolicyStore;
import com.guardrails.engine.policy.PolicyValidator;
import com.guardrails.scheduler.RollbackScheduler;
import com.guardrails.scheduler.SweepSettings;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the engine and the rollback scheduler from {@link GuardrailProperties}.
 * The identity backend and the notification sink fall back to logging implementations
 * unless the application provides its own beans.
 */
@Configuration
@EnableConfigurationProperties(GuardrailProperties.class)
public class GuardrailConfiguration {

    private static final Logger log = LoggerFactory.getLogger(GuardrailConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        return registry -> registry.config()
            .commonTags("application", "cost-guardrails");
    }

    @Bean
    public GuardrailMetrics guardrailMetrics(MeterRegistry registry, ExecutionRepository executions) {
        return new GuardrailMetrics(registry).withExecutionGauges(executions);
    }

    // ========== Policies ==========

    @Bean
    public PolicyStore policyStore(GuardrailProperties properties, Clock clock) {
        GuardrailProperties.Policies policies = properties.policies();
        PolicyStore store = new PolicyStore(
            new DirectoryPolicySource(Path.of(policies.directory())),
            new PolicyValidator(),
            policies.strict(),
            clock);
        PolicyLoadReport report = store.reload();
        log.info("Loaded {} polic(ies) from {}, {} rejected",
            report.accepted().size(), report.source(), report.rejected().size());
        return store;
    }

    // ========== Collaborators ==========

    @Bean
    @ConditionalOnMissingBean
    public GuardrailExecutor guardrailExecutor() {
        log.warn("No identity backend configured, guardrails are recorded in memory only");
        return new LoggingGuardrailExecutor();
    }

    @Bean
    @ConditionalOnMissingBean
    public NotificationSink notificationSink() {
        return new LoggingNotificationSink();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService executorCallPool() {
        return Executors.newCachedThreadPool(named("guardrail-executor"));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService notificationPool(GuardrailProperties properties) {
        return Executors.newFixedThreadPool(properties.notifications().threads(), named("guardrail-notify"));
    }

    @Bean
    public NotificationDispatcher notificationDispatcher(
            NotificationSink sink,
            @Qualifier("notificationPool") ExecutorService notificationPool,
            GuardrailMetrics metrics) {
        return new NotificationDispatcher(sink, notificationPool, metrics);
    }

    @Bean
    public ApprovalTokenSigner approvalTokenSigner(GuardrailProperties properties, Clock clock) {
        GuardrailProperties.Approval approval = properties.approval();
        if (approval.secret() == null || approval.secret().isBlank()) {
            log.warn("guardrails.approval.secret is not set, using a random key; "
                + "approval links will not survive a restart");
            byte[] secret = new byte[32];
            new SecureRandom().nextBytes(secret);
            return new ApprovalTokenSigner(secret, approval.window(), clock);
        }
        return new ApprovalTokenSigner(approval.secret(), approval.window(), clock);
    }

    // ========== Engine ==========

    @Bean
    public OrchestratorSettings orchestratorSettings(GuardrailProperties properties) {
        return new OrchestratorSettings(
            properties.approval().window(),
            properties.approval().baseUrl(),
            properties.rollback().escalationThreshold(),
            properties.rollback().claim(),
            NotificationRoute.to(properties.notifications().fallbackDestination())
        );
    }

    @Bean
    public ExecutionOrchestrator executionOrchestrator(
            GuardrailProperties properties,
            PolicyStore policyStore,
            ExecutionRepository executions,
            AuditLogRepository auditLog,
            GuardrailExecutor executor,
            @Qualifier("executorCallPool") ExecutorService executorCallPool,
            NotificationDispatcher notifications,
            ApprovalTokenSigner tokens,
            GuardrailMetrics metrics,
            OrchestratorSettings settings,
            Clock clock) {
        if (properties.forceSimulate()) {
            log.warn("guardrails.force-simulate is on, every policy runs in SIMULATE mode");
        }
        return ExecutionOrchestrator.builder()
            .policies(policyStore)
            .matcher(new PolicyMatcher())
            .planBuilder(new ActionPlanBuilder(properties.forceSimulate()))
            .executions(executions)
            .auditLog(auditLog)
            .executor(executor)
            .executorCalls(BoundedCalls.forExecutor(properties.timeouts().executor(), executorCallPool))
            .notifications(notifications)
            .tokens(tokens)
            .metrics(metrics)
            .settings(settings)
            .clock(clock)
            .build();
    }

    @Bean
    public ApprovalGateway approvalGateway(
            ApprovalTokenSigner signer,
            ExecutionOrchestrator orchestrator,
            ExecutionRepository executions,
            GuardrailMetrics metrics,
            Clock clock) {
        return new ApprovalGateway(signer, orchestrator, executions, metrics, clock);
    }

    // ========== Scheduler ==========

    @Bean(destroyMethod = "stop")
    public RollbackScheduler rollbackScheduler(
            ExecutionOrchestrator orchestrator,
            ExecutionRepository executions,
            GuardrailMetrics metrics,
            GuardrailProperties properties,
            Clock clock) {
        GuardrailProperties.Rollback rollback = properties.rollback();
        SweepSettings settings = new SweepSettings(
            rollback.sweepInterval(), rollback.batchSize(), rollback.interruptedAge());
        return new RollbackScheduler(orchestrator, executions, metrics, settings, clock);
    }

    @Bean
    public ApplicationRunner rollbackSchedulerStarter(RollbackScheduler scheduler, GuardrailProperties properties) {
        return args -> {
            if (properties.rollback().schedulerEnabled()) {
                scheduler.start();
            } else {
                log.info("Background rollback sweeps disabled, use POST /api/v1/sweeps");
            }
        };
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
