package com.guardrails.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Settings under the {@code guardrails} prefix.
 */
@ConfigurationProperties(prefix = "guardrails")
public record GuardrailProperties(
    @DefaultValue Policies policies,
    @DefaultValue("false") boolean forceSimulate,
    @DefaultValue Approval approval,
    @DefaultValue Timeouts timeouts,
    @DefaultValue Rollback rollback,
    @DefaultValue Notifications notifications,
    @DefaultValue Ledger ledger
) {

    /**
     * @param directory directory of policy documents, read at startup and on reload
     * @param strict    reject the whole load when any document is invalid
     */
    public record Policies(
        @DefaultValue("policies") String directory,
        @DefaultValue("false") boolean strict
    ) {}

    /**
     * @param secret  HMAC key for approval tokens; a random one is generated when blank
     * @param baseUrl public base URL the approve/reject links point at
     */
    public record Approval(
        @DefaultValue("1h") Duration window,
        String secret,
        @DefaultValue("http://localhost:8080") String baseUrl
    ) {}

    public record Timeouts(
        @DefaultValue("30s") Duration executor,
        @DefaultValue("10s") Duration ledger
    ) {}

    /**
     * @param schedulerEnabled       run sweeps in the background; manual sweeps work either way
     * @param interruptedAge age after which an APPROVED, or AUTOMATIC still PLANNED, execution is considered stuck
     */
    public record Rollback(
        @DefaultValue("true") boolean schedulerEnabled,
        @DefaultValue("5m") Duration sweepInterval,
        @DefaultValue("100") int batchSize,
        @DefaultValue("3") int escalationThreshold,
        @DefaultValue("2m") Duration claim,
        @DefaultValue("10m") Duration interruptedAge
    ) {}

    /**
     * @param fallbackDestination where notifications go when the execution's policy is no longer loaded
     * @param threads             size of the delivery pool
     */
    public record Notifications(
        @DefaultValue("default") String fallbackDestination,
        @DefaultValue("2") int threads
    ) {}

    /**
     * @param type {@code memory} or {@code jdbc}
     */
    public record Ledger(
        @DefaultValue("memory") String type
    ) {}
}
