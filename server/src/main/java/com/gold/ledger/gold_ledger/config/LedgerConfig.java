package com.gold.ledger.gold_ledger.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import com.gold.ledger.gold_ledger.service.ConflictClassifier;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;

/**
 * Ledger wiring.
 *
 * Conflict retry defaults:
 * - 3 attempts in total (first try + 2 retries)
 * - 50 ms between attempts
 * - only optimistic-lock and transient transaction errors are retried
 */
@Slf4j
@Configuration
@EnableScheduling
@EnableConfigurationProperties(LedgerProperties.class)
public class LedgerConfig {

    public static final String CONFLICT_RETRY_NAME = "tradeLedgerConflicts";

    @Bean
    public Retry tradeLedgerConflictRetry(LedgerProperties properties) {
        LedgerProperties.Conflict conflict = properties.getConflict();
        Retry retry = Retry.of(CONFLICT_RETRY_NAME, RetryConfig.custom()
                .maxAttempts(conflict.getMaxAttempts())
                .waitDuration(conflict.getWaitDuration())
                .retryOnException(ConflictClassifier::isConflict)
                .build());

        retry.getEventPublisher().onRetry(event ->
                log.warn("Retrying after write conflict: attempt={}, cause={}",
                        event.getNumberOfRetryAttempts(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : null));
        return retry;
    }
}
