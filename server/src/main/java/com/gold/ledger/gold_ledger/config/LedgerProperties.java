package com.gold.ledger.gold_ledger.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Getter;
import lombok.Setter;

import java.time.Duration;

/**
 * ledger.* settings from application.properties.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {

    private Conflict conflict = new Conflict();
    private Reconciliation reconciliation = new Reconciliation();

    /**
     * Bounded retry of a unit of work that lost an optimistic-concurrency race.
     */
    @Getter
    @Setter
    public static class Conflict {
        private int maxAttempts = 3;
        private Duration waitDuration = Duration.ofMillis(50);
    }

    @Getter
    @Setter
    public static class Reconciliation {
        private boolean enabled = false;

        /**
         * Move drifted counters to the ledger value instead of only reporting them.
         */
        private boolean repair = false;

        private Duration interval = Duration.ofMinutes(5);
    }
}
