package com.gold.ledger.gold_ledger.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * Outcome of comparing a member's cached holdings with the trade log.
 */
@Getter
@AllArgsConstructor
@Builder
public class HoldingsReconciliation {

    private final String memberId;
    private final BigDecimal cachedHoldings;
    private final BigDecimal ledgerHoldings;

    /**
     * cachedHoldings - ledgerHoldings; zero when in sync.
     */
    private final BigDecimal drift;

    /**
     * True if the cached counter was moved to the ledger value.
     */
    private final boolean corrected;

    public boolean hasDrift() {
        return drift.signum() != 0;
    }
}
