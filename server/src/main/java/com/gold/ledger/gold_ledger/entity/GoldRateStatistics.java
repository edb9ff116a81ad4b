package com.gold.ledger.gold_ledger.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

@Getter
@AllArgsConstructor
@Builder
public class GoldRateStatistics {

    /**
     * Null until the first rate is created.
     */
    private final GoldRate activeRate;
    private final long totalHistoricalRates;

    public boolean hasActiveRate() {
        return activeRate != null;
    }
}
