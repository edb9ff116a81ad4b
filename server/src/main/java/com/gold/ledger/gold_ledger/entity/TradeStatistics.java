package com.gold.ledger.gold_ledger.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * Trade counts and completed volumes, for one member or for everyone.
 */
@Getter
@AllArgsConstructor
@Builder
public class TradeStatistics {

    private final long totalTrades;
    private final long completedTrades;
    private final long pendingTrades;
    private final long buyTrades;
    private final long sellTrades;
    private final Volume buyVolume;
    private final Volume sellVolume;

    @Getter
    @AllArgsConstructor
    public static class Volume {
        public static final Volume EMPTY = new Volume(BigDecimal.ZERO, Money.ZERO);

        private final BigDecimal totalQuantity;
        private final Money totalAmount;

        public Volume plus(Trade trade) {
            return new Volume(totalQuantity.add(trade.getQuantity()),
                    totalAmount.add(Money.of(trade.getTotalAmount())));
        }
    }
}
