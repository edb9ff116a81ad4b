package com.gold.ledger.gold_ledger.entity;

import java.math.BigDecimal;

/**
 * Direction of a gold trade from the member's point of view.
 */
public enum TradeType {

    /**
     * Member receives gold. Admin-only, completes immediately.
     */
    BUY,

    /**
     * Member gives up gold for cash. Pending until approved when a member initiates it.
     */
    SELL;

    /**
     * Signed change a completed trade of this type applies to the member's holdings.
     */
    public BigDecimal holdingsDelta(BigDecimal quantity) {
        return this == BUY ? quantity : quantity.negate();
    }
}
