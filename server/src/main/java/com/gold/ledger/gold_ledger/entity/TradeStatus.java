package com.gold.ledger.gold_ledger.entity;

/**
 * Trade lifecycle.
 *
 * State Transitions (STRICT - no shortcuts allowed):
 *
 * PENDING   → COMPLETED  (admin approves a member SELL)
 * PENDING   → CANCELLED  (admin rejects a member SELL)
 * COMPLETED → CANCELLED  (admin reverses a BUY; BUY only)
 *
 * CANCELLED is terminal. COMPLETED is terminal for SELL trades.
 */
public enum TradeStatus {

    /**
     * PENDING: member-initiated SELL awaiting admin approval.
     * Holdings are not touched yet.
     */
    PENDING,

    /**
     * COMPLETED: trade took effect on the member's holdings.
     */
    COMPLETED,

    /**
     * CANCELLED: rejected while pending, or a reversed BUY.
     * TERMINAL STATE - no further transitions.
     */
    CANCELLED;

    /**
     * Validate state transition is legal.
     *
     * @param to the target state
     * @param tradeType type of the trade being moved
     * @return true if transition is valid
     */
    public boolean canTransitionTo(TradeStatus to, TradeType tradeType) {
        return switch (this) {
            case PENDING -> to == COMPLETED || to == CANCELLED;
            case COMPLETED -> to == CANCELLED && tradeType == TradeType.BUY;
            case CANCELLED -> false;
        };
    }
}
