package com.gold.ledger.gold_ledger.entity;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;

/**
 * Request to create a trade, as handed over by the HTTP layer once the caller
 * has been authenticated.
 */
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class TradeRequest {

    String memberId;
    TradeType tradeType;
    BigDecimal quantity; // grams
    String notes;

    /**
     * Admin or member creating the trade.
     */
    String initiatorId;
    boolean admin;
}
