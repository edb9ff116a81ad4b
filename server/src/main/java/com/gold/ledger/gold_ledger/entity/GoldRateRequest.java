package com.gold.ledger.gold_ledger.entity;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;

@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class GoldRateRequest {

    BigDecimal buyPrice;
    BigDecimal sellPrice;

    /**
     * Optional; defaults to the creation time.
     */
    Instant effectiveDate;

    String adminId;
}
