package com.gold.ledger.gold_ledger.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;

@Getter
@AllArgsConstructor
@Builder
public class DashboardStatistics {

    private final long totalMembers;
    private final BigDecimal totalGoldHoldings;
    private final long pendingSellRequests;
}
