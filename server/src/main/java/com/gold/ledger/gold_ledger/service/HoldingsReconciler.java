package com.gold.ledger.gold_ledger.service;

import com.gold.ledger.gold_ledger.entity.HoldingsReconciliation;
import com.gold.ledger.gold_ledger.entity.Trade;
import com.gold.ledger.gold_ledger.entity.TradeStatus;
import com.gold.ledger.gold_ledger.repositories.TradeRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;

/**
 * Audits member holdings against the trades ledger.
 * The ledger (completed trades) is the SOURCE OF TRUTH.
 * Member.goldHoldings is a CACHED value maintained by HoldingsLedger.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HoldingsReconciler {

    private final TradeRepository tradeRepository;
    private final HoldingsLedger holdingsLedger;

    /**
     * Compute a member's holdings from the ledger: completed BUYs minus completed SELLs.
     * A reversed BUY is CANCELLED and therefore contributes nothing.
     * WARNING: This is O(n) in the member's trades and should not be used in hot paths.
     *
     * @param memberId the member
     * @return holdings according to the ledger
     */
    public BigDecimal ledgerHoldings(String memberId) {
        List<Trade> completed = tradeRepository.findByMemberIdAndStatus(memberId, TradeStatus.COMPLETED);

        BigDecimal holdings = BigDecimal.ZERO;
        for (Trade trade : completed) {
            holdings = holdings.add(trade.holdingsDelta());
        }
        return holdings;
    }

    /**
     * Compare cached and ledger holdings for one member. Must run inside a
     * ledger transaction when repair is requested.
     *
     * @param memberId the member
     * @param repair move the cached counter to the ledger value on drift
     * @return comparison result
     */
    public HoldingsReconciliation reconcile(String memberId, boolean repair) {
        BigDecimal cached = holdingsLedger.get(memberId);
        BigDecimal ledger = ledgerHoldings(memberId);
        BigDecimal drift = cached.subtract(ledger);

        boolean corrected = false;
        if (drift.signum() != 0) {
            log.warn("Holdings drift detected for member {}: cached={}, ledger={}", memberId, cached, ledger);
            if (repair) {
                holdingsLedger.adjust(memberId, drift.negate());
                corrected = true;
                log.info("Holdings repaired for member {}: {} -> {}", memberId, cached, ledger);
            }
        } else {
            log.debug("Holdings in sync for member {}: {}", memberId, cached);
        }

        return HoldingsReconciliation.builder()
                .memberId(memberId)
                .cachedHoldings(cached)
                .ledgerHoldings(ledger)
                .drift(drift)
                .corrected(corrected)
                .build();
    }
}
