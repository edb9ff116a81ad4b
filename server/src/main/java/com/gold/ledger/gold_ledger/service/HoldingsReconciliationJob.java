package com.gold.ledger.gold_ledger.service;

import com.gold.ledger.gold_ledger.config.LedgerProperties;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic reconciliation job - detects (and optionally repairs) drift between
 * cached holdings and the trades ledger. Off unless ledger.reconciliation.enabled=true.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "ledger.reconciliation", name = "enabled", havingValue = "true")
public class HoldingsReconciliationJob {

    private final TradeLedgerFacade tradeLedgerFacade;
    private final LedgerProperties ledgerProperties;

    @Scheduled(fixedDelayString = "${ledger.reconciliation.interval:PT5M}",
            initialDelayString = "${ledger.reconciliation.interval:PT5M}")
    public void reconcileAllHoldings() {
        try {
            tradeLedgerFacade.reconcileAllHoldings(ledgerProperties.getReconciliation().isRepair());
        } catch (RuntimeException e) {
            // next run retries; the job must not die with the scheduler thread
            log.error("Holdings reconciliation failed: {}", e.getMessage(), e);
        }
    }
}
