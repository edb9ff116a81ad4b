package com.gold.ledger.gold_ledger.service;

import com.gold.ledger.gold_ledger.config.LedgerProperties;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HoldingsReconciliationJobTest {

    @Mock
    private TradeLedgerFacade tradeLedgerFacade;

    @Test
    void testRunsWithConfiguredRepairFlag() {
        LedgerProperties properties = new LedgerProperties();
        properties.getReconciliation().setRepair(true);
        when(tradeLedgerFacade.reconcileAllHoldings(true)).thenReturn(List.of());

        new HoldingsReconciliationJob(tradeLedgerFacade, properties).reconcileAllHoldings();

        verify(tradeLedgerFacade).reconcileAllHoldings(true);
    }

    @Test
    void testFailureDoesNotEscapeScheduler() {
        LedgerProperties properties = new LedgerProperties();
        when(tradeLedgerFacade.reconcileAllHoldings(false))
                .thenThrow(new DataAccessResourceFailureException("mongo down"));

        HoldingsReconciliationJob job = new HoldingsReconciliationJob(tradeLedgerFacade, properties);

        assertDoesNotThrow(job::reconcileAllHoldings);
    }
}
