package com.gold.ledger.gold_ledger.support;

import com.gold.ledger.gold_ledger.config.LedgerConfig;
import com.gold.ledger.gold_ledger.config.LedgerProperties;
import com.gold.ledger.gold_ledger.service.HoldingsLedger;
import com.gold.ledger.gold_ledger.service.HoldingsReconciler;
import com.gold.ledger.gold_ledger.service.LedgerStatisticsService;
import com.gold.ledger.gold_ledger.service.RateStore;
import com.gold.ledger.gold_ledger.service.TradeLedgerFacade;
import com.gold.ledger.gold_ledger.service.TradeStateMachine;
import com.gold.ledger.gold_ledger.service.TradeValidator;

import io.github.resilience4j.retry.Retry;

import java.time.Duration;

/**
 * The ledger services wired by hand on top of an {@link InMemoryLedgerStore}.
 */
public class LedgerFixture {

    public final InMemoryLedgerStore store = new InMemoryLedgerStore();
    public final LedgerProperties properties = new LedgerProperties();
    public final TradeValidator validator = new TradeValidator();
    public final RateStore rateStore = new RateStore(store.goldRateRepository());
    public final HoldingsLedger holdingsLedger = new HoldingsLedger(store.memberRepository());
    public final TradeStateMachine stateMachine =
            new TradeStateMachine(store.tradeRepository(), rateStore, holdingsLedger, validator);
    public final HoldingsReconciler reconciler = new HoldingsReconciler(store.tradeRepository(), holdingsLedger);
    public final LedgerStatisticsService statistics =
            new LedgerStatisticsService(store.tradeRepository(), store.memberRepository(), rateStore);
    public final Retry conflictRetry;
    public final TradeLedgerFacade facade;

    public LedgerFixture() {
        properties.getConflict().setWaitDuration(Duration.ofMillis(1));
        conflictRetry = new LedgerConfig().tradeLedgerConflictRetry(properties);
        facade = new TradeLedgerFacade(stateMachine, rateStore, holdingsLedger, reconciler, validator, statistics,
                store.tradeRepository(), store.memberRepository(), store.transactionOperations(), conflictRetry);
    }
}
