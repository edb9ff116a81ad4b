package com.gold.ledger.gold_ledger.service;

import com.gold.ledger.gold_ledger.entity.DashboardStatistics;
import com.gold.ledger.gold_ledger.entity.GoldRate;
import com.gold.ledger.gold_ledger.entity.GoldRateRequest;
import com.gold.ledger.gold_ledger.entity.GoldRateStatistics;
import com.gold.ledger.gold_ledger.entity.HoldingsReconciliation;
import com.gold.ledger.gold_ledger.entity.Member;
import com.gold.ledger.gold_ledger.entity.Trade;
import com.gold.ledger.gold_ledger.entity.TradeRequest;
import com.gold.ledger.gold_ledger.entity.TradeStatistics;
import com.gold.ledger.gold_ledger.entity.TradeStatus;
import com.gold.ledger.gold_ledger.entity.TradeType;
import com.gold.ledger.gold_ledger.exception.TradeLedgerException;
import com.gold.ledger.gold_ledger.repositories.MemberRepository;
import com.gold.ledger.gold_ledger.repositories.TradeRepository;

import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Entry point of the ledger for the HTTP layer.
 *
 * Each write runs as one transaction: trade write + holdings write, or rate
 * deactivation + insertion, commit together or not at all. A transaction that
 * loses a concurrency race is re-run from scratch (re-reading and re-checking
 * everything) a bounded number of times before CONFLICT is reported. Business
 * errors are never retried.
 *
 * Caller identity and admin role come from the authentication layer.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TradeLedgerFacade {

    private final TradeStateMachine tradeStateMachine;
    private final RateStore rateStore;
    private final HoldingsLedger holdingsLedger;
    private final HoldingsReconciler holdingsReconciler;
    private final TradeValidator tradeValidator;
    private final LedgerStatisticsService ledgerStatisticsService;
    private final TradeRepository tradeRepository;
    private final MemberRepository memberRepository;
    private final TransactionOperations transactionOperations;
    private final Retry conflictRetry;

    // ===== Trades =====

    public Trade createTrade(String memberId, TradeType tradeType, BigDecimal quantity, String notes,
                             String initiatorId, boolean isAdmin) {
        return createTrade(TradeRequest.builder()
                .memberId(memberId)
                .tradeType(tradeType)
                .quantity(quantity)
                .notes(notes)
                .initiatorId(initiatorId)
                .admin(isAdmin)
                .build());
    }

    public Trade createTrade(TradeRequest request) {
        return inTransaction("createTrade", () -> tradeStateMachine.create(request));
    }

    public Trade updateTradeStatus(String tradeId, TradeStatus newStatus, String adminId) {
        return inTransaction("updateTradeStatus", () -> tradeStateMachine.updateStatus(tradeId, newStatus, adminId));
    }

    public Trade cancelTrade(String tradeId, String adminId) {
        return inTransaction("cancelTrade", () -> tradeStateMachine.cancel(tradeId, adminId));
    }

    public Trade getTrade(String tradeId) {
        return tradeStateMachine.requireTrade(tradeId);
    }

    /**
     * Member's trades, newest first.
     */
    public List<Trade> getMemberTrades(String memberId) {
        holdingsLedger.requireMember(memberId);
        return tradeRepository.findByMemberIdOrderByCreatedAtDesc(memberId);
    }

    /**
     * SELL requests awaiting approval, oldest first.
     */
    public List<Trade> getPendingSellTrades() {
        return tradeRepository.findByTradeTypeAndStatusOrderByCreatedAtAsc(TradeType.SELL, TradeStatus.PENDING);
    }

    public BigDecimal getHoldings(String memberId) {
        return holdingsLedger.get(memberId);
    }

    // ===== Gold rates =====

    public GoldRate createGoldRateVersion(BigDecimal buyPrice, BigDecimal sellPrice, Instant effectiveDate,
                                          String adminId) {
        return createGoldRateVersion(GoldRateRequest.builder()
                .buyPrice(buyPrice)
                .sellPrice(sellPrice)
                .effectiveDate(effectiveDate)
                .adminId(adminId)
                .build());
    }

    public GoldRate createGoldRateVersion(GoldRateRequest request) {
        tradeValidator.validate(request).orThrow();
        return inTransaction("createGoldRateVersion", () -> rateStore.createVersion(
                request.getBuyPrice(), request.getSellPrice(), request.getEffectiveDate(), request.getAdminId()));
    }

    public GoldRate getActiveGoldRate() {
        return rateStore.getActive();
    }

    public GoldRate getGoldRate(String rateId) {
        return rateStore.getById(rateId);
    }

    public List<GoldRate> getGoldRateHistory() {
        return rateStore.history();
    }

    // ===== Statistics =====

    /**
     * @param memberId one member, or null for all trades
     */
    public TradeStatistics getTradeStatistics(String memberId) {
        if (memberId != null) {
            holdingsLedger.requireMember(memberId);
        }
        return ledgerStatisticsService.tradeStatistics(memberId);
    }

    public GoldRateStatistics getGoldRateStatistics() {
        return ledgerStatisticsService.goldRateStatistics();
    }

    public DashboardStatistics getDashboardStatistics() {
        return ledgerStatisticsService.dashboardStatistics();
    }

    // ===== Reconciliation =====

    public HoldingsReconciliation reconcileHoldings(String memberId, boolean repair) {
        return inTransaction("reconcileHoldings", () -> holdingsReconciler.reconcile(memberId, repair));
    }

    /**
     * Reconcile every member, one transaction each.
     *
     * @return members whose cached holdings drifted from the ledger
     */
    public List<HoldingsReconciliation> reconcileAllHoldings(boolean repair) {
        log.info("Starting holdings reconciliation from ledger (repair={})...", repair);

        List<HoldingsReconciliation> drifted = new ArrayList<>();
        int checked = 0;
        int failed = 0;
        for (Member member : memberRepository.findAll()) {
            checked++;
            try {
                HoldingsReconciliation result = reconcileHoldings(member.getId(), repair);
                if (result.hasDrift()) {
                    drifted.add(result);
                }
            } catch (RuntimeException e) {
                // one broken member must not stop the sweep
                failed++;
                log.error("Holdings reconciliation failed for member {}: {}", member.getId(), e.getMessage(), e);
            }
        }

        log.info("Holdings reconciliation complete: {} members checked, {} drifted, {} failed",
                checked, drifted.size(), failed);
        return drifted;
    }

    private <T> T inTransaction(String operation, Supplier<T> work) {
        Supplier<T> transactional = () -> transactionOperations.execute(status -> work.get());
        try {
            return Retry.decorateSupplier(conflictRetry, transactional).get();
        } catch (RuntimeException e) {
            if (ConflictClassifier.isConflict(e)) {
                int attempts = conflictRetry.getRetryConfig().getMaxAttempts();
                log.warn("{} gave up after {} conflicting attempts: {}", operation, attempts, e.getMessage());
                throw TradeLedgerException.conflict(operation, attempts, e);
            }
            throw e;
        }
    }
}
