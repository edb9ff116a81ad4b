package com.gold.ledger.gold_ledger.service;

import com.gold.ledger.gold_ledger.entity.GoldRate;
import com.gold.ledger.gold_ledger.entity.Money;
import com.gold.ledger.gold_ledger.entity.Trade;
import com.gold.ledger.gold_ledger.entity.TradeRequest;
import com.gold.ledger.gold_ledger.entity.TradeStatus;
import com.gold.ledger.gold_ledger.entity.TradeType;
import com.gold.ledger.gold_ledger.exception.TradeLedgerException;
import com.gold.ledger.gold_ledger.repositories.TradeRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Trade lifecycle - create, approve/reject, reverse.
 *
 * Create Flow:
 * 1. Validate request (TradeValidator)
 * 2. Resolve member and active gold rate
 * 3. Price the trade: rateAtTrade from the rate, totalAmount = quantity × rateAtTrade
 * 4. SELL: check holdings
 * 5. Pick status: BUY and admin SELL → COMPLETED, member SELL → PENDING
 * 6. Persist the trade
 * 7. COMPLETED: adjust holdings (HoldingsLedger)
 *
 * CRITICAL PROPERTIES:
 * - Every method must run inside one ledger transaction (TradeLedgerFacade);
 *   the trade write and the holdings write commit together or not at all
 * - Holdings are checked again inside the transaction that mutates them
 * - Status changes are conditional on the status that was read, so two admins acting
 *   on the same trade conflict
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TradeStateMachine {

    private final TradeRepository tradeRepository;
    private final RateStore rateStore;
    private final HoldingsLedger holdingsLedger;
    private final TradeValidator tradeValidator;

    /**
     * Create a trade at the active gold rate.
     *
     * @param request validated trade request
     * @return the persisted trade
     */
    public Trade create(TradeRequest request) {
        tradeValidator.validate(request).orThrow();

        String memberId = request.getMemberId();
        TradeType tradeType = request.getTradeType();
        BigDecimal quantity = request.getQuantity();

        holdingsLedger.requireMember(memberId);
        GoldRate rate = rateStore.getActive();

        // the rate is frozen exactly as published; only the total is rounded
        BigDecimal rateAtTrade = rate.priceFor(tradeType);
        Money totalAmount = Money.total(rateAtTrade, quantity);

        if (tradeType == TradeType.SELL) {
            holdingsLedger.requireSellable(memberId, quantity);
        }

        // BUY is admin-only and always completes; SELL waits for approval unless an admin entered it
        TradeStatus status = tradeType == TradeType.BUY || request.isAdmin()
                ? TradeStatus.COMPLETED
                : TradeStatus.PENDING;

        Instant now = Instant.now();
        Trade trade = Trade.builder()
                .memberId(memberId)
                .tradeType(tradeType)
                .quantity(quantity)
                .rateAtTrade(rateAtTrade)
                .totalAmount(totalAmount.toBigDecimal())
                .status(status)
                .goldRateId(rate.getId())
                .initiatedBy(request.getInitiatorId())
                .notes(request.getNotes())
                .createdAt(now)
                .updatedAt(now)
                .build();

        trade = tradeRepository.insert(trade);

        if (status == TradeStatus.COMPLETED) {
            holdingsLedger.adjust(memberId, trade.holdingsDelta());
        }

        log.info("Trade created: tradeId={}, memberId={}, type={}, qty={}, rate={}, total={}, status={}, initiatedBy={}",
                trade.getId(), memberId, tradeType, quantity, rateAtTrade, totalAmount, status, request.getInitiatorId());
        return trade;
    }

    /**
     * Approve (COMPLETED) or reject (CANCELLED) a pending trade.
     *
     * @param tradeId the trade
     * @param newStatus COMPLETED or CANCELLED
     * @param adminId admin recorded as approver
     * @return the updated trade
     */
    public Trade updateStatus(String tradeId, TradeStatus newStatus, String adminId) {
        tradeValidator.validateStatusUpdate(tradeId, newStatus, adminId).orThrow();

        Trade trade = requireTrade(tradeId);

        if (trade.getStatus() != TradeStatus.PENDING) {
            throw TradeLedgerException.invalidTransition(String.format(
                    "Cannot modify %s trade %s: only pending trades can be approved or rejected",
                    trade.getStatus(), tradeId));
        }
        if (!trade.getStatus().canTransitionTo(newStatus, trade.getTradeType())) {
            throw TradeLedgerException.invalidTransition(String.format(
                    "Pending trade %s can only move to COMPLETED or CANCELLED, not %s", tradeId, newStatus));
        }

        // holdings may have changed since the request was filed
        if (newStatus == TradeStatus.COMPLETED && trade.getTradeType() == TradeType.SELL) {
            holdingsLedger.requireSellable(trade.getMemberId(), trade.getQuantity());
        }

        trade.transitionTo(newStatus, adminId);
        writeTransition(trade, TradeStatus.PENDING);

        if (newStatus == TradeStatus.COMPLETED) {
            holdingsLedger.adjust(trade.getMemberId(), trade.holdingsDelta());
        }

        log.info("Trade {}: tradeId={}, memberId={}, type={}, qty={}, adminId={}",
                newStatus == TradeStatus.COMPLETED ? "approved" : "rejected",
                tradeId, trade.getMemberId(), trade.getTradeType(), trade.getQuantity(), adminId);
        return trade;
    }

    /**
     * Reverse a completed BUY: the member gives the gold back.
     *
     * @param tradeId the BUY trade
     * @param adminId admin performing the reversal
     * @return the cancelled trade
     */
    public Trade cancel(String tradeId, String adminId) {
        tradeValidator.validateCancel(tradeId, adminId).orThrow();

        Trade trade = requireTrade(tradeId);

        if (trade.getTradeType() != TradeType.BUY) {
            throw TradeLedgerException.invalidTransition(String.format(
                    "Only BUY trades can be cancelled (tradeId=%s, type=%s)", tradeId, trade.getTradeType()));
        }
        if (trade.getStatus() != TradeStatus.COMPLETED) {
            throw TradeLedgerException.invalidTransition(String.format(
                    "Only completed trades can be cancelled (tradeId=%s, status=%s)", tradeId, trade.getStatus()));
        }

        holdingsLedger.requireReversible(trade.getMemberId(), trade.getQuantity());

        trade.transitionTo(TradeStatus.CANCELLED, adminId);
        writeTransition(trade, TradeStatus.COMPLETED);

        BigDecimal remaining = holdingsLedger.adjust(trade.getMemberId(), trade.holdingsDelta().negate(),
                HoldingsLedger.AdjustPolicy.CLAMP_AT_ZERO);

        log.info("Trade reversed: tradeId={}, memberId={}, qty={}, holdingsAfter={}, adminId={}",
                tradeId, trade.getMemberId(), trade.getQuantity(), remaining, adminId);
        return trade;
    }

    /**
     * Persist the in-memory transition, conditional on the trade still being in fromStatus.
     */
    private void writeTransition(Trade trade, TradeStatus fromStatus) {
        long modified = tradeRepository.atomicStatusTransition(trade.getId(), fromStatus, trade.getStatus(),
                trade.getApprovedBy(), trade.getUpdatedAt());
        if (modified == 0) {
            throw new OptimisticLockingFailureException(String.format(
                    "Trade %s is no longer %s; it was changed concurrently", trade.getId(), fromStatus));
        }
    }

    public Trade requireTrade(String tradeId) {
        return tradeRepository.findById(tradeId)
                .orElseThrow(() -> TradeLedgerException.notFound("Trade", tradeId));
    }
}
