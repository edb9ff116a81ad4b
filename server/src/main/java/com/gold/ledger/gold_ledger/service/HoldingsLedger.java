package com.gold.ledger.gold_ledger.service;

import com.gold.ledger.gold_ledger.entity.Member;
import com.gold.ledger.gold_ledger.exception.TradeLedgerException;
import com.gold.ledger.gold_ledger.repositories.MemberRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.bson.types.Decimal128;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * The only writer of Member.goldHoldings.
 *
 * Invariant: holdings(member) = Σ completed BUY - Σ completed SELL, never negative.
 *
 * Every adjustment reads the member, checks the result and writes it back with
 * a compare-and-set on ledgerVersion that touches goldHoldings only. A concurrent
 * adjustment of the same member therefore fails with an optimistic-lock
 * conflict instead of losing an update. Callers run it inside the same
 * transaction as the trade write that triggers it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HoldingsLedger {

    /**
     * What to do when an adjustment would take holdings below zero.
     */
    public enum AdjustPolicy {
        REJECT_NEGATIVE,
        /** BUY reversal only; the caller has already checked holdings. */
        CLAMP_AT_ZERO
    }

    private final MemberRepository memberRepository;

    public Member requireMember(String memberId) {
        return memberRepository.findById(memberId)
                .orElseThrow(() -> TradeLedgerException.notFound("Member", memberId));
    }

    /**
     * Current holdings in grams.
     */
    public BigDecimal get(String memberId) {
        return holdingsOf(requireMember(memberId));
    }

    /**
     * Ensure the member can give up the given quantity (SELL create/approve).
     *
     * @throws TradeLedgerException INSUFFICIENT_HOLDINGS otherwise
     */
    public void requireSellable(String memberId, BigDecimal quantity) {
        BigDecimal holdings = get(memberId);
        if (holdings.compareTo(quantity) < 0) {
            log.warn("Sell rejected: memberId={}, holdings={}, requested={}", memberId, holdings, quantity);
            throw TradeLedgerException.insufficientHoldings(memberId, holdings, quantity);
        }
    }

    /**
     * Ensure a completed BUY of the given quantity can still be taken back.
     *
     * @throws TradeLedgerException CANNOT_REVERSE otherwise
     */
    public void requireReversible(String memberId, BigDecimal quantity) {
        BigDecimal holdings = get(memberId);
        if (holdings.compareTo(quantity) < 0) {
            log.warn("Buy reversal rejected: memberId={}, holdings={}, bought={}", memberId, holdings, quantity);
            throw TradeLedgerException.cannotReverse(memberId, holdings, quantity);
        }
    }

    public BigDecimal adjust(String memberId, BigDecimal delta) {
        return adjust(memberId, delta, AdjustPolicy.REJECT_NEGATIVE);
    }

    /**
     * Apply a signed change to the member's holdings.
     *
     * @param memberId the member
     * @param delta grams to add (positive) or remove (negative)
     * @param policy behaviour when the result would be negative
     * @return the new holdings
     * @throws TradeLedgerException INSUFFICIENT_HOLDINGS when rejected
     * @throws OptimisticLockingFailureException when another write got there first
     */
    public BigDecimal adjust(String memberId, BigDecimal delta, AdjustPolicy policy) {
        Member member = requireMember(memberId);
        BigDecimal current = holdingsOf(member);
        BigDecimal next = current.add(delta);

        if (next.signum() < 0) {
            if (policy != AdjustPolicy.CLAMP_AT_ZERO) {
                throw TradeLedgerException.insufficientHoldings(memberId, current, delta.negate());
            }
            log.warn("Holdings clamped at zero: memberId={}, holdings={}, delta={}", memberId, current, delta);
            next = BigDecimal.ZERO;
        }

        long modified = memberRepository.updateHoldingsIfUnchanged(
                memberId, member.getLedgerVersion(), new Decimal128(next), Instant.now());
        if (modified == 0) {
            throw new OptimisticLockingFailureException(String.format(
                    "Holdings of member %s changed concurrently (ledgerVersion=%s)",
                    memberId, member.getLedgerVersion()));
        }

        log.debug("Holdings adjusted: memberId={}, {} -> {} (delta={})", memberId, current, next, delta);
        return next;
    }

    private static BigDecimal holdingsOf(Member member) {
        return member.getGoldHoldings() != null ? member.getGoldHoldings() : BigDecimal.ZERO;
    }
}
