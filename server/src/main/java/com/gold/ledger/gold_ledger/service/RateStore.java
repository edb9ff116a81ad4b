package com.gold.ledger.gold_ledger.service;

import com.gold.ledger.gold_ledger.entity.GoldRate;
import com.gold.ledger.gold_ledger.exception.TradeLedgerException;
import com.gold.ledger.gold_ledger.repositories.GoldRateRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Versioned gold rates with exactly one active version.
 *
 * createVersion deactivates the current version and inserts the next one. Both
 * writes must share the caller's transaction; a concurrent creator is stopped
 * by the transaction's write conflict or by the single-active partial index.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RateStore {

    private final GoldRateRepository goldRateRepository;

    /**
     * @return the active rate
     * @throws TradeLedgerException NO_ACTIVE_RATE before the first rate is created
     */
    public GoldRate getActive() {
        return findActive().orElseThrow(TradeLedgerException::noActiveRate);
    }

    public Optional<GoldRate> findActive() {
        return goldRateRepository.findFirstByActiveTrueOrderByCreatedAtDesc();
    }

    /**
     * Supersede the active rate with a new version.
     *
     * @param buyPrice INR per gram members pay on BUY
     * @param sellPrice INR per gram members receive on SELL
     * @param effectiveDate when the rate takes effect; now if null
     * @param createdBy admin id
     * @return the new active version
     */
    public GoldRate createVersion(BigDecimal buyPrice, BigDecimal sellPrice, Instant effectiveDate, String createdBy) {
        Instant now = Instant.now();

        long deactivated = goldRateRepository.deactivateAllActive();

        GoldRate rate = GoldRate.builder()
                .buyPrice(buyPrice)
                .sellPrice(sellPrice)
                .active(true)
                .effectiveDate(effectiveDate != null ? effectiveDate : now)
                .createdBy(createdBy)
                .createdAt(now)
                .build();
        try {
            rate = goldRateRepository.insert(rate);
        } catch (DuplicateKeyException e) {
            // single_active_idx: another version was activated after our deactivation
            throw new OptimisticLockingFailureException("Another gold rate version was activated concurrently", e);
        }

        log.info("Gold rate version created: rateId={}, buy={}, sell={}, createdBy={}, superseded={}",
                rate.getId(), buyPrice, sellPrice, createdBy, deactivated);
        return rate;
    }

    public GoldRate getById(String rateId) {
        return goldRateRepository.findById(rateId)
                .orElseThrow(() -> TradeLedgerException.notFound("Gold rate", rateId));
    }

    /**
     * All versions, newest first.
     */
    public List<GoldRate> history() {
        return goldRateRepository.findAllByOrderByCreatedAtDesc();
    }

    public long countAll() {
        return goldRateRepository.count();
    }

    public long countActive() {
        return goldRateRepository.countByActiveTrue();
    }
}
