package com.gold.ledger.gold_ledger.service;

import com.gold.ledger.gold_ledger.entity.GoldRate;
import com.gold.ledger.gold_ledger.exception.LedgerErrorKind;
import com.gold.ledger.gold_ledger.exception.TradeLedgerException;
import com.gold.ledger.gold_ledger.repositories.GoldRateRepository;
import com.gold.ledger.gold_ledger.support.InMemoryLedgerStore;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.OptimisticLockingFailureException;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RateStoreTest {

    private InMemoryLedgerStore store;
    private RateStore rateStore;

    @BeforeEach
    void setUp() {
        store = new InMemoryLedgerStore();
        rateStore = new RateStore(store.goldRateRepository());
    }

    @Test
    void testNoActiveRateBeforeFirstVersion() {
        TradeLedgerException ex = assertThrows(TradeLedgerException.class, () -> rateStore.getActive());
        assertEquals(LedgerErrorKind.NO_ACTIVE_RATE, ex.getKind());
        assertTrue(rateStore.findActive().isEmpty());
    }

    @Test
    void testNewVersionSupersedesActiveRate() {
        GoldRate first = rateStore.createVersion(new BigDecimal("6000"), new BigDecimal("5800"), null, "admin-1");
        GoldRate second = rateStore.createVersion(new BigDecimal("6100"), new BigDecimal("5900"), null, "admin-2");

        assertEquals(second.getId(), rateStore.getActive().getId());
        assertEquals(1, store.activeRates().size());
        assertFalse(rateStore.getById(first.getId()).isActive());
        assertEquals(2, rateStore.countAll());
        assertEquals(1, rateStore.countActive());
    }

    @Test
    void testEffectiveDateDefaultsToCreationTime() {
        GoldRate rate = rateStore.createVersion(new BigDecimal("6000"), new BigDecimal("5800"), null, "admin-1");
        assertEquals(rate.getCreatedAt(), rate.getEffectiveDate());

        Instant tomorrow = Instant.now().plusSeconds(86_400);
        GoldRate scheduled = rateStore.createVersion(new BigDecimal("6000"), new BigDecimal("5800"), tomorrow, "admin-1");
        assertEquals(tomorrow, scheduled.getEffectiveDate());
    }

    @Test
    void testHistoryIsNewestFirst() {
        GoldRate first = rateStore.createVersion(new BigDecimal("6000"), new BigDecimal("5800"), null, "admin-1");
        GoldRate second = rateStore.createVersion(new BigDecimal("6100"), new BigDecimal("5900"), null, "admin-1");

        List<GoldRate> history = rateStore.history();

        assertEquals(List.of(second.getId(), first.getId()), history.stream().map(GoldRate::getId).toList());
    }

    @Test
    void testUnknownRate() {
        TradeLedgerException ex = assertThrows(TradeLedgerException.class, () -> rateStore.getById("nope"));
        assertEquals(LedgerErrorKind.NOT_FOUND, ex.getKind());
    }

    @Test
    void testSecondActiveRateIsRejectedByIndex() {
        rateStore.createVersion(new BigDecimal("6000"), new BigDecimal("5800"), null, "admin-1");

        GoldRate racing = GoldRate.builder()
                .buyPrice(new BigDecimal("6200"))
                .sellPrice(new BigDecimal("6000"))
                .active(true)
                .createdAt(Instant.now())
                .build();

        assertThrows(DuplicateKeyException.class, () -> store.goldRateRepository().insert(racing));
        assertEquals(1, store.activeRates().size());
    }

    @Test
    void testRacingActivationSurfacesAsOptimisticLockFailure() {
        GoldRateRepository racingRepository = mock(GoldRateRepository.class);
        when(racingRepository.deactivateAllActive()).thenReturn(1L);
        when(racingRepository.insert(any(GoldRate.class)))
                .thenThrow(new DuplicateKeyException("E11000 duplicate key error index: single_active_idx"));

        OptimisticLockingFailureException ex = assertThrows(OptimisticLockingFailureException.class,
                () -> new RateStore(racingRepository)
                        .createVersion(new BigDecimal("6000"), new BigDecimal("5800"), null, "admin-1"));

        assertInstanceOf(DuplicateKeyException.class, ex.getCause());
        assertTrue(ConflictClassifier.isConflict(ex));
    }
}
