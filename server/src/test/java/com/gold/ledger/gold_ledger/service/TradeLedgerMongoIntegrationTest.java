package com.gold.ledger.gold_ledger.service;

import com.gold.ledger.gold_ledger.config.LedgerConfig;
import com.gold.ledger.gold_ledger.config.MongoConfig;
import com.gold.ledger.gold_ledger.entity.GoldRate;
import com.gold.ledger.gold_ledger.entity.Trade;
import com.gold.ledger.gold_ledger.entity.TradeStatus;
import com.gold.ledger.gold_ledger.entity.TradeType;
import com.gold.ledger.gold_ledger.exception.LedgerErrorKind;
import com.gold.ledger.gold_ledger.exception.TradeLedgerException;

import org.bson.Document;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.mongo.DataMongoTest;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.springframework.context.annotation.Import;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.IndexInfo;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * The ledger against a real single-node MongoDB replica set: partial updates,
 * the single-active index and multi-document transactions.
 */
@Testcontainers(disabledWithoutDocker = true)
@DataMongoTest(properties = {
        "spring.data.mongodb.auto-index-creation=true",
        "ledger.conflict.max-attempts=5",
        "ledger.conflict.wait-duration=20ms"
})
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Import({MongoConfig.class, LedgerConfig.class, TradeValidator.class, RateStore.class, HoldingsLedger.class,
        TradeStateMachine.class, HoldingsReconciler.class, LedgerStatisticsService.class, TradeLedgerFacade.class})
class TradeLedgerMongoIntegrationTest {

    @Container
    @ServiceConnection
    static MongoDBContainer mongo = new MongoDBContainer("mongo:7.0");

    @Autowired
    private MongoTemplate mongoTemplate;

    @Autowired
    private TradeLedgerFacade facade;

    @BeforeEach
    void setUp() {
        // remove rather than drop so the indexes stay in place
        mongoTemplate.remove(new Query(), "members");
        mongoTemplate.remove(new Query(), "trades");
        mongoTemplate.remove(new Query(), "gold_rates");
        facade.createGoldRateVersion(new BigDecimal("6000"), new BigDecimal("5800"), null, "admin-1");
    }

    /**
     * A member document as the profile service writes it: no ledgerVersion and
     * fields the ledger does not map.
     */
    private String insertProfileMember(String holdings) {
        ObjectId id = new ObjectId();
        mongoTemplate.getCollection("members").insertOne(new Document("_id", id)
                .append("name", "Asha")
                .append("email", id.toHexString() + "@example.com")
                .append("password", "$2a$10$hashedsecret")
                .append("phone", "+91-9800000000")
                .append("resetPasswordToken", "reset-123")
                .append("goldHoldings", new Decimal128(new BigDecimal(holdings)))
                .append("isActive", true)
                .append("createdAt", Instant.now()));
        return id.toHexString();
    }

    private Document rawMember(String memberId) {
        return mongoTemplate.getCollection("members").find(new Document("_id", new ObjectId(memberId))).first();
    }

    private void assertHoldings(String expected, String memberId) {
        assertEquals(0, new BigDecimal(expected).compareTo(facade.getHoldings(memberId)),
                () -> "holdings of " + memberId + " were " + facade.getHoldings(memberId));
    }

    @Test
    void testAdjustOfUnversionedMemberKeepsProfileFields() {
        String memberId = insertProfileMember("1.5");

        Trade buy = facade.createTrade(memberId, TradeType.BUY, new BigDecimal("2"), null, "admin-1", true);

        assertEquals(TradeStatus.COMPLETED, buy.getStatus());
        assertHoldings("3.5", memberId);

        Document raw = rawMember(memberId);
        assertEquals("$2a$10$hashedsecret", raw.getString("password"));
        assertEquals("+91-9800000000", raw.getString("phone"));
        assertEquals("reset-123", raw.getString("resetPasswordToken"));
        assertEquals("Asha", raw.getString("name"));
        assertEquals(1L, ((Number) raw.get("ledgerVersion")).longValue());
        assertEquals(0, new BigDecimal("3.5").compareTo(raw.get("goldHoldings", Decimal128.class).bigDecimalValue()));
    }

    @Test
    void testNewVersionLeavesExactlyOneActiveRate() {
        GoldRate second = facade.createGoldRateVersion(new BigDecimal("6100"), new BigDecimal("5900"), null, "admin-1");

        long active = mongoTemplate.getCollection("gold_rates").countDocuments(new Document("isActive", true));
        assertEquals(1, active);
        assertEquals(second.getId(), facade.getActiveGoldRate().getId());
        assertEquals(2, facade.getGoldRateHistory().size());

        List<String> indexes = mongoTemplate.indexOps(GoldRate.class).getIndexInfo().stream()
                .map(IndexInfo::getName)
                .toList();
        assertTrue(indexes.contains("single_active_idx"), () -> "indexes were " + indexes);
    }

    @Test
    void testConcurrentApprovalsOfSellsNeverOverdraw() throws Exception {
        String memberId = insertProfileMember("10");
        Trade first = facade.createTrade(memberId, TradeType.SELL, new BigDecimal("8"), null, memberId, false);
        Trade second = facade.createTrade(memberId, TradeType.SELL, new BigDecimal("8"), null, memberId, false);

        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Trade>> results = new ArrayList<>();
        try {
            for (Trade sell : List.of(first, second)) {
                Callable<Trade> approve = () -> {
                    start.await();
                    return facade.updateTradeStatus(sell.getId(), TradeStatus.COMPLETED, "admin-1");
                };
                results.add(executor.submit(approve));
            }
            start.countDown();

            int completed = 0;
            int rejected = 0;
            for (Future<Trade> result : results) {
                try {
                    result.get(30, TimeUnit.SECONDS);
                    completed++;
                } catch (ExecutionException e) {
                    TradeLedgerException cause = assertInstanceOf(TradeLedgerException.class, e.getCause());
                    assertEquals(LedgerErrorKind.INSUFFICIENT_HOLDINGS, cause.getKind());
                    rejected++;
                }
            }

            assertEquals(1, completed);
            assertEquals(1, rejected);
        } finally {
            executor.shutdownNow();
        }

        assertHoldings("2", memberId);
        List<TradeStatus> statuses = List.of(
                facade.getTrade(first.getId()).getStatus(), facade.getTrade(second.getId()).getStatus());
        assertTrue(statuses.contains(TradeStatus.COMPLETED));
        assertTrue(statuses.contains(TradeStatus.PENDING));
        assertFalse(facade.reconcileHoldings(memberId, false).hasDrift());
    }
}
