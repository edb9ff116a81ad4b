package com.gold.ledger.gold_ledger.repositories;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.data.mongodb.repository.Update;
import org.springframework.stereotype.Repository;

import com.gold.ledger.gold_ledger.entity.Trade;
import com.gold.ledger.gold_ledger.entity.TradeStatus;
import com.gold.ledger.gold_ledger.entity.TradeType;

import java.time.Instant;
import java.util.List;

/**
 * Repository for the trades ledger.
 *
 * New trades are insert()ed. Status changes go through atomicStatusTransition
 * so two admins acting on the same trade cannot both succeed, and legacy
 * trade documents are updated in place.
 */
@Repository
public interface TradeRepository extends MongoRepository<Trade, String> {

    List<Trade> findByMemberIdOrderByCreatedAtDesc(String memberId);

    /**
     * Trades of one member in a status; COMPLETED is used to rebuild holdings.
     */
    List<Trade> findByMemberIdAndStatus(String memberId, TradeStatus status);

    List<Trade> findByStatus(TradeStatus status);

    /**
     * Approval queue, oldest first.
     */
    List<Trade> findByTradeTypeAndStatusOrderByCreatedAtAsc(TradeType tradeType, TradeStatus status);

    long countByStatus(TradeStatus status);

    long countByTradeType(TradeType tradeType);

    long countByTradeTypeAndStatus(TradeType tradeType, TradeStatus status);

    long countByMemberId(String memberId);

    long countByMemberIdAndStatus(String memberId, TradeStatus status);

    long countByMemberIdAndTradeType(String memberId, TradeType tradeType);

    /**
     * ATOMIC status transition: only applies if the trade is still in expectedStatus.
     *
     * @return 1 if transitioned, 0 if the status had already changed
     */
    @Query("{ '_id': ?0, 'status': ?1 }")
    @Update("{ '$set': { 'status': ?2, 'approvedBy': ?3, 'updatedAt': ?4 } }")
    long atomicStatusTransition(String tradeId, TradeStatus expectedStatus, TradeStatus newStatus,
                                String approvedBy, Instant updatedAt);
}
