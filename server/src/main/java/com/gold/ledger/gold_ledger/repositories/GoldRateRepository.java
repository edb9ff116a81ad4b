package com.gold.ledger.gold_ledger.repositories;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.data.mongodb.repository.Update;
import org.springframework.stereotype.Repository;

import com.gold.ledger.gold_ledger.entity.GoldRate;

import java.util.List;
import java.util.Optional;

@Repository
public interface GoldRateRepository extends MongoRepository<GoldRate, String> {

    /**
     * The active rate; most recent first in case a legacy dataset holds more than one.
     */
    Optional<GoldRate> findFirstByActiveTrueOrderByCreatedAtDesc();

    /**
     * Rate history, newest first.
     */
    List<GoldRate> findAllByOrderByCreatedAtDesc();

    long countByActiveTrue();

    /**
     * Deactivate every active rate. Must run in the same transaction as the
     * insert of the next version.
     *
     * @return number of documents modified
     */
    @Query("{ 'isActive': true }")
    @Update("{ '$set': { 'isActive': false } }")
    long deactivateAllActive();
}
