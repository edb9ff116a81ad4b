package com.gold.ledger.gold_ledger.repositories;

import org.bson.types.Decimal128;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.data.mongodb.repository.Update;
import org.springframework.stereotype.Repository;

import com.gold.ledger.gold_ledger.entity.Member;

import java.time.Instant;

/**
 * NOTE: Member.goldHoldings is a CACHED value of the trades ledger.
 *
 * Member documents belong to the profile service. This repository reads them
 * and changes goldHoldings in place; it never calls save(), which would
 * replace the document and drop the fields the ledger does not map.
 */
@Repository
public interface MemberRepository extends MongoRepository<Member, String> {

    /**
     * Compare-and-set of the cached holdings.
     *
     * Matches only while ledgerVersion still has the value read by the caller
     * (a null expected version matches documents without the field), then sets
     * goldHoldings/updatedAt and increments ledgerVersion. Other fields are left untouched.
     *
     * @return 1 if the write went through, 0 if the member changed or vanished meanwhile
     */
    @Query("{ '_id': ?0, 'ledgerVersion': ?1 }")
    @Update("{ '$set': { 'goldHoldings': ?2, 'updatedAt': ?3 }, '$inc': { 'ledgerVersion': 1 } }")
    long updateHoldingsIfUnchanged(String memberId, Long expectedLedgerVersion, Decimal128 goldHoldings,
                                   Instant updatedAt);
}
