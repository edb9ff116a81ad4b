package com.gold.ledger.gold_ledger.entity;

import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;
import org.springframework.data.mongodb.core.mapping.FieldType;
import org.springframework.data.mongodb.core.mapping.MongoId;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Member profile as far as the ledger is concerned.
 *
 * The members collection is owned by the profile service and its documents
 * carry more fields than mapped here (password hash, phone, reset tokens).
 * Never save() a Member: that would replace the whole document. The ledger
 * only ever $sets goldHoldings through MemberRepository.updateHoldingsIfUnchanged.
 *
 * goldHoldings is a cached counter of the member's gold in grams. It is written
 * only by HoldingsLedger; the trade log is the source of truth and
 * HoldingsReconciler can recompute it.
 */
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder(toBuilder = true)
@Document(collection = "members")
public class Member {
    @MongoId(FieldType.OBJECT_ID)
    private String id;

    private String name;

    @Indexed(unique = true, sparse = true)
    private String email;

    @Builder.Default
    @Field(targetType = FieldType.DECIMAL128)
    private BigDecimal goldHoldings = BigDecimal.ZERO;

    @Builder.Default
    @Field("isActive")
    private boolean active = true;

    private Instant createdAt;
    private Instant updatedAt;

    /**
     * Counter of ledger writes, absent on documents the ledger never touched.
     * Every holdings write is conditional on it and increments it.
     */
    private Long ledgerVersion;
}
