package com.gold.ledger.gold_ledger.entity;

import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
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
 * A single BUY or SELL of gold for one member, priced against the gold rate
 * that was active when the trade was created.
 *
 * Lifecycle:
 * - BUY: created COMPLETED by an admin, may later be reversed to CANCELLED
 * - SELL by admin: created COMPLETED
 * - SELL by member: created PENDING, then COMPLETED or CANCELLED by an admin
 *
 * rateAtTrade, totalAmount and goldRateId are frozen at creation. Status
 * changes are written with TradeRepository.atomicStatusTransition, never save().
 */
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder(toBuilder = true)
@Document(collection = "trades")
@CompoundIndexes({
        @CompoundIndex(name = "member_created_idx", def = "{'memberId':1,'createdAt':-1}"),
        @CompoundIndex(name = "status_created_idx", def = "{'status':1,'createdAt':-1}"),
        @CompoundIndex(name = "type_created_idx", def = "{'tradeType':1,'createdAt':-1}")
})
public class Trade {

    @MongoId(FieldType.OBJECT_ID)
    private String id;

    @Indexed
    @Field(targetType = FieldType.OBJECT_ID)
    private String memberId;

    private TradeType tradeType;

    /**
     * Grams of gold, at least 0.001.
     */
    @Field(targetType = FieldType.DECIMAL128)
    private BigDecimal quantity;

    /**
     * INR per gram taken from the active rate (buyPrice for BUY, sellPrice for SELL).
     */
    @Field(targetType = FieldType.DECIMAL128)
    private BigDecimal rateAtTrade;

    /**
     * quantity × rateAtTrade.
     */
    @Field(targetType = FieldType.DECIMAL128)
    private BigDecimal totalAmount;

    @Builder.Default
    private TradeStatus status = TradeStatus.PENDING;

    /**
     * Historical reference to the gold rate version used for pricing.
     */
    private String goldRateId;

    private String initiatedBy;

    /**
     * Admin who approved, rejected or reversed the trade.
     */
    private String approvedBy;

    private String notes;

    private Instant createdAt;

    private Instant updatedAt;

    /**
     * Move the trade to a new status on behalf of an admin.
     *
     * @param newStatus the target status
     * @param adminId admin recorded as approver
     * @throws IllegalStateException if the transition is not allowed for this trade
     */
    public void transitionTo(TradeStatus newStatus, String adminId) {
        if (!this.status.canTransitionTo(newStatus, this.tradeType)) {
            throw new IllegalStateException(
                String.format("Invalid trade state transition: %s → %s (tradeId=%s, type=%s)",
                    this.status, newStatus, this.id, this.tradeType)
            );
        }

        this.status = newStatus;
        this.approvedBy = adminId;
        this.updatedAt = Instant.now();
    }

    /**
     * Signed change this trade applies to holdings once completed.
     */
    public BigDecimal holdingsDelta() {
        return tradeType.holdingsDelta(quantity);
    }
}
