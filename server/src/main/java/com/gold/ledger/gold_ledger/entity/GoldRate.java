package com.gold.ledger.gold_ledger.entity;

import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
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
 * One version of the gold buy/sell price pair (INR per gram).
 *
 * Versions are never edited: a new version deactivates the previous one.
 * The partial unique index allows at most one document with isActive=true.
 */
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder(toBuilder = true)
@Document(collection = "gold_rates")
@CompoundIndexes({
        @CompoundIndex(name = "single_active_idx", def = "{'isActive':1}", unique = true,
                partialFilter = "{ 'isActive': true }"),
        @CompoundIndex(name = "effective_created_idx", def = "{'effectiveDate':-1,'createdAt':-1}")
})
public class GoldRate {
    @MongoId(FieldType.OBJECT_ID)
    private String id;

    @Field(targetType = FieldType.DECIMAL128)
    private BigDecimal buyPrice;

    @Field(targetType = FieldType.DECIMAL128)
    private BigDecimal sellPrice;

    @Field("isActive")
    private boolean active;

    private Instant effectiveDate;
    private String createdBy;
    private Instant createdAt;

    /**
     * Per-gram price a trade of the given type is executed at.
     */
    public BigDecimal priceFor(TradeType tradeType) {
        return tradeType == TradeType.BUY ? buyPrice : sellPrice;
    }
}
