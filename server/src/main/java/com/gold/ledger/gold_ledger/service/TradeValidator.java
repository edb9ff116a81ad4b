package com.gold.ledger.gold_ledger.service;

import com.gold.ledger.gold_ledger.entity.GoldRateRequest;
import com.gold.ledger.gold_ledger.entity.Money;
import com.gold.ledger.gold_ledger.entity.TradeRequest;
import com.gold.ledger.gold_ledger.entity.TradeStatus;
import com.gold.ledger.gold_ledger.entity.TradeType;
import com.gold.ledger.gold_ledger.exception.TradeLedgerException;

import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Request validation for the ledger.
 *
 * Checks shape only (ids present, quantities and prices in range). Anything
 * that depends on stored state (member exists, enough holdings, legal status)
 * is decided by the state machine inside the transaction.
 */
@Slf4j
@Service
public class TradeValidator {

    static final BigDecimal MIN_QUANTITY = new BigDecimal("0.001");
    static final int MAX_NOTES_LENGTH = 500;

    /**
     * Result of request validation.
     */
    public static class ValidationResult {
        private final List<String> errors;

        private ValidationResult(List<String> errors) {
            this.errors = errors;
        }

        public static ValidationResult of(List<String> errors) {
            return new ValidationResult(List.copyOf(errors));
        }

        public boolean isValid() {
            return errors.isEmpty();
        }

        public List<String> getErrors() {
            return errors;
        }

        public String getErrorMessage() {
            return String.join("; ", errors);
        }

        /**
         * @throws TradeLedgerException VALIDATION listing every problem
         */
        public void orThrow() {
            if (!isValid()) {
                throw TradeLedgerException.validation(getErrorMessage());
            }
        }
    }

    public ValidationResult validate(TradeRequest request) {
        List<String> errors = new ArrayList<>();

        requireId(request.getMemberId(), "memberId", errors);
        requireId(request.getInitiatorId(), "initiatorId", errors);

        if (request.getTradeType() == null) {
            errors.add("tradeType is required (BUY or SELL)");
        } else if (request.getTradeType() == TradeType.BUY && !request.isAdmin()) {
            errors.add("BUY trades can only be created by an admin");
        }

        validateQuantity(request.getQuantity(), errors);

        if (request.getNotes() != null && request.getNotes().length() > MAX_NOTES_LENGTH) {
            errors.add(String.format("Notes cannot exceed %d characters", MAX_NOTES_LENGTH));
        }

        return result(errors, "trade");
    }

    public ValidationResult validate(GoldRateRequest request) {
        List<String> errors = new ArrayList<>();

        validatePrice(request.getBuyPrice(), "buyPrice", errors);
        validatePrice(request.getSellPrice(), "sellPrice", errors);
        requireId(request.getAdminId(), "adminId", errors);

        return result(errors, "gold rate");
    }

    public ValidationResult validateStatusUpdate(String tradeId, TradeStatus newStatus, String adminId) {
        List<String> errors = new ArrayList<>();

        requireId(tradeId, "tradeId", errors);
        requireId(adminId, "adminId", errors);
        if (newStatus == null) {
            errors.add("status is required");
        }

        return result(errors, "status update");
    }

    public ValidationResult validateCancel(String tradeId, String adminId) {
        List<String> errors = new ArrayList<>();

        requireId(tradeId, "tradeId", errors);
        requireId(adminId, "adminId", errors);

        return result(errors, "cancel");
    }

    private void validateQuantity(BigDecimal quantity, List<String> errors) {
        if (quantity == null) {
            errors.add("quantity is required");
            return;
        }
        if (quantity.compareTo(MIN_QUANTITY) < 0) {
            errors.add(String.format("Quantity must be at least %s grams", MIN_QUANTITY.toPlainString()));
        }
    }

    private void validatePrice(BigDecimal price, String field, List<String> errors) {
        if (price == null) {
            errors.add(field + " is required");
        } else if (price.signum() < 0) {
            errors.add(field + " cannot be negative");
        } else if (price.stripTrailingZeros().scale() > Money.SCALE) {
            errors.add(String.format("%s cannot have more than %d decimal places", field, Money.SCALE));
        }
    }

    private void requireId(String id, String field, List<String> errors) {
        if (id == null || id.trim().isEmpty()) {
            errors.add(field + " is required");
        }
    }

    private ValidationResult result(List<String> errors, String what) {
        if (!errors.isEmpty()) {
            log.warn("Rejected {} request: {}", what, errors);
        }
        return ValidationResult.of(errors);
    }
}
