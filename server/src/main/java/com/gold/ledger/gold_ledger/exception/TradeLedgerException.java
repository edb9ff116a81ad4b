package com.gold.ledger.gold_ledger.exception;

import java.math.BigDecimal;

/**
 * Business failure raised by the ledger. Never retried.
 */
public class TradeLedgerException extends RuntimeException {

    private final LedgerErrorKind kind;

    public TradeLedgerException(LedgerErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public TradeLedgerException(LedgerErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public LedgerErrorKind getKind() {
        return kind;
    }

    public static TradeLedgerException notFound(String entity, String id) {
        return new TradeLedgerException(LedgerErrorKind.NOT_FOUND,
                String.format("%s not found: %s", entity, id));
    }

    public static TradeLedgerException noActiveRate() {
        return new TradeLedgerException(LedgerErrorKind.NO_ACTIVE_RATE,
                "No active gold rate found. Please set a gold rate first.");
    }

    public static TradeLedgerException insufficientHoldings(String memberId, BigDecimal holdings, BigDecimal required) {
        return new TradeLedgerException(LedgerErrorKind.INSUFFICIENT_HOLDINGS,
                String.format("Insufficient gold holdings for member %s: has %sg, requires %sg",
                        memberId, holdings.toPlainString(), required.toPlainString()));
    }

    public static TradeLedgerException cannotReverse(String memberId, BigDecimal holdings, BigDecimal quantity) {
        return new TradeLedgerException(LedgerErrorKind.CANNOT_REVERSE,
                String.format("Cannot cancel: member %s only has %sg but the trade added %sg. "
                        + "The gold may already have been sold.",
                        memberId, holdings.toPlainString(), quantity.toPlainString()));
    }

    public static TradeLedgerException invalidTransition(String message) {
        return new TradeLedgerException(LedgerErrorKind.INVALID_STATE_TRANSITION, message);
    }

    public static TradeLedgerException conflict(String operation, int attempts, Throwable cause) {
        return new TradeLedgerException(LedgerErrorKind.CONFLICT,
                String.format("%s kept conflicting with concurrent writes after %d attempts", operation, attempts),
                cause);
    }

    public static TradeLedgerException validation(String message) {
        return new TradeLedgerException(LedgerErrorKind.VALIDATION, message);
    }
}
