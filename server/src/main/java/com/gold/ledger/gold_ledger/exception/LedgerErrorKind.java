package com.gold.ledger.gold_ledger.exception;

/**
 * Closed set of failures the ledger reports. Callers branch on the kind,
 * the HTTP layer maps each kind to a status code.
 */
public enum LedgerErrorKind {

    /** Member, trade or gold rate does not exist. */
    NOT_FOUND,

    /** A trade was requested before any gold rate was set. */
    NO_ACTIVE_RATE,

    /** The member does not hold enough gold for the SELL. */
    INSUFFICIENT_HOLDINGS,

    /** Wrong current status, or wrong trade type for the operation. */
    INVALID_STATE_TRANSITION,

    /** Reversing the BUY would take holdings below zero: the gold was already sold. */
    CANNOT_REVERSE,

    /** Concurrent writes kept conflicting after the bounded retries. */
    CONFLICT,

    /** Malformed request. */
    VALIDATION
}
