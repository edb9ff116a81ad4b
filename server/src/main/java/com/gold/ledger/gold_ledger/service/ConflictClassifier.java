package com.gold.ledger.gold_ledger.service;

import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.dao.TransientDataAccessException;

import com.gold.ledger.gold_ledger.exception.TradeLedgerException;
import com.mongodb.MongoException;

/**
 * Decides whether a failed unit of work lost a concurrency race and may be
 * re-run from scratch.
 *
 * Conflicts:
 * - compare-and-set write that matched nothing (OptimisticLockingFailureException),
 *   including a second active gold rate rejected by the partial unique index
 * - MongoDB write conflict inside a transaction (TransientTransactionError label)
 *
 * Business errors are never conflicts, and neither is a plain duplicate key.
 */
public final class ConflictClassifier {

    static final String TRANSIENT_TRANSACTION_ERROR = "TransientTransactionError";

    private ConflictClassifier() {
    }

    public static boolean isConflict(Throwable throwable) {
        Throwable current = throwable;
        while (current != null) {
            if (current instanceof TradeLedgerException) {
                return false;
            }
            if (current instanceof OptimisticLockingFailureException
                    || current instanceof TransientDataAccessException) {
                return true;
            }
            if (current instanceof MongoException mongoException
                    && mongoException.hasErrorLabel(TRANSIENT_TRANSACTION_ERROR)) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }
}
