package com.flagship.drink_ledger.ledger.exception;

/**
 * Base type of all ledger failures.
 *
 * Every failure carries the error name reported to API clients. Subclasses
 * are mapped to HTTP status codes by {@link GlobalExceptionHandler}.
 */
public abstract class LedgerException extends RuntimeException {

    protected LedgerException(String message) {
        super(message);
    }

    protected LedgerException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String getError();
}
