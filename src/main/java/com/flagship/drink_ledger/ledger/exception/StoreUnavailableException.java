package com.flagship.drink_ledger.ledger.exception;

/**
 * The ledger store could not be reached. Fatal for the request; callers
 * decide whether to retry.
 */
public class StoreUnavailableException extends LedgerException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getError() {
        return "Store Unavailable";
    }
}
