package com.flagship.drink_ledger.ledger.exception;

public class ConflictException extends LedgerException {

    public ConflictException(String message) {
        super(message);
    }

    @Override
    public String getError() {
        return "Conflict";
    }
}
