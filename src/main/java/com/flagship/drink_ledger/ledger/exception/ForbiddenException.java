package com.flagship.drink_ledger.ledger.exception;

public class ForbiddenException extends LedgerException {

    public ForbiddenException(String message) {
        super(message);
    }

    @Override
    public String getError() {
        return "Forbidden";
    }
}
