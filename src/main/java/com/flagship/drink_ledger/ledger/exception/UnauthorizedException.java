package com.flagship.drink_ledger.ledger.exception;

public class UnauthorizedException extends LedgerException {

    public UnauthorizedException(String message) {
        super(message);
    }

    @Override
    public String getError() {
        return "Unauthorized";
    }
}
