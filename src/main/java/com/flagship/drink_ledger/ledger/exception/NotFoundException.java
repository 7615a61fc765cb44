package com.flagship.drink_ledger.ledger.exception;

public class NotFoundException extends LedgerException {

    public NotFoundException(String message) {
        super(message);
    }

    @Override
    public String getError() {
        return "Not Found";
    }
}
