package com.flagship.drink_ledger.ledger.exception;

public class InactiveException extends LedgerException {

    public InactiveException(String message) {
        super(message);
    }

    @Override
    public String getError() {
        return "Inactive";
    }
}
