package com.flagship.drink_ledger.ledger;

public enum UserKind {
    POSTPAID,
    PREPAID
}
