package com.flagship.drink_ledger.transaction;

import com.flagship.drink_ledger.ledger.PostpaidUser;
import lombok.Value;

@Value
public class PayUpResult {
    PostpaidUser payer;
    PostpaidUser receiver;
    long amountCents;
}
