package com.flagship.wallet_ledger.payment;

public enum PaymentIntentStatus {
    CREATED,
    PENDING,
    SUCCEEDED,
    FAILED,
    EXPIRED
}
