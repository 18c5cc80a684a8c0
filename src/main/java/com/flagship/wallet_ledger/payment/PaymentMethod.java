package com.flagship.wallet_ledger.payment;

public enum PaymentMethod {
    CARD,
    UPI,
    NET_BANKING,
    WALLET
}
