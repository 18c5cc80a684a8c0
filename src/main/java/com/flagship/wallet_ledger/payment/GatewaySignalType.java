package com.flagship.wallet_ledger.payment;

/**
 * Confirmed outcomes reported by the payment gateway. Signatures are verified upstream.
 */
public enum GatewaySignalType {
    SUCCEEDED,
    FAILED,
    EXPIRED
}
