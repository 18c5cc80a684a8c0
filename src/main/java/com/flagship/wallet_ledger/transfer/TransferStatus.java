package com.flagship.wallet_ledger.transfer;

/**
 * Transfer lifecycle: PENDING, then exactly one of COMPLETED or FAILED.
 */
public enum TransferStatus {
    PENDING,
    COMPLETED,
    FAILED
}
