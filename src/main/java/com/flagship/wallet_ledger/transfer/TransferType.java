package com.flagship.wallet_ledger.transfer;

public enum TransferType {
    /** Wallet to wallet. */
    TRANSFER,
    /** External money credited to one wallet. */
    DEPOSIT
}
