package com.flagship.wallet_ledger.transfer.exception;

import com.flagship.wallet_ledger.transfer.FailureReason;

/**
 * A request refused before any wallet was locked. Nothing was written: not the ledger,
 * not the idempotency index.
 */
public class TransferRejectedException extends LedgerException {

    public TransferRejectedException(FailureReason reason, String message) {
        super(reason, message);
    }
}
