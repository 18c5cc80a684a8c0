package com.flagship.wallet_ledger.transfer.exception;

import com.flagship.wallet_ledger.transfer.FailureReason;

/**
 * The unit of work was rolled back because a wallet lock could not be obtained in time,
 * or the database aborted it (deadlock, serialization failure). No state was committed,
 * so retrying with the same idempotency key is safe.
 */
public class ConcurrencyConflictException extends LedgerException {

    public ConcurrencyConflictException(String message, Throwable cause) {
        super(FailureReason.CONCURRENCY_CONFLICT, message, cause);
    }
}
