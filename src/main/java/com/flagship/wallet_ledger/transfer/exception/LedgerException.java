package com.flagship.wallet_ledger.transfer.exception;

import com.flagship.wallet_ledger.transfer.FailureReason;

/**
 * Base type for failures the engine reports with a stable {@link FailureReason}.
 */
public abstract class LedgerException extends RuntimeException {

    private final FailureReason reason;

    protected LedgerException(FailureReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    protected LedgerException(FailureReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public FailureReason getReason() {
        return reason;
    }

    public boolean isRetryable() {
        return reason.isRetryable();
    }
}
