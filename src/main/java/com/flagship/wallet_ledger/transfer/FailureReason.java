package com.flagship.wallet_ledger.transfer;

/**
 * Stable failure codes surfaced to callers.
 *
 * A retrying client can tell from the code alone whether the request definitely did not
 * happen (validation), definitely happened and failed ({@link #INSUFFICIENT_FUNDS}), or must
 * be retried with the same idempotency key ({@link #CONCURRENCY_CONFLICT}).
 */
public enum FailureReason {
    INVALID_AMOUNT(false),
    SELF_TRANSFER_NOT_ALLOWED(false),
    RECIPIENT_NOT_FOUND(false),
    VERIFICATION_REQUIRED(false),
    MISSING_IDEMPOTENCY_KEY(false),
    INSUFFICIENT_FUNDS(false),
    CONCURRENCY_CONFLICT(true);

    private final boolean retryable;

    FailureReason(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
