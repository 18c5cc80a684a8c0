package com.flagship.wallet_ledger.transfer;

import lombok.Value;

/**
 * What the engine did with a request.
 *
 * {@link Kind#ALREADY_PROCESSED} is not an error: it carries the transfer produced by the first
 * attempt under the same idempotency key, whatever its status.
 */
@Value
public class TransferOutcome {
    Kind kind;
    Transfer transfer;

    public enum Kind {
        COMPLETED,
        FAILED,
        ALREADY_PROCESSED
    }

    public static TransferOutcome completed(Transfer transfer) {
        return new TransferOutcome(Kind.COMPLETED, transfer);
    }

    public static TransferOutcome failed(Transfer transfer) {
        return new TransferOutcome(Kind.FAILED, transfer);
    }

    public static TransferOutcome alreadyProcessed(Transfer transfer) {
        return new TransferOutcome(Kind.ALREADY_PROCESSED, transfer);
    }

    public boolean isReplay() {
        return kind == Kind.ALREADY_PROCESSED;
    }

    public boolean isSuccessful() {
        return transfer.getStatus() == TransferStatus.COMPLETED;
    }

    public FailureReason getFailureReason() {
        return transfer.getFailureReason();
    }
}
