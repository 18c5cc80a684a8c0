package com.flagship.wallet_ledger.idempotency;

import com.flagship.wallet_ledger.transfer.FailureReason;
import com.flagship.wallet_ledger.transfer.TransferStatus;
import com.flagship.wallet_ledger.transfer.TransferType;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * The stored outcome of the first attempt made under an idempotency key.
 * Written once, in the same unit of work as the transfer it points at, and never updated.
 * Keys are scoped by transfer type: a deposit key never answers for a user transfer.
 */
@Value
public class IdempotencyRecord {
    TransferType scope;
    String idempotencyKey;
    UUID accountId;
    UUID transferId;
    TransferStatus outcome;
    FailureReason failureReason;
    String requestFingerprint;
    Instant createdAt;

    public static IdempotencyRecord of(TransferType scope, String idempotencyKey, UUID accountId, UUID transferId,
                                       TransferStatus outcome, FailureReason failureReason,
                                       String requestFingerprint) {
        if (outcome == TransferStatus.PENDING) {
            throw new IllegalArgumentException("Only terminal outcomes are recorded");
        }
        return new IdempotencyRecord(scope, idempotencyKey, accountId, transferId, outcome, failureReason,
            requestFingerprint, Instant.now());
    }
}
