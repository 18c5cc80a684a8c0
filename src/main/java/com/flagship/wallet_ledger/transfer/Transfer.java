package com.flagship.wallet_ledger.transfer;

import com.flagship.wallet_ledger.config.CurrencyCode;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Transfer domain object.
 *
 * Status transitions are explicit and one-directional: a PENDING transfer either completes
 * or fails, and a terminal transfer never changes again. Each transition returns a new instance.
 */
@Value
public class Transfer {
    UUID id;
    String reference;
    TransferType type;
    UUID initiatorAccountId;
    UUID fromAccountId;
    UUID toAccountId;
    BigDecimal amount;
    CurrencyCode currency;
    String description;
    String externalReference;
    TransferStatus status;
    FailureReason failureReason;
    String failureMessage;
    BigDecimal fromBalanceBefore;
    BigDecimal fromBalanceAfter;
    BigDecimal toBalanceBefore;
    BigDecimal toBalanceAfter;
    Instant createdAt;
    Instant completedAt;
    Long sequenceNumber;

    /**
     * Creates a PENDING wallet-to-wallet transfer. The initiator is the sender.
     */
    public static Transfer initiate(UUID id, String reference, UUID fromAccountId, UUID toAccountId,
                                    BigDecimal amount, CurrencyCode currency, String description) {
        if (fromAccountId.equals(toAccountId)) {
            throw new IllegalArgumentException("Source and destination accounts must differ");
        }
        return new Transfer(id, reference, TransferType.TRANSFER, fromAccountId, fromAccountId, toAccountId,
            amount, currency, description, null, TransferStatus.PENDING, null, null,
            null, null, null, null, Instant.now(), null, null);
    }

    /**
     * Creates a PENDING deposit of external money into the account's wallet.
     */
    public static Transfer deposit(UUID id, String reference, UUID accountId, BigDecimal amount,
                                   CurrencyCode currency, String description, String externalReference) {
        return new Transfer(id, reference, TransferType.DEPOSIT, accountId, null, accountId,
            amount, currency, description, externalReference, TransferStatus.PENDING, null, null,
            null, null, null, null, Instant.now(), null, null);
    }

    /**
     * Transitions to COMPLETED with the balance snapshots taken under lock.
     * Source balances are null for deposits.
     *
     * @throws IllegalStateException if the transfer is not PENDING
     */
    public Transfer complete(BigDecimal fromBefore, BigDecimal fromAfter, BigDecimal toBefore, BigDecimal toAfter) {
        requireStatus(TransferStatus.COMPLETED);
        return new Transfer(id, reference, type, initiatorAccountId, fromAccountId, toAccountId,
            amount, currency, description, externalReference, TransferStatus.COMPLETED, null, null,
            fromBefore, fromAfter, toBefore, toAfter, createdAt, Instant.now(), sequenceNumber);
    }

    /**
     * Transitions to FAILED. No balance moved, so the source snapshot is the same before and after.
     *
     * @throws IllegalStateException if the transfer is not PENDING
     */
    public Transfer fail(FailureReason reason, String message, BigDecimal sourceBalance) {
        requireStatus(TransferStatus.FAILED);
        return new Transfer(id, reference, type, initiatorAccountId, fromAccountId, toAccountId,
            amount, currency, description, externalReference, TransferStatus.FAILED, reason, message,
            sourceBalance, sourceBalance, null, null, createdAt, Instant.now(), sequenceNumber);
    }

    public boolean isTerminal() {
        return status == TransferStatus.COMPLETED || status == TransferStatus.FAILED;
    }

    public boolean canTransitionTo(TransferStatus targetStatus) {
        return switch (status) {
            case PENDING -> targetStatus == TransferStatus.COMPLETED || targetStatus == TransferStatus.FAILED;
            case COMPLETED, FAILED -> false;
        };
    }

    public boolean involves(UUID accountId) {
        return accountId.equals(fromAccountId) || accountId.equals(toAccountId);
    }

    private void requireStatus(TransferStatus target) {
        if (!canTransitionTo(target)) {
            throw new IllegalStateException(
                String.format("Cannot move transfer %s from %s to %s", id, status, target));
        }
    }
}
