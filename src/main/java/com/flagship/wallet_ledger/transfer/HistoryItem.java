package com.flagship.wallet_ledger.transfer;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One transfer as seen from one account.
 */
@Value
public class HistoryItem {
    UUID transferId;
    TransferType type;
    Direction direction;
    String counterparty;
    BigDecimal amount;
    String currency;
    TransferStatus status;
    FailureReason failureReason;
    String description;
    BigDecimal balanceAfter;
    Instant createdAt;
    Instant completedAt;

    public enum Direction {
        SENT,
        RECEIVED
    }

    public static HistoryItem of(Transfer transfer, UUID accountId) {
        boolean sent = accountId.equals(transfer.getFromAccountId());
        String counterparty;
        if (sent) {
            counterparty = transfer.getToAccountId().toString();
        } else if (transfer.getFromAccountId() != null) {
            counterparty = transfer.getFromAccountId().toString();
        } else {
            counterparty = transfer.getExternalReference();
        }
        return new HistoryItem(
            transfer.getId(),
            transfer.getType(),
            sent ? Direction.SENT : Direction.RECEIVED,
            counterparty,
            transfer.getAmount(),
            transfer.getCurrency().name(),
            transfer.getStatus(),
            transfer.getFailureReason(),
            transfer.getDescription(),
            sent ? transfer.getFromBalanceAfter() : transfer.getToBalanceAfter(),
            transfer.getCreatedAt(),
            transfer.getCompletedAt()
        );
    }
}
