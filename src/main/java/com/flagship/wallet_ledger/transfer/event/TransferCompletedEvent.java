package com.flagship.wallet_ledger.transfer.event;

import com.flagship.wallet_ledger.transfer.Transfer;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A wallet-to-wallet transfer committed. Carries both parties' resulting balances.
 */
@Value
public class TransferCompletedEvent implements TransferEvent {
    public static final String EVENT_TYPE = "TransferCompleted";

    UUID eventId;
    UUID transferId;
    UUID fromAccountId;
    UUID toAccountId;
    BigDecimal amount;
    String currency;
    String description;
    BigDecimal fromBalanceAfter;
    BigDecimal toBalanceAfter;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static TransferCompletedEvent fromTransfer(Transfer transfer) {
        return new TransferCompletedEvent(
            UUID.randomUUID(),
            transfer.getId(),
            transfer.getFromAccountId(),
            transfer.getToAccountId(),
            transfer.getAmount(),
            transfer.getCurrency().name(),
            transfer.getDescription(),
            transfer.getFromBalanceAfter(),
            transfer.getToBalanceAfter(),
            Instant.now()
        );
    }
}
