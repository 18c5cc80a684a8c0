package com.flagship.wallet_ledger.transfer.event;

import com.flagship.wallet_ledger.transfer.Transfer;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class TransferFailedEvent implements TransferEvent {
    public static final String EVENT_TYPE = "TransferFailed";

    UUID eventId;
    UUID transferId;
    UUID fromAccountId;
    UUID toAccountId;
    BigDecimal amount;
    String currency;
    String failureReason;
    String failureMessage;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static TransferFailedEvent fromTransfer(Transfer transfer) {
        return new TransferFailedEvent(
            UUID.randomUUID(),
            transfer.getId(),
            transfer.getFromAccountId(),
            transfer.getToAccountId(),
            transfer.getAmount(),
            transfer.getCurrency().name(),
            transfer.getFailureReason() != null ? transfer.getFailureReason().name() : null,
            transfer.getFailureMessage(),
            Instant.now()
        );
    }
}
