package com.flagship.wallet_ledger.transfer.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Notification about a terminal transfer, published through the outbox after commit.
 * Consumers deduplicate on {@link #getEventId()}.
 */
public interface TransferEvent {

    UUID getEventId();

    UUID getTransferId();

    Instant getOccurredAt();

    String getEventType();
}
