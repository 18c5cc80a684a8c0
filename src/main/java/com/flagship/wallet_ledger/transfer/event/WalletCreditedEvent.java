package com.flagship.wallet_ledger.transfer.event;

import com.flagship.wallet_ledger.transfer.Transfer;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * External money landed in a wallet (a settled payment intent).
 */
@Value
public class WalletCreditedEvent implements TransferEvent {
    public static final String EVENT_TYPE = "WalletCredited";

    UUID eventId;
    UUID transferId;
    UUID accountId;
    BigDecimal amount;
    String currency;
    String externalReference;
    BigDecimal balanceAfter;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static WalletCreditedEvent fromTransfer(Transfer transfer) {
        return new WalletCreditedEvent(
            UUID.randomUUID(),
            transfer.getId(),
            transfer.getToAccountId(),
            transfer.getAmount(),
            transfer.getCurrency().name(),
            transfer.getExternalReference(),
            transfer.getToBalanceAfter(),
            Instant.now()
        );
    }
}
