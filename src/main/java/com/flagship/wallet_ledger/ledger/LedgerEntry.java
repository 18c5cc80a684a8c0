package com.flagship.wallet_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A written ledger entry. Entries are immutable once recorded.
 */
@Value
public class LedgerEntry {
    UUID id;
    UUID transferId;
    UUID walletId;
    String externalReference;
    EntryType entryType;
    BigDecimal amount;
    BigDecimal balanceAfter;
    Instant createdAt;
    long sequenceNumber;
}
