package com.flagship.wallet_ledger.transfer.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wallet_ledger.ledger.EntryType;
import com.flagship.wallet_ledger.ledger.LedgerEntry;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class LedgerEntryResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("wallet_id")
    UUID walletId;

    @JsonProperty("external_reference")
    String externalReference;

    @JsonProperty("entry_type")
    EntryType entryType;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("balance_after")
    BigDecimal balanceAfter;

    @JsonProperty("created_at")
    Instant createdAt;

    public static LedgerEntryResponse from(LedgerEntry entry) {
        return new LedgerEntryResponse(entry.getId(), entry.getWalletId(), entry.getExternalReference(),
            entry.getEntryType(), entry.getAmount(), entry.getBalanceAfter(), entry.getCreatedAt());
    }
}
