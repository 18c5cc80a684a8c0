package com.flagship.wallet_ledger.transfer.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wallet_ledger.transfer.FailureReason;
import com.flagship.wallet_ledger.transfer.Transfer;
import com.flagship.wallet_ledger.transfer.TransferOutcome;
import com.flagship.wallet_ledger.transfer.TransferStatus;
import com.flagship.wallet_ledger.transfer.TransferType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class TransferResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("outcome")
    TransferOutcome.Kind outcome;

    @JsonProperty("type")
    TransferType type;

    @JsonProperty("status")
    TransferStatus status;

    @JsonProperty("from_account_id")
    UUID fromAccountId;

    @JsonProperty("to_account_id")
    UUID toAccountId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("description")
    String description;

    @JsonProperty("failure_reason")
    FailureReason failureReason;

    @JsonProperty("failure_message")
    String failureMessage;

    @JsonProperty("from_balance_after")
    BigDecimal fromBalanceAfter;

    @JsonProperty("to_balance_after")
    BigDecimal toBalanceAfter;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("completed_at")
    Instant completedAt;

    public static TransferResponse from(TransferOutcome outcome) {
        return from(outcome.getTransfer(), outcome.getKind());
    }

    public static TransferResponse from(Transfer transfer, TransferOutcome.Kind kind) {
        return TransferResponse.builder()
            .id(transfer.getId())
            .outcome(kind)
            .type(transfer.getType())
            .status(transfer.getStatus())
            .fromAccountId(transfer.getFromAccountId())
            .toAccountId(transfer.getToAccountId())
            .amount(transfer.getAmount())
            .currency(transfer.getCurrency().name())
            .description(transfer.getDescription())
            .failureReason(transfer.getFailureReason())
            .failureMessage(transfer.getFailureMessage())
            .fromBalanceAfter(transfer.getFromBalanceAfter())
            .toBalanceAfter(transfer.getToBalanceAfter())
            .createdAt(transfer.getCreatedAt())
            .completedAt(transfer.getCompletedAt())
            .build();
    }
}
