package com.flagship.wallet_ledger.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wallet_ledger.payment.PaymentIntent;
import com.flagship.wallet_ledger.payment.PaymentIntentStatus;
import com.flagship.wallet_ledger.payment.PaymentMethod;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class PaymentIntentResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("gateway_payment_id")
    String gatewayPaymentId;

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("description")
    String description;

    @JsonProperty("payment_method")
    PaymentMethod paymentMethod;

    @JsonProperty("status")
    PaymentIntentStatus status;

    @JsonProperty("failure_message")
    String failureMessage;

    @JsonProperty("ledger_transfer_id")
    UUID ledgerTransferId;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("succeeded_at")
    Instant succeededAt;

    public static PaymentIntentResponse from(PaymentIntent intent) {
        return PaymentIntentResponse.builder()
            .id(intent.getId())
            .gatewayPaymentId(intent.getGatewayPaymentId())
            .accountId(intent.getAccountId())
            .amount(intent.getAmount())
            .currency(intent.getCurrency().name())
            .description(intent.getDescription())
            .paymentMethod(intent.getPaymentMethod())
            .status(intent.getStatus())
            .failureMessage(intent.getFailureMessage())
            .ledgerTransferId(intent.getLedgerTransferId())
            .createdAt(intent.getCreatedAt())
            .succeededAt(intent.getSucceededAt())
            .build();
    }
}
