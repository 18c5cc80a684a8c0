package com.flagship.wallet_ledger.transfer.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * Request body for {@code POST /api/transfers}. The initiator comes from the {@code X-Account-Id}
 * header and the idempotency key from {@code Idempotency-Key}.
 */
@Value
@Builder
@Jacksonized
public class CreateTransferRequest {

    @NotBlank(message = "Recipient is required")
    @JsonProperty("recipient")
    String recipient;

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    BigDecimal amount;

    @Size(max = 500, message = "Description must be at most 500 characters")
    @JsonProperty("description")
    String description;
}
