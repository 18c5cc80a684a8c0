package com.flagship.wallet_ledger.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wallet_ledger.account.VerificationStatus;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Verification outcome pushed by the identity provider.
 */
@Value
@Builder
@Jacksonized
public class UpdateVerificationRequest {

    @NotNull(message = "Verification status is required")
    @JsonProperty("verification_status")
    VerificationStatus verificationStatus;
}
