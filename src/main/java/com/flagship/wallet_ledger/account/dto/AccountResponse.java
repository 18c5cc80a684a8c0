package com.flagship.wallet_ledger.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wallet_ledger.account.Account;
import com.flagship.wallet_ledger.account.VerificationStatus;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class AccountResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("email")
    String email;

    @JsonProperty("display_name")
    String displayName;

    @JsonProperty("verification_status")
    VerificationStatus verificationStatus;

    @JsonProperty("active")
    boolean active;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("created_at")
    Instant createdAt;

    public static AccountResponse from(Account account, BigDecimal balance) {
        return new AccountResponse(account.getId(), account.getEmail(), account.getDisplayName(),
            account.getVerificationStatus(), account.isActive(), balance, account.getCreatedAt());
    }
}
