package com.flagship.wallet_ledger.account;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An account holder. Every account owns exactly one wallet.
 */
@Value
public class Account {
    UUID id;
    String email;
    String displayName;
    VerificationStatus verificationStatus;
    boolean active;
    Instant createdAt;

    public boolean isVerified() {
        return verificationStatus == VerificationStatus.VERIFIED;
    }
}
