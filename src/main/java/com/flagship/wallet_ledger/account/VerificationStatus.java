package com.flagship.wallet_ledger.account;

/**
 * Identity verification state of an account. Only {@link #VERIFIED} accounts may move money
 * while verification gating is on.
 */
public enum VerificationStatus {
    PENDING,
    IN_REVIEW,
    VERIFIED,
    REJECTED,
    EXPIRED
}
