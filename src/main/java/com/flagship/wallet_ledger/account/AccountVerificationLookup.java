package com.flagship.wallet_ledger.account;

import java.util.Optional;
import java.util.UUID;

/**
 * Answers "may this account transact?" for the transfer engine.
 *
 * The engine only needs a verification status, so this is kept narrow enough to be backed
 * by an external identity provider instead of the local accounts table.
 */
public interface AccountVerificationLookup {

    /**
     * @return the verification status, or empty if the account does not exist or is inactive
     */
    Optional<VerificationStatus> statusOf(UUID accountId);
}
