package com.flagship.wallet_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Stored wallet balance compared with the balance recomputed from the ledger.
 */
@Value
public class BalanceAudit {
    UUID accountId;
    UUID walletId;
    BigDecimal storedBalance;
    BigDecimal ledgerBalance;

    public boolean isConsistent() {
        return storedBalance.compareTo(ledgerBalance) == 0;
    }
}
