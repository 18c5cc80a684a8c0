package com.flagship.wallet_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.UUID;

/**
 * One side of a ledger posting, before it is written.
 *
 * A leg either touches a wallet (and then carries the wallet's balance after it) or names
 * an external party such as a payment gateway.
 */
@Value
public class LedgerLeg {
    UUID walletId;
    String externalReference;
    EntryType entryType;
    BigDecimal amount;
    BigDecimal balanceAfter;

    private LedgerLeg(UUID walletId, String externalReference, EntryType entryType,
                      BigDecimal amount, BigDecimal balanceAfter) {
        if (walletId == null && (externalReference == null || externalReference.isBlank())) {
            throw new IllegalArgumentException("A ledger leg needs a wallet or an external reference");
        }
        this.entryType = Objects.requireNonNull(entryType);
        this.amount = Objects.requireNonNull(amount);
        if (amount.signum() <= 0) {
            throw new IllegalArgumentException("Amount must be positive");
        }
        this.walletId = walletId;
        this.externalReference = externalReference;
        this.balanceAfter = balanceAfter;
    }

    public static LedgerLeg debit(UUID walletId, BigDecimal amount, BigDecimal balanceAfter) {
        return new LedgerLeg(Objects.requireNonNull(walletId), null, EntryType.DEBIT, amount, balanceAfter);
    }

    public static LedgerLeg credit(UUID walletId, BigDecimal amount, BigDecimal balanceAfter) {
        return new LedgerLeg(Objects.requireNonNull(walletId), null, EntryType.CREDIT, amount, balanceAfter);
    }

    /**
     * Money entering the system from outside (a gateway settlement).
     */
    public static LedgerLeg externalDebit(String externalReference, BigDecimal amount) {
        return new LedgerLeg(null, externalReference, EntryType.DEBIT, amount, null);
    }

    public boolean isWalletLeg() {
        return walletId != null;
    }
}
