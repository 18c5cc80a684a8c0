package com.flagship.wallet_ledger.wallet;

import com.flagship.wallet_ledger.config.CurrencyCode;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A wallet balance as read under lock.
 *
 * Balance changes return a new instance; persisting it is {@link WalletStore#save}'s job.
 */
@Value
public class Wallet {
    UUID id;
    UUID accountId;
    BigDecimal balance;
    CurrencyCode currency;
    long version;

    public boolean canDebit(BigDecimal amount) {
        return balance.compareTo(amount) >= 0;
    }

    /**
     * @throws IllegalStateException if the debit would take the balance below zero
     */
    public Wallet debit(BigDecimal amount) {
        requirePositive(amount);
        if (!canDebit(amount)) {
            throw new IllegalStateException(
                String.format("Wallet %s cannot be debited %s: balance is %s", id, amount, balance));
        }
        return new Wallet(id, accountId, balance.subtract(amount), currency, version);
    }

    public Wallet credit(BigDecimal amount) {
        requirePositive(amount);
        return new Wallet(id, accountId, balance.add(amount), currency, version);
    }

    private static void requirePositive(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Amount must be positive");
        }
    }
}
