package com.flagship.wallet_ledger.wallet;

import com.flagship.wallet_ledger.config.CurrencyCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class WalletTest {

    private final Wallet wallet = new Wallet(UUID.randomUUID(), UUID.randomUUID(),
        new BigDecimal("50.00"), CurrencyCode.USD, 3);

    @Test
    @DisplayName("Debiting the full balance leaves exactly zero")
    void testDebit_FullBalance() {
        Wallet drained = wallet.debit(new BigDecimal("50.00"));

        assertEquals(0, drained.getBalance().signum());
        assertEquals(wallet.getVersion(), drained.getVersion());
        assertEquals(new BigDecimal("50.00"), wallet.getBalance(), "original instance is unchanged");
    }

    @Test
    @DisplayName("Debiting more than the balance is refused")
    void testDebit_Overdraft() {
        assertFalse(wallet.canDebit(new BigDecimal("50.01")));
        assertThrows(IllegalStateException.class, () -> wallet.debit(new BigDecimal("50.01")));
    }

    @Test
    @DisplayName("Credits add to the balance")
    void testCredit() {
        assertEquals(new BigDecimal("62.50"), wallet.credit(new BigDecimal("12.50")).getBalance());
    }

    @Test
    @DisplayName("Zero and negative amounts are rejected in both directions")
    void testNonPositiveAmounts() {
        assertThrows(IllegalArgumentException.class, () -> wallet.credit(BigDecimal.ZERO));
        assertThrows(IllegalArgumentException.class, () -> wallet.debit(new BigDecimal("-1.00")));
    }
}
