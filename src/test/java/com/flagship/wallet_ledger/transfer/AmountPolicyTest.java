package com.flagship.wallet_ledger.transfer;

import com.flagship.wallet_ledger.config.CurrencyCode;
import com.flagship.wallet_ledger.config.LedgerProperties;
import com.flagship.wallet_ledger.transfer.exception.TransferRejectedException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class AmountPolicyTest {

    private final AmountPolicy policy = new AmountPolicy(new LedgerProperties());

    @Test
    @DisplayName("Amounts are returned at the currency's scale")
    void testNormalize_Scale() {
        assertEquals(new BigDecimal("100.00"), policy.normalize(new BigDecimal("100")));
        assertEquals(new BigDecimal("12.50"), policy.normalize(new BigDecimal("12.5000")));
    }

    @ParameterizedTest
    @ValueSource(strings = {"0", "-5.00", "0.001", "10.005", "0.00"})
    @DisplayName("Non-positive or over-precise amounts are INVALID_AMOUNT")
    void testNormalize_Rejected(String amount) {
        TransferRejectedException e = assertThrows(TransferRejectedException.class,
            () -> policy.normalize(new BigDecimal(amount)));
        assertEquals(FailureReason.INVALID_AMOUNT, e.getReason());
        assertFalse(e.isRetryable());
    }

    @Test
    @DisplayName("Limits are inclusive")
    void testNormalize_Limits() {
        assertEquals(new BigDecimal("0.01"), policy.normalize(new BigDecimal("0.01")));
        assertEquals(new BigDecimal("1000000.00"), policy.normalize(new BigDecimal("1000000")));
        assertThrows(TransferRejectedException.class, () -> policy.normalize(new BigDecimal("1000000.01")));
    }

    @Test
    @DisplayName("A missing amount is rejected")
    void testNormalize_Null() {
        assertThrows(TransferRejectedException.class, () -> policy.normalize(null));
    }

    @Test
    @DisplayName("Zero-decimal currencies refuse fractional amounts")
    void testNormalize_ZeroDecimalCurrency() {
        LedgerProperties properties = new LedgerProperties();
        properties.setCurrency(CurrencyCode.JPY);
        properties.setMinAmount(BigDecimal.ONE);
        AmountPolicy yen = new AmountPolicy(properties);

        assertEquals(new BigDecimal("500"), yen.normalize(new BigDecimal("500.00")));
        assertThrows(TransferRejectedException.class, () -> yen.normalize(new BigDecimal("500.5")));
    }
}
