package com.flagship.wallet_ledger.payment;

import com.flagship.wallet_ledger.config.CurrencyCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class PaymentIntentTest {

    private PaymentIntent created() {
        return PaymentIntent.create(UUID.randomUUID(), "PAY-0123456789ABCDEF", UUID.randomUUID(),
            new BigDecimal("30.00"), CurrencyCode.USD, "top up");
    }

    @Test
    @DisplayName("created -> pending -> succeeded records the transfer and time")
    void testHappyPath() {
        UUID transferId = UUID.randomUUID();

        PaymentIntent pending = created().markPending(PaymentMethod.UPI);
        PaymentIntent succeeded = pending.succeed(transferId);

        assertEquals(PaymentIntentStatus.PENDING, pending.getStatus());
        assertEquals(PaymentMethod.UPI, pending.getPaymentMethod());
        assertEquals(PaymentIntentStatus.SUCCEEDED, succeeded.getStatus());
        assertEquals(transferId, succeeded.getLedgerTransferId());
        assertNotNull(succeeded.getSucceededAt());
        assertTrue(succeeded.isTerminal());
    }

    @Test
    @DisplayName("A success report may skip the pending step")
    void testSucceedFromCreated() {
        assertEquals(PaymentIntentStatus.SUCCEEDED, created().succeed(UUID.randomUUID()).getStatus());
    }

    @Test
    @DisplayName("Failed and expired intents cannot succeed")
    void testClosedIntentsStayClosed() {
        PaymentIntent failed = created().markPending(PaymentMethod.CARD).fail("card declined");
        PaymentIntent expired = created().expire();

        assertEquals("card declined", failed.getFailureMessage());
        assertThrows(IllegalStateException.class, () -> failed.succeed(UUID.randomUUID()));
        assertThrows(IllegalStateException.class, () -> expired.succeed(UUID.randomUUID()));
        assertThrows(IllegalStateException.class, () -> expired.fail("late"));
    }

    @Test
    @DisplayName("Only a CREATED intent can be marked pending")
    void testMarkPendingTwice() {
        PaymentIntent pending = created().markPending(PaymentMethod.CARD);

        assertThrows(IllegalStateException.class, () -> pending.markPending(PaymentMethod.WALLET));
    }
}
