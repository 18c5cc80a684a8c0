package com.flagship.wallet_ledger.payment;

import com.flagship.wallet_ledger.config.CurrencyCode;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * An expected inbound payment from the gateway.
 *
 * CREATED, then PENDING once the payer picks a method, then exactly one of SUCCEEDED, FAILED
 * or EXPIRED. A success confirmation for an intent still in CREATED is accepted too, since the
 * gateway does not always report the intermediate step. Only SUCCEEDED ever touches the ledger.
 */
@Value
public class PaymentIntent {
    UUID id;
    String gatewayPaymentId;
    UUID accountId;
    BigDecimal amount;
    CurrencyCode currency;
    String description;
    PaymentMethod paymentMethod;
    PaymentIntentStatus status;
    String failureMessage;
    UUID ledgerTransferId;
    Instant createdAt;
    Instant succeededAt;

    public static PaymentIntent create(UUID id, String gatewayPaymentId, UUID accountId, BigDecimal amount,
                                       CurrencyCode currency, String description) {
        return new PaymentIntent(id, gatewayPaymentId, accountId, amount, currency, description,
            null, PaymentIntentStatus.CREATED, null, null, Instant.now(), null);
    }

    /**
     * @throws IllegalStateException unless the intent is CREATED
     */
    public PaymentIntent markPending(PaymentMethod method) {
        if (status != PaymentIntentStatus.CREATED) {
            throw new IllegalStateException(
                String.format("Cannot mark payment intent %s pending in %s status", gatewayPaymentId, status));
        }
        return new PaymentIntent(id, gatewayPaymentId, accountId, amount, currency, description,
            method, PaymentIntentStatus.PENDING, null, null, createdAt, null);
    }

    /**
     * @throws IllegalStateException if the intent already reached a terminal status
     */
    public PaymentIntent succeed(UUID transferId) {
        requireOpen(PaymentIntentStatus.SUCCEEDED);
        return new PaymentIntent(id, gatewayPaymentId, accountId, amount, currency, description,
            paymentMethod, PaymentIntentStatus.SUCCEEDED, null, transferId, createdAt, Instant.now());
    }

    public PaymentIntent fail(String message) {
        requireOpen(PaymentIntentStatus.FAILED);
        return new PaymentIntent(id, gatewayPaymentId, accountId, amount, currency, description,
            paymentMethod, PaymentIntentStatus.FAILED, message, null, createdAt, null);
    }

    public PaymentIntent expire() {
        requireOpen(PaymentIntentStatus.EXPIRED);
        return new PaymentIntent(id, gatewayPaymentId, accountId, amount, currency, description,
            paymentMethod, PaymentIntentStatus.EXPIRED, "Payment intent expired", null, createdAt, null);
    }

    public boolean isTerminal() {
        return status == PaymentIntentStatus.SUCCEEDED
            || status == PaymentIntentStatus.FAILED
            || status == PaymentIntentStatus.EXPIRED;
    }

    public boolean canTransitionTo(PaymentIntentStatus target) {
        return switch (status) {
            case CREATED -> target != PaymentIntentStatus.CREATED;
            case PENDING -> target == PaymentIntentStatus.SUCCEEDED
                || target == PaymentIntentStatus.FAILED
                || target == PaymentIntentStatus.EXPIRED;
            case SUCCEEDED, FAILED, EXPIRED -> false;
        };
    }

    private void requireOpen(PaymentIntentStatus target) {
        if (!canTransitionTo(target)) {
            throw new IllegalStateException(
                String.format("Cannot move payment intent %s from %s to %s", gatewayPaymentId, status, target));
        }
    }
}
