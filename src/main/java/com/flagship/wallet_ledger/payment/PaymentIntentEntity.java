package com.flagship.wallet_ledger.payment;

import com.flagship.wallet_ledger.config.CurrencyCode;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for payment intents. The ledger transfer id can be written once;
 * a database trigger backs that up.
 */
@Entity
@Table(name = "payment_intents")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PaymentIntentEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "gateway_payment_id", nullable = false, updatable = false, unique = true, length = 100)
    private String gatewayPaymentId;

    @Column(name = "account_id", nullable = false, updatable = false)
    private UUID accountId;

    @Column(nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 3)
    private CurrencyCode currency;

    @Column(updatable = false)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_method")
    private PaymentMethod paymentMethod;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PaymentIntentStatus status;

    @Column(name = "failure_message")
    private String failureMessage;

    @Column(name = "ledger_transfer_id")
    private UUID ledgerTransferId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "succeeded_at")
    private Instant succeededAt;

    @PrePersist
    void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static PaymentIntentEntity fromDomain(PaymentIntent intent) {
        return new PaymentIntentEntity(
            intent.getId(),
            intent.getGatewayPaymentId(),
            intent.getAccountId(),
            intent.getAmount(),
            intent.getCurrency(),
            intent.getDescription(),
            intent.getPaymentMethod(),
            intent.getStatus(),
            intent.getFailureMessage(),
            null, // ledgerTransferId - set once on success
            intent.getCreatedAt(),
            null, // updatedAt - set by @PrePersist
            null
        );
    }

    public PaymentIntent toDomain() {
        return new PaymentIntent(id, gatewayPaymentId, accountId, amount, currency, description,
            paymentMethod, status, failureMessage, ledgerTransferId, createdAt, succeededAt);
    }

    /**
     * Applies a status transition. The ledger transfer id goes through {@link #setLedgerTransferId}.
     */
    void updateFromDomain(PaymentIntent intent) {
        this.paymentMethod = intent.getPaymentMethod();
        this.status = intent.getStatus();
        this.failureMessage = intent.getFailureMessage();
        this.succeededAt = intent.getSucceededAt();
    }

    void setLedgerTransferId(UUID ledgerTransferId) {
        if (this.ledgerTransferId != null) {
            throw new IllegalStateException(
                "Payment intent " + gatewayPaymentId + " was already credited by transfer " + this.ledgerTransferId);
        }
        if (this.status != PaymentIntentStatus.SUCCEEDED) {
            throw new IllegalStateException(
                "Cannot attach a ledger transfer to payment intent " + gatewayPaymentId + " in " + status + " status");
        }
        this.ledgerTransferId = ledgerTransferId;
    }

    boolean isCredited() {
        return ledgerTransferId != null;
    }
}
