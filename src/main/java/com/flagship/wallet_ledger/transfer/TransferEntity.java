package com.flagship.wallet_ledger.transfer;

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
 * JPA Entity for transfer persistence.
 *
 * No setters: the identifying columns are {@code updatable = false}, and the only mutation
 * is {@link #updateFromDomain}, which moves a PENDING row to its terminal state.
 * {@code sequence_number} is assigned by the database and never written from here.
 */
@Entity
@Table(name = "transfers")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TransferEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, updatable = false)
    private String reference;

    @Enumerated(EnumType.STRING)
    @Column(name = "transfer_type", nullable = false, updatable = false)
    private TransferType transferType;

    @Column(name = "initiator_account_id", nullable = false, updatable = false)
    private UUID initiatorAccountId;

    @Column(name = "from_account_id", updatable = false)
    private UUID fromAccountId;

    @Column(name = "to_account_id", nullable = false, updatable = false)
    private UUID toAccountId;

    @Column(nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 3)
    private CurrencyCode currency;

    @Column(updatable = false)
    private String description;

    @Column(name = "external_reference", updatable = false)
    private String externalReference;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TransferStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "failure_reason")
    private FailureReason failureReason;

    @Column(name = "failure_message")
    private String failureMessage;

    @Column(name = "from_balance_before", precision = 19, scale = 4)
    private BigDecimal fromBalanceBefore;

    @Column(name = "from_balance_after", precision = 19, scale = 4)
    private BigDecimal fromBalanceAfter;

    @Column(name = "to_balance_before", precision = 19, scale = 4)
    private BigDecimal toBalanceBefore;

    @Column(name = "to_balance_after", precision = 19, scale = 4)
    private BigDecimal toBalanceAfter;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "sequence_number", insertable = false, updatable = false)
    private Long sequenceNumber;

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

    static TransferEntity fromDomain(Transfer transfer) {
        return new TransferEntity(
            transfer.getId(),
            transfer.getReference(),
            transfer.getType(),
            transfer.getInitiatorAccountId(),
            transfer.getFromAccountId(),
            transfer.getToAccountId(),
            transfer.getAmount(),
            transfer.getCurrency(),
            transfer.getDescription(),
            transfer.getExternalReference(),
            transfer.getStatus(),
            transfer.getFailureReason(),
            transfer.getFailureMessage(),
            transfer.getFromBalanceBefore(),
            transfer.getFromBalanceAfter(),
            transfer.getToBalanceBefore(),
            transfer.getToBalanceAfter(),
            transfer.getCreatedAt(),
            null, // updatedAt - set by @PrePersist
            transfer.getCompletedAt(),
            null  // sequenceNumber - assigned by the database
        );
    }

    public Transfer toDomain() {
        return new Transfer(
            id,
            reference,
            transferType,
            initiatorAccountId,
            fromAccountId,
            toAccountId,
            amount,
            currency,
            description,
            externalReference,
            status,
            failureReason,
            failureMessage,
            fromBalanceBefore,
            fromBalanceAfter,
            toBalanceBefore,
            toBalanceAfter,
            createdAt,
            completedAt,
            sequenceNumber
        );
    }

    /**
     * Applies a terminal transition. Identifying columns are never touched.
     */
    void updateFromDomain(Transfer transfer) {
        if (this.status != TransferStatus.PENDING) {
            throw new IllegalStateException("Transfer " + id + " is " + status + " and cannot be modified");
        }
        this.status = transfer.getStatus();
        this.failureReason = transfer.getFailureReason();
        this.failureMessage = transfer.getFailureMessage();
        this.fromBalanceBefore = transfer.getFromBalanceBefore();
        this.fromBalanceAfter = transfer.getFromBalanceAfter();
        this.toBalanceBefore = transfer.getToBalanceBefore();
        this.toBalanceAfter = transfer.getToBalanceAfter();
        this.completedAt = transfer.getCompletedAt();
    }
}
