package com.flagship.wallet_ledger.idempotency;

import com.flagship.wallet_ledger.transfer.FailureReason;
import com.flagship.wallet_ledger.transfer.TransferStatus;
import com.flagship.wallet_ledger.transfer.TransferType;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Persistable;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for idempotency records.
 *
 * Always inserted, never merged: a second record for the same (scope, key, account) must fail
 * on the primary key instead of overwriting the first outcome.
 */
@Entity
@Table(name = "idempotency_records")
@IdClass(IdempotencyRecordId.class)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class IdempotencyRecordEntity implements Persistable<IdempotencyRecordId> {

    @Id
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private TransferType scope;

    @Id
    @Column(name = "idempotency_key", nullable = false, updatable = false)
    private String idempotencyKey;

    @Id
    @Column(name = "account_id", nullable = false, updatable = false)
    private UUID accountId;

    @Column(name = "transfer_id", nullable = false, updatable = false)
    private UUID transferId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private TransferStatus outcome;

    @Enumerated(EnumType.STRING)
    @Column(name = "failure_reason", updatable = false)
    private FailureReason failureReason;

    @Column(name = "request_fingerprint", nullable = false, updatable = false)
    private String requestFingerprint;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Transient
    @Getter(AccessLevel.NONE)
    private boolean newRecord;

    static IdempotencyRecordEntity fromDomain(IdempotencyRecord record) {
        IdempotencyRecordEntity entity = new IdempotencyRecordEntity();
        entity.scope = record.getScope();
        entity.idempotencyKey = record.getIdempotencyKey();
        entity.accountId = record.getAccountId();
        entity.transferId = record.getTransferId();
        entity.outcome = record.getOutcome();
        entity.failureReason = record.getFailureReason();
        entity.requestFingerprint = record.getRequestFingerprint();
        entity.createdAt = record.getCreatedAt();
        entity.newRecord = true;
        return entity;
    }

    public IdempotencyRecord toDomain() {
        return new IdempotencyRecord(scope, idempotencyKey, accountId, transferId, outcome, failureReason,
            requestFingerprint, createdAt);
    }

    @Override
    public IdempotencyRecordId getId() {
        return new IdempotencyRecordId(scope, idempotencyKey, accountId);
    }

    @Override
    public boolean isNew() {
        return newRecord;
    }

    @PostLoad
    @PostPersist
    void markPersisted() {
        this.newRecord = false;
    }
}
