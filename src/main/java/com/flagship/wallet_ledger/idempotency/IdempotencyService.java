package com.flagship.wallet_ledger.idempotency;

import com.flagship.wallet_ledger.transfer.FailureReason;
import com.flagship.wallet_ledger.transfer.TransferStatus;
import com.flagship.wallet_ledger.transfer.TransferType;
import com.flagship.wallet_ledger.tx.UnitOfWork;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

/**
 * Idempotency index keyed by (scope, idempotency key, account).
 *
 * The scope is the transfer type, so user transfer keys and deposit keys never collide.
 *
 * Strategy:
 * 1. {@link #findTransferId} tries the Redis cache first, then the database. Used before any lock is taken.
 * 2. {@link #findRecord} reads only the database. Used under the wallet locks, where it is authoritative.
 * 3. {@link #record} inserts inside the transfer's unit of work and fills the cache after commit.
 */
@Service
@Slf4j
public class IdempotencyService {

    private final IdempotencyRecordRepository repository;
    private final Optional<IdempotencyCache> cache;

    public IdempotencyService(IdempotencyRecordRepository repository, Optional<IdempotencyCache> cache) {
        this.repository = repository;
        this.cache = cache;
    }

    public Optional<UUID> findTransferId(TransferType scope, String idempotencyKey, UUID accountId) {
        requireKey(idempotencyKey);
        Optional<UUID> cached = cache.flatMap(c -> c.get(scope, idempotencyKey, accountId));
        if (cached.isPresent()) {
            return cached;
        }
        Optional<IdempotencyRecord> record = findRecord(scope, idempotencyKey, accountId);
        record.ifPresent(r -> cache.ifPresent(c -> c.put(scope, idempotencyKey, accountId, r.getTransferId())));
        return record.map(IdempotencyRecord::getTransferId);
    }

    @Transactional(readOnly = true)
    public Optional<IdempotencyRecord> findRecord(TransferType scope, String idempotencyKey, UUID accountId) {
        requireKey(idempotencyKey);
        return repository.findByScopeAndIdempotencyKeyAndAccountId(scope, idempotencyKey, accountId)
            .map(IdempotencyRecordEntity::toDomain);
    }

    /**
     * Inserts the record and flushes, so a concurrent duplicate surfaces here as a
     * {@link org.springframework.dao.DataIntegrityViolationException}.
     */
    public IdempotencyRecord record(UnitOfWork unitOfWork, TransferType scope, String idempotencyKey, UUID accountId,
                                    UUID transferId, TransferStatus outcome, FailureReason failureReason,
                                    String requestFingerprint) {
        requireKey(idempotencyKey);
        IdempotencyRecord record = IdempotencyRecord.of(
            scope, idempotencyKey, accountId, transferId, outcome, failureReason, requestFingerprint);
        repository.saveAndFlush(IdempotencyRecordEntity.fromDomain(record));
        log.debug("Recorded {} idempotency key {} for account {} -> {} ({})",
            scope, idempotencyKey, accountId, transferId, outcome);

        cache.ifPresent(c -> unitOfWork.afterCommit("cache idempotency key",
            () -> c.put(scope, idempotencyKey, accountId, transferId)));
        return record;
    }

    private static void requireKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
    }
}
