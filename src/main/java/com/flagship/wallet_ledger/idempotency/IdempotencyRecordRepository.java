package com.flagship.wallet_ledger.idempotency;

import com.flagship.wallet_ledger.transfer.TransferType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface IdempotencyRecordRepository extends JpaRepository<IdempotencyRecordEntity, IdempotencyRecordId> {

    Optional<IdempotencyRecordEntity> findByScopeAndIdempotencyKeyAndAccountId(TransferType scope,
                                                                               String idempotencyKey,
                                                                               UUID accountId);
}
