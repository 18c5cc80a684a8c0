package com.flagship.wallet_ledger.transfer;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface TransferRepository extends JpaRepository<TransferEntity, UUID> {

    /**
     * Newest-first history of an account: everything it sent (completed or failed)
     * and every completed transfer into it.
     */
    @Query("SELECT t FROM TransferEntity t " +
           "WHERE (t.fromAccountId = :accountId AND t.status <> com.flagship.wallet_ledger.transfer.TransferStatus.PENDING) " +
           "   OR (t.toAccountId = :accountId AND t.status = com.flagship.wallet_ledger.transfer.TransferStatus.COMPLETED) " +
           "ORDER BY t.sequenceNumber DESC")
    List<TransferEntity> findHistory(@Param("accountId") UUID accountId, Pageable pageable);

    /**
     * Same as {@link #findHistory} but strictly older than the given sequence number.
     */
    @Query("SELECT t FROM TransferEntity t " +
           "WHERE t.sequenceNumber < :before AND (" +
           "      (t.fromAccountId = :accountId AND t.status <> com.flagship.wallet_ledger.transfer.TransferStatus.PENDING) " +
           "   OR (t.toAccountId = :accountId AND t.status = com.flagship.wallet_ledger.transfer.TransferStatus.COMPLETED)) " +
           "ORDER BY t.sequenceNumber DESC")
    List<TransferEntity> findHistoryBefore(@Param("accountId") UUID accountId,
                                           @Param("before") long before,
                                           Pageable pageable);
}
