package com.flagship.wallet_ledger.transfer;

import com.flagship.wallet_ledger.tx.UnitOfWork;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Bridges the {@link Transfer} domain object and {@link TransferEntity}.
 *
 * Writes take the {@link UnitOfWork} they belong to; reads open their own read-only transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransferPersistenceService {

    private final TransferRepository transferRepository;

    /**
     * Inserts a PENDING transfer and flushes, so the unique (initiator, reference) constraint
     * fires here rather than at commit.
     */
    public Transfer insert(UnitOfWork unitOfWork, Transfer transfer) {
        if (transfer.getStatus() != TransferStatus.PENDING) {
            throw new IllegalArgumentException("Only PENDING transfers can be inserted");
        }
        TransferEntity saved = transferRepository.saveAndFlush(TransferEntity.fromDomain(transfer));
        log.debug("Inserted transfer {} with reference {}", saved.getId(), saved.getReference());
        return saved.toDomain();
    }

    /**
     * Writes a terminal transition of a transfer inserted in the same unit of work.
     */
    public Transfer update(UnitOfWork unitOfWork, Transfer transfer) {
        TransferEntity existing = transferRepository.findById(transfer.getId())
            .orElseThrow(() -> new IllegalArgumentException("Transfer not found: " + transfer.getId()));
        existing.updateFromDomain(transfer);
        TransferEntity updated = transferRepository.saveAndFlush(existing);
        log.debug("Transfer {} is now {}", updated.getId(), updated.getStatus());
        return updated.toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<Transfer> findById(UUID transferId) {
        return transferRepository.findById(transferId).map(TransferEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<Transfer> findHistory(UUID accountId, Long beforeSequence, int limit) {
        PageRequest page = PageRequest.of(0, limit);
        List<TransferEntity> entities = beforeSequence == null
            ? transferRepository.findHistory(accountId, page)
            : transferRepository.findHistoryBefore(accountId, beforeSequence, page);
        return entities.stream().map(TransferEntity::toDomain).toList();
    }
}
