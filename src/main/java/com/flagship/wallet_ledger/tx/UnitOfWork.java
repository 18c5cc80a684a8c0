package com.flagship.wallet_ledger.tx;

import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Handle for one atomic unit of work, created by {@link UnitOfWorkRunner}.
 *
 * Everything that mutates wallets, transfers, ledger entries or idempotency records takes
 * this handle as a parameter, which makes the transaction boundary visible in every signature.
 * It also tracks which wallet rows are locked so that writes to an unlocked wallet fail fast.
 */
@Slf4j
public final class UnitOfWork {

    private final Set<UUID> lockedWallets = new HashSet<>();

    UnitOfWork() {
    }

    /**
     * Records that the given wallet row is now held under an exclusive lock.
     */
    public void registerLock(UUID walletId) {
        lockedWallets.add(walletId);
    }

    public boolean holdsLock(UUID walletId) {
        return lockedWallets.contains(walletId);
    }

    /**
     * Runs the action once the unit of work has committed. Never runs on rollback.
     * Failures are logged and dropped: committed money movements are not undone by a side effect.
     */
    public void afterCommit(String description, Runnable action) {
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                try {
                    action.run();
                } catch (RuntimeException e) {
                    log.warn("Post-commit action '{}' failed: {}", description, e.getMessage());
                }
            }
        });
    }
}
