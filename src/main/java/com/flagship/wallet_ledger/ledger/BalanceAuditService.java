package com.flagship.wallet_ledger.ledger;

import com.flagship.wallet_ledger.wallet.Wallet;
import com.flagship.wallet_ledger.wallet.WalletStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Checks that a wallet's stored balance matches its ledger history.
 */
@Service
@Slf4j
public class BalanceAuditService {

    private final WalletStore walletStore;
    private final LedgerService ledgerService;

    public BalanceAuditService(WalletStore walletStore, LedgerService ledgerService) {
        this.walletStore = walletStore;
        this.ledgerService = ledgerService;
    }

    /**
     * Reads both figures from one snapshot so a concurrent transfer cannot skew the comparison.
     *
     * @throws IllegalArgumentException if the account has no wallet
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public BalanceAudit audit(UUID accountId) {
        Wallet wallet = walletStore.findByAccount(accountId)
            .orElseThrow(() -> new IllegalArgumentException("Account not found: " + accountId));
        BalanceAudit audit = new BalanceAudit(
            accountId,
            wallet.getId(),
            wallet.getBalance(),
            ledgerService.derivedBalance(wallet.getId())
        );
        if (!audit.isConsistent()) {
            log.error("Balance mismatch for wallet {}: stored={}, ledger={}",
                wallet.getId(), audit.getStoredBalance(), audit.getLedgerBalance());
        }
        return audit;
    }
}
