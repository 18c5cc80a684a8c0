package com.flagship.wallet_ledger.transfer;

import com.flagship.wallet_ledger.config.LedgerProperties;
import com.flagship.wallet_ledger.ledger.LedgerEntry;
import com.flagship.wallet_ledger.ledger.LedgerService;
import com.flagship.wallet_ledger.transfer.exception.TransferRejectedException;
import com.flagship.wallet_ledger.wallet.WalletStore;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read side: balances, history and ledger lookups. Reads see the latest committed state and
 * never take wallet locks.
 */
@Service
public class TransferQueryService {

    private final WalletStore walletStore;
    private final TransferPersistenceService persistenceService;
    private final LedgerService ledgerService;
    private final int defaultPageSize;
    private final int maxPageSize;

    public TransferQueryService(WalletStore walletStore,
                                TransferPersistenceService persistenceService,
                                LedgerService ledgerService,
                                LedgerProperties properties) {
        this.walletStore = walletStore;
        this.persistenceService = persistenceService;
        this.ledgerService = ledgerService;
        this.defaultPageSize = properties.getHistory().getDefaultPageSize();
        this.maxPageSize = properties.getHistory().getMaxPageSize();
    }

    /**
     * @throws TransferRejectedException with {@link FailureReason#RECIPIENT_NOT_FOUND} if the account has no wallet
     */
    public BigDecimal getBalance(UUID accountId) {
        return walletStore.findBalance(accountId)
            .orElseThrow(() -> new TransferRejectedException(FailureReason.RECIPIENT_NOT_FOUND,
                "Account not found: " + accountId));
    }

    /**
     * Newest-first history. Pass the previous page's {@code nextCursor} to continue;
     * a null cursor starts from the newest transfer.
     */
    public HistoryPage getHistory(UUID accountId, String cursor, Integer limit) {
        int pageSize = limit == null ? defaultPageSize : Math.max(1, Math.min(limit, maxPageSize));
        Long before = cursor == null || cursor.isBlank() ? null : HistoryCursor.decode(cursor);

        // One extra row tells us whether another page exists
        List<Transfer> transfers = persistenceService.findHistory(accountId, before, pageSize + 1);
        boolean hasMore = transfers.size() > pageSize;
        List<Transfer> page = hasMore ? transfers.subList(0, pageSize) : transfers;

        List<HistoryItem> items = page.stream()
            .map(transfer -> HistoryItem.of(transfer, accountId))
            .toList();
        String nextCursor = hasMore ? HistoryCursor.encode(page.get(page.size() - 1).getSequenceNumber()) : null;
        return new HistoryPage(items, nextCursor);
    }

    public Optional<Transfer> findTransfer(UUID transferId) {
        return persistenceService.findById(transferId);
    }

    public List<LedgerEntry> ledgerEntries(UUID transferId) {
        return ledgerService.entriesFor(transferId);
    }
}
