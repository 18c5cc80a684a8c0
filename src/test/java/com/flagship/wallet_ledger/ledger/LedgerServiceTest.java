package com.flagship.wallet_ledger.ledger;

import com.flagship.wallet_ledger.support.AbstractIntegrationTest;
import com.flagship.wallet_ledger.transfer.TransferCommand;
import com.flagship.wallet_ledger.transfer.TransferOutcome;
import com.flagship.wallet_ledger.tx.UnitOfWorkRunner;
import com.flagship.wallet_ledger.wallet.WalletStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.NestedRuntimeException;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Double-entry rules, enforced by {@link LedgerService} and again by the database.
 */
class LedgerServiceTest extends AbstractIntegrationTest {

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private BalanceAuditService auditService;

    @Autowired
    private WalletStore walletStore;

    @Autowired
    private UnitOfWorkRunner unitOfWorkRunner;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private PlatformTransactionManager transactionManager;

    private UUID alice;
    private UUID bob;
    private UUID aliceWallet;
    private UUID bobWallet;

    @BeforeEach
    void setUp() {
        alice = verifiedAccount("alice");
        bob = verifiedAccount("bob");
        aliceWallet = walletStore.findWalletIdByAccount(alice).orElseThrow();
        bobWallet = walletStore.findWalletIdByAccount(bob).orElseThrow();
    }

    private UUID completedTransfer() {
        fund(alice, "50.00");
        TransferOutcome outcome = transferEngine.transfer(new TransferCommand(alice, bob.toString(),
            new BigDecimal("20.00"), "ledger test", "ledger-" + UUID.randomUUID()));
        return outcome.getTransfer().getId();
    }

    @Test
    @DisplayName("Unbalanced or one-sided postings are refused before any row is written")
    void testRecord_RejectsUnbalanced() {
        UUID transferId = UUID.randomUUID();

        assertThrows(IllegalArgumentException.class, () -> unitOfWorkRunner.execute(unitOfWork -> {
            walletStore.lockAll(unitOfWork, List.of(aliceWallet, bobWallet));
            return ledgerService.record(unitOfWork, transferId, List.of(
                LedgerLeg.debit(aliceWallet, new BigDecimal("10.00"), BigDecimal.ZERO),
                LedgerLeg.credit(bobWallet, new BigDecimal("9.99"), BigDecimal.ZERO)));
        }));
        assertThrows(IllegalArgumentException.class, () -> unitOfWorkRunner.execute(unitOfWork ->
            ledgerService.record(unitOfWork, transferId, List.of(
                LedgerLeg.externalDebit("gateway", new BigDecimal("10.00"))))));
        assertThrows(IllegalArgumentException.class, () -> unitOfWorkRunner.execute(unitOfWork ->
            ledgerService.record(unitOfWork, transferId, List.of())));
    }

    @Test
    @DisplayName("Wallet legs require the wallet to be locked by the same unit of work")
    void testRecord_RequiresLock() {
        assertThrows(IllegalStateException.class, () -> unitOfWorkRunner.execute(unitOfWork ->
            ledgerService.record(unitOfWork, UUID.randomUUID(), List.of(
                LedgerLeg.externalDebit("gateway", new BigDecimal("10.00")),
                LedgerLeg.credit(bobWallet, new BigDecimal("10.00"), new BigDecimal("10.00"))))));
    }

    @Test
    @DisplayName("The database refuses to commit a one-legged transfer")
    void testDatabase_BalanceTrigger() {
        UUID transferId = completedTransfer();
        TransactionTemplate transaction = new TransactionTemplate(transactionManager);

        assertThrows(NestedRuntimeException.class, () -> transaction.executeWithoutResult(status ->
            jdbcTemplate.update(
                "INSERT INTO ledger_entries (id, transfer_id, wallet_id, entry_type, amount, balance_after) " +
                "VALUES (?, ?, ?, 'DEBIT', 5.00, 0)",
                UUID.randomUUID(), transferId, aliceWallet)));

        assertEquals(2, ledgerService.entriesFor(transferId).size());
    }

    @Test
    @DisplayName("Ledger entries and terminal transfers cannot be rewritten")
    void testDatabase_AppendOnly() {
        UUID transferId = completedTransfer();

        assertThrows(DataAccessException.class, () ->
            jdbcTemplate.update("UPDATE ledger_entries SET amount = 1 WHERE transfer_id = ?", transferId));
        assertThrows(DataAccessException.class, () ->
            jdbcTemplate.update("DELETE FROM ledger_entries WHERE transfer_id = ?", transferId));
        assertThrows(DataAccessException.class, () ->
            jdbcTemplate.update("UPDATE transfers SET status = 'FAILED' WHERE id = ?", transferId));
    }

    @Test
    @DisplayName("Wallet balances cannot go negative even through direct SQL")
    void testDatabase_NonNegativeBalance() {
        assertThrows(DataAccessException.class, () ->
            jdbcTemplate.update("UPDATE wallets SET balance = -1 WHERE id = ?", aliceWallet));
    }

    @Test
    @DisplayName("The audit agrees after normal traffic and flags a tampered balance")
    void testAudit() {
        completedTransfer();

        BalanceAudit clean = auditService.audit(alice);
        assertTrue(clean.isConsistent());
        assertMoney("30.00", clean.getLedgerBalance());

        jdbcTemplate.update("UPDATE wallets SET balance = balance + 1 WHERE id = ?", bobWallet);
        BalanceAudit tampered = auditService.audit(bob);

        assertFalse(tampered.isConsistent());
        assertMoney("21.00", tampered.getStoredBalance());
        assertMoney("20.00", tampered.getLedgerBalance());
    }

    @Test
    @DisplayName("Auditing an unknown account is an error")
    void testAudit_UnknownAccount() {
        assertThrows(IllegalArgumentException.class, () -> auditService.audit(UUID.randomUUID()));
    }
}
