package com.flagship.wallet_ledger.transfer;

import com.flagship.wallet_ledger.account.Account;
import com.flagship.wallet_ledger.account.AccountService;
import com.flagship.wallet_ledger.account.AccountVerificationLookup;
import com.flagship.wallet_ledger.account.VerificationStatus;
import com.flagship.wallet_ledger.config.CurrencyCode;
import com.flagship.wallet_ledger.config.LedgerProperties;
import com.flagship.wallet_ledger.idempotency.IdempotencyRecord;
import com.flagship.wallet_ledger.idempotency.IdempotencyService;
import com.flagship.wallet_ledger.ledger.LedgerService;
import com.flagship.wallet_ledger.observability.LedgerMetrics;
import com.flagship.wallet_ledger.outbox.OutboxService;
import com.flagship.wallet_ledger.tx.UnitOfWork;
import com.flagship.wallet_ledger.tx.UnitOfWorkRunner;
import com.flagship.wallet_ledger.wallet.Wallet;
import com.flagship.wallet_ledger.wallet.WalletStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Idempotency ordering inside the engine, with every collaborator mocked.
 */
class TransferEngineTest {

    private final UnitOfWorkRunner unitOfWorkRunner = mock(UnitOfWorkRunner.class);
    private final AccountService accountService = mock(AccountService.class);
    private final AccountVerificationLookup verificationLookup = mock(AccountVerificationLookup.class);
    private final WalletStore walletStore = mock(WalletStore.class);
    private final LedgerService ledgerService = mock(LedgerService.class);
    private final IdempotencyService idempotencyService = mock(IdempotencyService.class);
    private final TransferPersistenceService persistenceService = mock(TransferPersistenceService.class);
    private final OutboxService outboxService = mock(OutboxService.class);

    private TransferEngine engine;
    private UUID alice;
    private UUID bob;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        LedgerProperties properties = new LedgerProperties();
        engine = new TransferEngine(unitOfWorkRunner, accountService, verificationLookup, walletStore, ledgerService,
            idempotencyService, persistenceService, outboxService, new AmountPolicy(properties),
            new LedgerMetrics(new SimpleMeterRegistry()), properties);
        alice = UUID.randomUUID();
        bob = UUID.randomUUID();

        UnitOfWork unitOfWork = mock(UnitOfWork.class);
        when(unitOfWorkRunner.execute(any())).thenAnswer(invocation ->
            ((Function<UnitOfWork, Object>) invocation.getArgument(0)).apply(unitOfWork));
    }

    private Transfer completedTransfer(UUID from, UUID to, String amount, String key) {
        return Transfer.initiate(UUID.randomUUID(), key, from, to, new BigDecimal(amount), CurrencyCode.USD, "rent")
            .complete(new BigDecimal("100.00"), new BigDecimal("50.00"), BigDecimal.ZERO, new BigDecimal("50.00"));
    }

    private Transfer completedDeposit(UUID accountId, String amount, String source) {
        return Transfer.deposit(UUID.randomUUID(), TransferEngine.DEPOSIT_KEY_PREFIX + source, accountId,
                new BigDecimal(amount), CurrencyCode.USD, "top up", source)
            .complete(null, null, BigDecimal.ZERO, new BigDecimal(amount));
    }

    private TransferCommand command(String amount, String key) {
        return new TransferCommand(alice, bob.toString(), new BigDecimal(amount), "rent", key);
    }

    @Test
    @DisplayName("A stored outcome is returned before the accounts are validated again")
    void testTransfer_ReplaySkipsValidation() {
        Transfer original = completedTransfer(alice, bob, "50.00", "k1");
        when(idempotencyService.findTransferId(TransferType.TRANSFER, "k1", alice))
            .thenReturn(Optional.of(original.getId()));
        when(persistenceService.findById(original.getId())).thenReturn(Optional.of(original));
        when(accountService.resolveRecipient(bob.toString())).thenReturn(Optional.of(
            new Account(bob, "bob@example.com", "Bob", VerificationStatus.VERIFIED, false, Instant.now())));
        when(verificationLookup.statusOf(alice)).thenReturn(Optional.of(VerificationStatus.EXPIRED));

        TransferOutcome outcome = engine.transfer(command("50.00", "k1"));

        assertEquals(TransferOutcome.Kind.ALREADY_PROCESSED, outcome.getKind());
        assertEquals(original.getId(), outcome.getTransfer().getId());
        verifyNoInteractions(verificationLookup, walletStore, unitOfWorkRunner);
    }

    @Test
    @DisplayName("A record committed while waiting for the wallet locks is replayed, not re-executed")
    void testTransfer_RecheckAfterLocks() {
        Transfer winner = completedTransfer(alice, bob, "10.00", "k2");
        UUID fromWallet = UUID.randomUUID();
        UUID toWallet = UUID.randomUUID();
        when(idempotencyService.findTransferId(TransferType.TRANSFER, "k2", alice)).thenReturn(Optional.empty());
        when(accountService.resolveRecipient(bob.toString())).thenReturn(Optional.of(
            new Account(bob, "bob@example.com", "Bob", VerificationStatus.VERIFIED, true, Instant.now())));
        when(verificationLookup.statusOf(any())).thenReturn(Optional.of(VerificationStatus.VERIFIED));
        when(walletStore.findWalletIdByAccount(alice)).thenReturn(Optional.of(fromWallet));
        when(walletStore.findWalletIdByAccount(bob)).thenReturn(Optional.of(toWallet));
        when(walletStore.lockAll(any(), anyList())).thenReturn(Map.of(
            fromWallet, new Wallet(fromWallet, alice, new BigDecimal("100.00"), CurrencyCode.USD, 1L),
            toWallet, new Wallet(toWallet, bob, BigDecimal.ZERO, CurrencyCode.USD, 1L)));
        when(idempotencyService.findRecord(TransferType.TRANSFER, "k2", alice)).thenReturn(Optional.of(
            IdempotencyRecord.of(TransferType.TRANSFER, "k2", alice, winner.getId(), TransferStatus.COMPLETED, null,
                TransferEngine.fingerprint(TransferType.TRANSFER, bob, new BigDecimal("10.00")))));
        when(persistenceService.findById(winner.getId())).thenReturn(Optional.of(winner));

        TransferOutcome outcome = engine.transfer(command("10.00", "k2"));

        assertTrue(outcome.isReplay());
        assertEquals(winner.getId(), outcome.getTransfer().getId());
        InOrder order = inOrder(walletStore, idempotencyService);
        order.verify(walletStore).lockAll(any(), eq(List.of(fromWallet, toWallet)));
        order.verify(idempotencyService).findRecord(TransferType.TRANSFER, "k2", alice);
        verify(persistenceService, never()).insert(any(), any());
        verify(walletStore, never()).save(any(), any());
    }

    @Test
    @DisplayName("Credits look up deposit keys only, and lock the wallet before the re-check")
    void testCredit_UsesDepositScope() {
        String source = UUID.randomUUID().toString();
        String key = TransferEngine.DEPOSIT_KEY_PREFIX + source;
        UUID walletId = UUID.randomUUID();
        Transfer pending = Transfer.deposit(UUID.randomUUID(), key, alice, new BigDecimal("40.00"),
            CurrencyCode.USD, "top up", source);
        when(idempotencyService.findTransferId(TransferType.DEPOSIT, key, alice)).thenReturn(Optional.empty());
        when(idempotencyService.findRecord(TransferType.DEPOSIT, key, alice)).thenReturn(Optional.empty());
        when(walletStore.findWalletIdByAccount(alice)).thenReturn(Optional.of(walletId));
        Wallet wallet = new Wallet(walletId, alice, new BigDecimal("9.00"), CurrencyCode.USD, 3L);
        when(walletStore.getForUpdate(any(), any())).thenReturn(wallet);
        when(persistenceService.insert(any(), any())).thenReturn(pending);
        when(walletStore.save(any(), any())).thenAnswer(invocation -> invocation.getArgument(1));
        when(persistenceService.update(any(), any())).thenAnswer(invocation -> invocation.getArgument(1));

        TransferOutcome outcome = engine.credit(alice, new BigDecimal("40.00"), source, "top up");

        assertEquals(TransferOutcome.Kind.COMPLETED, outcome.getKind());
        assertEquals(TransferType.DEPOSIT, outcome.getTransfer().getType());
        InOrder order = inOrder(walletStore, idempotencyService);
        order.verify(walletStore).getForUpdate(any(), any());
        order.verify(idempotencyService).findRecord(TransferType.DEPOSIT, key, alice);
        verify(idempotencyService).record(any(), any(), any(), any(), any(), any(), any(), any());
        verify(idempotencyService, never()).findTransferId(TransferType.TRANSFER, key, alice);
    }

    @Test
    @DisplayName("A deposit key that resolves to a non-deposit transfer is refused, not replayed")
    void testCredit_RefusesForeignTransfer() {
        String source = UUID.randomUUID().toString();
        String key = TransferEngine.DEPOSIT_KEY_PREFIX + source;
        Transfer userTransfer = completedTransfer(alice, bob, "1.00", key);
        when(idempotencyService.findTransferId(TransferType.DEPOSIT, key, alice))
            .thenReturn(Optional.of(userTransfer.getId()));
        when(persistenceService.findById(userTransfer.getId())).thenReturn(Optional.of(userTransfer));

        assertThrows(IllegalStateException.class,
            () -> engine.credit(alice, new BigDecimal("40.00"), source, "top up"));
        verifyNoInteractions(unitOfWorkRunner);
    }

    @Test
    @DisplayName("A repeated credit replays the stored deposit")
    void testCredit_Replay() {
        String source = UUID.randomUUID().toString();
        Transfer deposit = completedDeposit(alice, "40.00", source);
        when(idempotencyService.findTransferId(TransferType.DEPOSIT, deposit.getReference(), alice))
            .thenReturn(Optional.of(deposit.getId()));
        when(persistenceService.findById(deposit.getId())).thenReturn(Optional.of(deposit));

        TransferOutcome outcome = engine.credit(alice, new BigDecimal("40.00"), source, "top up");

        assertTrue(outcome.isReplay());
        assertEquals(deposit.getId(), outcome.getTransfer().getId());
        verifyNoInteractions(walletStore, unitOfWorkRunner);
    }
}
