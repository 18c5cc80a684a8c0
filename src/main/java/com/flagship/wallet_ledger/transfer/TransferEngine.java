package com.flagship.wallet_ledger.transfer;

import com.flagship.wallet_ledger.account.Account;
import com.flagship.wallet_ledger.account.AccountService;
import com.flagship.wallet_ledger.account.AccountVerificationLookup;
import com.flagship.wallet_ledger.account.VerificationStatus;
import com.flagship.wallet_ledger.config.CurrencyCode;
import com.flagship.wallet_ledger.config.LedgerProperties;
import com.flagship.wallet_ledger.idempotency.IdempotencyRecord;
import com.flagship.wallet_ledger.idempotency.IdempotencyService;
import com.flagship.wallet_ledger.ledger.LedgerLeg;
import com.flagship.wallet_ledger.ledger.LedgerService;
import com.flagship.wallet_ledger.observability.CorrelationContext;
import com.flagship.wallet_ledger.observability.LedgerMetrics;
import com.flagship.wallet_ledger.outbox.OutboxService;
import com.flagship.wallet_ledger.transfer.event.TransferCompletedEvent;
import com.flagship.wallet_ledger.transfer.event.TransferFailedEvent;
import com.flagship.wallet_ledger.transfer.event.WalletCreditedEvent;
import com.flagship.wallet_ledger.transfer.exception.ConcurrencyConflictException;
import com.flagship.wallet_ledger.transfer.exception.TransferRejectedException;
import com.flagship.wallet_ledger.tx.ConcurrencyFailures;
import com.flagship.wallet_ledger.tx.UnitOfWork;
import com.flagship.wallet_ledger.tx.UnitOfWorkRunner;
import com.flagship.wallet_ledger.wallet.Wallet;
import com.flagship.wallet_ledger.wallet.WalletStore;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Moves money between wallets, and from external sources into wallets.
 *
 * Every request runs as:
 * 1. Idempotency lookup (cache, then database); a hit is answered with the stored outcome,
 *    whatever has happened to the accounts since
 * 2. Validation, before anything is locked or written
 * 3. One unit of work: lock the wallets in ascending id order, re-check idempotency, check
 *    the balance, move the money, write both ledger legs, complete the transfer, record the
 *    idempotency key and queue the notification
 *
 * Idempotency keys are scoped by transfer type, so a user's transfer key never answers for a
 * deposit. Insufficient funds is discovered under lock, so it is recorded as a FAILED transfer
 * under the idempotency key and returned, not thrown. Lock timeouts and deadlocks roll everything
 * back and surface as {@link ConcurrencyConflictException}; the same key can then be retried.
 */
@Service
@Slf4j
public class TransferEngine {

    static final String AGGREGATE_TYPE = "Transfer";
    static final String DEPOSIT_KEY_PREFIX = "DEPOSIT-";

    private final UnitOfWorkRunner unitOfWorkRunner;
    private final AccountService accountService;
    private final AccountVerificationLookup verificationLookup;
    private final WalletStore walletStore;
    private final LedgerService ledgerService;
    private final IdempotencyService idempotencyService;
    private final TransferPersistenceService persistenceService;
    private final OutboxService outboxService;
    private final AmountPolicy amountPolicy;
    private final LedgerMetrics metrics;
    private final CurrencyCode currency;
    private final boolean verificationRequired;
    private final boolean recipientVerificationRequired;

    public TransferEngine(UnitOfWorkRunner unitOfWorkRunner,
                          AccountService accountService,
                          AccountVerificationLookup verificationLookup,
                          WalletStore walletStore,
                          LedgerService ledgerService,
                          IdempotencyService idempotencyService,
                          TransferPersistenceService persistenceService,
                          OutboxService outboxService,
                          AmountPolicy amountPolicy,
                          LedgerMetrics metrics,
                          LedgerProperties properties) {
        this.unitOfWorkRunner = unitOfWorkRunner;
        this.accountService = accountService;
        this.verificationLookup = verificationLookup;
        this.walletStore = walletStore;
        this.ledgerService = ledgerService;
        this.idempotencyService = idempotencyService;
        this.persistenceService = persistenceService;
        this.outboxService = outboxService;
        this.amountPolicy = amountPolicy;
        this.metrics = metrics;
        this.currency = properties.getCurrency();
        this.verificationRequired = properties.getVerification().isRequired();
        this.recipientVerificationRequired = properties.getVerification().isRecipientRequired();
    }

    /**
     * Transfers money from the initiator's wallet to the recipient's.
     *
     * @throws TransferRejectedException if validation fails; nothing is written
     * @throws ConcurrencyConflictException if the unit of work lost a lock race; nothing is written
     */
    public TransferOutcome transfer(TransferCommand command) {
        UUID initiatorId = command.getInitiatorAccountId();
        MDC.put(CorrelationContext.ACCOUNT_ID_MDC_KEY, String.valueOf(initiatorId));
        try {
            String key = requireIdempotencyKey(command.getIdempotencyKey());
            Optional<TransferOutcome> replay = idempotencyService.findTransferId(TransferType.TRANSFER, key, initiatorId)
                .map(transferId -> replayOf(TransferType.TRANSFER, key, transferId,
                    original -> isSameTransferRequest(original, command)));
            if (replay.isPresent()) {
                return replay.get();
            }

            BigDecimal amount = amountPolicy.normalize(command.getAmount());
            Account recipient = accountService.resolveRecipient(command.getRecipientIdentifier())
                .filter(Account::isActive)
                .orElseThrow(() -> new TransferRejectedException(FailureReason.RECIPIENT_NOT_FOUND,
                    "Recipient not found: " + command.getRecipientIdentifier()));
            if (recipient.getId().equals(initiatorId)) {
                throw new TransferRejectedException(FailureReason.SELF_TRANSFER_NOT_ALLOWED,
                    "Cannot transfer to your own wallet");
            }
            requireMayTransact(initiatorId, verificationRequired, "Initiator");
            requireMayTransact(recipient.getId(), verificationRequired && recipientVerificationRequired, "Recipient");

            UUID fromWalletId = walletStore.findWalletIdByAccount(initiatorId)
                .orElseThrow(() -> new TransferRejectedException(FailureReason.VERIFICATION_REQUIRED,
                    "Initiator has no wallet"));
            UUID toWalletId = walletStore.findWalletIdByAccount(recipient.getId())
                .orElseThrow(() -> new IllegalStateException("Account " + recipient.getId() + " has no wallet"));

            String fingerprint = fingerprint(TransferType.TRANSFER, recipient.getId(), amount);
            Predicate<Transfer> sameRequest = matchesFingerprint(fingerprint);
            return runUnitOfWork(TransferType.TRANSFER, key, initiatorId, sameRequest, unitOfWork -> {
                Map<UUID, Wallet> locked = walletStore.lockAll(unitOfWork, List.of(fromWalletId, toWalletId));
                Optional<TransferOutcome> recorded = recordedOutcome(TransferType.TRANSFER, key, initiatorId, sameRequest);
                if (recorded.isPresent()) {
                    return recorded.get();
                }
                Wallet from = locked.get(fromWalletId);
                Wallet to = locked.get(toWalletId);

                Transfer pending = persistenceService.insert(unitOfWork, Transfer.initiate(
                    UUID.randomUUID(), key, initiatorId, recipient.getId(), amount, currency, command.getDescription()));
                MDC.put(CorrelationContext.TRANSFER_ID_MDC_KEY, pending.getId().toString());

                if (!from.canDebit(amount)) {
                    return recordInsufficientFunds(unitOfWork, pending, from, key, fingerprint);
                }

                Wallet debited = walletStore.save(unitOfWork, from.debit(amount));
                Wallet credited = walletStore.save(unitOfWork, to.credit(amount));
                ledgerService.record(unitOfWork, pending.getId(), List.of(
                    LedgerLeg.debit(fromWalletId, amount, debited.getBalance()),
                    LedgerLeg.credit(toWalletId, amount, credited.getBalance())
                ));

                Transfer completed = persistenceService.update(unitOfWork, pending.complete(
                    from.getBalance(), debited.getBalance(), to.getBalance(), credited.getBalance()));
                idempotencyService.record(unitOfWork, TransferType.TRANSFER, key, initiatorId, completed.getId(),
                    TransferStatus.COMPLETED, null, fingerprint);
                outboxService.saveEvent(AGGREGATE_TYPE, completed.getId(),
                    TransferCompletedEvent.EVENT_TYPE, TransferCompletedEvent.fromTransfer(completed));

                log.info("Transfer completed: amount={}, from={}, to={}, fromBalance={}, toBalance={}",
                    amount, initiatorId, recipient.getId(), debited.getBalance(), credited.getBalance());
                return TransferOutcome.completed(completed);
            });
        } catch (TransferRejectedException e) {
            metrics.recordRejection(e.getReason().name());
            log.warn("Transfer rejected: reason={}, message={}", e.getReason(), e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.ACCOUNT_ID_MDC_KEY);
            MDC.remove(CorrelationContext.TRANSFER_ID_MDC_KEY);
        }
    }

    /**
     * Credits external money (a settled payment) to an account's wallet.
     *
     * The idempotency key is {@code DEPOSIT-<sourceReference>} in the deposit scope of the credited
     * account, so the same source reference can never be credited twice and no user transfer key
     * can stand in for it.
     *
     * @throws TransferRejectedException if the amount is invalid or the account does not exist
     * @throws ConcurrencyConflictException if the unit of work lost a lock race; nothing is written
     */
    public TransferOutcome credit(UUID accountId, BigDecimal requestedAmount, String sourceReference, String description) {
        MDC.put(CorrelationContext.ACCOUNT_ID_MDC_KEY, String.valueOf(accountId));
        try {
            if (sourceReference == null || sourceReference.isBlank()) {
                throw new TransferRejectedException(FailureReason.MISSING_IDEMPOTENCY_KEY,
                    "A source reference is required for credits");
            }
            String key = DEPOSIT_KEY_PREFIX + sourceReference.trim();
            Optional<TransferOutcome> replay = idempotencyService.findTransferId(TransferType.DEPOSIT, key, accountId)
                .map(transferId -> replayOf(TransferType.DEPOSIT, key, transferId,
                    original -> original.getToAccountId().equals(accountId)
                        && requestedAmount != null
                        && original.getAmount().compareTo(requestedAmount) == 0));
            if (replay.isPresent()) {
                return replay.get();
            }

            BigDecimal amount = amountPolicy.normalize(requestedAmount);
            UUID walletId = walletStore.findWalletIdByAccount(accountId)
                .orElseThrow(() -> new TransferRejectedException(FailureReason.RECIPIENT_NOT_FOUND,
                    "Account not found: " + accountId));

            String fingerprint = fingerprint(TransferType.DEPOSIT, accountId, amount);
            Predicate<Transfer> sameRequest = matchesFingerprint(fingerprint);
            return runUnitOfWork(TransferType.DEPOSIT, key, accountId, sameRequest, unitOfWork -> {
                Wallet wallet = walletStore.getForUpdate(unitOfWork, walletId);
                Optional<TransferOutcome> recorded = recordedOutcome(TransferType.DEPOSIT, key, accountId, sameRequest);
                if (recorded.isPresent()) {
                    return recorded.get();
                }

                Transfer pending = persistenceService.insert(unitOfWork, Transfer.deposit(
                    UUID.randomUUID(), key, accountId, amount, currency, description, sourceReference.trim()));
                MDC.put(CorrelationContext.TRANSFER_ID_MDC_KEY, pending.getId().toString());

                Wallet credited = walletStore.save(unitOfWork, wallet.credit(amount));
                ledgerService.record(unitOfWork, pending.getId(), List.of(
                    LedgerLeg.externalDebit(sourceReference.trim(), amount),
                    LedgerLeg.credit(walletId, amount, credited.getBalance())
                ));

                Transfer completed = persistenceService.update(unitOfWork, pending.complete(
                    null, null, wallet.getBalance(), credited.getBalance()));
                idempotencyService.record(unitOfWork, TransferType.DEPOSIT, key, accountId, completed.getId(),
                    TransferStatus.COMPLETED, null, fingerprint);
                outboxService.saveEvent(AGGREGATE_TYPE, completed.getId(),
                    WalletCreditedEvent.EVENT_TYPE, WalletCreditedEvent.fromTransfer(completed));

                log.info("Wallet credited: amount={}, source={}, balance={}",
                    amount, sourceReference, credited.getBalance());
                return TransferOutcome.completed(completed);
            });
        } catch (TransferRejectedException e) {
            metrics.recordRejection(e.getReason().name());
            log.warn("Credit rejected: reason={}, message={}", e.getReason(), e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.ACCOUNT_ID_MDC_KEY);
            MDC.remove(CorrelationContext.TRANSFER_ID_MDC_KEY);
        }
    }

    /**
     * Runs the work in a fresh unit of work and maps its failure modes.
     *
     * The work re-checks idempotency once it holds the wallet locks, so a concurrent identical
     * request that committed first is replayed, not re-executed. If the unique index still
     * fires, the stored winner is replayed instead.
     */
    private TransferOutcome runUnitOfWork(TransferType type, String key, UUID accountId,
                                          Predicate<Transfer> sameRequest,
                                          Function<UnitOfWork, TransferOutcome> work) {
        long start = System.nanoTime();
        try {
            TransferOutcome outcome = unitOfWorkRunner.execute(work);
            if (!outcome.isReplay()) {
                metrics.recordTransfer(type.name(), outcome.getTransfer().getStatus().name());
            }
            return outcome;
        } catch (DataIntegrityViolationException e) {
            Optional<IdempotencyRecord> winner = idempotencyService.findRecord(type, key, accountId);
            if (winner.isEmpty()) {
                throw e;
            }
            log.info("Lost idempotency race for key {}, replaying stored outcome", key);
            return replayOf(type, key, winner.get().getTransferId(), sameRequest);
        } catch (RuntimeException e) {
            if (ConcurrencyFailures.isTransient(e)) {
                metrics.recordLockConflict();
                log.warn("Unit of work rolled back on lock conflict: key={}, error={}", key, e.getMessage());
                throw new ConcurrencyConflictException(
                    "Wallet is busy, retry with the same idempotency key", e);
            }
            log.error("Unit of work failed: key={}, error={}", key, e.getMessage());
            throw e;
        } finally {
            metrics.recordUnitOfWork(type.name(), Duration.ofNanos(System.nanoTime() - start));
        }
    }

    /**
     * Must run under the wallet locks: a record committed by a concurrent request is visible here.
     */
    private Optional<TransferOutcome> recordedOutcome(TransferType type, String key, UUID accountId,
                                                      Predicate<Transfer> sameRequest) {
        return idempotencyService.findRecord(type, key, accountId)
            .map(record -> replayOf(type, key, record.getTransferId(), sameRequest));
    }

    private TransferOutcome recordInsufficientFunds(UnitOfWork unitOfWork, Transfer pending, Wallet from,
                                                    String key, String fingerprint) {
        String message = String.format("Insufficient funds: balance %s, requested %s",
            from.getBalance().toPlainString(), pending.getAmount().toPlainString());
        Transfer failed = persistenceService.update(unitOfWork,
            pending.fail(FailureReason.INSUFFICIENT_FUNDS, message, from.getBalance()));
        idempotencyService.record(unitOfWork, TransferType.TRANSFER, key, pending.getInitiatorAccountId(), failed.getId(),
            TransferStatus.FAILED, FailureReason.INSUFFICIENT_FUNDS, fingerprint);
        outboxService.saveEvent(AGGREGATE_TYPE, failed.getId(),
            TransferFailedEvent.EVENT_TYPE, TransferFailedEvent.fromTransfer(failed));

        log.warn("Transfer failed: reason={}, message={}", FailureReason.INSUFFICIENT_FUNDS, message);
        return TransferOutcome.failed(failed);
    }

    private TransferOutcome replayOf(TransferType scope, String key, UUID transferId,
                                     Predicate<Transfer> sameRequest) {
        Transfer original = persistenceService.findById(transferId)
            .orElseThrow(() -> new IllegalStateException(
                "Idempotency key " + key + " points at missing transfer " + transferId));
        if (original.getType() != scope) {
            throw new IllegalStateException(String.format(
                "%s idempotency key %s points at %s transfer %s", scope, key, original.getType(), transferId));
        }
        if (!sameRequest.test(original)) {
            log.warn("Idempotency key {} reused with a different request; returning the original outcome", key);
        }
        metrics.recordReplay(original.getType().name());
        log.info("Idempotent replay: key={}, transferId={}, status={}", key, transferId, original.getStatus());
        return TransferOutcome.alreadyProcessed(original);
    }

    private boolean isSameTransferRequest(Transfer original, TransferCommand command) {
        boolean sameAmount = command.getAmount() != null && original.getAmount().compareTo(command.getAmount()) == 0;
        return sameAmount && accountService.resolveRecipient(command.getRecipientIdentifier())
            .map(recipient -> recipient.getId().equals(original.getToAccountId()))
            .orElse(false);
    }

    private static Predicate<Transfer> matchesFingerprint(String fingerprint) {
        return original -> fingerprint(original.getType(), original.getToAccountId(), original.getAmount())
            .equals(fingerprint);
    }

    private void requireMayTransact(UUID accountId, boolean mustBeVerified, String party) {
        Optional<VerificationStatus> status = verificationLookup.statusOf(accountId);
        if (status.isEmpty()) {
            throw new TransferRejectedException(FailureReason.VERIFICATION_REQUIRED,
                party + " account is not active");
        }
        if (mustBeVerified && status.get() != VerificationStatus.VERIFIED) {
            throw new TransferRejectedException(FailureReason.VERIFICATION_REQUIRED,
                party + " account verification is " + status.get());
        }
    }

    private static String requireIdempotencyKey(String key) {
        if (key == null || key.isBlank()) {
            throw new TransferRejectedException(FailureReason.MISSING_IDEMPOTENCY_KEY, "Idempotency key is required");
        }
        if (key.length() > 255) {
            throw new TransferRejectedException(FailureReason.MISSING_IDEMPOTENCY_KEY,
                "Idempotency key must be at most 255 characters");
        }
        return key.trim();
    }

    static String fingerprint(TransferType type, UUID counterparty, BigDecimal amount) {
        return type + ":" + counterparty + ":" + amount.stripTrailingZeros().toPlainString();
    }
}
