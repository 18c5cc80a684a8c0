package com.flagship.wallet_ledger.payment;

import com.flagship.wallet_ledger.observability.LedgerMetrics;
import com.flagship.wallet_ledger.transfer.Transfer;
import com.flagship.wallet_ledger.transfer.TransferEngine;
import com.flagship.wallet_ledger.transfer.TransferOutcome;
import com.flagship.wallet_ledger.transfer.TransferStatus;
import com.flagship.wallet_ledger.transfer.TransferType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.UUID;

/**
 * Applies confirmed gateway outcomes to payment intents.
 *
 * A success credits the intent's account through {@link TransferEngine#credit} with the
 * intent id as source reference, then marks the intent SUCCEEDED. The credit is idempotent on
 * its own, so a crash between the two steps is repaired by the next delivery of the same
 * signal. FAILED and EXPIRED only change the intent.
 */
@Service
@Slf4j
public class PaymentIntentReconciler {

    private final PaymentIntentRepository repository;
    private final TransferEngine transferEngine;
    private final LedgerMetrics metrics;
    private final TransactionTemplate transactionTemplate;

    public PaymentIntentReconciler(PaymentIntentRepository repository,
                                   TransferEngine transferEngine,
                                   LedgerMetrics metrics,
                                   PlatformTransactionManager transactionManager) {
        this.repository = repository;
        this.transferEngine = transferEngine;
        this.metrics = metrics;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * @throws IllegalArgumentException if no intent has the signal's gateway payment id
     * @throws IllegalStateException if the signal contradicts the intent's terminal status
     */
    public PaymentIntent apply(GatewaySignal signal) {
        PaymentIntent intent = repository.findByGatewayPaymentId(signal.getGatewayPaymentId())
            .map(PaymentIntentEntity::toDomain)
            .orElseThrow(() -> new IllegalArgumentException(
                "Payment intent not found: " + signal.getGatewayPaymentId()));

        return switch (signal.getType()) {
            case SUCCEEDED -> succeed(intent);
            case FAILED -> close(intent, PaymentIntentStatus.FAILED,
                signal.getErrorMessage() != null ? signal.getErrorMessage() : "Payment failed");
            case EXPIRED -> close(intent, PaymentIntentStatus.EXPIRED, null);
        };
    }

    private PaymentIntent succeed(PaymentIntent intent) {
        if (intent.getStatus() == PaymentIntentStatus.SUCCEEDED) {
            log.info("Payment intent {} already succeeded with transfer {}",
                intent.getGatewayPaymentId(), intent.getLedgerTransferId());
            return intent;
        }

        // The intent row stays locked while the credit commits in its own unit of work,
        // so concurrent signals for one intent are applied one at a time.
        PaymentIntent succeeded = transactionTemplate.execute(status -> {
            PaymentIntentEntity entity = lockedEntity(intent.getGatewayPaymentId());
            PaymentIntent current = entity.toDomain();
            if (entity.isCredited()) {
                return current;
            }
            if (!current.canTransitionTo(PaymentIntentStatus.SUCCEEDED)) {
                throw new IllegalStateException(String.format(
                    "Success signal for payment intent %s in %s status",
                    current.getGatewayPaymentId(), current.getStatus()));
            }

            String description = "Deposit via "
                + (current.getPaymentMethod() != null ? current.getPaymentMethod() : "gateway");
            TransferOutcome outcome = transferEngine.credit(current.getAccountId(), current.getAmount(),
                current.getId().toString(), description);
            requireDepositFor(current, outcome.getTransfer());
            UUID transferId = outcome.getTransfer().getId();

            entity.updateFromDomain(current.succeed(transferId));
            entity.setLedgerTransferId(transferId);
            log.info("Payment intent {} succeeded: transferId={}, amount={}, replay={}",
                current.getGatewayPaymentId(), transferId, current.getAmount(), outcome.isReplay());
            return repository.saveAndFlush(entity).toDomain();
        });

        metrics.recordPaymentIntent(PaymentIntentStatus.SUCCEEDED.name());
        return succeeded;
    }

    private static void requireDepositFor(PaymentIntent intent, Transfer transfer) {
        boolean matches = transfer.getType() == TransferType.DEPOSIT
            && transfer.getStatus() == TransferStatus.COMPLETED
            && transfer.getToAccountId().equals(intent.getAccountId())
            && transfer.getAmount().compareTo(intent.getAmount()) == 0;
        if (!matches) {
            throw new IllegalStateException(String.format(
                "Credit for payment intent %s resolved to %s %s transfer %s of %s to %s",
                intent.getGatewayPaymentId(), transfer.getStatus(), transfer.getType(), transfer.getId(),
                transfer.getAmount(), transfer.getToAccountId()));
        }
    }

    private PaymentIntent close(PaymentIntent intent, PaymentIntentStatus target, String failureMessage) {
        if (intent.getStatus() == target) {
            log.info("Payment intent {} already {}", intent.getGatewayPaymentId(), target);
            return intent;
        }
        PaymentIntent result = transactionTemplate.execute(status -> {
            PaymentIntentEntity entity = lockedEntity(intent.getGatewayPaymentId());
            PaymentIntent current = entity.toDomain();
            if (current.getStatus() == target) {
                return current;
            }
            PaymentIntent next = target == PaymentIntentStatus.FAILED
                ? current.fail(failureMessage)
                : current.expire();
            entity.updateFromDomain(next);
            return repository.saveAndFlush(entity).toDomain();
        });
        metrics.recordPaymentIntent(result.getStatus().name());
        log.warn("Payment intent {} closed as {}: {}", intent.getGatewayPaymentId(), result.getStatus(),
            result.getFailureMessage());
        return result;
    }

    private PaymentIntentEntity lockedEntity(String gatewayPaymentId) {
        return repository.findByGatewayPaymentIdForUpdate(gatewayPaymentId)
            .orElseThrow(() -> new IllegalStateException("Payment intent disappeared: " + gatewayPaymentId));
    }
}
