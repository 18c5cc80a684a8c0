package com.flagship.wallet_ledger.payment;

import com.flagship.wallet_ledger.config.LedgerProperties;
import com.flagship.wallet_ledger.transfer.AmountPolicy;
import com.flagship.wallet_ledger.transfer.FailureReason;
import com.flagship.wallet_ledger.transfer.exception.TransferRejectedException;
import com.flagship.wallet_ledger.wallet.WalletStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Lifecycle of payment intents up to the point where the gateway reports an outcome.
 * Outcomes are applied by {@link PaymentIntentReconciler}.
 */
@Service
@Slf4j
public class PaymentIntentService {

    private static final String GATEWAY_ID_PREFIX = "PAY-";

    private final PaymentIntentRepository repository;
    private final WalletStore walletStore;
    private final AmountPolicy amountPolicy;
    private final LedgerProperties properties;
    private final SecureRandom random = new SecureRandom();

    public PaymentIntentService(PaymentIntentRepository repository,
                                WalletStore walletStore,
                                AmountPolicy amountPolicy,
                                LedgerProperties properties) {
        this.repository = repository;
        this.walletStore = walletStore;
        this.amountPolicy = amountPolicy;
        this.properties = properties;
    }

    @Transactional
    public PaymentIntent create(UUID accountId, BigDecimal amount, String description) {
        BigDecimal normalized = amountPolicy.normalize(amount);
        if (walletStore.findWalletIdByAccount(accountId).isEmpty()) {
            throw new TransferRejectedException(FailureReason.RECIPIENT_NOT_FOUND, "Account not found: " + accountId);
        }
        PaymentIntent intent = PaymentIntent.create(UUID.randomUUID(), newGatewayPaymentId(), accountId,
            normalized, properties.getCurrency(), description);
        PaymentIntent saved = repository.saveAndFlush(PaymentIntentEntity.fromDomain(intent)).toDomain();
        log.info("Payment intent created: gatewayPaymentId={}, accountId={}, amount={}",
            saved.getGatewayPaymentId(), accountId, normalized);
        return saved;
    }

    @Transactional
    public PaymentIntent markPending(String gatewayPaymentId, PaymentMethod method) {
        PaymentIntentEntity entity = repository.findByGatewayPaymentIdForUpdate(gatewayPaymentId)
            .orElseThrow(() -> new IllegalArgumentException("Payment intent not found: " + gatewayPaymentId));
        PaymentIntent pending = entity.toDomain().markPending(method);
        entity.updateFromDomain(pending);
        return repository.saveAndFlush(entity).toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<PaymentIntent> findById(UUID id) {
        return repository.findById(id).map(PaymentIntentEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<PaymentIntent> findByGatewayPaymentId(String gatewayPaymentId) {
        return repository.findByGatewayPaymentId(gatewayPaymentId).map(PaymentIntentEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<PaymentIntent> findByAccount(UUID accountId) {
        return repository.findByAccountIdOrderByCreatedAtDesc(accountId).stream()
            .map(PaymentIntentEntity::toDomain)
            .toList();
    }

    private String newGatewayPaymentId() {
        byte[] bytes = new byte[8];
        random.nextBytes(bytes);
        return GATEWAY_ID_PREFIX + HexFormat.of().withUpperCase().formatHex(bytes);
    }
}
