package com.flagship.wallet_ledger.payment;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PaymentIntentRepository extends JpaRepository<PaymentIntentEntity, UUID> {

    Optional<PaymentIntentEntity> findByGatewayPaymentId(String gatewayPaymentId);

    /**
     * Row-locks the intent so concurrent signals for it apply one after another.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM PaymentIntentEntity p WHERE p.gatewayPaymentId = :gatewayPaymentId")
    Optional<PaymentIntentEntity> findByGatewayPaymentIdForUpdate(@Param("gatewayPaymentId") String gatewayPaymentId);

    List<PaymentIntentEntity> findByAccountIdOrderByCreatedAtDesc(UUID accountId);
}
