package com.flagship.wallet_ledger.consumer;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface ProcessedEventRepository extends JpaRepository<ProcessedEventEntity, UUID> {

    /**
     * Primary deduplication check.
     */
    boolean existsByEventIdAndConsumerGroup(UUID eventId, String consumerGroup);

    Optional<ProcessedEventEntity> findByEventIdAndConsumerGroup(UUID eventId, String consumerGroup);

    @Query("""
        SELECT COUNT(e) FROM ProcessedEventEntity e
        WHERE e.consumerGroup = :consumerGroup
        AND e.processingResult = com.flagship.wallet_ledger.consumer.ProcessedEvent.ProcessingResult.FAILED
        """)
    long countFailedByConsumerGroup(@Param("consumerGroup") String consumerGroup);
}
