package com.flagship.wallet_ledger.consumer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Runs an event handler at most once per (eventId, consumerGroup).
 *
 * The handler runs outside any transaction of this class and must itself be idempotent: the
 * processed record is written only after it returns, so a crash in between leads to one more
 * invocation on redelivery. When the handler throws, nothing is recorded and the exception
 * propagates so the broker redelivers.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotentEventProcessor {

    private final ProcessedEventRepository repository;

    /**
     * @return true if the handler ran, false if the event had already been processed
     */
    public boolean processEvent(UUID eventId, String eventType, String consumerGroup, Runnable handler) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            log.info("Event {} already processed by consumer group {}, skipping", eventId, consumerGroup);
            return false;
        }

        handler.run();

        if (!record(ProcessedEvent.success(eventId, eventType, consumerGroup))) {
            log.info("Event {} was processed concurrently by another member of {}", eventId, consumerGroup);
            return false;
        }
        log.debug("Processed event {} by consumer group {}", eventId, consumerGroup);
        return true;
    }

    /**
     * Records an event that will never succeed, so redeliveries stop at the deduplication check.
     */
    public void recordFailure(UUID eventId, String eventType, String consumerGroup, String errorMessage) {
        if (record(ProcessedEvent.failed(eventId, eventType, consumerGroup, errorMessage))) {
            log.warn("Event {} permanently failed for consumer group {}: {}", eventId, consumerGroup, errorMessage);
        }
    }

    public boolean isAlreadyProcessed(UUID eventId, String consumerGroup) {
        return repository.existsByEventIdAndConsumerGroup(eventId, consumerGroup);
    }

    private boolean record(ProcessedEvent event) {
        try {
            repository.saveAndFlush(ProcessedEventEntity.fromDomain(event));
            return true;
        } catch (DataIntegrityViolationException e) {
            // unique (event_id, consumer_group)
            return false;
        }
    }
}
