package com.flagship.wallet_ledger.consumer;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One event handled by one consumer group. At most one exists per (eventId, consumerGroup).
 */
@Value
public class ProcessedEvent {
    UUID eventId;
    String eventType;
    String consumerGroup;
    Instant processedAt;
    ProcessingResult result;
    String errorMessage;

    public enum ProcessingResult {
        SUCCESS,
        // permanent; the event is not retried
        FAILED
    }

    public static ProcessedEvent success(UUID eventId, String eventType, String consumerGroup) {
        return new ProcessedEvent(eventId, eventType, consumerGroup, Instant.now(), ProcessingResult.SUCCESS, null);
    }

    public static ProcessedEvent failed(UUID eventId, String eventType, String consumerGroup, String errorMessage) {
        return new ProcessedEvent(eventId, eventType, consumerGroup, Instant.now(), ProcessingResult.FAILED, errorMessage);
    }
}
