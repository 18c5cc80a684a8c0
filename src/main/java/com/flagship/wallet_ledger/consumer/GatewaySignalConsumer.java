package com.flagship.wallet_ledger.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.wallet_ledger.payment.GatewaySignal;
import com.flagship.wallet_ledger.payment.PaymentIntentReconciler;
import com.flagship.wallet_ledger.transfer.exception.LedgerException;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

/**
 * Consumes verified gateway signals and hands them to the {@link PaymentIntentReconciler}.
 *
 * Offsets are acknowledged only once a signal is either applied or recorded as permanently
 * failed. Transient errors, such as a lock conflict while crediting, propagate and the record
 * is redelivered.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class GatewaySignalConsumer {

    static final String EVENT_TYPE = "GatewaySignal";

    private final IdempotentEventProcessor eventProcessor;
    private final PaymentIntentReconciler reconciler;
    private final ObjectMapper objectMapper;
    private final String consumerGroup;

    public GatewaySignalConsumer(IdempotentEventProcessor eventProcessor,
                                 PaymentIntentReconciler reconciler,
                                 ObjectMapper objectMapper,
                                 @Value("${spring.kafka.consumer.group-id:wallet-ledger-reconciler}") String consumerGroup) {
        this.eventProcessor = eventProcessor;
        this.reconciler = reconciler;
        this.objectMapper = objectMapper;
        this.consumerGroup = consumerGroup;
    }

    @KafkaListener(
        topics = "${ledger.kafka.gateway-signals-topic:gateway-signals}",
        groupId = "${spring.kafka.consumer.group-id:wallet-ledger-reconciler}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received gateway signal: partition={}, offset={}, key={}",
            record.partition(), record.offset(), record.key());

        GatewaySignal signal = parse(record.value());
        if (signal == null) {
            log.warn("Unreadable gateway signal at offset {}, acknowledging to skip", record.offset());
            ack.acknowledge();
            return;
        }

        String eventType = EVENT_TYPE + "." + signal.getType();
        try {
            boolean processed = eventProcessor.processEvent(signal.getEventId(), eventType, consumerGroup,
                () -> reconciler.apply(signal));
            if (processed) {
                log.info("Applied gateway signal: eventId={}, gatewayPaymentId={}, type={}",
                    signal.getEventId(), signal.getGatewayPaymentId(), signal.getType());
            }
        } catch (IllegalArgumentException | IllegalStateException e) {
            // unknown intent or a signal contradicting a terminal status
            eventProcessor.recordFailure(signal.getEventId(), eventType, consumerGroup, e.getMessage());
        } catch (LedgerException e) {
            if (e.isRetryable()) {
                log.warn("Retryable failure applying gateway signal {}: {}", signal.getEventId(), e.getMessage());
                throw e;
            }
            eventProcessor.recordFailure(signal.getEventId(), eventType, consumerGroup,
                e.getReason() + ": " + e.getMessage());
        }
        ack.acknowledge();
    }

    GatewaySignal parse(String json) {
        try {
            GatewaySignal signal = objectMapper.readValue(json, GatewaySignal.class);
            if (signal.getEventId() == null || signal.getGatewayPaymentId() == null || signal.getType() == null) {
                log.error("Gateway signal is missing eventId, gatewayPaymentId or type: {}", json);
                return null;
            }
            return signal;
        } catch (JsonProcessingException e) {
            log.error("Failed to parse gateway signal: {}", e.getMessage());
            return null;
        }
    }
}
