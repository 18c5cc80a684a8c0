package com.flagship.wallet_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topics owned by the ledger: {@code wallet-events} carries post-commit notifications,
 * {@code gateway-signals} carries confirmed payment-gateway outcomes from the webhook ingester.
 */
@Configuration
public class KafkaConfig {

    @Bean
    public NewTopic walletEventsTopic(LedgerProperties properties) {
        return TopicBuilder.name(properties.getKafka().getWalletEventsTopic())
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic gatewaySignalsTopic(LedgerProperties properties) {
        return TopicBuilder.name(properties.getKafka().getGatewaySignalsTopic())
                .partitions(3)
                .replicas(1)
                .build();
    }
}
