package com.flagship.wallet_ledger.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Explicit configuration for the transfer engine and its collaborators.
 *
 * Bound from the {@code ledger.*} keys and handed to the engine through its constructor,
 * so nothing in the money path reads ambient settings.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {

    /**
     * The single supported currency. Every wallet and transfer carries it.
     */
    private CurrencyCode currency = CurrencyCode.USD;

    private BigDecimal minAmount = new BigDecimal("0.01");

    private BigDecimal maxAmount = new BigDecimal("1000000.00");

    /**
     * How long a unit of work waits for a wallet row lock before giving up with a concurrency conflict.
     */
    private Duration lockTimeout = Duration.ofSeconds(5);

    /**
     * Upper bound for a whole unit of work, lock waits included.
     */
    private Duration unitOfWorkTimeout = Duration.ofSeconds(15);

    private Verification verification = new Verification();

    private Idempotency idempotency = new Idempotency();

    private History history = new History();

    private Kafka kafka = new Kafka();

    @Getter
    @Setter
    public static class Verification {
        /**
         * When false, any active account may transact regardless of its verification status.
         */
        private boolean required = true;

        /**
         * Also require the recipient to be verified (only consulted when {@link #required} is true).
         */
        private boolean recipientRequired = true;
    }

    @Getter
    @Setter
    public static class Idempotency {
        private boolean cacheEnabled = true;
        private Duration cacheTtl = Duration.ofDays(7);
    }

    @Getter
    @Setter
    public static class History {
        private int defaultPageSize = 20;
        private int maxPageSize = 100;
    }

    @Getter
    @Setter
    public static class Kafka {
        private String walletEventsTopic = "wallet-events";
        private String gatewaySignalsTopic = "gateway-signals";
    }
}
