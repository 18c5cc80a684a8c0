package com.flagship.wallet_ledger.payment;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.UUID;

/**
 * A verified gateway event about one payment intent. {@code eventId} is unique per delivery
 * attempt of the gateway's event, so replays carry the same id.
 */
@Value
@Builder
@Jacksonized
public class GatewaySignal {
    UUID eventId;
    String gatewayPaymentId;
    GatewaySignalType type;
    String errorMessage;
}
