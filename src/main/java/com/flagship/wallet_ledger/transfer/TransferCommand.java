package com.flagship.wallet_ledger.transfer;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A wallet-to-wallet transfer request as the engine receives it.
 * The recipient is either an account id or an email address.
 */
@Value
public class TransferCommand {
    UUID initiatorAccountId;
    String recipientIdentifier;
    BigDecimal amount;
    String description;
    String idempotencyKey;
}
