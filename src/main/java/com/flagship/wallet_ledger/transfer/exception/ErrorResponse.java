package com.flagship.wallet_ledger.transfer.exception;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class ErrorResponse {
    String error;
    String message;
    Map<String, String> details;
    Instant timestamp;
}
