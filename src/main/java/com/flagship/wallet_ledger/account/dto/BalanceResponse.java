package com.flagship.wallet_ledger.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class BalanceResponse {

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("currency")
    String currency;
}
