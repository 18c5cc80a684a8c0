package com.flagship.wallet_ledger.idempotency;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

import com.flagship.wallet_ledger.transfer.TransferType;

import java.io.Serializable;
import java.util.UUID;

@Getter
@EqualsAndHashCode
@NoArgsConstructor
@AllArgsConstructor
public class IdempotencyRecordId implements Serializable {
    private TransferType scope;
    private String idempotencyKey;
    private UUID accountId;
}
