package com.flagship.wallet_ledger.transfer;

import com.flagship.wallet_ledger.transfer.dto.CreateTransferRequest;
import com.flagship.wallet_ledger.transfer.dto.LedgerEntryResponse;
import com.flagship.wallet_ledger.transfer.dto.TransferResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST surface of the transfer engine.
 *
 * 201 for a new completed transfer, 200 for an idempotent replay of a completed one, and
 * 422 whenever the (new or replayed) transfer failed for insufficient funds.
 */
@RestController
@RequestMapping("/api/transfers")
@RequiredArgsConstructor
@Slf4j
public class TransferController {

    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";
    static final String ACCOUNT_ID_HEADER = "X-Account-Id";

    private final TransferEngine transferEngine;
    private final TransferQueryService queryService;

    @PostMapping
    public ResponseEntity<TransferResponse> createTransfer(
            @Valid @RequestBody CreateTransferRequest request,
            @RequestHeader(ACCOUNT_ID_HEADER) UUID initiatorAccountId,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        log.info("Received transfer request: idempotencyKey={}, amount={}", idempotencyKey, request.getAmount());

        TransferOutcome outcome = transferEngine.transfer(new TransferCommand(
            initiatorAccountId,
            request.getRecipient(),
            request.getAmount(),
            request.getDescription(),
            idempotencyKey
        ));

        HttpStatus status;
        if (!outcome.isSuccessful()) {
            status = HttpStatus.UNPROCESSABLE_ENTITY;
        } else if (outcome.isReplay()) {
            status = HttpStatus.OK;
        } else {
            status = HttpStatus.CREATED;
        }
        return ResponseEntity.status(status).body(TransferResponse.from(outcome));
    }

    @GetMapping("/{id}")
    public ResponseEntity<TransferResponse> getTransfer(@PathVariable("id") UUID id) {
        return queryService.findTransfer(id)
            .map(transfer -> ResponseEntity.ok(TransferResponse.from(transfer, kindOf(transfer))))
            .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/{id}/ledger")
    public ResponseEntity<List<LedgerEntryResponse>> getLedgerEntries(@PathVariable("id") UUID id) {
        if (queryService.findTransfer(id).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(queryService.ledgerEntries(id).stream()
            .map(LedgerEntryResponse::from)
            .toList());
    }

    private static TransferOutcome.Kind kindOf(Transfer transfer) {
        return transfer.getStatus() == TransferStatus.COMPLETED
            ? TransferOutcome.Kind.COMPLETED
            : TransferOutcome.Kind.FAILED;
    }
}
