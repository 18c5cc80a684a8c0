package com.flagship.wallet_ledger.account;

import com.flagship.wallet_ledger.account.dto.AccountResponse;
import com.flagship.wallet_ledger.account.dto.BalanceResponse;
import com.flagship.wallet_ledger.account.dto.ProvisionAccountRequest;
import com.flagship.wallet_ledger.account.dto.UpdateVerificationRequest;
import com.flagship.wallet_ledger.config.LedgerProperties;
import com.flagship.wallet_ledger.ledger.BalanceAudit;
import com.flagship.wallet_ledger.ledger.BalanceAuditService;
import com.flagship.wallet_ledger.transfer.HistoryPage;
import com.flagship.wallet_ledger.transfer.TransferQueryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.UUID;

@RestController
@RequestMapping("/api/accounts")
@RequiredArgsConstructor
@Slf4j
public class AccountController {

    private final AccountService accountService;
    private final TransferQueryService queryService;
    private final BalanceAuditService auditService;
    private final LedgerProperties properties;

    @PostMapping
    public ResponseEntity<AccountResponse> provision(@Valid @RequestBody ProvisionAccountRequest request) {
        Account account = accountService.provision(request.getEmail(), request.getDisplayName());
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(AccountResponse.from(account, BigDecimal.ZERO.setScale(properties.getCurrency().getMinorUnits())));
    }

    @PutMapping("/{id}/verification")
    public AccountResponse updateVerification(@PathVariable("id") UUID id,
                                              @Valid @RequestBody UpdateVerificationRequest request) {
        accountService.updateVerificationStatus(id, request.getVerificationStatus());
        return current(id);
    }

    /**
     * Closes the account to new transfers. Balance and history stay readable, and retries of
     * transfers it already made still replay.
     */
    @PostMapping("/{id}/deactivate")
    public AccountResponse deactivate(@PathVariable("id") UUID id) {
        accountService.deactivate(id);
        log.info("Account {} deactivated", id);
        return current(id);
    }

    @GetMapping("/{id}/balance")
    public BalanceResponse balance(@PathVariable("id") UUID id) {
        return new BalanceResponse(id, queryService.getBalance(id), properties.getCurrency().name());
    }

    @GetMapping("/{id}/history")
    public HistoryPage history(@PathVariable("id") UUID id,
                               @RequestParam(value = "cursor", required = false) String cursor,
                               @RequestParam(value = "limit", required = false) Integer limit) {
        return queryService.getHistory(id, cursor, limit);
    }

    @GetMapping("/{id}/audit")
    public BalanceAudit audit(@PathVariable("id") UUID id) {
        return auditService.audit(id);
    }

    private AccountResponse current(UUID id) {
        Account account = accountService.findById(id)
            .orElseThrow(() -> new IllegalArgumentException("Account not found: " + id));
        return AccountResponse.from(account, queryService.getBalance(id));
    }
}
