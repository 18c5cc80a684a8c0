package com.flagship.wallet_ledger.payment;

import com.flagship.wallet_ledger.payment.dto.CreatePaymentIntentRequest;
import com.flagship.wallet_ledger.payment.dto.MarkPendingRequest;
import com.flagship.wallet_ledger.payment.dto.PaymentIntentResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Payment intents are created here and then settled by gateway signals, never by clients.
 */
@RestController
@RequestMapping("/api/payment-intents")
@RequiredArgsConstructor
@Slf4j
public class PaymentIntentController {

    private final PaymentIntentService paymentIntentService;

    @PostMapping
    public ResponseEntity<PaymentIntentResponse> createPaymentIntent(
            @Valid @RequestBody CreatePaymentIntentRequest request) {
        log.info("Received payment intent request: accountId={}, amount={}",
            request.getAccountId(), request.getAmount());

        PaymentIntent intent = paymentIntentService.create(
            request.getAccountId(), request.getAmount(), request.getDescription());

        return ResponseEntity.status(HttpStatus.CREATED).body(PaymentIntentResponse.from(intent));
    }

    @GetMapping("/{id}")
    public ResponseEntity<PaymentIntentResponse> getPaymentIntent(@PathVariable("id") UUID id) {
        return paymentIntentService.findById(id)
            .map(intent -> ResponseEntity.ok(PaymentIntentResponse.from(intent)))
            .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/{gatewayPaymentId}/pending")
    public ResponseEntity<PaymentIntentResponse> markPending(
            @PathVariable("gatewayPaymentId") String gatewayPaymentId,
            @Valid @RequestBody MarkPendingRequest request) {
        PaymentIntent intent = paymentIntentService.markPending(gatewayPaymentId, request.getPaymentMethod());
        return ResponseEntity.ok(PaymentIntentResponse.from(intent));
    }
}
