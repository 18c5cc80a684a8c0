package com.flagship.wallet_ledger.transfer;

import com.flagship.wallet_ledger.config.CurrencyCode;
import com.flagship.wallet_ledger.config.JacksonConfig;
import com.flagship.wallet_ledger.transfer.exception.ConcurrencyConflictException;
import com.flagship.wallet_ledger.transfer.exception.GlobalExceptionHandler;
import com.flagship.wallet_ledger.transfer.exception.TransferRejectedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.math.BigDecimal;
import java.sql.SQLException;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * HTTP mapping of transfer outcomes and engine failures, with the engine mocked out.
 */
class TransferControllerTest {

    private static final String BODY = """
        {"recipient": "bob@example.com", "amount": 25.00, "description": "dinner"}
        """;

    private final TransferEngine engine = mock(TransferEngine.class);
    private final TransferQueryService queryService = mock(TransferQueryService.class);

    private MockMvc mockMvc;
    private UUID alice;
    private UUID bob;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new TransferController(engine, queryService))
            .setControllerAdvice(new GlobalExceptionHandler())
            .setMessageConverters(new MappingJackson2HttpMessageConverter(new JacksonConfig().objectMapper()))
            .build();
        alice = UUID.randomUUID();
        bob = UUID.randomUUID();
    }

    private Transfer pendingTransfer() {
        return Transfer.initiate(UUID.randomUUID(), "key-1", alice, bob,
            new BigDecimal("25.00"), CurrencyCode.USD, "dinner");
    }

    @Test
    @DisplayName("A new completed transfer is 201 and carries the sender's new balance")
    void testCreate_Completed() throws Exception {
        Transfer completed = pendingTransfer().complete(new BigDecimal("100.00"), new BigDecimal("75.00"),
            BigDecimal.ZERO.setScale(2), new BigDecimal("25.00"));
        when(engine.transfer(any())).thenReturn(TransferOutcome.completed(completed));

        mockMvc.perform(post("/api/transfers")
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Account-Id", alice.toString())
                .header("Idempotency-Key", "key-1")
                .content(BODY))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.outcome").value("COMPLETED"))
            .andExpect(jsonPath("$.status").value("COMPLETED"))
            .andExpect(jsonPath("$.from_balance_after").value(75.00));

        ArgumentCaptor<TransferCommand> command = ArgumentCaptor.forClass(TransferCommand.class);
        verify(engine).transfer(command.capture());
        assertEquals(alice, command.getValue().getInitiatorAccountId());
        assertEquals("bob@example.com", command.getValue().getRecipientIdentifier());
        assertEquals("key-1", command.getValue().getIdempotencyKey());
    }

    @Test
    @DisplayName("A replay of a completed transfer is 200 with the original transfer")
    void testCreate_Replay() throws Exception {
        Transfer completed = pendingTransfer().complete(new BigDecimal("100.00"), new BigDecimal("75.00"),
            BigDecimal.ZERO.setScale(2), new BigDecimal("25.00"));
        when(engine.transfer(any())).thenReturn(TransferOutcome.alreadyProcessed(completed));

        mockMvc.perform(post("/api/transfers")
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Account-Id", alice.toString())
                .header("Idempotency-Key", "key-1")
                .content(BODY))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.outcome").value("ALREADY_PROCESSED"))
            .andExpect(jsonPath("$.id").value(completed.getId().toString()));
    }

    @Test
    @DisplayName("Insufficient funds is 422 with the failure reason")
    void testCreate_InsufficientFunds() throws Exception {
        Transfer failed = pendingTransfer().fail(FailureReason.INSUFFICIENT_FUNDS,
            "Insufficient balance", new BigDecimal("10.00"));
        when(engine.transfer(any())).thenReturn(TransferOutcome.failed(failed));

        mockMvc.perform(post("/api/transfers")
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Account-Id", alice.toString())
                .header("Idempotency-Key", "key-2")
                .content(BODY))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.status").value("FAILED"))
            .andExpect(jsonPath("$.failure_reason").value("INSUFFICIENT_FUNDS"));
    }

    @Test
    @DisplayName("Engine rejections map to their status and reason name")
    void testCreate_Rejections() throws Exception {
        when(engine.transfer(any()))
            .thenThrow(new TransferRejectedException(FailureReason.RECIPIENT_NOT_FOUND, "No such recipient"))
            .thenThrow(new TransferRejectedException(FailureReason.VERIFICATION_REQUIRED, "Not verified"))
            .thenThrow(new TransferRejectedException(FailureReason.MISSING_IDEMPOTENCY_KEY, "Key required"));

        mockMvc.perform(post("/api/transfers")
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Account-Id", alice.toString())
                .header("Idempotency-Key", "key-3")
                .content(BODY))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("RECIPIENT_NOT_FOUND"));

        mockMvc.perform(post("/api/transfers")
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Account-Id", alice.toString())
                .header("Idempotency-Key", "key-4")
                .content(BODY))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.error").value("VERIFICATION_REQUIRED"));

        mockMvc.perform(post("/api/transfers")
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Account-Id", alice.toString())
                .content(BODY))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("MISSING_IDEMPOTENCY_KEY"));
    }

    @Test
    @DisplayName("A lost lock race is 409 and marked retryable")
    void testCreate_ConcurrencyConflict() throws Exception {
        when(engine.transfer(any())).thenThrow(new ConcurrencyConflictException("Wallet lock timed out",
            new SQLException("canceling statement due to lock timeout", "55P03")));

        mockMvc.perform(post("/api/transfers")
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Account-Id", alice.toString())
                .header("Idempotency-Key", "key-5")
                .content(BODY))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("CONCURRENCY_CONFLICT"))
            .andExpect(jsonPath("$.details.retryable").value("true"));
    }

    @Test
    @DisplayName("A request without the initiator header never reaches the engine")
    void testCreate_MissingInitiator() throws Exception {
        mockMvc.perform(post("/api/transfers")
                .contentType(MediaType.APPLICATION_JSON)
                .header("Idempotency-Key", "key-6")
                .content(BODY))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Missing Required Header"));

        verify(engine, never()).transfer(any());
    }

    @Test
    @DisplayName("Body validation failures are 400 with field details")
    void testCreate_InvalidBody() throws Exception {
        mockMvc.perform(post("/api/transfers")
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Account-Id", alice.toString())
                .header("Idempotency-Key", "key-7")
                .content("{\"amount\": 5.00}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.details.recipient").exists());

        verify(engine, never()).transfer(any());
    }

    @Test
    @DisplayName("Unknown transfers and their ledger entries are 404")
    void testGet_NotFound() throws Exception {
        UUID id = UUID.randomUUID();
        when(queryService.findTransfer(id)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/transfers/{id}", id)).andExpect(status().isNotFound());
        mockMvc.perform(get("/api/transfers/{id}/ledger", id)).andExpect(status().isNotFound());
    }
}
