package com.flagship.wallet_ledger.transfer;

import com.flagship.wallet_ledger.support.AbstractIntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Cursor-paginated history as seen by senders and recipients.
 */
class TransferHistoryTest extends AbstractIntegrationTest {

    private UUID alice;
    private UUID bob;
    private UUID dave;

    @BeforeEach
    void setUp() {
        alice = verifiedAccount("alice");
        bob = verifiedAccount("bob");
        dave = verifiedAccount("dave");
    }

    private TransferOutcome send(UUID from, UUID to, String amount) {
        return transferEngine.transfer(new TransferCommand(from, to.toString(), new BigDecimal(amount),
            "history", "h-" + UUID.randomUUID()));
    }

    @Test
    @DisplayName("Pages are newest first, disjoint, and end with a null cursor")
    void testPagination() {
        printTestHeader("History pagination");
        fund(alice, "100.00");
        List<UUID> sent = new ArrayList<>();
        for (int i = 1; i <= 6; i++) {
            sent.add(send(alice, bob, i + ".00").getTransfer().getId());
        }

        List<HistoryItem> all = new ArrayList<>();
        String cursor = null;
        int pages = 0;
        do {
            HistoryPage page = queryService.getHistory(alice, cursor, 3);
            all.addAll(page.getItems());
            cursor = page.getNextCursor();
            pages++;
        } while (cursor != null);
        printOutput("Pages", pages);

        // six transfers plus the funding deposit
        assertEquals(7, all.size());
        assertEquals(3, pages);
        assertEquals(7, new HashSet<>(all.stream().map(HistoryItem::getTransferId).toList()).size());
        assertEquals(sent.get(5), all.get(0).getTransferId());
        assertEquals(TransferType.DEPOSIT, all.get(6).getType());
        assertEquals(HistoryItem.Direction.RECEIVED, all.get(6).getDirection());
        printSuccess("Walked all pages without gaps or duplicates");
    }

    @Test
    @DisplayName("New transfers do not shift a page boundary that was already handed out")
    void testCursorStableUnderAppends() {
        fund(alice, "100.00");
        for (int i = 0; i < 4; i++) {
            send(alice, bob, "1.00");
        }
        HistoryPage first = queryService.getHistory(alice, null, 2);

        send(alice, bob, "1.00");
        send(alice, bob, "1.00");
        HistoryPage second = queryService.getHistory(alice, first.getNextCursor(), 2);

        assertTrue(second.getItems().stream()
            .noneMatch(item -> first.getItems().stream()
                .anyMatch(seen -> seen.getTransferId().equals(item.getTransferId()))));
    }

    @Test
    @DisplayName("Senders see their failed transfers; recipients see only completed ones")
    void testVisibility() {
        fund(alice, "10.00");
        TransferOutcome completed = send(alice, bob, "4.00");
        TransferOutcome failed = send(alice, dave, "500.00");

        List<HistoryItem> aliceHistory = queryService.getHistory(alice, null, 10).getItems();
        List<HistoryItem> bobHistory = queryService.getHistory(bob, null, 10).getItems();
        List<HistoryItem> daveHistory = queryService.getHistory(dave, null, 10).getItems();

        assertTrue(aliceHistory.stream().anyMatch(i -> i.getTransferId().equals(failed.getTransfer().getId())
            && i.getStatus() == TransferStatus.FAILED));
        assertTrue(daveHistory.isEmpty());

        assertEquals(1, bobHistory.size());
        HistoryItem received = bobHistory.get(0);
        assertEquals(completed.getTransfer().getId(), received.getTransferId());
        assertEquals(HistoryItem.Direction.RECEIVED, received.getDirection());
        assertEquals(alice.toString(), received.getCounterparty());
        assertMoney("4.00", received.getBalanceAfter());
    }

    @Test
    @DisplayName("Page size is clamped and bad cursors are rejected")
    void testLimitsAndBadCursor() {
        fund(alice, "10.00");
        send(alice, bob, "1.00");

        assertEquals(1, queryService.getHistory(alice, null, 0).getItems().size());
        assertEquals(2, queryService.getHistory(alice, null, 10_000).getItems().size());
        assertThrows(IllegalArgumentException.class, () -> queryService.getHistory(alice, "not-a-cursor", 5));
    }
}
