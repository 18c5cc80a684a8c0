package com.flagship.wallet_ledger.transfer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;

class HistoryCursorTest {

    @Test
    @DisplayName("A cursor decodes to the sequence number it was built from")
    void testDecode() {
        String cursor = HistoryCursor.encode(4217L);

        assertFalse(cursor.contains("4217"), "cursor should be opaque");
        assertEquals(4217L, HistoryCursor.decode(cursor));
    }

    @Test
    @DisplayName("Garbage cursors are rejected as bad input")
    void testDecode_Invalid() {
        String foreign = Base64.getUrlEncoder().encodeToString("offset:10".getBytes(StandardCharsets.UTF_8));
        String notNumeric = Base64.getUrlEncoder().encodeToString("seq:abc".getBytes(StandardCharsets.UTF_8));

        assertThrows(IllegalArgumentException.class, () -> HistoryCursor.decode("%%%"));
        assertThrows(IllegalArgumentException.class, () -> HistoryCursor.decode(foreign));
        assertThrows(IllegalArgumentException.class, () -> HistoryCursor.decode(notNumeric));
    }
}
