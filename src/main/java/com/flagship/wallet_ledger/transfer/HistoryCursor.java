package com.flagship.wallet_ledger.transfer;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Opaque history cursor. It wraps the sequence number of the last item returned, so a
 * page boundary stays stable while new transfers are appended.
 */
public final class HistoryCursor {

    private static final String PREFIX = "seq:";

    private HistoryCursor() {
    }

    public static String encode(long sequenceNumber) {
        return Base64.getUrlEncoder().withoutPadding()
            .encodeToString((PREFIX + sequenceNumber).getBytes(StandardCharsets.UTF_8));
    }

    /**
     * @throws IllegalArgumentException if the cursor was not produced by {@link #encode}
     */
    public static long decode(String cursor) {
        try {
            String decoded = new String(Base64.getUrlDecoder().decode(cursor), StandardCharsets.UTF_8);
            if (!decoded.startsWith(PREFIX)) {
                throw new IllegalArgumentException("Invalid history cursor");
            }
            return Long.parseLong(decoded.substring(PREFIX.length()));
        } catch (IllegalArgumentException e) {
            // NumberFormatException and bad Base64 both land here
            throw new IllegalArgumentException("Invalid history cursor", e);
        }
    }
}
