package com.flagship.wallet_ledger.transfer;

import lombok.Value;

import java.util.List;

/**
 * A newest-first page of history. {@code nextCursor} is null on the last page.
 */
@Value
public class HistoryPage {
    List<HistoryItem> items;
    String nextCursor;
}
