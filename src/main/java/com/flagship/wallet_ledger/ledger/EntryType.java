package com.flagship.wallet_ledger.ledger;

/**
 * Side of a ledger entry. A wallet debit lowers its balance, a credit raises it.
 */
public enum EntryType {
    DEBIT,
    CREDIT
}
