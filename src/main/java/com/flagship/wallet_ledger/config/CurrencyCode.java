package com.flagship.wallet_ledger.config;

/**
 * ISO-4217 currencies the ledger can be configured for.
 *
 * A deployment runs on exactly one of these (see {@link LedgerProperties#getCurrency()}).
 * The minor-unit count is the maximum number of fractional digits an amount may carry.
 */
public enum CurrencyCode {
    USD(2),
    EUR(2),
    GBP(2),
    INR(2),
    JPY(0);

    private final int minorUnits;

    CurrencyCode(int minorUnits) {
        this.minorUnits = minorUnits;
    }

    public int getMinorUnits() {
        return minorUnits;
    }
}
