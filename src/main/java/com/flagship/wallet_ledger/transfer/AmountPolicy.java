package com.flagship.wallet_ledger.transfer;

import com.flagship.wallet_ledger.config.LedgerProperties;
import com.flagship.wallet_ledger.transfer.exception.TransferRejectedException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Validates amounts against the currency's precision and the configured limits.
 */
@Component
public class AmountPolicy {

    private final int minorUnits;
    private final BigDecimal minAmount;
    private final BigDecimal maxAmount;

    public AmountPolicy(LedgerProperties properties) {
        this.minorUnits = properties.getCurrency().getMinorUnits();
        this.minAmount = properties.getMinAmount();
        this.maxAmount = properties.getMaxAmount();
    }

    /**
     * @return the amount at the currency's scale
     * @throws TransferRejectedException with {@link FailureReason#INVALID_AMOUNT}
     */
    public BigDecimal normalize(BigDecimal amount) {
        if (amount == null) {
            throw invalid("Amount is required");
        }
        BigDecimal stripped = amount.stripTrailingZeros();
        if (stripped.signum() <= 0) {
            throw invalid("Amount must be positive");
        }
        if (stripped.scale() > minorUnits) {
            throw invalid("Amount must have at most " + minorUnits + " decimal places");
        }
        if (stripped.compareTo(minAmount) < 0) {
            throw invalid("Minimum amount is " + minAmount.toPlainString());
        }
        if (stripped.compareTo(maxAmount) > 0) {
            throw invalid("Maximum amount is " + maxAmount.toPlainString());
        }
        return stripped.setScale(minorUnits);
    }

    private static TransferRejectedException invalid(String message) {
        return new TransferRejectedException(FailureReason.INVALID_AMOUNT, message);
    }
}
