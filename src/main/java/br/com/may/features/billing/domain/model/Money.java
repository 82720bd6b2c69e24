package br.com.may.features.billing.domain.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Conversions between gateway minor units (centavos) and the major-unit decimals stored in the ledger.
 */
public final class Money {

    private static final int SCALE = 2;

    private Money() {
    }

    public static BigDecimal fromCents(long cents) {
        return BigDecimal.valueOf(cents, SCALE);
    }

    /**
     * @throws ArithmeticException if the amount has more than two decimal places
     */
    public static long toCents(BigDecimal amount) {
        return amount.setScale(SCALE, RoundingMode.UNNECESSARY).unscaledValue().longValueExact();
    }
}
