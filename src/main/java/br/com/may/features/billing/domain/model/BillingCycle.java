package br.com.may.features.billing.domain.model;

import java.time.LocalDateTime;
import java.util.Locale;

public enum BillingCycle {
    MONTHLY(1),
    SEMIANNUAL(6),
    ANNUAL(12),
    /** Charged per issued invoice; never rebilled on a calendar. */
    PER_INVOICE(0);

    private final int months;

    BillingCycle(int months) {
        this.months = months;
    }

    public int getMonths() {
        return months;
    }

    public boolean isRecurring() {
        return months > 0;
    }

    /**
     * Next billing date for a period starting at {@code from}. Per-invoice cycles fall back to one month.
     */
    public LocalDateTime advance(LocalDateTime from) {
        return from.plusMonths(isRecurring() ? months : 1);
    }

    /**
     * Parse the API value of a billing cycle. Accepts the Portuguese aliases the web app sends.
     *
     * @throws IllegalArgumentException if the value is unknown
     */
    public static BillingCycle fromValue(String value) {
        if (value == null || value.isBlank()) {
            return MONTHLY;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "monthly", "mensal" -> MONTHLY;
            case "semiannual", "semestral" -> SEMIANNUAL;
            case "annual", "yearly", "anual" -> ANNUAL;
            case "per_invoice", "per-invoice" -> PER_INVOICE;
            default -> throw new IllegalArgumentException("Unknown billing cycle: " + value);
        };
    }

    public String apiValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
