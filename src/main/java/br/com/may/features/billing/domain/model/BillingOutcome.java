package br.com.may.features.billing.domain.model;

import java.util.Locale;

/**
 * Result of applying a gateway event or a confirmation to local state.
 */
public enum BillingOutcome {
    ACTIVATED,
    ALREADY_PROCESSED,
    SUBSCRIPTION_NOT_FOUND,
    MARKED_PAST_DUE,
    FAILURE_RECORDED,
    CANCELED,
    UPDATED,
    ACKNOWLEDGED,
    IGNORED,
    PENDING,
    REQUIRES_REVIEW;

    public String apiValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
