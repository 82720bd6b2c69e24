package br.com.may.features.billing.application;

import java.util.List;
import java.util.UUID;

/**
 * Charges subscriptions that this system rebills itself (Pagar.me order model). Stripe rebills on its
 * own schedule and reports renewals through webhooks.
 */
public interface RecurringBillingService {

    RecurringBillingSummary runDueCharges();

    record RecurringBillingSummary(int total, int successful, int failed, List<ChargeResult> results) {
    }

    record ChargeResult(UUID subscriptionId, UUID userId, String outcome, String error) {
    }
}
