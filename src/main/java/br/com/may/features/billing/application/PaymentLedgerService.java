package br.com.may.features.billing.application;

import br.com.may.features.billing.domain.event.GatewayEvent;
import br.com.may.features.billing.domain.model.BillingOutcome;

import java.util.UUID;

/**
 * Records payments exactly once per provider transaction or invoice id and applies their effect on
 * the subscription. Webhooks, reconciliation and recurring billing all go through here.
 */
public interface PaymentLedgerService {

    /**
     * Activate (or renew) the subscription and record the payment as paid, atomically with the
     * confirmation notification.
     *
     * @return {@link BillingOutcome#ACTIVATED}, {@link BillingOutcome#ALREADY_PROCESSED} for a replay,
     * {@link BillingOutcome#SUBSCRIPTION_NOT_FOUND}, or {@link BillingOutcome#REQUIRES_REVIEW} when
     * money arrived for a subscription that can no longer be activated
     * @throws IllegalArgumentException if the confirmation has neither a transaction nor an invoice id
     */
    BillingOutcome confirmPayment(GatewayEvent.PaymentConfirmed confirmation);

    /**
     * Record a failed payment and mark the subscription past due when its state allows it.
     * The paid period is never shortened.
     */
    BillingOutcome recordFailure(GatewayEvent.PaymentFailed failure);

    /**
     * Non-production confirmation keyed by {@code sim_<sessionId>}, so the same session activates once.
     */
    BillingOutcome recordSimulatedPayment(UUID userId, String sessionId);
}
