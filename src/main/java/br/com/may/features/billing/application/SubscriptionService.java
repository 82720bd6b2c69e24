package br.com.may.features.billing.application;

import br.com.may.features.billing.api.dto.CancelSubscriptionResponse;
import br.com.may.features.billing.api.dto.ConfirmCheckoutRequest;
import br.com.may.features.billing.api.dto.ConfirmCheckoutResponse;
import br.com.may.features.billing.api.dto.CurrentSubscriptionResponse;
import br.com.may.features.billing.api.dto.ProcessPaymentRequest;
import br.com.may.features.billing.api.dto.ProcessPaymentResponse;
import br.com.may.features.billing.api.dto.StartSubscriptionRequest;
import br.com.may.features.billing.api.dto.StartSubscriptionResponse;
import br.com.may.features.billing.api.dto.SubscriptionDto;
import br.com.may.features.billing.api.dto.SubscriptionStatusResponse;
import br.com.may.features.billing.api.dto.TokenizeCardRequest;
import br.com.may.features.billing.api.dto.TokenizeCardResponse;
import br.com.may.features.billing.api.dto.TrialEligibilityResponse;
import br.com.may.features.billing.domain.event.GatewayEvent;
import br.com.may.features.billing.domain.model.BillingOutcome;

import java.util.UUID;

/**
 * Subscription lifecycle driven by the user (checkout, cancel, reactivate) and by provider events
 * that are not payments (cancellation, metadata updates).
 */
public interface SubscriptionService {

    /**
     * Start a free trial, or open a pending subscription and quote the paid plan.
     *
     * @throws br.com.may.features.billing.domain.exception.TrialAlreadyUsedException if the trial was used before
     * @throws br.com.may.features.billing.domain.exception.SubscriptionAlreadyActiveException if the user is already subscribed
     */
    StartSubscriptionResponse start(UUID userId, StartSubscriptionRequest request);

    /**
     * Charge a tokenized card and activate the subscription when the gateway captures the payment.
     */
    ProcessPaymentResponse processPayment(UUID userId, ProcessPaymentRequest request);

    /**
     * Non-production checkout confirmation. Idempotent by session id.
     */
    ConfirmCheckoutResponse confirmCheckout(UUID userId, ConfirmCheckoutRequest request);

    CancelSubscriptionResponse cancel(UUID userId);

    /**
     * Undo a cancellation while the paid period is still running. No new charge is made.
     */
    SubscriptionDto reactivate(UUID userId);

    SubscriptionStatusResponse getStatus(UUID userId);

    TrialEligibilityResponse getTrialEligibility(UUID userId);

    CurrentSubscriptionResponse getCurrent(UUID userId);

    TokenizeCardResponse tokenizeCard(TokenizeCardRequest request);

    BillingOutcome handleGatewayCancellation(GatewayEvent.SubscriptionCanceled event);

    BillingOutcome handleGatewayUpdate(GatewayEvent.SubscriptionUpdated event);
}
