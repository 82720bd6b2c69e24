package br.com.may.features.billing.application.impl;

import br.com.may.features.billing.application.GatewayEventDispatcher;
import br.com.may.features.billing.application.PaymentLedgerService;
import br.com.may.features.billing.application.SubscriptionService;
import br.com.may.features.billing.domain.event.GatewayEvent;
import br.com.may.features.billing.domain.model.BillingOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class GatewayEventDispatcherImpl implements GatewayEventDispatcher {

    private final PaymentLedgerService paymentLedgerService;
    private final SubscriptionService subscriptionService;

    @Override
    public BillingOutcome dispatch(GatewayEvent event) {
        if (event instanceof GatewayEvent.PaymentConfirmed confirmed) {
            return paymentLedgerService.confirmPayment(confirmed);
        }
        if (event instanceof GatewayEvent.PaymentFailed failed) {
            return paymentLedgerService.recordFailure(failed);
        }
        if (event instanceof GatewayEvent.SubscriptionCanceled canceled) {
            return subscriptionService.handleGatewayCancellation(canceled);
        }
        if (event instanceof GatewayEvent.SubscriptionUpdated updated) {
            return subscriptionService.handleGatewayUpdate(updated);
        }
        if (event instanceof GatewayEvent.Acknowledged acknowledged) {
            log.info("Acknowledged {} without state change: {}", acknowledged.eventType(), acknowledged.reason());
            return BillingOutcome.ACKNOWLEDGED;
        }
        if (event instanceof GatewayEvent.Ignored ignored) {
            log.info("Ignoring unhandled event type {}", ignored.eventType());
            return BillingOutcome.IGNORED;
        }
        throw new IllegalArgumentException("Unsupported gateway event " + event.getClass().getSimpleName());
    }
}
