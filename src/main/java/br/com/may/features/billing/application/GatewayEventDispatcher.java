package br.com.may.features.billing.application;

import br.com.may.features.billing.domain.event.GatewayEvent;
import br.com.may.features.billing.domain.model.BillingOutcome;

/**
 * Applies a translated gateway event to local state. Shared by both webhook endpoints and the
 * simulation endpoint.
 */
public interface GatewayEventDispatcher {

    BillingOutcome dispatch(GatewayEvent event);
}
