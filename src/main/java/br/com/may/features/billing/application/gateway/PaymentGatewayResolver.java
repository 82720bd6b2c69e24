package br.com.may.features.billing.application.gateway;

import br.com.may.features.billing.domain.model.GatewayProvider;

public interface PaymentGatewayResolver {

    /**
     * Gateway that owns an existing subscription, which may differ from the one used for new checkouts.
     *
     * @throws IllegalArgumentException if no adapter is registered for the provider
     */
    PaymentGateway forProvider(GatewayProvider provider);
}
