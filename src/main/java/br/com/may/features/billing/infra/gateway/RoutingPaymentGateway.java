package br.com.may.features.billing.infra.gateway;

import br.com.may.features.billing.application.BillingProperties;
import br.com.may.features.billing.application.gateway.CardData;
import br.com.may.features.billing.application.gateway.CustomerRequest;
import br.com.may.features.billing.application.gateway.GatewayCustomer;
import br.com.may.features.billing.application.gateway.GatewayPaymentMethod;
import br.com.may.features.billing.application.gateway.GatewaySubscription;
import br.com.may.features.billing.application.gateway.GatewaySubscriptionRequest;
import br.com.may.features.billing.application.gateway.PaymentGateway;
import br.com.may.features.billing.application.gateway.PaymentGatewayResolver;
import br.com.may.features.billing.application.gateway.SelectablePaymentGateway;
import br.com.may.features.billing.domain.model.GatewayProvider;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Delegates to the adapter selected by {@code billing.gateway}. Existing subscriptions are served by
 * the adapter of the provider that created them.
 */
@Service
@Primary
public class RoutingPaymentGateway implements PaymentGateway, PaymentGatewayResolver {

    private final Map<GatewayProvider, SelectablePaymentGateway> gatewaysByProvider = new EnumMap<>(GatewayProvider.class);
    private final BillingProperties billingProperties;

    public RoutingPaymentGateway(List<SelectablePaymentGateway> gateways, BillingProperties billingProperties) {
        for (SelectablePaymentGateway gateway : gateways) {
            gatewaysByProvider.put(gateway.provider(), gateway);
        }
        this.billingProperties = billingProperties;
    }

    @Override
    public PaymentGateway forProvider(GatewayProvider provider) {
        SelectablePaymentGateway gateway = provider == null ? null : gatewaysByProvider.get(provider);
        if (gateway == null) {
            throw new IllegalArgumentException("Unsupported payment gateway '" + provider
                    + "'. Available: " + gatewaysByProvider.keySet());
        }
        return gateway;
    }

    @Override
    public GatewayProvider provider() {
        return selectedGateway().provider();
    }

    @Override
    public String publicKey() {
        return selectedGateway().publicKey();
    }

    @Override
    public GatewayPaymentMethod tokenizeCard(CardData card) {
        return selectedGateway().tokenizeCard(card);
    }

    @Override
    public GatewayCustomer createOrGetCustomer(CustomerRequest request) {
        return selectedGateway().createOrGetCustomer(request);
    }

    @Override
    public GatewayPaymentMethod attachPaymentMethod(String customerRef, String tokenRef) {
        return selectedGateway().attachPaymentMethod(customerRef, tokenRef);
    }

    @Override
    public Optional<GatewayPaymentMethod> findDefaultPaymentMethod(String customerRef) {
        return selectedGateway().findDefaultPaymentMethod(customerRef);
    }

    @Override
    public GatewaySubscription createSubscription(GatewaySubscriptionRequest request) {
        return selectedGateway().createSubscription(request);
    }

    @Override
    public void cancelSubscription(String subscriptionRef) {
        selectedGateway().cancelSubscription(subscriptionRef);
    }

    @Override
    public GatewaySubscription getStatus(String subscriptionRef) {
        return selectedGateway().getStatus(subscriptionRef);
    }

    private PaymentGateway selectedGateway() {
        return forProvider(billingProperties.getGateway());
    }
}
