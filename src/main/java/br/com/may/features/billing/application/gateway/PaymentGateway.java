package br.com.may.features.billing.application.gateway;

import br.com.may.features.billing.domain.model.GatewayProvider;

import java.util.Optional;

/**
 * Generic billing operations implemented once per payment provider. Every adapter returns the same
 * normalized records, so callers never see provider payloads.
 * <p>
 * Adapters throw {@link br.com.may.features.billing.domain.exception.GatewayValidationException}
 * before any remote call when a request is malformed,
 * {@link br.com.may.features.billing.domain.exception.GatewayRejectedException} when the provider
 * refuses it, and {@link br.com.may.features.billing.domain.exception.GatewayNetworkException}
 * for transient failures.
 */
public interface PaymentGateway {

    GatewayProvider provider();

    /**
     * Key the browser uses to tokenize cards without sending them to this API.
     */
    String publicKey();

    /**
     * Exchange raw card data for a single-use token. This is the only method that accepts card data.
     */
    GatewayPaymentMethod tokenizeCard(CardData card);

    /**
     * Return the customer referenced by {@code request.existingCustomerRef()} or create a new one.
     */
    GatewayCustomer createOrGetCustomer(CustomerRequest request);

    /**
     * Attach a single-use token to the customer and return the durable payment method reference.
     */
    GatewayPaymentMethod attachPaymentMethod(String customerRef, String tokenRef);

    /**
     * Default payment method stored for the customer, used for recurring charges.
     */
    Optional<GatewayPaymentMethod> findDefaultPaymentMethod(String customerRef);

    GatewaySubscription createSubscription(GatewaySubscriptionRequest request);

    void cancelSubscription(String subscriptionRef);

    /**
     * Current payment state of a subscription or order, straight from the provider.
     */
    GatewaySubscription getStatus(String subscriptionRef);
}
