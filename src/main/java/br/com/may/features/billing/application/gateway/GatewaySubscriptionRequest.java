package br.com.may.features.billing.application.gateway;

import br.com.may.features.billing.domain.model.BillingCycle;
import lombok.Builder;

import java.util.Map;
import java.util.UUID;

/**
 * A new subscription charge. {@code paymentMethodRef} must be a durable reference obtained from
 * {@link PaymentGateway#attachPaymentMethod}, never a token or card data.
 */
@Builder
public record GatewaySubscriptionRequest(
        UUID userId,
        String customerRef,
        String paymentMethodRef,
        String planCode,
        String planName,
        BillingCycle cycle,
        long amountCents,
        Map<String, String> metadata
) {
}
