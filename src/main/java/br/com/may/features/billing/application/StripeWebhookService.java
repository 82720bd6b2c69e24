package br.com.may.features.billing.application;

import br.com.may.features.billing.api.dto.WebhookReceipt;

public interface StripeWebhookService {

    /**
     * Verify the {@code Stripe-Signature} header, then translate and apply the event.
     *
     * @throws br.com.may.features.billing.domain.exception.WebhookAuthenticationException if the signature is missing or invalid
     * @throws br.com.may.features.billing.domain.exception.InvalidWebhookPayloadException if the payload cannot be parsed
     */
    WebhookReceipt process(String payload, String signatureHeader);
}
