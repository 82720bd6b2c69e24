package br.com.may.features.billing.application;

import br.com.may.features.billing.api.dto.WebhookConfigResponse;
import br.com.may.features.billing.api.dto.WebhookReceipt;

import java.util.UUID;

public interface PagarmeWebhookService {

    /**
     * Authenticate, translate and apply one Pagar.me webhook delivery. Once authenticated and
     * parsed, the delivery always yields a receipt; handler failures are reported inside it.
     *
     * @throws br.com.may.features.billing.domain.exception.WebhookAuthenticationException if no valid secret is present
     * @throws br.com.may.features.billing.domain.exception.InvalidWebhookPayloadException if the body is not a JSON object
     */
    WebhookReceipt process(String payload, WebhookCredentials credentials);

    /**
     * Run an event body through the same router without secret validation. Non-production only.
     * The event is attributed to {@code userId}; a {@code metadata.user_id} in the body is replaced.
     */
    WebhookReceipt simulate(UUID userId, String payload);

    WebhookConfigResponse describeConfiguration();
}
