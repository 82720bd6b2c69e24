package br.com.may.features.billing.application.impl;

import br.com.may.features.billing.api.dto.WebhookReceipt;
import br.com.may.features.billing.application.BillingMetricsService;
import br.com.may.features.billing.application.GatewayEventDispatcher;
import br.com.may.features.billing.application.StripeProperties;
import br.com.may.features.billing.application.StripeWebhookService;
import br.com.may.features.billing.application.WebhookLoggingContext;
import br.com.may.features.billing.domain.event.GatewayEvent;
import br.com.may.features.billing.domain.exception.InvalidWebhookPayloadException;
import br.com.may.features.billing.domain.exception.WebhookAuthenticationException;
import br.com.may.features.billing.domain.model.BillingOutcome;
import br.com.may.features.billing.infra.gateway.stripe.StripeEventTranslator;
import com.stripe.exception.SignatureVerificationException;
import com.stripe.model.Event;
import com.stripe.net.Webhook;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;

@Slf4j
@Service
@RequiredArgsConstructor
public class StripeWebhookServiceImpl implements StripeWebhookService {

    private static final String PROVIDER = "stripe";

    private final StripeProperties stripeProperties;
    private final StripeEventTranslator eventTranslator;
    private final GatewayEventDispatcher eventDispatcher;
    private final BillingMetricsService metricsService;
    private final Clock clock;

    @Override
    public WebhookReceipt process(String payload, String signatureHeader) {
        long startTime = clock.millis();

        String webhookSecret = stripeProperties.getWebhookSecret();
        if (!StringUtils.hasText(webhookSecret)) {
            log.warn("Stripe webhook secret not configured; rejecting request");
            metricsService.incrementWebhookRejected(PROVIDER, "not_configured");
            throw new WebhookAuthenticationException("Webhook secret not configured");
        }
        if (!StringUtils.hasText(signatureHeader)) {
            metricsService.incrementWebhookRejected(PROVIDER, "missing_signature");
            throw new WebhookAuthenticationException("Missing Stripe-Signature header");
        }

        final Event event;
        try {
            event = Webhook.constructEvent(payload, signatureHeader, webhookSecret);
        } catch (SignatureVerificationException e) {
            log.warn("Stripe webhook signature verification failed: {}", e.getMessage());
            metricsService.incrementWebhookRejected(PROVIDER, "invalid_signature");
            throw new WebhookAuthenticationException("Invalid Stripe signature", e);
        } catch (RuntimeException e) {
            // signature matched but the body is not a Stripe event
            metricsService.incrementWebhookRejected(PROVIDER, "invalid_payload");
            throw new InvalidWebhookPayloadException("Cannot parse Stripe event", e);
        }

        String eventId = event.getId();
        String type = event.getType();
        metricsService.incrementWebhookReceived(PROVIDER, type);

        WebhookLoggingContext loggingContext = WebhookLoggingContext.builder()
                .provider(PROVIDER)
                .eventId(eventId)
                .eventType(type)
                .build();
        loggingContext.setMDC();
        try {
            GatewayEvent gatewayEvent = eventTranslator.translate(event);
            BillingOutcome outcome = eventDispatcher.dispatch(gatewayEvent);
            metricsService.incrementWebhookOutcome(PROVIDER, type, outcome.apiValue());
            long elapsed = clock.millis() - startTime;
            loggingContext.logInfo(log, "Stripe webhook id={} type={} -> {} in {}ms",
                    eventId, type, outcome.apiValue(), elapsed);
            return new WebhookReceipt(outcome.apiValue(), eventId, type, elapsed, null);
        } catch (RuntimeException e) {
            metricsService.incrementWebhookFailed(PROVIDER, type);
            loggingContext.logError(log, "Failed to process Stripe webhook id=" + eventId + " type=" + type, e);
            return new WebhookReceipt("error", eventId, type, clock.millis() - startTime, e.getMessage());
        } finally {
            metricsService.recordWebhookLatency(PROVIDER, type, clock.millis() - startTime);
            WebhookLoggingContext.clearMDC();
        }
    }
}
