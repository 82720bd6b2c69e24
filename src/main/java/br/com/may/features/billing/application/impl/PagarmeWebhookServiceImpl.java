package br.com.may.features.billing.application.impl;

import br.com.may.features.billing.api.dto.WebhookConfigResponse;
import br.com.may.features.billing.api.dto.WebhookReceipt;
import br.com.may.features.billing.application.BillingMetricsService;
import br.com.may.features.billing.application.BillingProperties;
import br.com.may.features.billing.application.GatewayEventDispatcher;
import br.com.may.features.billing.application.PagarmeProperties;
import br.com.may.features.billing.application.PagarmeWebhookService;
import br.com.may.features.billing.application.WebhookCredentials;
import br.com.may.features.billing.application.WebhookLoggingContext;
import br.com.may.features.billing.application.WebhookSecretVerifier;
import br.com.may.features.billing.domain.event.GatewayEvent;
import br.com.may.features.billing.domain.exception.InvalidWebhookPayloadException;
import br.com.may.features.billing.domain.exception.WebhookAuthenticationException;
import br.com.may.features.billing.domain.model.BillingOutcome;
import br.com.may.features.billing.infra.gateway.pagarme.PagarmeEventTranslator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class PagarmeWebhookServiceImpl implements PagarmeWebhookService {

    private static final String PROVIDER = "pagarme";
    private static final String UNKNOWN_EVENT_TYPE = "unknown";

    static final List<String> RECOMMENDED_EVENTS = List.of(
            "order.paid",
            "order.payment_failed",
            "order.canceled",
            "charge.payment_failed",
            "charge.refunded",
            "invoice.paid",
            "invoice.payment_failed",
            "subscription.canceled",
            "subscription.updated");

    private final WebhookSecretVerifier secretVerifier;
    private final PagarmeEventTranslator eventTranslator;
    private final GatewayEventDispatcher eventDispatcher;
    private final BillingMetricsService metricsService;
    private final BillingProperties billingProperties;
    private final PagarmeProperties pagarmeProperties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public WebhookReceipt process(String payload, WebhookCredentials credentials) {
        String carrier;
        try {
            carrier = secretVerifier.verify(credentials);
        } catch (WebhookAuthenticationException e) {
            metricsService.incrementWebhookRejected(PROVIDER, "unauthorized");
            log.warn("Rejected Pagar.me webhook: {}", e.getMessage());
            throw e;
        }
        log.debug("Pagar.me webhook authenticated via {}", carrier);
        return handle(payload, null);
    }

    @Override
    public WebhookReceipt simulate(UUID userId, String payload) {
        log.warn("Processing simulated Pagar.me webhook for user {} without secret validation", userId);
        return handle(payload, userId);
    }

    @Override
    public WebhookConfigResponse describeConfiguration() {
        String baseUrl = billingProperties.getPublicBaseUrl().replaceAll("/+$", "");
        return new WebhookConfigResponse(
                baseUrl + "/api/subscriptions/webhook",
                baseUrl + "/api/subscriptions/webhook/stripe",
                List.of("header X-Pagarme-Webhook-Secret", "header X-Webhook-Secret",
                        "Authorization: Bearer <secret>", "query ?token=<secret>",
                        "Authorization: Basic (user or password is the secret)"),
                RECOMMENDED_EVENTS,
                secretVerifier.isConfigured(),
                pagarmeProperties.isAllowUnsignedWebhooks());
    }

    private WebhookReceipt handle(String payload, UUID simulatingUserId) {
        long startTime = clock.millis();
        JsonNode root = parse(payload);
        String eventType = firstText(root, "type", "event");
        if (eventType == null) {
            log.warn("Pagar.me webhook without an event type; acknowledging as {}", UNKNOWN_EVENT_TYPE);
            eventType = UNKNOWN_EVENT_TYPE;
        }
        String eventId = firstText(root, "id");
        if (eventId == null) {
            eventId = "unknown";
        }
        JsonNode data = root.path("data").isObject() ? root.get("data") : root;
        if (simulatingUserId != null) {
            attributeTo((ObjectNode) data, simulatingUserId);
        }

        metricsService.incrementWebhookReceived(PROVIDER, eventType);
        WebhookLoggingContext loggingContext = WebhookLoggingContext.builder()
                .provider(PROVIDER)
                .eventId(eventId)
                .eventType(eventType)
                .subscriptionId(firstText(data.path("subscription"), "id"))
                .build();
        loggingContext.setMDC();
        try {
            GatewayEvent event = eventTranslator.translate(eventType, data);
            BillingOutcome outcome = eventDispatcher.dispatch(event);
            metricsService.incrementWebhookOutcome(PROVIDER, eventType, outcome.apiValue());
            long elapsed = clock.millis() - startTime;
            loggingContext.logInfo(log, "Pagar.me webhook id={} type={} -> {} in {}ms",
                    eventId, eventType, outcome.apiValue(), elapsed);
            return new WebhookReceipt(outcome.apiValue(), eventId, eventType, elapsed, null);
        } catch (RuntimeException e) {
            metricsService.incrementWebhookFailed(PROVIDER, eventType);
            loggingContext.logError(log, "Failed to process Pagar.me webhook id=" + eventId + " type=" + eventType, e);
            return new WebhookReceipt("error", eventId, eventType, clock.millis() - startTime, e.getMessage());
        } finally {
            metricsService.recordWebhookLatency(PROVIDER, eventType, clock.millis() - startTime);
            WebhookLoggingContext.clearMDC();
        }
    }

    private static void attributeTo(ObjectNode data, UUID userId) {
        JsonNode metadata = data.get("metadata");
        ObjectNode target = metadata instanceof ObjectNode existing ? existing : data.putObject("metadata");
        target.put("user_id", userId.toString());
    }

    private JsonNode parse(String payload) {
        if (!StringUtils.hasText(payload)) {
            metricsService.incrementWebhookRejected(PROVIDER, "empty_body");
            throw new InvalidWebhookPayloadException("Webhook body is empty");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            metricsService.incrementWebhookRejected(PROVIDER, "invalid_json");
            throw new InvalidWebhookPayloadException("Webhook body is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            metricsService.incrementWebhookRejected(PROVIDER, "not_an_object");
            throw new InvalidWebhookPayloadException("Webhook body must be a JSON object");
        }
        return root;
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && value.isValueNode() && StringUtils.hasText(value.asText())) {
                return value.asText();
            }
        }
        return null;
    }
}
