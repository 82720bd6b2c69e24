package br.com.may.features.billing.infra.gateway.pagarme;

import br.com.may.features.billing.domain.event.GatewayEvent;
import br.com.may.features.billing.domain.exception.InvalidWebhookPayloadException;
import br.com.may.features.billing.domain.model.GatewayProvider;
import br.com.may.features.billing.domain.model.PaymentMethod;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import static br.com.may.features.billing.infra.gateway.pagarme.PagarmePayloads.cents;
import static br.com.may.features.billing.infra.gateway.pagarme.PagarmePayloads.text;

/**
 * Maps Pagar.me webhook events onto {@link GatewayEvent}s.
 * <p>
 * Invoice events confirm payments for the invoice model and order events for the order/charge
 * model. Creation and renewal markers are acknowledged without touching state because they do not
 * prove that money was captured.
 */
@Component
public class PagarmeEventTranslator {

    private static final GatewayProvider PROVIDER = GatewayProvider.PAGARME;

    @FunctionalInterface
    private interface Handler {
        GatewayEvent translate(String eventType, JsonNode data, ZoneId zone);
    }

    private static final Set<String> ACKNOWLEDGED = Set.of(
            "charge.paid",
            "invoice.created",
            "order.created",
            "charge.created",
            "subscription.created",
            "subscription.renewed",
            "subscription.activated",
            "subscription.pending",
            "subscription.pending_payment");

    private static final Map<String, Handler> HANDLERS = new HashMap<>();

    static {
        HANDLERS.put("invoice.paid", PagarmeEventTranslator::invoicePaid);
        HANDLERS.put("order.paid", PagarmeEventTranslator::orderPaid);
        HANDLERS.put("order.closed", PagarmeEventTranslator::orderPaid);
        HANDLERS.put("subscription.paid", PagarmeEventTranslator::legacySubscriptionPaid);
        HANDLERS.put("transaction.paid", PagarmeEventTranslator::legacyTransactionPaid);

        HANDLERS.put("invoice.payment_failed", PagarmeEventTranslator::invoiceFailed);
        HANDLERS.put("invoice.canceled", PagarmeEventTranslator::invoiceFailed);
        HANDLERS.put("order.payment_failed", PagarmeEventTranslator::orderFailed);
        HANDLERS.put("order.canceled", PagarmeEventTranslator::orderFailed);
        HANDLERS.put("charge.payment_failed", PagarmeEventTranslator::chargeFailed);
        HANDLERS.put("charge.refused", PagarmeEventTranslator::chargeFailed);
        HANDLERS.put("charge.refunded", PagarmeEventTranslator::chargeFailed);
        HANDLERS.put("subscription.payment_failed", PagarmeEventTranslator::legacySubscriptionFailed);
        HANDLERS.put("transaction.refused", PagarmeEventTranslator::legacyTransactionFailed);

        HANDLERS.put("subscription.canceled", PagarmeEventTranslator::subscriptionCanceled);
        HANDLERS.put("subscription.updated", PagarmeEventTranslator::subscriptionUpdated);

        for (String eventType : ACKNOWLEDGED) {
            HANDLERS.put(eventType, (type, data, zone) ->
                    new GatewayEvent.Acknowledged(type, "creation or renewal marker; payment arrives in its own event"));
        }
    }

    private final Clock clock;

    public PagarmeEventTranslator(Clock clock) {
        this.clock = clock;
    }

    public static boolean isKnown(String eventType) {
        return HANDLERS.containsKey(eventType);
    }

    public static Set<String> knownEventTypes() {
        return HANDLERS.keySet();
    }

    /**
     * @param eventType value of the {@code type} field
     * @param data      the {@code data} object of the event
     * @throws InvalidWebhookPayloadException if a known event lacks the ids needed to apply it
     */
    public GatewayEvent translate(String eventType, JsonNode data) {
        Handler handler = HANDLERS.get(eventType);
        if (handler == null) {
            return new GatewayEvent.Ignored(eventType);
        }
        return handler.translate(eventType, data, clock.getZone());
    }

    private static GatewayEvent invoicePaid(String eventType, JsonNode invoice, ZoneId zone) {
        String invoiceId = require(invoice, "id", eventType);
        JsonNode charge = PagarmePayloads.firstCharge(invoice);
        JsonNode cycle = invoice.has("cycle") ? invoice.path("cycle") : invoice.path("subscription").path("current_cycle");
        LocalDateTime periodEnd = PagarmePayloads.dateTime(cycle, "end_at", zone);

        return GatewayEvent.PaymentConfirmed.builder()
                .provider(PROVIDER)
                .providerSubscriptionId(subscriptionId(invoice))
                .providerInvoiceId(invoiceId)
                .providerTransactionId(text(charge, "id") != null ? text(charge, "id") : invoiceId)
                .amountCents(cents(invoice, "amount"))
                .method(method(text(invoice, "payment_method")))
                .periodStart(PagarmePayloads.dateTime(cycle, "start_at", zone))
                .periodEnd(periodEnd)
                .nextBillingAt(periodEnd != null ? periodEnd.plusDays(1) : null)
                .paidAt(PagarmePayloads.dateTime(charge, "paid_at", zone))
                .userIdHint(PagarmePayloads.userIdFromMetadata(invoice))
                .build();
    }

    private static GatewayEvent orderPaid(String eventType, JsonNode order, ZoneId zone) {
        String orderId = require(order, "id", eventType);
        JsonNode charge = PagarmePayloads.firstCharge(order);
        boolean paid = "paid".equals(text(order, "status")) || "paid".equals(text(charge, "status"));
        if (!paid) {
            return new GatewayEvent.Acknowledged(eventType, "order has no paid charge");
        }
        String chargeId = text(charge, "id");

        return GatewayEvent.PaymentConfirmed.builder()
                .provider(PROVIDER)
                .providerSubscriptionId(text(charge, "subscription_id"))
                .providerOrderId(orderId)
                .providerTransactionId(chargeId != null ? chargeId : orderId)
                .amountCents(charge != null && cents(charge, "amount") != null ? cents(charge, "amount") : cents(order, "amount"))
                .method(method(text(charge, "payment_method")))
                .paidAt(PagarmePayloads.dateTime(charge, "paid_at", zone))
                .userIdHint(PagarmePayloads.userIdFromMetadata(order))
                .build();
    }

    private static GatewayEvent legacySubscriptionPaid(String eventType, JsonNode subscription, ZoneId zone) {
        String subscriptionId = require(subscription, "id", eventType);
        JsonNode transaction = subscription.has("current_transaction")
                ? subscription.path("current_transaction")
                : subscription.path("last_transaction");
        String transactionId = text(transaction, "id");
        if (transactionId == null) {
            throw new InvalidWebhookPayloadException(eventType + " carries no transaction id");
        }
        return GatewayEvent.PaymentConfirmed.builder()
                .provider(PROVIDER)
                .providerSubscriptionId(subscriptionId)
                .providerTransactionId(transactionId)
                .amountCents(cents(transaction, "amount"))
                .method(method(text(transaction, "payment_method")))
                .periodStart(PagarmePayloads.dateTime(subscription, "current_period_start", zone))
                .periodEnd(PagarmePayloads.dateTime(subscription, "current_period_end", zone))
                .userIdHint(PagarmePayloads.userIdFromMetadata(subscription))
                .build();
    }

    private static GatewayEvent legacyTransactionPaid(String eventType, JsonNode transaction, ZoneId zone) {
        String transactionId = require(transaction, "id", eventType);
        return GatewayEvent.PaymentConfirmed.builder()
                .provider(PROVIDER)
                .providerSubscriptionId(subscriptionId(transaction))
                .providerTransactionId(transactionId)
                .amountCents(cents(transaction, "amount"))
                .method(method(text(transaction, "payment_method")))
                .userIdHint(PagarmePayloads.userIdFromMetadata(transaction))
                .build();
    }

    private static GatewayEvent invoiceFailed(String eventType, JsonNode invoice, ZoneId zone) {
        String invoiceId = require(invoice, "id", eventType);
        JsonNode charge = PagarmePayloads.firstCharge(invoice);
        return failure(invoice, charge)
                .providerSubscriptionId(subscriptionId(invoice))
                .providerInvoiceId(invoiceId)
                .providerTransactionId(text(charge, "id") != null ? text(charge, "id") : invoiceId)
                .amountCents(cents(invoice, "amount"))
                .build();
    }

    private static GatewayEvent orderFailed(String eventType, JsonNode order, ZoneId zone) {
        String orderId = require(order, "id", eventType);
        JsonNode charge = PagarmePayloads.firstCharge(order);
        String chargeId = text(charge, "id");
        return failure(order, charge)
                .providerSubscriptionId(text(charge, "subscription_id"))
                .providerOrderId(orderId)
                .providerTransactionId(chargeId != null ? chargeId : orderId)
                .amountCents(cents(order, "amount"))
                .build();
    }

    private static GatewayEvent chargeFailed(String eventType, JsonNode charge, ZoneId zone) {
        String chargeId = require(charge, "id", eventType);
        JsonNode invoice = charge.path("invoice");
        String subscriptionId = text(charge, "subscription_id") != null
                ? text(charge, "subscription_id")
                : subscriptionId(invoice);
        return failure(charge, charge)
                .providerSubscriptionId(subscriptionId)
                .providerOrderId(text(charge.path("order"), "id"))
                .providerInvoiceId(text(invoice, "id"))
                .providerTransactionId(chargeId)
                .amountCents(cents(charge, "amount"))
                .build();
    }

    private static GatewayEvent legacySubscriptionFailed(String eventType, JsonNode subscription, ZoneId zone) {
        String subscriptionId = require(subscription, "id", eventType);
        JsonNode transaction = subscription.has("current_transaction")
                ? subscription.path("current_transaction")
                : subscription.path("last_transaction");
        return GatewayEvent.PaymentFailed.builder()
                .provider(PROVIDER)
                .providerSubscriptionId(subscriptionId)
                .providerTransactionId(text(transaction, "id"))
                .amountCents(cents(transaction, "amount"))
                .failureReason(legacyReason(transaction))
                .recurring(isRecurring(subscription))
                .userIdHint(PagarmePayloads.userIdFromMetadata(subscription))
                .build();
    }

    private static GatewayEvent legacyTransactionFailed(String eventType, JsonNode transaction, ZoneId zone) {
        String transactionId = require(transaction, "id", eventType);
        return GatewayEvent.PaymentFailed.builder()
                .provider(PROVIDER)
                .providerSubscriptionId(subscriptionId(transaction))
                .providerTransactionId(transactionId)
                .amountCents(cents(transaction, "amount"))
                .failureReason(legacyReason(transaction))
                .recurring(isRecurring(transaction))
                .userIdHint(PagarmePayloads.userIdFromMetadata(transaction))
                .build();
    }

    private static GatewayEvent subscriptionCanceled(String eventType, JsonNode subscription, ZoneId zone) {
        String subscriptionId = require(subscription, "id", eventType);
        return new GatewayEvent.SubscriptionCanceled(PROVIDER, subscriptionId,
                PagarmePayloads.dateTime(subscription, "canceled_at", zone));
    }

    private static GatewayEvent subscriptionUpdated(String eventType, JsonNode subscription, ZoneId zone) {
        String subscriptionId = require(subscription, "id", eventType);
        String planCode = text(subscription.path("metadata"), "plan");
        return new GatewayEvent.SubscriptionUpdated(PROVIDER, subscriptionId, null,
                PagarmePayloads.dateTime(subscription.path("current_cycle"), "end_at", zone), planCode);
    }

    private static GatewayEvent.PaymentFailed.PaymentFailedBuilder failure(JsonNode source, JsonNode charge) {
        return GatewayEvent.PaymentFailed.builder()
                .provider(PROVIDER)
                .failureReason(PagarmePayloads.failureReason(charge))
                .integrationError(PagarmePayloads.isIntegrationError(charge))
                .recurring(isRecurring(source))
                .userIdHint(PagarmePayloads.userIdFromMetadata(source));
    }

    private static String legacyReason(JsonNode transaction) {
        String reason = text(transaction, "refuse_reason");
        if (reason == null) {
            reason = text(transaction, "status_reason");
        }
        return reason != null ? reason : PagarmePayloads.DEFAULT_FAILURE_REASON;
    }

    private static String subscriptionId(JsonNode node) {
        String nested = text(node.path("subscription"), "id");
        return nested != null ? nested : text(node, "subscription_id");
    }

    private static boolean isRecurring(JsonNode node) {
        return "true".equals(text(node.path("metadata"), "recurring"));
    }

    private static PaymentMethod method(String paymentMethod) {
        if (paymentMethod == null) {
            return PaymentMethod.CREDIT_CARD;
        }
        return switch (paymentMethod) {
            case "boleto" -> PaymentMethod.BOLETO;
            case "pix" -> PaymentMethod.PIX;
            default -> PaymentMethod.CREDIT_CARD;
        };
    }

    private static String require(JsonNode node, String field, String eventType) {
        String value = text(node, field);
        if (value == null) {
            throw new InvalidWebhookPayloadException(eventType + " event is missing data." + field);
        }
        return value;
    }
}
