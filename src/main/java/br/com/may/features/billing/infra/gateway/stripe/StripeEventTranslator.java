package br.com.may.features.billing.infra.gateway.stripe;

import br.com.may.features.billing.domain.event.GatewayEvent;
import br.com.may.features.billing.domain.exception.InvalidWebhookPayloadException;
import br.com.may.features.billing.domain.model.GatewayProvider;
import br.com.may.features.billing.domain.model.PaymentMethod;
import br.com.may.features.billing.domain.model.SubscriptionStatus;
import com.stripe.exception.EventDataObjectDeserializationException;
import com.stripe.model.Event;
import com.stripe.model.EventDataObjectDeserializer;
import com.stripe.model.Invoice;
import com.stripe.model.InvoiceLineItem;
import com.stripe.model.StripeObject;
import com.stripe.model.Subscription;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Map;

/**
 * Maps Stripe events onto {@link GatewayEvent}s. The paid invoice is the only payment confirmation;
 * its id is the ledger key.
 */
@Slf4j
@Component
public class StripeEventTranslator {

    private static final GatewayProvider PROVIDER = GatewayProvider.STRIPE;

    @FunctionalInterface
    private interface Handler {
        GatewayEvent translate(Event event, StripeObject object, ZoneId zone);
    }

    private static final Map<String, Handler> HANDLERS = Map.of(
            "invoice.paid", StripeEventTranslator::invoicePaid,
            "invoice.payment_failed", StripeEventTranslator::invoiceFailed,
            "customer.subscription.updated", StripeEventTranslator::subscriptionUpdated,
            "customer.subscription.deleted", StripeEventTranslator::subscriptionDeleted,
            "customer.subscription.created", (event, object, zone) ->
                    new GatewayEvent.Acknowledged(event.getType(), "subscription created; payment arrives with invoice.paid"),
            "customer.subscription.trial_will_end", (event, object, zone) ->
                    new GatewayEvent.Acknowledged(event.getType(), "trial reminder"));

    private static final Map<String, SubscriptionStatus> STATUS_MAP = Map.of(
            "incomplete", SubscriptionStatus.PENDING,
            "incomplete_expired", SubscriptionStatus.EXPIRED,
            "active", SubscriptionStatus.ACTIVE,
            "past_due", SubscriptionStatus.PAST_DUE,
            "unpaid", SubscriptionStatus.PAST_DUE,
            "canceled", SubscriptionStatus.CANCELED,
            "trialing", SubscriptionStatus.TRIAL);

    private final Clock clock;

    public StripeEventTranslator(Clock clock) {
        this.clock = clock;
    }

    /**
     * @throws InvalidWebhookPayloadException if a known event carries an unreadable data object
     */
    public GatewayEvent translate(Event event) {
        Handler handler = HANDLERS.get(event.getType());
        if (handler == null) {
            return new GatewayEvent.Ignored(event.getType());
        }
        return handler.translate(event, dataObject(event), clock.getZone());
    }

    public static SubscriptionStatus mapStatus(String stripeStatus) {
        return stripeStatus == null ? null : STATUS_MAP.get(stripeStatus);
    }

    private static StripeObject dataObject(Event event) {
        EventDataObjectDeserializer deserializer = event.getDataObjectDeserializer();
        if (deserializer.getObject().isPresent()) {
            return deserializer.getObject().get();
        }
        // API version mismatch: the payload is still usable for the few fields read here
        log.warn("Stripe event {} uses API version {}; deserializing unsafely", event.getId(), event.getApiVersion());
        try {
            return deserializer.deserializeUnsafe();
        } catch (EventDataObjectDeserializationException e) {
            throw new InvalidWebhookPayloadException("Cannot read data object of Stripe event " + event.getId(), e);
        }
    }

    private static GatewayEvent invoicePaid(Event event, StripeObject object, ZoneId zone) {
        Invoice invoice = expect(event, object, Invoice.class);
        if (invoice.getSubscription() == null) {
            return new GatewayEvent.Acknowledged(event.getType(), "invoice is not tied to a subscription");
        }
        InvoiceLineItem.Period period = linePeriod(invoice);
        LocalDateTime paidAt = invoice.getStatusTransitions() != null
                ? toLocal(invoice.getStatusTransitions().getPaidAt(), zone)
                : null;

        return GatewayEvent.PaymentConfirmed.builder()
                .provider(PROVIDER)
                .providerSubscriptionId(invoice.getSubscription())
                .providerInvoiceId(invoice.getId())
                .providerTransactionId(invoice.getCharge() != null ? invoice.getCharge() : invoice.getId())
                .amountCents(invoice.getAmountPaid())
                .method(PaymentMethod.CREDIT_CARD)
                .periodStart(period != null ? toLocal(period.getStart(), zone) : null)
                .periodEnd(period != null ? toLocal(period.getEnd(), zone) : null)
                .paidAt(paidAt)
                .build();
    }

    private static GatewayEvent invoiceFailed(Event event, StripeObject object, ZoneId zone) {
        Invoice invoice = expect(event, object, Invoice.class);
        if (invoice.getSubscription() == null) {
            return new GatewayEvent.Acknowledged(event.getType(), "invoice is not tied to a subscription");
        }
        String reason = invoice.getLastFinalizationError() != null
                ? invoice.getLastFinalizationError().getMessage()
                : null;

        return GatewayEvent.PaymentFailed.builder()
                .provider(PROVIDER)
                .providerSubscriptionId(invoice.getSubscription())
                .providerInvoiceId(invoice.getId())
                .providerTransactionId(invoice.getCharge() != null ? invoice.getCharge() : invoice.getId())
                .amountCents(invoice.getAmountDue())
                .failureReason(reason != null ? reason : "Pagamento recusado")
                .recurring("subscription_cycle".equals(invoice.getBillingReason()))
                .build();
    }

    private static GatewayEvent subscriptionUpdated(Event event, StripeObject object, ZoneId zone) {
        Subscription subscription = expect(event, object, Subscription.class);
        String planCode = subscription.getMetadata() != null ? subscription.getMetadata().get("plan") : null;
        return new GatewayEvent.SubscriptionUpdated(PROVIDER, subscription.getId(),
                mapStatus(subscription.getStatus()), toLocal(subscription.getCurrentPeriodEnd(), zone), planCode);
    }

    private static GatewayEvent subscriptionDeleted(Event event, StripeObject object, ZoneId zone) {
        Subscription subscription = expect(event, object, Subscription.class);
        return new GatewayEvent.SubscriptionCanceled(PROVIDER, subscription.getId(),
                toLocal(subscription.getCanceledAt(), zone));
    }

    private static InvoiceLineItem.Period linePeriod(Invoice invoice) {
        if (invoice.getLines() == null || invoice.getLines().getData() == null
                || invoice.getLines().getData().isEmpty()) {
            return null;
        }
        return invoice.getLines().getData().get(0).getPeriod();
    }

    private static <T extends StripeObject> T expect(Event event, StripeObject object, Class<T> type) {
        if (!type.isInstance(object)) {
            throw new InvalidWebhookPayloadException("Stripe event " + event.getType() + " does not carry a "
                    + type.getSimpleName());
        }
        return type.cast(object);
    }

    private static LocalDateTime toLocal(Long epochSeconds, ZoneId zone) {
        return epochSeconds == null ? null : LocalDateTime.ofInstant(Instant.ofEpochSecond(epochSeconds), zone);
    }
}
