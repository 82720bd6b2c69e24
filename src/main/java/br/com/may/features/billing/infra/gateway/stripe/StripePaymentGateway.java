package br.com.may.features.billing.infra.gateway.stripe;

import br.com.may.features.billing.application.StripeProperties;
import br.com.may.features.billing.application.gateway.CardData;
import br.com.may.features.billing.application.gateway.CustomerRequest;
import br.com.may.features.billing.application.gateway.GatewayCustomer;
import br.com.may.features.billing.application.gateway.GatewayIds;
import br.com.may.features.billing.application.gateway.GatewayPaymentMethod;
import br.com.may.features.billing.application.gateway.GatewayPaymentStatus;
import br.com.may.features.billing.application.gateway.GatewaySubscription;
import br.com.may.features.billing.application.gateway.GatewaySubscriptionRequest;
import br.com.may.features.billing.application.gateway.SelectablePaymentGateway;
import br.com.may.features.billing.domain.exception.GatewayNetworkException;
import br.com.may.features.billing.domain.exception.GatewayRejectedException;
import br.com.may.features.billing.domain.exception.GatewayValidationException;
import br.com.may.features.billing.domain.exception.PaymentGatewayException;
import br.com.may.features.billing.domain.model.BillingCycle;
import br.com.may.features.billing.domain.model.GatewayProvider;
import com.stripe.StripeClient;
import com.stripe.exception.ApiConnectionException;
import com.stripe.exception.CardException;
import com.stripe.exception.RateLimitException;
import com.stripe.exception.StripeException;
import com.stripe.model.Customer;
import com.stripe.model.Invoice;
import com.stripe.model.PaymentMethod;
import com.stripe.model.Subscription;
import com.stripe.param.CustomerCreateParams;
import com.stripe.param.CustomerUpdateParams;
import com.stripe.param.PaymentMethodAttachParams;
import com.stripe.param.SubscriptionCreateParams;
import com.stripe.param.SubscriptionRetrieveParams;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Stripe adapter for the invoice-based model: Stripe owns the billing schedule and reports each
 * paid invoice through webhooks.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StripePaymentGateway implements SelectablePaymentGateway {

    private static final GatewayProvider PROVIDER = GatewayProvider.STRIPE;

    private final ObjectProvider<StripeClient> stripeClientProvider;
    private final StripeProperties properties;
    private final Clock clock;

    @FunctionalInterface
    private interface StripeCall<T> {
        T execute(StripeClient client) throws StripeException;
    }

    @Override
    public GatewayProvider provider() {
        return PROVIDER;
    }

    @Override
    public String publicKey() {
        return properties.getPublishableKey();
    }

    @Override
    public GatewayPaymentMethod tokenizeCard(CardData card) {
        throw new GatewayValidationException(PROVIDER,
                "Stripe cards are collected with Stripe.js; send the resulting payment method id instead");
    }

    @Override
    public GatewayCustomer createOrGetCustomer(CustomerRequest request) {
        if (request.existingCustomerRef() != null) {
            String customerId = GatewayIds.require(PROVIDER, request.existingCustomerRef(), "cus_", "customer_id");
            Customer existing = call("retrieveCustomer", client -> client.customers().retrieve(customerId));
            if (!Boolean.TRUE.equals(existing.getDeleted())) {
                return new GatewayCustomer(existing.getId(), existing.getEmail(), false);
            }
            log.warn("Stripe customer {} was deleted; creating a new one for user {}", customerId, request.userId());
        }

        CustomerCreateParams params = CustomerCreateParams.builder()
                .setEmail(request.email())
                .setName(request.name())
                .putMetadata("userId", request.userId().toString())
                .build();
        Customer customer = call("createCustomer", client -> client.customers().create(params));
        log.info("Created Stripe customer {} for user {}", customer.getId(), request.userId());
        return new GatewayCustomer(customer.getId(), customer.getEmail(), true);
    }

    @Override
    public GatewayPaymentMethod attachPaymentMethod(String customerRef, String tokenRef) {
        String customerId = GatewayIds.require(PROVIDER, customerRef, "cus_", "customer_id");
        String paymentMethodId = GatewayIds.require(PROVIDER, tokenRef, "pm_", "payment_method");

        PaymentMethod paymentMethod = call("attachPaymentMethod", client -> client.paymentMethods().attach(
                paymentMethodId, PaymentMethodAttachParams.builder().setCustomer(customerId).build()));

        CustomerUpdateParams makeDefault = CustomerUpdateParams.builder()
                .setInvoiceSettings(CustomerUpdateParams.InvoiceSettings.builder()
                        .setDefaultPaymentMethod(paymentMethodId)
                        .build())
                .build();
        call("setDefaultPaymentMethod", client -> client.customers().update(customerId, makeDefault));

        PaymentMethod.Card card = paymentMethod.getCard();
        log.info("Attached payment method {} to Stripe customer {}", paymentMethodId, customerId);
        return new GatewayPaymentMethod(paymentMethodId,
                card != null ? card.getBrand() : null,
                card != null ? card.getLast4() : null);
    }

    @Override
    public Optional<GatewayPaymentMethod> findDefaultPaymentMethod(String customerRef) {
        String customerId = GatewayIds.require(PROVIDER, customerRef, "cus_", "customer_id");
        Customer customer = call("retrieveCustomer", client -> client.customers().retrieve(customerId));
        if (customer.getInvoiceSettings() == null
                || !StringUtils.hasText(customer.getInvoiceSettings().getDefaultPaymentMethod())) {
            return Optional.empty();
        }
        return Optional.of(new GatewayPaymentMethod(
                customer.getInvoiceSettings().getDefaultPaymentMethod(), null, null));
    }

    @Override
    public GatewaySubscription createSubscription(GatewaySubscriptionRequest request) {
        String customerId = GatewayIds.require(PROVIDER, request.customerRef(), "cus_", "customer_id");
        String paymentMethodId = GatewayIds.require(PROVIDER, request.paymentMethodRef(), "pm_", "payment_method");
        GatewayIds.requireAmount(PROVIDER, request.amountCents());
        String priceId = priceFor(request.planCode(), request.cycle());

        SubscriptionCreateParams.Builder params = SubscriptionCreateParams.builder()
                .setCustomer(customerId)
                .addItem(SubscriptionCreateParams.Item.builder().setPrice(priceId).build())
                .setDefaultPaymentMethod(paymentMethodId)
                .putMetadata("userId", request.userId().toString())
                .putMetadata("plan", request.planCode())
                .putMetadata("billing_cycle", request.cycle().apiValue())
                .addExpand("latest_invoice");
        if (request.metadata() != null) {
            params.putAllMetadata(request.metadata());
        }
        SubscriptionCreateParams createParams = params.build();

        Subscription subscription = call("createSubscription", client -> client.subscriptions().create(createParams));
        GatewaySubscription result = fromSubscription(subscription);
        log.info("Stripe subscription {} for user {} created with status {}",
                subscription.getId(), request.userId(), subscription.getStatus());
        return result;
    }

    @Override
    public void cancelSubscription(String subscriptionRef) {
        String subscriptionId = GatewayIds.require(PROVIDER, subscriptionRef, "sub_", "subscription_id");
        call("cancelSubscription", client -> client.subscriptions().cancel(subscriptionId));
        log.info("Canceled Stripe subscription {}", subscriptionId);
    }

    @Override
    public GatewaySubscription getStatus(String subscriptionRef) {
        String subscriptionId = GatewayIds.require(PROVIDER, subscriptionRef, "sub_", "subscription_id");
        SubscriptionRetrieveParams params = SubscriptionRetrieveParams.builder()
                .addExpand("latest_invoice")
                .build();
        Subscription subscription = call("retrieveSubscription",
                client -> client.subscriptions().retrieve(subscriptionId, params));
        return fromSubscription(subscription);
    }

    private GatewaySubscription fromSubscription(Subscription subscription) {
        Invoice invoice = subscription.getLatestInvoiceObject();
        String invoiceId = invoice != null ? invoice.getId() : subscription.getLatestInvoice();
        String invoiceStatus = invoice != null ? invoice.getStatus() : null;
        GatewayPaymentStatus status = mapStatus(subscription.getStatus(), invoiceStatus);

        Long amount = null;
        if (invoice != null) {
            amount = status == GatewayPaymentStatus.PAID ? invoice.getAmountPaid() : invoice.getAmountDue();
        }
        return GatewaySubscription.builder()
                .provider(PROVIDER)
                .subscriptionRef(subscription.getId())
                .status(status)
                .rawStatus(subscription.getStatus())
                .invoiceRef(invoiceId)
                .chargeRef(invoice != null ? invoice.getCharge() : null)
                .amountCents(amount)
                .periodStart(toLocal(subscription.getCurrentPeriodStart()))
                .periodEnd(toLocal(subscription.getCurrentPeriodEnd()))
                .failureReason(status == GatewayPaymentStatus.FAILED ? "Pagamento recusado" : null)
                .build();
    }

    static GatewayPaymentStatus mapStatus(String subscriptionStatus, String invoiceStatus) {
        if ("paid".equals(invoiceStatus)) {
            return GatewayPaymentStatus.PAID;
        }
        if ("canceled".equals(subscriptionStatus) || "incomplete_expired".equals(subscriptionStatus)) {
            return GatewayPaymentStatus.CANCELED;
        }
        if ("past_due".equals(subscriptionStatus) || "unpaid".equals(subscriptionStatus)
                || "uncollectible".equals(invoiceStatus)) {
            return GatewayPaymentStatus.FAILED;
        }
        return GatewayPaymentStatus.PENDING;
    }

    private String priceFor(String planCode, BillingCycle cycle) {
        if (planCode == null || cycle == null) {
            throw new GatewayValidationException(PROVIDER, "Plan code and billing cycle are required");
        }
        // Stripe has no six-month interval
        BillingCycle priced = cycle == BillingCycle.SEMIANNUAL ? BillingCycle.ANNUAL : cycle;
        String key = planCode + "-" + priced.apiValue();
        String priceId = properties.getPrices().get(key);
        if (!StringUtils.hasText(priceId)) {
            throw new GatewayRejectedException(PROVIDER, "No Stripe price configured for " + key, true);
        }
        return priceId;
    }

    private LocalDateTime toLocal(Long epochSeconds) {
        return epochSeconds == null ? null : LocalDateTime.ofInstant(Instant.ofEpochSecond(epochSeconds), clock.getZone());
    }

    private <T> T call(String operation, StripeCall<T> call) {
        StripeClient client = stripeClientProvider.getIfAvailable();
        if (client == null) {
            throw new GatewayRejectedException(PROVIDER, "Stripe is not configured (stripe.secret-key)", true);
        }
        try {
            return call.execute(client);
        } catch (StripeException e) {
            PaymentGatewayException failure = translate(operation, e);
            log.warn("Stripe {} failed (requestId={}, code={}): {}", operation, e.getRequestId(), e.getCode(), e.getMessage());
            throw failure;
        }
    }

    static PaymentGatewayException translate(String operation, StripeException e) {
        String message = "Stripe " + operation + " failed: " + e.getMessage();
        if (e instanceof ApiConnectionException || e instanceof RateLimitException) {
            return new GatewayNetworkException(PROVIDER, message, e);
        }
        Integer status = e.getStatusCode();
        if (status != null && status >= 500) {
            return new GatewayNetworkException(PROVIDER, message, e);
        }
        // only a card error is the customer's problem; bad keys, permissions and invalid requests are ours
        boolean integrationError = !(e instanceof CardException);
        String customerMessage = !integrationError && e.getStripeError() != null
                ? e.getStripeError().getMessage()
                : null;
        return new GatewayRejectedException(PROVIDER, message, integrationError, status, customerMessage, e);
    }
}
