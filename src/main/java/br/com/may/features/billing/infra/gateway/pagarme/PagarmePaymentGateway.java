package br.com.may.features.billing.infra.gateway.pagarme;

import br.com.may.features.billing.application.PagarmeProperties;
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
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Supplier;

import static br.com.may.features.billing.infra.gateway.pagarme.PagarmePayloads.cents;
import static br.com.may.features.billing.infra.gateway.pagarme.PagarmePayloads.text;

/**
 * Pagar.me Core v5 adapter. Subscriptions are charged through the orders API: every billing period
 * is a closed order with a single credit card charge.
 */
@Slf4j
@Component
public class PagarmePaymentGateway implements SelectablePaymentGateway {

    private static final GatewayProvider PROVIDER = GatewayProvider.PAGARME;
    private static final String STATEMENT_DESCRIPTOR = "MAY";
    private static final int MAX_ERROR_SNIPPET = 300;

    private final RestClient http;
    private final PagarmeProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public PagarmePaymentGateway(@Qualifier("pagarmeRestClient") RestClient http,
                                 PagarmeProperties properties,
                                 ObjectMapper objectMapper,
                                 Clock clock) {
        this.http = http;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public GatewayProvider provider() {
        return PROVIDER;
    }

    @Override
    public String publicKey() {
        return properties.getPublicKey();
    }

    @Override
    public GatewayPaymentMethod tokenizeCard(CardData card) {
        if (card == null || card.number() == null || card.number().isBlank()) {
            throw new GatewayValidationException(PROVIDER, "Card number is required");
        }
        if (card.holderName() == null || card.holderName().isBlank() || card.cvv() == null) {
            throw new GatewayValidationException(PROVIDER, "Card holder name and CVV are required");
        }
        String publicKey = properties.getPublicKey();
        if (publicKey == null || !publicKey.startsWith("pk_")) {
            throw new GatewayRejectedException(PROVIDER, "Pagar.me public key is not configured", true);
        }

        Map<String, Object> cardBody = new LinkedHashMap<>();
        cardBody.put("number", card.number().replaceAll("\\s", ""));
        cardBody.put("holder_name", card.holderName().trim().toUpperCase(Locale.ROOT));
        cardBody.put("exp_month", String.format("%02d", card.expMonth()));
        cardBody.put("exp_year", String.valueOf(card.expYear()));
        cardBody.put("cvv", card.cvv());
        Map<String, Object> body = Map.of("type", "card", "card", cardBody);

        JsonNode response = execute("tokenizeCard", () -> http.post()
                .uri(uri -> uri.path("/tokens").queryParam("appId", publicKey).build())
                .contentType(MediaType.APPLICATION_JSON)
                .body(body)
                .retrieve()
                .body(String.class));

        String token = GatewayIds.require(PROVIDER, text(response, "id"), "token_", "token");
        JsonNode cardInfo = response.path("card");
        log.info("Tokenized card ending {}", card.lastFour());
        return new GatewayPaymentMethod(token, text(cardInfo, "brand"), text(cardInfo, "last_four_digits"));
    }

    @Override
    public GatewayCustomer createOrGetCustomer(CustomerRequest request) {
        if (request.existingCustomerRef() != null) {
            String customerId = GatewayIds.require(PROVIDER, request.existingCustomerRef(), "cus_", "customer_id");
            return new GatewayCustomer(customerId, request.email(), false);
        }

        String document = digits(request.document());
        if (document == null || (document.length() != 11 && document.length() != 14)) {
            throw new GatewayValidationException(PROVIDER, "CPF must have 11 digits and CNPJ 14 digits");
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", request.name());
        body.put("email", request.email());
        body.put("code", request.userId().toString());
        body.put("document", document);
        body.put("document_type", request.isCompany() ? "CNPJ" : "CPF");
        body.put("type", request.isCompany() ? "company" : "individual");
        String phone = digits(request.phone());
        if (phone != null && phone.length() >= 10) {
            body.put("phones", Map.of("mobile_phone", Map.of(
                    "country_code", "55",
                    "area_code", phone.substring(0, 2),
                    "number", phone.substring(2))));
        }
        if (request.address() != null) {
            CustomerRequest.Address address = request.address();
            Map<String, Object> addressBody = new LinkedHashMap<>();
            addressBody.put("line_1", address.line1());
            if (address.line2() != null) {
                addressBody.put("line_2", address.line2());
            }
            addressBody.put("zip_code", digits(address.zipCode()));
            addressBody.put("city", address.city());
            addressBody.put("state", address.state());
            addressBody.put("country", address.country() != null ? address.country() : "BR");
            body.put("address", addressBody);
        }

        Consumer<HttpHeaders> auth = authorization();
        JsonNode response = execute("createCustomer", () -> http.post()
                .uri("/customers")
                .headers(auth)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body)
                .retrieve()
                .body(String.class));

        String customerId = GatewayIds.require(PROVIDER, text(response, "id"), "cus_", "customer_id");
        log.info("Created Pagar.me customer {} for user {}", customerId, request.userId());
        return new GatewayCustomer(customerId, request.email(), true);
    }

    @Override
    public GatewayPaymentMethod attachPaymentMethod(String customerRef, String tokenRef) {
        String customerId = GatewayIds.require(PROVIDER, customerRef, "cus_", "customer_id");
        String token = GatewayIds.require(PROVIDER, tokenRef, "token_", "card_token");

        Consumer<HttpHeaders> auth = authorization();
        JsonNode card = execute("attachCard", () -> http.post()
                .uri("/customers/{customerId}/cards", customerId)
                .headers(auth)
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("token", token))
                .retrieve()
                .body(String.class));

        String cardId = GatewayIds.require(PROVIDER, text(card, "id"), "card_", "card_id");
        log.info("Attached card {} to customer {}", cardId, customerId);
        return new GatewayPaymentMethod(cardId, text(card, "brand"), text(card, "last_four_digits"));
    }

    @Override
    public Optional<GatewayPaymentMethod> findDefaultPaymentMethod(String customerRef) {
        String customerId = GatewayIds.require(PROVIDER, customerRef, "cus_", "customer_id");

        Consumer<HttpHeaders> auth = authorization();
        JsonNode response = execute("listCards", () -> http.get()
                .uri("/customers/{customerId}/cards", customerId)
                .headers(auth)
                .retrieve()
                .body(String.class));

        JsonNode chosen = null;
        for (JsonNode card : response.path("data")) {
            if (chosen == null) {
                chosen = card;
            }
            if ("active".equals(text(card, "status"))) {
                chosen = card;
                break;
            }
        }
        if (chosen == null || text(chosen, "id") == null) {
            return Optional.empty();
        }
        return Optional.of(new GatewayPaymentMethod(
                text(chosen, "id"), text(chosen, "brand"), text(chosen, "last_four_digits")));
    }

    @Override
    public GatewaySubscription createSubscription(GatewaySubscriptionRequest request) {
        String customerId = GatewayIds.require(PROVIDER, request.customerRef(), "cus_", "customer_id");
        String cardId = GatewayIds.require(PROVIDER, request.paymentMethodRef(), "card_", "card_id");
        long amount = GatewayIds.requireAmount(PROVIDER, request.amountCents());
        if (request.planCode() == null || request.planCode().isBlank() || request.cycle() == null) {
            throw new GatewayValidationException(PROVIDER, "Plan code and billing cycle are required");
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        if (request.metadata() != null) {
            metadata.putAll(request.metadata());
        }
        metadata.put("user_id", request.userId().toString());
        metadata.put("plan", request.planCode());
        metadata.put("billing_cycle", request.cycle().apiValue());

        Map<String, Object> item = new LinkedHashMap<>();
        // an item without a code is refused with HTTP 412
        item.put("code", request.planCode() + "_" + request.cycle().apiValue());
        item.put("amount", amount);
        item.put("description", request.planName() + " (" + request.cycle().apiValue() + ")");
        item.put("quantity", 1);

        Map<String, Object> creditCard = new LinkedHashMap<>();
        creditCard.put("installments", 1);
        creditCard.put("statement_descriptor", STATEMENT_DESCRIPTOR);
        creditCard.put("card_id", cardId);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("customer_id", customerId);
        body.put("items", List.of(item));
        body.put("payments", List.of(Map.of("payment_method", "credit_card", "credit_card", creditCard)));
        body.put("closed", true);
        body.put("metadata", metadata);

        // retries of this call must not create a second order
        String idempotencyKey = UUID.randomUUID().toString();
        Consumer<HttpHeaders> auth = authorization();
        JsonNode order = execute("createOrder", () -> http.post()
                .uri("/orders")
                .headers(auth)
                .header("Idempotency-Key", idempotencyKey)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body)
                .retrieve()
                .body(String.class));

        GatewaySubscription result = fromOrder(order, request.cycle());
        log.info("Pagar.me order {} for user {} finished with status {} (charge {})",
                result.orderRef(), request.userId(), result.rawStatus(), result.chargeRef());
        return result;
    }

    @Override
    public void cancelSubscription(String subscriptionRef) {
        if (GatewayIds.hasPrefix(subscriptionRef, "or_")) {
            log.info("Order {} is a one-off charge; nothing to cancel at Pagar.me", subscriptionRef);
            return;
        }
        String subscriptionId = GatewayIds.require(PROVIDER, subscriptionRef, "sub_", "subscription_id");

        Consumer<HttpHeaders> auth = authorization();
        execute("cancelSubscription", () -> http.delete()
                .uri("/subscriptions/{subscriptionId}", subscriptionId)
                .headers(auth)
                .retrieve()
                .body(String.class));
        log.info("Canceled Pagar.me subscription {}", subscriptionId);
    }

    @Override
    public GatewaySubscription getStatus(String subscriptionRef) {
        if (GatewayIds.hasPrefix(subscriptionRef, "or_")) {
            Consumer<HttpHeaders> orderAuth = authorization();
            JsonNode order = execute("getOrder", () -> http.get()
                    .uri("/orders/{orderId}", subscriptionRef)
                    .headers(orderAuth)
                    .retrieve()
                    .body(String.class));
            return fromOrder(order, null);
        }

        String subscriptionId = GatewayIds.require(PROVIDER, subscriptionRef, "sub_", "subscription_id");
        Consumer<HttpHeaders> auth = authorization();
        JsonNode subscription = execute("getSubscription", () -> http.get()
                .uri("/subscriptions/{subscriptionId}", subscriptionId)
                .headers(auth)
                .retrieve()
                .body(String.class));

        String rawStatus = text(subscription, "status");
        JsonNode cycle = subscription.path("current_cycle");
        return GatewaySubscription.builder()
                .provider(PROVIDER)
                .subscriptionRef(subscriptionId)
                .status(mapSubscriptionStatus(rawStatus))
                .rawStatus(rawStatus)
                .periodStart(PagarmePayloads.dateTime(cycle, "start_at", clock.getZone()))
                .periodEnd(PagarmePayloads.dateTime(cycle, "end_at", clock.getZone()))
                .build();
    }

    private GatewaySubscription fromOrder(JsonNode order, BillingCycle cycle) {
        String orderId = GatewayIds.require(PROVIDER, text(order, "id"), "or_", "order_id");
        JsonNode charge = PagarmePayloads.firstCharge(order);
        String orderStatus = text(order, "status");
        String chargeStatus = text(charge, "status");
        GatewayPaymentStatus status = mapOrderStatus(orderStatus, chargeStatus);

        LocalDateTime paidAt = PagarmePayloads.dateTime(charge, "paid_at", clock.getZone());
        LocalDateTime start = status == GatewayPaymentStatus.PAID
                ? (paidAt != null ? paidAt : LocalDateTime.now(clock))
                : null;
        LocalDateTime end = start != null && cycle != null ? cycle.advance(start) : null;
        Long amount = charge != null && cents(charge, "amount") != null ? cents(charge, "amount") : cents(order, "amount");
        boolean failed = status == GatewayPaymentStatus.FAILED;

        return GatewaySubscription.builder()
                .provider(PROVIDER)
                .subscriptionRef(text(charge, "subscription_id"))
                .orderRef(orderId)
                .status(status)
                .rawStatus(chargeStatus != null ? chargeStatus : orderStatus)
                .chargeRef(text(charge, "id"))
                .amountCents(amount)
                .periodStart(start)
                .periodEnd(end)
                .failureReason(failed ? PagarmePayloads.failureReason(charge) : null)
                .integrationError(failed && PagarmePayloads.isIntegrationError(charge))
                .build();
    }

    /**
     * The charge status wins over the order status; a closed order is not proof of payment.
     */
    static GatewayPaymentStatus mapOrderStatus(String orderStatus, String chargeStatus) {
        if ("paid".equals(chargeStatus) || "paid".equals(orderStatus)) {
            return GatewayPaymentStatus.PAID;
        }
        if ("failed".equals(chargeStatus) || "failed".equals(orderStatus)) {
            return GatewayPaymentStatus.FAILED;
        }
        if ("canceled".equals(chargeStatus) || "canceled".equals(orderStatus)) {
            return GatewayPaymentStatus.CANCELED;
        }
        return GatewayPaymentStatus.PENDING;
    }

    private static GatewayPaymentStatus mapSubscriptionStatus(String status) {
        if (status == null) {
            return GatewayPaymentStatus.PENDING;
        }
        return switch (status) {
            case "active" -> GatewayPaymentStatus.PAID;
            case "canceled" -> GatewayPaymentStatus.CANCELED;
            case "failed" -> GatewayPaymentStatus.FAILED;
            default -> GatewayPaymentStatus.PENDING;
        };
    }

    private Consumer<HttpHeaders> authorization() {
        String secretKey = properties.getSecretKey();
        if (secretKey == null || secretKey.isBlank()) {
            throw new GatewayRejectedException(PROVIDER, "Pagar.me secret key is not configured", true);
        }
        return headers -> headers.setBasicAuth(secretKey, "");
    }

    private JsonNode execute(String operation, Supplier<String> call) {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return parse(operation, call.get());
            } catch (RestClientException e) {
                PaymentGatewayException failure = translate(operation, e);
                if (!failure.isRetryable() || attempt > properties.getMaxRetries()) {
                    log.warn("Pagar.me {} failed after {} attempt(s): {}", operation, attempt, failure.getMessage());
                    throw failure;
                }
                log.warn("Pagar.me {} failed on attempt {}: {}; retrying", operation, attempt, failure.getMessage());
                backoff(attempt);
            }
        }
    }

    private JsonNode parse(String operation, String body) {
        if (body == null || body.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new GatewayRejectedException(PROVIDER,
                    "Pagar.me " + operation + " returned a body that is not JSON", true, null, e);
        }
    }

    private PaymentGatewayException translate(String operation, RestClientException e) {
        if (e instanceof RestClientResponseException response) {
            int status = response.getStatusCode().value();
            String detail = errorDetail(response.getResponseBodyAsString());
            String message = "Pagar.me " + operation + " failed with HTTP " + status
                    + (detail != null ? ": " + detail : "");
            if (status >= 500 || status == 429) {
                return new GatewayNetworkException(PROVIDER, message, e);
            }
            boolean integrationError = status == 401 || status == 403 || status == 412;
            return new GatewayRejectedException(PROVIDER, message, integrationError, status, e);
        }
        if (e instanceof ResourceAccessException) {
            return new GatewayNetworkException(PROVIDER, "Pagar.me " + operation + " unreachable: " + e.getMessage(), e);
        }
        return new GatewayRejectedException(PROVIDER, "Pagar.me " + operation + " failed: " + e.getMessage(), true, null, e);
    }

    private String errorDetail(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            String message = text(root, "message");
            JsonNode errors = root.path("errors");
            if (errors.isObject() && errors.size() > 0) {
                JsonNode first = errors.elements().next();
                String firstError = first.isArray() && !first.isEmpty() ? first.get(0).asText() : first.asText();
                return message != null ? message + " (" + firstError + ")" : firstError;
            }
            return message;
        } catch (JsonProcessingException e) {
            return body.length() <= MAX_ERROR_SNIPPET ? body : body.substring(0, MAX_ERROR_SNIPPET) + "...";
        }
    }

    private void backoff(int attempt) {
        long millis = properties.getRetryBackoff().toMillis() * attempt;
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GatewayNetworkException(PROVIDER, "Interrupted while waiting to retry", e);
        }
    }

    private static String digits(String value) {
        if (value == null) {
            return null;
        }
        String digits = value.replaceAll("\\D", "");
        return digits.isEmpty() ? null : digits;
    }
}
