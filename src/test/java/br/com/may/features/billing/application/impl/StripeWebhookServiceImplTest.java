package br.com.may.features.billing.application.impl;

import br.com.may.features.billing.api.dto.WebhookReceipt;
import br.com.may.features.billing.application.BillingMetricsService;
import br.com.may.features.billing.application.GatewayEventDispatcher;
import br.com.may.features.billing.application.StripeProperties;
import br.com.may.features.billing.domain.event.GatewayEvent;
import br.com.may.features.billing.domain.exception.InvalidWebhookPayloadException;
import br.com.may.features.billing.domain.exception.WebhookAuthenticationException;
import br.com.may.features.billing.domain.model.BillingOutcome;
import br.com.may.features.billing.infra.gateway.stripe.StripeEventTranslator;
import com.stripe.Stripe;
import com.stripe.net.Webhook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StripeWebhookServiceImplTest {

    private static final String SECRET = "whsec_stripe_test";

    @Mock
    private GatewayEventDispatcher dispatcher;
    @Mock
    private BillingMetricsService metricsService;

    private StripeProperties stripeProperties;
    private StripeWebhookServiceImpl service;

    @BeforeEach
    void setUp() {
        stripeProperties = new StripeProperties();
        stripeProperties.setWebhookSecret(SECRET);
        Clock clock = Clock.systemUTC();
        service = new StripeWebhookServiceImpl(stripeProperties, new StripeEventTranslator(clock), dispatcher,
                metricsService, clock);
    }

    private static String sign(String payload) throws Exception {
        long timestamp = System.currentTimeMillis() / 1000L;
        String signature = Webhook.Util.computeHmacSha256(SECRET, timestamp + "." + payload);
        return "t=" + timestamp + ",v1=" + signature;
    }

    private static String invoicePaid() {
        return """
                {
                  "id": "evt_1",
                  "object": "event",
                  "api_version": "%s",
                  "type": "invoice.paid",
                  "data": {"object": {
                    "id": "in_1",
                    "object": "invoice",
                    "subscription": "sub_1",
                    "charge": "ch_1",
                    "amount_paid": 9700
                  }}
                }
                """.formatted(Stripe.API_VERSION);
    }

    @Test
    @DisplayName("a correctly signed invoice.paid is dispatched as a payment keyed by the invoice")
    void signedInvoicePaid() throws Exception {
        String payload = invoicePaid();
        when(dispatcher.dispatch(any())).thenReturn(BillingOutcome.ACTIVATED);

        WebhookReceipt receipt = service.process(payload, sign(payload));

        assertThat(receipt.status()).isEqualTo("activated");
        assertThat(receipt.eventId()).isEqualTo("evt_1");
        ArgumentCaptor<GatewayEvent> event = ArgumentCaptor.forClass(GatewayEvent.class);
        verify(dispatcher).dispatch(event.capture());
        GatewayEvent.PaymentConfirmed paid = (GatewayEvent.PaymentConfirmed) event.getValue();
        assertThat(paid.ledgerKey()).isEqualTo("in_1");
        assertThat(paid.providerSubscriptionId()).isEqualTo("sub_1");
    }

    @Test
    @DisplayName("a tampered body fails signature verification")
    void tampered() throws Exception {
        String signature = sign(invoicePaid());
        String tampered = invoicePaid().replace("9700", "1");

        assertThatThrownBy(() -> service.process(tampered, signature))
                .isInstanceOf(WebhookAuthenticationException.class);
        verify(metricsService).incrementWebhookRejected("stripe", "invalid_signature");
        verifyNoInteractions(dispatcher);
    }

    @Test
    @DisplayName("a missing signature header is rejected")
    void missingSignature() {
        assertThatThrownBy(() -> service.process(invoicePaid(), null))
                .isInstanceOf(WebhookAuthenticationException.class)
                .hasMessageContaining("Stripe-Signature");
    }

    @Test
    @DisplayName("without a configured secret every request is rejected")
    void notConfigured() {
        stripeProperties.setWebhookSecret("");

        assertThatThrownBy(() -> service.process(invoicePaid(), "t=1,v1=abc"))
                .isInstanceOf(WebhookAuthenticationException.class);
        verify(metricsService).incrementWebhookRejected("stripe", "not_configured");
    }

    @Test
    @DisplayName("a signed body that is not an event is an invalid payload")
    void signedGarbage() throws Exception {
        String payload = "not json at all";

        assertThatThrownBy(() -> service.process(payload, sign(payload)))
                .isInstanceOf(InvalidWebhookPayloadException.class);
    }

    @Test
    @DisplayName("a dispatch failure is reported in the receipt")
    void dispatchFailure() throws Exception {
        String payload = invoicePaid();
        when(dispatcher.dispatch(any())).thenThrow(new IllegalStateException("boom"));

        WebhookReceipt receipt = service.process(payload, sign(payload));

        assertThat(receipt.status()).isEqualTo("error");
        assertThat(receipt.error()).isEqualTo("boom");
        verify(metricsService).incrementWebhookFailed("stripe", "invoice.paid");
    }
}
