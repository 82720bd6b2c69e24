package br.com.may.features.billing.application.impl;

import br.com.may.features.billing.api.dto.AddressRequest;
import br.com.may.features.billing.api.dto.BillingInfoRequest;
import br.com.may.features.billing.api.dto.CancelSubscriptionResponse;
import br.com.may.features.billing.api.dto.ConfirmCheckoutRequest;
import br.com.may.features.billing.api.dto.ConfirmCheckoutResponse;
import br.com.may.features.billing.api.dto.ProcessPaymentRequest;
import br.com.may.features.billing.api.dto.ProcessPaymentResponse;
import br.com.may.features.billing.api.dto.StartSubscriptionRequest;
import br.com.may.features.billing.api.dto.StartSubscriptionResponse;
import br.com.may.features.billing.api.dto.SubscriptionStatusResponse;
import br.com.may.features.billing.api.dto.TrialEligibilityResponse;
import br.com.may.features.billing.application.BillingNotifications;
import br.com.may.features.billing.application.BillingProperties;
import br.com.may.features.billing.application.PaymentLedgerService;
import br.com.may.features.billing.application.PlanCatalog;
import br.com.may.features.billing.application.gateway.GatewayCustomer;
import br.com.may.features.billing.application.gateway.GatewayPaymentMethod;
import br.com.may.features.billing.application.gateway.GatewayPaymentStatus;
import br.com.may.features.billing.application.gateway.GatewaySubscription;
import br.com.may.features.billing.application.gateway.GatewaySubscriptionRequest;
import br.com.may.features.billing.application.gateway.PaymentGateway;
import br.com.may.features.billing.application.gateway.PaymentGatewayResolver;
import br.com.may.features.billing.domain.event.GatewayEvent;
import br.com.may.features.billing.domain.event.SubscriptionCanceledEvent;
import br.com.may.features.billing.domain.exception.GatewayNetworkException;
import br.com.may.features.billing.domain.exception.GatewayRejectedException;
import br.com.may.features.billing.domain.exception.GatewayValidationException;
import br.com.may.features.billing.domain.exception.ReactivationNotAllowedException;
import br.com.may.features.billing.domain.exception.SubscriptionAlreadyActiveException;
import br.com.may.features.billing.domain.exception.SubscriptionAlreadyCanceledException;
import br.com.may.features.billing.domain.exception.TrialAlreadyUsedException;
import br.com.may.features.billing.domain.model.BillingCycle;
import br.com.may.features.billing.domain.model.BillingOutcome;
import br.com.may.features.billing.domain.model.GatewayProvider;
import br.com.may.features.billing.domain.model.Payment;
import br.com.may.features.billing.domain.model.PaymentStatus;
import br.com.may.features.billing.domain.model.Subscription;
import br.com.may.features.billing.domain.model.SubscriptionStatus;
import br.com.may.features.billing.infra.mapping.PaymentMapper;
import br.com.may.features.billing.infra.mapping.SubscriptionMapper;
import br.com.may.features.billing.infra.repository.PaymentRepository;
import br.com.may.features.billing.infra.repository.SubscriptionRepository;
import br.com.may.features.notification.application.NotificationService;
import br.com.may.features.notification.domain.model.NotificationKind;
import br.com.may.features.user.domain.model.User;
import br.com.may.features.user.domain.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SubscriptionServiceImplTest {

    private static final Instant NOW_INSTANT = Instant.parse("2025-03-10T12:00:00Z");
    private static final LocalDateTime NOW = LocalDateTime.ofInstant(NOW_INSTANT, ZoneOffset.UTC);

    @Mock
    private SubscriptionRepository subscriptionRepository;
    @Mock
    private PaymentRepository paymentRepository;
    @Mock
    private UserRepository userRepository;
    @Mock
    private PaymentGateway paymentGateway;
    @Mock
    private PaymentGatewayResolver gatewayResolver;
    @Mock
    private PaymentLedgerService ledger;
    @Mock
    private NotificationService notificationService;
    @Mock
    private ApplicationEventPublisher eventPublisher;
    @Mock
    private TransactionTemplate transactionTemplate;
    @Mock
    private SubscriptionMapper subscriptionMapper;
    @Mock
    private PaymentMapper paymentMapper;

    private SubscriptionServiceImpl service;
    private final UUID userId = UUID.randomUUID();
    private User user;

    @BeforeEach
    void setUp() {
        service = new SubscriptionServiceImpl(subscriptionRepository, paymentRepository, userRepository,
                paymentGateway, gatewayResolver, ledger, notificationService, new PlanCatalog(),
                new BillingProperties(), eventPublisher, transactionTemplate, subscriptionMapper, paymentMapper,
                Clock.fixed(NOW_INSTANT, ZoneOffset.UTC));

        user = new User();
        user.setId(userId);
        user.setEmail("ana@example.com");
        when(userRepository.findById(userId)).thenReturn(Optional.of(user));
        when(subscriptionRepository.save(any(Subscription.class))).thenAnswer(inv -> {
            Subscription saved = inv.getArgument(0);
            if (saved.getId() == null) {
                saved.setId(UUID.randomUUID());
            }
            return saved;
        });
        when(transactionTemplate.execute(any()))
                .thenAnswer(inv -> inv.<TransactionCallback<?>>getArgument(0).doInTransaction(null));
        doAnswer(inv -> {
            inv.<Consumer<TransactionStatus>>getArgument(0).accept(null);
            return null;
        }).when(transactionTemplate).executeWithoutResult(any());
        when(paymentGateway.provider()).thenReturn(GatewayProvider.PAGARME);
        when(paymentGateway.publicKey()).thenReturn("pk_test_may");
        when(gatewayResolver.forProvider(GatewayProvider.PAGARME)).thenReturn(paymentGateway);
    }

    private Subscription stored(SubscriptionStatus... path) {
        Subscription subscription = Subscription.pending(userId, "pro", BillingCycle.MONTHLY, new BigDecimal("97.00"));
        subscription.setId(UUID.randomUUID());
        for (SubscriptionStatus status : path) {
            subscription.transitionTo(status, NOW.minusDays(1));
        }
        when(subscriptionRepository.findByUserId(userId)).thenReturn(Optional.of(subscription));
        when(subscriptionRepository.findById(subscription.getId())).thenReturn(Optional.of(subscription));
        return subscription;
    }

    private static ProcessPaymentRequest payment(String cardToken, String cardId, String document) {
        return new ProcessPaymentRequest("pro", "monthly", cardToken, cardId,
                new BillingInfoRequest("Ana Souza", "ana@example.com", document, "(11) 98765-4321",
                        new AddressRequest("Rua A, 10", null, "01310-100", "São Paulo", "SP", null)));
    }

    private static GatewaySubscription order(GatewayPaymentStatus status, String chargeRef) {
        return GatewaySubscription.builder()
                .provider(GatewayProvider.PAGARME)
                .orderRef("or_1")
                .chargeRef(chargeRef)
                .status(status)
                .amountCents(9700L)
                .periodStart(status == GatewayPaymentStatus.PAID ? NOW : null)
                .periodEnd(status == GatewayPaymentStatus.PAID ? NOW.plusMonths(1) : null)
                .failureReason(status == GatewayPaymentStatus.FAILED ? "Cartão recusado" : null)
                .build();
    }

    @Nested
    @DisplayName("start")
    class Start {

        @Test
        @DisplayName("a paid plan creates a pending row and tells the client which gateway to use")
        void paidPlan() {
            StartSubscriptionResponse response = service.start(userId, new StartSubscriptionRequest("pro", "anual"));

            assertThat(response.status()).isEqualTo("pending");
            assertThat(response.plan()).isEqualTo("pro");
            assertThat(response.billingCycle()).isEqualTo("annual");
            assertThat(response.amount()).isEqualByComparingTo("970.00");
            assertThat(response.gateway()).isEqualTo("pagarme");
            assertThat(response.publicKey()).isEqualTo("pk_test_may");
            assertThat(response.subscriptionId()).isNotNull();
        }

        @Test
        @DisplayName("the trial starts immediately and is marked as used")
        void trial() {
            StartSubscriptionResponse response = service.start(userId, new StartSubscriptionRequest("trial", null));

            assertThat(response.status()).isEqualTo("trial");
            assertThat(response.amount()).isEqualByComparingTo("0");
            assertThat(response.trialEndsAt()).isEqualTo(NOW.plusDays(7));
            assertThat(user.isTrialUsed()).isTrue();
            assertThat(user.getTrialStartedAt()).isEqualTo(NOW);
            verify(notificationService).notifyOnce(eq(userId), eq(BillingNotifications.WELCOME), anyString(),
                    eq(NotificationKind.SUCCESS), anyInt());
        }

        @Test
        @DisplayName("a second trial is refused even while a subscription is live")
        void trialUsed() {
            user.setTrialUsed(true);
            stored(SubscriptionStatus.ACTIVE);

            assertThatThrownBy(() -> service.start(userId, new StartSubscriptionRequest("trial", null)))
                    .isInstanceOf(TrialAlreadyUsedException.class);
        }

        @Test
        @DisplayName("a live subscription blocks a new checkout")
        void alreadyLive() {
            stored(SubscriptionStatus.ACTIVE, SubscriptionStatus.PAST_DUE);

            assertThatThrownBy(() -> service.start(userId, new StartSubscriptionRequest("pro", "monthly")))
                    .isInstanceOf(SubscriptionAlreadyActiveException.class);
        }

        @Test
        @DisplayName("a plan with negotiated pricing cannot be bought")
        void customPricing() {
            assertThatThrownBy(() -> service.start(userId, new StartSubscriptionRequest("accountant", "monthly")))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("an expired row is reused for the new lifecycle")
        void reusesClosedRow() {
            Subscription expired = stored(SubscriptionStatus.EXPIRED);
            UUID rowId = expired.getId();

            StartSubscriptionResponse response = service.start(userId, new StartSubscriptionRequest("business", "monthly"));

            assertThat(response.subscriptionId()).isEqualTo(rowId);
            assertThat(expired.getStatus()).isEqualTo(SubscriptionStatus.PENDING);
            assertThat(expired.getPlanCode()).isEqualTo("business");
        }

        @Test
        @DisplayName("a checkout on a canceled row starts a new lifecycle even inside the paid period")
        void canceledRowStartsOver() {
            Subscription canceled = stored(SubscriptionStatus.ACTIVE);
            canceled.applyPaidPeriod(NOW.minusDays(20), NOW.plusDays(10), NOW.plusDays(10));
            canceled.setProviderOrderId("or_old");
            canceled.transitionTo(SubscriptionStatus.CANCELED, NOW.minusDays(1));

            service.start(userId, new StartSubscriptionRequest("pro", "monthly"));

            assertThat(canceled.getStatus()).isEqualTo(SubscriptionStatus.PENDING);
            assertThat(canceled.getProviderOrderId()).isNull();
            assertThat(canceled.getCanceledAt()).isNull();
        }
    }

    @Nested
    @DisplayName("processPayment")
    class ProcessPayment {

        @BeforeEach
        void gateway() {
            when(paymentGateway.createOrGetCustomer(any())).thenReturn(new GatewayCustomer("cus_1", "ana@example.com", true));
            when(paymentGateway.attachPaymentMethod("cus_1", "token_abc"))
                    .thenReturn(new GatewayPaymentMethod("card_1", "visa", "1111"));
        }

        @Test
        @DisplayName("a captured charge goes through the ledger")
        void paid() {
            Subscription subscription = stored();
            when(paymentGateway.createSubscription(any())).thenReturn(order(GatewayPaymentStatus.PAID, "ch_1"));
            when(ledger.confirmPayment(any())).thenReturn(BillingOutcome.ACTIVATED);

            ProcessPaymentResponse response = service.processPayment(userId, payment("token_abc", null, "123.456.789-09"));

            assertThat(response.message()).isEqualTo("Pagamento confirmado");
            assertThat(response.providerReference()).isEqualTo("or_1");
            assertThat(subscription.getProviderOrderId()).isEqualTo("or_1");
            assertThat(subscription.getProvider()).isEqualTo(GatewayProvider.PAGARME);
            assertThat(user.getProviderCustomerId()).isEqualTo("cus_1");

            ArgumentCaptor<GatewaySubscriptionRequest> request = ArgumentCaptor.forClass(GatewaySubscriptionRequest.class);
            verify(paymentGateway).createSubscription(request.capture());
            assertThat(request.getValue().paymentMethodRef()).isEqualTo("card_1");
            assertThat(request.getValue().amountCents()).isEqualTo(9700L);
            assertThat(request.getValue().metadata()).containsEntry("subscription_id", subscription.getId().toString());

            ArgumentCaptor<GatewayEvent.PaymentConfirmed> confirmed =
                    ArgumentCaptor.forClass(GatewayEvent.PaymentConfirmed.class);
            verify(ledger).confirmPayment(confirmed.capture());
            assertThat(confirmed.getValue().ledgerKey()).isEqualTo("ch_1");
            assertThat(confirmed.getValue().userIdHint()).isEqualTo(userId);
        }

        @Test
        @DisplayName("a retried Stripe checkout tracks the new provider subscription and stops the old one")
        void retriedStripeCheckout() {
            Subscription subscription = stored();
            subscription.setProvider(GatewayProvider.STRIPE);
            subscription.setProviderSubscriptionId("sub_old");
            when(paymentGateway.provider()).thenReturn(GatewayProvider.STRIPE);
            when(gatewayResolver.forProvider(GatewayProvider.STRIPE)).thenReturn(paymentGateway);
            when(paymentGateway.attachPaymentMethod("cus_1", "pm_retry"))
                    .thenReturn(new GatewayPaymentMethod("pm_retry", "visa", "4242"));
            when(paymentGateway.createSubscription(any())).thenReturn(GatewaySubscription.builder()
                    .provider(GatewayProvider.STRIPE)
                    .subscriptionRef("sub_new")
                    .invoiceRef("in_new")
                    .status(GatewayPaymentStatus.PENDING)
                    .amountCents(9700L)
                    .build());

            ProcessPaymentResponse response = service.processPayment(userId, payment("pm_retry", null, "12345678909"));

            assertThat(response.providerReference()).isEqualTo("sub_new");
            assertThat(subscription.getProviderSubscriptionId()).isEqualTo("sub_new");
            assertThat(subscription.getStatus()).isEqualTo(SubscriptionStatus.PENDING);
            verify(paymentGateway).cancelSubscription("sub_old");
        }

        @Test
        @DisplayName("a paid status without a charge id waits for the webhook")
        void paidWithoutKey() {
            stored();
            when(paymentGateway.createSubscription(any())).thenReturn(order(GatewayPaymentStatus.PAID, null));

            ProcessPaymentResponse response = service.processPayment(userId, payment("token_abc", null, "12345678909"));

            assertThat(response.message()).isEqualTo("Pagamento aprovado, aguardando confirmação");
            verify(ledger, never()).confirmPayment(any());
        }

        @Test
        @DisplayName("a declined charge is recorded and reported as a rejection")
        void declined() {
            stored();
            when(paymentGateway.createSubscription(any())).thenReturn(order(GatewayPaymentStatus.FAILED, "ch_2"));

            assertThatThrownBy(() -> service.processPayment(userId, payment("token_abc", null, "12345678909")))
                    .isInstanceOfSatisfying(GatewayRejectedException.class, e -> {
                        assertThat(e.getCustomerMessage()).isEqualTo("Cartão recusado");
                        assertThat(e.isIntegrationError()).isFalse();
                    });
            verify(ledger).recordFailure(any(GatewayEvent.PaymentFailed.class));
        }

        @Test
        @DisplayName("a pending charge notifies the user and leaves the row pending")
        void pending() {
            stored();
            when(paymentGateway.createSubscription(any())).thenReturn(order(GatewayPaymentStatus.PENDING, "ch_3"));

            ProcessPaymentResponse response = service.processPayment(userId, payment("token_abc", null, "12345678909"));

            assertThat(response.status()).isEqualTo("pending");
            verify(notificationService).notifyOnce(eq(userId), eq(BillingNotifications.PAYMENT_PROCESSING),
                    anyString(), eq(NotificationKind.INFO), anyInt());
            verify(ledger, never()).confirmPayment(any());
        }

        @Test
        @DisplayName("a stored card is charged without attaching a new one")
        void storedCard() {
            stored();
            when(paymentGateway.createSubscription(any())).thenReturn(order(GatewayPaymentStatus.PENDING, "ch_3"));

            service.processPayment(userId, payment(null, "card_9", "12345678909"));

            verify(paymentGateway, never()).attachPaymentMethod(anyString(), anyString());
        }

        @Test
        @DisplayName("raw card numbers are refused before any gateway call")
        void rawCardNumber() {
            assertThatThrownBy(() -> service.processPayment(userId, payment("4111 1111 1111 1111", null, "12345678909")))
                    .isInstanceOf(GatewayValidationException.class)
                    .hasMessageContaining("tokenize");
            verify(paymentGateway, never()).createOrGetCustomer(any());
        }

        @Test
        @DisplayName("a document that is neither CPF nor CNPJ is refused")
        void invalidDocument() {
            assertThatThrownBy(() -> service.processPayment(userId, payment("token_abc", null, "1234")))
                    .isInstanceOf(GatewayValidationException.class);
        }

        @Test
        @DisplayName("an active subscription cannot pay again")
        void alreadyActive() {
            stored(SubscriptionStatus.ACTIVE);

            assertThatThrownBy(() -> service.processPayment(userId, payment("token_abc", null, "12345678909")))
                    .isInstanceOf(SubscriptionAlreadyActiveException.class);
            verify(paymentGateway, never()).createOrGetCustomer(any());
        }
    }

    @Nested
    @DisplayName("confirmCheckout")
    class ConfirmCheckout {

        @Test
        @DisplayName("records the simulated payment through the ledger")
        void confirms() {
            Subscription subscription = stored();
            when(ledger.recordSimulatedPayment(userId, "cs_1")).thenReturn(BillingOutcome.ACTIVATED);

            ConfirmCheckoutResponse response =
                    service.confirmCheckout(userId, new ConfirmCheckoutRequest("cs_1", "pro", "monthly"));

            assertThat(response.outcome()).isEqualTo("activated");
            assertThat(subscription.getProvider()).isEqualTo(GatewayProvider.SIMULATED);
        }

        @Test
        @DisplayName("a repeated session is reported as already processed")
        void repeated() {
            stored(SubscriptionStatus.ACTIVE);
            when(paymentRepository.findByProviderTransactionId("sim_cs_1"))
                    .thenReturn(Optional.of(new Payment()));

            ConfirmCheckoutResponse response =
                    service.confirmCheckout(userId, new ConfirmCheckoutRequest("cs_1", "pro", "monthly"));

            assertThat(response.outcome()).isEqualTo("already_processed");
            assertThat(response.status()).isEqualTo("active");
            verifyNoInteractions(ledger);
        }
    }

    @Nested
    @DisplayName("cancel and reactivate")
    class CancelAndReactivate {

        @Test
        @DisplayName("cancel stops the gateway charge and keeps access until period end")
        void cancel() {
            Subscription subscription = stored(SubscriptionStatus.ACTIVE);
            subscription.setProvider(GatewayProvider.PAGARME);
            subscription.setProviderOrderId("or_1");
            subscription.applyPaidPeriod(NOW.minusDays(5), NOW.plusDays(25), NOW.plusDays(25));

            CancelSubscriptionResponse response = service.cancel(userId);

            assertThat(response.status()).isEqualTo("canceled");
            assertThat(response.accessUntil()).isEqualTo(NOW.plusDays(25));
            assertThat(subscription.getCanceledAt()).isEqualTo(NOW);
            assertThat(subscription.grantsAccess(NOW)).isTrue();
            verify(paymentGateway).cancelSubscription("or_1");
            verify(eventPublisher).publishEvent(any(SubscriptionCanceledEvent.class));
        }

        @Test
        @DisplayName("a gateway failure does not block the local cancellation")
        void gatewayFailure() {
            Subscription subscription = stored(SubscriptionStatus.ACTIVE);
            subscription.setProvider(GatewayProvider.PAGARME);
            subscription.setProviderSubscriptionId("sub_1");
            doThrow(new GatewayNetworkException(GatewayProvider.PAGARME, "timeout", null))
                    .when(paymentGateway).cancelSubscription("sub_1");

            service.cancel(userId);

            assertThat(subscription.getStatus()).isEqualTo(SubscriptionStatus.CANCELED);
        }

        @Test
        @DisplayName("canceling twice is refused")
        void cancelTwice() {
            stored(SubscriptionStatus.ACTIVE, SubscriptionStatus.CANCELED);

            assertThatThrownBy(() -> service.cancel(userId)).isInstanceOf(SubscriptionAlreadyCanceledException.class);
        }

        @Test
        @DisplayName("a canceled subscription inside its paid period is reactivated")
        void reactivate() {
            Subscription subscription = stored(SubscriptionStatus.ACTIVE);
            subscription.applyPaidPeriod(NOW.minusDays(5), NOW.plusDays(25), null);
            subscription.transitionTo(SubscriptionStatus.CANCELED, NOW);
            when(paymentRepository.existsBySubscriptionIdAndStatus(subscription.getId(), PaymentStatus.PAID))
                    .thenReturn(true);

            service.reactivate(userId);

            assertThat(subscription.getStatus()).isEqualTo(SubscriptionStatus.ACTIVE);
            assertThat(subscription.getCanceledAt()).isNull();
            assertThat(subscription.getNextBillingAt()).isEqualTo(NOW.plusDays(25));
        }

        @Test
        @DisplayName("reactivation after the paid period is refused")
        void reactivateTooLate() {
            Subscription subscription = stored(SubscriptionStatus.ACTIVE);
            subscription.applyPaidPeriod(NOW.minusDays(40), NOW.minusDays(10), null);
            subscription.transitionTo(SubscriptionStatus.CANCELED, NOW.minusDays(20));

            assertThatThrownBy(() -> service.reactivate(userId)).isInstanceOf(ReactivationNotAllowedException.class);
        }

        @Test
        @DisplayName("reactivation without a recorded payment is refused")
        void reactivateWithoutPayment() {
            Subscription subscription = stored(SubscriptionStatus.ACTIVE);
            subscription.applyPaidPeriod(NOW.minusDays(5), NOW.plusDays(25), null);
            subscription.transitionTo(SubscriptionStatus.CANCELED, NOW);

            assertThatThrownBy(() -> service.reactivate(userId)).isInstanceOf(ReactivationNotAllowedException.class);
        }

        @Test
        @DisplayName("reactivation of a provider-managed subscription is refused")
        void reactivateProviderManaged() {
            Subscription subscription = stored(SubscriptionStatus.ACTIVE);
            subscription.setProviderSubscriptionId("sub_1");
            subscription.applyPaidPeriod(NOW.minusDays(5), NOW.plusDays(25), null);
            subscription.transitionTo(SubscriptionStatus.CANCELED, NOW);
            when(paymentRepository.existsBySubscriptionIdAndStatus(subscription.getId(), PaymentStatus.PAID))
                    .thenReturn(true);

            assertThatThrownBy(() -> service.reactivate(userId))
                    .isInstanceOf(ReactivationNotAllowedException.class)
                    .hasMessageContaining("payment provider");
        }

        @Test
        @DisplayName("an active subscription cannot be reactivated")
        void reactivateActive() {
            stored(SubscriptionStatus.ACTIVE);

            assertThatThrownBy(() -> service.reactivate(userId)).isInstanceOf(ReactivationNotAllowedException.class);
        }
    }

    @Nested
    @DisplayName("gateway lifecycle events")
    class GatewayEvents {

        private Subscription providerManaged(SubscriptionStatus... path) {
            Subscription subscription = stored(path);
            subscription.setProviderSubscriptionId("sub_1");
            when(subscriptionRepository.findByProviderSubscriptionId("sub_1")).thenReturn(Optional.of(subscription));
            return subscription;
        }

        private GatewayEvent.SubscriptionUpdated update(SubscriptionStatus mapped, LocalDateTime periodEnd, String plan) {
            return new GatewayEvent.SubscriptionUpdated(GatewayProvider.STRIPE, "sub_1", mapped, periodEnd, plan);
        }

        @Test
        @DisplayName("a provider cancellation cancels an active subscription")
        void cancellation() {
            Subscription subscription = providerManaged(SubscriptionStatus.ACTIVE);
            LocalDateTime canceledAt = NOW.minusHours(1);

            BillingOutcome outcome = service.handleGatewayCancellation(
                    new GatewayEvent.SubscriptionCanceled(GatewayProvider.STRIPE, "sub_1", canceledAt));

            assertThat(outcome).isEqualTo(BillingOutcome.CANCELED);
            assertThat(subscription.getCanceledAt()).isEqualTo(canceledAt);
        }

        @Test
        @DisplayName("a repeated cancellation is already processed")
        void repeatedCancellation() {
            providerManaged(SubscriptionStatus.ACTIVE, SubscriptionStatus.CANCELED);

            assertThat(service.handleGatewayCancellation(
                    new GatewayEvent.SubscriptionCanceled(GatewayProvider.STRIPE, "sub_1", null)))
                    .isEqualTo(BillingOutcome.ALREADY_PROCESSED);
        }

        @Test
        @DisplayName("an expired subscription ignores a cancellation")
        void expiredCancellation() {
            providerManaged(SubscriptionStatus.EXPIRED);

            assertThat(service.handleGatewayCancellation(
                    new GatewayEvent.SubscriptionCanceled(GatewayProvider.STRIPE, "sub_1", null)))
                    .isEqualTo(BillingOutcome.IGNORED);
        }

        @Test
        @DisplayName("an unknown provider subscription is not found")
        void unknown() {
            assertThat(service.handleGatewayCancellation(
                    new GatewayEvent.SubscriptionCanceled(GatewayProvider.STRIPE, "sub_404", null)))
                    .isEqualTo(BillingOutcome.SUBSCRIPTION_NOT_FOUND);
        }

        @Test
        @DisplayName("a past-due update is applied")
        void pastDue() {
            Subscription subscription = providerManaged(SubscriptionStatus.ACTIVE);

            assertThat(service.handleGatewayUpdate(update(SubscriptionStatus.PAST_DUE, null, null)))
                    .isEqualTo(BillingOutcome.UPDATED);
            assertThat(subscription.getStatus()).isEqualTo(SubscriptionStatus.PAST_DUE);
        }

        @Test
        @DisplayName("an active update without a recorded payment waits for the paid event")
        void activeWithoutPayment() {
            Subscription subscription = providerManaged(SubscriptionStatus.ACTIVE, SubscriptionStatus.PAST_DUE);

            assertThat(service.handleGatewayUpdate(update(SubscriptionStatus.ACTIVE, null, null)))
                    .isEqualTo(BillingOutcome.ACKNOWLEDGED);
            assertThat(subscription.getStatus()).isEqualTo(SubscriptionStatus.PAST_DUE);
        }

        @Test
        @DisplayName("a period end alone never moves the paid period")
        void periodEndIgnored() {
            Subscription subscription = providerManaged(SubscriptionStatus.ACTIVE);
            subscription.applyPaidPeriod(NOW, NOW.plusMonths(1), NOW.plusMonths(1));

            assertThat(service.handleGatewayUpdate(update(null, NOW.plusMonths(2), null)))
                    .isEqualTo(BillingOutcome.ACKNOWLEDGED);
            assertThat(subscription.getCurrentPeriodEnd()).isEqualTo(NOW.plusMonths(1));
        }

        @Test
        @DisplayName("a known plan change is applied")
        void planChange() {
            Subscription subscription = providerManaged(SubscriptionStatus.ACTIVE);

            assertThat(service.handleGatewayUpdate(update(SubscriptionStatus.ACTIVE, null, "Business")))
                    .isEqualTo(BillingOutcome.UPDATED);
            assertThat(subscription.getPlanCode()).isEqualTo("business");
        }
    }

    @Nested
    @DisplayName("status queries")
    class Queries {

        @Test
        @DisplayName("a user without a subscription is eligible for the trial")
        void noSubscription() {
            SubscriptionStatusResponse status = service.getStatus(userId);

            assertThat(status.status()).isEqualTo("none");
            assertThat(status.trialEligible()).isTrue();
            assertThat(status.hasAccess()).isFalse();
        }

        @Test
        @DisplayName("a canceled subscription reports the remaining days of access")
        void canceledStatus() {
            Subscription subscription = stored(SubscriptionStatus.ACTIVE);
            subscription.applyPaidPeriod(NOW.minusDays(20), NOW.plusDays(10), null);
            subscription.transitionTo(SubscriptionStatus.CANCELED, NOW);

            SubscriptionStatusResponse status = service.getStatus(userId);

            assertThat(status.status()).isEqualTo("canceled");
            assertThat(status.daysRemaining()).isEqualTo(10);
            assertThat(status.hasAccess()).isTrue();
        }

        @Test
        @DisplayName("trial eligibility explains why it is refused")
        void trialEligibility() {
            stored(SubscriptionStatus.ACTIVE);
            TrialEligibilityResponse live = service.getTrialEligibility(userId);
            assertThat(live.eligible()).isFalse();
            assertThat(live.reason()).isEqualTo("subscription_active");

            user.setTrialUsed(true);
            TrialEligibilityResponse used = service.getTrialEligibility(userId);
            assertThat(used.hasUsedTrial()).isTrue();
            assertThat(used.reason()).isEqualTo("trial_already_used");
        }
    }
}
