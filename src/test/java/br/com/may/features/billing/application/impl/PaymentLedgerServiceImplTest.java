package br.com.may.features.billing.application.impl;

import br.com.may.features.billing.application.BillingMetricsService;
import br.com.may.features.billing.application.BillingNotifications;
import br.com.may.features.billing.application.BillingProperties;
import br.com.may.features.billing.domain.event.GatewayEvent;
import br.com.may.features.billing.domain.event.PaymentFailedEvent;
import br.com.may.features.billing.domain.event.SubscriptionActivatedEvent;
import br.com.may.features.billing.domain.model.BillingCycle;
import br.com.may.features.billing.domain.model.BillingOutcome;
import br.com.may.features.billing.domain.model.GatewayProvider;
import br.com.may.features.billing.domain.model.Payment;
import br.com.may.features.billing.domain.model.PaymentStatus;
import br.com.may.features.billing.domain.model.Subscription;
import br.com.may.features.billing.domain.model.SubscriptionStatus;
import br.com.may.features.billing.infra.repository.PaymentRepository;
import br.com.may.features.billing.infra.repository.SubscriptionRepository;
import br.com.may.features.notification.application.NotificationService;
import br.com.may.features.notification.domain.model.NotificationKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PaymentLedgerServiceImplTest {

    private static final Instant NOW_INSTANT = Instant.parse("2025-03-10T12:00:00Z");
    private static final LocalDateTime NOW = LocalDateTime.ofInstant(NOW_INSTANT, ZoneOffset.UTC);

    @Mock
    private SubscriptionRepository subscriptionRepository;
    @Mock
    private PaymentRepository paymentRepository;
    @Mock
    private NotificationService notificationService;
    @Mock
    private ApplicationEventPublisher eventPublisher;
    @Mock
    private TransactionTemplate transactionTemplate;
    @Mock
    private BillingMetricsService metricsService;

    private PaymentLedgerServiceImpl ledger;
    private final UUID userId = UUID.randomUUID();
    private Subscription subscription;

    @BeforeEach
    void setUp() {
        ledger = new PaymentLedgerServiceImpl(subscriptionRepository, paymentRepository, notificationService,
                eventPublisher, transactionTemplate, metricsService, new BillingProperties(),
                Clock.fixed(NOW_INSTANT, ZoneOffset.UTC));
        lenient().when(transactionTemplate.execute(any()))
                .thenAnswer(inv -> inv.<TransactionCallback<?>>getArgument(0).doInTransaction(null));

        subscription = Subscription.pending(userId, "pro", BillingCycle.MONTHLY, new BigDecimal("97.00"));
        subscription.setId(UUID.randomUUID());
        subscription.setProvider(GatewayProvider.PAGARME);
        subscription.setProviderOrderId("or_1");
    }

    private static GatewayEvent.PaymentConfirmed orderPaid() {
        return GatewayEvent.PaymentConfirmed.builder()
                .provider(GatewayProvider.PAGARME)
                .providerOrderId("or_1")
                .providerTransactionId("ch_1")
                .amountCents(9700L)
                .build();
    }

    private static GatewayEvent.PaymentFailed chargeFailed(boolean recurring) {
        return GatewayEvent.PaymentFailed.builder()
                .provider(GatewayProvider.PAGARME)
                .providerOrderId("or_1")
                .providerTransactionId("ch_2")
                .amountCents(9700L)
                .failureReason("Cartão sem saldo")
                .recurring(recurring)
                .build();
    }

    @Nested
    @DisplayName("confirmPayment")
    class ConfirmPayment {

        @Test
        @DisplayName("activates a pending subscription and records the payment once")
        void activatesPending() {
            when(subscriptionRepository.findByProviderOrderId("or_1")).thenReturn(Optional.of(subscription));

            BillingOutcome outcome = ledger.confirmPayment(orderPaid());

            assertThat(outcome).isEqualTo(BillingOutcome.ACTIVATED);
            assertThat(subscription.getStatus()).isEqualTo(SubscriptionStatus.ACTIVE);
            assertThat(subscription.getCurrentPeriodStart()).isEqualTo(NOW);
            assertThat(subscription.getCurrentPeriodEnd()).isEqualTo(NOW.plusMonths(1));
            assertThat(subscription.getNextBillingAt()).isEqualTo(NOW.plusMonths(1));

            ArgumentCaptor<Payment> payment = ArgumentCaptor.forClass(Payment.class);
            verify(paymentRepository).saveAndFlush(payment.capture());
            assertThat(payment.getValue().getStatus()).isEqualTo(PaymentStatus.PAID);
            assertThat(payment.getValue().getProviderTransactionId()).isEqualTo("ch_1");
            assertThat(payment.getValue().getAmount()).isEqualByComparingTo("97.00");
            assertThat(payment.getValue().getPaidAt()).isEqualTo(NOW);

            verify(notificationService).notifyOnce(eq(userId), eq(BillingNotifications.PAYMENT_CONFIRMED),
                    anyString(), eq(NotificationKind.SUCCESS), eq(5));
            verify(eventPublisher).publishEvent(any(SubscriptionActivatedEvent.class));
            verify(metricsService).incrementPaymentConfirmed("pagarme");
        }

        @Test
        @DisplayName("a replay of a paid transaction changes nothing")
        void replayIsAlreadyProcessed() {
            Payment paid = new Payment();
            paid.setStatus(PaymentStatus.PAID);
            when(subscriptionRepository.findByProviderOrderId("or_1")).thenReturn(Optional.of(subscription));
            when(paymentRepository.findByProviderTransactionId("ch_1")).thenReturn(Optional.of(paid));

            BillingOutcome outcome = ledger.confirmPayment(orderPaid());

            assertThat(outcome).isEqualTo(BillingOutcome.ALREADY_PROCESSED);
            assertThat(subscription.getStatus()).isEqualTo(SubscriptionStatus.PENDING);
            verify(paymentRepository, never()).saveAndFlush(any());
            verify(notificationService, never()).notifyOnce(any(), anyString(), anyString(), any(), anyInt());
            verify(metricsService).incrementLedgerDuplicate("pagarme");
        }

        @Test
        @DisplayName("a unique-key violation from a concurrent delivery is reported as already processed")
        void concurrentInsertIsAlreadyProcessed() {
            when(subscriptionRepository.findByProviderOrderId("or_1")).thenReturn(Optional.of(subscription));
            when(paymentRepository.saveAndFlush(any())).thenThrow(new DataIntegrityViolationException("duplicate"));

            BillingOutcome outcome = ledger.confirmPayment(orderPaid());

            assertThat(outcome).isEqualTo(BillingOutcome.ALREADY_PROCESSED);
            verify(eventPublisher, never()).publishEvent(any());
        }

        @Test
        @DisplayName("an optimistic-lock failure is retried once with fresh state")
        void optimisticLockRetried() {
            when(subscriptionRepository.findByProviderOrderId("or_1"))
                    .thenThrow(new OptimisticLockingFailureException("stale"))
                    .thenReturn(Optional.of(subscription));

            BillingOutcome outcome = ledger.confirmPayment(orderPaid());

            assertThat(outcome).isEqualTo(BillingOutcome.ACTIVATED);
            verify(transactionTemplate, times(2)).execute(any());
        }

        @Test
        @DisplayName("a second optimistic-lock failure propagates")
        void optimisticLockGivesUp() {
            when(subscriptionRepository.findByProviderOrderId("or_1"))
                    .thenThrow(new OptimisticLockingFailureException("stale"));

            assertThatThrownBy(() -> ledger.confirmPayment(orderPaid()))
                    .isInstanceOf(OptimisticLockingFailureException.class);
        }

        @Test
        @DisplayName("requires a transaction or invoice id")
        void requiresKey() {
            GatewayEvent.PaymentConfirmed noKey = GatewayEvent.PaymentConfirmed.builder()
                    .provider(GatewayProvider.PAGARME)
                    .providerOrderId("or_1")
                    .build();

            assertThatThrownBy(() -> ledger.confirmPayment(noKey)).isInstanceOf(IllegalArgumentException.class);
            verify(transactionTemplate, never()).execute(any());
        }

        @Test
        @DisplayName("returns not found when no subscription matches")
        void notFound() {
            assertThat(ledger.confirmPayment(orderPaid())).isEqualTo(BillingOutcome.SUBSCRIPTION_NOT_FOUND);
            verify(paymentRepository, never()).saveAndFlush(any());
        }

        @Test
        @DisplayName("money for an expired subscription is recorded for review without activation")
        void expiredNeedsReview() {
            subscription.transitionTo(SubscriptionStatus.EXPIRED, NOW);
            when(subscriptionRepository.findByProviderOrderId("or_1")).thenReturn(Optional.of(subscription));

            BillingOutcome outcome = ledger.confirmPayment(orderPaid());

            assertThat(outcome).isEqualTo(BillingOutcome.REQUIRES_REVIEW);
            assertThat(subscription.getStatus()).isEqualTo(SubscriptionStatus.EXPIRED);
            verify(paymentRepository).saveAndFlush(any(Payment.class));
            verify(eventPublisher, never()).publishEvent(any());
        }

        @Test
        @DisplayName("a payment on a locally canceled subscription inside its period reactivates it")
        void reactivatesCanceledInsidePeriod() {
            subscription.transitionTo(SubscriptionStatus.ACTIVE, NOW.minusMonths(1));
            subscription.applyPaidPeriod(NOW.minusMonths(1), NOW.plusDays(2), NOW.plusDays(2));
            subscription.transitionTo(SubscriptionStatus.CANCELED, NOW.minusDays(1));
            when(subscriptionRepository.findByProviderOrderId("or_1")).thenReturn(Optional.of(subscription));

            BillingOutcome outcome = ledger.confirmPayment(orderPaid());

            assertThat(outcome).isEqualTo(BillingOutcome.ACTIVATED);
            assertThat(subscription.getCanceledAt()).isNull();
            verify(notificationService).notifyOnce(eq(userId), eq(BillingNotifications.SUBSCRIPTION_REACTIVATED),
                    anyString(), eq(NotificationKind.SUCCESS), anyInt());
        }

        @Test
        @DisplayName("a late payment after the canceled period ended is recorded for review and grants no access")
        void latePaymentAfterCanceledPeriod() {
            subscription.transitionTo(SubscriptionStatus.ACTIVE, NOW.minusDays(70));
            subscription.applyPaidPeriod(NOW.minusDays(70), NOW.minusDays(40), NOW.minusDays(40));
            subscription.transitionTo(SubscriptionStatus.CANCELED, NOW.minusDays(50));
            when(subscriptionRepository.findByProviderOrderId("or_1")).thenReturn(Optional.of(subscription));

            BillingOutcome outcome = ledger.confirmPayment(orderPaid());

            assertThat(outcome).isEqualTo(BillingOutcome.REQUIRES_REVIEW);
            assertThat(subscription.getStatus()).isEqualTo(SubscriptionStatus.CANCELED);
            assertThat(subscription.grantsAccess(NOW)).isFalse();
            ArgumentCaptor<Payment> payment = ArgumentCaptor.forClass(Payment.class);
            verify(paymentRepository).saveAndFlush(payment.capture());
            assertThat(payment.getValue().getStatus()).isEqualTo(PaymentStatus.PAID);
            verify(subscriptionRepository, never()).save(any());
            verify(eventPublisher, never()).publishEvent(any());
        }

        @Test
        @DisplayName("an invoice paid on a subscription the provider canceled does not reactivate it")
        void providerCanceledNeedsReview() {
            subscription.setProviderSubscriptionId("sub_1");
            subscription.transitionTo(SubscriptionStatus.ACTIVE, NOW.minusDays(20));
            subscription.applyPaidPeriod(NOW.minusDays(20), NOW.plusDays(10), NOW.plusDays(10));
            subscription.transitionTo(SubscriptionStatus.CANCELED, NOW.minusDays(1));
            when(subscriptionRepository.findByProviderSubscriptionId("sub_1")).thenReturn(Optional.of(subscription));

            BillingOutcome outcome = ledger.confirmPayment(GatewayEvent.PaymentConfirmed.builder()
                    .provider(GatewayProvider.STRIPE)
                    .providerSubscriptionId("sub_1")
                    .providerInvoiceId("in_late")
                    .amountCents(9700L)
                    .build());

            assertThat(outcome).isEqualTo(BillingOutcome.REQUIRES_REVIEW);
            assertThat(subscription.getStatus()).isEqualTo(SubscriptionStatus.CANCELED);
        }

        @Test
        @DisplayName("an invoice for the subscription of a retried checkout activates the row without a user hint")
        void retriedCheckoutMatchedBySubscription() {
            subscription.setProvider(GatewayProvider.STRIPE);
            subscription.setProviderOrderId(null);
            subscription.setProviderSubscriptionId("sub_new");
            when(subscriptionRepository.findByProviderSubscriptionId("sub_new")).thenReturn(Optional.of(subscription));

            BillingOutcome outcome = ledger.confirmPayment(GatewayEvent.PaymentConfirmed.builder()
                    .provider(GatewayProvider.STRIPE)
                    .providerSubscriptionId("sub_new")
                    .providerInvoiceId("in_new")
                    .amountCents(9700L)
                    .build());

            assertThat(outcome).isEqualTo(BillingOutcome.ACTIVATED);
            assertThat(subscription.getStatus()).isEqualTo(SubscriptionStatus.ACTIVE);
        }

        @Test
        @DisplayName("uses the period reported by the gateway")
        void usesGatewayPeriod() {
            subscription.setProviderSubscriptionId("sub_1");
            when(subscriptionRepository.findByProviderSubscriptionId("sub_1")).thenReturn(Optional.of(subscription));
            LocalDateTime end = NOW.plusDays(40);

            ledger.confirmPayment(GatewayEvent.PaymentConfirmed.builder()
                    .provider(GatewayProvider.STRIPE)
                    .providerSubscriptionId("sub_1")
                    .providerInvoiceId("in_1")
                    .amountCents(9700L)
                    .periodStart(NOW)
                    .periodEnd(end)
                    .build());

            assertThat(subscription.getCurrentPeriodEnd()).isEqualTo(end);
            verify(paymentRepository).findByProviderInvoiceId("in_1");
        }
    }

    @Nested
    @DisplayName("recordSimulatedPayment")
    class RecordSimulatedPayment {

        @Test
        @DisplayName("keys the payment by the session and uses the short checkout window")
        void simulated() {
            when(subscriptionRepository.findByUserId(userId)).thenReturn(Optional.of(subscription));

            BillingOutcome outcome = ledger.recordSimulatedPayment(userId, "cs_42");

            assertThat(outcome).isEqualTo(BillingOutcome.ACTIVATED);
            verify(paymentRepository).findByProviderTransactionId("sim_cs_42");
            verify(notificationService).notifyOnce(eq(userId), eq(BillingNotifications.SUBSCRIPTION_ACTIVATED),
                    anyString(), eq(NotificationKind.SUCCESS), eq(1));
        }

        @Test
        @DisplayName("requires a session id")
        void requiresSession() {
            assertThatThrownBy(() -> ledger.recordSimulatedPayment(userId, " "))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("recordFailure")
    class RecordFailure {

        @BeforeEach
        void activate() {
            subscription.transitionTo(SubscriptionStatus.ACTIVE, NOW.minusMonths(1));
            subscription.applyPaidPeriod(NOW.minusMonths(1), NOW.plusDays(5), NOW);
        }

        @Test
        @DisplayName("marks an active subscription past due without shortening the paid period")
        void marksPastDue() {
            when(subscriptionRepository.findByProviderOrderId("or_1")).thenReturn(Optional.of(subscription));

            BillingOutcome outcome = ledger.recordFailure(chargeFailed(false));

            assertThat(outcome).isEqualTo(BillingOutcome.MARKED_PAST_DUE);
            assertThat(subscription.getStatus()).isEqualTo(SubscriptionStatus.PAST_DUE);
            assertThat(subscription.getCurrentPeriodEnd()).isEqualTo(NOW.plusDays(5));

            ArgumentCaptor<Payment> payment = ArgumentCaptor.forClass(Payment.class);
            verify(paymentRepository).saveAndFlush(payment.capture());
            assertThat(payment.getValue().getStatus()).isEqualTo(PaymentStatus.FAILED);
            assertThat(payment.getValue().getFailureReason()).isEqualTo("Cartão sem saldo");
            verify(notificationService).notifyOnce(eq(userId), eq(BillingNotifications.PAYMENT_DECLINED),
                    anyString(), eq(NotificationKind.ALERT), eq(5));
            verify(eventPublisher).publishEvent(any(PaymentFailedEvent.class));
        }

        @Test
        @DisplayName("a recurring failure uses the recurring notification")
        void recurringNotification() {
            when(subscriptionRepository.findByProviderOrderId("or_1")).thenReturn(Optional.of(subscription));

            ledger.recordFailure(chargeFailed(true));

            verify(notificationService).notifyOnce(eq(userId), eq(BillingNotifications.RECURRING_PAYMENT_FAILED),
                    anyString(), eq(NotificationKind.ALERT), anyInt());
        }

        @Test
        @DisplayName("a failure for an already recorded transaction is a replay")
        void replay() {
            Payment existing = new Payment();
            existing.setStatus(PaymentStatus.PAID);
            when(subscriptionRepository.findByProviderOrderId("or_1")).thenReturn(Optional.of(subscription));
            when(paymentRepository.findByProviderTransactionId("ch_2")).thenReturn(Optional.of(existing));

            BillingOutcome outcome = ledger.recordFailure(chargeFailed(false));

            assertThat(outcome).isEqualTo(BillingOutcome.ALREADY_PROCESSED);
            assertThat(subscription.getStatus()).isEqualTo(SubscriptionStatus.ACTIVE);
        }

        @Test
        @DisplayName("a canceled subscription records the failure without a status change")
        void canceledKeepsStatus() {
            subscription.transitionTo(SubscriptionStatus.CANCELED, NOW);
            when(subscriptionRepository.findByProviderOrderId("or_1")).thenReturn(Optional.of(subscription));

            BillingOutcome outcome = ledger.recordFailure(chargeFailed(false));

            assertThat(outcome).isEqualTo(BillingOutcome.FAILURE_RECORDED);
            assertThat(subscription.getStatus()).isEqualTo(SubscriptionStatus.CANCELED);
        }

        @Test
        @DisplayName("long failure reasons are truncated to the column size")
        void truncatesReason() {
            when(subscriptionRepository.findByProviderOrderId("or_1")).thenReturn(Optional.of(subscription));

            ledger.recordFailure(GatewayEvent.PaymentFailed.builder()
                    .provider(GatewayProvider.PAGARME)
                    .providerOrderId("or_1")
                    .providerTransactionId("ch_3")
                    .failureReason("x".repeat(800))
                    .build());

            ArgumentCaptor<Payment> payment = ArgumentCaptor.forClass(Payment.class);
            verify(paymentRepository).saveAndFlush(payment.capture());
            assertThat(payment.getValue().getFailureReason()).hasSize(500);
        }
    }
}
