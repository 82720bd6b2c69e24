package br.com.may.features.billing.application.impl;

import br.com.may.features.billing.application.BillingMetricsService;
import br.com.may.features.billing.application.BillingNotifications;
import br.com.may.features.billing.application.BillingProperties;
import br.com.may.features.billing.application.PaymentLedgerService;
import br.com.may.features.billing.domain.event.GatewayEvent;
import br.com.may.features.billing.domain.event.PaymentFailedEvent;
import br.com.may.features.billing.domain.event.SubscriptionActivatedEvent;
import br.com.may.features.billing.domain.model.BillingOutcome;
import br.com.may.features.billing.domain.model.GatewayProvider;
import br.com.may.features.billing.domain.model.Money;
import br.com.may.features.billing.domain.model.Payment;
import br.com.may.features.billing.domain.model.PaymentMethod;
import br.com.may.features.billing.domain.model.PaymentStatus;
import br.com.may.features.billing.domain.model.Subscription;
import br.com.may.features.billing.domain.model.SubscriptionStatus;
import br.com.may.features.billing.infra.repository.PaymentRepository;
import br.com.may.features.billing.infra.repository.SubscriptionRepository;
import br.com.may.features.notification.application.NotificationService;
import br.com.may.features.notification.domain.model.NotificationKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Ledger writes run in a programmatic transaction so that a unique-key violation, which marks the
 * transaction rollback-only, can be caught after rollback and reported as a replay.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentLedgerServiceImpl implements PaymentLedgerService {

    private static final int MAX_ATTEMPTS = 2;
    private static final int CHECKOUT_NOTIFICATION_WINDOW_MINUTES = 1;

    private final SubscriptionRepository subscriptionRepository;
    private final PaymentRepository paymentRepository;
    private final NotificationService notificationService;
    private final ApplicationEventPublisher eventPublisher;
    private final TransactionTemplate transactionTemplate;
    private final BillingMetricsService metricsService;
    private final BillingProperties billingProperties;
    private final Clock clock;

    @Override
    public BillingOutcome confirmPayment(GatewayEvent.PaymentConfirmed confirmation) {
        String key = confirmation.ledgerKey();
        if (key == null) {
            throw new IllegalArgumentException("Payment confirmation needs a transaction or invoice id");
        }
        return runIdempotent(key, confirmation.provider(), () -> applyConfirmation(confirmation));
    }

    @Override
    public BillingOutcome recordFailure(GatewayEvent.PaymentFailed failure) {
        String key = failure.ledgerKey() != null ? failure.ledgerKey() : "<no transaction id>";
        return runIdempotent(key, failure.provider(), () -> applyFailure(failure));
    }

    @Override
    public BillingOutcome recordSimulatedPayment(UUID userId, String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId is required");
        }
        return confirmPayment(GatewayEvent.PaymentConfirmed.builder()
                .provider(GatewayProvider.SIMULATED)
                .providerTransactionId("sim_" + sessionId)
                .method(PaymentMethod.SIMULATED)
                .userIdHint(userId)
                .build());
    }

    private BillingOutcome runIdempotent(String key, GatewayProvider provider, Supplier<BillingOutcome> work) {
        for (int attempt = 1; ; attempt++) {
            try {
                return transactionTemplate.execute(status -> work.get());
            } catch (DataIntegrityViolationException e) {
                log.info("Payment {} was recorded by a concurrent delivery; treating as already processed", key);
                metricsService.incrementLedgerDuplicate(providerName(provider));
                return BillingOutcome.ALREADY_PROCESSED;
            } catch (OptimisticLockingFailureException e) {
                if (attempt >= MAX_ATTEMPTS) {
                    throw e;
                }
                log.info("Subscription changed concurrently while applying payment {}; re-reading state", key);
            }
        }
    }

    private BillingOutcome applyConfirmation(GatewayEvent.PaymentConfirmed confirmation) {
        Optional<Subscription> found = resolveSubscription(confirmation.providerSubscriptionId(),
                confirmation.providerOrderId(), confirmation.userIdHint());
        if (found.isEmpty()) {
            log.info("No subscription for payment {} (subscription={}, order={}, user={})",
                    confirmation.ledgerKey(), confirmation.providerSubscriptionId(),
                    confirmation.providerOrderId(), confirmation.userIdHint());
            return BillingOutcome.SUBSCRIPTION_NOT_FOUND;
        }
        Optional<Payment> existing = findPayment(confirmation.providerInvoiceId(), confirmation.providerTransactionId());
        if (existing.isPresent() && existing.get().isPaid()) {
            log.info("Payment {} already recorded as paid", confirmation.ledgerKey());
            metricsService.incrementLedgerDuplicate(providerName(confirmation.provider()));
            return BillingOutcome.ALREADY_PROCESSED;
        }

        Subscription subscription = found.get();
        LocalDateTime now = LocalDateTime.now(clock);
        SubscriptionStatus previous = subscription.getStatus();
        BigDecimal amount = confirmation.amountCents() != null
                ? Money.fromCents(confirmation.amountCents())
                : subscription.getAmount();

        Payment payment = existing.orElseGet(Payment::new);
        fillPayment(payment, subscription, confirmation.provider(), confirmation.providerTransactionId(),
                confirmation.providerInvoiceId(), amount,
                confirmation.method() != null ? confirmation.method() : PaymentMethod.CREDIT_CARD);
        payment.setStatus(PaymentStatus.PAID);
        payment.setPaidAt(confirmation.paidAt() != null ? confirmation.paidAt() : now);
        payment.setFailureReason(null);

        boolean blocked = !previous.canTransitionTo(SubscriptionStatus.ACTIVE)
                || (previous == SubscriptionStatus.CANCELED && !subscription.isResumable(now));
        if (blocked) {
            paymentRepository.saveAndFlush(payment);
            log.error("Payment {} received for subscription {} in state {} (paid until {}); recorded without "
                            + "activation, needs review", confirmation.ledgerKey(), subscription.getId(), previous,
                    subscription.getCurrentPeriodEnd());
            return BillingOutcome.REQUIRES_REVIEW;
        }

        LocalDateTime start = confirmation.periodStart() != null ? confirmation.periodStart() : now;
        LocalDateTime end = confirmation.periodEnd() != null
                ? confirmation.periodEnd()
                : subscription.getBillingCycle().advance(start);
        LocalDateTime nextBilling = confirmation.nextBillingAt() != null ? confirmation.nextBillingAt() : end;

        subscription.transitionTo(SubscriptionStatus.ACTIVE, now);
        subscription.applyPaidPeriod(start, end, nextBilling);
        if (subscription.getProvider() == null) {
            subscription.setProvider(confirmation.provider());
        }
        if (subscription.getProviderSubscriptionId() == null && confirmation.providerSubscriptionId() != null) {
            subscription.setProviderSubscriptionId(confirmation.providerSubscriptionId());
        }
        if (confirmation.providerOrderId() != null) {
            subscription.setProviderOrderId(confirmation.providerOrderId());
        }
        if (amount != null && amount.signum() > 0) {
            subscription.setAmount(amount);
        }
        subscriptionRepository.save(subscription);
        paymentRepository.saveAndFlush(payment);

        notifyActivation(subscription, previous, confirmation.provider(), amount);
        eventPublisher.publishEvent(new SubscriptionActivatedEvent(this, subscription.getUserId(),
                subscription.getId(), subscription.getPlanCode(), amount, subscription.getCurrentPeriodEnd()));

        metricsService.incrementPaymentConfirmed(providerName(confirmation.provider()));
        log.info("Subscription {} activated by payment {} ({} -> ACTIVE, paid until {})",
                subscription.getId(), confirmation.ledgerKey(), previous, subscription.getCurrentPeriodEnd());
        return BillingOutcome.ACTIVATED;
    }

    private BillingOutcome applyFailure(GatewayEvent.PaymentFailed failure) {
        Optional<Subscription> found = resolveSubscription(failure.providerSubscriptionId(),
                failure.providerOrderId(), failure.userIdHint());
        if (found.isEmpty()) {
            log.info("No subscription for failed payment {} (subscription={}, order={})",
                    failure.ledgerKey(), failure.providerSubscriptionId(), failure.providerOrderId());
            return BillingOutcome.SUBSCRIPTION_NOT_FOUND;
        }
        Optional<Payment> existing = findPayment(failure.providerInvoiceId(), failure.providerTransactionId());
        if (existing.isPresent()) {
            log.info("Payment {} already recorded as {}; ignoring failure event",
                    failure.ledgerKey(), existing.get().getStatus());
            return BillingOutcome.ALREADY_PROCESSED;
        }

        Subscription subscription = found.get();
        LocalDateTime now = LocalDateTime.now(clock);
        SubscriptionStatus previous = subscription.getStatus();
        String reason = failure.failureReason() != null ? failure.failureReason() : "Pagamento recusado";

        BillingOutcome outcome;
        if (previous.canTransitionTo(SubscriptionStatus.PAST_DUE)) {
            subscription.transitionTo(SubscriptionStatus.PAST_DUE, now);
            subscriptionRepository.save(subscription);
            outcome = BillingOutcome.MARKED_PAST_DUE;
        } else {
            log.info("Subscription {} is {}; recording failed payment without a status change",
                    subscription.getId(), previous);
            outcome = BillingOutcome.FAILURE_RECORDED;
        }

        if (failure.ledgerKey() != null) {
            BigDecimal amount = failure.amountCents() != null
                    ? Money.fromCents(failure.amountCents())
                    : (subscription.getAmount() != null ? subscription.getAmount() : BigDecimal.ZERO.setScale(2));
            Payment payment = new Payment();
            fillPayment(payment, subscription, failure.provider(), failure.providerTransactionId(),
                    failure.providerInvoiceId(), amount, PaymentMethod.CREDIT_CARD);
            payment.setStatus(PaymentStatus.FAILED);
            payment.setFailedAt(now);
            payment.setFailureReason(truncate(reason, 500));
            paymentRepository.saveAndFlush(payment);
        }

        notifyFailure(subscription.getUserId(), failure, reason);
        eventPublisher.publishEvent(new PaymentFailedEvent(this, subscription.getUserId(), subscription.getId(),
                reason, failure.integrationError(), failure.recurring()));

        metricsService.incrementPaymentFailed(providerName(failure.provider()), failure.integrationError());
        log.warn("Payment {} failed for subscription {} ({}): {}",
                failure.ledgerKey(), subscription.getId(), outcome.apiValue(), reason);
        return outcome;
    }

    private Optional<Subscription> resolveSubscription(String providerSubscriptionId, String providerOrderId,
                                                       UUID userIdHint) {
        if (providerSubscriptionId != null) {
            Optional<Subscription> bySubscription = subscriptionRepository.findByProviderSubscriptionId(providerSubscriptionId);
            if (bySubscription.isPresent()) {
                return bySubscription;
            }
        }
        if (providerOrderId != null) {
            Optional<Subscription> byOrder = subscriptionRepository.findByProviderOrderId(providerOrderId);
            if (byOrder.isPresent()) {
                return byOrder;
            }
        }
        if (userIdHint == null) {
            return Optional.empty();
        }
        return subscriptionRepository.findByUserId(userIdHint)
                .filter(subscription -> providerSubscriptionId == null
                        || subscription.getProviderSubscriptionId() == null
                        || subscription.getProviderSubscriptionId().equals(providerSubscriptionId));
    }

    private Optional<Payment> findPayment(String providerInvoiceId, String providerTransactionId) {
        if (providerInvoiceId != null) {
            Optional<Payment> byInvoice = paymentRepository.findByProviderInvoiceId(providerInvoiceId);
            if (byInvoice.isPresent()) {
                return byInvoice;
            }
        }
        if (providerTransactionId != null) {
            return paymentRepository.findByProviderTransactionId(providerTransactionId);
        }
        return Optional.empty();
    }

    private void fillPayment(Payment payment, Subscription subscription, GatewayProvider provider,
                             String transactionId, String invoiceId, BigDecimal amount, PaymentMethod method) {
        payment.setSubscriptionId(subscription.getId());
        payment.setUserId(subscription.getUserId());
        payment.setProvider(provider);
        if (transactionId != null) {
            payment.setProviderTransactionId(transactionId);
        }
        if (invoiceId != null) {
            payment.setProviderInvoiceId(invoiceId);
        }
        payment.setAmount(amount != null ? amount : BigDecimal.ZERO.setScale(2));
        payment.setMethod(method);
    }

    private void notifyActivation(Subscription subscription, SubscriptionStatus previous, GatewayProvider provider,
                                  BigDecimal amount) {
        boolean checkout = provider == GatewayProvider.SIMULATED;
        int window = checkout ? CHECKOUT_NOTIFICATION_WINDOW_MINUTES : billingProperties.getNotificationWindowMinutes();
        if (previous == SubscriptionStatus.CANCELED) {
            notificationService.notifyOnce(subscription.getUserId(), BillingNotifications.SUBSCRIPTION_REACTIVATED,
                    BillingNotifications.subscriptionReactivated(subscription.getPlanCode()),
                    NotificationKind.SUCCESS, window);
        } else if (checkout) {
            notificationService.notifyOnce(subscription.getUserId(), BillingNotifications.SUBSCRIPTION_ACTIVATED,
                    BillingNotifications.subscriptionActivated(subscription.getPlanCode()),
                    NotificationKind.SUCCESS, window);
        } else {
            notificationService.notifyOnce(subscription.getUserId(), BillingNotifications.PAYMENT_CONFIRMED,
                    BillingNotifications.paymentConfirmed(amount != null ? amount : BigDecimal.ZERO,
                            subscription.getCurrentPeriodEnd()),
                    NotificationKind.SUCCESS, window);
        }
    }

    private void notifyFailure(UUID userId, GatewayEvent.PaymentFailed failure, String reason) {
        int window = billingProperties.getNotificationWindowMinutes();
        if (failure.integrationError()) {
            notificationService.notifyOnce(userId, BillingNotifications.PAYMENT_INTEGRATION_FAILURE,
                    BillingNotifications.integrationFailure(), NotificationKind.ALERT, window);
        } else if (failure.recurring()) {
            notificationService.notifyOnce(userId, BillingNotifications.RECURRING_PAYMENT_FAILED,
                    BillingNotifications.recurringPaymentFailed(reason), NotificationKind.ALERT, window);
        } else {
            notificationService.notifyOnce(userId, BillingNotifications.PAYMENT_DECLINED,
                    BillingNotifications.paymentDeclined(reason), NotificationKind.ALERT, window);
        }
    }

    private static String providerName(GatewayProvider provider) {
        return provider != null ? provider.name().toLowerCase() : "unknown";
    }

    private static String truncate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max);
    }
}
