package br.com.may.features.billing.application.impl;

import br.com.may.features.billing.application.BillingMetricsService;
import br.com.may.features.billing.application.GatewaySubscriptionEvents;
import br.com.may.features.billing.application.PaymentLedgerService;
import br.com.may.features.billing.application.PlanCatalog;
import br.com.may.features.billing.application.RecurringBillingService;
import br.com.may.features.billing.application.gateway.GatewayPaymentMethod;
import br.com.may.features.billing.application.gateway.GatewayPaymentStatus;
import br.com.may.features.billing.application.gateway.GatewaySubscription;
import br.com.may.features.billing.application.gateway.GatewaySubscriptionRequest;
import br.com.may.features.billing.application.gateway.PaymentGateway;
import br.com.may.features.billing.application.gateway.PaymentGatewayResolver;
import br.com.may.features.billing.domain.event.GatewayEvent;
import br.com.may.features.billing.domain.exception.GatewayRejectedException;
import br.com.may.features.billing.domain.exception.GatewayValidationException;
import br.com.may.features.billing.domain.model.BillingCycle;
import br.com.may.features.billing.domain.model.BillingOutcome;
import br.com.may.features.billing.domain.model.GatewayProvider;
import br.com.may.features.billing.domain.model.Money;
import br.com.may.features.billing.domain.model.Subscription;
import br.com.may.features.billing.domain.model.SubscriptionStatus;
import br.com.may.features.billing.infra.repository.SubscriptionRepository;
import br.com.may.features.user.domain.model.User;
import br.com.may.features.user.domain.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class RecurringBillingServiceImpl implements RecurringBillingService {

    static final String CHARGE_PENDING = "charge_pending";
    static final String SKIPPED_PREVIOUS_PENDING = "skipped_previous_charge_pending";
    private static final String GENERIC_FAILURE = "Não foi possível processar a cobrança recorrente";

    private final SubscriptionRepository subscriptionRepository;
    private final UserRepository userRepository;
    private final PaymentGatewayResolver gatewayResolver;
    private final PaymentLedgerService paymentLedgerService;
    private final PlanCatalog planCatalog;
    private final BillingMetricsService metricsService;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    @Override
    public RecurringBillingSummary runDueCharges() {
        LocalDateTime now = LocalDateTime.now(clock);
        List<Subscription> due = subscriptionRepository.findDueForRecurringCharge(SubscriptionStatus.ACTIVE,
                GatewayProvider.PAGARME,
                EnumSet.of(BillingCycle.MONTHLY, BillingCycle.SEMIANNUAL, BillingCycle.ANNUAL), now);
        if (due.isEmpty()) {
            log.info("Recurring billing: no subscriptions due");
            metricsService.recordRecurringRun(0, 0, 0);
            return new RecurringBillingSummary(0, 0, 0, List.of());
        }

        PaymentGateway gateway = gatewayResolver.forProvider(GatewayProvider.PAGARME);
        List<ChargeResult> results = new ArrayList<>();
        int successful = 0;
        int failed = 0;
        for (Subscription subscription : due) {
            ChargeResult result = chargeSafely(gateway, subscription);
            results.add(result);
            if (BillingOutcome.ACTIVATED.apiValue().equals(result.outcome())
                    || CHARGE_PENDING.equals(result.outcome())) {
                successful++;
            } else if (result.error() != null
                    || BillingOutcome.MARKED_PAST_DUE.apiValue().equals(result.outcome())
                    || BillingOutcome.FAILURE_RECORDED.apiValue().equals(result.outcome())) {
                failed++;
            }
        }

        log.info("Recurring billing: {} due, {} charged, {} failed", due.size(), successful, failed);
        metricsService.recordRecurringRun(due.size(), successful, failed);
        return new RecurringBillingSummary(due.size(), successful, failed, List.copyOf(results));
    }

    private ChargeResult chargeSafely(PaymentGateway gateway, Subscription subscription) {
        try {
            return charge(gateway, subscription);
        } catch (RuntimeException e) {
            log.error("Recurring charge for subscription {} failed", subscription.getId(), e);
            return recordChargeError(subscription, e);
        }
    }

    private ChargeResult charge(PaymentGateway gateway, Subscription subscription) {
        Optional<ChargeResult> settled = settlePreviousOrder(gateway, subscription);
        if (settled.isPresent()) {
            return settled.get();
        }

        User user = userRepository.findById(subscription.getUserId())
                .orElseThrow(() -> new IllegalStateException("User " + subscription.getUserId() + " not found"));
        if (!StringUtils.hasText(user.getProviderCustomerId())) {
            throw new GatewayValidationException(GatewayProvider.PAGARME, "No customer stored for user " + user.getId());
        }
        GatewayPaymentMethod card = gateway.findDefaultPaymentMethod(user.getProviderCustomerId())
                .orElseThrow(() -> new GatewayValidationException(GatewayProvider.PAGARME,
                        "No stored card for customer " + user.getProviderCustomerId()));

        String planName = planCatalog.find(subscription.getPlanCode())
                .map(PlanCatalog.Plan::displayName)
                .orElse(subscription.getPlanCode());
        GatewaySubscription result = gateway.createSubscription(GatewaySubscriptionRequest.builder()
                .userId(subscription.getUserId())
                .customerRef(user.getProviderCustomerId())
                .paymentMethodRef(card.ref())
                .planCode(subscription.getPlanCode())
                .planName(planName)
                .cycle(subscription.getBillingCycle())
                .amountCents(Money.toCents(subscription.getAmount()))
                .metadata(Map.of("recurring", "true", "subscription_id", subscription.getId().toString()))
                .build());

        if (result.status() == GatewayPaymentStatus.PAID && result.hasLedgerKey()) {
            LocalDateTime periodStart = subscription.getNextBillingAt();
            LocalDateTime periodEnd = subscription.getBillingCycle().advance(periodStart);
            BillingOutcome outcome = paymentLedgerService.confirmPayment(
                    GatewaySubscriptionEvents.renewed(result, subscription.getUserId(), periodStart, periodEnd));
            return new ChargeResult(subscription.getId(), subscription.getUserId(), outcome.apiValue(), null);
        }
        if (result.status() == GatewayPaymentStatus.PENDING
                || (result.status() == GatewayPaymentStatus.PAID && !result.hasLedgerKey())) {
            rememberOrder(subscription, result.orderRef());
            return new ChargeResult(subscription.getId(), subscription.getUserId(), CHARGE_PENDING, null);
        }

        BillingOutcome outcome = paymentLedgerService.recordFailure(
                GatewaySubscriptionEvents.failed(result, subscription.getUserId(), true));
        log.warn("Recurring charge for subscription {} declined: {}", subscription.getId(), result.failureReason());
        return new ChargeResult(subscription.getId(), subscription.getUserId(), outcome.apiValue(), null);
    }

    /**
     * Looks at the order left by the previous run before charging again. A pending order blocks the charge.
     * A paid order whose webhook never arrived is recorded as this period's renewal, so the customer is
     * not charged a second time for it.
     */
    private Optional<ChargeResult> settlePreviousOrder(PaymentGateway gateway, Subscription subscription) {
        String orderId = subscription.getProviderOrderId();
        if (orderId == null) {
            return Optional.empty();
        }
        GatewaySubscription previous = gateway.getStatus(orderId);
        if (previous.status() == GatewayPaymentStatus.PENDING
                || (previous.status() == GatewayPaymentStatus.PAID && !previous.hasLedgerKey())) {
            log.info("Subscription {} still has pending order {}; not charging again", subscription.getId(), orderId);
            return Optional.of(new ChargeResult(subscription.getId(), subscription.getUserId(),
                    SKIPPED_PREVIOUS_PENDING, null));
        }
        if (previous.status() != GatewayPaymentStatus.PAID) {
            return Optional.empty();
        }

        LocalDateTime periodStart = subscription.getNextBillingAt();
        LocalDateTime periodEnd = subscription.getBillingCycle().advance(periodStart);
        BillingOutcome outcome = paymentLedgerService.confirmPayment(
                GatewaySubscriptionEvents.renewed(previous, subscription.getUserId(), periodStart, periodEnd));
        if (outcome != BillingOutcome.ALREADY_PROCESSED) {
            log.info("Order {} of subscription {} was paid without a confirmation; recorded as renewal ({})",
                    orderId, subscription.getId(), outcome.apiValue());
            return Optional.of(new ChargeResult(subscription.getId(), subscription.getUserId(), outcome.apiValue(), null));
        }
        if (!stillDue(subscription.getId())) {
            log.info("Subscription {} was renewed since it was selected; not charging again", subscription.getId());
            return Optional.of(new ChargeResult(subscription.getId(), subscription.getUserId(), outcome.apiValue(), null));
        }
        return Optional.empty();
    }

    private boolean stillDue(UUID subscriptionId) {
        LocalDateTime now = LocalDateTime.now(clock);
        return subscriptionRepository.findById(subscriptionId)
                .filter(current -> current.getStatus() == SubscriptionStatus.ACTIVE)
                .map(Subscription::getNextBillingAt)
                .filter(nextBillingAt -> !nextBillingAt.isAfter(now))
                .isPresent();
    }

    private ChargeResult recordChargeError(Subscription subscription, RuntimeException error) {
        boolean integrationError = error instanceof GatewayRejectedException rejected && rejected.isIntegrationError();
        String reason = error instanceof GatewayRejectedException ? error.getMessage() : GENERIC_FAILURE;
        try {
            BillingOutcome outcome = paymentLedgerService.recordFailure(GatewayEvent.PaymentFailed.builder()
                    .provider(GatewayProvider.PAGARME)
                    .amountCents(Money.toCents(subscription.getAmount()))
                    .failureReason(reason)
                    .integrationError(integrationError)
                    .recurring(true)
                    .userIdHint(subscription.getUserId())
                    .build());
            return new ChargeResult(subscription.getId(), subscription.getUserId(), outcome.apiValue(),
                    error.getMessage());
        } catch (RuntimeException e) {
            log.error("Could not record recurring failure for subscription {}", subscription.getId(), e);
            return new ChargeResult(subscription.getId(), subscription.getUserId(), null, error.getMessage());
        }
    }

    private void rememberOrder(Subscription subscription, String orderId) {
        if (orderId == null) {
            return;
        }
        transactionTemplate.executeWithoutResult(status -> subscriptionRepository.findById(subscription.getId())
                .ifPresent(current -> {
                    current.setProviderOrderId(orderId);
                    subscriptionRepository.save(current);
                }));
    }
}
