package br.com.may.features.billing.application.impl;

import br.com.may.features.billing.api.dto.AddressRequest;
import br.com.may.features.billing.api.dto.BillingInfoRequest;
import br.com.may.features.billing.api.dto.CancelSubscriptionResponse;
import br.com.may.features.billing.api.dto.ConfirmCheckoutRequest;
import br.com.may.features.billing.api.dto.ConfirmCheckoutResponse;
import br.com.may.features.billing.api.dto.CurrentSubscriptionResponse;
import br.com.may.features.billing.api.dto.ProcessPaymentRequest;
import br.com.may.features.billing.api.dto.ProcessPaymentResponse;
import br.com.may.features.billing.api.dto.StartSubscriptionRequest;
import br.com.may.features.billing.api.dto.StartSubscriptionResponse;
import br.com.may.features.billing.api.dto.SubscriptionDto;
import br.com.may.features.billing.api.dto.SubscriptionStatusResponse;
import br.com.may.features.billing.api.dto.TokenizeCardRequest;
import br.com.may.features.billing.api.dto.TokenizeCardResponse;
import br.com.may.features.billing.api.dto.TrialEligibilityResponse;
import br.com.may.features.billing.application.BillingNotifications;
import br.com.may.features.billing.application.BillingProperties;
import br.com.may.features.billing.application.GatewaySubscriptionEvents;
import br.com.may.features.billing.application.PaymentLedgerService;
import br.com.may.features.billing.application.PlanCatalog;
import br.com.may.features.billing.application.SubscriptionService;
import br.com.may.features.billing.application.gateway.CardData;
import br.com.may.features.billing.application.gateway.CustomerRequest;
import br.com.may.features.billing.application.gateway.GatewayCustomer;
import br.com.may.features.billing.application.gateway.GatewayIds;
import br.com.may.features.billing.application.gateway.GatewayPaymentMethod;
import br.com.may.features.billing.application.gateway.GatewaySubscription;
import br.com.may.features.billing.application.gateway.GatewaySubscriptionRequest;
import br.com.may.features.billing.application.gateway.PaymentGateway;
import br.com.may.features.billing.application.gateway.PaymentGatewayResolver;
import br.com.may.features.billing.domain.event.GatewayEvent;
import br.com.may.features.billing.domain.event.SubscriptionCanceledEvent;
import br.com.may.features.billing.domain.exception.GatewayRejectedException;
import br.com.may.features.billing.domain.exception.GatewayValidationException;
import br.com.may.features.billing.domain.exception.PaymentGatewayException;
import br.com.may.features.billing.domain.exception.ReactivationNotAllowedException;
import br.com.may.features.billing.domain.exception.SubscriptionAlreadyActiveException;
import br.com.may.features.billing.domain.exception.SubscriptionAlreadyCanceledException;
import br.com.may.features.billing.domain.exception.SubscriptionNotFoundException;
import br.com.may.features.billing.domain.exception.TrialAlreadyUsedException;
import br.com.may.features.billing.domain.model.BillingCycle;
import br.com.may.features.billing.domain.model.BillingOutcome;
import br.com.may.features.billing.domain.model.GatewayProvider;
import br.com.may.features.billing.domain.model.Money;
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
import br.com.may.shared.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * User-driven subscription lifecycle. Calls to the gateway run outside database transactions;
 * every local write around them uses its own short transaction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SubscriptionServiceImpl implements SubscriptionService {

    private static final int RECENT_PAYMENTS = 10;

    private final SubscriptionRepository subscriptionRepository;
    private final PaymentRepository paymentRepository;
    private final UserRepository userRepository;
    private final PaymentGateway paymentGateway;
    private final PaymentGatewayResolver gatewayResolver;
    private final PaymentLedgerService paymentLedgerService;
    private final NotificationService notificationService;
    private final PlanCatalog planCatalog;
    private final BillingProperties billingProperties;
    private final ApplicationEventPublisher eventPublisher;
    private final TransactionTemplate transactionTemplate;
    private final SubscriptionMapper subscriptionMapper;
    private final PaymentMapper paymentMapper;
    private final Clock clock;

    @Override
    @Transactional
    public StartSubscriptionResponse start(UUID userId, StartSubscriptionRequest request) {
        User user = requireUser(userId);
        LocalDateTime now = LocalDateTime.now(clock);
        Subscription existing = subscriptionRepository.findByUserId(userId).orElse(null);
        boolean trial = PlanCatalog.TRIAL.equalsIgnoreCase(request.plan().trim());
        if (trial && user.isTrialUsed()) {
            throw new TrialAlreadyUsedException(userId);
        }
        if (existing != null && existing.getStatus().isLive()) {
            throw new SubscriptionAlreadyActiveException(existing.getStatus());
        }
        if (trial) {
            return startTrial(user, existing, now);
        }

        PlanCatalog.Plan plan = planCatalog.requirePurchasable(request.plan());
        BillingCycle cycle = BillingCycle.fromValue(request.billingCycle());
        BigDecimal amount = planCatalog.price(plan, cycle);
        Subscription subscription = preparePending(userId, existing, plan.code(), cycle, amount, null);

        log.info("User {} started checkout for plan {} ({}, {})", userId, plan.code(), cycle.apiValue(), amount);
        return new StartSubscriptionResponse(
                statusValue(subscription.getStatus()),
                subscription.getId(),
                plan.code(),
                cycle.apiValue(),
                amount,
                null,
                providerValue(paymentGateway.provider()),
                paymentGateway.publicKey());
    }

    private StartSubscriptionResponse startTrial(User user, Subscription existing, LocalDateTime now) {
        LocalDateTime trialEndsAt = now.plusDays(billingProperties.getTrialDays());
        Subscription subscription;
        if (existing == null) {
            subscription = Subscription.trial(user.getId(), now, trialEndsAt);
        } else {
            subscription = existing;
            subscription.beginTrial(now, trialEndsAt);
        }
        subscription = subscriptionRepository.save(subscription);

        user.setTrialUsed(true);
        user.setTrialStartedAt(now);
        userRepository.save(user);

        notificationService.notifyOnce(user.getId(), BillingNotifications.WELCOME,
                BillingNotifications.welcomeTrial(billingProperties.getTrialDays()),
                NotificationKind.SUCCESS, billingProperties.getNotificationWindowMinutes());

        log.info("Trial started for user {} until {}", user.getId(), trialEndsAt);
        return new StartSubscriptionResponse(
                statusValue(subscription.getStatus()),
                subscription.getId(),
                PlanCatalog.TRIAL,
                subscription.getBillingCycle().apiValue(),
                subscription.getAmount(),
                trialEndsAt,
                null,
                null);
    }

    @Override
    public ProcessPaymentResponse processPayment(UUID userId, ProcessPaymentRequest request) {
        GatewayProvider provider = paymentGateway.provider();
        PlanCatalog.Plan plan = planCatalog.requirePurchasable(request.plan());
        if (plan.isTrial()) {
            throw new IllegalArgumentException("The trial plan is started without payment");
        }
        BillingCycle cycle = BillingCycle.fromValue(request.billingCycle());
        long amountCents = planCatalog.priceCents(plan, cycle);
        BillingInfoRequest billingInfo = request.billingInfo();
        String document = requireDocument(provider, billingInfo.document());
        String phone = digitsOnly(billingInfo.phone());
        if (phone.length() < 10) {
            throw new GatewayValidationException(provider, "Phone must include the area code");
        }
        boolean storedCard = StringUtils.hasText(request.cardId());
        validatePaymentSource(provider, request.cardToken(), request.cardId());

        User user = requireUser(userId);
        PendingCheckout checkout = transactionTemplate.execute(status -> {
            Subscription existing = subscriptionRepository.findByUserId(userId).orElse(null);
            if (existing != null && existing.getStatus() == SubscriptionStatus.ACTIVE) {
                throw new SubscriptionAlreadyActiveException(existing.getStatus());
            }
            GatewayProvider previousProvider = existing != null ? existing.getProvider() : null;
            String previousSubscriptionRef = existing != null ? existing.getProviderSubscriptionId() : null;
            Subscription pending = preparePending(userId, existing, plan.code(), cycle, Money.fromCents(amountCents),
                    provider);
            return new PendingCheckout(pending.getId(), previousProvider, previousSubscriptionRef);
        });
        UUID subscriptionId = checkout.subscriptionId();

        GatewayCustomer customer = paymentGateway.createOrGetCustomer(new CustomerRequest(
                userId, customerRef(user, provider), billingInfo.name(), billingInfo.email(), document, phone,
                toAddress(billingInfo.address())));
        if (!customer.customerRef().equals(customerRef(user, provider))) {
            storeCustomerRef(user, provider, customer.customerRef());
        }

        String paymentMethodRef = storedCard
                ? request.cardId()
                : paymentGateway.attachPaymentMethod(customer.customerRef(), request.cardToken()).ref();

        GatewaySubscription result = paymentGateway.createSubscription(GatewaySubscriptionRequest.builder()
                .userId(userId)
                .customerRef(customer.customerRef())
                .paymentMethodRef(paymentMethodRef)
                .planCode(plan.code())
                .planName(plan.displayName())
                .cycle(cycle)
                .amountCents(amountCents)
                .metadata(Map.of("subscription_id", subscriptionId.toString()))
                .build());
        rememberGatewayReferences(subscriptionId, result);
        if (checkout.previousSubscriptionRef() != null
                && !checkout.previousSubscriptionRef().equals(result.subscriptionRef())) {
            // the new checkout replaces the old provider subscription, which must stop billing
            cancelAtGateway(checkout.previousProvider(), checkout.previousSubscriptionRef());
        }

        return switch (result.status()) {
            case PAID -> {
                BillingOutcome outcome = result.hasLedgerKey()
                        ? paymentLedgerService.confirmPayment(GatewaySubscriptionEvents.confirmed(result, userId))
                        : BillingOutcome.PENDING;
                Subscription subscription = requireSubscription(userId);
                log.info("Checkout for user {} captured at {} ({})", userId, provider, outcome.apiValue());
                yield new ProcessPaymentResponse(statusValue(subscription.getStatus()), subscriptionId,
                        reference(result), subscription.getCurrentPeriodEnd(),
                        outcome == BillingOutcome.PENDING ? "Pagamento aprovado, aguardando confirmação" : "Pagamento confirmado");
            }
            case FAILED, CANCELED -> {
                paymentLedgerService.recordFailure(GatewaySubscriptionEvents.failed(result, userId, false));
                if (result.integrationError()) {
                    throw new GatewayRejectedException(provider,
                            "Checkout rejected by configuration: " + result.failureReason(), true);
                }
                throw result.failureReason() != null
                        ? GatewayRejectedException.declined(provider, result.failureReason())
                        : new GatewayRejectedException(provider, "Checkout declined without a reason", false);
            }
            case PENDING -> {
                notificationService.notifyOnce(userId, BillingNotifications.PAYMENT_PROCESSING,
                        BillingNotifications.paymentProcessing(plan.displayName()),
                        NotificationKind.INFO, billingProperties.getNotificationWindowMinutes());
                log.info("Checkout for user {} is pending at {} ({})", userId, provider, reference(result));
                yield new ProcessPaymentResponse(statusValue(SubscriptionStatus.PENDING), subscriptionId,
                        reference(result), null, "Pagamento em processamento");
            }
        };
    }

    @Override
    public ConfirmCheckoutResponse confirmCheckout(UUID userId, ConfirmCheckoutRequest request) {
        if (paymentRepository.findByProviderTransactionId("sim_" + request.sessionId()).isPresent()) {
            Subscription current = requireSubscription(userId);
            log.info("Checkout session {} already confirmed for user {}", request.sessionId(), userId);
            return new ConfirmCheckoutResponse(BillingOutcome.ALREADY_PROCESSED.apiValue(), current.getId(),
                    statusValue(current.getStatus()), current.getCurrentPeriodEnd());
        }

        PlanCatalog.Plan plan = planCatalog.requirePurchasable(request.plan());
        BillingCycle cycle = BillingCycle.fromValue(request.billingCycle());
        BigDecimal amount = planCatalog.price(plan, cycle);
        requireUser(userId);
        transactionTemplate.executeWithoutResult(status -> preparePending(userId,
                subscriptionRepository.findByUserId(userId).orElse(null),
                plan.code(), cycle, amount, GatewayProvider.SIMULATED));

        BillingOutcome outcome = paymentLedgerService.recordSimulatedPayment(userId, request.sessionId());
        Subscription subscription = requireSubscription(userId);
        log.info("Simulated checkout {} for user {}: {}", request.sessionId(), userId, outcome.apiValue());
        return new ConfirmCheckoutResponse(outcome.apiValue(), subscription.getId(),
                statusValue(subscription.getStatus()), subscription.getCurrentPeriodEnd());
    }

    @Override
    public CancelSubscriptionResponse cancel(UUID userId) {
        Subscription subscription = requireSubscription(userId);
        if (subscription.getStatus() == SubscriptionStatus.CANCELED
                || subscription.getStatus() == SubscriptionStatus.EXPIRED) {
            throw new SubscriptionAlreadyCanceledException();
        }

        cancelAtGateway(subscription.getProvider(), subscription.getProviderSubscriptionId() != null
                ? subscription.getProviderSubscriptionId()
                : subscription.getProviderOrderId());

        LocalDateTime now = LocalDateTime.now(clock);
        Subscription canceled = transactionTemplate.execute(status -> {
            Subscription current = subscriptionRepository.findById(subscription.getId())
                    .orElseThrow(() -> new SubscriptionNotFoundException(userId));
            if (current.getStatus() == SubscriptionStatus.CANCELED) {
                throw new SubscriptionAlreadyCanceledException();
            }
            applyCancellation(current, now, null);
            return current;
        });

        log.info("User {} canceled subscription {}; access until {}", userId, canceled.getId(),
                canceled.getCurrentPeriodEnd());
        return new CancelSubscriptionResponse(statusValue(canceled.getStatus()), canceled.getCanceledAt(),
                canceled.getCurrentPeriodEnd(), BillingNotifications.subscriptionCanceled(canceled.getCurrentPeriodEnd()));
    }

    private void cancelAtGateway(GatewayProvider provider, String reference) {
        if (reference == null || provider == null || provider == GatewayProvider.SIMULATED) {
            return;
        }
        try {
            gatewayResolver.forProvider(provider).cancelSubscription(reference);
        } catch (PaymentGatewayException e) {
            // the local cancellation stands; the gateway side is retried by support if needed
            log.warn("Could not cancel {} at {} ({}): {}", reference, provider, e.getCode(), e.getMessage());
        }
    }

    @Override
    @Transactional
    public SubscriptionDto reactivate(UUID userId) {
        Subscription subscription = requireSubscription(userId);
        LocalDateTime now = LocalDateTime.now(clock);
        if (subscription.getStatus() != SubscriptionStatus.CANCELED) {
            throw new ReactivationNotAllowedException("Only canceled subscriptions can be reactivated");
        }
        if (subscription.getCurrentPeriodEnd() == null || !now.isBefore(subscription.getCurrentPeriodEnd())) {
            throw new ReactivationNotAllowedException("The paid period has ended; start a new checkout");
        }
        if (!paymentRepository.existsBySubscriptionIdAndStatus(subscription.getId(), PaymentStatus.PAID)) {
            throw new ReactivationNotAllowedException("There is no paid period to resume; start a new checkout");
        }
        if (subscription.getProviderSubscriptionId() != null) {
            // the provider-side subscription was canceled and will not bill again
            throw new ReactivationNotAllowedException(
                    "This subscription was canceled at the payment provider; start a new checkout");
        }

        subscription.transitionTo(SubscriptionStatus.ACTIVE, now);
        if (subscription.getNextBillingAt() == null) {
            subscription.setNextBillingAt(subscription.getCurrentPeriodEnd());
        }
        subscriptionRepository.save(subscription);
        notificationService.notifyOnce(userId, BillingNotifications.SUBSCRIPTION_REACTIVATED,
                BillingNotifications.subscriptionReactivated(subscription.getPlanCode()),
                NotificationKind.SUCCESS, billingProperties.getNotificationWindowMinutes());
        log.info("User {} reactivated subscription {}", userId, subscription.getId());
        return subscriptionMapper.toDto(subscription);
    }

    @Override
    @Transactional(readOnly = true)
    public SubscriptionStatusResponse getStatus(UUID userId) {
        User user = requireUser(userId);
        Optional<Subscription> found = subscriptionRepository.findByUserId(userId);
        if (found.isEmpty()) {
            return new SubscriptionStatusResponse("none", null, null, null, null, null, null, null, 0,
                    user.isTrialUsed(), !user.isTrialUsed(), false);
        }
        Subscription subscription = found.get();
        LocalDateTime now = LocalDateTime.now(clock);
        return new SubscriptionStatusResponse(
                statusValue(subscription.getStatus()),
                subscription.getPlanCode(),
                subscription.getBillingCycle().apiValue(),
                subscription.getCurrentPeriodStart(),
                subscription.getCurrentPeriodEnd(),
                subscription.getNextBillingAt(),
                subscription.getTrialEndsAt(),
                subscription.getCanceledAt(),
                daysRemaining(subscription.getCurrentPeriodEnd(), now),
                user.isTrialUsed(),
                !user.isTrialUsed() && !subscription.getStatus().isLive(),
                subscription.grantsAccess(now));
    }

    @Override
    @Transactional(readOnly = true)
    public TrialEligibilityResponse getTrialEligibility(UUID userId) {
        User user = requireUser(userId);
        if (user.isTrialUsed()) {
            return new TrialEligibilityResponse(false, true, "trial_already_used");
        }
        Optional<Subscription> live = subscriptionRepository.findByUserId(userId)
                .filter(subscription -> subscription.getStatus().isLive());
        if (live.isPresent()) {
            return new TrialEligibilityResponse(false, false, "subscription_active");
        }
        return new TrialEligibilityResponse(true, false, null);
    }

    @Override
    @Transactional(readOnly = true)
    public CurrentSubscriptionResponse getCurrent(UUID userId) {
        Subscription subscription = requireSubscription(userId);
        return new CurrentSubscriptionResponse(
                subscriptionMapper.toDto(subscription),
                paymentMapper.toDtos(paymentRepository.findBySubscriptionIdOrderByCreatedAtDesc(
                        subscription.getId(), PageRequest.of(0, RECENT_PAYMENTS))));
    }

    @Override
    public TokenizeCardResponse tokenizeCard(TokenizeCardRequest request) {
        CardData card = new CardData(request.number(), request.holderName(), request.expMonth(),
                request.expYear(), request.cvv());
        GatewayPaymentMethod token = paymentGateway.tokenizeCard(card);
        return new TokenizeCardResponse(token.ref(), token.brand(),
                token.lastFour() != null ? token.lastFour() : card.lastFour());
    }

    @Override
    @Transactional
    public BillingOutcome handleGatewayCancellation(GatewayEvent.SubscriptionCanceled event) {
        Optional<Subscription> found = findByProviderSubscriptionId(event.providerSubscriptionId());
        if (found.isEmpty()) {
            log.info("Cancellation for unknown provider subscription {}", event.providerSubscriptionId());
            return BillingOutcome.SUBSCRIPTION_NOT_FOUND;
        }
        Subscription subscription = found.get();
        if (subscription.getStatus() == SubscriptionStatus.CANCELED) {
            log.info("Subscription {} already canceled", subscription.getId());
            return BillingOutcome.ALREADY_PROCESSED;
        }
        if (!subscription.getStatus().canTransitionTo(SubscriptionStatus.CANCELED)) {
            log.info("Skipping cancellation of subscription {} in state {}", subscription.getId(),
                    subscription.getStatus());
            return BillingOutcome.IGNORED;
        }
        applyCancellation(subscription, LocalDateTime.now(clock), event.canceledAt());
        log.info("Subscription {} canceled by {}", subscription.getId(), event.provider());
        return BillingOutcome.CANCELED;
    }

    @Override
    @Transactional
    public BillingOutcome handleGatewayUpdate(GatewayEvent.SubscriptionUpdated event) {
        Optional<Subscription> found = findByProviderSubscriptionId(event.providerSubscriptionId());
        if (found.isEmpty()) {
            log.info("Update for unknown provider subscription {}", event.providerSubscriptionId());
            return BillingOutcome.SUBSCRIPTION_NOT_FOUND;
        }
        Subscription subscription = found.get();
        LocalDateTime now = LocalDateTime.now(clock);
        boolean changed = false;

        if (event.planCode() != null && !event.planCode().equals(subscription.getPlanCode())
                && planCatalog.find(event.planCode()).isPresent()) {
            subscription.setPlanCode(planCatalog.find(event.planCode()).get().code());
            changed = true;
        }
        if (event.periodEnd() != null && !event.periodEnd().equals(subscription.getCurrentPeriodEnd())) {
            log.info("Provider period end {} differs from local {} for subscription {}; waiting for a paid event",
                    event.periodEnd(), subscription.getCurrentPeriodEnd(), subscription.getId());
        }

        SubscriptionStatus target = event.mappedStatus();
        SubscriptionStatus current = subscription.getStatus();
        if (target != null && target != current) {
            if (!current.canTransitionTo(target)) {
                log.info("Skipping provider status {} for subscription {} in state {}", target,
                        subscription.getId(), current);
            } else {
                switch (target) {
                    case PAST_DUE, EXPIRED -> {
                        subscription.transitionTo(target, now);
                        changed = true;
                    }
                    case CANCELED -> {
                        applyCancellation(subscription, now, null);
                        changed = true;
                    }
                    case ACTIVE -> {
                        if (paymentRepository.existsBySubscriptionIdAndStatus(subscription.getId(), PaymentStatus.PAID)) {
                            subscription.transitionTo(SubscriptionStatus.ACTIVE, now);
                            changed = true;
                        } else {
                            log.info("Provider reports subscription {} active but no payment is recorded; "
                                    + "waiting for the paid event", subscription.getId());
                        }
                    }
                    default -> log.info("Provider status {} is not applied from update events", target);
                }
            }
        }

        if (!changed) {
            return BillingOutcome.ACKNOWLEDGED;
        }
        subscriptionRepository.save(subscription);
        log.info("Subscription {} updated from {} event (status {})", subscription.getId(), event.provider(),
                subscription.getStatus());
        return BillingOutcome.UPDATED;
    }

    private void applyCancellation(Subscription subscription, LocalDateTime now, LocalDateTime canceledAt) {
        subscription.transitionTo(SubscriptionStatus.CANCELED, now);
        if (canceledAt != null) {
            subscription.setCanceledAt(canceledAt);
        }
        subscriptionRepository.save(subscription);
        notificationService.notifyOnce(subscription.getUserId(), BillingNotifications.SUBSCRIPTION_CANCELED,
                BillingNotifications.subscriptionCanceled(subscription.getCurrentPeriodEnd()),
                NotificationKind.INFO, billingProperties.getNotificationWindowMinutes());
        eventPublisher.publishEvent(new SubscriptionCanceledEvent(this, subscription.getUserId(),
                subscription.getId(), subscription.getCurrentPeriodEnd()));
    }

    /**
     * Reuse the user's row for a new checkout. A canceled or expired row starts a new lifecycle; a row still
     * in its lifecycle drops the gateway references of the earlier checkout so the new charge is matched.
     */
    private Subscription preparePending(UUID userId, Subscription existing, String planCode, BillingCycle cycle,
                                        BigDecimal amount, GatewayProvider provider) {
        Subscription subscription;
        if (existing == null) {
            subscription = Subscription.pending(userId, planCode, cycle, amount);
        } else {
            subscription = existing;
            if (subscription.getStatus().canRestartAs(SubscriptionStatus.PENDING)) {
                subscription.beginNewLifecycle(SubscriptionStatus.PENDING);
            } else {
                subscription.clearGatewayReferences();
            }
            subscription.setPlanCode(planCode);
            subscription.setBillingCycle(cycle);
            subscription.setAmount(amount);
        }
        if (provider != null) {
            subscription.setProvider(provider);
        }
        return subscriptionRepository.save(subscription);
    }

    private void rememberGatewayReferences(UUID subscriptionId, GatewaySubscription result) {
        transactionTemplate.executeWithoutResult(status -> subscriptionRepository.findById(subscriptionId)
                .ifPresent(subscription -> {
                    subscription.setProviderOrderId(result.orderRef());
                    subscription.setProviderSubscriptionId(result.subscriptionRef());
                    subscriptionRepository.save(subscription);
                }));
    }

    private record PendingCheckout(UUID subscriptionId, GatewayProvider previousProvider,
                                   String previousSubscriptionRef) {
    }

    private void validatePaymentSource(GatewayProvider provider, String cardToken, String cardId) {
        if (StringUtils.hasText(cardId)) {
            GatewayIds.require(provider, cardId, provider == GatewayProvider.STRIPE ? "pm_" : "card_", "cardId");
            return;
        }
        if (!StringUtils.hasText(cardToken)) {
            throw new GatewayValidationException(provider, "cardToken or cardId is required");
        }
        if (cardToken.replaceAll("[\\s-]", "").matches("\\d{12,19}")) {
            throw new GatewayValidationException(provider, "Raw card numbers are not accepted; tokenize the card first");
        }
        GatewayIds.require(provider, cardToken, provider == GatewayProvider.STRIPE ? "pm_" : "token_", "cardToken");
    }

    private static String requireDocument(GatewayProvider provider, String document) {
        String digits = digitsOnly(document);
        if (digits.length() != 11 && digits.length() != 14) {
            throw new GatewayValidationException(provider, "Document must be a CPF (11 digits) or a CNPJ (14 digits)");
        }
        return digits;
    }

    private static CustomerRequest.Address toAddress(AddressRequest address) {
        return new CustomerRequest.Address(address.line1(), address.line2(), digitsOnly(address.zipCode()),
                address.city(), address.state(), address.country() != null ? address.country() : "BR");
    }

    private static String customerRef(User user, GatewayProvider provider) {
        return provider == GatewayProvider.STRIPE ? user.getStripeCustomerId() : user.getProviderCustomerId();
    }

    private void storeCustomerRef(User user, GatewayProvider provider, String customerRef) {
        if (provider == GatewayProvider.STRIPE) {
            user.setStripeCustomerId(customerRef);
        } else {
            user.setProviderCustomerId(customerRef);
        }
        userRepository.save(user);
    }

    private Optional<Subscription> findByProviderSubscriptionId(String providerSubscriptionId) {
        if (providerSubscriptionId == null) {
            return Optional.empty();
        }
        return subscriptionRepository.findByProviderSubscriptionId(providerSubscriptionId);
    }

    private User requireUser(UUID userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User " + userId + " not found"));
    }

    private Subscription requireSubscription(UUID userId) {
        return subscriptionRepository.findByUserId(userId)
                .orElseThrow(() -> new SubscriptionNotFoundException(userId));
    }

    private static String reference(GatewaySubscription result) {
        return result.subscriptionRef() != null ? result.subscriptionRef() : result.orderRef();
    }

    private static long daysRemaining(LocalDateTime periodEnd, LocalDateTime now) {
        if (periodEnd == null || !now.isBefore(periodEnd)) {
            return 0;
        }
        return ChronoUnit.DAYS.between(now, periodEnd);
    }

    private static String digitsOnly(String value) {
        return value == null ? "" : value.replaceAll("\\D", "");
    }

    private static String statusValue(SubscriptionStatus status) {
        return status.name().toLowerCase(Locale.ROOT);
    }

    private static String providerValue(GatewayProvider provider) {
        return provider != null ? provider.name().toLowerCase(Locale.ROOT) : null;
    }
}
