package br.com.may.features.billing.application.impl;

import br.com.may.features.billing.api.dto.CheckPaymentResponse;
import br.com.may.features.billing.api.dto.ReconciliationReport;
import br.com.may.features.billing.application.BillingMetricsService;
import br.com.may.features.billing.application.BillingProperties;
import br.com.may.features.billing.application.GatewaySubscriptionEvents;
import br.com.may.features.billing.application.PaymentLedgerService;
import br.com.may.features.billing.application.ReconciliationService;
import br.com.may.features.billing.application.gateway.GatewayPaymentStatus;
import br.com.may.features.billing.application.gateway.GatewaySubscription;
import br.com.may.features.billing.application.gateway.PaymentGatewayResolver;
import br.com.may.features.billing.domain.exception.PaymentGatewayException;
import br.com.may.features.billing.domain.exception.SubscriptionNotFoundException;
import br.com.may.features.billing.domain.model.BillingOutcome;
import br.com.may.features.billing.domain.model.GatewayProvider;
import br.com.may.features.billing.domain.model.Subscription;
import br.com.may.features.billing.domain.model.SubscriptionStatus;
import br.com.may.features.billing.infra.repository.SubscriptionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class ReconciliationServiceImpl implements ReconciliationService {

    static final String AWAITING_INVOICE = "gateway_active_awaiting_invoice";
    static final String NO_GATEWAY_REFERENCE = "no_gateway_reference";
    static final String NO_CHARGE_TO_RECORD = "gateway_failed_without_charge";

    private final SubscriptionRepository subscriptionRepository;
    private final PaymentGatewayResolver gatewayResolver;
    private final PaymentLedgerService paymentLedgerService;
    private final BillingMetricsService metricsService;
    private final BillingProperties billingProperties;
    private final Clock clock;

    @Override
    public ReconciliationReport verify(UUID userId) {
        Subscription subscription = requireSubscription(userId);
        String localStatus = lower(subscription.getStatus());
        String reference = gatewayReference(subscription);
        if (reference == null) {
            return new ReconciliationReport(localStatus, null, null, false, "local", null, null,
                    subscription.getCurrentPeriodEnd());
        }

        try {
            GatewaySubscription remote = gatewayResolver.forProvider(subscription.getProvider()).getStatus(reference);
            boolean discrepancy = disagrees(subscription.getStatus(), remote.status());
            if (discrepancy) {
                log.warn("Subscription {} is {} locally but {} at {} ({})", subscription.getId(),
                        subscription.getStatus(), remote.status(), subscription.getProvider(), reference);
            }
            metricsService.recordReconciliation(discrepancy ? "discrepancy" : "in_sync");
            return new ReconciliationReport(localStatus, lower(remote.status()), remote.rawStatus(), discrepancy,
                    "gateway", null, reference, subscription.getCurrentPeriodEnd());
        } catch (PaymentGatewayException e) {
            log.warn("Could not verify subscription {} at {}: {}", subscription.getId(),
                    subscription.getProvider(), e.getMessage());
            metricsService.recordReconciliation("gateway_error");
            return new ReconciliationReport(localStatus, null, null, false, "local",
                    e.getCode() + ": " + e.getMessage(), reference, subscription.getCurrentPeriodEnd());
        }
    }

    @Override
    public CheckPaymentResponse checkPayment(UUID userId) {
        Subscription subscription = requireSubscription(userId);
        String reference = gatewayReference(subscription);
        if (reference == null) {
            return new CheckPaymentResponse(NO_GATEWAY_REFERENCE, lower(subscription.getStatus()),
                    "Nenhuma cobrança para verificar no gateway");
        }

        GatewaySubscription remote = gatewayResolver.forProvider(subscription.getProvider()).getStatus(reference);
        String outcome = switch (remote.status()) {
            case PAID -> remote.hasLedgerKey()
                    ? paymentLedgerService.confirmPayment(GatewaySubscriptionEvents.confirmed(remote, userId)).apiValue()
                    : AWAITING_INVOICE;
            case PENDING -> BillingOutcome.PENDING.apiValue();
            case FAILED, CANCELED -> remote.hasLedgerKey()
                    ? paymentLedgerService.recordFailure(GatewaySubscriptionEvents.failed(remote, userId, false)).apiValue()
                    : NO_CHARGE_TO_RECORD;
        };
        metricsService.recordReconciliation(outcome);

        Subscription refreshed = requireSubscription(userId);
        log.info("Checked payment of subscription {} at {} ({}): gateway {} -> {}", refreshed.getId(),
                refreshed.getProvider(), reference, remote.status(), outcome);
        return new CheckPaymentResponse(outcome, lower(refreshed.getStatus()), message(remote.status()));
    }

    @Override
    public PendingReconciliationSummary reconcilePending() {
        LocalDateTime cutoff = LocalDateTime.now(clock).minus(billingProperties.getReconciliation().getPendingMinAge());
        List<Subscription> pending = subscriptionRepository.findByStatusAndUpdatedAtBefore(SubscriptionStatus.PENDING, cutoff);
        int checked = 0;
        int activated = 0;
        int failed = 0;
        for (Subscription subscription : pending) {
            if (gatewayReference(subscription) == null) {
                continue;
            }
            checked++;
            try {
                CheckPaymentResponse result = checkPayment(subscription.getUserId());
                if (BillingOutcome.ACTIVATED.apiValue().equals(result.outcome())) {
                    activated++;
                }
            } catch (RuntimeException e) {
                failed++;
                log.error("Reconciliation of pending subscription {} failed", subscription.getId(), e);
            }
        }
        if (!pending.isEmpty()) {
            log.info("Pending reconciliation: {} candidates, {} checked, {} activated, {} failed",
                    pending.size(), checked, activated, failed);
        }
        return new PendingReconciliationSummary(checked, activated, failed);
    }

    /**
     * A paid gateway state against a local state without a paid period, or a live local state against
     * a gateway that stopped charging.
     */
    static boolean disagrees(SubscriptionStatus local, GatewayPaymentStatus remote) {
        return switch (remote) {
            case PAID -> local == SubscriptionStatus.PENDING
                    || local == SubscriptionStatus.PAST_DUE
                    || local == SubscriptionStatus.EXPIRED;
            case FAILED -> local == SubscriptionStatus.ACTIVE;
            case CANCELED -> local.isLive();
            case PENDING -> false;
        };
    }

    private static String gatewayReference(Subscription subscription) {
        GatewayProvider provider = subscription.getProvider();
        if (provider == null || provider == GatewayProvider.SIMULATED) {
            return null;
        }
        return subscription.getProviderSubscriptionId() != null
                ? subscription.getProviderSubscriptionId()
                : subscription.getProviderOrderId();
    }

    private static String message(GatewayPaymentStatus status) {
        return switch (status) {
            case PAID -> "Pagamento confirmado pelo gateway";
            case PENDING -> "Pagamento ainda em processamento";
            case FAILED -> "Pagamento recusado pelo gateway";
            case CANCELED -> "Cobrança cancelada no gateway";
        };
    }

    private Subscription requireSubscription(UUID userId) {
        return subscriptionRepository.findByUserId(userId)
                .orElseThrow(() -> new SubscriptionNotFoundException(userId));
    }

    private static String lower(Enum<?> value) {
        return value == null ? null : value.name().toLowerCase(Locale.ROOT);
    }
}
