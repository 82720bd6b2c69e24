package br.com.may.features.billing.domain.event;

import br.com.may.features.billing.domain.model.GatewayProvider;
import br.com.may.features.billing.domain.model.PaymentMethod;
import br.com.may.features.billing.domain.model.SubscriptionStatus;
import lombok.Builder;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Provider-neutral event produced by translating a webhook, a reconciliation poll or a recurring
 * charge. Each provider adapter maps its own event names onto these.
 */
public interface GatewayEvent {

    /**
     * Money was captured. {@link #ledgerKey()} is the idempotency key.
     */
    @Builder
    record PaymentConfirmed(
            GatewayProvider provider,
            String providerSubscriptionId,
            String providerOrderId,
            String providerInvoiceId,
            String providerTransactionId,
            Long amountCents,
            PaymentMethod method,
            LocalDateTime periodStart,
            LocalDateTime periodEnd,
            LocalDateTime nextBillingAt,
            LocalDateTime paidAt,
            UUID userIdHint
    ) implements GatewayEvent {

        public String ledgerKey() {
            return providerInvoiceId != null ? providerInvoiceId : providerTransactionId;
        }
    }

    @Builder
    record PaymentFailed(
            GatewayProvider provider,
            String providerSubscriptionId,
            String providerOrderId,
            String providerInvoiceId,
            String providerTransactionId,
            Long amountCents,
            String failureReason,
            boolean integrationError,
            boolean recurring,
            UUID userIdHint
    ) implements GatewayEvent {

        public String ledgerKey() {
            return providerInvoiceId != null ? providerInvoiceId : providerTransactionId;
        }
    }

    record SubscriptionCanceled(
            GatewayProvider provider,
            String providerSubscriptionId,
            LocalDateTime canceledAt
    ) implements GatewayEvent {
    }

    /**
     * Provider-side change to a subscription. {@code mappedStatus} is null when the provider status
     * has no local counterpart. {@code periodEnd} is informational; only paid events move the period.
     */
    record SubscriptionUpdated(
            GatewayProvider provider,
            String providerSubscriptionId,
            SubscriptionStatus mappedStatus,
            LocalDateTime periodEnd,
            String planCode
    ) implements GatewayEvent {
    }

    /**
     * A known event that carries no state change, such as a creation marker.
     */
    record Acknowledged(String eventType, String reason) implements GatewayEvent {
    }

    record Ignored(String eventType) implements GatewayEvent {
    }
}
