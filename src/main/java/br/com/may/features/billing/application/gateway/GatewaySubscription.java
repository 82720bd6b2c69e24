package br.com.may.features.billing.application.gateway;

import br.com.may.features.billing.domain.model.GatewayProvider;
import lombok.Builder;

import java.time.LocalDateTime;

/**
 * Provider-neutral view of a subscription or order and its latest charge.
 * <p>
 * The ledger key of a paid status is {@code invoiceRef} for invoice-based providers and
 * {@code chargeRef} for the order/charge model. A status without either key cannot be recorded.
 */
@Builder
public record GatewaySubscription(
        GatewayProvider provider,
        String subscriptionRef,
        String orderRef,
        GatewayPaymentStatus status,
        String rawStatus,
        String chargeRef,
        String invoiceRef,
        Long amountCents,
        LocalDateTime periodStart,
        LocalDateTime periodEnd,
        String failureReason,
        boolean integrationError
) {

    public boolean hasLedgerKey() {
        return invoiceRef != null || chargeRef != null;
    }
}
