package br.com.may.features.billing.application;

import br.com.may.features.billing.application.gateway.GatewaySubscription;
import br.com.may.features.billing.domain.event.GatewayEvent;
import br.com.may.features.billing.domain.model.PaymentMethod;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Turns a status read from a gateway into the same ledger events a webhook would produce, so polling
 * and webhooks share one idempotency key per payment.
 */
public final class GatewaySubscriptionEvents {

    private GatewaySubscriptionEvents() {
    }

    public static GatewayEvent.PaymentConfirmed confirmed(GatewaySubscription status, UUID userId) {
        return GatewayEvent.PaymentConfirmed.builder()
                .provider(status.provider())
                .providerSubscriptionId(status.subscriptionRef())
                .providerOrderId(status.orderRef())
                .providerInvoiceId(status.invoiceRef())
                .providerTransactionId(transactionId(status))
                .amountCents(status.amountCents())
                .method(PaymentMethod.CREDIT_CARD)
                .periodStart(status.periodStart())
                .periodEnd(status.periodEnd())
                .userIdHint(userId)
                .build();
    }

    /**
     * Confirmation of a renewal charge. The new period starts where the paid one was due, not when the
     * charge happened to run.
     */
    public static GatewayEvent.PaymentConfirmed renewed(GatewaySubscription status, UUID userId,
                                                        LocalDateTime periodStart, LocalDateTime periodEnd) {
        return GatewayEvent.PaymentConfirmed.builder()
                .provider(status.provider())
                .providerSubscriptionId(status.subscriptionRef())
                .providerOrderId(status.orderRef())
                .providerInvoiceId(status.invoiceRef())
                .providerTransactionId(transactionId(status))
                .amountCents(status.amountCents())
                .method(PaymentMethod.CREDIT_CARD)
                .periodStart(periodStart)
                .periodEnd(periodEnd)
                .nextBillingAt(periodEnd)
                .userIdHint(userId)
                .build();
    }

    public static GatewayEvent.PaymentFailed failed(GatewaySubscription status, UUID userId, boolean recurring) {
        return GatewayEvent.PaymentFailed.builder()
                .provider(status.provider())
                .providerSubscriptionId(status.subscriptionRef())
                .providerOrderId(status.orderRef())
                .providerInvoiceId(status.invoiceRef())
                .providerTransactionId(transactionId(status))
                .amountCents(status.amountCents())
                .failureReason(status.failureReason())
                .integrationError(status.integrationError())
                .recurring(recurring)
                .userIdHint(userId)
                .build();
    }

    // order/charge model: the charge id, or the order id when the gateway did not return a charge
    private static String transactionId(GatewaySubscription status) {
        if (status.chargeRef() != null) {
            return status.chargeRef();
        }
        return status.invoiceRef() != null ? status.invoiceRef() : status.orderRef();
    }
}
