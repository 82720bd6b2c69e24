package br.com.may.features.billing.application.gateway;

/**
 * A concrete provider adapter. The routing gateway chooses among these by {@link #provider()}.
 */
public interface SelectablePaymentGateway extends PaymentGateway {
}
