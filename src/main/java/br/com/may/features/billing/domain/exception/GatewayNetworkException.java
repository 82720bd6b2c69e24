package br.com.may.features.billing.domain.exception;

import br.com.may.features.billing.domain.model.GatewayProvider;

/**
 * Timeout, connection reset, TLS failure or a 5xx answer. Safe to retry.
 */
public class GatewayNetworkException extends PaymentGatewayException {

    public GatewayNetworkException(GatewayProvider provider, String message, Throwable cause) {
        super(provider, "GATEWAY_UNAVAILABLE", message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
