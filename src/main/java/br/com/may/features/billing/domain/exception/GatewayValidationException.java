package br.com.may.features.billing.domain.exception;

import br.com.may.features.billing.domain.model.GatewayProvider;

/**
 * The request was refused locally before any gateway call: bad amount, wrong identifier prefix,
 * raw card data where a token was expected.
 */
public class GatewayValidationException extends PaymentGatewayException {

    public GatewayValidationException(GatewayProvider provider, String message) {
        super(provider, "INVALID_PAYMENT_REQUEST", message, null);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
