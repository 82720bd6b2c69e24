package br.com.may.features.billing.domain.exception;

import br.com.may.features.billing.domain.model.GatewayProvider;
import lombok.Getter;

/**
 * Base type for failures talking to a payment gateway. Subclasses tell the caller whether a retry
 * can help ({@link GatewayNetworkException}) or not (rejections and invalid requests).
 */
@Getter
public abstract class PaymentGatewayException extends RuntimeException {

    private final GatewayProvider provider;
    private final String code;

    protected PaymentGatewayException(GatewayProvider provider, String code, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
        this.code = code;
    }

    public abstract boolean isRetryable();
}
