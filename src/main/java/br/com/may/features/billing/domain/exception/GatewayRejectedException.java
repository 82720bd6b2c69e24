package br.com.may.features.billing.domain.exception;

import br.com.may.features.billing.domain.model.GatewayProvider;
import lombok.Getter;

/**
 * The gateway understood the request and refused it. {@code integrationError} separates problems on
 * our side (bad credentials, account configuration) from a declined card.
 * <p>
 * The exception message is for logs. {@code customerMessage} is the issuer's reason, safe to show to
 * the payer, and is {@code null} when the gateway gave none.
 */
@Getter
public class GatewayRejectedException extends PaymentGatewayException {

    private final boolean integrationError;
    private final Integer httpStatus;
    private final String customerMessage;

    public GatewayRejectedException(GatewayProvider provider, String message, boolean integrationError,
                                    Integer httpStatus, String customerMessage, Throwable cause) {
        super(provider, integrationError ? "GATEWAY_INTEGRATION_ERROR" : "PAYMENT_DECLINED", message, cause);
        this.integrationError = integrationError;
        this.httpStatus = httpStatus;
        this.customerMessage = customerMessage;
    }

    public GatewayRejectedException(GatewayProvider provider, String message, boolean integrationError,
                                    Integer httpStatus, Throwable cause) {
        this(provider, message, integrationError, httpStatus, null, cause);
    }

    public GatewayRejectedException(GatewayProvider provider, String message, boolean integrationError) {
        this(provider, message, integrationError, null, null, null);
    }

    /**
     * A decline whose reason came from the issuer and can be shown to the payer as is.
     */
    public static GatewayRejectedException declined(GatewayProvider provider, String customerMessage) {
        return new GatewayRejectedException(provider, "Payment declined: " + customerMessage, false, null,
                customerMessage, null);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
