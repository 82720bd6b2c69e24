package br.com.may.features.billing.domain.exception;

/**
 * The webhook request did not carry a valid shared secret or signature. Nothing has been processed.
 */
public class WebhookAuthenticationException extends RuntimeException {
    public WebhookAuthenticationException(String message) {
        super(message);
    }

    public WebhookAuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
