package br.com.may.features.billing.application;

/**
 * Every place a Pagar.me webhook may carry its shared secret. Values are raw, as received.
 */
public record WebhookCredentials(
        String pagarmeSecretHeader,
        String webhookSecretHeader,
        String authorizationHeader,
        String tokenParameter
) {

    public static WebhookCredentials none() {
        return new WebhookCredentials(null, null, null, null);
    }
}
