package br.com.may.features.billing.application.gateway;

/**
 * A card reference: a single-use token or a durable card/payment-method id, depending on the call.
 */
public record GatewayPaymentMethod(String ref, String brand, String lastFour) {
}
