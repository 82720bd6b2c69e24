package br.com.may.features.billing.domain.model;

public enum GatewayProvider {
    PAGARME,
    STRIPE,
    /** Non-production confirmations that never reach a real gateway. */
    SIMULATED
}
