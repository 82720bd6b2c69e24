package br.com.may.features.billing.application.gateway;

public enum GatewayPaymentStatus {
    PAID,
    PENDING,
    FAILED,
    CANCELED
}
