package br.com.may.features.billing.domain.model;

public enum PaymentMethod {
    CREDIT_CARD,
    BOLETO,
    PIX,
    SIMULATED
}
