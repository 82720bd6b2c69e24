package br.com.may.features.billing.domain.model;

public enum PaymentStatus {
    PAID,
    FAILED
}
