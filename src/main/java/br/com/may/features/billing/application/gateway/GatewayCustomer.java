package br.com.may.features.billing.application.gateway;

public record GatewayCustomer(String customerRef, String email, boolean created) {
}
