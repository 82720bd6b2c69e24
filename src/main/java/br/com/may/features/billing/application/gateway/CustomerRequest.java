package br.com.may.features.billing.application.gateway;

import java.util.UUID;

public record CustomerRequest(
        UUID userId,
        String existingCustomerRef,
        String name,
        String email,
        String document,
        String phone,
        Address address
) {

    public record Address(String line1, String line2, String zipCode, String city, String state, String country) {
    }

    /**
     * CPF documents have 11 digits, CNPJ documents 14.
     */
    public boolean isCompany() {
        return document != null && document.replaceAll("\\D", "").length() == 14;
    }
}
