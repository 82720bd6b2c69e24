package br.com.may.features.billing.api.dto;

import jakarta.validation.constraints.NotBlank;

public record AddressRequest(
        @NotBlank(message = "Address line is required")
        String line1,
        String line2,
        @NotBlank(message = "Zip code is required")
        String zipCode,
        @NotBlank(message = "City is required")
        String city,
        @NotBlank(message = "State is required")
        String state,
        String country
) {}
