package br.com.may.features.billing.api.dto;

import jakarta.validation.constraints.NotBlank;

public record ConfirmCheckoutRequest(
        @NotBlank(message = "Session ID is required")
        String sessionId,

        @NotBlank(message = "Plan is required")
        String plan,

        String billingCycle
) {}
