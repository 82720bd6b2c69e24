package br.com.may.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

@Schema(name = "StartSubscriptionRequest", description = "Plan chosen on the pricing page")
public record StartSubscriptionRequest(
        @Schema(description = "Plan code, or 'trial' for the free trial", example = "pro")
        @NotBlank(message = "Plan is required")
        String plan,

        @Schema(description = "monthly, semiannual or annual (Portuguese aliases accepted)", example = "monthly")
        String billingCycle
) {}
