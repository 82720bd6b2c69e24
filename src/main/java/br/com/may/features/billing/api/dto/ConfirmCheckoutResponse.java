package br.com.may.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.LocalDateTime;
import java.util.UUID;

@Schema(name = "ConfirmCheckoutResponse", description = "Simulated checkout confirmation (non-production)")
public record ConfirmCheckoutResponse(
        @Schema(description = "Ledger outcome", example = "activated")
        String outcome,

        UUID subscriptionId,

        @Schema(example = "active")
        String status,

        LocalDateTime currentPeriodEnd
) {}
