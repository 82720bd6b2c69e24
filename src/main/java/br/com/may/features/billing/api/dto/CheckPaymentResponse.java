package br.com.may.features.billing.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;

@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(name = "CheckPaymentResponse", description = "Result of polling the gateway for a payment")
public record CheckPaymentResponse(
        @Schema(description = "Ledger or reconciliation outcome", example = "activated")
        String outcome,

        @Schema(description = "Subscription status after the check", example = "active")
        String status,

        String message
) {}
