package br.com.may.features.billing.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.LocalDateTime;
import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(name = "ProcessPaymentResponse", description = "Result of a paid checkout")
public record ProcessPaymentResponse(
        @Schema(description = "active when the charge was captured, pending otherwise", example = "active")
        String status,

        UUID subscriptionId,

        @Schema(description = "Gateway reference of the subscription or order")
        String providerReference,

        LocalDateTime currentPeriodEnd,

        String message
) {}
