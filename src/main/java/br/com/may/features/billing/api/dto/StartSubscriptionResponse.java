package br.com.may.features.billing.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(name = "StartSubscriptionResponse", description = "Trial activation or a quote for the paid checkout")
public record StartSubscriptionResponse(
        @Schema(description = "Subscription status after the call", example = "pending")
        String status,

        UUID subscriptionId,

        @Schema(example = "pro")
        String plan,

        @Schema(example = "monthly")
        String billingCycle,

        @Schema(description = "Amount to be charged, in BRL", example = "97.00")
        BigDecimal amount,

        @Schema(description = "End of the free trial, trial plan only")
        LocalDateTime trialEndsAt,

        @Schema(description = "Gateway that will process the checkout", example = "pagarme")
        String gateway,

        @Schema(description = "Public key the browser uses to tokenize the card")
        String publicKey
) {}
