package br.com.may.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

@Schema(name = "ProcessPaymentRequest", description = "Paid checkout with a tokenized card")
public record ProcessPaymentRequest(
        @NotBlank(message = "Plan is required")
        String plan,

        String billingCycle,

        @Schema(description = "Single-use card token from the gateway (token_... or pm_...)")
        String cardToken,

        @Schema(description = "Card already stored for the customer (card_...), used instead of a token")
        String cardId,

        @NotNull(message = "Billing info is required")
        @Valid
        BillingInfoRequest billingInfo
) {}
