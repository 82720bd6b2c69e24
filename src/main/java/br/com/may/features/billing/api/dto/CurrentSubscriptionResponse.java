package br.com.may.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(name = "CurrentSubscriptionResponse", description = "Subscription with its most recent payments")
public record CurrentSubscriptionResponse(
        SubscriptionDto subscription,
        @Schema(description = "Last 10 payments, newest first")
        List<PaymentDto> payments
) {}
