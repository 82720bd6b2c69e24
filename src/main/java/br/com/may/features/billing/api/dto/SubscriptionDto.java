package br.com.may.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

@Schema(name = "SubscriptionDto", description = "Subscription of the authenticated user")
public record SubscriptionDto(
        UUID id,
        @Schema(example = "active")
        String status,
        @Schema(example = "pagarme")
        String provider,
        String providerSubscriptionId,
        String providerOrderId,
        String plan,
        String billingCycle,
        BigDecimal amount,
        LocalDateTime currentPeriodStart,
        LocalDateTime currentPeriodEnd,
        LocalDateTime nextBillingAt,
        LocalDateTime canceledAt,
        LocalDateTime trialEndsAt,
        LocalDateTime createdAt
) {}
