package br.com.may.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.LocalDateTime;

@Schema(name = "SubscriptionStatusResponse", description = "Current subscription state of the user")
public record SubscriptionStatusResponse(
        @Schema(description = "Subscription status, or 'none'", example = "active")
        String status,

        @Schema(example = "pro")
        String plan,

        @Schema(example = "monthly")
        String billingCycle,

        LocalDateTime currentPeriodStart,
        LocalDateTime currentPeriodEnd,
        LocalDateTime nextBillingAt,
        LocalDateTime trialEndsAt,
        LocalDateTime canceledAt,

        @Schema(description = "Whole days until the current period ends", example = "27")
        long daysRemaining,

        boolean hasUsedTrial,
        boolean trialEligible,

        @Schema(description = "Whether the user may use paid features right now")
        boolean hasAccess
) {}
