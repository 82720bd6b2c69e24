package br.com.may.features.billing.api.dto;

import java.time.LocalDateTime;

public record CancelSubscriptionResponse(
        String status,
        LocalDateTime canceledAt,
        LocalDateTime accessUntil,
        String message
) {}
