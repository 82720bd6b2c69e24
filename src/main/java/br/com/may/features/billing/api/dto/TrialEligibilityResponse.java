package br.com.may.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "TrialEligibilityResponse")
public record TrialEligibilityResponse(
        boolean eligible,
        boolean hasUsedTrial,
        @Schema(description = "Why the user is not eligible, null when eligible")
        String reason
) {}
