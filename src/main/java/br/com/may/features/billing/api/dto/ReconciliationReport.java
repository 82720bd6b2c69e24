package br.com.may.features.billing.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.LocalDateTime;

@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(name = "ReconciliationReport", description = "Read-only comparison of local and gateway state")
public record ReconciliationReport(
        @Schema(description = "Local subscription status", example = "pending")
        String localStatus,

        @Schema(description = "Payment status reported by the gateway", example = "paid")
        String gatewayStatus,

        @Schema(description = "Raw status string from the gateway", example = "paid")
        String gatewayRawStatus,

        @Schema(description = "True when the gateway and local state disagree")
        boolean discrepancy,

        @Schema(description = "gateway when the gateway answered, local otherwise", example = "gateway")
        String source,

        @Schema(description = "Why the gateway could not be consulted")
        String gatewayError,

        String providerReference,
        LocalDateTime currentPeriodEnd
) {}
