package br.com.may.features.billing.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Body returned to the gateway for every authenticated webhook delivery.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(name = "WebhookReceipt")
public record WebhookReceipt(
        @Schema(description = "Dispatch outcome, or 'error' when the handler failed", example = "activated")
        String status,
        String eventId,
        String eventType,
        long processingTimeMs,
        String error
) {}
