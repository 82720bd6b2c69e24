package br.com.may.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(name = "WebhookConfigResponse", description = "What to register in the Pagar.me dashboard")
public record WebhookConfigResponse(
        String webhookUrl,
        String stripeWebhookUrl,
        List<String> acceptedAuthMethods,
        List<String> recommendedEvents,
        boolean secretConfigured,
        boolean unsignedWebhooksAllowed
) {}
