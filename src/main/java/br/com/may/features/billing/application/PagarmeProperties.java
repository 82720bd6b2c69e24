package br.com.may.features.billing.application;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Pagar.me Core v5 configuration: keys, endpoint, timeouts and webhook secrets.
 */
@Configuration
@ConfigurationProperties(prefix = "pagarme")
@Data
public class PagarmeProperties {
    /** Secret API key ({@code sk_...}), sent as the Basic auth user. */
    private String secretKey;

    /** Public key ({@code pk_...}) used only for card tokenization. */
    private String publicKey;

    private String baseUrl = "https://api.pagar.me/core/v5";

    private Duration connectTimeout = Duration.ofSeconds(10);

    private Duration readTimeout = Duration.ofSeconds(30);

    /** Retries for network failures only; rejections are never retried. */
    private int maxRetries = 2;

    private Duration retryBackoff = Duration.ofMillis(500);

    /** Accepted webhook shared secrets. More than one allows rotation. */
    private List<String> webhookSecrets = new ArrayList<>();

    /** Development escape hatch: accept webhooks when no secret is configured. */
    private boolean allowUnsignedWebhooks = false;
}
