package br.com.may.features.billing.application;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.HashMap;
import java.util.Map;

/**
 * Stripe configuration properties: keys, webhook secret and price IDs.
 */
@Configuration
@ConfigurationProperties(prefix = "stripe")
@Data
public class StripeProperties {
    /** Secret API key (server-side). */
    private String secretKey;

    /** Publishable API key (client-side). */
    private String publishableKey;

    /** Webhook signing secret for signature verification. */
    private String webhookSecret;

    /**
     * Price IDs keyed by {@code <plan>-<cycle>}, e.g. {@code pro-monthly}. Stripe has no semiannual
     * interval, so semiannual checkouts use the annual price.
     */
    private Map<String, String> prices = new HashMap<>();
}
