package br.com.may.features.billing.infra.gateway.stripe;

import br.com.may.features.billing.application.StripeProperties;
import com.stripe.StripeClient;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Stripe client configuration. The client is injected where needed; the SDK's global API key is
 * never set.
 */
@Configuration
@RequiredArgsConstructor
public class StripeClientConfig {

    private static final int CONNECT_TIMEOUT_MS = 10_000;
    private static final int READ_TIMEOUT_MS = 30_000;
    private static final int MAX_NETWORK_RETRIES = 2;

    private final StripeProperties stripe;

    /**
     * Provide a reusable StripeClient only when the secret key is configured.
     */
    @Bean
    @ConditionalOnProperty(name = "stripe.secret-key")
    public StripeClient stripeClient() {
        return StripeClient.builder()
                .setApiKey(stripe.getSecretKey())
                .setConnectTimeout(CONNECT_TIMEOUT_MS)
                .setReadTimeout(READ_TIMEOUT_MS)
                .setMaxNetworkRetries(MAX_NETWORK_RETRIES)
                .build();
    }
}
