package br.com.may.features.billing.application;

import br.com.may.features.billing.domain.exception.WebhookAuthenticationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Checks the shared secret of a Pagar.me webhook against the configured secrets. Carriers are
 * tried in a fixed order and compared in constant time.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebhookSecretVerifier {

    private static final String BEARER = "Bearer ";
    private static final String BASIC = "Basic ";

    private final PagarmeProperties pagarmeProperties;

    /**
     * @return the name of the carrier that matched, for logging
     * @throws WebhookAuthenticationException if no carrier holds a configured secret
     */
    public String verify(WebhookCredentials credentials) {
        List<String> secrets = configuredSecrets();
        if (secrets.isEmpty()) {
            if (pagarmeProperties.isAllowUnsignedWebhooks()) {
                log.warn("No Pagar.me webhook secret configured; accepting unsigned webhook (development only)");
                return "unsigned";
            }
            throw new WebhookAuthenticationException("Webhook secret is not configured");
        }

        if (matches(credentials.pagarmeSecretHeader(), secrets)) {
            return "X-Pagarme-Webhook-Secret";
        }
        if (matches(credentials.webhookSecretHeader(), secrets)) {
            return "X-Webhook-Secret";
        }
        String authorization = credentials.authorizationHeader();
        if (authorization != null && authorization.regionMatches(true, 0, BEARER, 0, BEARER.length())
                && matches(authorization.substring(BEARER.length()).trim(), secrets)) {
            return "Bearer";
        }
        if (matches(credentials.tokenParameter(), secrets)) {
            return "token";
        }
        if (authorization != null && authorization.regionMatches(true, 0, BASIC, 0, BASIC.length())
                && basicMatches(authorization.substring(BASIC.length()).trim(), secrets)) {
            return "Basic";
        }
        throw new WebhookAuthenticationException("Invalid or missing webhook secret");
    }

    public boolean isConfigured() {
        return !configuredSecrets().isEmpty();
    }

    private List<String> configuredSecrets() {
        List<String> secrets = new ArrayList<>();
        for (String secret : pagarmeProperties.getWebhookSecrets()) {
            if (StringUtils.hasText(secret)) {
                secrets.add(secret.trim());
            }
        }
        return secrets;
    }

    private static boolean basicMatches(String encoded, List<String> secrets) {
        String decoded;
        try {
            decoded = new String(Base64.getDecoder().decode(encoded), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            log.debug("Malformed Basic credentials on webhook: {}", e.getMessage());
            return false;
        }
        int colon = decoded.indexOf(':');
        if (colon < 0) {
            return matches(decoded, secrets);
        }
        return matches(decoded.substring(0, colon), secrets) || matches(decoded.substring(colon + 1), secrets);
    }

    private static boolean matches(String candidate, List<String> secrets) {
        if (!StringUtils.hasText(candidate)) {
            return false;
        }
        byte[] candidateBytes = candidate.trim().getBytes(StandardCharsets.UTF_8);
        boolean matched = false;
        for (String secret : secrets) {
            // no early exit, so every configured secret is compared
            matched |= MessageDigest.isEqual(candidateBytes, secret.getBytes(StandardCharsets.UTF_8));
        }
        return matched;
    }
}
