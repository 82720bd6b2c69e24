package br.com.may.features.billing.api;

import br.com.may.features.billing.api.dto.WebhookConfigResponse;
import br.com.may.features.billing.api.dto.WebhookReceipt;
import br.com.may.features.billing.application.BillingProperties;
import br.com.may.features.billing.application.PagarmeWebhookService;
import br.com.may.features.billing.application.StripeWebhookService;
import br.com.may.features.billing.application.WebhookCredentials;
import br.com.may.shared.config.FeatureFlags;
import io.swagger.v3.oas.annotations.Hidden;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/api/subscriptions/webhook")
@RequiredArgsConstructor
@Tag(name = "Subscription Webhooks", description = "Endpoints called by the payment gateways (not for public use)")
public class SubscriptionWebhookController {

    private final PagarmeWebhookService pagarmeWebhookService;
    private final StripeWebhookService stripeWebhookService;
    private final BillingProperties billingProperties;
    private final FeatureFlags featureFlags;

    @Operation(summary = "Handle Pagar.me webhook",
            description = "Authenticated by a shared secret; every authenticated delivery is answered with 200")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Webhook accepted"),
            @ApiResponse(responseCode = "400", description = "Unparseable payload",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "401", description = "Missing or wrong secret",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @Hidden
    @PostMapping
    public ResponseEntity<WebhookReceipt> handlePagarmeWebhook(
            @Parameter(hidden = true) @RequestBody String payload,
            @RequestHeader(name = "X-Pagarme-Webhook-Secret", required = false) String pagarmeSecret,
            @RequestHeader(name = "X-Webhook-Secret", required = false) String webhookSecret,
            @RequestHeader(name = "Authorization", required = false) String authorization,
            @RequestParam(name = "token", required = false) String token) {
        if (!featureFlags.isBilling()) {
            log.warn("Billing feature is disabled, rejecting webhook");
            return ResponseEntity.status(HttpStatus.NOT_FOUND).build();
        }
        WebhookCredentials credentials = new WebhookCredentials(pagarmeSecret, webhookSecret, authorization, token);
        return ResponseEntity.ok(pagarmeWebhookService.process(payload, credentials));
    }

    @Operation(summary = "Handle Stripe webhook", description = "Verifies the Stripe-Signature header")
    @Hidden
    @PostMapping("/stripe")
    public ResponseEntity<Map<String, Object>> handleStripeWebhook(
            @Parameter(hidden = true) @RequestBody String payload,
            @RequestHeader(name = "Stripe-Signature", required = false) String signature) {
        if (!featureFlags.isBilling()) {
            log.warn("Billing feature is disabled, rejecting webhook");
            return ResponseEntity.status(HttpStatus.NOT_FOUND).build();
        }
        WebhookReceipt receipt = stripeWebhookService.process(payload, signature);
        return ResponseEntity.ok(Map.of("received", true, "status", receipt.status()));
    }

    @Operation(summary = "Webhook configuration for operators", description = "Only available when simulation is enabled")
    @GetMapping("/config")
    public ResponseEntity<WebhookConfigResponse> config() {
        if (!billingProperties.isSimulationEnabled()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).build();
        }
        return ResponseEntity.ok(pagarmeWebhookService.describeConfiguration());
    }

    @Operation(summary = "Process a Pagar.me payload without the webhook secret",
            description = "Only available when simulation is enabled. Requires a user token; the event is "
                    + "applied to the calling user")
    @SecurityRequirement(name = "Bearer Authentication")
    @PostMapping("/simulate")
    public ResponseEntity<WebhookReceipt> simulate(@RequestBody String payload) {
        if (!billingProperties.isSimulationEnabled()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).build();
        }
        UUID userId = BillingSecurityUtils.getCurrentUserId();
        log.info("Processing simulated Pagar.me webhook for user {}", userId);
        return ResponseEntity.ok(pagarmeWebhookService.simulate(userId, payload));
    }
}
