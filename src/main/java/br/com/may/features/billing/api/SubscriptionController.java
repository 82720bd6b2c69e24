package br.com.may.features.billing.api;

import br.com.may.features.billing.api.dto.CancelSubscriptionResponse;
import br.com.may.features.billing.api.dto.CheckPaymentResponse;
import br.com.may.features.billing.api.dto.ConfirmCheckoutRequest;
import br.com.may.features.billing.api.dto.ConfirmCheckoutResponse;
import br.com.may.features.billing.api.dto.CurrentSubscriptionResponse;
import br.com.may.features.billing.api.dto.ProcessPaymentRequest;
import br.com.may.features.billing.api.dto.ProcessPaymentResponse;
import br.com.may.features.billing.api.dto.ReconciliationReport;
import br.com.may.features.billing.api.dto.StartSubscriptionRequest;
import br.com.may.features.billing.api.dto.StartSubscriptionResponse;
import br.com.may.features.billing.api.dto.SubscriptionDto;
import br.com.may.features.billing.api.dto.SubscriptionStatusResponse;
import br.com.may.features.billing.api.dto.TokenizeCardRequest;
import br.com.may.features.billing.api.dto.TokenizeCardResponse;
import br.com.may.features.billing.api.dto.TrialEligibilityResponse;
import br.com.may.features.billing.application.BillingProperties;
import br.com.may.features.billing.application.ReconciliationService;
import br.com.may.features.billing.application.SubscriptionService;
import br.com.may.shared.config.FeatureFlags;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.function.Supplier;

@Slf4j
@RestController
@RequestMapping("/api/subscriptions")
@RequiredArgsConstructor
@Validated
@Tag(name = "Subscriptions", description = "Subscription checkout, status, cancellation and reconciliation")
@SecurityRequirement(name = "Bearer Authentication")
public class SubscriptionController {

    private final SubscriptionService subscriptionService;
    private final ReconciliationService reconciliationService;
    private final BillingProperties billingProperties;
    private final FeatureFlags featureFlags;

    @Operation(summary = "Start a subscription",
            description = "Plan 'trial' starts the free trial; a paid plan creates a pending subscription and returns the quote")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Trial started or checkout prepared"),
            @ApiResponse(responseCode = "403", description = "Trial already used",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "A live subscription already exists",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/start")
    public ResponseEntity<StartSubscriptionResponse> start(@Valid @RequestBody StartSubscriptionRequest request) {
        return billing(() -> subscriptionService.start(BillingSecurityUtils.getCurrentUserId(), request));
    }

    @Operation(summary = "Pay for a subscription",
            description = "Charges a tokenized or stored card. Raw card numbers are rejected.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Payment captured or pending"),
            @ApiResponse(responseCode = "400", description = "Invalid payment request",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "402", description = "Payment declined",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "502", description = "Gateway integration error",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "503", description = "Gateway unavailable, retry later",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/process-payment")
    public ResponseEntity<ProcessPaymentResponse> processPayment(@Valid @RequestBody ProcessPaymentRequest request) {
        return billing(() -> subscriptionService.processPayment(BillingSecurityUtils.getCurrentUserId(), request));
    }

    @Operation(summary = "Confirm a simulated checkout", description = "Only available when simulation is enabled")
    @PostMapping("/confirm-checkout")
    public ResponseEntity<ConfirmCheckoutResponse> confirmCheckout(@Valid @RequestBody ConfirmCheckoutRequest request) {
        if (!billingProperties.isSimulationEnabled()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).build();
        }
        return billing(() -> subscriptionService.confirmCheckout(BillingSecurityUtils.getCurrentUserId(), request));
    }

    @Operation(summary = "Cancel the subscription", description = "Access continues until the end of the paid period")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Subscription canceled"),
            @ApiResponse(responseCode = "400", description = "Already canceled",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "No subscription",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/cancel")
    public ResponseEntity<CancelSubscriptionResponse> cancel() {
        return billing(() -> subscriptionService.cancel(BillingSecurityUtils.getCurrentUserId()));
    }

    @Operation(summary = "Reactivate a canceled subscription", description = "Only while the paid period is running")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Subscription active again"),
            @ApiResponse(responseCode = "409", description = "Reactivation not allowed",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/reactivate")
    public ResponseEntity<SubscriptionDto> reactivate() {
        return billing(() -> subscriptionService.reactivate(BillingSecurityUtils.getCurrentUserId()));
    }

    @Operation(summary = "Subscription status")
    @GetMapping("/status")
    public ResponseEntity<SubscriptionStatusResponse> status() {
        return billing(() -> subscriptionService.getStatus(BillingSecurityUtils.getCurrentUserId()));
    }

    @Operation(summary = "Compare local state with the gateway", description = "Read-only")
    @GetMapping("/verify")
    public ResponseEntity<ReconciliationReport> verify() {
        return billing(() -> reconciliationService.verify(BillingSecurityUtils.getCurrentUserId()));
    }

    @Operation(summary = "Poll the gateway and apply the payment state",
            description = "Activates the subscription when the gateway reports the payment as paid")
    @PostMapping("/check-payment")
    public ResponseEntity<CheckPaymentResponse> checkPayment() {
        return billing(() -> reconciliationService.checkPayment(BillingSecurityUtils.getCurrentUserId()));
    }

    @Operation(summary = "Trial eligibility")
    @GetMapping("/trial-eligibility")
    public ResponseEntity<TrialEligibilityResponse> trialEligibility() {
        return billing(() -> subscriptionService.getTrialEligibility(BillingSecurityUtils.getCurrentUserId()));
    }

    @Operation(summary = "Current subscription with its last payments")
    @GetMapping("/current")
    public ResponseEntity<CurrentSubscriptionResponse> current() {
        return billing(() -> subscriptionService.getCurrent(BillingSecurityUtils.getCurrentUserId()));
    }

    @Operation(summary = "Tokenize a card",
            description = "Forwards card data to the gateway and returns only the token. Card data is never stored.")
    @PostMapping("/tokenize-card")
    public ResponseEntity<TokenizeCardResponse> tokenizeCard(@Valid @RequestBody TokenizeCardRequest request) {
        return billing(() -> subscriptionService.tokenizeCard(request));
    }

    private <T> ResponseEntity<T> billing(Supplier<T> action) {
        if (!featureFlags.isBilling()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).build();
        }
        return ResponseEntity.ok(action.get());
    }
}
