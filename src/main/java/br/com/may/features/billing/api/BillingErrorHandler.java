package br.com.may.features.billing.api;

import br.com.may.features.billing.domain.exception.GatewayNetworkException;
import br.com.may.features.billing.domain.exception.GatewayRejectedException;
import br.com.may.features.billing.domain.exception.GatewayValidationException;
import br.com.may.features.billing.domain.exception.IllegalSubscriptionTransitionException;
import br.com.may.features.billing.domain.exception.InvalidWebhookPayloadException;
import br.com.may.features.billing.domain.exception.ReactivationNotAllowedException;
import br.com.may.features.billing.domain.exception.SubscriptionAlreadyActiveException;
import br.com.may.features.billing.domain.exception.SubscriptionAlreadyCanceledException;
import br.com.may.features.billing.domain.exception.SubscriptionNotFoundException;
import br.com.may.features.billing.domain.exception.TrialAlreadyUsedException;
import br.com.may.features.billing.domain.exception.WebhookAuthenticationException;
import br.com.may.shared.api.problem.ErrorTypes;
import br.com.may.shared.api.problem.ProblemDetailBuilder;
import br.com.may.shared.exception.ResourceNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Error handler for the subscription API and webhook endpoints.
 * Maps billing exceptions to RFC 7807 Problem Detail responses with a stable {@code code}.
 */
@Slf4j
@Order(Ordered.HIGHEST_PRECEDENCE)
@RestControllerAdvice(basePackages = "br.com.may.features.billing.api")
public class BillingErrorHandler {

    static final String DECLINED_DETAIL =
            "Pagamento recusado. Verifique os dados do cartão ou tente outra forma de pagamento.";

    @ExceptionHandler(WebhookAuthenticationException.class)
    public ResponseEntity<ProblemDetail> handleWebhookAuthentication(WebhookAuthenticationException ex, HttpServletRequest request) {
        log.warn("Rejected webhook on {}: {}", request.getRequestURI(), ex.getMessage());
        return problem(HttpStatus.UNAUTHORIZED, ErrorTypes.WEBHOOK_UNAUTHORIZED, "Webhook Unauthorized",
                "Webhook authentication failed", "WEBHOOK_UNAUTHORIZED", request);
    }

    @ExceptionHandler(InvalidWebhookPayloadException.class)
    public ResponseEntity<ProblemDetail> handleInvalidWebhookPayload(InvalidWebhookPayloadException ex, HttpServletRequest request) {
        log.warn("Invalid webhook payload on {}: {}", request.getRequestURI(), ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, ErrorTypes.INVALID_WEBHOOK_PAYLOAD, "Invalid Webhook Payload",
                ex.getMessage(), "INVALID_WEBHOOK_PAYLOAD", request);
    }

    @ExceptionHandler(GatewayValidationException.class)
    public ResponseEntity<ProblemDetail> handleGatewayValidation(GatewayValidationException ex, HttpServletRequest request) {
        log.info("Invalid payment request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, ErrorTypes.INVALID_PAYMENT_REQUEST, "Invalid Payment Request",
                ex.getMessage(), "INVALID_PAYMENT_REQUEST", request);
    }

    @ExceptionHandler(GatewayRejectedException.class)
    public ResponseEntity<ProblemDetail> handleGatewayRejected(GatewayRejectedException ex, HttpServletRequest request) {
        if (ex.isIntegrationError()) {
            log.error("Gateway integration error at {}: {}", ex.getProvider(), ex.getMessage());
            return problem(HttpStatus.BAD_GATEWAY, ErrorTypes.GATEWAY_INTEGRATION_ERROR, "Payment Gateway Error",
                    "The payment could not be processed due to a technical problem. No charge was made.",
                    "GATEWAY_INTEGRATION_ERROR", request);
        }
        log.info("Payment declined at {}: {}", ex.getProvider(), ex.getMessage(), ex.getCause());
        String detail = ex.getCustomerMessage() != null && !ex.getCustomerMessage().isBlank()
                ? ex.getCustomerMessage()
                : DECLINED_DETAIL;
        return problem(HttpStatus.PAYMENT_REQUIRED, ErrorTypes.PAYMENT_DECLINED, "Payment Declined",
                detail, "PAYMENT_DECLINED", request);
    }

    @ExceptionHandler(GatewayNetworkException.class)
    public ResponseEntity<ProblemDetail> handleGatewayNetwork(GatewayNetworkException ex, HttpServletRequest request) {
        log.warn("Gateway {} unavailable: {}", ex.getProvider(), ex.getMessage());
        ResponseEntity<ProblemDetail> response = problem(HttpStatus.SERVICE_UNAVAILABLE, ErrorTypes.GATEWAY_UNAVAILABLE,
                "Payment Gateway Unavailable", "The payment gateway is temporarily unavailable, please retry",
                "GATEWAY_UNAVAILABLE", request);
        response.getBody().setProperty("retryable", true);
        return response;
    }

    @ExceptionHandler(TrialAlreadyUsedException.class)
    public ResponseEntity<ProblemDetail> handleTrialAlreadyUsed(TrialAlreadyUsedException ex, HttpServletRequest request) {
        return problem(HttpStatus.FORBIDDEN, ErrorTypes.TRIAL_ALREADY_USED, "Trial Already Used",
                ex.getMessage(), "TRIAL_ALREADY_USED", request);
    }

    @ExceptionHandler(SubscriptionAlreadyActiveException.class)
    public ResponseEntity<ProblemDetail> handleAlreadyActive(SubscriptionAlreadyActiveException ex, HttpServletRequest request) {
        return problem(HttpStatus.CONFLICT, ErrorTypes.SUBSCRIPTION_ALREADY_ACTIVE, "Subscription Already Active",
                ex.getMessage(), "SUBSCRIPTION_ALREADY_ACTIVE", request);
    }

    @ExceptionHandler(SubscriptionAlreadyCanceledException.class)
    public ResponseEntity<ProblemDetail> handleAlreadyCanceled(SubscriptionAlreadyCanceledException ex, HttpServletRequest request) {
        return problem(HttpStatus.BAD_REQUEST, ErrorTypes.ALREADY_CANCELED, "Subscription Already Canceled",
                ex.getMessage(), "ALREADY_CANCELED", request);
    }

    @ExceptionHandler(ReactivationNotAllowedException.class)
    public ResponseEntity<ProblemDetail> handleReactivationNotAllowed(ReactivationNotAllowedException ex, HttpServletRequest request) {
        return problem(HttpStatus.CONFLICT, ErrorTypes.REACTIVATION_NOT_ALLOWED, "Reactivation Not Allowed",
                ex.getMessage(), "REACTIVATION_NOT_ALLOWED", request);
    }

    @ExceptionHandler(IllegalSubscriptionTransitionException.class)
    public ResponseEntity<ProblemDetail> handleIllegalTransition(IllegalSubscriptionTransitionException ex, HttpServletRequest request) {
        log.warn("Illegal subscription transition: {}", ex.getMessage());
        return problem(HttpStatus.CONFLICT, ErrorTypes.ILLEGAL_TRANSITION, "Illegal Subscription Transition",
                ex.getMessage(), "ILLEGAL_TRANSITION", request);
    }

    @ExceptionHandler(SubscriptionNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleSubscriptionNotFound(SubscriptionNotFoundException ex, HttpServletRequest request) {
        return problem(HttpStatus.NOT_FOUND, ErrorTypes.SUBSCRIPTION_NOT_FOUND, "Subscription Not Found",
                ex.getMessage(), "SUBSCRIPTION_NOT_FOUND", request);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleResourceNotFound(ResourceNotFoundException ex, HttpServletRequest request) {
        return problem(HttpStatus.NOT_FOUND, ErrorTypes.RESOURCE_NOT_FOUND, "Resource Not Found",
                ex.getMessage(), "RESOURCE_NOT_FOUND", request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ProblemDetail> handleIllegalArgument(IllegalArgumentException ex, HttpServletRequest request) {
        return problem(HttpStatus.BAD_REQUEST, ErrorTypes.INVALID_ARGUMENT, "Invalid Argument",
                ex.getMessage(), "INVALID_ARGUMENT", request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemDetail> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest request) {
        Map<String, String> errors = new LinkedHashMap<>();
        for (FieldError fieldError : ex.getBindingResult().getFieldErrors()) {
            errors.putIfAbsent(fieldError.getField(), fieldError.getDefaultMessage());
        }
        ResponseEntity<ProblemDetail> response = problem(HttpStatus.BAD_REQUEST, ErrorTypes.VALIDATION_FAILED,
                "Validation Failed", "Validation failed for one or more fields", "VALIDATION_FAILED", request);
        response.getBody().setProperty("errors", errors);
        return response;
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ProblemDetail> handleTypeMismatch(MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        return problem(HttpStatus.BAD_REQUEST, ErrorTypes.TYPE_MISMATCH, "Type Mismatch",
                "Invalid value for parameter '" + ex.getName() + "'", "TYPE_MISMATCH", request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ProblemDetail> handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest request) {
        return problem(HttpStatus.BAD_REQUEST, ErrorTypes.MALFORMED_JSON, "Malformed Request Body",
                "The request body could not be read", "MALFORMED_JSON", request);
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ProblemDetail> handleDataIntegrity(DataIntegrityViolationException ex, HttpServletRequest request) {
        log.warn("Data integrity violation on {}: {}", request.getRequestURI(), ex.getMostSpecificCause().getMessage());
        return problem(HttpStatus.CONFLICT, ErrorTypes.DATA_CONFLICT, "Duplicate Entry",
                "The record already exists", "DUPLICATE_ENTRY", request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("Unexpected billing error on {}", request.getRequestURI(), ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, ErrorTypes.BILLING_INTERNAL_ERROR, "Internal Server Error",
                "An unexpected error occurred", "INTERNAL_ERROR", request);
    }

    private static ResponseEntity<ProblemDetail> problem(HttpStatus status, URI type, String title, String detail,
                                                         String code, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(status, type, title, detail, code, request);
        return ResponseEntity.status(status).body(problem);
    }
}
