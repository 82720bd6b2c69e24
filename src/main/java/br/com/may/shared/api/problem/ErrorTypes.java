package br.com.may.shared.api.problem;

import java.net.URI;

/**
 * Centralised catalog of RFC 7807 Problem Detail type URIs.
 * Each constant points to documentation describing the error.
 *
 * @see ProblemDetailBuilder
 * @see <a href="https://www.rfc-editor.org/rfc/rfc7807">RFC 7807</a>
 */
public final class ErrorTypes {

    private static final String BASE_URL = "https://may.com.br/docs/errors";

    // ==================== Resource Errors ====================
    public static final URI RESOURCE_NOT_FOUND = URI.create(BASE_URL + "/resource-not-found");
    public static final URI SUBSCRIPTION_NOT_FOUND = URI.create(BASE_URL + "/subscription-not-found");

    // ==================== Validation Errors ====================
    public static final URI VALIDATION_FAILED = URI.create(BASE_URL + "/validation-failed");
    public static final URI INVALID_ARGUMENT = URI.create(BASE_URL + "/invalid-argument");
    public static final URI TYPE_MISMATCH = URI.create(BASE_URL + "/type-mismatch");
    public static final URI MALFORMED_JSON = URI.create(BASE_URL + "/malformed-json");

    // ==================== Security Errors ====================
    public static final URI UNAUTHORIZED = URI.create(BASE_URL + "/unauthorized");
    public static final URI ACCESS_DENIED = URI.create(BASE_URL + "/access-denied");

    // ==================== State Errors ====================
    public static final URI DATA_CONFLICT = URI.create(BASE_URL + "/data-conflict");
    public static final URI OPTIMISTIC_LOCK_CONFLICT = URI.create(BASE_URL + "/optimistic-lock-conflict");

    // ==================== Billing Errors ====================
    public static final URI WEBHOOK_UNAUTHORIZED = URI.create(BASE_URL + "/webhook-unauthorized");
    public static final URI INVALID_WEBHOOK_PAYLOAD = URI.create(BASE_URL + "/invalid-webhook-payload");
    public static final URI TRIAL_ALREADY_USED = URI.create(BASE_URL + "/trial-already-used");
    public static final URI SUBSCRIPTION_ALREADY_ACTIVE = URI.create(BASE_URL + "/subscription-already-active");
    public static final URI ALREADY_CANCELED = URI.create(BASE_URL + "/already-canceled");
    public static final URI REACTIVATION_NOT_ALLOWED = URI.create(BASE_URL + "/reactivation-not-allowed");
    public static final URI ILLEGAL_TRANSITION = URI.create(BASE_URL + "/illegal-subscription-transition");
    public static final URI INVALID_PAYMENT_REQUEST = URI.create(BASE_URL + "/invalid-payment-request");
    public static final URI PAYMENT_DECLINED = URI.create(BASE_URL + "/payment-declined");
    public static final URI GATEWAY_INTEGRATION_ERROR = URI.create(BASE_URL + "/gateway-integration-error");
    public static final URI GATEWAY_UNAVAILABLE = URI.create(BASE_URL + "/gateway-unavailable");
    public static final URI BILLING_INTERNAL_ERROR = URI.create(BASE_URL + "/billing-internal-error");

    // ==================== Generic ====================
    public static final URI INTERNAL_SERVER_ERROR = URI.create(BASE_URL + "/internal-server-error");

    private ErrorTypes() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
