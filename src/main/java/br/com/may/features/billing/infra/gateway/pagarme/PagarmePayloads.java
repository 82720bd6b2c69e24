package br.com.may.features.billing.infra.gateway.pagarme;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.UUID;

/**
 * Field extraction shared by the Pagar.me REST adapter and the webhook translator.
 */
final class PagarmePayloads {

    static final String DEFAULT_FAILURE_REASON = "Pagamento recusado";

    private PagarmePayloads() {
    }

    static String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    static Long cents(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        return value != null && value.canConvertToLong() ? value.asLong() : null;
    }

    static JsonNode firstCharge(JsonNode orderOrInvoice) {
        JsonNode charges = orderOrInvoice.path("charges");
        if (charges.isArray() && !charges.isEmpty()) {
            return charges.get(0);
        }
        JsonNode charge = orderOrInvoice.path("charge");
        return charge.isObject() ? charge : null;
    }

    /**
     * Human-readable failure reason: first gateway error, then acquirer message, then the default.
     */
    static String failureReason(JsonNode charge) {
        if (charge == null) {
            return DEFAULT_FAILURE_REASON;
        }
        JsonNode transaction = charge.path("last_transaction");
        JsonNode gatewayResponse = transaction.path("gateway_response");
        String firstError = text(gatewayResponse.path("errors").path(0), "message");
        if (firstError != null) {
            return firstError;
        }
        String message = text(gatewayResponse, "message");
        if (message != null) {
            return message;
        }
        String acquirerMessage = text(transaction, "acquirer_message");
        if (acquirerMessage != null) {
            return acquirerMessage;
        }
        String statusReason = text(charge, "status_reason");
        return statusReason != null ? statusReason : DEFAULT_FAILURE_REASON;
    }

    /**
     * A 412 from the acquirer, or an error about a missing item code, is a problem in our request
     * rather than a declined card.
     */
    static boolean isIntegrationError(JsonNode charge) {
        if (charge == null) {
            return false;
        }
        JsonNode gatewayResponse = charge.path("last_transaction").path("gateway_response");
        if ("412".equals(text(gatewayResponse, "code"))) {
            return true;
        }
        for (JsonNode error : gatewayResponse.path("errors")) {
            String message = text(error, "message");
            if (message != null) {
                String lower = message.toLowerCase(Locale.ROOT);
                if (lower.contains("code") || lower.contains("integra") || lower.contains("configura")) {
                    return true;
                }
            }
        }
        return false;
    }

    static UUID userIdFromMetadata(JsonNode node) {
        String raw = text(node.path("metadata"), "user_id");
        if (raw == null) {
            return null;
        }
        try {
            return UUID.fromString(raw);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    /**
     * Pagar.me sends ISO-8601 timestamps with an offset. Converted to local time in {@code zone}.
     */
    static LocalDateTime dateTime(JsonNode node, String field, ZoneId zone) {
        String raw = text(node, field);
        if (raw == null) {
            return null;
        }
        try {
            return OffsetDateTime.parse(raw).atZoneSameInstant(zone).toLocalDateTime();
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(raw);
            } catch (DateTimeParseException ignored) {
                return null;
            }
        }
    }
}
