package br.com.may.features.billing.application;

import lombok.Builder;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * Structured logging context for webhook processing.
 * Provides consistent logging fields across both gateway webhook handlers.
 */
@Data
@Builder
public class WebhookLoggingContext {
    private String provider;
    private String eventId;
    private String eventType;
    private String subscriptionId;
    private UUID userId;

    /**
     * Set MDC context for structured logging.
     */
    public void setMDC() {
        if (provider != null) MDC.put("webhook.provider", provider);
        if (eventId != null) MDC.put("webhook.event_id", eventId);
        if (eventType != null) MDC.put("webhook.event_type", eventType);
        if (subscriptionId != null) MDC.put("webhook.subscription_id", subscriptionId);
        if (userId != null) MDC.put("webhook.user_id", userId.toString());
    }

    public static void clearMDC() {
        MDC.remove("webhook.provider");
        MDC.remove("webhook.event_id");
        MDC.remove("webhook.event_type");
        MDC.remove("webhook.subscription_id");
        MDC.remove("webhook.user_id");
    }

    public void logInfo(Logger logger, String message, Object... args) {
        setMDC();
        try {
            logger.info(message, args);
        } finally {
            clearMDC();
        }
    }

    public void logWarn(Logger logger, String message, Object... args) {
        setMDC();
        try {
            logger.warn(message, args);
        } finally {
            clearMDC();
        }
    }

    public void logError(Logger logger, String message, Throwable throwable) {
        setMDC();
        try {
            logger.error(message, throwable);
        } finally {
            clearMDC();
        }
    }
}
