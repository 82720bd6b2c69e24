package br.com.may.features.billing.application.impl;

import br.com.may.features.billing.application.BillingMetricsService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer implementation. Meters are tagged by provider and event type; Micrometer returns the
 * already registered meter for a known name and tag set.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BillingMetricsServiceImpl implements BillingMetricsService {

    private final MeterRegistry meterRegistry;

    @Override
    public void incrementWebhookReceived(String provider, String eventType) {
        log.info("METRIC: billing.webhooks.received provider={} eventType={}", provider, eventType);
        counter("billing.webhooks.received", "Webhooks received", "provider", provider, "eventType", eventType)
                .increment();
    }

    @Override
    public void incrementWebhookOutcome(String provider, String eventType, String outcome) {
        log.info("METRIC: billing.webhooks.processed provider={} eventType={} outcome={}", provider, eventType, outcome);
        counter("billing.webhooks.processed", "Webhooks processed by outcome",
                "provider", provider, "eventType", eventType, "outcome", outcome).increment();
    }

    @Override
    public void incrementWebhookFailed(String provider, String eventType) {
        log.info("METRIC: billing.webhooks.failed provider={} eventType={}", provider, eventType);
        counter("billing.webhooks.failed", "Webhooks whose handler threw", "provider", provider, "eventType", eventType)
                .increment();
    }

    @Override
    public void incrementWebhookRejected(String provider, String reason) {
        log.warn("METRIC: billing.webhooks.rejected provider={} reason={}", provider, reason);
        counter("billing.webhooks.rejected", "Webhooks rejected before processing", "provider", provider, "reason", reason)
                .increment();
    }

    @Override
    public void recordWebhookLatency(String provider, String eventType, long latencyMs) {
        log.info("METRIC: billing.webhooks.latency provider={} eventType={} latencyMs={}", provider, eventType, latencyMs);
        Timer.builder("billing.webhooks.latency")
                .description("Webhook processing latency")
                .tag("provider", tagValue(provider))
                .tag("eventType", tagValue(eventType))
                .register(meterRegistry)
                .record(latencyMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void incrementPaymentConfirmed(String provider) {
        log.info("METRIC: billing.payments.confirmed provider={}", provider);
        counter("billing.payments.confirmed", "Payments recorded as paid", "provider", provider).increment();
    }

    @Override
    public void incrementPaymentFailed(String provider, boolean integrationError) {
        log.info("METRIC: billing.payments.failed provider={} integrationError={}", provider, integrationError);
        counter("billing.payments.failed", "Payments recorded as failed",
                "provider", provider, "integrationError", String.valueOf(integrationError)).increment();
    }

    @Override
    public void incrementLedgerDuplicate(String provider) {
        log.info("METRIC: billing.payments.duplicate provider={}", provider);
        counter("billing.payments.duplicate", "Payment confirmations already recorded", "provider", provider).increment();
    }

    @Override
    public void recordRecurringRun(int total, int successful, int failed) {
        log.info("METRIC: billing.recurring.run total={} successful={} failed={}", total, successful, failed);
        counter("billing.recurring.charges", "Recurring charges attempted", "result", "successful").increment(successful);
        counter("billing.recurring.charges", "Recurring charges attempted", "result", "failed").increment(failed);
    }

    @Override
    public void recordReconciliation(String outcome) {
        log.info("METRIC: billing.reconciliation.checks outcome={}", outcome);
        counter("billing.reconciliation.checks", "Gateway reconciliation checks", "outcome", outcome).increment();
    }

    private Counter counter(String name, String description, String... tags) {
        String[] values = tags.clone();
        for (int i = 1; i < values.length; i += 2) {
            values[i] = tagValue(values[i]);
        }
        return Counter.builder(name)
                .description(description)
                .tags(values)
                .register(meterRegistry);
    }

    private static String tagValue(String value) {
        return value == null || value.isBlank() ? "unknown" : value;
    }
}
