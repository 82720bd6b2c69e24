package br.com.may.features.billing.application;

/**
 * Counters and timers for webhook processing, the payment ledger and the scheduled jobs.
 */
public interface BillingMetricsService {

    void incrementWebhookReceived(String provider, String eventType);
    void incrementWebhookOutcome(String provider, String eventType, String outcome);
    void incrementWebhookFailed(String provider, String eventType);
    void incrementWebhookRejected(String provider, String reason);
    void recordWebhookLatency(String provider, String eventType, long latencyMs);

    void incrementPaymentConfirmed(String provider);
    void incrementPaymentFailed(String provider, boolean integrationError);
    void incrementLedgerDuplicate(String provider);

    void recordRecurringRun(int total, int successful, int failed);
    void recordReconciliation(String outcome);
}
