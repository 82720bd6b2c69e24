package br.com.may.features.billing.application;

import br.com.may.features.billing.api.dto.CheckPaymentResponse;
import br.com.may.features.billing.api.dto.ReconciliationReport;

import java.util.UUID;

/**
 * Compares local subscription state with the gateway, for when a webhook was lost or delayed.
 */
public interface ReconciliationService {

    /**
     * Read-only comparison. Falls back to local data when the gateway cannot be reached.
     */
    ReconciliationReport verify(UUID userId);

    /**
     * Poll the gateway and apply what it reports through the payment ledger, so a concurrent webhook
     * for the same payment is absorbed as a duplicate.
     */
    CheckPaymentResponse checkPayment(UUID userId);

    /**
     * Run {@link #checkPayment} for every pending checkout older than the configured minimum age.
     * One failing subscription never stops the batch.
     */
    PendingReconciliationSummary reconcilePending();

    record PendingReconciliationSummary(int checked, int activated, int failed) {
    }
}
