package br.com.may.features.billing.infra.scheduling;

import br.com.may.features.billing.application.ReconciliationService;
import br.com.may.shared.config.FeatureFlags;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Polls the gateway for checkouts whose webhook never arrived.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "billing.reconciliation.enabled", havingValue = "true")
public class ReconciliationJob {

    private final ReconciliationService reconciliationService;
    private final FeatureFlags featureFlags;

    @Scheduled(cron = "${billing.reconciliation.cron:0 */30 * * * *}")
    public void reconcilePendingSubscriptions() {
        if (!featureFlags.isBilling()) {
            return;
        }
        try {
            reconciliationService.reconcilePending();
        } catch (Exception e) {
            log.warn("ReconciliationJob: error during pending reconciliation", e);
        }
    }
}
