package br.com.may.features.billing.infra.scheduling;

import br.com.may.features.billing.application.RecurringBillingService;
import br.com.may.shared.config.FeatureFlags;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Daily run of the charges this system rebills itself.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "billing.recurring.enabled", havingValue = "true")
public class RecurringBillingJob {

    private final RecurringBillingService recurringBillingService;
    private final FeatureFlags featureFlags;

    @Scheduled(cron = "${billing.recurring.cron:0 0 2 * * *}")
    public void chargeDueSubscriptions() {
        if (!featureFlags.isBilling()) {
            return;
        }
        try {
            RecurringBillingService.RecurringBillingSummary summary = recurringBillingService.runDueCharges();
            log.info("RecurringBillingJob: {} due, {} successful, {} failed",
                    summary.total(), summary.successful(), summary.failed());
        } catch (Exception e) {
            log.error("RecurringBillingJob: run aborted", e);
        }
    }
}
