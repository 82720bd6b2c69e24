package br.com.may.features.billing.application;

import br.com.may.features.billing.domain.model.GatewayProvider;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Subscription billing configuration.
 */
@Configuration
@ConfigurationProperties(prefix = "billing")
@Validated
@Data
public class BillingProperties {

    /**
     * Gateway used for new checkouts and recurring charges.
     */
    @NotNull
    private GatewayProvider gateway = GatewayProvider.PAGARME;

    /**
     * Length of the free trial in days.
     */
    @Positive
    private int trialDays = 7;

    /**
     * Trailing window in which a notification with the same title is not repeated.
     */
    @PositiveOrZero
    private int notificationWindowMinutes = 5;

    /**
     * Enables the non-production confirm-checkout and webhook simulation endpoints.
     * Must stay false in production.
     */
    private boolean simulationEnabled = false;

    /**
     * Public base URL of this API, used to show the webhook URL to operators.
     */
    private String publicBaseUrl = "http://localhost:8080";

    @Valid
    private Recurring recurring = new Recurring();

    @Valid
    private Reconciliation reconciliation = new Reconciliation();

    @Data
    public static class Recurring {
        /** Whether the daily recurring-charge job runs. */
        private boolean enabled = false;
        private String cron = "0 0 2 * * *";
    }

    @Data
    public static class Reconciliation {
        /** Whether pending subscriptions are polled against the gateway on a schedule. */
        private boolean enabled = false;
        private String cron = "0 */30 * * * *";
        /** Pending subscriptions younger than this are left to the webhook. */
        @NotNull
        private Duration pendingMinAge = Duration.ofMinutes(10);
    }
}
