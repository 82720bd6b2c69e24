package br.com.may.shared.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Single source of time for the application.
 * Billing periods, notification windows and recurring charges all read the time through this bean
 * so tests can pin it with a fixed clock.
 */
@Configuration
public class ClockConfig {

    /**
     * Application timezone. Billing dates are computed in the Brazilian business timezone by default.
     */
    @Value("${app.timezone:America/Sao_Paulo}")
    private String timezone;

    @Bean
    public Clock clock() {
        String configuredZone = timezone == null || timezone.isBlank()
                ? "America/Sao_Paulo"
                : timezone.trim();
        return Clock.system(ZoneId.of(configuredZone));
    }
}
