package br.com.may.shared.config;

import br.com.may.shared.email.EmailService;
import br.com.may.shared.email.impl.NoopEmailService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the {@link EmailService} implementation from {@code app.email.provider}.
 * <ul>
 *   <li>smtp: Spring Mail ({@code EmailServiceImpl})</li>
 *   <li>noop: logging only, default</li>
 * </ul>
 */
@Slf4j
@Configuration
public class EmailProviderConfig {

    @Bean
    @ConditionalOnProperty(name = "app.email.provider", havingValue = "noop", matchIfMissing = true)
    public EmailService noopEmailService() {
        log.info("Activating No-op email service (emails will be logged but not sent)");
        return new NoopEmailService();
    }
}
