package br.com.may.shared.email.impl;

import br.com.may.shared.email.EmailService;
import lombok.extern.slf4j.Slf4j;

/**
 * Logs email send attempts without delivering anything.
 * Activated when {@code app.email.provider=noop} (the default for development and tests).
 */
@Slf4j
public class NoopEmailService implements EmailService {

    public NoopEmailService() {
        log.info("NoopEmailService initialized - emails will be logged but not sent");
    }

    @Override
    public void sendPlainTextEmail(String to, String subject, String body) {
        log.info("[NOOP] Would send plain text email to: {} with subject: {}",
                EmailServiceImpl.maskEmail(to), subject);
    }
}
