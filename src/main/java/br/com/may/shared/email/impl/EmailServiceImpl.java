package br.com.may.shared.email.impl;

import br.com.may.shared.email.EmailService;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Service;

/**
 * SMTP-based email service. Activated when {@code app.email.provider=smtp}.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.email.provider", havingValue = "smtp")
@RequiredArgsConstructor
public class EmailServiceImpl implements EmailService {

    private final JavaMailSender mailSender;

    @Value("${spring.mail.username:}")
    private String fromEmail;

    @PostConstruct
    void verifyEmailConfiguration() {
        if (fromEmail == null || fromEmail.isBlank()) {
            log.warn("Email service disabled: spring.mail.username is not configured");
        } else {
            log.info("Email service enabled with sender: {}", fromEmail);
        }
    }

    @Override
    public void sendPlainTextEmail(String to, String subject, String body) {
        if (fromEmail == null || fromEmail.isBlank()) {
            log.warn("Email service disabled - skipping email '{}' to: {}", subject, maskEmail(to));
            return;
        }
        try {
            SimpleMailMessage message = new SimpleMailMessage();
            message.setFrom(fromEmail);
            message.setTo(to);
            message.setSubject(subject);
            message.setText(body);
            mailSender.send(message);
            log.info("Email '{}' sent to: {}", subject, maskEmail(to));
        } catch (Exception e) {
            // Delivery is best effort; callers never depend on it
            log.error("Failed to send email '{}' to: {}", subject, maskEmail(to), e);
        }
    }

    static String maskEmail(String email) {
        if (email == null || !email.contains("@")) {
            return "***";
        }
        int at = email.indexOf('@');
        String local = email.substring(0, at);
        String visible = local.length() <= 2 ? local.substring(0, 1) : local.substring(0, 2);
        return visible + "***" + email.substring(at);
    }
}
