package br.com.may.features.billing.domain.event;

import br.com.may.features.billing.application.BillingNotifications;
import br.com.may.features.billing.application.PlanCatalog;
import br.com.may.features.user.domain.model.User;
import br.com.may.features.user.domain.repository.UserRepository;
import br.com.may.shared.email.EmailService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

/**
 * Sends billing emails once the state change that triggered them has been committed.
 * <p>
 * A failed email never affects billing state; it is logged and dropped.
 * </p>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BillingEventListener {

    private final UserRepository userRepository;
    private final EmailService emailService;
    private final PlanCatalog planCatalog;

    @Async("notificationTaskExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleSubscriptionActivated(SubscriptionActivatedEvent event) {
        String planName = planCatalog.find(event.getPlanCode())
                .map(PlanCatalog.Plan::displayName)
                .orElse(event.getPlanCode());
        BigDecimal amount = event.getAmount() != null ? event.getAmount() : BigDecimal.ZERO;
        String body = BillingNotifications.subscriptionActivated(planName);
        if (event.getCurrentPeriodEnd() != null) {
            body = body + "\n\n" + BillingNotifications.paymentConfirmed(amount, event.getCurrentPeriodEnd());
        }
        send(event.getUserId(), BillingNotifications.SUBSCRIPTION_ACTIVATED, body);
    }

    @Async("notificationTaskExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handlePaymentFailed(PaymentFailedEvent event) {
        String subject;
        String body;
        if (event.isIntegrationError()) {
            subject = BillingNotifications.PAYMENT_INTEGRATION_FAILURE;
            body = BillingNotifications.integrationFailure();
        } else if (event.isRecurring()) {
            subject = BillingNotifications.RECURRING_PAYMENT_FAILED;
            body = BillingNotifications.recurringPaymentFailed(event.getReason());
        } else {
            subject = BillingNotifications.PAYMENT_DECLINED;
            body = BillingNotifications.paymentDeclined(event.getReason());
        }
        send(event.getUserId(), subject, body);
    }

    @Async("notificationTaskExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleSubscriptionCanceled(SubscriptionCanceledEvent event) {
        send(event.getUserId(), BillingNotifications.SUBSCRIPTION_CANCELED,
                BillingNotifications.subscriptionCanceled(event.getAccessUntil()));
    }

    private void send(UUID userId, String subject, String body) {
        try {
            Optional<User> user = userRepository.findById(userId);
            if (user.isEmpty()) {
                log.warn("Skipping billing email '{}': user {} not found", subject, userId);
                return;
            }
            emailService.sendPlainTextEmail(user.get().getEmail(), subject, body);
            log.info("Sent billing email '{}' to user {}", subject, userId);
        } catch (Exception e) {
            // billing state is already committed
            log.warn("Failed to send billing email '{}' to user {}: {}", subject, userId, e.getMessage());
        }
    }
}
