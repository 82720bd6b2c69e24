package br.com.may.features.billing.domain.event;

import lombok.Getter;
import org.springframework.context.ApplicationEvent;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Published inside the activation transaction; listeners act on it after commit.
 */
@Getter
public class SubscriptionActivatedEvent extends ApplicationEvent {

    private final UUID userId;
    private final UUID subscriptionId;
    private final String planCode;
    private final BigDecimal amount;
    private final LocalDateTime currentPeriodEnd;

    public SubscriptionActivatedEvent(Object source, UUID userId, UUID subscriptionId, String planCode,
                                      BigDecimal amount, LocalDateTime currentPeriodEnd) {
        super(source);
        this.userId = userId;
        this.subscriptionId = subscriptionId;
        this.planCode = planCode;
        this.amount = amount;
        this.currentPeriodEnd = currentPeriodEnd;
    }
}
