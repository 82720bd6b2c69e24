package br.com.may.features.billing.domain.event;

import lombok.Getter;
import org.springframework.context.ApplicationEvent;

import java.util.UUID;

@Getter
public class PaymentFailedEvent extends ApplicationEvent {

    private final UUID userId;
    private final UUID subscriptionId;
    private final String reason;
    private final boolean integrationError;
    private final boolean recurring;

    public PaymentFailedEvent(Object source, UUID userId, UUID subscriptionId, String reason,
                              boolean integrationError, boolean recurring) {
        super(source);
        this.userId = userId;
        this.subscriptionId = subscriptionId;
        this.reason = reason;
        this.integrationError = integrationError;
        this.recurring = recurring;
    }
}
