package br.com.may.features.billing.domain.event;

import lombok.Getter;
import org.springframework.context.ApplicationEvent;

import java.time.LocalDateTime;
import java.util.UUID;

@Getter
public class SubscriptionCanceledEvent extends ApplicationEvent {

    private final UUID userId;
    private final UUID subscriptionId;
    private final LocalDateTime accessUntil;

    public SubscriptionCanceledEvent(Object source, UUID userId, UUID subscriptionId, LocalDateTime accessUntil) {
        super(source);
        this.userId = userId;
        this.subscriptionId = subscriptionId;
        this.accessUntil = accessUntil;
    }
}
