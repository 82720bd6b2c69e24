package br.com.may.features.billing.domain.model;

import br.com.may.features.billing.domain.exception.IllegalSubscriptionTransitionException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EntityListeners;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * One row per user. Status changes go through {@link #transitionTo}; the row is never deleted.
 */
@Entity
@EntityListeners(AuditingEntityListener.class)
@Table(name = "subscriptions")
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Subscription {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false, unique = true)
    private UUID userId;

    @Setter(AccessLevel.NONE)
    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private SubscriptionStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "provider", length = 20)
    private GatewayProvider provider;

    @Column(name = "provider_subscription_id", unique = true)
    private String providerSubscriptionId;

    @Column(name = "provider_order_id")
    private String providerOrderId;

    @Column(name = "plan_code", nullable = false, length = 40)
    private String planCode;

    @Enumerated(EnumType.STRING)
    @Column(name = "billing_cycle", nullable = false, length = 20)
    private BillingCycle billingCycle;

    @Column(name = "amount", precision = 10, scale = 2)
    private BigDecimal amount;

    @Column(name = "current_period_start")
    private LocalDateTime currentPeriodStart;

    @Column(name = "current_period_end")
    private LocalDateTime currentPeriodEnd;

    @Column(name = "next_billing_at")
    private LocalDateTime nextBillingAt;

    @Column(name = "canceled_at")
    private LocalDateTime canceledAt;

    @Column(name = "trial_ends_at")
    private LocalDateTime trialEndsAt;

    @CreatedDate
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @LastModifiedDate
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    /**
     * A new lifecycle that starts with a checkout: {@code (none) -> PENDING}.
     */
    public static Subscription pending(UUID userId, String planCode, BillingCycle cycle, BigDecimal amount) {
        Subscription subscription = new Subscription();
        subscription.userId = userId;
        subscription.status = SubscriptionStatus.PENDING;
        subscription.planCode = planCode;
        subscription.billingCycle = cycle;
        subscription.amount = amount;
        return subscription;
    }

    /**
     * A new lifecycle that starts with a free trial: {@code (none) -> TRIAL}.
     */
    public static Subscription trial(UUID userId, LocalDateTime now, LocalDateTime trialEndsAt) {
        Subscription subscription = new Subscription();
        subscription.userId = userId;
        subscription.status = SubscriptionStatus.TRIAL;
        subscription.applyTrial(now, trialEndsAt);
        return subscription;
    }

    /**
     * Start a trial on an existing row that is pending or whose previous lifecycle is over.
     */
    public void beginTrial(LocalDateTime now, LocalDateTime trialEndsAt) {
        beginNewLifecycle(SubscriptionStatus.TRIAL);
        applyTrial(now, trialEndsAt);
    }

    private void applyTrial(LocalDateTime now, LocalDateTime trialEndsAt) {
        this.planCode = "trial";
        this.billingCycle = BillingCycle.MONTHLY;
        this.amount = BigDecimal.ZERO.setScale(2);
        this.currentPeriodStart = now;
        this.currentPeriodEnd = trialEndsAt;
        this.trialEndsAt = trialEndsAt;
    }

    /**
     * Move to {@code next}, enforcing the lifecycle table in {@link SubscriptionStatus}.
     *
     * @throws IllegalSubscriptionTransitionException if the move is not allowed
     */
    public void transitionTo(SubscriptionStatus next, LocalDateTime now) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalSubscriptionTransitionException(status, next);
        }
        this.status = next;
        if (next == SubscriptionStatus.CANCELED) {
            this.canceledAt = now;
        } else if (next == SubscriptionStatus.ACTIVE) {
            this.canceledAt = null;
        }
    }

    /**
     * Reset the row to the first state of a new lifecycle ({@code PENDING} or {@code TRIAL}).
     * A canceled row may restart before its paid period ends; the remaining days are replaced by the new period.
     *
     * @throws IllegalSubscriptionTransitionException unless {@link SubscriptionStatus#canRestartAs} allows it
     */
    public void beginNewLifecycle(SubscriptionStatus initial) {
        if (!status.canRestartAs(initial)) {
            throw new IllegalSubscriptionTransitionException(status, initial);
        }
        this.status = initial;
        this.provider = null;
        clearGatewayReferences();
        this.currentPeriodStart = null;
        this.currentPeriodEnd = null;
        this.nextBillingAt = null;
        this.canceledAt = null;
        this.trialEndsAt = null;
    }

    /**
     * Forget the provider subscription and order of an earlier checkout. A new checkout replaces them.
     */
    public void clearGatewayReferences() {
        this.providerSubscriptionId = null;
        this.providerOrderId = null;
    }

    /**
     * Whether a payment may bring this canceled row back to ACTIVE: the paid period is still running and
     * the provider has not canceled the subscription on its side.
     */
    public boolean isResumable(LocalDateTime now) {
        return status == SubscriptionStatus.CANCELED
                && currentPeriodEnd != null && now.isBefore(currentPeriodEnd)
                && providerSubscriptionId == null;
    }

    /**
     * Whether the user currently has paid or trial access. Past-due and canceled subscriptions keep
     * access until the end of the period already paid for.
     */
    public boolean grantsAccess(LocalDateTime now) {
        return switch (status) {
            case ACTIVE -> true;
            case TRIAL -> trialEndsAt == null || now.isBefore(trialEndsAt);
            case PAST_DUE, CANCELED -> currentPeriodEnd != null && now.isBefore(currentPeriodEnd);
            case PENDING, EXPIRED -> false;
        };
    }

    /**
     * Extend the paid period. The period end never moves backwards.
     */
    public void applyPaidPeriod(LocalDateTime start, LocalDateTime end, LocalDateTime nextBilling) {
        this.currentPeriodStart = start;
        if (currentPeriodEnd == null || end.isAfter(currentPeriodEnd)) {
            this.currentPeriodEnd = end;
        }
        this.nextBillingAt = nextBilling;
    }
}
