package br.com.may.features.billing.domain.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle of a {@link Subscription}. The transition table below is closed: any move not listed
 * is rejected by {@link Subscription#transitionTo(SubscriptionStatus, java.time.LocalDateTime)}.
 *
 * <pre>
 * PENDING  -> TRIAL | ACTIVE | CANCELED | EXPIRED
 * TRIAL    -> ACTIVE | PAST_DUE | CANCELED
 * ACTIVE   -> ACTIVE (renewal) | PAST_DUE | CANCELED
 * PAST_DUE -> ACTIVE | CANCELED
 * CANCELED -> ACTIVE (reactivation)
 * EXPIRED  -> (terminal)
 * </pre>
 * The row itself outlives a lifecycle. A checkout or trial restarts it through
 * {@link Subscription#beginNewLifecycle}, which is allowed only from the states below:
 * <pre>
 * PENDING | CANCELED | EXPIRED -> PENDING | TRIAL (new lifecycle)
 * </pre>
 */
public enum SubscriptionStatus {
    PENDING,
    TRIAL,
    ACTIVE,
    PAST_DUE,
    CANCELED,
    EXPIRED;

    private static final Map<SubscriptionStatus, Set<SubscriptionStatus>> TRANSITIONS;
    private static final Set<SubscriptionStatus> RESTARTABLE = Collections.unmodifiableSet(EnumSet.of(PENDING, CANCELED, EXPIRED));
    private static final Set<SubscriptionStatus> LIFECYCLE_START = Collections.unmodifiableSet(EnumSet.of(PENDING, TRIAL));

    static {
        Map<SubscriptionStatus, Set<SubscriptionStatus>> table = new EnumMap<>(SubscriptionStatus.class);
        table.put(PENDING, EnumSet.of(TRIAL, ACTIVE, CANCELED, EXPIRED));
        table.put(TRIAL, EnumSet.of(ACTIVE, PAST_DUE, CANCELED));
        table.put(ACTIVE, EnumSet.of(ACTIVE, PAST_DUE, CANCELED));
        table.put(PAST_DUE, EnumSet.of(ACTIVE, CANCELED));
        table.put(CANCELED, EnumSet.of(ACTIVE));
        table.put(EXPIRED, EnumSet.noneOf(SubscriptionStatus.class));
        table.replaceAll((status, targets) -> Collections.unmodifiableSet(targets));
        TRANSITIONS = Collections.unmodifiableMap(table);
    }

    public boolean canTransitionTo(SubscriptionStatus next) {
        return next != null && TRANSITIONS.get(this).contains(next);
    }

    public Set<SubscriptionStatus> allowedTransitions() {
        return TRANSITIONS.get(this);
    }

    /**
     * Whether a new lifecycle starting in {@code initial} may replace this one on the same row.
     */
    public boolean canRestartAs(SubscriptionStatus initial) {
        return RESTARTABLE.contains(this) && LIFECYCLE_START.contains(initial);
    }

    public boolean isTerminal() {
        return TRANSITIONS.get(this).isEmpty();
    }

    /**
     * States in which the user is billed or about to be billed and should not start another checkout.
     */
    public boolean isLive() {
        return this == TRIAL || this == ACTIVE || this == PAST_DUE;
    }
}
