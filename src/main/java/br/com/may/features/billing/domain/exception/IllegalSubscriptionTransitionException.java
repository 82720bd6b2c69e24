package br.com.may.features.billing.domain.exception;

import br.com.may.features.billing.domain.model.SubscriptionStatus;
import lombok.Getter;

/**
 * Thrown when a caller asks for a status change the subscription lifecycle does not allow.
 */
@Getter
public class IllegalSubscriptionTransitionException extends RuntimeException {

    private final SubscriptionStatus from;
    private final SubscriptionStatus to;

    public IllegalSubscriptionTransitionException(SubscriptionStatus from, SubscriptionStatus to) {
        super("Illegal subscription transition " + from + " -> " + to);
        this.from = from;
        this.to = to;
    }
}
