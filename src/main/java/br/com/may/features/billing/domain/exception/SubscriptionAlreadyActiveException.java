package br.com.may.features.billing.domain.exception;

import br.com.may.features.billing.domain.model.SubscriptionStatus;

public class SubscriptionAlreadyActiveException extends RuntimeException {
    public SubscriptionAlreadyActiveException(SubscriptionStatus status) {
        super("User already has a subscription in status " + status);
    }
}
