package br.com.may.features.billing.domain.exception;

public class SubscriptionAlreadyCanceledException extends RuntimeException {
    public SubscriptionAlreadyCanceledException() {
        super("Subscription is already canceled");
    }
}
