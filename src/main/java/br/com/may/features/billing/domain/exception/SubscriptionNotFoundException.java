package br.com.may.features.billing.domain.exception;

import br.com.may.shared.exception.ResourceNotFoundException;

import java.util.UUID;

public class SubscriptionNotFoundException extends ResourceNotFoundException {
    public SubscriptionNotFoundException(UUID userId) {
        super("No subscription found for user " + userId);
    }
}
