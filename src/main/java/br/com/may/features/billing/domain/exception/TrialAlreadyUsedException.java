package br.com.may.features.billing.domain.exception;

import java.util.UUID;

public class TrialAlreadyUsedException extends RuntimeException {
    public TrialAlreadyUsedException(UUID userId) {
        super("User " + userId + " has already used the free trial");
    }
}
