package br.com.may.features.billing.domain.exception;

public class ReactivationNotAllowedException extends RuntimeException {
    public ReactivationNotAllowedException(String message) {
        super(message);
    }
}
