package com.ownmyhealth.phi.exception;

public class AuthenticationFailedException extends PhiCoreException {
    private final Integer remainingAttempts;

    public AuthenticationFailedException(String message) {
        this(message, null);
    }

    public AuthenticationFailedException(String message, Integer remainingAttempts) {
        super(message);
        this.remainingAttempts = remainingAttempts;
    }

    public Integer getRemainingAttempts() {
        return this.remainingAttempts;
    }
}
