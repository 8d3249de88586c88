package com.ownmyhealth.phi.exception;

import java.time.Instant;

public class AccountLockedException extends PhiCoreException {
    private final Instant lockedUntil;

    public AccountLockedException(String message, Instant lockedUntil) {
        super(message);
        this.lockedUntil = lockedUntil;
    }

    public Instant getLockedUntil() {
        return this.lockedUntil;
    }
}
