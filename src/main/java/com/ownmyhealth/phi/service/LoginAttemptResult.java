package com.ownmyhealth.phi.service;

import com.ownmyhealth.phi.model.User;
import java.time.Instant;

/**
 * Result of {@link AuthService#attemptLogin}. Only one of the optional fields is
 * populated on failure, matching the reason the attempt was refused.
 */
public record LoginAttemptResult(boolean success, User user, String error, Integer remainingAttempts,
        Instant lockedUntil, boolean emailNotVerified) {

    public static LoginAttemptResult succeeded(User user) {
        return new LoginAttemptResult(true, user, null, null, null, false);
    }

    public static LoginAttemptResult failed(String error) {
        return new LoginAttemptResult(false, null, error, null, null, false);
    }

    public static LoginAttemptResult failedWithRemaining(String error, int remainingAttempts) {
        return new LoginAttemptResult(false, null, error, remainingAttempts, null, false);
    }

    public static LoginAttemptResult locked(String error, Instant lockedUntil) {
        return new LoginAttemptResult(false, null, error, null, lockedUntil, false);
    }

    public static LoginAttemptResult unverified(String error) {
        return new LoginAttemptResult(false, null, error, null, null, true);
    }
}
