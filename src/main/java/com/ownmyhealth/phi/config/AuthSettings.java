package com.ownmyhealth.phi.config;

import java.time.Duration;
import java.util.Locale;

/**
 * Immutable authentication policy, assembled once from {@code app.auth.*} and {@code app.jwt.*}.
 */
public record AuthSettings(
        Duration accessTokenTtl,
        Duration refreshTokenTtl,
        Duration demoSessionTtl,
        int maxLoginAttempts,
        Duration lockoutDuration,
        int bcryptCost,
        Duration emailVerificationTtl,
        Duration passwordResetTtl,
        boolean requireEmailVerification,
        boolean demoAllowed,
        String demoEmail,
        String demoPassword) {

    public AuthSettings {
        if (maxLoginAttempts < 1) {
            throw new IllegalStateException("app.auth.lockout.max-attempts must be at least 1");
        }
        demoEmail = demoEmail == null ? "" : demoEmail.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * True when {@code email} is the demo address, whether or not demo login is allowed.
     */
    public boolean matchesDemoEmail(String email) {
        return email != null && !this.demoEmail.isEmpty() && this.demoEmail.equals(email.trim().toLowerCase(Locale.ROOT));
    }

    public boolean isDemoEmail(String email) {
        return this.demoAllowed && this.matchesDemoEmail(email);
    }

    public static AuthSettings defaults() {
        return new AuthSettings(Duration.ofMinutes(15), Duration.ofDays(7), Duration.ofDays(30), 5,
                Duration.ofMinutes(30), 12, Duration.ofHours(24), Duration.ofHours(1), true, false,
                "demo@ownmyhealth.com", "Demo123!");
    }
}
