package com.ownmyhealth.phi.service;

import com.ownmyhealth.phi.config.PhiCoreConfig;
import com.ownmyhealth.phi.util.LogSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Stand-in for a mail transport. Outside production the link is written to the
 * log so local sign-up and reset flows can be completed by hand; in production
 * only the fact that a link was issued is logged.
 */
@Component
public class LoggingAccountNotifier implements AccountNotifier {
    private static final Logger log = LoggerFactory.getLogger(LoggingAccountNotifier.class);
    private final boolean production;
    private final String baseUrl;

    public LoggingAccountNotifier(Environment environment, @Value(value="${app.public-base-url:http://localhost:8080}") String baseUrl) {
        this.production = PhiCoreConfig.isProduction(environment);
        this.baseUrl = baseUrl;
    }

    @Override
    public void sendVerificationLink(String email, String token) {
        this.deliver("Email verification", email, "/api/v1/auth/verify-email?token=" + token);
    }

    @Override
    public void sendPasswordResetLink(String email, String token) {
        this.deliver("Password reset", email, "/api/v1/auth/reset-password?token=" + token);
    }

    private void deliver(String purpose, String email, String path) {
        if (this.production) {
            log.warn("{} link issued for {} but no mail transport is configured", purpose, LogSanitizer.maskEmail(email));
            return;
        }
        log.info("{} link for {}: {}{}", purpose, LogSanitizer.maskEmail(email), this.baseUrl, path);
    }
}
