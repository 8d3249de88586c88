package com.ownmyhealth.phi.config;

import com.ownmyhealth.phi.crypto.MasterKey;
import com.ownmyhealth.phi.security.JwtTokenProvider;
import jakarta.annotation.PostConstruct;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Refuses to start a production deployment with development secrets.
 */
@Component
public class StartupSecurityValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupSecurityValidator.class);
    static final Set<String> DEFAULT_SECRETS = Set.of(
            "access-secret-change-in-production",
            "refresh-secret-change-in-production",
            "dev-access-secret-change-in-production-0000",
            "dev-refresh-secret-change-in-production-000");
    private final Environment environment;
    @Value(value="${app.jwt.access-secret:}")
    private String accessSecret;
    @Value(value="${app.jwt.refresh-secret:}")
    private String refreshSecret;
    @Value(value="${app.crypto.master-key:}")
    private String masterKey;
    @Value(value="${app.auth.bcrypt-cost:12}")
    private int bcryptCost;
    @Value(value="${app.auth.demo.allowed:false}")
    private boolean demoAllowed;

    public StartupSecurityValidator(Environment environment) {
        this.environment = environment;
    }

    @PostConstruct
    public void validate() {
        if (this.bcryptCost < 4 || this.bcryptCost > 31) {
            throw new IllegalStateException("app.auth.bcrypt-cost must be between 4 and 31. Current: " + this.bcryptCost);
        }
        if (!PhiCoreConfig.isProduction(this.environment)) {
            return;
        }
        this.enforceSecret("app.jwt.access-secret", this.accessSecret);
        this.enforceSecret("app.jwt.refresh-secret", this.refreshSecret);
        if (this.accessSecret.equals(this.refreshSecret)) {
            throw new IllegalStateException("app.jwt.access-secret and app.jwt.refresh-secret must differ in production");
        }
        if (MasterKey.isPlaceholder(this.masterKey)) {
            throw new IllegalStateException("app.crypto.master-key appears to be a placeholder. Generate one with: openssl rand -hex 32");
        }
        if (this.demoAllowed) {
            log.warn("Demo account login is enabled in production");
        }
        log.info("Production security configuration validated");
    }

    private void enforceSecret(String property, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalStateException(property + " is required in production");
        }
        if (DEFAULT_SECRETS.contains(value)) {
            throw new IllegalStateException(property + " must be changed in production");
        }
        if (value.length() < JwtTokenProvider.MIN_SECRET_LENGTH) {
            throw new IllegalStateException(property + " must be at least " + JwtTokenProvider.MIN_SECRET_LENGTH
                    + " characters. Current length: " + value.length() + ". Generate with: openssl rand -base64 32");
        }
    }
}
