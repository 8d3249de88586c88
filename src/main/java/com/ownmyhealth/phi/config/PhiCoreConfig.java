package com.ownmyhealth.phi.config;

import com.ownmyhealth.phi.crypto.EncryptionService;
import com.ownmyhealth.phi.crypto.MasterKey;
import com.ownmyhealth.phi.security.JwtTokenProvider;
import java.time.Clock;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

/**
 * Assembles the immutable security settings once at startup. Services receive
 * them by constructor; nothing reads configuration after this point.
 */
@Configuration
public class PhiCoreConfig {
    public static final String PRODUCTION_PROFILE = "prod";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MasterKey masterKey(@Value(value="${app.crypto.master-key:}") String masterKeyHex, Environment environment) {
        return MasterKey.fromHex(masterKeyHex, isProduction(environment));
    }

    @Bean
    public EncryptionService encryptionService(MasterKey masterKey,
            @Value(value="${app.crypto.kdf-iterations:100000}") int kdfIterations) {
        return new EncryptionService(masterKey, kdfIterations);
    }

    @Bean
    public AuthSettings authSettings(
            @Value(value="${app.jwt.access-ttl:15m}") Duration accessTtl,
            @Value(value="${app.jwt.refresh-ttl:7d}") Duration refreshTtl,
            @Value(value="${app.auth.demo.session-ttl:30d}") Duration demoSessionTtl,
            @Value(value="${app.auth.lockout.max-attempts:5}") int maxAttempts,
            @Value(value="${app.auth.lockout.duration-minutes:30}") int lockoutMinutes,
            @Value(value="${app.auth.bcrypt-cost:12}") int bcryptCost,
            @Value(value="${app.auth.email-verification-ttl:24h}") Duration emailVerificationTtl,
            @Value(value="${app.auth.password-reset-ttl:1h}") Duration passwordResetTtl,
            @Value(value="${app.auth.require-email-verification:true}") boolean requireEmailVerification,
            @Value(value="${app.auth.demo.allowed:false}") boolean demoAllowed,
            @Value(value="${app.auth.demo.email:demo@ownmyhealth.com}") String demoEmail,
            @Value(value="${app.auth.demo.password:Demo123!}") String demoPassword) {
        return new AuthSettings(accessTtl, refreshTtl, demoSessionTtl, maxAttempts, Duration.ofMinutes(lockoutMinutes),
                bcryptCost, emailVerificationTtl, passwordResetTtl, requireEmailVerification, demoAllowed, demoEmail, demoPassword);
    }

    @Bean
    public AuditSettings auditSettings(
            @Value(value="${app.audit.retention-days:2555}") int retentionDays,
            @Value(value="${app.audit.user-agent-max-length:500}") int userAgentMaxLength,
            @Value(value="${app.audit.export-id-limit:100}") int exportIdLimit) {
        return new AuditSettings(retentionDays, userAgentMaxLength, exportIdLimit);
    }

    @Bean
    public JwtTokenProvider jwtTokenProvider(
            @Value(value="${app.jwt.access-secret:}") String accessSecret,
            @Value(value="${app.jwt.refresh-secret:}") String refreshSecret,
            AuthSettings authSettings, Clock clock) {
        return new JwtTokenProvider(accessSecret, refreshSecret, authSettings.accessTokenTtl(), clock);
    }

    @Bean
    public PasswordEncoder passwordEncoder(AuthSettings authSettings) {
        return new BCryptPasswordEncoder(authSettings.bcryptCost());
    }

    public static boolean isProduction(Environment environment) {
        return environment.acceptsProfiles(Profiles.of(PRODUCTION_PROFILE));
    }
}
