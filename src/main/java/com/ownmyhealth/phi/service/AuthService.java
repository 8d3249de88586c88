package com.ownmyhealth.phi.service;

import com.mongodb.client.result.UpdateResult;
import com.ownmyhealth.phi.config.AuthSettings;
import com.ownmyhealth.phi.exception.AuthenticationFailedException;
import com.ownmyhealth.phi.exception.NotFoundException;
import com.ownmyhealth.phi.exception.ValidationException;
import com.ownmyhealth.phi.model.User;
import com.ownmyhealth.phi.model.UserRole;
import com.ownmyhealth.phi.repository.UserRepository;
import com.ownmyhealth.phi.util.LogSanitizer;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

/**
 * Account authentication and maintenance flows.
 *
 * Responses never reveal whether an email is registered: unknown accounts get
 * the same generic login error after an equally expensive BCrypt comparison,
 * and password-reset / resend requests always report success.
 *
 * Existing accounts are only ever changed through field-scoped updates. A whole
 * document save would write back the stale lockout counters read at the start
 * of the flow and undo concurrent failed-login accounting.
 */
@Service
public class AuthService {
    private static final Logger log = LoggerFactory.getLogger(AuthService.class);
    static final String INVALID_CREDENTIALS = "Invalid email or password";
    private static final int ONE_TIME_TOKEN_BYTES = 32;

    private final UserRepository userRepository;
    private final MongoTemplate mongoTemplate;
    private final PasswordService passwordService;
    private final LoginAttemptService loginAttemptService;
    private final SessionService sessionService;
    private final AuthSettings settings;
    private final Clock clock;
    private final SecureRandom secureRandom = new SecureRandom();

    public AuthService(UserRepository userRepository, MongoTemplate mongoTemplate, PasswordService passwordService,
            LoginAttemptService loginAttemptService, SessionService sessionService, AuthSettings settings, Clock clock) {
        this.userRepository = userRepository;
        this.mongoTemplate = mongoTemplate;
        this.passwordService = passwordService;
        this.loginAttemptService = loginAttemptService;
        this.sessionService = sessionService;
        this.settings = settings;
        this.clock = clock;
    }

    public RegistrationResult createUser(String email, String password, UserRole role) {
        String normalized = normalizeEmail(email);
        if (normalized.isEmpty()) {
            throw new ValidationException("Email is required");
        }
        PasswordValidationResult strength = this.passwordService.validatePasswordStrength(password);
        if (!strength.valid()) {
            throw new ValidationException(strength.errors());
        }
        if (this.userRepository.existsByEmail(normalized)) {
            throw new ValidationException("Email already registered");
        }
        Instant now = this.clock.instant();
        User user = new User();
        user.setEmail(normalized);
        user.setPasswordHash(this.passwordService.hashPassword(password));
        user.setRole(role != null ? role : UserRole.PATIENT);
        user.setCreatedAt(now);
        user.setUpdatedAt(now);
        String verificationToken = null;
        if (this.settings.requireEmailVerification()) {
            verificationToken = this.newOneTimeToken();
            user.setEmailVerificationToken(verificationToken);
            user.setEmailVerificationExpires(now.plus(this.settings.emailVerificationTtl()));
        } else {
            user.setEmailVerified(true);
        }
        User saved = this.userRepository.save(user);
        log.info("Registered account {} ({})", saved.getId(), LogSanitizer.maskEmail(normalized));
        return new RegistrationResult(saved, verificationToken);
    }

    public Optional<User> findUserByEmail(String email) {
        String normalized = normalizeEmail(email);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        return this.userRepository.findByEmail(normalized);
    }

    public Optional<User> findUserById(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        return this.userRepository.findById(id);
    }

    public boolean emailExists(String email) {
        String normalized = normalizeEmail(email);
        return !normalized.isEmpty() && this.userRepository.existsByEmail(normalized);
    }

    /**
     * Checks, in order: demo account, unknown account, deactivated, unverified,
     * locked, password. Only a wrong password against a known, usable account
     * counts toward lockout.
     */
    public LoginAttemptResult attemptLogin(String email, String password) {
        Optional<User> found = this.findUserByEmail(email);
        if (this.settings.matchesDemoEmail(email)) {
            return this.settings.demoAllowed() ? this.attemptDemoLogin(found, password) : LoginAttemptResult.failed("Demo account is not available");
        }
        if (found.isEmpty()) {
            this.passwordService.simulateVerification(password);
            return LoginAttemptResult.failed(INVALID_CREDENTIALS);
        }
        User user = found.get();
        if (!user.isActive()) {
            return LoginAttemptResult.failed("Account is deactivated");
        }
        if (this.settings.requireEmailVerification() && !user.isEmailVerified()) {
            return LoginAttemptResult.unverified("Email not verified. Please check your email for the verification link.");
        }
        if (this.loginAttemptService.isAccountLocked(user)) {
            long minutes = (this.loginAttemptService.getLockoutRemainingTime(user) + 59) / 60;
            return LoginAttemptResult.locked("Account is locked. Try again in " + minutes + " minutes", user.getLockedUntil());
        }
        if (!this.passwordService.verifyPassword(password, user.getPasswordHash())) {
            LockoutResult lockout = this.loginAttemptService.recordFailedLogin(user);
            if (lockout.locked()) {
                return LoginAttemptResult.locked("Account locked due to too many failed attempts. Try again in "
                        + this.settings.lockoutDuration().toMinutes() + " minutes", lockout.lockedUntil());
            }
            return LoginAttemptResult.failedWithRemaining(INVALID_CREDENTIALS + ". " + lockout.remainingAttempts() + " attempts remaining",
                    lockout.remainingAttempts());
        }
        this.loginAttemptService.resetFailedLoginAttempts(user);
        return LoginAttemptResult.succeeded(user);
    }

    private LoginAttemptResult attemptDemoLogin(Optional<User> found, String password) {
        if (found.isEmpty()) {
            return LoginAttemptResult.failed("Demo account not yet initialized. Please try again in a moment.");
        }
        User user = found.get();
        if (!this.passwordService.verifyPassword(password, user.getPasswordHash())) {
            return LoginAttemptResult.failed("Invalid password for demo account");
        }
        Instant now = this.clock.instant();
        this.updateUser(Criteria.where("_id").is(user.getId()), demoReset().set("lastLoginAt", now), now);
        applyDemoReset(user);
        user.setLastLoginAt(now);
        user.setUpdatedAt(now);
        return LoginAttemptResult.succeeded(user);
    }

    public AccountResult verifyEmail(String token) {
        if (token == null || token.isBlank()) {
            return AccountResult.failure("Invalid verification token");
        }
        Optional<User> found = this.userRepository.findByEmailVerificationToken(token);
        if (found.isEmpty()) {
            return AccountResult.failure("Invalid verification token");
        }
        User user = found.get();
        Instant now = this.clock.instant();
        if (user.getEmailVerificationExpires() != null && user.getEmailVerificationExpires().isBefore(now)) {
            return AccountResult.failure("Verification token has expired. Please request a new one.");
        }
        if (user.isEmailVerified()) {
            return AccountResult.failure("Email is already verified");
        }
        UpdateResult result = this.updateUser(Criteria.where("_id").is(user.getId()).and("emailVerificationToken").is(token),
                new Update().set("emailVerified", true).unset("emailVerificationToken").unset("emailVerificationExpires"), now);
        if (result.getModifiedCount() == 0) {
            return AccountResult.failure("Invalid verification token");
        }
        user.setEmailVerified(true);
        user.setEmailVerificationToken(null);
        user.setEmailVerificationExpires(null);
        user.setUpdatedAt(now);
        return AccountResult.forUser(user);
    }

    public AccountResult resendVerificationEmail(String email) {
        Optional<User> found = this.findUserByEmail(email);
        if (found.isEmpty()) {
            return AccountResult.ok();
        }
        User user = found.get();
        if (user.isEmailVerified()) {
            return AccountResult.failure("Email is already verified");
        }
        Instant now = this.clock.instant();
        String token = this.newOneTimeToken();
        Instant expires = now.plus(this.settings.emailVerificationTtl());
        this.updateUser(Criteria.where("_id").is(user.getId()),
                new Update().set("emailVerificationToken", token).set("emailVerificationExpires", expires), now);
        user.setEmailVerificationToken(token);
        user.setEmailVerificationExpires(expires);
        user.setUpdatedAt(now);
        return AccountResult.withToken(token);
    }

    /**
     * Always succeeds. A reset token is issued only for an existing, active account.
     */
    public AccountResult forgotPassword(String email) {
        Optional<User> found = this.findUserByEmail(email);
        if (found.isEmpty() || !found.get().isActive()) {
            return AccountResult.ok();
        }
        User user = found.get();
        Instant now = this.clock.instant();
        String token = this.newOneTimeToken();
        Instant expires = now.plus(this.settings.passwordResetTtl());
        this.updateUser(Criteria.where("_id").is(user.getId()),
                new Update().set("passwordResetToken", token).set("passwordResetExpires", expires), now);
        user.setPasswordResetToken(token);
        user.setPasswordResetExpires(expires);
        user.setUpdatedAt(now);
        return AccountResult.withToken(token);
    }

    public AccountResult resetPassword(String token, String newPassword) {
        if (token == null || token.isBlank()) {
            return AccountResult.failure("Invalid or expired reset token");
        }
        Optional<User> found = this.userRepository.findByPasswordResetToken(token);
        if (found.isEmpty()) {
            return AccountResult.failure("Invalid or expired reset token");
        }
        User user = found.get();
        Instant now = this.clock.instant();
        if (user.getPasswordResetExpires() != null && user.getPasswordResetExpires().isBefore(now)) {
            this.updateUser(Criteria.where("_id").is(user.getId()).and("passwordResetToken").is(token),
                    new Update().unset("passwordResetToken").unset("passwordResetExpires"), now);
            user.setPasswordResetToken(null);
            user.setPasswordResetExpires(null);
            return AccountResult.failure("Reset token has expired. Please request a new password reset.");
        }
        PasswordValidationResult strength = this.passwordService.validatePasswordStrength(newPassword);
        if (!strength.valid()) {
            return AccountResult.failure(String.join(". ", strength.errors()));
        }
        String passwordHash = this.passwordService.hashPassword(newPassword);
        // A successful reset proves ownership, so it also lifts any lock.
        UpdateResult result = this.updateUser(Criteria.where("_id").is(user.getId()).and("passwordResetToken").is(token),
                new Update().set("passwordHash", passwordHash).unset("passwordResetToken").unset("passwordResetExpires")
                        .set("failedLoginAttempts", 0).unset("lockedUntil"), now);
        if (result.getModifiedCount() == 0) {
            return AccountResult.failure("Invalid or expired reset token");
        }
        user.setPasswordHash(passwordHash);
        user.setPasswordResetToken(null);
        user.setPasswordResetExpires(null);
        user.setFailedLoginAttempts(0);
        user.setLockedUntil(null);
        user.setUpdatedAt(now);
        this.sessionService.revokeAllUserTokens(user.getId());
        return AccountResult.forUser(user);
    }

    /**
     * Changes the password of a signed-in user and signs out every session.
     *
     * @throws ValidationException if the new password breaks any strength rule
     * @throws AuthenticationFailedException if the current password is wrong
     */
    public User changePassword(String userId, String currentPassword, String newPassword) {
        User user = this.findUserById(userId).orElseThrow(() -> new NotFoundException("User not found"));
        PasswordValidationResult strength = this.passwordService.validatePasswordStrength(newPassword);
        if (!strength.valid()) {
            throw new ValidationException(strength.errors());
        }
        if (!this.passwordService.verifyPassword(currentPassword, user.getPasswordHash())) {
            throw new AuthenticationFailedException("Current password is incorrect");
        }
        Instant now = this.clock.instant();
        String passwordHash = this.passwordService.hashPassword(newPassword);
        this.updateUser(Criteria.where("_id").is(user.getId()), Update.update("passwordHash", passwordHash), now);
        user.setPasswordHash(passwordHash);
        user.setUpdatedAt(now);
        this.sessionService.revokeAllUserTokens(user.getId());
        return user;
    }

    public boolean isDemoUser(User user) {
        return user != null && this.settings.isDemoEmail(user.getEmail());
    }

    public boolean isDemoEmail(String email) {
        return this.settings.isDemoEmail(email);
    }

    /**
     * Provisions the demo account, or puts an existing one back into a usable
     * state. No-op unless demo login is allowed.
     */
    public void initializeDemoUser() {
        if (!this.settings.demoAllowed()) {
            return;
        }
        Optional<User> existing = this.userRepository.findByEmail(this.settings.demoEmail());
        Instant now = this.clock.instant();
        if (existing.isPresent()) {
            this.updateUser(Criteria.where("_id").is(existing.get().getId()), demoReset(), now);
            applyDemoReset(existing.get());
            log.info("Demo user verified");
            return;
        }
        User user = new User();
        user.setEmail(this.settings.demoEmail());
        user.setPasswordHash(this.passwordService.hashPassword(this.settings.demoPassword()));
        user.setRole(UserRole.PATIENT);
        user.setCreatedAt(now);
        user.setUpdatedAt(now);
        applyDemoReset(user);
        this.userRepository.save(user);
        log.info("Demo user created (auto-verified)");
    }

    /**
     * The demo account is shared, so signing in or restarting puts it back into a
     * verified, unlocked state.
     */
    private static Update demoReset() {
        return new Update().set("emailVerified", true).unset("emailVerificationToken").unset("emailVerificationExpires")
                .set("active", true).set("failedLoginAttempts", 0).unset("lockedUntil").unset("lastFailedLogin");
    }

    private static void applyDemoReset(User user) {
        user.setEmailVerified(true);
        user.setEmailVerificationToken(null);
        user.setEmailVerificationExpires(null);
        user.setActive(true);
        user.setFailedLoginAttempts(0);
        user.setLockedUntil(null);
        user.setLastFailedLogin(null);
    }

    private UpdateResult updateUser(Criteria criteria, Update update, Instant now) {
        return this.mongoTemplate.updateFirst(Query.query(criteria), update.set("updatedAt", now), User.class);
    }

    private String newOneTimeToken() {
        byte[] bytes = new byte[ONE_TIME_TOKEN_BYTES];
        this.secureRandom.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    static String normalizeEmail(String email) {
        return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
    }
}
