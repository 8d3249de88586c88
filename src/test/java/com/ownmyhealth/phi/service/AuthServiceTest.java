package com.ownmyhealth.phi.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.mongodb.client.result.UpdateResult;
import com.ownmyhealth.phi.config.AuthSettings;
import com.ownmyhealth.phi.exception.AuthenticationFailedException;
import com.ownmyhealth.phi.exception.ValidationException;
import com.ownmyhealth.phi.model.User;
import com.ownmyhealth.phi.model.UserRole;
import com.ownmyhealth.phi.repository.UserRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

class AuthServiceTest {
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final String PASSWORD = "Health#2024";
    private UserRepository userRepository;
    private MongoTemplate mongoTemplate;
    private PasswordService passwordService;
    private LoginAttemptService loginAttemptService;
    private SessionService sessionService;
    private AuthService authService;

    private static AuthSettings settings(boolean demoAllowed) {
        return new AuthSettings(Duration.ofMinutes(15), Duration.ofDays(7), Duration.ofDays(30), 5,
                Duration.ofMinutes(30), 4, Duration.ofHours(24), Duration.ofHours(1), true, demoAllowed,
                "demo@ownmyhealth.com", "Demo123!");
    }

    @BeforeEach
    void setUp() {
        this.setUp(false);
    }

    private void setUp(boolean demoAllowed) {
        this.userRepository = mock(UserRepository.class);
        this.mongoTemplate = mock(MongoTemplate.class);
        this.passwordService = spy(new PasswordService(new BCryptPasswordEncoder(4)));
        this.loginAttemptService = mock(LoginAttemptService.class);
        this.sessionService = mock(SessionService.class);
        this.authService = new AuthService(this.userRepository, this.mongoTemplate, this.passwordService, this.loginAttemptService,
                this.sessionService, settings(demoAllowed), Clock.fixed(NOW, ZoneOffset.UTC));
        when(this.mongoTemplate.updateFirst(any(Query.class), any(Update.class), eq(User.class)))
                .thenReturn(UpdateResult.acknowledged(1, 1L, null));
        when(this.userRepository.save(any(User.class))).thenAnswer(inv -> {
            User u = inv.getArgument(0);
            if (u.getId() == null) {
                u.setId("user-1");
            }
            return u;
        });
    }

    private User storedUser(boolean verified) {
        User user = new User();
        user.setId("user-1");
        user.setEmail("patient@example.com");
        user.setPasswordHash(this.passwordService.hashPassword(PASSWORD));
        user.setEmailVerified(verified);
        when(this.userRepository.findByEmail("patient@example.com")).thenReturn(Optional.of(user));
        when(this.userRepository.findById("user-1")).thenReturn(Optional.of(user));
        return user;
    }

    @Test
    void registrationNormalizesEmailAndIssuesVerificationToken() {
        RegistrationResult result = this.authService.createUser("  Patient@Example.COM ", PASSWORD, null);

        User user = result.user();
        assertEquals("patient@example.com", user.getEmail());
        assertEquals(UserRole.PATIENT, user.getRole());
        assertFalse(user.isEmailVerified());
        assertTrue(result.verificationToken().matches("^[0-9a-f]{64}$"));
        assertEquals(NOW.plus(Duration.ofHours(24)), user.getEmailVerificationExpires());
        assertNotEquals(PASSWORD, user.getPasswordHash());
    }

    @Test
    void registrationRejectsWeakPasswordWithAllViolations() {
        ValidationException ex = assertThrows(ValidationException.class,
                () -> this.authService.createUser("patient@example.com", "weak", UserRole.PATIENT));

        assertEquals(4, ex.getViolations().size());
        verify(this.userRepository, never()).save(any());
    }

    @Test
    void registrationRejectsDuplicateEmail() {
        when(this.userRepository.existsByEmail("patient@example.com")).thenReturn(true);

        ValidationException ex = assertThrows(ValidationException.class,
                () -> this.authService.createUser("Patient@example.com", PASSWORD, UserRole.PATIENT));
        assertEquals("Email already registered", ex.getMessage());
    }

    @Test
    void loginBeforeVerificationIsRefusedThenSucceedsAfter() {
        RegistrationResult registered = this.authService.createUser("patient@example.com", PASSWORD, UserRole.PATIENT);
        User user = registered.user();
        when(this.userRepository.findByEmail("patient@example.com")).thenReturn(Optional.of(user));
        when(this.userRepository.findByEmailVerificationToken(registered.verificationToken())).thenReturn(Optional.of(user));

        LoginAttemptResult before = this.authService.attemptLogin("patient@example.com", PASSWORD);
        assertFalse(before.success());
        assertTrue(before.emailNotVerified());

        AccountResult verified = this.authService.verifyEmail(registered.verificationToken());
        assertTrue(verified.success());
        assertNull(user.getEmailVerificationToken());

        LoginAttemptResult after = this.authService.attemptLogin("patient@example.com", PASSWORD);
        assertTrue(after.success());
        assertSame(user, after.user());
        verify(this.loginAttemptService).resetFailedLoginAttempts(user);
    }

    @Test
    void unknownEmailGetsGenericErrorAfterDummyComparison() {
        when(this.userRepository.findByEmail(anyString())).thenReturn(Optional.empty());

        LoginAttemptResult result = this.authService.attemptLogin("nobody@example.com", PASSWORD);

        assertFalse(result.success());
        assertEquals("Invalid email or password", result.error());
        assertNull(result.remainingAttempts());
        verify(this.passwordService).simulateVerification(PASSWORD);
        verifyNoInteractions(this.loginAttemptService);
    }

    @Test
    void wrongPasswordCountsTowardLockout() {
        User user = storedUser(true);
        when(this.loginAttemptService.recordFailedLogin(user)).thenReturn(new LockoutResult(false, 1, null));

        LoginAttemptResult result = this.authService.attemptLogin("patient@example.com", "Wrong#2024");

        assertFalse(result.success());
        assertEquals(1, result.remainingAttempts());
        assertTrue(result.error().startsWith("Invalid email or password"));
    }

    @Test
    void finalWrongPasswordReportsLock() {
        User user = storedUser(true);
        Instant until = NOW.plus(Duration.ofMinutes(30));
        when(this.loginAttemptService.recordFailedLogin(user)).thenReturn(new LockoutResult(true, 0, until));

        LoginAttemptResult result = this.authService.attemptLogin("patient@example.com", "Wrong#2024");

        assertFalse(result.success());
        assertEquals(until, result.lockedUntil());
    }

    @Test
    void lockedAccountRefusesEvenTheCorrectPassword() {
        User user = storedUser(true);
        user.setLockedUntil(NOW.plus(Duration.ofMinutes(10)));
        when(this.loginAttemptService.isAccountLocked(user)).thenReturn(true);
        when(this.loginAttemptService.getLockoutRemainingTime(user)).thenReturn(600L);

        LoginAttemptResult result = this.authService.attemptLogin("patient@example.com", PASSWORD);

        assertFalse(result.success());
        assertEquals("Account is locked. Try again in 10 minutes", result.error());
        verify(this.loginAttemptService, never()).recordFailedLogin(any());
    }

    @Test
    void deactivatedAccountIsRefused() {
        User user = storedUser(true);
        user.setActive(false);

        LoginAttemptResult result = this.authService.attemptLogin("patient@example.com", PASSWORD);

        assertFalse(result.success());
        assertEquals("Account is deactivated", result.error());
    }

    @Test
    void demoEmailRefusedWhenDemoDisabled() {
        LoginAttemptResult result = this.authService.attemptLogin("demo@ownmyhealth.com", "Demo123!");

        assertFalse(result.success());
        verify(this.loginAttemptService, never()).recordFailedLogin(any());
    }

    @Test
    void demoLoginResetsLockoutWhenAllowed() {
        this.setUp(true);
        User demo = new User();
        demo.setId("demo-1");
        demo.setEmail("demo@ownmyhealth.com");
        demo.setPasswordHash(this.passwordService.hashPassword("Demo123!"));
        demo.setFailedLoginAttempts(5);
        demo.setLockedUntil(NOW.plusSeconds(600));
        when(this.userRepository.findByEmail("demo@ownmyhealth.com")).thenReturn(Optional.of(demo));

        LoginAttemptResult result = this.authService.attemptLogin(" DEMO@ownmyhealth.com", "Demo123!");

        assertTrue(result.success());
        assertEquals(0, demo.getFailedLoginAttempts());
        assertNull(demo.getLockedUntil());
        assertTrue(demo.isEmailVerified());
        assertTrue(this.authService.isDemoUser(demo));
    }

    @Test
    void verifyEmailDistinguishesExpiredAndAlreadyVerified() {
        User user = storedUser(false);
        user.setEmailVerificationToken("tok");
        user.setEmailVerificationExpires(NOW.minusSeconds(1));
        when(this.userRepository.findByEmailVerificationToken("tok")).thenReturn(Optional.of(user));

        assertEquals("Verification token has expired. Please request a new one.", this.authService.verifyEmail("tok").error());

        user.setEmailVerificationExpires(NOW.plusSeconds(60));
        user.setEmailVerified(true);
        assertEquals("Email is already verified", this.authService.verifyEmail("tok").error());
        assertEquals("Invalid verification token", this.authService.verifyEmail("other").error());
    }

    @Test
    void forgotPasswordAlwaysSucceedsButOnlyIssuesTokenForRealAccounts() {
        when(this.userRepository.findByEmail("nobody@example.com")).thenReturn(Optional.empty());
        AccountResult unknown = this.authService.forgotPassword("nobody@example.com");
        assertTrue(unknown.success());
        assertNull(unknown.token());

        User user = storedUser(true);
        AccountResult known = this.authService.forgotPassword("Patient@Example.com");
        assertTrue(known.success());
        assertNotNull(known.token());
        assertEquals(known.token(), user.getPasswordResetToken());
        assertEquals(NOW.plus(Duration.ofHours(1)), user.getPasswordResetExpires());
    }

    @Test
    void resendVerificationHidesUnknownEmails() {
        when(this.userRepository.findByEmail(anyString())).thenReturn(Optional.empty());

        AccountResult result = this.authService.resendVerificationEmail("nobody@example.com");

        assertTrue(result.success());
        assertNull(result.token());
    }

    @Test
    void resetPasswordUpdatesHashClearsLockoutAndRevokesSessions() {
        User user = storedUser(true);
        user.setPasswordResetToken("reset");
        user.setPasswordResetExpires(NOW.plusSeconds(600));
        user.setFailedLoginAttempts(5);
        user.setLockedUntil(NOW.plusSeconds(600));
        when(this.userRepository.findByPasswordResetToken("reset")).thenReturn(Optional.of(user));

        AccountResult result = this.authService.resetPassword("reset", "Brand#New2025");

        assertTrue(result.success());
        assertTrue(this.passwordService.verifyPassword("Brand#New2025", user.getPasswordHash()));
        assertNull(user.getPasswordResetToken());
        assertEquals(0, user.getFailedLoginAttempts());
        assertNull(user.getLockedUntil());
        verify(this.sessionService).revokeAllUserTokens("user-1");
    }

    @Test
    void expiredResetTokenIsClearedAndRefused() {
        User user = storedUser(true);
        user.setPasswordResetToken("reset");
        user.setPasswordResetExpires(NOW.minusSeconds(1));
        when(this.userRepository.findByPasswordResetToken("reset")).thenReturn(Optional.of(user));

        AccountResult result = this.authService.resetPassword("reset", "Brand#New2025");

        assertFalse(result.success());
        assertNull(user.getPasswordResetToken());
        verify(this.sessionService, never()).revokeAllUserTokens(anyString());
    }

    @Test
    void changePasswordChecksCurrentPasswordAndRevokesSessions() {
        storedUser(true);

        assertThrows(AuthenticationFailedException.class,
                () -> this.authService.changePassword("user-1", "Wrong#2024", "Brand#New2025"));
        assertThrows(ValidationException.class,
                () -> this.authService.changePassword("user-1", PASSWORD, "short"));
        verify(this.sessionService, never()).revokeAllUserTokens(anyString());

        User updated = this.authService.changePassword("user-1", PASSWORD, "Brand#New2025");
        assertTrue(this.passwordService.verifyPassword("Brand#New2025", updated.getPasswordHash()));
        verify(this.sessionService).revokeAllUserTokens("user-1");
    }

    @Test
    void initializeDemoUserProvisionsVerifiedAccountOnlyWhenAllowed() {
        this.authService.initializeDemoUser();
        verify(this.userRepository, never()).save(any());

        this.setUp(true);
        when(this.userRepository.findByEmail("demo@ownmyhealth.com")).thenReturn(Optional.empty());
        this.authService.initializeDemoUser();
        verify(this.userRepository).save(argThat(u -> u.isEmailVerified() && u.isActive()
                && "demo@ownmyhealth.com".equals(u.getEmail())));
    }

    @Test
    void accountMaintenanceNeverWritesLockoutState() {
        User user = storedUser(false);
        user.setFailedLoginAttempts(4);

        AccountResult resent = this.authService.resendVerificationEmail("patient@example.com");
        this.authService.forgotPassword("patient@example.com");
        this.authService.changePassword("user-1", PASSWORD, "Brand#New2025");
        when(this.userRepository.findByEmailVerificationToken(resent.token())).thenReturn(Optional.of(user));
        assertTrue(this.authService.verifyEmail(resent.token()).success());

        ArgumentCaptor<Update> updates = ArgumentCaptor.forClass(Update.class);
        verify(this.mongoTemplate, times(4)).updateFirst(any(Query.class), updates.capture(), eq(User.class));
        for (Update update : updates.getAllValues()) {
            assertFalse(update.modifies("failedLoginAttempts"));
            assertFalse(update.modifies("lockedUntil"));
            assertFalse(update.modifies("lastFailedLogin"));
        }
        verify(this.userRepository, never()).save(any());
    }

    @Test
    void verificationTokenConsumedElsewhereIsRejected() {
        User user = storedUser(false);
        user.setEmailVerificationToken("tok");
        user.setEmailVerificationExpires(NOW.plusSeconds(60));
        when(this.userRepository.findByEmailVerificationToken("tok")).thenReturn(Optional.of(user));
        when(this.mongoTemplate.updateFirst(any(Query.class), any(Update.class), eq(User.class)))
                .thenReturn(UpdateResult.acknowledged(0, 0L, null));

        AccountResult result = this.authService.verifyEmail("tok");

        assertFalse(result.success());
        assertEquals("Invalid verification token", result.error());
        assertFalse(user.isEmailVerified());
    }

    @Test
    void lockoutRunsThroughTheFullLoginFlow() {
        Instant[] now = {NOW};
        Clock clock = mock(Clock.class);
        when(clock.instant()).thenAnswer(inv -> now[0]);
        AuthSettings settings = settings(false);
        AuthService service = new AuthService(this.userRepository, this.mongoTemplate, this.passwordService,
                new LoginAttemptService(this.mongoTemplate, settings, clock), this.sessionService, settings, clock);
        User user = storedUser(true);
        when(this.mongoTemplate.findAndModify(any(Query.class), any(Update.class), any(FindAndModifyOptions.class), eq(User.class)))
                .thenAnswer(inv -> {
                    user.setFailedLoginAttempts(user.getFailedLoginAttempts() + 1);
                    return user;
                });

        LoginAttemptResult last = null;
        for (int i = 0; i < 4; i++) {
            last = service.attemptLogin("patient@example.com", "Wrong#2024");
        }
        assertEquals(1, last.remainingAttempts());

        LoginAttemptResult locking = service.attemptLogin("patient@example.com", "Wrong#2024");
        assertEquals(NOW.plus(Duration.ofMinutes(30)), locking.lockedUntil());
        assertEquals(NOW.plus(Duration.ofMinutes(30)), user.getLockedUntil());
        assertFalse(service.attemptLogin("patient@example.com", PASSWORD).success());

        now[0] = NOW.plus(Duration.ofMinutes(31));
        LoginAttemptResult afterLock = service.attemptLogin("patient@example.com", PASSWORD);
        assertTrue(afterLock.success());
        assertEquals(0, user.getFailedLoginAttempts());
        assertNull(user.getLockedUntil());
    }
}
