package com.ownmyhealth.phi.controller;

import com.ownmyhealth.phi.audit.AuditContext;
import com.ownmyhealth.phi.audit.AuditLogService;
import com.ownmyhealth.phi.audit.AuthEvent;
import com.ownmyhealth.phi.config.AuthSettings;
import com.ownmyhealth.phi.exception.AccountLockedException;
import com.ownmyhealth.phi.exception.AuthenticationFailedException;
import com.ownmyhealth.phi.exception.EmailNotVerifiedException;
import com.ownmyhealth.phi.exception.ValidationException;
import com.ownmyhealth.phi.filter.JwtAuthenticationFilter;
import com.ownmyhealth.phi.filter.SecurityContext;
import com.ownmyhealth.phi.model.Session;
import com.ownmyhealth.phi.model.User;
import com.ownmyhealth.phi.model.UserRole;
import com.ownmyhealth.phi.security.JwtTokenProvider;
import com.ownmyhealth.phi.security.TokenClaims;
import com.ownmyhealth.phi.service.AccountNotifier;
import com.ownmyhealth.phi.service.AccountResult;
import com.ownmyhealth.phi.service.AuthService;
import com.ownmyhealth.phi.service.AuthTokens;
import com.ownmyhealth.phi.service.LoginAttemptResult;
import com.ownmyhealth.phi.service.RefreshResult;
import com.ownmyhealth.phi.service.RegistrationResult;
import com.ownmyhealth.phi.service.SessionMetadata;
import com.ownmyhealth.phi.service.SessionService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseCookie;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CookieValue;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Account and session endpoints. Tokens are handed out only as HTTP-only
 * cookies; every outcome that matters for security is audited.
 */
@RestController
@RequestMapping(value={"/api/v1/auth"})
public class AuthController {
    private static final Logger log = LoggerFactory.getLogger(AuthController.class);
    static final String ACCESS_TOKEN_COOKIE = JwtAuthenticationFilter.ACCESS_TOKEN_COOKIE;
    static final String REFRESH_TOKEN_COOKIE = "refresh_token";
    private static final Pattern EMAIL_FORMAT = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");

    private final AuthService authService;
    private final SessionService sessionService;
    private final AuditLogService auditLogService;
    private final AccountNotifier accountNotifier;
    private final JwtTokenProvider jwtTokenProvider;
    private final AuthSettings settings;
    @Value(value="${app.cookie.secure:true}")
    private boolean secureCookies = true;
    @Value(value="${app.cookie.same-site:Strict}")
    private String sameSite = "Strict";

    public AuthController(AuthService authService, SessionService sessionService, AuditLogService auditLogService,
            AccountNotifier accountNotifier, JwtTokenProvider jwtTokenProvider, AuthSettings settings) {
        this.authService = authService;
        this.sessionService = sessionService;
        this.auditLogService = auditLogService;
        this.accountNotifier = accountNotifier;
        this.jwtTokenProvider = jwtTokenProvider;
        this.settings = settings;
    }

    public record CredentialsRequest(String email, String password) {
    }

    public record EmailRequest(String email) {
    }

    public record ChangePasswordRequest(String currentPassword, String newPassword) {
    }

    public record ResetPasswordRequest(String token, String newPassword) {
    }

    @PostMapping(value={"/register"})
    public ResponseEntity<Map<String, Object>> register(@RequestBody(required=false) CredentialsRequest body, HttpServletRequest request) {
        if (body == null || isBlank(body.email()) || isBlank(body.password())) {
            throw new ValidationException("Email and password are required");
        }
        if (!EMAIL_FORMAT.matcher(body.email().trim()).matches()) {
            throw new ValidationException("Invalid email format");
        }
        RegistrationResult result = this.authService.createUser(body.email(), body.password(), UserRole.PATIENT);
        User user = result.user();
        if (result.verificationToken() != null) {
            this.accountNotifier.sendVerificationLink(user.getEmail(), result.verificationToken());
        }
        this.auditLogService.logAuth(AuthEvent.REGISTER, this.auditContext(request).withUser(user.getId()), user.getEmail(), null);
        Map<String, Object> response = success();
        response.put("user", userView(user));
        response.put("message", result.verificationToken() != null
                ? "Registration successful. Please check your email to verify your account."
                : "Registration successful. You can now log in.");
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    /**
     * @throws EmailNotVerifiedException for an unverified account (403)
     * @throws AccountLockedException while locked out (423)
     * @throws AuthenticationFailedException for anything else (401)
     */
    @PostMapping(value={"/login"})
    public Map<String, Object> login(@RequestBody(required=false) CredentialsRequest body, HttpServletRequest request,
            HttpServletResponse response) {
        if (body == null || isBlank(body.email()) || isBlank(body.password())) {
            throw new ValidationException("Email and password are required");
        }
        AuditContext context = this.auditContext(request);
        LoginAttemptResult result = this.authService.attemptLogin(body.email(), body.password());
        if (!result.success()) {
            this.rejectLogin(result, body.email(), context);
        }
        return this.completeLogin(result.user(), context, request, response);
    }

    /**
     * One-click sign-in to the demo account. Goes through the regular login path.
     */
    @PostMapping(value={"/demo"})
    public Map<String, Object> demoLogin(HttpServletRequest request, HttpServletResponse response) {
        if (!this.settings.demoAllowed()) {
            throw new ValidationException("Demo login is not available");
        }
        AuditContext context = this.auditContext(request);
        LoginAttemptResult result = this.authService.attemptLogin(this.settings.demoEmail(), this.settings.demoPassword());
        if (!result.success()) {
            this.auditLogService.logAuth(AuthEvent.LOGIN_FAILED, context, this.settings.demoEmail(), "DEMO_LOGIN_FAILED");
            throw new ValidationException(result.error() != null ? result.error() : "Demo login failed");
        }
        return this.completeLogin(result.user(), context, request, response);
    }

    @PostMapping(value={"/refresh"})
    public ResponseEntity<Map<String, Object>> refresh(@CookieValue(value=REFRESH_TOKEN_COOKIE, required=false) String refreshToken,
            HttpServletRequest request, HttpServletResponse response) {
        if (isBlank(refreshToken)) {
            throw new AuthenticationFailedException("Refresh token not provided");
        }
        Optional<RefreshResult> result = this.sessionService.refreshTokens(refreshToken, this.sessionMetadata(request));
        if (result.isEmpty()) {
            this.clearAuthCookies(response);
            Map<String, Object> error = new LinkedHashMap<>();
            error.put("success", false);
            error.put("error", "Invalid or expired refresh token");
            error.put("code", "UNAUTHORIZED");
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(error);
        }
        this.setAuthCookies(response, result.get().tokens(), result.get().demo());
        return ResponseEntity.ok(success());
    }

    @PostMapping(value={"/logout"})
    public Map<String, Object> logout(@CookieValue(value=REFRESH_TOKEN_COOKIE, required=false) String refreshToken,
            HttpServletRequest request, HttpServletResponse response) {
        if (!isBlank(refreshToken)) {
            this.sessionService.revokeRefreshToken(refreshToken);
        }
        this.clearAuthCookies(response);
        TokenClaims claims = SecurityContext.getCurrentClaims();
        AuditContext context = this.auditContext(request);
        if (claims != null) {
            this.auditLogService.logAuth(AuthEvent.LOGOUT, context.withUser(claims.userId()), claims.email(), null);
        } else {
            this.auditLogService.logAuth(AuthEvent.LOGOUT, context);
        }
        return success();
    }

    @PostMapping(value={"/logout-all"})
    public Map<String, Object> logoutAll(HttpServletRequest request, HttpServletResponse response) {
        TokenClaims claims = requireClaims();
        long revoked = this.sessionService.revokeAllUserTokens(claims.userId());
        this.clearAuthCookies(response);
        this.auditLogService.logAuth(AuthEvent.LOGOUT, this.auditContext(request).withUser(claims.userId()), claims.email(), "ALL_SESSIONS");
        Map<String, Object> body = success();
        body.put("revokedSessions", revoked);
        return body;
    }

    @GetMapping(value={"/me"})
    public Map<String, Object> me() {
        TokenClaims claims = requireClaims();
        User user = this.authService.findUserById(claims.userId())
                .orElseThrow(() -> new AuthenticationFailedException("User not found"));
        Map<String, Object> body = success();
        body.put("user", userView(user));
        return body;
    }

    /**
     * Every existing session is revoked; the caller gets a fresh pair for this device.
     */
    @PostMapping(value={"/change-password"})
    public Map<String, Object> changePassword(@RequestBody(required=false) ChangePasswordRequest body, HttpServletRequest request,
            HttpServletResponse response) {
        TokenClaims claims = requireClaims();
        if (body == null || isBlank(body.currentPassword()) || isBlank(body.newPassword())) {
            throw new ValidationException("Current password and new password are required");
        }
        User user = this.authService.changePassword(claims.userId(), body.currentPassword(), body.newPassword());
        AuthTokens tokens = this.sessionService.generateTokens(user, this.sessionMetadata(request));
        this.setAuthCookies(response, tokens, this.authService.isDemoUser(user));
        this.auditLogService.logAuth(AuthEvent.PASSWORD_CHANGE, this.auditContext(request).withUser(user.getId()), user.getEmail(), null);
        return success();
    }

    @GetMapping(value={"/verify-email"})
    public ResponseEntity<Map<String, Object>> verifyEmail(@RequestParam(value="token", required=false) String token,
            HttpServletRequest request) {
        if (isBlank(token)) {
            throw new ValidationException("Verification token is required");
        }
        AccountResult result = this.authService.verifyEmail(token);
        AuditContext context = this.auditContext(request);
        if (!result.success()) {
            this.auditLogService.logAuth(AuthEvent.EMAIL_VERIFICATION_FAILED, context, null, result.error());
            return failure("VERIFICATION_FAILED", result.error() != null ? result.error() : "Email verification failed");
        }
        User user = result.user();
        this.auditLogService.logAuth(AuthEvent.EMAIL_VERIFICATION, context.withUser(user.getId()), user.getEmail(), null);
        Map<String, Object> body = success();
        body.put("message", "Email verified successfully. You can now log in.");
        return ResponseEntity.ok(body);
    }

    @PostMapping(value={"/resend-verification"})
    public ResponseEntity<Map<String, Object>> resendVerification(@RequestBody(required=false) EmailRequest body) {
        if (body == null || isBlank(body.email())) {
            throw new ValidationException("Email is required");
        }
        AccountResult result = this.authService.resendVerificationEmail(body.email());
        if (!result.success()) {
            return failure("RESEND_FAILED", result.error() != null ? result.error() : "Failed to resend verification email");
        }
        if (result.token() != null) {
            this.accountNotifier.sendVerificationLink(body.email(), result.token());
        }
        Map<String, Object> response = success();
        response.put("message", "If the email exists and is unverified, a new verification email has been sent.");
        return ResponseEntity.ok(response);
    }

    @PostMapping(value={"/forgot-password"})
    public Map<String, Object> forgotPassword(@RequestBody(required=false) EmailRequest body, HttpServletRequest request) {
        if (body == null || isBlank(body.email())) {
            throw new ValidationException("Email is required");
        }
        AccountResult result = this.authService.forgotPassword(body.email());
        this.auditLogService.logAuth(AuthEvent.PASSWORD_RESET_REQUEST, this.auditContext(request), body.email(), null);
        if (result.token() != null) {
            this.accountNotifier.sendPasswordResetLink(body.email(), result.token());
        }
        Map<String, Object> response = success();
        response.put("message", "If an account exists with this email, a password reset link has been sent.");
        return response;
    }

    @PostMapping(value={"/reset-password"})
    public ResponseEntity<Map<String, Object>> resetPassword(@RequestBody(required=false) ResetPasswordRequest body,
            HttpServletRequest request) {
        if (body == null || isBlank(body.token())) {
            throw new ValidationException("Reset token is required");
        }
        if (isBlank(body.newPassword())) {
            throw new ValidationException("New password is required");
        }
        AccountResult result = this.authService.resetPassword(body.token(), body.newPassword());
        AuditContext context = this.auditContext(request);
        if (!result.success()) {
            this.auditLogService.logAuth(AuthEvent.PASSWORD_RESET_FAILED, context, null, result.error());
            return failure("RESET_FAILED", result.error() != null ? result.error() : "Password reset failed");
        }
        User user = result.user();
        this.auditLogService.logAuth(AuthEvent.PASSWORD_RESET_COMPLETE, context.withUser(user.getId()), user.getEmail(), null);
        Map<String, Object> response = success();
        response.put("message", "Password has been reset successfully. You can now log in with your new password.");
        return ResponseEntity.ok(response);
    }

    /**
     * Active sessions of the caller, newest first. The session behind the
     * request's own refresh cookie is flagged as current.
     */
    @GetMapping(value={"/sessions"})
    public Map<String, Object> sessions(@CookieValue(value=REFRESH_TOKEN_COOKIE, required=false) String refreshToken) {
        TokenClaims claims = requireClaims();
        String currentId = isBlank(refreshToken) ? null : this.jwtTokenProvider.extractRefreshTokenId(refreshToken).orElse(null);
        List<Map<String, Object>> views = new ArrayList<>();
        for (Session session : this.sessionService.listSessions(claims.userId())) {
            Map<String, Object> view = new LinkedHashMap<>();
            view.put("id", session.getId());
            view.put("createdAt", session.getCreatedAt());
            view.put("expiresAt", session.getExpiresAt());
            view.put("ipAddress", session.getIpAddress());
            view.put("userAgent", session.getUserAgent());
            view.put("current", session.getId().equals(currentId));
            views.add(view);
        }
        Map<String, Object> body = success();
        body.put("sessions", views);
        return body;
    }

    private void rejectLogin(LoginAttemptResult result, String email, AuditContext context) {
        if (result.emailNotVerified()) {
            this.auditLogService.logAuth(AuthEvent.LOGIN_FAILED, context, email, "EMAIL_NOT_VERIFIED");
            throw new EmailNotVerifiedException(result.error() != null ? result.error() : "Email not verified");
        }
        if (result.lockedUntil() != null) {
            this.auditLogService.logAuth(AuthEvent.ACCOUNT_LOCKOUT, context, email, "ACCOUNT_LOCKED");
            throw new AccountLockedException(result.error() != null ? result.error() : "Account is locked", result.lockedUntil());
        }
        if (result.remainingAttempts() != null) {
            this.auditLogService.logAuth(AuthEvent.LOGIN_FAILED, context, email, "INVALID_CREDENTIALS");
            throw new AuthenticationFailedException(result.error(), result.remainingAttempts());
        }
        this.auditLogService.logAuth(AuthEvent.LOGIN_FAILED, context, email, "UNKNOWN");
        throw new AuthenticationFailedException(result.error() != null ? result.error() : "Invalid email or password");
    }

    private Map<String, Object> completeLogin(User user, AuditContext context, HttpServletRequest request, HttpServletResponse response) {
        AuthTokens tokens = this.sessionService.generateTokens(user, this.sessionMetadata(request));
        this.setAuthCookies(response, tokens, this.authService.isDemoUser(user));
        this.auditLogService.logAuth(AuthEvent.LOGIN, context.withUser(user.getId()), user.getEmail(), null);
        log.info("User {} signed in", user.getId());
        Map<String, Object> body = success();
        body.put("user", userView(user));
        return body;
    }

    private AuditContext auditContext(HttpServletRequest request) {
        return this.auditLogService.extractContext(request);
    }

    private SessionMetadata sessionMetadata(HttpServletRequest request) {
        AuditContext context = this.auditLogService.extractContext(request);
        return new SessionMetadata(context.ipAddress(), context.userAgent());
    }

    private void setAuthCookies(HttpServletResponse response, AuthTokens tokens, boolean demo) {
        Duration refreshTtl = demo ? this.settings.demoSessionTtl() : this.settings.refreshTokenTtl();
        response.addHeader(HttpHeaders.SET_COOKIE, this.cookie(ACCESS_TOKEN_COOKIE, tokens.accessToken(), this.settings.accessTokenTtl()).toString());
        response.addHeader(HttpHeaders.SET_COOKIE, this.cookie(REFRESH_TOKEN_COOKIE, tokens.refreshToken(), refreshTtl).toString());
    }

    private void clearAuthCookies(HttpServletResponse response) {
        response.addHeader(HttpHeaders.SET_COOKIE, this.cookie(ACCESS_TOKEN_COOKIE, "", Duration.ZERO).toString());
        response.addHeader(HttpHeaders.SET_COOKIE, this.cookie(REFRESH_TOKEN_COOKIE, "", Duration.ZERO).toString());
    }

    private ResponseCookie cookie(String name, String value, Duration maxAge) {
        return ResponseCookie.from(name, value)
                .httpOnly(true)
                .secure(this.secureCookies)
                .sameSite(this.sameSite)
                .path("/")
                .maxAge(maxAge)
                .build();
    }

    private static TokenClaims requireClaims() {
        TokenClaims claims = SecurityContext.getCurrentClaims();
        if (claims == null) {
            throw new AuthenticationFailedException("Not authenticated");
        }
        return claims;
    }

    private static Map<String, Object> userView(User user) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", user.getId());
        view.put("email", user.getEmail());
        view.put("role", user.getRole());
        return view;
    }

    private static Map<String, Object> success() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        return body;
    }

    private static ResponseEntity<Map<String, Object>> failure(String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", message);
        body.put("code", code);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
