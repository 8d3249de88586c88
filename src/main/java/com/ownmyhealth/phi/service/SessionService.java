package com.ownmyhealth.phi.service;

import com.ownmyhealth.phi.config.AuthSettings;
import com.ownmyhealth.phi.model.Session;
import com.ownmyhealth.phi.model.User;
import com.ownmyhealth.phi.repository.SessionRepository;
import com.ownmyhealth.phi.repository.UserRepository;
import com.ownmyhealth.phi.security.IssuedToken;
import com.ownmyhealth.phi.security.JwtTokenProvider;
import com.ownmyhealth.phi.security.TokenClaims;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Refresh-token sessions. Every refresh token is backed by a {@link Session}
 * whose id is the token's {@code jti}; deleting the session revokes the token.
 * Refresh tokens are single use: rotation consumes the old session atomically.
 */
@Service
public class SessionService {
    private static final Logger log = LoggerFactory.getLogger(SessionService.class);
    private static final int FINGERPRINT_HEX_LENGTH = 32;
    private final SessionRepository sessionRepository;
    private final UserRepository userRepository;
    private final MongoTemplate mongoTemplate;
    private final JwtTokenProvider jwtTokenProvider;
    private final AuthSettings settings;
    private final Clock clock;

    public SessionService(SessionRepository sessionRepository, UserRepository userRepository, MongoTemplate mongoTemplate,
            JwtTokenProvider jwtTokenProvider, AuthSettings settings, Clock clock) {
        this.sessionRepository = sessionRepository;
        this.userRepository = userRepository;
        this.mongoTemplate = mongoTemplate;
        this.jwtTokenProvider = jwtTokenProvider;
        this.settings = settings;
        this.clock = clock;
    }

    public AuthTokens generateTokens(User user, SessionMetadata metadata) {
        String accessToken = this.jwtTokenProvider.generateAccessToken(user);
        Duration ttl = this.settings.isDemoEmail(user.getEmail()) ? this.settings.demoSessionTtl() : this.settings.refreshTokenTtl();
        IssuedToken refresh = this.jwtTokenProvider.generateRefreshToken(user, ttl);
        Session session = new Session(refresh.jti(), user.getId(), fingerprint(refresh.token()), refresh.expiresAt(), this.clock.instant());
        if (metadata != null) {
            session.withClient(metadata.ipAddress(), metadata.userAgent());
        }
        this.sessionRepository.save(session);
        return new AuthTokens(accessToken, refresh.token());
    }

    /**
     * Signature and type first, then the backing session. A missing session and
     * an expired one are reported the same way; the expired one is deleted.
     */
    public Optional<TokenClaims> verifyRefreshToken(String token) {
        Optional<TokenClaims> claims = this.jwtTokenProvider.verifyRefreshToken(token);
        if (claims.isEmpty() || claims.get().jti() == null) {
            return Optional.empty();
        }
        String sessionId = claims.get().jti();
        Optional<Session> session = this.sessionRepository.findById(sessionId);
        if (session.isEmpty()) {
            return Optional.empty();
        }
        if (session.get().isExpired(this.clock.instant())) {
            this.sessionRepository.deleteById(sessionId);
            return Optional.empty();
        }
        return claims;
    }

    public Optional<RefreshResult> refreshTokens(String oldRefreshToken, SessionMetadata metadata) {
        Optional<TokenClaims> claims = this.verifyRefreshToken(oldRefreshToken);
        if (claims.isEmpty()) {
            return Optional.empty();
        }
        Optional<User> user = this.userRepository.findById(claims.get().userId());
        if (user.isEmpty() || !user.get().isActive()) {
            return Optional.empty();
        }
        // Only the caller that actually removes the session may rotate it.
        Session consumed = this.mongoTemplate.findAndRemove(Query.query(Criteria.where("_id").is(claims.get().jti())), Session.class);
        if (consumed == null) {
            log.warn("Refresh token replay rejected for user {}", claims.get().userId());
            return Optional.empty();
        }
        AuthTokens tokens = this.generateTokens(user.get(), metadata);
        return Optional.of(new RefreshResult(tokens, this.settings.isDemoEmail(user.get().getEmail())));
    }

    public boolean revokeRefreshToken(String token) {
        Optional<String> sessionId = this.jwtTokenProvider.extractRefreshTokenId(token);
        if (sessionId.isEmpty()) {
            return false;
        }
        this.sessionRepository.deleteById(sessionId.get());
        return true;
    }

    public long revokeAllUserTokens(String userId) {
        long removed = this.sessionRepository.deleteByUserId(userId);
        log.info("Revoked {} sessions for user {}", removed, userId);
        return removed;
    }

    public List<Session> listSessions(String userId) {
        return this.sessionRepository.findByUserIdAndExpiresAtAfterOrderByCreatedAtDesc(userId, this.clock.instant());
    }

    public long cleanupExpiredSessions() {
        long removed = this.sessionRepository.deleteByExpiresAtBefore(this.clock.instant());
        if (removed > 0) {
            log.info("Cleaned up {} expired sessions", removed);
        }
        return removed;
    }

    @Scheduled(fixedDelayString="${app.auth.session-cleanup-interval:PT1H}", initialDelayString="${app.auth.session-cleanup-interval:PT1H}")
    public void purgeExpiredSessions() {
        try {
            this.cleanupExpiredSessions();
        } catch (RuntimeException e) {
            log.error("Session cleanup failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Short digest of a token kept on the session for diagnostics. A prefix of the
     * raw JWT would only ever show the shared header.
     */
    static String fingerprint(String token) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(token.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, FINGERPRINT_HEX_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
