package com.ownmyhealth.phi.security;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.jwk.source.ImmutableSecret;
import com.nimbusds.jose.proc.BadJOSEException;
import com.nimbusds.jose.proc.JWSVerificationKeySelector;
import com.nimbusds.jose.proc.SecurityContext;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import com.nimbusds.jwt.proc.BadJWTException;
import com.nimbusds.jwt.proc.DefaultJWTProcessor;
import com.ownmyhealth.phi.exception.TokenExpiredException;
import com.ownmyhealth.phi.exception.TokenInvalidException;
import com.ownmyhealth.phi.model.User;
import com.ownmyhealth.phi.model.UserRole;
import java.nio.charset.StandardCharsets;
import java.text.ParseException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues and verifies the HS256 access and refresh tokens. Access and refresh
 * tokens are signed with different secrets so one can never stand in for the other.
 */
public class JwtTokenProvider {
    private static final Logger log = LoggerFactory.getLogger(JwtTokenProvider.class);
    public static final int MIN_SECRET_LENGTH = 32;
    private static final String CLAIM_EMAIL = "email";
    private static final String CLAIM_ROLE = "role";
    private static final String CLAIM_TYPE = "type";

    private final byte[] accessSecret;
    private final byte[] refreshSecret;
    private final Duration accessTtl;
    private final Clock clock;

    public JwtTokenProvider(String accessSecret, String refreshSecret, Duration accessTtl, Clock clock) {
        this.accessSecret = requireSecret(accessSecret, "app.jwt.access-secret");
        this.refreshSecret = requireSecret(refreshSecret, "app.jwt.refresh-secret");
        this.accessTtl = accessTtl;
        this.clock = clock;
    }

    public String generateAccessToken(User user) {
        Instant now = this.clock.instant();
        return this.sign(user, TokenType.ACCESS, UUID.randomUUID().toString(), now, now.plus(this.accessTtl), this.accessSecret);
    }

    /**
     * Issues a refresh token valid for {@code ttl}. The returned {@code jti} is the
     * identifier of the server-side session that must back the token.
     */
    public IssuedToken generateRefreshToken(User user, Duration ttl) {
        Instant now = this.clock.instant();
        String jti = UUID.randomUUID().toString();
        Instant expiresAt = now.plus(ttl);
        String token = this.sign(user, TokenType.REFRESH, jti, now, expiresAt, this.refreshSecret);
        return new IssuedToken(token, jti, expiresAt);
    }

    public Optional<TokenClaims> verifyAccessToken(String token) {
        return this.verifyQuietly(token, TokenType.ACCESS);
    }

    public Optional<TokenClaims> verifyRefreshToken(String token) {
        return this.verifyQuietly(token, TokenType.REFRESH);
    }

    /**
     * Strict verification. Throws {@link TokenExpiredException} or
     * {@link TokenInvalidException}; the public verify methods collapse both to empty.
     */
    public TokenClaims parse(String token, TokenType expectedType) {
        JWTClaimsSet claims = this.process(token, expectedType);
        Instant expiresAt = claims.getExpirationTime().toInstant();
        if (!expiresAt.isAfter(this.clock.instant())) {
            throw new TokenExpiredException("Token has expired");
        }
        return toTokenClaims(claims, expectedType);
    }

    /**
     * Session id of a refresh token whose signature checks out, expired or not.
     * Used on logout so a stale cookie still removes its session.
     */
    public Optional<String> extractRefreshTokenId(String token) {
        try {
            return Optional.ofNullable(this.process(token, TokenType.REFRESH).getJWTID());
        } catch (TokenInvalidException e) {
            log.debug("Cannot read refresh token id: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private JWTClaimsSet process(String token, TokenType expectedType) {
        if (token == null || token.isBlank()) {
            throw new TokenInvalidException("Token is null or empty");
        }
        byte[] secret = expectedType == TokenType.ACCESS ? this.accessSecret : this.refreshSecret;
        try {
            DefaultJWTProcessor<SecurityContext> processor = new DefaultJWTProcessor<>();
            processor.setJWSKeySelector(new JWSVerificationKeySelector<>(JWSAlgorithm.HS256, new ImmutableSecret<>(secret)));
            processor.setJWTClaimsSetVerifier((claimSet, context) -> {
                if (!expectedType.claimValue().equals(claimSet.getClaim(CLAIM_TYPE))) {
                    throw new BadJWTException("Unexpected token type");
                }
                if (claimSet.getSubject() == null || claimSet.getExpirationTime() == null) {
                    throw new BadJWTException("Missing required claims");
                }
            });
            return processor.process(token, null);
        } catch (ParseException e) {
            throw new TokenInvalidException("Invalid JWT format", e);
        } catch (BadJOSEException | JOSEException e) {
            throw new TokenInvalidException("Token verification failed: " + e.getMessage(), e);
        }
    }

    private Optional<TokenClaims> verifyQuietly(String token, TokenType type) {
        try {
            return Optional.of(this.parse(token, type));
        } catch (TokenExpiredException e) {
            log.debug("Rejected expired {} token", type.claimValue());
        } catch (TokenInvalidException e) {
            log.debug("Rejected {} token: {}", type.claimValue(), e.getMessage());
        }
        return Optional.empty();
    }

    private String sign(User user, TokenType type, String jti, Instant issuedAt, Instant expiresAt, byte[] secret) {
        JWTClaimsSet claims = new JWTClaimsSet.Builder()
                .subject(user.getId())
                .claim(CLAIM_EMAIL, user.getEmail())
                .claim(CLAIM_ROLE, user.getRole().name())
                .claim(CLAIM_TYPE, type.claimValue())
                .jwtID(jti)
                .issueTime(Date.from(issuedAt))
                .expirationTime(Date.from(expiresAt))
                .build();
        SignedJWT jwt = new SignedJWT(new JWSHeader(JWSAlgorithm.HS256), claims);
        try {
            jwt.sign(new MACSigner(secret));
        } catch (JOSEException e) {
            throw new IllegalStateException("Failed to sign " + type.claimValue() + " token", e);
        }
        return jwt.serialize();
    }

    private static TokenClaims toTokenClaims(JWTClaimsSet claims, TokenType type) {
        try {
            String roleName = claims.getStringClaim(CLAIM_ROLE);
            UserRole role = roleName != null ? UserRole.valueOf(roleName) : null;
            Date issued = claims.getIssueTime();
            return new TokenClaims(claims.getSubject(), claims.getStringClaim(CLAIM_EMAIL), role, type,
                    claims.getJWTID(), issued != null ? issued.toInstant() : null, claims.getExpirationTime().toInstant());
        } catch (ParseException | IllegalArgumentException e) {
            throw new TokenInvalidException("Malformed token claims", e);
        }
    }

    private static byte[] requireSecret(String secret, String property) {
        if (secret == null || secret.length() < MIN_SECRET_LENGTH) {
            throw new IllegalStateException(property + " must be at least " + MIN_SECRET_LENGTH + " characters");
        }
        return secret.getBytes(StandardCharsets.UTF_8);
    }
}
