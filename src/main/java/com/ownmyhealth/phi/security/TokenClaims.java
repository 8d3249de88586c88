package com.ownmyhealth.phi.security;

import com.ownmyhealth.phi.model.UserRole;
import java.time.Instant;

/**
 * Verified contents of an access or refresh token.
 */
public record TokenClaims(String userId, String email, UserRole role, TokenType type, String jti, Instant issuedAt, Instant expiresAt) {
}
