package com.ownmyhealth.phi.security;

import java.time.Instant;

public record IssuedToken(String token, String jti, Instant expiresAt) {
}
