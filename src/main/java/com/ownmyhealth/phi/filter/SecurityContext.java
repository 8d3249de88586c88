package com.ownmyhealth.phi.filter;

import com.ownmyhealth.phi.security.TokenClaims;

/**
 * Thread-local holder for the verified access-token claims of the current request.
 *
 * Set by {@link JwtAuthenticationFilter} and cleared when the request completes.
 */
public class SecurityContext {

    private static final ThreadLocal<TokenClaims> currentClaims = new ThreadLocal<>();

    public static void setCurrentClaims(TokenClaims claims) {
        currentClaims.set(claims);
    }

    /**
     * @return the claims, or null if the request is not authenticated
     */
    public static TokenClaims getCurrentClaims() {
        return currentClaims.get();
    }

    public static boolean isAuthenticated() {
        return currentClaims.get() != null;
    }

    /**
     * Current user id for logging; "ANONYMOUS" when unauthenticated.
     */
    public static String getCurrentUserId() {
        TokenClaims claims = currentClaims.get();
        return claims != null ? claims.userId() : "ANONYMOUS";
    }

    public static void clear() {
        currentClaims.remove();
    }
}
