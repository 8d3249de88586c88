package com.ownmyhealth.phi.filter;

import com.ownmyhealth.phi.model.UserRole;
import com.ownmyhealth.phi.security.JwtTokenProvider;
import com.ownmyhealth.phi.security.TokenClaims;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates requests carrying an access token, from the {@code Authorization}
 * bearer header or the {@code access_token} cookie. Requests without a valid token
 * pass through unauthenticated; the security chain decides whether that is allowed.
 */
@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {
    private static final Logger log = LoggerFactory.getLogger(JwtAuthenticationFilter.class);
    public static final String ACCESS_TOKEN_COOKIE = "access_token";
    private static final String BEARER_PREFIX = "Bearer ";
    private final JwtTokenProvider jwtTokenProvider;

    public JwtAuthenticationFilter(JwtTokenProvider jwtTokenProvider) {
        this.jwtTokenProvider = jwtTokenProvider;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String token = resolveToken(request);
        Optional<TokenClaims> claims = token != null ? this.jwtTokenProvider.verifyAccessToken(token) : Optional.empty();
        if (claims.isEmpty()) {
            if (token != null) {
                log.debug("Ignoring invalid access token on {}", request.getRequestURI());
            }
            chain.doFilter(request, response);
            return;
        }
        SecurityContext.setCurrentClaims(claims.get());
        this.setSpringSecurityContext(claims.get());
        try {
            chain.doFilter(request, response);
        } finally {
            SecurityContext.clear();
            SecurityContextHolder.clearContext();
        }
    }

    static String resolveToken(HttpServletRequest request) {
        String header = request.getHeader("Authorization");
        if (header != null && header.startsWith(BEARER_PREFIX)) {
            String value = header.substring(BEARER_PREFIX.length()).trim();
            return value.isEmpty() ? null : value;
        }
        Cookie[] cookies = request.getCookies();
        if (cookies != null) {
            for (Cookie cookie : cookies) {
                if (ACCESS_TOKEN_COOKIE.equals(cookie.getName()) && cookie.getValue() != null && !cookie.getValue().isBlank()) {
                    return cookie.getValue();
                }
            }
        }
        return null;
    }

    private void setSpringSecurityContext(TokenClaims claims) {
        UsernamePasswordAuthenticationToken auth = new UsernamePasswordAuthenticationToken(claims, null, buildAuthorities(claims.role()));
        SecurityContextHolder.getContext().setAuthentication(auth);
    }

    private static Collection<GrantedAuthority> buildAuthorities(UserRole role) {
        ArrayList<GrantedAuthority> authorities = new ArrayList<>();
        if (role == null) {
            return authorities;
        }
        authorities.add(new SimpleGrantedAuthority("ROLE_" + role.name()));
        for (UserRole.Permission permission : role.getPermissions()) {
            authorities.add(new SimpleGrantedAuthority("PERM_" + permission.name()));
        }
        return authorities;
    }
}
