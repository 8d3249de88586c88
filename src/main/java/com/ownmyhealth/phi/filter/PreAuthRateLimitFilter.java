package com.ownmyhealth.phi.filter;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.ownmyhealth.phi.audit.AuditContext;
import com.ownmyhealth.phi.audit.AuditLogService;
import com.ownmyhealth.phi.audit.AuditMetadata;
import com.ownmyhealth.phi.security.ClientIpResolver;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Per-IP throttle for unauthenticated traffic to the auth endpoints, the surface
 * exposed to credential stuffing. Complements account lockout, which only sees
 * attempts against existing accounts.
 */
@Component
public class PreAuthRateLimitFilter extends OncePerRequestFilter {
    private static final Logger log = LoggerFactory.getLogger(PreAuthRateLimitFilter.class);
    static final String AUTH_PATH_PREFIX = "/api/v1/auth/";
    private final AuditLogService auditLogService;
    private final ClientIpResolver clientIpResolver;
    @Value(value="${app.rate-limit.enabled:true}")
    private boolean enabled;
    @Value(value="${app.rate-limit.anonymous-rpm:30}")
    private int anonymousRpm;
    private final Cache<String, Bucket> bucketCache = Caffeine.newBuilder().maximumSize(10000L).expireAfterAccess(1L, TimeUnit.HOURS).build();

    public PreAuthRateLimitFilter(AuditLogService auditLogService, ClientIpResolver clientIpResolver) {
        this.auditLogService = auditLogService;
        this.clientIpResolver = clientIpResolver;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String path = request.getRequestURI();
        if (!this.enabled || SecurityContext.isAuthenticated() || path == null || !path.startsWith(AUTH_PATH_PREFIX)) {
            chain.doFilter(request, response);
            return;
        }
        String clientIp = this.clientIpResolver.resolveClientIp(request);
        Bucket bucket = this.bucketCache.get("ip:" + clientIp, k -> this.createBucket(this.anonymousRpm));
        if (bucket.tryConsume(1L)) {
            response.setHeader("X-RateLimit-Limit", String.valueOf(this.anonymousRpm));
            response.setHeader("X-RateLimit-Remaining", String.valueOf(bucket.getAvailableTokens()));
            chain.doFilter(request, response);
            return;
        }
        log.warn("Pre-auth rate limit exceeded for ip: {} on path: {}", clientIp, path);
        AuditContext context = this.auditLogService.extractContext(request);
        this.auditLogService.logAccess("RateLimit", null, context,
                new AuditMetadata.AccessMetadata("rate_limit_exceeded", Map.of("path", path)));
        response.setStatus(429);
        response.setContentType("application/json");
        response.setHeader("Retry-After", "60");
        response.setHeader("X-RateLimit-Limit", String.valueOf(this.anonymousRpm));
        response.setHeader("X-RateLimit-Remaining", "0");
        response.getWriter().write("{\"error\": \"Too many requests. Please wait before trying again.\", \"retryAfter\": 60}");
    }

    private Bucket createBucket(int requestsPerMinute) {
        long capacity = requestsPerMinute;
        Bandwidth limit = Bandwidth.builder().capacity(capacity).refillGreedy(capacity, Duration.ofMinutes(1L)).build();
        return Bucket.builder().addLimit(limit).build();
    }
}
