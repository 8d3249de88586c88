package com.ownmyhealth.phi.security;

import jakarta.annotation.PostConstruct;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Resolves the originating client address of a request.
 *
 * With no trusted proxies configured the first {@code X-Forwarded-For} hop is
 * taken as-is (single reverse proxy deployment). Once proxies are listed, the
 * header is honoured only when the socket peer is one of them.
 */
@Component
public class ClientIpResolver {
    private static final Logger log = LoggerFactory.getLogger(ClientIpResolver.class);
    public static final String UNKNOWN = "unknown";
    @Value("${app.security.trusted-proxies:}")
    private String trustedProxyList;
    private Set<String> trustedProxies = Set.of();

    @PostConstruct
    public void init() {
        if (this.trustedProxyList == null || this.trustedProxyList.isBlank()) {
            this.trustedProxies = Set.of();
            return;
        }
        HashSet<String> parsed = new HashSet<>();
        Arrays.stream(this.trustedProxyList.split(","))
                .map(String::trim)
                .filter(value -> !value.isBlank())
                .forEach(parsed::add);
        this.trustedProxies = Set.copyOf(parsed);
        log.info("Trusted proxies configured: {}", this.trustedProxies);
    }

    public String resolveClientIp(HttpServletRequest request) {
        if (request == null) {
            return UNKNOWN;
        }
        String remoteAddr = request.getRemoteAddr();
        String xff = request.getHeader("X-Forwarded-For");
        if (xff != null && !xff.isBlank()) {
            if (this.trustedProxies.isEmpty() || (remoteAddr != null && this.trustedProxies.contains(remoteAddr))) {
                String candidate = xff.split(",")[0].trim();
                if (!candidate.isBlank()) {
                    return candidate;
                }
            } else {
                log.debug("Ignoring X-Forwarded-For from untrusted peer: {}", remoteAddr);
            }
        }
        return remoteAddr != null && !remoteAddr.isBlank() ? remoteAddr : UNKNOWN;
    }
}
