package com.ownmyhealth.phi.filter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Gives every request a correlation id. The id tags log lines through the MDC,
 * is stamped on each audit entry written for the request and is echoed to the
 * client, so a support report, a log line and an audit row can be joined.
 */
@Component
public class CorrelationIdFilter extends OncePerRequestFilter {
    public static final String HEADER_NAME = "X-Correlation-Id";
    public static final String MDC_KEY = "correlationId";
    static final String REQUEST_ATTRIBUTE = CorrelationIdFilter.class.getName() + ".ID";
    // Client ids end up in log lines and audit rows.
    private static final Pattern ACCEPTED_ID = Pattern.compile("^[a-zA-Z0-9\\-_.]{1,64}$");

    /**
     * Correlation id assigned to {@code request}, or null outside a filtered request.
     */
    public static String currentId(HttpServletRequest request) {
        return request.getAttribute(REQUEST_ATTRIBUTE) instanceof String id ? id : null;
    }

    static String acceptOrGenerate(String supplied) {
        return supplied != null && ACCEPTED_ID.matcher(supplied).matches() ? supplied : UUID.randomUUID().toString();
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String id = acceptOrGenerate(request.getHeader(HEADER_NAME));
        request.setAttribute(REQUEST_ATTRIBUTE, id);
        response.setHeader(HEADER_NAME, id);
        try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_KEY, id)) {
            filterChain.doFilter(request, response);
        }
    }
}
