package com.flagship.flight_cover.observability;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Binds each API request to the MDC: correlation id, caller identity, and the
 * policy id when the path addresses a single policy. The correlation id is
 * echoed back in the response.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    private static final Pattern POLICY_PATH = Pattern.compile("^/api/policies/(\\d+)(/.*)?$");

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain)
            throws ServletException, IOException {
        try {
            String correlationId = CorrelationContext.beginRequest(
                request.getHeader(CorrelationContext.CORRELATION_ID_HEADER),
                request.getHeader(CorrelationContext.CALLER_ID_HEADER));
            CorrelationContext.putPolicyId(policyIdFromPath(request.getRequestURI()));

            response.setHeader(CorrelationContext.CORRELATION_ID_HEADER, correlationId);
            filterChain.doFilter(request, response);
        } finally {
            CorrelationContext.clear();
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith("/api/");
    }

    static Long policyIdFromPath(String uri) {
        Matcher matcher = POLICY_PATH.matcher(uri);
        if (!matcher.matches()) {
            return null;
        }
        try {
            return Long.valueOf(matcher.group(1));
        } catch (NumberFormatException e) {
            // too many digits for a policy id; the controller rejects it
            return null;
        }
    }
}
