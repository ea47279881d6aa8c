package com.sparagne.budget_ledger.observability;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Binds the logging context of every API request: the correlation id (taken
 * from X-Correlation-ID when it is log-safe, generated otherwise and echoed on
 * the response) and the calling user from X-User.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain)
            throws ServletException, IOException {

        try {
            String correlationId = CorrelationContext.bind(
                request.getHeader(CorrelationContext.CORRELATION_ID_HEADER),
                request.getHeader(CorrelationContext.CALLER_HEADER));
            response.setHeader(CorrelationContext.CORRELATION_ID_HEADER, correlationId);

            filterChain.doFilter(request, response);
        } finally {
            CorrelationContext.clear();
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        // probes
        String path = request.getRequestURI();
        return path.startsWith("/actuator") || path.equals("/health");
    }
}
