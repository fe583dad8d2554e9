package com.flagship.gold_ledger.observability;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Puts the request's correlation id and calling address into MDC, echoes the correlation id
 * back, and clears every request-scoped MDC key afterwards.
 *
 * The caller is only logged here; whether it may act is decided by the registry.
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
            CorrelationContext.setCorrelationId(request.getHeader(CorrelationContext.CORRELATION_ID_HEADER));
            String correlationId = CorrelationContext.getCorrelationId();
            MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, correlationId);
            response.setHeader(CorrelationContext.CORRELATION_ID_HEADER, correlationId);

            String caller = request.getHeader(CorrelationContext.CALLER_HEADER);
            if (caller != null && !caller.isBlank()) {
                MDC.put(CorrelationContext.CALLER_MDC_KEY, caller.trim());
            }

            filterChain.doFilter(request, response);

        } finally {
            CorrelationContext.clear();
            CorrelationContext.REQUEST_MDC_KEYS.forEach(MDC::remove);
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return request.getRequestURI().startsWith("/actuator");
    }
}
