package com.phillippitts.shato.presentation.controller;

import com.phillippitts.shato.config.logging.CorrelationIdFilter;
import com.phillippitts.shato.domain.CorrelationContext;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.ThreadContext;

/**
 * Picks the correlation id of a request: the X-Correlation-ID header, else the body's
 * {@code correlation_id}, else the id generated by {@link CorrelationIdFilter}.
 */
final class CorrelationResolver {

    private CorrelationResolver() {
    }

    static CorrelationContext resolve(HttpServletRequest request, HttpServletResponse response, String bodyId) {
        Object assigned = request.getAttribute(CorrelationIdFilter.ATTRIBUTE);
        boolean fromHeader = request.getHeader(CorrelationContext.HEADER) != null
                && !request.getHeader(CorrelationContext.HEADER).isBlank();
        if (assigned instanceof CorrelationContext context && (fromHeader || bodyId == null || bodyId.isBlank())) {
            return context;
        }
        CorrelationContext context = CorrelationContext.ofNullable(bodyId);
        ThreadContext.put(CorrelationContext.MDC_KEY, context.correlationId());
        response.setHeader(CorrelationContext.HEADER, context.correlationId());
        return context;
    }
}
