package com.phillippitts.shato.config.logging;

import com.phillippitts.shato.domain.CorrelationContext;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Assigns the correlation id of every inbound request and adds request-scoped values to
 * Log4j2's MDC (ThreadContext).
 *
 * <p>Values added:</p>
 * <ul>
 *   <li>correlationId: from the X-Correlation-ID header, or a generated eight-character id</li>
 *   <li>method: HTTP method</li>
 *   <li>uri: request URI</li>
 * </ul>
 *
 * <p>The id is echoed on the response header and exposed to controllers as the request
 * attribute {@link #ATTRIBUTE}. The context is always cleared after the request.</p>
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter implements Filter {

    /** Request attribute holding the resolved {@link CorrelationContext}. */
    public static final String ATTRIBUTE = CorrelationIdFilter.class.getName() + ".correlation";

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        try {
            if (request instanceof HttpServletRequest http) {
                CorrelationContext correlation = CorrelationContext.ofNullable(http.getHeader(CorrelationContext.HEADER));
                http.setAttribute(ATTRIBUTE, correlation);
                ThreadContext.put(CorrelationContext.MDC_KEY, correlation.correlationId());
                ThreadContext.put("method", http.getMethod());
                ThreadContext.put("uri", http.getRequestURI());
                if (response instanceof HttpServletResponse httpResponse) {
                    httpResponse.setHeader(CorrelationContext.HEADER, correlation.correlationId());
                }
            }
            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearAll();
        }
    }
}
