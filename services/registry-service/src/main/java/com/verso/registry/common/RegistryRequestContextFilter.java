package com.verso.registry.common;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Binds a {@link RequestContext} for the request thread and writes one access log line per request.
 * Health and actuator requests log at DEBUG.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RegistryRequestContextFilter extends OncePerRequestFilter {
    private static final Logger logger = LoggerFactory.getLogger(RegistryRequestContextFilter.class);
    static final String REQUEST_ID_HEADER = "x-request-id";
    static final String TRACE_ID_HEADER = "x-trace-id";
    private static final String ACCESS_LOG = "request_id={} trace_id={} method={} uri={} status={} latency_ms={}";

    @Override
    protected void doFilterInternal(
        HttpServletRequest request,
        HttpServletResponse response,
        FilterChain filterChain
    ) throws ServletException, IOException {
        RequestContext context = new RequestContext(
            IdGenerator.resolveRequestId(request.getHeader(REQUEST_ID_HEADER)),
            IdGenerator.resolveTraceId(request.getHeader(TRACE_ID_HEADER)),
            request.getMethod(),
            request.getQueryString() == null
                ? request.getRequestURI()
                : request.getRequestURI() + "?" + request.getQueryString(),
            System.nanoTime()
        );
        RequestContextHolder.set(context);
        response.setHeader(REQUEST_ID_HEADER, context.getRequestId());
        response.setHeader(TRACE_ID_HEADER, context.getTraceId());

        try {
            filterChain.doFilter(request, response);
        } finally {
            if (isProbe(request.getRequestURI())) {
                if (logger.isDebugEnabled()) {
                    logger.debug(ACCESS_LOG, accessArgs(context, response));
                }
            } else {
                logger.info(ACCESS_LOG, accessArgs(context, response));
            }
            RequestContextHolder.clear();
        }
    }

    private static boolean isProbe(String path) {
        return path != null && (path.equals("/health") || path.startsWith("/actuator"));
    }

    private static Object[] accessArgs(RequestContext context, HttpServletResponse response) {
        return new Object[] {
            context.getRequestId(),
            context.getTraceId(),
            context.getMethod(),
            context.getUri(),
            response.getStatus(),
            context.elapsedMs()
        };
    }
}
