package com.verso.registry.audit;

import com.verso.registry.common.IdGenerator;
import com.verso.registry.domain.event.LogLevel;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Emits one INFO audit event per successful mutation under {@code /v1}. Event writes themselves are
 * not audited.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 40)
public class MutationAuditFilter extends OncePerRequestFilter {
    private static final String API_PREFIX = "/v1/";
    private static final String EVENTS_PREFIX = "/v1/events";

    private final AuditService auditService;

    public MutationAuditFilter(AuditService auditService) {
        this.auditService = auditService;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        return !isMutation(request.getMethod())
            || path == null
            || !path.startsWith(API_PREFIX)
            || path.startsWith(EVENTS_PREFIX);
    }

    @Override
    protected void doFilterInternal(
        HttpServletRequest request,
        HttpServletResponse response,
        FilterChain filterChain
    ) throws ServletException, IOException {
        filterChain.doFilter(request, response);
        int status = response.getStatus();
        if (status < 200 || status >= 300) {
            return;
        }
        String[] segments = request.getRequestURI().substring(API_PREFIX.length()).split("/");
        String collection = segments[0];
        String entityType = collection.endsWith("s") ? collection.substring(0, collection.length() - 1) : collection;
        String entityId = segments.length > 1 && IdGenerator.isEntityId(segments[1]) ? segments[1] : null;
        auditService.record(
            LogLevel.INFO,
            entityType,
            entityId,
            request.getMethod() + " " + request.getRequestURI() + " " + status
        );
    }

    private boolean isMutation(String method) {
        return "POST".equalsIgnoreCase(method)
            || "PUT".equalsIgnoreCase(method)
            || "DELETE".equalsIgnoreCase(method);
    }
}
