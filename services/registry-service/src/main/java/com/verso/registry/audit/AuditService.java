package com.verso.registry.audit;

import com.verso.registry.common.RequestContext;
import com.verso.registry.common.RequestContextHolder;
import com.verso.registry.config.RegistryProperties;
import com.verso.registry.domain.event.Event;
import com.verso.registry.domain.event.LogLevel;
import com.verso.registry.service.EventService;
import io.micrometer.core.instrument.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Records audit events. Recording is best-effort: a failure is logged and never reaches the caller.
 */
@Service
public class AuditService {
    private static final Logger logger = LoggerFactory.getLogger(AuditService.class);

    private final EventService eventService;
    private final RegistryProperties properties;

    public AuditService(EventService eventService, RegistryProperties properties) {
        this.eventService = eventService;
        this.properties = properties;
    }

    public void record(LogLevel level, String entityType, String entityId, String message) {
        if (!properties.getAudit().isEnabled()) {
            return;
        }
        RequestContext context = RequestContextHolder.get();
        Event event = new Event();
        event.setLogLevel(level);
        event.setEntityType(entityType);
        event.setEntityId(entityId);
        event.setMessage(message);
        event.setUri(context == null ? null : context.getUri());
        try {
            eventService.create(event);
        } catch (RuntimeException ex) {
            Metrics.counter("registry.audit.failures.total").increment();
            logger.warn(
                "audit_failed request_id={} level={} entity_type={} error={}",
                RequestContextHolder.requestId(),
                level,
                entityType,
                ex.toString()
            );
        }
    }
}
