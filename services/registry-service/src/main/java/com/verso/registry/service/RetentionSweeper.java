package com.verso.registry.service;

import com.verso.registry.config.RegistryProperties;
import com.verso.registry.domain.Entity;
import com.verso.registry.domain.ExpiringEntity;
import com.verso.registry.domain.device.Device;
import com.verso.registry.domain.event.Event;
import com.verso.registry.domain.metric.Metric;
import com.verso.registry.domain.token.Token;
import com.verso.registry.repository.EntityStore;
import com.verso.registry.repository.StoreException;
import io.micrometer.core.instrument.Metrics;
import java.time.Instant;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Deletes events, metrics, tokens and devices whose expiry has passed.
 */
@Component
public class RetentionSweeper {
    private static final Logger logger = LoggerFactory.getLogger(RetentionSweeper.class);

    private final EntityStore<Event> eventStore;
    private final EntityStore<Metric> metricStore;
    private final EntityStore<Token> tokenStore;
    private final EntityStore<Device> deviceStore;
    private final RegistryProperties properties;

    public RetentionSweeper(
        EntityStore<Event> eventStore,
        EntityStore<Metric> metricStore,
        EntityStore<Token> tokenStore,
        EntityStore<Device> deviceStore,
        RegistryProperties properties
    ) {
        this.eventStore = eventStore;
        this.metricStore = metricStore;
        this.tokenStore = tokenStore;
        this.deviceStore = deviceStore;
        this.properties = properties;
    }

    @Scheduled(
        fixedDelayString = "${registry.retention.sweep-delay-ms:3600000}",
        initialDelayString = "${registry.retention.sweep-initial-delay-ms:60000}"
    )
    public void sweep() {
        if (!properties.getRetention().isSweepEnabled()) {
            return;
        }
        Instant now = Instant.now();
        int purged = purge(eventStore, ExpiringEntity::getExpiresAt, now)
            + purge(metricStore, ExpiringEntity::getExpiresAt, now)
            + purge(tokenStore, ExpiringEntity::getExpiresAt, now)
            + purge(deviceStore, Device::getExpiresAt, now);
        if (purged > 0) {
            logger.info("retention_sweep purged={}", purged);
        }
    }

    /**
     * Deletes the expired entities of one kind. A store failure is logged and ends this kind's
     * pass only, keeping whatever was already purged.
     */
    <T extends Entity> int purge(EntityStore<T> store, Function<T, Instant> expiry, Instant now) {
        String entityType = store.getTable().getEntityType();
        int purged = 0;
        try {
            for (String id : store.allIds()) {
                T entity = store.read(id).orElse(null);
                if (entity == null) {
                    continue;
                }
                Instant expiresAt = expiry.apply(entity);
                if (expiresAt != null && !expiresAt.isAfter(now) && store.delete(id).isPresent()) {
                    purged++;
                }
            }
        } catch (StoreException ex) {
            logger.error("retention_sweep_failed entity_type={} purged={}", entityType, purged, ex);
            Metrics.counter("registry.retention.failed.total", "entity_type", entityType).increment();
        }
        if (purged > 0) {
            logger.info("retention_purge entity_type={} purged={}", entityType, purged);
            Metrics.counter("registry.retention.purged.total", "entity_type", entityType).increment(purged);
        }
        return purged;
    }
}
