package com.verso.registry.service;

import com.verso.registry.config.RegistryProperties;
import com.verso.registry.domain.event.Event;
import com.verso.registry.domain.event.LogLevel;
import com.verso.registry.listing.FanOutRetriever;
import com.verso.registry.listing.FilterValues;
import com.verso.registry.listing.ListingEngine;
import com.verso.registry.repository.EntityStore;
import com.verso.registry.repository.EntityTables;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Service;

@Service
public class EventService extends EntityService<Event> {

    public EventService(
        EntityStore<Event> eventStore,
        ListingEngine listingEngine,
        FanOutRetriever retriever,
        RegistryProperties properties
    ) {
        super(eventStore, listingEngine, retriever, properties, properties.getListing().getEntityLimit(), List.of(
            new Filter(EntityTables.ENTITY, FilterValues.entityId()),
            new Filter("type", EntityTables.ENTITY_TYPE, FilterValues.text()),
            new Filter(EntityTables.LOG_LEVEL, FilterValues.enumValue(LogLevel.class)),
            new Filter(EntityTables.DATE, FilterValues.date())
        ));
    }

    @Override
    protected void prepare(Event event, Optional<Event> previous, Instant now) {
        if (event.getExpiresAt() == null) {
            event.setExpiresAt(now.plus(Duration.ofDays(getProperties().getRetention().getEventDays())));
        }
    }
}
