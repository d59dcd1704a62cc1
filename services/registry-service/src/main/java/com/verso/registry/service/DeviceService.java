package com.verso.registry.service;

import com.verso.registry.config.RegistryProperties;
import com.verso.registry.domain.device.Device;
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
public class DeviceService extends EntityService<Device> {

    public DeviceService(
        EntityStore<Device> deviceStore,
        ListingEngine listingEngine,
        FanOutRetriever retriever,
        RegistryProperties properties
    ) {
        super(deviceStore, listingEngine, retriever, properties, properties.getListing().getEntityLimit(), List.of(
            new Filter(EntityTables.USER, FilterValues.entityId()),
            new Filter(EntityTables.DATE, FilterValues.date())
        ));
    }

    @Override
    protected void prepare(Device device, Optional<Device> previous, Instant now) {
        if (device.getLastSeenAt() == null) {
            device.setLastSeenAt(now);
        }
        device.setExpiresAt(device.getLastSeenAt().plus(Duration.ofDays(getProperties().getRetention().getDeviceDays())));
    }
}
