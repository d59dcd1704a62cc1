package com.verso.registry.service;

import com.verso.registry.common.BadRequestException;
import com.verso.registry.common.NotFoundException;
import com.verso.registry.config.RegistryProperties;
import com.verso.registry.domain.device.Device;
import com.verso.registry.domain.device.DeviceCount;
import com.verso.registry.listing.ListingParams;
import com.verso.registry.repository.EntityStore;
import com.verso.registry.repository.EntityTables;
import com.verso.registry.repository.IndexDefinition;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Daily device tallies. A count is recomputed from the device date index on update and kept after
 * the devices themselves expire.
 */
@Service
public class DeviceCountService {
    private static final Logger logger = LoggerFactory.getLogger(DeviceCountService.class);

    private final EntityStore<DeviceCount> countStore;
    private final EntityStore<Device> deviceStore;
    private final RegistryProperties properties;

    public DeviceCountService(
        EntityStore<DeviceCount> deviceCountStore,
        EntityStore<Device> deviceStore,
        RegistryProperties properties
    ) {
        this.countStore = deviceCountStore;
        this.deviceStore = deviceStore;
        this.properties = properties;
    }

    /**
     * Counts in date order; the offset is the last date of the previous page.
     */
    public List<DeviceCount> list(Map<String, String> query) {
        ListingParams params = ListingParams.parse(query, properties.getListing().getEntityLimit());
        return countStore.pageEntities(EntityTables.ALL, IndexDefinition.ALL_KEY, params.page());
    }

    public DeviceCount read(String date) {
        String key = requireDate(date);
        return countStore.read(key).orElseThrow(() -> new NotFoundException("device_count", key));
    }

    public boolean exists(String date) {
        return countStore.exists(requireDate(date));
    }

    public DeviceCount update(String date) {
        String key = requireDate(date);
        DeviceCount count = DeviceCount.of(key, deviceStore.allEntities(EntityTables.DATE, key));
        count.setCreatedAt(Instant.now());
        countStore.write(count);
        logger.info("device_count_updated date={} total={}", key, count.getTotal());
        return count;
    }

    private static String requireDate(String date) {
        if (!DeviceCount.isDate(date)) {
            throw BadRequestException.invalid("date", date);
        }
        return date;
    }
}
