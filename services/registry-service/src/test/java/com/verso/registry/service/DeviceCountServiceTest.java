package com.verso.registry.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.verso.registry.common.BadRequestException;
import com.verso.registry.common.IdGenerator;
import com.verso.registry.common.JsonUtils;
import com.verso.registry.common.NotFoundException;
import com.verso.registry.config.RegistryProperties;
import com.verso.registry.domain.device.Device;
import com.verso.registry.domain.device.DeviceCount;
import com.verso.registry.repository.EntityTables;
import com.verso.registry.repository.MemoryEntityStore;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DeviceCountServiceTest {
    private MemoryEntityStore<Device> deviceStore;
    private MemoryEntityStore<DeviceCount> countStore;
    private DeviceCountService service;

    @BeforeEach
    void setUp() {
        deviceStore = new MemoryEntityStore<>(EntityTables.DEVICES, JsonUtils.newObjectMapper());
        countStore = new MemoryEntityStore<>(EntityTables.DEVICE_COUNTS, JsonUtils.newObjectMapper());
        service = new DeviceCountService(countStore, deviceStore, new RegistryProperties());
    }

    @Test
    void updateTalliesDevicesLastSeenOnTheDate() {
        device("Firefox", "2024-03-01T08:00:00Z");
        device("Firefox", "2024-03-01T23:59:59Z");
        device("curl/8.0", "2024-03-01T12:00:00Z");
        device("Firefox", "2024-03-02T00:00:00Z");

        DeviceCount count = service.update("2024-03-01");

        assertThat(count.getDate()).isEqualTo("2024-03-01");
        assertThat(count.getTotal()).isEqualTo(3);
        assertThat(count.getUserAgents()).isEqualTo(Map.of("Firefox", 2, "curl/8.0", 1));
        assertThat(service.exists("2024-03-01")).isTrue();
        assertThat(service.read("2024-03-01").getTotal()).isEqualTo(3);
    }

    @Test
    void updateReplacesThePreviousCount() {
        service.update("2024-03-01");
        device("Safari", "2024-03-01T10:00:00Z");

        service.update("2024-03-01");

        assertThat(service.read("2024-03-01").getTotal()).isEqualTo(1);
        assertThat(countStore.allIds()).containsExactly("2024-03-01");
    }

    @Test
    void listPagesByDate() {
        service.update("2024-03-02");
        service.update("2024-03-01");
        service.update("2024-03-03");

        List<DeviceCount> first = service.list(Map.of("limit", "2"));
        List<DeviceCount> next = service.list(Map.of("limit", "2", "offset", "2024-03-02"));
        List<DeviceCount> reversed = service.list(Map.of("reverse", "true", "limit", "1"));

        assertThat(first).extracting(DeviceCount::getDate).containsExactly("2024-03-01", "2024-03-02");
        assertThat(next).extracting(DeviceCount::getDate).containsExactly("2024-03-03");
        assertThat(reversed).extracting(DeviceCount::getDate).containsExactly("2024-03-03");
    }

    @Test
    void datesAreValidated() {
        assertThatThrownBy(() -> service.update("2024-02-30"))
            .isInstanceOf(BadRequestException.class)
            .hasMessage("invalid parameter, date: 2024-02-30");
        assertThatThrownBy(() -> service.read("yesterday")).isInstanceOf(BadRequestException.class);
        assertThatThrownBy(() -> service.read("2024-03-01")).isInstanceOf(NotFoundException.class);
        assertThat(service.exists("2024-03-01")).isFalse();
    }

    private void device(String userAgent, String lastSeenAt) {
        Device device = new Device();
        String id = IdGenerator.newEntityId();
        device.setId(id);
        device.setVersionId(id);
        device.setCreatedAt(Instant.now());
        device.setUpdatedAt(Instant.now());
        device.setUserAgent(userAgent);
        device.setLastSeenAt(Instant.parse(lastSeenAt));
        deviceStore.write(device);
    }
}
