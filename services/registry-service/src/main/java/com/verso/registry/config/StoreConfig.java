package com.verso.registry.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.verso.registry.common.JsonUtils;
import com.verso.registry.domain.Entity;
import com.verso.registry.domain.content.Content;
import com.verso.registry.domain.device.Device;
import com.verso.registry.domain.device.DeviceCount;
import com.verso.registry.domain.email.Email;
import com.verso.registry.domain.event.Event;
import com.verso.registry.domain.metric.Metric;
import com.verso.registry.domain.org.Organization;
import com.verso.registry.domain.token.Token;
import com.verso.registry.domain.user.User;
import com.verso.registry.repository.EntityStore;
import com.verso.registry.repository.EntityTable;
import com.verso.registry.repository.EntityTables;
import com.verso.registry.repository.JdbcEntityStore;
import com.verso.registry.repository.MemoryEntityStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * One store per entity kind, on the backend named by {@code registry.store.backend}.
 */
@Configuration
public class StoreConfig {
    private static final Logger logger = LoggerFactory.getLogger(StoreConfig.class);

    private final RegistryProperties properties;
    private final ObjectProvider<JdbcTemplate> jdbcTemplate;
    private final ObjectMapper storeMapper = JsonUtils.newObjectMapper();

    public StoreConfig(RegistryProperties properties, ObjectProvider<JdbcTemplate> jdbcTemplate) {
        this.properties = properties;
        this.jdbcTemplate = jdbcTemplate;
    }

    @Bean
    public EntityStore<Content> contentStore() {
        return create(EntityTables.CONTENT);
    }

    @Bean
    public EntityStore<User> userStore() {
        return create(EntityTables.USERS);
    }

    @Bean
    public EntityStore<Organization> organizationStore() {
        return create(EntityTables.ORGANIZATIONS);
    }

    @Bean
    public EntityStore<Email> emailStore() {
        return create(EntityTables.EMAILS);
    }

    @Bean
    public EntityStore<Device> deviceStore() {
        return create(EntityTables.DEVICES);
    }

    @Bean
    public EntityStore<DeviceCount> deviceCountStore() {
        return create(EntityTables.DEVICE_COUNTS);
    }

    @Bean
    public EntityStore<Token> tokenStore() {
        return create(EntityTables.TOKENS);
    }

    @Bean
    public EntityStore<Metric> metricStore() {
        return create(EntityTables.METRICS);
    }

    @Bean
    public EntityStore<Event> eventStore() {
        return create(EntityTables.EVENTS);
    }

    private <T extends Entity> EntityStore<T> create(EntityTable<T> table) {
        RegistryProperties.Backend backend = properties.getStore().getBackend();
        logger.info("entity_store entity_type={} backend={}", table.getEntityType(), backend);
        return switch (backend) {
            case JDBC -> new JdbcEntityStore<>(table, jdbcTemplate.getObject(), storeMapper);
            case MEMORY -> new MemoryEntityStore<>(table, storeMapper);
        };
    }
}
