package com.verso.registry.service;

import com.verso.registry.common.ApiException;
import com.verso.registry.common.BadRequestException;
import com.verso.registry.common.IdGenerator;
import com.verso.registry.common.NotFoundException;
import com.verso.registry.common.RequestParams;
import com.verso.registry.config.RegistryProperties;
import com.verso.registry.domain.Entity;
import com.verso.registry.domain.VersionedEntity;
import com.verso.registry.listing.FanOutRetriever;
import com.verso.registry.listing.FilterValues;
import com.verso.registry.listing.ListingDefinition;
import com.verso.registry.listing.ListingEngine;
import com.verso.registry.listing.ListingParams;
import com.verso.registry.listing.TextValue;
import com.verso.registry.repository.EntityStore;
import com.verso.registry.repository.EntityTable;
import com.verso.registry.repository.EntityTables;
import com.verso.registry.repository.IndexDefinition;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.http.HttpStatus;

/**
 * CRUD and listings for one entity kind. Subclasses declare their filters in precedence order and
 * hook into {@link #prepare} and {@link #present}.
 */
public abstract class EntityService<T extends Entity> {
    protected final EntityStore<T> store;
    private final ListingEngine listingEngine;
    private final RegistryProperties properties;
    private final ListingDefinition<TextValue> textListing;
    private final ListingDefinition<T> entityListing;

    protected EntityService(
        EntityStore<T> store,
        ListingEngine listingEngine,
        FanOutRetriever retriever,
        RegistryProperties properties,
        int entityLimit,
        List<Filter> filters
    ) {
        this.store = store;
        this.listingEngine = listingEngine;
        this.properties = properties;
        EntityTable<T> table = store.getTable();
        IndexDefinition<T> all = table.index(EntityTables.ALL);

        ListingDefinition.Builder<TextValue> text = ListingDefinition
            .<TextValue>builder(table.getEntityType() + "_text", TextValue::value)
            .defaultLimit(properties.getListing().getTextLimit())
            .allWhenLimitAbsent(true);
        ListingDefinition.Builder<T> entities = ListingDefinition
            .<T>builder(table.getEntityType(), all::textOf)
            .defaultLimit(entityLimit)
            .allWhenLimitAbsent(false);
        for (Filter filter : filters) {
            table.index(filter.index());
            text.filter(filter.parameter(), filter.normalizer(), IndexSources.textValues(store, filter.index()));
            entities.filter(filter.parameter(), filter.normalizer(), IndexSources.entities(store, filter.index()));
        }
        this.textListing = text.defaultIndex(IndexDefinition.ALL_KEY, IndexSources.textValues(store, EntityTables.ALL)).build();
        this.entityListing = entities.defaultIndex(IndexDefinition.ALL_KEY, IndexSources.fannedOut(store, retriever)).build();
    }

    public String getEntityType() {
        return store.getTable().getEntityType();
    }

    public T create(T entity) {
        if (entity == null) {
            throw new BadRequestException("body", "request body is required");
        }
        Instant now = Instant.now();
        String id = IdGenerator.newEntityId();
        entity.setId(id);
        entity.setCreatedAt(now);
        if (entity instanceof VersionedEntity versioned) {
            versioned.setVersionId(id);
            versioned.setUpdatedAt(now);
        }
        prepare(entity, Optional.empty(), now);
        save(entity);
        return present(entity);
    }

    public T update(String id, T entity) {
        RequestParams.requireEntityId(id, "id");
        if (entity == null) {
            throw new BadRequestException("body", "request body is required");
        }
        if (!(entity instanceof VersionedEntity versioned)) {
            throw new ApiException(HttpStatus.METHOD_NOT_ALLOWED, "method_not_allowed", getEntityType() + " is immutable");
        }
        T previous = store.read(id).orElseThrow(() -> new NotFoundException(getEntityType(), id));
        Instant now = Instant.now();
        entity.setId(id);
        entity.setCreatedAt(previous.getCreatedAt());
        versioned.setVersionId(IdGenerator.newEntityId());
        versioned.setUpdatedAt(now);
        prepare(entity, Optional.of(previous), now);
        save(entity);
        return present(entity);
    }

    public T read(String id) {
        return present(load(id));
    }

    public boolean exists(String id) {
        RequestParams.requireEntityId(id, "id");
        return store.exists(id);
    }

    public T delete(String id) {
        RequestParams.requireEntityId(id, "id");
        return store.delete(id).map(this::present).orElseThrow(() -> new NotFoundException(getEntityType(), id));
    }

    public List<T> versions(String id, Map<String, String> query) {
        RequestParams.requireEntityId(id, "id");
        ListingParams params = ListingParams.parse(query, properties.getListing().getVersionLimit());
        if (!store.exists(id)) {
            throw new NotFoundException(getEntityType(), id);
        }
        return store.readVersions(id, params.page()).stream().map(this::present).toList();
    }

    public boolean versionExists(String id, String versionId) {
        RequestParams.requireEntityId(id, "id");
        RequestParams.requireEntityId(versionId, "versionId");
        return store.readVersion(id, versionId).isPresent();
    }

    /**
     * Removes one version. When it is the current one, the latest remaining version becomes
     * current, and removing the only version removes the entity.
     */
    public T deleteVersion(String id, String versionId) {
        RequestParams.requireEntityId(id, "id");
        RequestParams.requireEntityId(versionId, "versionId");
        if (!store.getTable().isVersioned()) {
            throw new ApiException(HttpStatus.METHOD_NOT_ALLOWED, "method_not_allowed", getEntityType() + " has no versions");
        }
        return store.deleteVersion(id, versionId)
            .map(this::present)
            .orElseThrow(() -> new NotFoundException(getEntityType() + " version", id + "/" + versionId));
    }

    public T version(String id, String versionId) {
        RequestParams.requireEntityId(id, "id");
        RequestParams.requireEntityId(versionId, "versionId");
        return store.readVersion(id, versionId)
            .map(this::present)
            .orElseThrow(() -> new NotFoundException(getEntityType() + " version", id + "/" + versionId));
    }

    public List<TextValue> listTextValues(Map<String, String> query) {
        return listingEngine.list(textListing, query);
    }

    public List<T> list(Map<String, String> query) {
        return listingEngine.list(entityListing, query).stream().map(this::present).toList();
    }

    public List<String> indexKeys(String index) {
        return store.indexKeys(index);
    }

    protected T load(String id) {
        RequestParams.requireEntityId(id, "id");
        return store.read(id).orElseThrow(() -> new NotFoundException(getEntityType(), id));
    }

    /**
     * Fills derived fields before validation. {@code previous} is the stored version on update.
     */
    protected void prepare(T entity, Optional<T> previous, Instant now) {
    }

    /**
     * Shapes an entity for the response.
     */
    protected T present(T entity) {
        return entity;
    }

    protected ListingDefinition<T> entityListing() {
        return entityListing;
    }

    protected RegistryProperties getProperties() {
        return properties;
    }

    private void save(T entity) {
        List<String> problems = new ArrayList<>(entity.validate());
        problems.addAll(store.getTable().keyProblems(entity));
        if (!problems.isEmpty()) {
            throw new BadRequestException("body", "invalid " + getEntityType() + ": " + String.join("; ", problems));
        }
        store.write(entity);
    }

    /**
     * A filter parameter and the index it selects. Most parameters are named after their index.
     */
    public record Filter(String parameter, String index, FilterValues.FilterNormalizer normalizer) {

        public Filter(String index, FilterValues.FilterNormalizer normalizer) {
            this(index, index, normalizer);
        }
    }
}
