package com.verso.registry.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.verso.registry.common.JsonUtils;
import com.verso.registry.domain.Entity;
import com.verso.registry.listing.PageRequest;
import com.verso.registry.listing.TextValue;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.function.BiFunction;

/**
 * In-process store keeping JSON snapshots in sorted maps. Readers never lock; writers are
 * serialized so an entity and its index rows always change together.
 */
public class MemoryEntityStore<T extends Entity> implements EntityStore<T> {
    private final EntityTable<T> table;
    private final ObjectMapper objectMapper;
    private final ConcurrentSkipListMap<String, String> current = new ConcurrentSkipListMap<>();
    private final Map<String, ConcurrentSkipListMap<String, String>> versions = new ConcurrentHashMap<>();
    private final Map<String, ConcurrentSkipListMap<String, ConcurrentSkipListMap<String, String>>> indexes =
        new ConcurrentHashMap<>();

    public MemoryEntityStore(EntityTable<T> table, ObjectMapper objectMapper) {
        this.table = table;
        this.objectMapper = objectMapper;
        for (IndexDefinition<T> index : table.getIndexes()) {
            indexes.put(index.name(), new ConcurrentSkipListMap<>());
        }
    }

    @Override
    public EntityTable<T> getTable() {
        return table;
    }

    @Override
    public synchronized void write(T entity) {
        String json = JsonUtils.toJson(objectMapper, entity);
        String previous = current.put(entity.getId(), json);
        if (previous != null) {
            unindex(decode(previous));
        }
        versions.computeIfAbsent(entity.getId(), id -> new ConcurrentSkipListMap<>()).put(entity.versionKey(), json);
        index(entity);
    }

    @Override
    public Optional<T> read(String id) {
        return Optional.ofNullable(current.get(id)).map(this::decode);
    }

    @Override
    public boolean exists(String id) {
        return current.containsKey(id);
    }

    @Override
    public synchronized Optional<T> delete(String id) {
        String previous = current.remove(id);
        versions.remove(id);
        if (previous == null) {
            return Optional.empty();
        }
        T entity = decode(previous);
        unindex(entity);
        return Optional.of(entity);
    }

    @Override
    public synchronized Optional<T> deleteVersion(String id, String versionId) {
        ConcurrentSkipListMap<String, String> history = versions.get(id);
        String removed = history == null ? null : history.remove(versionId);
        if (removed == null) {
            return Optional.empty();
        }
        String currentJson = current.get(id);
        if (currentJson != null && versionId.equals(decode(currentJson).versionKey())) {
            unindex(decode(currentJson));
            if (history.isEmpty()) {
                current.remove(id);
                versions.remove(id);
            } else {
                String latest = history.lastEntry().getValue();
                current.put(id, latest);
                index(decode(latest));
            }
        }
        return Optional.of(decode(removed));
    }

    @Override
    public List<T> readVersions(String id, PageRequest page) {
        NavigableMap<String, String> history = versions.get(id);
        if (history == null) {
            return List.of();
        }
        return slice(history, page, (versionId, json) -> decode(json));
    }

    @Override
    public Optional<T> readVersion(String id, String versionId) {
        NavigableMap<String, String> history = versions.get(id);
        if (history == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(history.get(versionId)).map(this::decode);
    }

    @Override
    public List<String> pageIds(PageRequest page) {
        return slice(current, page, (id, json) -> id);
    }

    @Override
    public List<String> allIds() {
        return new ArrayList<>(current.keySet());
    }

    @Override
    public List<String> indexKeys(String index) {
        return new ArrayList<>(rows(index).keySet());
    }

    @Override
    public List<TextValue> pageTextValues(String index, String key, PageRequest page) {
        return slice(rows(index, key), page, TextValue::new);
    }

    @Override
    public List<TextValue> allTextValues(String index, String key) {
        List<TextValue> values = new ArrayList<>();
        rows(index, key).forEach((id, text) -> values.add(new TextValue(id, text)));
        return values;
    }

    @Override
    public List<T> pageEntities(String index, String key, PageRequest page) {
        return loadAll(slice(rows(index, key), page, (id, text) -> id));
    }

    @Override
    public List<T> allEntities(String index, String key) {
        return loadAll(rows(index, key).keySet());
    }

    private ConcurrentSkipListMap<String, ConcurrentSkipListMap<String, String>> rows(String index) {
        table.index(index);
        return indexes.get(index);
    }

    private NavigableMap<String, String> rows(String index, String key) {
        NavigableMap<String, String> rows = rows(index).get(key);
        return rows == null ? new ConcurrentSkipListMap<>() : rows;
    }

    private void index(T entity) {
        for (IndexDefinition<T> index : table.getIndexes()) {
            String text = index.textOf(entity);
            for (String key : index.keys().apply(entity)) {
                indexes.get(index.name())
                    .computeIfAbsent(key, k -> new ConcurrentSkipListMap<>())
                    .put(entity.getId(), text == null ? "" : text);
            }
        }
    }

    private void unindex(T entity) {
        for (IndexDefinition<T> index : table.getIndexes()) {
            ConcurrentSkipListMap<String, ConcurrentSkipListMap<String, String>> byKey = indexes.get(index.name());
            for (String key : index.keys().apply(entity)) {
                byKey.computeIfPresent(key, (k, ids) -> {
                    ids.remove(entity.getId());
                    return ids.isEmpty() ? null : ids;
                });
            }
        }
    }

    private List<T> loadAll(Collection<String> ids) {
        List<T> entities = new ArrayList<>(ids.size());
        for (String id : ids) {
            read(id).ifPresent(entities::add);
        }
        return entities;
    }

    private T decode(String json) {
        return JsonUtils.fromJson(objectMapper, json, table.getType());
    }

    /**
     * Reads up to {@code page.limit()} rows after the exclusive offset, walking backwards when reversed.
     */
    static <V, R> List<R> slice(NavigableMap<String, V> rows, PageRequest page, BiFunction<String, V, R> mapper) {
        NavigableMap<String, V> window = page.reverse()
            ? rows.headMap(page.offset(), false).descendingMap()
            : rows.tailMap(page.offset(), false);
        List<R> out = new ArrayList<>();
        for (Map.Entry<String, V> entry : window.entrySet()) {
            if (out.size() >= page.limit()) {
                break;
            }
            out.add(mapper.apply(entry.getKey(), entry.getValue()));
        }
        return out;
    }
}
