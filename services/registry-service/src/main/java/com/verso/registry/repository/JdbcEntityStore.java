package com.verso.registry.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.verso.registry.common.JsonUtils;
import com.verso.registry.domain.Entity;
import com.verso.registry.listing.PageRequest;
import com.verso.registry.listing.TextValue;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.annotation.Transactional;

/**
 * Relational store over three shared tables keyed by entity type: the current snapshot, every
 * version, and one row per index key. Bodies are stored as JSON.
 */
public class JdbcEntityStore<T extends Entity> implements EntityStore<T> {
    private static final Logger logger = LoggerFactory.getLogger(JdbcEntityStore.class);

    private final EntityTable<T> table;
    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public JdbcEntityStore(EntityTable<T> table, JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.table = table;
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public EntityTable<T> getTable() {
        return table;
    }

    @Override
    @Transactional
    public void write(T entity) {
        String json = JsonUtils.toJson(objectMapper, entity);
        String type = table.getEntityType();
        execute("write", () -> {
            int updated = jdbcTemplate.update(
                "UPDATE entity_current SET body = ? WHERE entity_type = ? AND id = ?",
                json,
                type,
                entity.getId()
            );
            if (updated == 0) {
                jdbcTemplate.update(
                    "INSERT INTO entity_current (entity_type, id, body) VALUES (?, ?, ?)",
                    type,
                    entity.getId(),
                    json
                );
            }
            jdbcTemplate.update(
                "DELETE FROM entity_version WHERE entity_type = ? AND id = ? AND version_id = ?",
                type,
                entity.getId(),
                entity.versionKey()
            );
            jdbcTemplate.update(
                "INSERT INTO entity_version (entity_type, id, version_id, body) VALUES (?, ?, ?, ?)",
                type,
                entity.getId(),
                entity.versionKey(),
                json
            );
            reindex(entity);
            return null;
        });
    }

    @Override
    public Optional<T> read(String id) {
        List<String> bodies = execute("read", () -> jdbcTemplate.queryForList(
            "SELECT body FROM entity_current WHERE entity_type = ? AND id = ?",
            String.class,
            table.getEntityType(),
            id
        ));
        return bodies.isEmpty() ? Optional.empty() : Optional.of(decode(bodies.get(0)));
    }

    @Override
    public boolean exists(String id) {
        Integer count = execute("exists", () -> jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM entity_current WHERE entity_type = ? AND id = ?",
            Integer.class,
            table.getEntityType(),
            id
        ));
        return count != null && count > 0;
    }

    @Override
    @Transactional
    public Optional<T> delete(String id) {
        Optional<T> existing = read(id);
        if (existing.isEmpty()) {
            return existing;
        }
        String type = table.getEntityType();
        execute("delete", () -> {
            jdbcTemplate.update("DELETE FROM entity_index WHERE entity_type = ? AND id = ?", type, id);
            jdbcTemplate.update("DELETE FROM entity_version WHERE entity_type = ? AND id = ?", type, id);
            jdbcTemplate.update("DELETE FROM entity_current WHERE entity_type = ? AND id = ?", type, id);
            return null;
        });
        return existing;
    }

    @Override
    @Transactional
    public Optional<T> deleteVersion(String id, String versionId) {
        Optional<T> removed = readVersion(id, versionId);
        if (removed.isEmpty()) {
            return removed;
        }
        String type = table.getEntityType();
        Optional<T> existing = read(id);
        execute("delete_version", () -> {
            jdbcTemplate.update(
                "DELETE FROM entity_version WHERE entity_type = ? AND id = ? AND version_id = ?",
                type,
                id,
                versionId
            );
            if (existing.isEmpty() || !versionId.equals(existing.get().versionKey())) {
                return null;
            }
            List<String> latest = jdbcTemplate.queryForList(
                "SELECT body FROM entity_version WHERE entity_type = ? AND id = ? ORDER BY version_id DESC LIMIT 1",
                String.class,
                type,
                id
            );
            if (latest.isEmpty()) {
                jdbcTemplate.update("DELETE FROM entity_index WHERE entity_type = ? AND id = ?", type, id);
                jdbcTemplate.update("DELETE FROM entity_current WHERE entity_type = ? AND id = ?", type, id);
            } else {
                jdbcTemplate.update(
                    "UPDATE entity_current SET body = ? WHERE entity_type = ? AND id = ?",
                    latest.get(0),
                    type,
                    id
                );
                reindex(decode(latest.get(0)));
            }
            return null;
        });
        return removed;
    }

    @Override
    public List<T> readVersions(String id, PageRequest page) {
        List<String> bodies = execute("read_versions", () -> jdbcTemplate.queryForList(
            "SELECT body FROM entity_version WHERE entity_type = ? AND id = ? AND " + window("version_id", page),
            String.class,
            table.getEntityType(),
            id,
            page.offset(),
            page.limit()
        ));
        return decodeAll(bodies);
    }

    @Override
    public Optional<T> readVersion(String id, String versionId) {
        List<String> bodies = execute("read_version", () -> jdbcTemplate.queryForList(
            "SELECT body FROM entity_version WHERE entity_type = ? AND id = ? AND version_id = ?",
            String.class,
            table.getEntityType(),
            id,
            versionId
        ));
        return bodies.isEmpty() ? Optional.empty() : Optional.of(decode(bodies.get(0)));
    }

    @Override
    public List<String> pageIds(PageRequest page) {
        return execute("page_ids", () -> jdbcTemplate.queryForList(
            "SELECT id FROM entity_current WHERE entity_type = ? AND " + window("id", page),
            String.class,
            table.getEntityType(),
            page.offset(),
            page.limit()
        ));
    }

    @Override
    public List<String> allIds() {
        return execute("all_ids", () -> jdbcTemplate.queryForList(
            "SELECT id FROM entity_current WHERE entity_type = ? ORDER BY id",
            String.class,
            table.getEntityType()
        ));
    }

    @Override
    public List<String> indexKeys(String index) {
        table.index(index);
        return execute("index_keys", () -> jdbcTemplate.queryForList(
            "SELECT DISTINCT index_key FROM entity_index WHERE entity_type = ? AND index_name = ? ORDER BY index_key",
            String.class,
            table.getEntityType(),
            index
        ));
    }

    @Override
    public List<TextValue> pageTextValues(String index, String key, PageRequest page) {
        table.index(index);
        return execute("page_text_values", () -> jdbcTemplate.query(
            "SELECT id, text_value FROM entity_index WHERE entity_type = ? AND index_name = ? AND index_key = ? AND "
                + window("id", page),
            (rs, rowNum) -> new TextValue(rs.getString("id"), rs.getString("text_value")),
            table.getEntityType(),
            index,
            key,
            page.offset(),
            page.limit()
        ));
    }

    @Override
    public List<TextValue> allTextValues(String index, String key) {
        table.index(index);
        return execute("all_text_values", () -> jdbcTemplate.query(
            "SELECT id, text_value FROM entity_index WHERE entity_type = ? AND index_name = ? AND index_key = ? ORDER BY id",
            (rs, rowNum) -> new TextValue(rs.getString("id"), rs.getString("text_value")),
            table.getEntityType(),
            index,
            key
        ));
    }

    @Override
    public List<T> pageEntities(String index, String key, PageRequest page) {
        table.index(index);
        List<String> bodies = execute("page_entities", () -> jdbcTemplate.queryForList(
            "SELECT c.body FROM entity_index i JOIN entity_current c ON c.entity_type = i.entity_type AND c.id = i.id "
                + "WHERE i.entity_type = ? AND i.index_name = ? AND i.index_key = ? AND " + window("i.id", page),
            String.class,
            table.getEntityType(),
            index,
            key,
            page.offset(),
            page.limit()
        ));
        return decodeAll(bodies);
    }

    @Override
    public List<T> allEntities(String index, String key) {
        table.index(index);
        List<String> bodies = execute("all_entities", () -> jdbcTemplate.queryForList(
            "SELECT c.body FROM entity_index i JOIN entity_current c ON c.entity_type = i.entity_type AND c.id = i.id "
                + "WHERE i.entity_type = ? AND i.index_name = ? AND i.index_key = ? ORDER BY i.id",
            String.class,
            table.getEntityType(),
            index,
            key
        ));
        return decodeAll(bodies);
    }

    private void reindex(T entity) {
        String type = table.getEntityType();
        jdbcTemplate.update("DELETE FROM entity_index WHERE entity_type = ? AND id = ?", type, entity.getId());
        List<Object[]> rows = new ArrayList<>();
        for (IndexDefinition<T> index : table.getIndexes()) {
            String text = index.textOf(entity);
            for (String key : index.keys().apply(entity)) {
                rows.add(new Object[] {type, index.name(), key, entity.getId(), text == null ? "" : text});
            }
        }
        if (!rows.isEmpty()) {
            jdbcTemplate.batchUpdate(
                "INSERT INTO entity_index (entity_type, index_name, index_key, id, text_value) VALUES (?, ?, ?, ?, ?)",
                rows
            );
        }
    }

    /**
     * Exclusive range condition plus ordering and limit; binds the offset then the limit.
     */
    static String window(String column, PageRequest page) {
        return page.reverse()
            ? column + " < ? ORDER BY " + column + " DESC LIMIT ?"
            : column + " > ? ORDER BY " + column + " ASC LIMIT ?";
    }

    private <R> R execute(String operation, Supplier<R> action) {
        try {
            return action.get();
        } catch (DataAccessException ex) {
            logger.error("store_failed entity_type={} operation={} error={}", table.getEntityType(), operation, ex.toString());
            throw new StoreException(operation + " " + table.getEntityType() + " failed", ex);
        }
    }

    private List<T> decodeAll(List<String> bodies) {
        List<T> entities = new ArrayList<>(bodies.size());
        for (String body : bodies) {
            entities.add(decode(body));
        }
        return entities;
    }

    private T decode(String json) {
        return JsonUtils.fromJson(objectMapper, json, table.getType());
    }
}
