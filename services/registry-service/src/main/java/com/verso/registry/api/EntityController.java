package com.verso.registry.api;

import com.verso.registry.common.NotFoundException;
import com.verso.registry.domain.Entity;
import com.verso.registry.service.EntityService;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Shared request handling for the per-kind controllers. Subclasses own the routes.
 */
public abstract class EntityController<T extends Entity> {
    protected final EntityService<T> service;
    private final Map<String, String> indexesByPath;

    /**
     * @param indexesByPath path suffix of each index-key endpoint, e.g. {@code "tags" -> "tag"}
     */
    protected EntityController(EntityService<T> service, Map<String, String> indexesByPath) {
        this.service = service;
        this.indexesByPath = Map.copyOf(indexesByPath);
    }

    protected ResponseEntity<T> created(T body) {
        return ResponseEntity.status(HttpStatus.CREATED).body(service.create(body));
    }

    protected ResponseEntity<Void> head(String id) {
        return service.exists(id) ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
    }

    protected ResponseEntity<Void> headVersion(String id, String versionId) {
        return service.versionExists(id, versionId) ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
    }

    protected List<String> listIndexKeys(String path) {
        String index = indexesByPath.get(path);
        if (index == null) {
            throw new NotFoundException("index", service.getEntityType() + "_" + path);
        }
        return service.indexKeys(index);
    }
}
