package com.verso.registry.domain;

import com.verso.registry.common.IdGenerator;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Base of every stored entity. The ID is time-ordered, so it doubles as the natural sort key.
 */
public abstract class Entity {
    private String id;
    private Instant createdAt;

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    /**
     * Key under which this snapshot is kept in the version history.
     */
    public String versionKey() {
        return id;
    }

    /**
     * Problems with required fields, empty when the entity may be stored.
     */
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        if (!IdGenerator.isEntityId(id)) {
            problems.add("ID is missing or invalid");
        }
        if (createdAt == null) {
            problems.add("CreatedAt is missing");
        }
        return problems;
    }
}
