package com.verso.registry.domain;

import com.verso.registry.common.IdGenerator;
import java.time.Instant;
import java.util.List;

public abstract class VersionedEntity extends Entity {
    private String versionId;
    private Instant updatedAt;

    public String getVersionId() {
        return versionId;
    }

    public void setVersionId(String versionId) {
        this.versionId = versionId;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    @Override
    public String versionKey() {
        return versionId;
    }

    @Override
    public List<String> validate() {
        List<String> problems = super.validate();
        if (!IdGenerator.isEntityId(versionId)) {
            problems.add("VersionID is missing or invalid");
        }
        if (updatedAt == null) {
            problems.add("UpdatedAt is missing");
        }
        return problems;
    }
}
