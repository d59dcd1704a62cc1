package com.verso.registry.domain.org;

import com.verso.registry.domain.Status;
import com.verso.registry.domain.VersionedEntity;
import java.util.List;

public class Organization extends VersionedEntity {
    private String name;
    private Status status;

    public String statusName() {
        return status == null ? null : status.name();
    }

    @Override
    public List<String> validate() {
        List<String> problems = super.validate();
        if (name == null || name.isBlank()) {
            problems.add("Name is missing");
        }
        if (status == null) {
            problems.add("Status is missing");
        }
        return problems;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public Status getStatus() {
        return status;
    }

    public void setStatus(Status status) {
        this.status = status;
    }
}
