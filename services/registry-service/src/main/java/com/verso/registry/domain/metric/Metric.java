package com.verso.registry.domain.metric;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.verso.registry.domain.ExpiringEntity;
import java.util.ArrayList;
import java.util.List;

/**
 * A single numeric measurement, optionally about another entity.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Metric extends ExpiringEntity {
    private String title;
    private String label;
    private String entityId;
    private String entityType;
    private List<String> tags = new ArrayList<>();
    private double value;
    private String units;

    @Override
    public List<String> validate() {
        List<String> problems = super.validate();
        if (title == null || title.isBlank()) {
            problems.add("Title is missing");
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            problems.add("Value is not a finite number");
        }
        return problems;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getLabel() {
        return label;
    }

    public void setLabel(String label) {
        this.label = label;
    }

    public String getEntityId() {
        return entityId;
    }

    public void setEntityId(String entityId) {
        this.entityId = entityId;
    }

    public String getEntityType() {
        return entityType;
    }

    public void setEntityType(String entityType) {
        this.entityType = entityType;
    }

    public List<String> getTags() {
        return tags;
    }

    public void setTags(List<String> tags) {
        this.tags = tags == null ? new ArrayList<>() : tags;
    }

    public double getValue() {
        return value;
    }

    public void setValue(double value) {
        this.value = value;
    }

    public String getUnits() {
        return units;
    }

    public void setUnits(String units) {
        this.units = units;
    }
}
