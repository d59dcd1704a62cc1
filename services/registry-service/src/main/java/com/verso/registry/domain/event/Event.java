package com.verso.registry.domain.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.verso.registry.domain.ExpiringEntity;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Something that happened to one or more entities, recorded for auditing.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Event extends ExpiringEntity {
    private String userId;
    private String entityId;
    private String entityType;
    private List<String> otherIds = new ArrayList<>();
    private LogLevel logLevel;
    private String message;
    private String uri;

    /**
     * IDs this event concerns, excluding its own.
     */
    public List<String> relatedIds() {
        List<String> ids = new ArrayList<>();
        if (userId != null && !userId.isEmpty()) {
            ids.add(userId);
        }
        if (entityId != null && !entityId.isEmpty() && !ids.contains(entityId)) {
            ids.add(entityId);
        }
        for (String id : otherIds) {
            if (id != null && !id.isEmpty() && !ids.contains(id)) {
                ids.add(id);
            }
        }
        return ids;
    }

    public String createdOn() {
        return getCreatedAt() == null ? null : getCreatedAt().atZone(ZoneOffset.UTC).toLocalDate().toString();
    }

    public String logLevelName() {
        return logLevel == null ? null : logLevel.name();
    }

    @Override
    public List<String> validate() {
        List<String> problems = super.validate();
        if (logLevel == null) {
            problems.add("LogLevel is missing");
        }
        if (message == null || message.isBlank()) {
            problems.add("Message is missing");
        }
        return problems;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
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

    public List<String> getOtherIds() {
        return otherIds;
    }

    public void setOtherIds(List<String> otherIds) {
        this.otherIds = otherIds == null ? new ArrayList<>() : otherIds;
    }

    public LogLevel getLogLevel() {
        return logLevel;
    }

    public void setLogLevel(LogLevel logLevel) {
        this.logLevel = logLevel;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public String getUri() {
        return uri;
    }

    public void setUri(String uri) {
        this.uri = uri;
    }
}
