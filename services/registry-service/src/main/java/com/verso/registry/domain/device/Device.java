package com.verso.registry.domain.device;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.verso.registry.common.IdGenerator;
import com.verso.registry.domain.VersionedEntity;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

/**
 * A client device (browser or app install), optionally tied to a user.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Device extends VersionedEntity {
    private String userId;
    private String userAgent;
    private Instant lastSeenAt;
    private Instant expiresAt;

    /**
     * ISO date (UTC) the device was last seen, or {@code null}.
     */
    public String lastSeenOn() {
        return lastSeenAt == null ? null : lastSeenAt.atZone(ZoneOffset.UTC).toLocalDate().toString();
    }

    @Override
    public List<String> validate() {
        List<String> problems = super.validate();
        if (userId != null && !IdGenerator.isEntityId(userId)) {
            problems.add("UserID is invalid");
        }
        if (userAgent == null || userAgent.isBlank()) {
            problems.add("UserAgent is missing");
        }
        return problems;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }

    public Instant getLastSeenAt() {
        return lastSeenAt;
    }

    public void setLastSeenAt(Instant lastSeenAt) {
        this.lastSeenAt = lastSeenAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public void setExpiresAt(Instant expiresAt) {
        this.expiresAt = expiresAt;
    }
}
