package com.verso.registry.domain.token;

import com.verso.registry.common.IdGenerator;
import com.verso.registry.domain.ExpiringEntity;
import java.util.List;

/**
 * A bearer token issued to a user. The token ID is the bearer secret.
 */
public class Token extends ExpiringEntity {
    private String userId;
    private String email;

    @Override
    public List<String> validate() {
        List<String> problems = super.validate();
        if (!IdGenerator.isEntityId(userId)) {
            problems.add("UserID is missing or invalid");
        }
        if (getExpiresAt() == null) {
            problems.add("ExpiresAt is missing");
        }
        return problems;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }
}
