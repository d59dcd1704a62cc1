package com.verso.registry.domain.user;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.verso.registry.common.IdGenerator;
import com.verso.registry.domain.Status;
import com.verso.registry.domain.VersionedEntity;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * A person or system account. The plain password is accepted on input only; the hash is kept in
 * storage and removed by {@link #scrub()} before anything leaves the service.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class User extends VersionedEntity {
    private String givenName;
    private String familyName;
    private String email;
    @JsonProperty(access = JsonProperty.Access.WRITE_ONLY)
    private String password;
    private String passwordHash;
    private List<String> roles = new ArrayList<>();
    private String orgId;
    private String orgName;
    private Status status;

    public static String standardizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }

    public String fullName() {
        String given = givenName == null ? "" : givenName.trim();
        String family = familyName == null ? "" : familyName.trim();
        return (given + " " + family).trim();
    }

    /**
     * Name and address as shown in pickers, e.g. {@code "Jane Doe <jane@example.com>"}.
     */
    public String displayName() {
        String name = fullName();
        if (name.isEmpty()) {
            return email;
        }
        return email == null ? name : name + " <" + email + ">";
    }

    public String statusName() {
        return status == null ? null : status.name();
    }

    public boolean hasRole(String role) {
        return roles.contains(role) || roles.contains("admin");
    }

    public User scrub() {
        this.password = null;
        this.passwordHash = null;
        return this;
    }

    @Override
    public List<String> validate() {
        List<String> problems = super.validate();
        if (email == null || !email.contains("@")) {
            problems.add("Email is missing or invalid");
        }
        if (orgId != null && !IdGenerator.isEntityId(orgId)) {
            problems.add("OrgID is invalid");
        }
        if (status == null) {
            problems.add("Status is missing");
        }
        return problems;
    }

    public String getGivenName() {
        return givenName;
    }

    public void setGivenName(String givenName) {
        this.givenName = givenName;
    }

    public String getFamilyName() {
        return familyName;
    }

    public void setFamilyName(String familyName) {
        this.familyName = familyName;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public String getPasswordHash() {
        return passwordHash;
    }

    public void setPasswordHash(String passwordHash) {
        this.passwordHash = passwordHash;
    }

    public List<String> getRoles() {
        return roles;
    }

    public void setRoles(List<String> roles) {
        this.roles = roles == null ? new ArrayList<>() : roles;
    }

    public String getOrgId() {
        return orgId;
    }

    public void setOrgId(String orgId) {
        this.orgId = orgId;
    }

    public String getOrgName() {
        return orgName;
    }

    public void setOrgName(String orgName) {
        this.orgName = orgName;
    }

    public Status getStatus() {
        return status;
    }

    public void setStatus(Status status) {
        this.status = status;
    }
}
