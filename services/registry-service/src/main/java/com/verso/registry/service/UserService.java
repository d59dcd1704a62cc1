package com.verso.registry.service;

import com.verso.registry.common.BadRequestException;
import com.verso.registry.config.RegistryProperties;
import com.verso.registry.domain.Status;
import com.verso.registry.domain.user.User;
import com.verso.registry.listing.FanOutRetriever;
import com.verso.registry.listing.FilterValues;
import com.verso.registry.listing.ListingEngine;
import com.verso.registry.listing.TextValue;
import com.verso.registry.repository.EntityStore;
import com.verso.registry.repository.EntityTables;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;
import org.springframework.stereotype.Service;

/**
 * Users. Passwords are hashed on write and never returned.
 */
@Service
public class UserService extends EntityService<User> {

    public UserService(
        EntityStore<User> userStore,
        ListingEngine listingEngine,
        FanOutRetriever retriever,
        RegistryProperties properties
    ) {
        super(userStore, listingEngine, retriever, properties, properties.getListing().getEntityLimit(), List.of(
            new Filter(EntityTables.EMAIL, FilterValues.email()),
            new Filter(EntityTables.ORG, FilterValues.entityId()),
            new Filter(EntityTables.ROLE, FilterValues.text()),
            new Filter(EntityTables.STATUS, FilterValues.enumValue(Status.class))
        ));
    }

    /**
     * IDs of the users registered under an email address, oldest first.
     */
    public List<String> idsByEmail(String email) {
        if (email == null || email.isBlank()) {
            throw new BadRequestException(EntityTables.EMAIL, "email is required");
        }
        String key = FilterValues.email().normalize(EntityTables.EMAIL, email);
        return store.allTextValues(EntityTables.EMAIL, key).stream().map(TextValue::id).toList();
    }

    /**
     * True when the stored hash matches the given password.
     */
    public boolean checkPassword(String id, String password) {
        User user = load(id);
        return password != null && user.getPasswordHash() != null
            && MessageDigest.isEqual(
                hashPassword(id, password).getBytes(StandardCharsets.UTF_8),
                user.getPasswordHash().getBytes(StandardCharsets.UTF_8)
            );
    }

    @Override
    protected void prepare(User user, Optional<User> previous, Instant now) {
        user.setEmail(User.standardizeEmail(user.getEmail()));
        user.setRoles(user.getRoles().stream()
            .filter(role -> role != null && !role.isBlank())
            .map(role -> role.trim().toLowerCase(Locale.ROOT))
            .distinct()
            .collect(Collectors.toCollection(ArrayList::new)));
        if (user.getStatus() == null) {
            user.setStatus(Status.PENDING);
        }
        if (user.getPassword() != null && !user.getPassword().isEmpty()) {
            user.setPasswordHash(hashPassword(user.getId(), user.getPassword()));
        } else {
            user.setPasswordHash(previous.map(User::getPasswordHash).orElse(null));
        }
        user.setPassword(null);
    }

    @Override
    protected User present(User user) {
        return user.scrub();
    }

    static String hashPassword(String salt, String password) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hashed = digest.digest((salt + ":" + password).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hashed);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
