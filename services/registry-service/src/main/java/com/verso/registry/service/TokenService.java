package com.verso.registry.service;

import com.verso.registry.common.NotFoundException;
import com.verso.registry.config.RegistryProperties;
import com.verso.registry.domain.token.Token;
import com.verso.registry.listing.FanOutRetriever;
import com.verso.registry.listing.FilterValues;
import com.verso.registry.listing.ListingEngine;
import com.verso.registry.repository.EntityStore;
import com.verso.registry.repository.EntityTables;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Service;

/**
 * Bearer tokens. An expired token reads as missing.
 */
@Service
public class TokenService extends EntityService<Token> {

    public TokenService(
        EntityStore<Token> tokenStore,
        ListingEngine listingEngine,
        FanOutRetriever retriever,
        RegistryProperties properties
    ) {
        super(tokenStore, listingEngine, retriever, properties, properties.getListing().getEntityLimit(), List.of(
            new Filter(EntityTables.USER, FilterValues.entityId())
        ));
    }

    @Override
    public boolean exists(String id) {
        return super.exists(id) && !store.read(id).map(token -> token.isExpired(Instant.now())).orElse(true);
    }

    @Override
    protected Token load(String id) {
        Token token = super.load(id);
        if (token.isExpired(Instant.now())) {
            throw new NotFoundException(getEntityType(), id);
        }
        return token;
    }

    @Override
    protected void prepare(Token token, Optional<Token> previous, Instant now) {
        if (token.getExpiresAt() == null) {
            token.setExpiresAt(now.plus(Duration.ofDays(getProperties().getRetention().getTokenDays())));
        }
    }
}
