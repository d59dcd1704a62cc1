package com.verso.registry.service;

import com.verso.registry.config.RegistryProperties;
import com.verso.registry.domain.email.Email;
import com.verso.registry.domain.email.EmailStatus;
import com.verso.registry.listing.FanOutRetriever;
import com.verso.registry.listing.FilterValues;
import com.verso.registry.listing.ListingEngine;
import com.verso.registry.repository.EntityStore;
import com.verso.registry.repository.EntityTables;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Service;

/**
 * Outbound email records. Delivery happens elsewhere; this service only tracks messages and their
 * status.
 */
@Service
public class EmailService extends EntityService<Email> {

    public EmailService(
        EntityStore<Email> emailStore,
        ListingEngine listingEngine,
        FanOutRetriever retriever,
        RegistryProperties properties
    ) {
        super(emailStore, listingEngine, retriever, properties, properties.getListing().getEntityLimit(), List.of(
            new Filter(EntityTables.ADDRESS, FilterValues.email()),
            new Filter(EntityTables.STATUS, FilterValues.enumValue(EmailStatus.class))
        ));
    }

    @Override
    protected void prepare(Email email, Optional<Email> previous, Instant now) {
        if (email.getStatus() == null) {
            email.setStatus(EmailStatus.PENDING);
        }
    }
}
