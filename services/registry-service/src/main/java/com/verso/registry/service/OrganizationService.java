package com.verso.registry.service;

import com.verso.registry.config.RegistryProperties;
import com.verso.registry.domain.Status;
import com.verso.registry.domain.org.Organization;
import com.verso.registry.listing.FanOutRetriever;
import com.verso.registry.listing.FilterValues;
import com.verso.registry.listing.ListingEngine;
import com.verso.registry.repository.EntityStore;
import com.verso.registry.repository.EntityTables;
import java.util.List;
import org.springframework.stereotype.Service;

@Service
public class OrganizationService extends EntityService<Organization> {

    public OrganizationService(
        EntityStore<Organization> organizationStore,
        ListingEngine listingEngine,
        FanOutRetriever retriever,
        RegistryProperties properties
    ) {
        super(organizationStore, listingEngine, retriever, properties, properties.getListing().getEntityLimit(), List.of(
            new Filter(EntityTables.STATUS, FilterValues.enumValue(Status.class))
        ));
    }
}
