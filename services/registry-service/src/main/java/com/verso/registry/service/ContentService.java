package com.verso.registry.service;

import com.verso.registry.config.RegistryProperties;
import com.verso.registry.domain.content.Content;
import com.verso.registry.domain.content.ContentType;
import com.verso.registry.listing.FanOutRetriever;
import com.verso.registry.listing.FilterValues;
import com.verso.registry.listing.ListingEngine;
import com.verso.registry.repository.EntityStore;
import com.verso.registry.repository.EntityTables;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Service;

@Service
public class ContentService extends EntityService<Content> {

    public ContentService(
        EntityStore<Content> contentStore,
        ListingEngine listingEngine,
        FanOutRetriever retriever,
        RegistryProperties properties
    ) {
        super(contentStore, listingEngine, retriever, properties, properties.getListing().getContentLimit(), List.of(
            new Filter(EntityTables.TYPE, FilterValues.enumValue(ContentType.class)),
            new Filter(EntityTables.AUTHOR, FilterValues.text()),
            new Filter(EntityTables.EDITOR, FilterValues.entityId()),
            new Filter(EntityTables.TAG, FilterValues.lowerCase())
        ));
    }

    @Override
    protected void prepare(Content content, Optional<Content> previous, Instant now) {
        content.normalizeTags();
        content.setWordCount(content.countWords());
    }
}
