package com.verso.registry.service;

import com.verso.registry.domain.Entity;
import com.verso.registry.listing.FanOutRetriever;
import com.verso.registry.listing.IndexSource;
import com.verso.registry.listing.PageRequest;
import com.verso.registry.listing.TextValue;
import com.verso.registry.repository.EntityStore;
import java.util.List;

/**
 * Adapts store indexes to {@link IndexSource} for the listing engine.
 */
public final class IndexSources {
    private IndexSources() {
    }

    public static <T extends Entity> IndexSource<TextValue> textValues(EntityStore<T> store, String index) {
        return new IndexSource<>() {
            @Override
            public List<TextValue> page(String key, PageRequest page) {
                return store.pageTextValues(index, key, page);
            }

            @Override
            public List<TextValue> all(String key) {
                return store.allTextValues(index, key);
            }
        };
    }

    public static <T extends Entity> IndexSource<T> entities(EntityStore<T> store, String index) {
        return new IndexSource<>() {
            @Override
            public List<T> page(String key, PageRequest page) {
                return store.pageEntities(index, key, page);
            }

            @Override
            public List<T> all(String key) {
                return store.allEntities(index, key);
            }
        };
    }

    /**
     * Walks the primary ID order and loads each body concurrently. The key is ignored. Entities that
     * vanish between the ID read and the body fetch are left out.
     */
    public static <T extends Entity> IndexSource<T> fannedOut(EntityStore<T> store, FanOutRetriever retriever) {
        return new IndexSource<>() {
            @Override
            public List<T> page(String key, PageRequest page) {
                return retriever.fetchAll(store.pageIds(page), store::read).present();
            }

            @Override
            public List<T> all(String key) {
                return retriever.fetchAll(store.allIds(), store::read).present();
            }
        };
    }
}
