package com.verso.registry.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.verso.registry.common.BadRequestException;
import com.verso.registry.common.JsonUtils;
import com.verso.registry.common.NotFoundException;
import com.verso.registry.config.RegistryProperties;
import com.verso.registry.domain.content.Author;
import com.verso.registry.domain.content.Content;
import com.verso.registry.domain.content.ContentType;
import com.verso.registry.listing.FanOutRetriever;
import com.verso.registry.listing.ListingEngine;
import com.verso.registry.listing.TextValue;
import com.verso.registry.repository.EntityTables;
import com.verso.registry.repository.MemoryEntityStore;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ContentServiceTest {
    private final ExecutorService executor = Executors.newFixedThreadPool(4);
    private ContentService service;

    @BeforeEach
    void setUp() {
        RegistryProperties properties = new RegistryProperties();
        properties.getListing().setContentLimit(2);
        service = new ContentService(
            new MemoryEntityStore<>(EntityTables.CONTENT, JsonUtils.newObjectMapper()),
            new ListingEngine(),
            new FanOutRetriever(executor, 5_000L),
            properties
        );
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void createAssignsIdentityAndDerivedFields() {
        Content created = service.create(content("Dune", ContentType.BOOK, "Frank Herbert", " SciFi ", "scifi"));

        assertThat(created.getId()).hasSize(16);
        assertThat(created.getVersionId()).isEqualTo(created.getId());
        assertThat(created.getCreatedAt()).isNotNull().isEqualTo(created.getUpdatedAt());
        assertThat(created.getTags()).containsExactly("scifi");
        assertThat(created.getWordCount()).isEqualTo(4);
        assertThat(service.read(created.getId()).getTitle()).isEqualTo("Dune");
    }

    @Test
    void createRejectsInvalidContentListingEveryProblem() {
        Content invalid = new Content();

        assertThatThrownBy(() -> service.create(invalid))
            .isInstanceOf(BadRequestException.class)
            .hasMessageContaining("Type is missing")
            .hasMessageContaining("Title is missing");
    }

    @Test
    void updateAddsVersionAndKeepsCreationTime() {
        Content created = service.create(content("Draft", ContentType.ARTICLE, "Ann", "news"));
        Content change = content("Final", ContentType.ARTICLE, "Ann", "news");

        Content updated = service.update(created.getId(), change);

        assertThat(updated.getId()).isEqualTo(created.getId());
        assertThat(updated.getCreatedAt()).isEqualTo(created.getCreatedAt());
        assertThat(updated.getVersionId()).isNotEqualTo(created.getVersionId());
        assertThat(service.versions(created.getId(), Map.of())).extracting(Content::getTitle)
            .containsExactly("Draft", "Final");
        assertThat(service.versions(created.getId(), Map.of("reverse", "true", "limit", "1")))
            .extracting(Content::getTitle)
            .containsExactly("Final");
        assertThat(service.version(created.getId(), created.getVersionId()).getTitle()).isEqualTo("Draft");
    }

    @Test
    void tagListingPagesSortsAndSearches() {
        String t1 = service.create(content("The Dragon Reborn", ContentType.BOOK, "Robert", "fiction")).getId();
        String t2 = service.create(content("Castles", ContentType.BOOK, "Ann", "fiction")).getId();
        String t3 = service.create(content("Dragon Eggs", ContentType.CHAPTER, "Ann", "fiction")).getId();

        assertThat(service.listTextValues(Map.of("tag", "fiction", "limit", "2")))
            .extracting(TextValue::id).containsExactly(t1, t2);
        assertThat(service.listTextValues(Map.of("tag", "fiction", "limit", "2", "offset", t2)))
            .extracting(TextValue::id).containsExactly(t3);
        assertThat(service.listTextValues(Map.of("tag", "fiction", "sorted", "true", "limit", "1")))
            .extracting(TextValue::value)
            .containsExactly("Castles (BOOK)", "Dragon Eggs (CHAPTER)", "The Dragon Reborn (BOOK)");
        assertThat(service.listTextValues(Map.of("tag", "fiction", "search", "Dragon", "any", "false")))
            .extracting(TextValue::id).containsExactly(t1, t3);
    }

    @Test
    void typeTakesPrecedenceOverAuthor() {
        service.create(content("Alpha", ContentType.BOOK, "Jane", "a"));
        service.create(content("Beta", ContentType.ARTICLE, "Jane", "b"));

        List<TextValue> both = service.listTextValues(Map.of("type", "BOOK", "author", "Jane"));

        assertThat(both).isEqualTo(service.listTextValues(Map.of("type", "book")));
        assertThat(both).extracting(TextValue::value).containsExactly("Alpha (BOOK)");
    }

    @Test
    void unfilteredEntityListingPagesWithTheContentDefault() {
        String first = service.create(content("One", ContentType.BOOK, "A", "x")).getId();
        String second = service.create(content("Two", ContentType.BOOK, "A", "x")).getId();
        String third = service.create(content("Three", ContentType.BOOK, "A", "x")).getId();

        assertThat(service.list(Map.of())).extracting(Content::getId).containsExactly(first, second);
        assertThat(service.list(Map.of("offset", second))).extracting(Content::getId).containsExactly(third);
        assertThat(service.list(Map.of("sorted", "true"))).extracting(Content::getTitle)
            .containsExactly("One", "Three", "Two");
    }

    @Test
    void indexKeysListDistinctValues() {
        service.create(content("One", ContentType.BOOK, "Ann", "poetry"));
        service.create(content("Two", ContentType.ARTICLE, "Ann", "essays"));

        assertThat(service.indexKeys(EntityTables.TAG)).containsExactly("essays", "poetry");
        assertThat(service.indexKeys(EntityTables.AUTHOR)).containsExactly("Ann");
    }

    @Test
    void readValidatesIdShapeBeforeLookingUp() {
        assertThatThrownBy(() -> service.read("bad")).isInstanceOf(BadRequestException.class);
        assertThatThrownBy(() -> service.read("0123456789abcdef")).isInstanceOf(NotFoundException.class);
        assertThat(service.exists("0123456789abcdef")).isFalse();
    }

    @Test
    void deleteReturnsLastVersionThenNotFound() {
        Content created = service.create(content("Temp", ContentType.CATEGORY, "Ann", "tmp"));

        assertThat(service.delete(created.getId()).getTitle()).isEqualTo("Temp");
        assertThatThrownBy(() -> service.delete(created.getId())).isInstanceOf(NotFoundException.class);
        assertThat(service.listTextValues(Map.of("tag", "tmp"))).isEmpty();
    }

    @Test
    void entitiesDeletedBetweenIdReadAndFetchAreDropped() {
        VanishingStore store = new VanishingStore();
        ContentService racing = new ContentService(store, new ListingEngine(), new FanOutRetriever(executor, 5_000L),
            new RegistryProperties());
        String first = racing.create(content("One", ContentType.BOOK, "A", "x")).getId();
        String second = racing.create(content("Two", ContentType.BOOK, "A", "x")).getId();
        String third = racing.create(content("Three", ContentType.BOOK, "A", "x")).getId();
        store.vanished.add(second);

        assertThat(racing.list(Map.of("limit", "3"))).extracting(Content::getId).containsExactly(first, third);
    }

    @Test
    void deletingTheCurrentVersionRestoresThePreviousOne() {
        Content created = service.create(content("Draft", ContentType.ARTICLE, "Ann", "drafts"));
        Content updated = service.update(created.getId(), content("Final", ContentType.ARTICLE, "Ann", "final"));

        assertThat(service.versionExists(created.getId(), updated.getVersionId())).isTrue();
        assertThat(service.deleteVersion(created.getId(), updated.getVersionId()).getTitle()).isEqualTo("Final");

        assertThat(service.versionExists(created.getId(), updated.getVersionId())).isFalse();
        assertThat(service.read(created.getId()).getTitle()).isEqualTo("Draft");
        assertThat(service.listTextValues(Map.of("tag", "drafts"))).extracting(TextValue::id)
            .containsExactly(created.getId());
        assertThat(service.listTextValues(Map.of("tag", "final"))).isEmpty();

        service.deleteVersion(created.getId(), created.getVersionId());
        assertThat(service.exists(created.getId())).isFalse();
        assertThatThrownBy(() -> service.deleteVersion(created.getId(), created.getVersionId()))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    void oversizedIndexValuesAreRejectedBeforeWriting() {
        Content content = content("Long", ContentType.BOOK, "Ann", "t".repeat(600));

        assertThatThrownBy(() -> service.create(content))
            .isInstanceOf(BadRequestException.class)
            .hasMessageContaining("tag value is longer than 512 characters");
    }

    private static Content content(String title, ContentType type, String author, String... tags) {
        Content content = new Content();
        content.setTitle(title);
        content.setType(type);
        content.setBody("a b  c\nd");
        content.setAuthors(new ArrayList<>(List.of(new Author(author, null, null))));
        content.setTags(new ArrayList<>(List.of(tags)));
        return content;
    }

    private static final class VanishingStore extends MemoryEntityStore<Content> {
        private final Set<String> vanished = ConcurrentHashMap.newKeySet();

        private VanishingStore() {
            super(EntityTables.CONTENT, JsonUtils.newObjectMapper());
        }

        @Override
        public Optional<Content> read(String id) {
            return vanished.contains(id) ? Optional.empty() : super.read(id);
        }
    }
}
