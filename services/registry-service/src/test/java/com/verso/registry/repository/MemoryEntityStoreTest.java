package com.verso.registry.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.verso.registry.common.IdGenerator;
import com.verso.registry.common.JsonUtils;
import com.verso.registry.domain.content.Author;
import com.verso.registry.domain.content.Content;
import com.verso.registry.domain.content.ContentType;
import com.verso.registry.domain.user.User;
import com.verso.registry.listing.PageRequest;
import com.verso.registry.listing.TextValue;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class MemoryEntityStoreTest {
    private final MemoryEntityStore<Content> store =
        new MemoryEntityStore<>(EntityTables.CONTENT, JsonUtils.newObjectMapper());

    @Test
    void pagesAreContiguousAndDisjointInBothDirections() {
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            ids.add(write("Title " + i, ContentType.BOOK, "fiction").getId());
        }

        List<String> forward = new ArrayList<>();
        String offset = null;
        List<String> page;
        do {
            page = store.pageIds(PageRequest.of(false, 3, offset));
            forward.addAll(page);
            offset = page.isEmpty() ? offset : page.get(page.size() - 1);
        } while (!page.isEmpty());
        assertThat(forward).containsExactlyElementsOf(ids);

        List<TextValue> backwards = store.pageTextValues(EntityTables.TAG, "fiction", PageRequest.of(true, 2, null));
        assertThat(backwards).extracting(TextValue::id).containsExactly(ids.get(6), ids.get(5));
        List<TextValue> next = store.pageTextValues(EntityTables.TAG, "fiction", PageRequest.of(true, 2, ids.get(5)));
        assertThat(next).extracting(TextValue::id).containsExactly(ids.get(4), ids.get(3));
    }

    @Test
    void identicalRequestsReturnIdenticalPages() {
        for (int i = 0; i < 4; i++) {
            write("Title " + i, ContentType.ARTICLE, "news");
        }
        PageRequest request = PageRequest.of(false, 2, null);

        assertThat(store.pageTextValues(EntityTables.TAG, "news", request))
            .isEqualTo(store.pageTextValues(EntityTables.TAG, "news", request));
    }

    @Test
    void rewriteMovesIndexRowsAndKeepsVersions() {
        Content content = write("Dune", ContentType.BOOK, "scifi");
        String firstVersion = content.getVersionId();
        content.setTags(new ArrayList<>(List.of("classic")));
        content.setVersionId(IdGenerator.newEntityId());
        store.write(content);

        assertThat(store.allTextValues(EntityTables.TAG, "scifi")).isEmpty();
        assertThat(store.allTextValues(EntityTables.TAG, "classic")).extracting(TextValue::value)
            .containsExactly("Dune (BOOK)");
        assertThat(store.indexKeys(EntityTables.TAG)).containsExactly("classic");
        assertThat(store.readVersions(content.getId(), PageRequest.of(false, 10, null)))
            .extracting(Content::getVersionId)
            .containsExactly(firstVersion, content.getVersionId());
        assertThat(store.readVersion(content.getId(), firstVersion)).get()
            .extracting(Content::getTags)
            .isEqualTo(List.of("scifi"));
    }

    @Test
    void deleteRemovesBodyVersionsAndIndexRows() {
        Content content = write("Gone", ContentType.CHAPTER, "tmp");

        assertThat(store.delete(content.getId())).get().extracting(Content::getTitle).isEqualTo("Gone");
        assertThat(store.exists(content.getId())).isFalse();
        assertThat(store.read(content.getId())).isEmpty();
        assertThat(store.allEntities(EntityTables.TAG, "tmp")).isEmpty();
        assertThat(store.readVersions(content.getId(), PageRequest.first(5))).isEmpty();
        assertThat(store.delete(content.getId())).isEmpty();
    }

    @Test
    void entitiesByIndexAreFullBodiesInIdOrder() {
        Content first = write("One", ContentType.BOOK, "shared");
        Content second = write("Two", ContentType.ARTICLE, "shared");

        assertThat(store.allEntities(EntityTables.TAG, "shared")).extracting(Content::getId)
            .containsExactly(first.getId(), second.getId());
        assertThat(store.pageEntities(EntityTables.TYPE, "ARTICLE", PageRequest.first(5))).extracting(Content::getTitle)
            .containsExactly("Two");
    }

    @Test
    void repeatedAndBlankKeysAreFiledOnce() {
        Content content = write("Good Omens", ContentType.BOOK, "fantasy");
        content.setTags(new ArrayList<>(Arrays.asList("fantasy", null, " ", "fantasy")));
        content.setAuthors(new ArrayList<>(List.of(
            new Author("Terry", null, null),
            new Author("Terry", null, null),
            new Author("Neil", null, null)
        )));
        store.write(content);

        assertThat(store.indexKeys(EntityTables.TAG)).containsExactly("fantasy");
        assertThat(store.indexKeys(EntityTables.AUTHOR)).containsExactly("Neil", "Terry");
        assertThat(store.allTextValues(EntityTables.AUTHOR, "Terry")).hasSize(1);

        store.delete(content.getId());
        assertThat(store.indexKeys(EntityTables.AUTHOR)).isEmpty();
    }

    @Test
    void nullRolesNeverReachTheIndex() {
        MemoryEntityStore<User> users = new MemoryEntityStore<>(EntityTables.USERS, JsonUtils.newObjectMapper());
        String id = IdGenerator.newEntityId();
        User user = new User();
        user.setId(id);
        user.setVersionId(id);
        user.setCreatedAt(Instant.now());
        user.setUpdatedAt(Instant.now());
        user.setEmail("ada@example.com");
        user.setRoles(new ArrayList<>(Arrays.asList("admin", null, "admin")));

        users.write(user);

        assertThat(users.indexKeys(EntityTables.ROLE)).containsExactly("admin");
    }

    @Test
    void keysOverTheLimitAreReportedAsProblems() {
        Content content = new Content();
        content.setTags(new ArrayList<>(List.of("x".repeat(IndexDefinition.MAX_KEY_LENGTH + 1))));

        assertThat(EntityTables.CONTENT.keyProblems(content)).containsExactly("tag value is longer than 512 characters");
    }

    @Test
    void unknownIndexIsRejected() {
        assertThatThrownBy(() -> store.indexKeys("colour")).isInstanceOf(IllegalArgumentException.class);
    }

    private Content write(String title, ContentType type, String tag) {
        String id = IdGenerator.newEntityId();
        Content content = new Content();
        content.setId(id);
        content.setVersionId(id);
        content.setCreatedAt(Instant.now());
        content.setUpdatedAt(Instant.now());
        content.setTitle(title);
        content.setType(type);
        content.setTags(new ArrayList<>(List.of(tag)));
        store.write(content);
        return content;
    }
}
