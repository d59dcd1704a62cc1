package com.verso.registry.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.verso.registry.common.JsonUtils;
import com.verso.registry.domain.Status;
import com.verso.registry.domain.org.Organization;
import com.verso.registry.domain.user.User;
import com.verso.registry.listing.PageRequest;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;

@ExtendWith(MockitoExtension.class)
class JdbcEntityStoreTest {
    private static final String ID = "0123456789abcdef";

    @Mock
    private JdbcTemplate jdbcTemplate;

    private JdbcEntityStore<Organization> newStore() {
        return new JdbcEntityStore<>(EntityTables.ORGANIZATIONS, jdbcTemplate, JsonUtils.newObjectMapper());
    }

    @Test
    void forwardPageReadsAfterTheOffsetAscending() {
        when(jdbcTemplate.queryForList(anyString(), eq(String.class), any(Object[].class))).thenReturn(List.of(ID));

        List<String> ids = newStore().pageIds(PageRequest.of(false, 10, null));

        assertThat(ids).containsExactly(ID);
        verify(jdbcTemplate).queryForList(
            "SELECT id FROM entity_current WHERE entity_type = ? AND id > ? ORDER BY id ASC LIMIT ?",
            String.class,
            "organization",
            "-",
            10
        );
    }

    @Test
    void reversePageReadsBeforeTheOffsetDescending() {
        when(jdbcTemplate.queryForList(anyString(), eq(String.class), any(Object[].class))).thenReturn(List.of());

        newStore().pageIds(PageRequest.of(true, 5, ID));

        verify(jdbcTemplate).queryForList(
            "SELECT id FROM entity_current WHERE entity_type = ? AND id < ? ORDER BY id DESC LIMIT ?",
            String.class,
            "organization",
            ID,
            5
        );
    }

    @Test
    void writeReplacesIndexRowsForTheEntity() {
        when(jdbcTemplate.update(anyString(), any(Object[].class))).thenReturn(1);
        Organization organization = new Organization();
        organization.setId(ID);
        organization.setVersionId(ID);
        organization.setCreatedAt(Instant.parse("2024-05-01T00:00:00Z"));
        organization.setUpdatedAt(Instant.parse("2024-05-01T00:00:00Z"));
        organization.setName("Acme");
        organization.setStatus(Status.ENABLED);

        newStore().write(organization);

        verify(jdbcTemplate).update("DELETE FROM entity_index WHERE entity_type = ? AND id = ?", "organization", ID);
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<Object[]>> rows = ArgumentCaptor.forClass(List.class);
        verify(jdbcTemplate).batchUpdate(
            eq("INSERT INTO entity_index (entity_type, index_name, index_key, id, text_value) VALUES (?, ?, ?, ?, ?)"),
            rows.capture()
        );
        assertThat(rows.getValue()).extracting(row -> row[1] + "=" + row[2])
            .containsExactlyInAnyOrder("status=ENABLED", "all=*");
        assertThat(rows.getValue()).allSatisfy(row -> assertThat(row[4]).isEqualTo("Acme"));
    }

    @Test
    void writeInsertsOneIndexRowPerDistinctKey() {
        when(jdbcTemplate.update(anyString(), any(Object[].class))).thenReturn(1);
        JdbcEntityStore<User> users = new JdbcEntityStore<>(EntityTables.USERS, jdbcTemplate, JsonUtils.newObjectMapper());
        User user = new User();
        user.setId(ID);
        user.setVersionId(ID);
        user.setCreatedAt(Instant.parse("2024-05-01T00:00:00Z"));
        user.setUpdatedAt(Instant.parse("2024-05-01T00:00:00Z"));
        user.setEmail("ada@example.com");
        user.setRoles(new ArrayList<>(Arrays.asList("admin", null, "", "admin", "editor")));

        users.write(user);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<Object[]>> rows = ArgumentCaptor.forClass(List.class);
        verify(jdbcTemplate).batchUpdate(anyString(), rows.capture());
        assertThat(rows.getValue())
            .filteredOn(row -> "role".equals(row[1]))
            .extracting(row -> row[2])
            .containsExactly("admin", "editor");
        assertThat(rows.getValue()).allSatisfy(row -> assertThat(row[2]).isNotNull());
    }

    @Test
    void dataAccessFailuresBecomeStoreExceptions() {
        when(jdbcTemplate.queryForList(anyString(), eq(String.class), any(Object[].class)))
            .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(() -> newStore().read(ID))
            .isInstanceOf(StoreException.class)
            .hasMessage("read organization failed")
            .hasCauseInstanceOf(DataAccessResourceFailureException.class);
    }

    @Test
    void readDecodesStoredJson() {
        when(jdbcTemplate.queryForList(anyString(), eq(String.class), any(Object[].class)))
            .thenReturn(List.of("{\"id\":\"" + ID + "\",\"name\":\"Acme\",\"status\":\"DISABLED\"}"));

        assertThat(newStore().read(ID)).get()
            .extracting(Organization::getName, Organization::getStatus)
            .containsExactly("Acme", Status.DISABLED);
    }

    @Test
    void indexKeysAreDistinctAndOrdered() {
        when(jdbcTemplate.queryForList(anyString(), eq(String.class), any(Object[].class)))
            .thenReturn(List.of("DISABLED", "ENABLED"));

        assertThat(newStore().indexKeys(EntityTables.STATUS)).containsExactly("DISABLED", "ENABLED");
        verify(jdbcTemplate).queryForList(
            "SELECT DISTINCT index_key FROM entity_index WHERE entity_type = ? AND index_name = ? ORDER BY index_key",
            String.class,
            "organization",
            "status"
        );
    }
}
