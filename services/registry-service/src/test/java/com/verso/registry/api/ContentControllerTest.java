package com.verso.registry.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.head;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.verso.registry.audit.AuditService;
import com.verso.registry.audit.MutationAuditFilter;
import com.verso.registry.common.ApiExceptionHandler;
import com.verso.registry.common.BadRequestException;
import com.verso.registry.common.NotFoundException;
import com.verso.registry.common.RegistryRequestContextFilter;
import com.verso.registry.domain.content.Content;
import com.verso.registry.domain.content.ContentType;
import com.verso.registry.domain.event.LogLevel;
import com.verso.registry.listing.FanOutTimeoutException;
import com.verso.registry.listing.TextValue;
import com.verso.registry.repository.StoreException;
import com.verso.registry.service.ContentService;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class ContentControllerTest {
    private static final String ID = "0123456789abcdef";

    @Mock
    private ContentService contentService;

    @Mock
    private AuditService auditService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new ContentController(contentService))
            .setControllerAdvice(new ApiExceptionHandler(auditService))
            .addFilters(new RegistryRequestContextFilter(), new MutationAuditFilter(auditService))
            .build();
    }

    @Test
    void titlesListingPassesQueryThrough() throws Exception {
        when(contentService.listTextValues(Map.of("tag", "fiction", "limit", "2")))
            .thenReturn(List.of(new TextValue(ID, "Dune (BOOK)")));

        mockMvc.perform(get("/v1/content_titles").param("tag", "fiction").param("limit", "2"))
            .andExpect(status().isOk())
            .andExpect(header().exists("x-request-id"))
            .andExpect(jsonPath("$[0].id").value(ID))
            .andExpect(jsonPath("$[0].value").value("Dune (BOOK)"));
    }

    @Test
    void badParameterIsA400WithoutAudit() throws Exception {
        when(contentService.listTextValues(anyMap())).thenThrow(BadRequestException.invalid("limit", "0"));

        mockMvc.perform(get("/v1/content_titles").param("limit", "0"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("bad_request"))
            .andExpect(jsonPath("$.error.message").value("invalid parameter, limit: 0"))
            .andExpect(jsonPath("$.error.parameter").value("limit"))
            .andExpect(jsonPath("$.request_id").exists());

        verify(auditService, never()).record(any(), any(), any(), any());
    }

    @Test
    void missingEntityIsA404() throws Exception {
        when(contentService.read(ID)).thenThrow(new NotFoundException("content", ID));

        mockMvc.perform(get("/v1/contents/" + ID))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error.code").value("not_found"));
    }

    @Test
    void headReportsExistence() throws Exception {
        when(contentService.exists(ID)).thenReturn(true);

        mockMvc.perform(head("/v1/contents/" + ID)).andExpect(status().isNoContent());
    }

    @Test
    void createReturns201AndIsAudited() throws Exception {
        Content created = new Content();
        created.setId(ID);
        created.setTitle("Dune");
        created.setType(ContentType.BOOK);
        when(contentService.create(any(Content.class))).thenReturn(created);

        mockMvc.perform(post("/v1/contents")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"type\":\"BOOK\",\"title\":\"Dune\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.id").value(ID))
            .andExpect(jsonPath("$.type").value("BOOK"));

        verify(auditService).record(eq(LogLevel.INFO), eq("content"), any(), eq("POST /v1/contents 201"));
    }

    @Test
    void storeFailureIsA500WithOneErrorEvent() throws Exception {
        when(contentService.list(anyMap())).thenThrow(new StoreException("read content failed", null));

        mockMvc.perform(get("/v1/contents"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.error.code").value("internal_error"));

        verify(auditService).record(eq(LogLevel.ERROR), any(), any(), any());
    }

    @Test
    void fanOutTimeoutIsA503() throws Exception {
        when(contentService.list(anyMap())).thenThrow(new FanOutTimeoutException("timed out fetching 20 entities"));

        mockMvc.perform(get("/v1/contents"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.error.code").value("fan_out_timeout"));
    }

    @Test
    void unknownIndexKeysEndpointIsA404() throws Exception {
        mockMvc.perform(get("/v1/content_colours"))
            .andExpect(status().isNotFound());

        verify(contentService, never()).indexKeys(any());
    }
}
