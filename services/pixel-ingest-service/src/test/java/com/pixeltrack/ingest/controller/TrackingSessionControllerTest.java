package com.pixeltrack.ingest.controller;

import com.pixeltrack.ingest.config.IngestionProperties;
import com.pixeltrack.ingest.dto.SessionUpsertRequest;
import com.pixeltrack.ingest.entity.TrackingSession;
import com.pixeltrack.ingest.service.TrackingSessionService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = TrackingSessionController.class)
@EnableConfigurationProperties(IngestionProperties.class)
@DisplayName("TrackingSessionController Tests")
class TrackingSessionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TrackingSessionService trackingSessionService;

    @Test
    @DisplayName("Should bind snake_case fields and return the stored session")
    void shouldUpsertSession() throws Exception {
        // Given
        when(trackingSessionService.upsert(any(SessionUpsertRequest.class))).thenReturn(TrackingSession.builder()
            .sessionId("s-1").clientId("c-1").firstPage("/a").lastPage("/b").build());

        // When
        mockMvc.perform(post("/sessions").contentType(MediaType.APPLICATION_JSON)
                .content("{\"session_id\":\"s-1\",\"client_id\":\"c-1\",\"last_page\":\"/b\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.first_page").value("/a"))
            .andExpect(jsonPath("$.last_page").value("/b"));

        // Then
        ArgumentCaptor<SessionUpsertRequest> captor = ArgumentCaptor.forClass(SessionUpsertRequest.class);
        verify(trackingSessionService).upsert(captor.capture());
        assertThat(captor.getValue().getLastPage()).isEqualTo("/b");
        assertThat(captor.getValue().getFirstPage()).isNull();
    }

    @Test
    @DisplayName("Should reject a session without id")
    void shouldRejectMissingSessionId() throws Exception {
        mockMvc.perform(post("/sessions").contentType(MediaType.APPLICATION_JSON).content("{\"client_id\":\"c-1\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.details.sessionId").value("session_id is required"));

        verifyNoInteractions(trackingSessionService);
    }
}
