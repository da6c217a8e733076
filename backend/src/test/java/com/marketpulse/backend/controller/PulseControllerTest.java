package com.marketpulse.backend.controller;

import com.marketpulse.backend.dto.ComponentHealth;
import com.marketpulse.backend.dto.ItemQuery;
import com.marketpulse.backend.dto.StateResponse;
import com.marketpulse.backend.event.EventPage;
import com.marketpulse.backend.event.EventType;
import com.marketpulse.backend.event.PulseEvent;
import com.marketpulse.backend.model.ItemSource;
import com.marketpulse.backend.service.CommentaryService;
import com.marketpulse.backend.service.PulseQueryService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(PulseController.class)
class PulseControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PulseQueryService queryService;

    @MockBean
    private CommentaryService commentaryService;

    @Test
    void stateIsRenderedInSnakeCase() throws Exception {
        when(queryService.currentState()).thenReturn(StateResponse.builder()
                .asset("ETH-USD")
                .ema15(0.42)
                .mentions15m(7)
                .baseline7d(3.5)
                .mentionsZ(1.2)
                .alpha(0.38)
                .action("accumulate")
                .updatedAt(Instant.parse("2024-05-01T12:00:00Z"))
                .health(Map.of("oracle", new ComponentHealth(ComponentHealth.Status.OK, null, null)))
                .build());

        mockMvc.perform(get("/api/state"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.asset").value("ETH-USD"))
                .andExpect(jsonPath("$.mentions_15m").value(7))
                .andExpect(jsonPath("$.mentions_z").value(1.2))
                .andExpect(jsonPath("$.baseline_7d").value(3.5))
                .andExpect(jsonPath("$.action").value("accumulate"))
                .andExpect(jsonPath("$.updated_at").value("2024-05-01T12:00:00Z"))
                .andExpect(jsonPath("$.health.oracle.status").value("OK"));
    }

    @Test
    void unknownOrderIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/signals").param("order", "sideways"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.message").value("order must be asc or desc"))
                .andExpect(jsonPath("$.path").value("/api/signals"));

        verify(queryService, never()).listSignals(any(), any(), any(), any(), anyBoolean());
    }

    @Test
    void serviceValidationErrorsBecomeBadRequest() throws Exception {
        when(queryService.listSignals(eq(5000), isNull(), isNull(), isNull(), eq(false)))
                .thenThrow(new IllegalArgumentException("limit must be between 1 and 2000"));

        mockMvc.perform(get("/api/signals").param("limit", "5000"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("limit must be between 1 and 2000"));
    }

    @Test
    void malformedNumberIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/events").param("since_id", "abc"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void itemFiltersAreForwarded() throws Exception {
        when(queryService.listItems(any())).thenReturn(List.of());

        mockMvc.perform(get("/api/items")
                        .param("source", "social")
                        .param("q", "staking")
                        .param("min_score", "0.2")
                        .param("relevant", "true")
                        .param("since", "2024-05-01T00:00:00Z")
                        .param("order", "asc"))
                .andExpect(status().isOk());

        ArgumentCaptor<ItemQuery> captor = ArgumentCaptor.forClass(ItemQuery.class);
        verify(queryService).listItems(captor.capture());
        ItemQuery query = captor.getValue();
        assertThat(query.getSource()).isEqualTo(ItemSource.SOCIAL);
        assertThat(query.getText()).isEqualTo("staking");
        assertThat(query.getMinScore()).isEqualTo(0.2);
        assertThat(query.getRelevant()).isTrue();
        assertThat(query.getSince()).isEqualTo(Instant.parse("2024-05-01T00:00:00Z"));
        assertThat(query.isAscending()).isTrue();
    }

    @Test
    void unknownSourceIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/items").param("source", "radio"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Unknown source: radio"));
    }

    @Test
    void eventsPageCarriesGapFlag() throws Exception {
        PulseEvent event = new PulseEvent(12, EventType.SIGNAL, Instant.parse("2024-05-01T12:00:00Z"),
                "ETH-USD hold", Map.of("alpha", 0.1));
        when(queryService.eventsSince(3L, 10)).thenReturn(new EventPage(List.of(event), true, false, 12L, 12));

        mockMvc.perform(get("/api/events").param("since_id", "3").param("limit", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.gap").value(true))
                .andExpect(jsonPath("$.has_more").value(false))
                .andExpect(jsonPath("$.oldest_id").value(12))
                .andExpect(jsonPath("$.events[0].id").value(12))
                .andExpect(jsonPath("$.events[0].summary").value("ETH-USD hold"));
    }

    @Test
    void unexpectedFailureIsInternalError() throws Exception {
        when(queryService.metrics()).thenThrow(new IllegalStateException("db down"));

        mockMvc.perform(get("/api/metrics"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.message").value("Internal error"));
    }
}
