package com.marketpulse.backend.controller;

import com.marketpulse.backend.event.EventStreamService;
import com.marketpulse.backend.service.PulseQueryService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;

@WebMvcTest(EventStreamController.class)
class EventStreamControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private EventStreamService eventStreamService;

    @MockBean
    private PulseQueryService queryService;

    @Test
    void cursorParameterMatchesPagedEndpoint() throws Exception {
        when(eventStreamService.open(any(), any())).thenReturn(new SseEmitter());

        mockMvc.perform(get("/api/events/stream").param("since_id", "7").header("Last-Event-ID", "3"))
                .andExpect(request().asyncStarted());

        verify(eventStreamService).open(eq(7L), any());
    }

    @Test
    void lastEventIdResumesWhenNoCursorIsGiven() throws Exception {
        when(eventStreamService.open(any(), any())).thenReturn(new SseEmitter());

        mockMvc.perform(get("/api/events/stream").header("Last-Event-ID", "12"))
                .andExpect(request().asyncStarted());

        verify(eventStreamService).open(eq(12L), any());
    }

    @Test
    void freshConnectionHasNoCursor() throws Exception {
        when(eventStreamService.open(any(), any())).thenReturn(new SseEmitter());

        mockMvc.perform(get("/api/events/stream"))
                .andExpect(request().asyncStarted());

        verify(eventStreamService).open(isNull(), any());
    }
}
