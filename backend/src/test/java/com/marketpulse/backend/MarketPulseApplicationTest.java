package com.marketpulse.backend;

import com.marketpulse.backend.event.EventBusService;
import com.marketpulse.backend.event.EventType;
import com.marketpulse.backend.service.loop.LoopOrchestrator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class MarketPulseApplicationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private LoopOrchestrator loopOrchestrator;

    @Autowired
    private EventBusService eventBusService;

    @Test
    void loopsStayStoppedWhenAutoStartIsOff() {
        assertThat(loopOrchestrator.isRunning()).isFalse();
    }

    @Test
    void emptyStoreReportsHold() throws Exception {
        mockMvc.perform(get("/api/state"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.asset").value("ETH-USD"))
                .andExpect(jsonPath("$.action").value("hold"))
                .andExpect(jsonPath("$.mentions_15m").value(0));
    }

    @Test
    void publishedEventsAreReadableByCursor() throws Exception {
        long before = eventBusService.latestId();
        eventBusService.publish(EventType.STATE, "smoke", Map.of("ok", true));

        mockMvc.perform(get("/api/events").param("since_id", String.valueOf(before)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.gap").value(false))
                .andExpect(jsonPath("$.events[0].summary").value("smoke"));
    }

    @Test
    void badLimitIsRejected() throws Exception {
        mockMvc.perform(get("/api/items").param("limit", "0"))
                .andExpect(status().isBadRequest());
    }
}
