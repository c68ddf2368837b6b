package com.brandmetrics.backend.controller;

import com.brandmetrics.backend.config.JacksonConfig;
import com.brandmetrics.backend.config.RefresherConfig;
import com.brandmetrics.backend.model.MetricsPayload;
import com.brandmetrics.backend.model.MetricsSnapshot;
import com.brandmetrics.backend.service.MetricsSnapshotService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class MetricsControllerTest {

    @Mock
    private MetricsSnapshotService metricsSnapshotService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        RefresherConfig config = RefresherConfig.builder().tenant("brandA").tenant("brandB").build();
        mockMvc = MockMvcBuilders
                .standaloneSetup(new MetricsController(metricsSnapshotService), new HealthController(config))
                .setMessageConverters(new MappingJackson2HttpMessageConverter(JacksonConfig.snapshotMapper()))
                .build();
    }

    @Test
    void testGetSnapshot_Cached_200() throws Exception {
        MetricsSnapshot snapshot = MetricsSnapshot.builder()
                .tenantId("brandA")
                .fetchedAt(Instant.parse("2024-05-01T10:00:00Z"))
                .payload(MetricsPayload.ofCounts(Map.of("orders", 5L)))
                .build();
        when(metricsSnapshotService.getSnapshot("brandA")).thenReturn(Optional.of(snapshot));

        mockMvc.perform(get("/api/v1/metrics/brandA"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tenantId").value("brandA"))
                .andExpect(jsonPath("$.fetchedAt").value("2024-05-01T10:00:00Z"))
                .andExpect(jsonPath("$.payload.counts.orders").value(5));
    }

    @Test
    void testGetSnapshot_NoRecentData_204() throws Exception {
        when(metricsSnapshotService.getSnapshot("brandB")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/metrics/brandB"))
                .andExpect(status().isNoContent())
                .andExpect(content().string(""));
    }

    @Test
    void testGetAllSnapshots() throws Exception {
        when(metricsSnapshotService.getAllSnapshots()).thenReturn(Map.of("brandA", MetricsSnapshot.builder()
                .tenantId("brandA")
                .payload(MetricsPayload.ofCounts(Map.of("orders", 1L)))
                .build()));

        mockMvc.perform(get("/api/v1/metrics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.brandA.payload.counts.orders").value(1));
    }

    @Test
    void testHealth() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true))
                .andExpect(jsonPath("$.brands[0]").value("brandA"))
                .andExpect(jsonPath("$.brands[1]").value("brandB"));
    }
}
