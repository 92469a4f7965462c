package com.meshnexus.controller;

import com.meshnexus.config.MeshProperties;
import com.meshnexus.model.NetworkTopology;
import com.meshnexus.model.PerformanceReport;
import com.meshnexus.realtime.RealtimeHub;
import com.meshnexus.service.CoordinatorStatusService;
import com.meshnexus.service.StatsAggregator;
import com.meshnexus.service.TopologyService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class MonitoringControllerTest {

    @Mock
    private CoordinatorStatusService statusService;

    @Mock
    private StatsAggregator statsAggregator;

    @Mock
    private TopologyService topologyService;

    @Mock
    private RealtimeHub realtimeHub;

    @Spy
    private MeshProperties properties = new MeshProperties();

    @InjectMocks
    private MonitoringController monitoringController;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(monitoringController)
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void statusCountsRealtimeClients() throws Exception {
        when(realtimeHub.sessionCount()).thenReturn(3);
        when(statusService.status(3)).thenReturn(Map.of(
                "coordinator", Map.of("clientCount", 3, "isRunning", true),
                "nodes", Map.of("total", 2, "online", 1)));

        mockMvc.perform(get("/api/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.coordinator.clientCount").value(3))
                .andExpect(jsonPath("$.nodes.online").value(1));
    }

    @Test
    void performanceUsesConfiguredWindowByDefault() throws Exception {
        PerformanceReport report = new PerformanceReport();
        report.setDataPoints(12);
        when(statsAggregator.performanceWindow(30)).thenReturn(Optional.of(report));

        mockMvc.perform(get("/api/stats/performance"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.dataPoints").value(12));
    }

    @Test
    void performanceWithoutDataSaysNoData() throws Exception {
        when(statsAggregator.performanceWindow(5)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/stats/performance").param("minutes", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("no_data"))
                .andExpect(jsonPath("$.minutes").value(5));
    }

    @Test
    void nonPositiveWindowIs400() throws Exception {
        mockMvc.perform(get("/api/stats/performance").param("minutes", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));

        verify(statsAggregator, never()).performanceWindow(anyInt());
    }

    @Test
    void topologyIsBuiltOnRequest() throws Exception {
        NetworkTopology topology = new NetworkTopology();
        topology.getNodes().add(NetworkTopology.TopologyNode.builder()
                .id("192.168.100.1").address("192.168.100.1").name("Coordinator")
                .type("coordinator").source("coordinator").status("online").build());
        topology.getMetadata().put("nodeCount", 1);
        when(topologyService.build()).thenReturn(topology);

        mockMvc.perform(get("/api/topology"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.nodes", hasSize(1)))
                .andExpect(jsonPath("$.nodes[0].type").value("coordinator"))
                .andExpect(jsonPath("$.metadata.nodeCount").value(1));
    }

    @Test
    void gatewayStatusIsReturned() throws Exception {
        when(statusService.gatewayStatus()).thenReturn(Map.of("active", true, "interface", "bat0"));

        mockMvc.perform(get("/api/gateway"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.interface").value("bat0"));
    }

    @Test
    void realtimeSessionsAreListed() throws Exception {
        when(realtimeHub.clientInfo()).thenReturn(Map.of("count", 0, "clients", List.of()));

        mockMvc.perform(get("/api/realtime/sessions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(0));
    }

    @Test
    void unexpectedFailureIs500() throws Exception {
        when(topologyService.build()).thenThrow(new IllegalStateException("route table unreadable"));

        mockMvc.perform(get("/api/topology"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("route table unreadable"));
    }
}
