package com.meshnexus.controller;

import com.meshnexus.config.CoordinatorRole;
import com.meshnexus.config.MeshProperties;
import com.meshnexus.model.NetworkTopology;
import com.meshnexus.model.StatsSnapshot;
import com.meshnexus.realtime.RealtimeHub;
import com.meshnexus.service.CoordinatorStatusService;
import com.meshnexus.service.StatsAggregator;
import com.meshnexus.service.TopologyService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api")
@CoordinatorRole
public class MonitoringController {

    @Autowired
    private CoordinatorStatusService statusService;

    @Autowired
    private StatsAggregator statsAggregator;

    @Autowired
    private TopologyService topologyService;

    @Autowired
    private RealtimeHub realtimeHub;

    @Autowired
    private MeshProperties properties;

    @GetMapping("/status")
    public Map<String, Object> getStatus() {
        return statusService.status(realtimeHub.sessionCount());
    }

    @GetMapping("/stats")
    public StatsSnapshot getStats() {
        return statsAggregator.latest();
    }

    @GetMapping("/stats/performance")
    public Object getPerformance(@RequestParam(required = false) Integer minutes) {
        int window = minutes != null ? minutes : properties.getStats().getPerformanceWindowMinutes();
        if (window <= 0) {
            throw new IllegalArgumentException("minutes must be positive");
        }
        return statsAggregator.performanceWindow(window)
                .<Object>map(report -> report)
                .orElse(Map.of("status", "no_data", "minutes", window));
    }

    @GetMapping("/topology")
    public NetworkTopology getTopology() {
        return topologyService.build();
    }

    @GetMapping("/gateway")
    public Map<String, Object> getGateway() {
        return statusService.gatewayStatus();
    }

    @GetMapping("/realtime/sessions")
    public Map<String, Object> getRealtimeSessions() {
        return realtimeHub.clientInfo();
    }
}
