package com.meshnexus.service;

import com.meshnexus.config.CoordinatorRole;
import com.meshnexus.config.MeshProperties;
import com.meshnexus.probe.NetworkProbe;
import com.meshnexus.probe.OverlayProbe;
import com.meshnexus.util.ProbeCalls;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executor;

@Service
@CoordinatorRole
public class CoordinatorStatusService {

    private final NodeRegistry nodeRegistry;
    private final StatsAggregator statsAggregator;
    private final NetworkProbe networkProbe;
    private final OverlayProbe overlayProbe;
    private final Executor probeExecutor;
    private final Clock clock;
    private final Duration probeTimeout;
    private final Instant startedAt;

    public CoordinatorStatusService(NodeRegistry nodeRegistry,
                                    StatsAggregator statsAggregator,
                                    NetworkProbe networkProbe,
                                    OverlayProbe overlayProbe,
                                    @Qualifier("probeExecutor") Executor probeExecutor,
                                    Clock clock,
                                    MeshProperties properties) {
        this.nodeRegistry = nodeRegistry;
        this.statsAggregator = statsAggregator;
        this.networkProbe = networkProbe;
        this.overlayProbe = overlayProbe;
        this.probeExecutor = probeExecutor;
        this.clock = clock;
        this.probeTimeout = properties.getCoordinator().getProbeTimeout();
        this.startedAt = clock.instant();
    }

    /**
     * Payload of {@code GET /api/status}. Peers also use it to recognize a coordinator, so the
     * {@code coordinator} section must always be present.
     */
    public Map<String, Object> status(int clientCount) {
        Instant now = clock.instant();

        Map<String, Object> coordinator = new LinkedHashMap<>();
        coordinator.put("uptime", Duration.between(startedAt, now).getSeconds());
        coordinator.put("nodeCount", nodeRegistry.size());
        coordinator.put("clientCount", clientCount);
        coordinator.put("isRunning", true);
        coordinator.put("timestamp", now);

        Map<String, Object> status = new LinkedHashMap<>();
        status.put("coordinator", coordinator);
        Map<String, Integer> counts = new LinkedHashMap<>();
        nodeRegistry.statusCounts().forEach((nodeStatus, count) -> counts.put(nodeStatus.value(), count));
        status.put("nodes", counts);
        status.put("mesh", ProbeCalls.orDefault(probeExecutor, probeTimeout, "Mesh status",
                networkProbe::meshStatus, Map.of()));
        status.put("overlay", ProbeCalls.orDefault(probeExecutor, probeTimeout, "Overlay status",
                overlayProbe::overlayStatus, Map.of()));
        status.put("summary", statsAggregator.systemSummary());
        return status;
    }

    public Map<String, Object> gatewayStatus() {
        Map<String, Object> gateway = new LinkedHashMap<>(ProbeCalls.orDefault(probeExecutor, probeTimeout,
                "Gateway status", networkProbe::meshStatus, Map.of()));
        gateway.put("timestamp", clock.instant());
        return gateway;
    }
}
