package com.meshnexus.heartbeat;

import com.meshnexus.config.MeshProperties;
import com.meshnexus.config.NodeRole;
import com.meshnexus.model.HeartbeatRecord;
import com.meshnexus.model.NodeStatus;
import com.meshnexus.model.SystemMetrics;
import com.meshnexus.probe.NetworkProbe;
import com.meshnexus.probe.OverlayProbe;
import com.meshnexus.probe.SystemProbe;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Gathers what a peer reports about itself. Every part is best effort; a failing probe leaves
 * its section empty.
 */
@Component
@NodeRole
@Slf4j
public class TelemetryCollector {

    private static final int DIAGNOSTICS_PING_TIMEOUT_MS = 5000;

    private final SystemProbe systemProbe;
    private final NetworkProbe networkProbe;
    private final OverlayProbe overlayProbe;
    private final Clock clock;
    private final String diagnosticsTarget;

    public TelemetryCollector(SystemProbe systemProbe,
                              NetworkProbe networkProbe,
                              OverlayProbe overlayProbe,
                              Clock clock,
                              MeshProperties properties) {
        this.systemProbe = systemProbe;
        this.networkProbe = networkProbe;
        this.overlayProbe = overlayProbe;
        this.clock = clock;
        this.diagnosticsTarget = properties.getHeartbeat().getDiagnosticsTarget();
    }

    public HeartbeatRecord heartbeat(String nodeId, NodeStatus status) {
        return HeartbeatRecord.builder()
                .nodeId(nodeId)
                .timestamp(clock.instant())
                .status(status)
                .system(systemSection())
                .network(networkSection())
                .build();
    }

    private Map<String, Object> systemSection() {
        Map<String, Object> system = new LinkedHashMap<>();
        SystemMetrics metrics = safely("system metrics", systemProbe::sample, null);
        if (metrics == null) {
            return system;
        }
        system.put("cpu", Map.of("usage", metrics.getCpuUsage(), "cores", metrics.getCpuCores(),
                "loadAverage", metrics.getLoadAverage()));
        system.put("memory", Map.of("total", metrics.getMemoryTotal(), "used", metrics.getMemoryUsed(),
                "free", metrics.getMemoryFree(), "usage", metrics.getMemoryUsage()));
        system.put("uptime", metrics.getUptimeSeconds());
        return system;
    }

    private Map<String, Object> networkSection() {
        Map<String, Object> network = new LinkedHashMap<>();
        network.put("mesh", safely("mesh status", networkProbe::meshStatus, Map.of()));
        network.put("overlay", safely("overlay status", overlayProbe::overlayStatus, Map.of()));
        network.put("interfaces", safely("network interfaces", systemProbe::networkInterfaces, Map.of()));
        return network;
    }

    /**
     * Hardware snapshot sent with a registration.
     */
    public Map<String, Object> registrationDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("hostname", NodeIdentity.hostname());
        details.put("platform", System.getProperty("os.name"));
        details.put("arch", System.getProperty("os.arch"));
        details.put("osVersion", System.getProperty("os.version"));
        details.put("javaVersion", System.getProperty("java.version"));
        SystemMetrics metrics = safely("system metrics", systemProbe::sample, null);
        if (metrics != null) {
            details.put("cpu", Map.of("cores", metrics.getCpuCores()));
            details.put("memory", Map.of("total", metrics.getMemoryTotal(), "free", metrics.getMemoryFree(),
                    "used", metrics.getMemoryUsed()));
            details.put("uptime", metrics.getUptimeSeconds());
        }
        details.put("interfaces", safely("network interfaces", systemProbe::networkInterfaces, Map.of()));
        details.put("timestamp", clock.instant());
        return details;
    }

    public Map<String, Object> fullStatus(String nodeId) {
        HeartbeatRecord record = heartbeat(nodeId, NodeStatus.ONLINE);
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("nodeId", nodeId);
        status.put("timestamp", record.getTimestamp());
        status.put("status", record.getStatus());
        status.put("system", record.getSystem());
        status.put("network", record.getNetwork());
        status.put("registration", registrationDetails());
        return status;
    }

    public Map<String, Object> diagnostics(String nodeId) {
        Map<String, Object> internet = new LinkedHashMap<>();
        internet.put("host", diagnosticsTarget);
        internet.put("alive", safely("internet reachability",
                () -> networkProbe.isReachable(diagnosticsTarget, DIAGNOSTICS_PING_TIMEOUT_MS), false));

        Map<String, Object> tests = new LinkedHashMap<>();
        tests.put("internet", internet);
        tests.put("mesh", safely("mesh status", networkProbe::meshStatus, Map.of()));
        tests.put("meshNeighbors", safely("mesh neighbors", networkProbe::listNeighbors, List.of()));
        tests.put("overlay", safely("overlay status", overlayProbe::overlayStatus, Map.of()));

        Map<String, Object> diagnostics = new LinkedHashMap<>();
        diagnostics.put("nodeId", nodeId);
        diagnostics.put("timestamp", clock.instant());
        diagnostics.put("tests", tests);
        return diagnostics;
    }

    private static <T> T safely(String what, Supplier<T> call, T fallback) {
        try {
            T value = call.get();
            return value != null ? value : fallback;
        } catch (RuntimeException e) {
            log.warn("Failed to collect {}: {}", what, e.getMessage());
            return fallback;
        }
    }
}
