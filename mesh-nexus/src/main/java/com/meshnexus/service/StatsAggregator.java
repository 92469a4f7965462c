package com.meshnexus.service;

import com.meshnexus.config.CoordinatorRole;
import com.meshnexus.config.MeshProperties;
import com.meshnexus.model.MeshHealthScore;
import com.meshnexus.model.MeshNeighbor;
import com.meshnexus.model.MeshRoute;
import com.meshnexus.model.MeshStats;
import com.meshnexus.model.OverlayNetwork;
import com.meshnexus.model.OverlayPeer;
import com.meshnexus.model.OverlayStats;
import com.meshnexus.model.PerformanceReport;
import com.meshnexus.model.StatsSnapshot;
import com.meshnexus.model.SystemMetrics;
import com.meshnexus.probe.NetworkProbe;
import com.meshnexus.probe.OverlayProbe;
import com.meshnexus.probe.SystemProbe;
import com.meshnexus.util.ProbeCalls;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.function.ToDoubleFunction;

@Service
@CoordinatorRole
@Slf4j
public class StatsAggregator {

    private final SystemProbe systemProbe;
    private final NetworkProbe networkProbe;
    private final OverlayProbe overlayProbe;
    private final Executor probeExecutor;
    private final Clock clock;
    private final Duration probeTimeout;
    private final int historySize;
    private final Instant startedAt;

    private final Deque<StatsSnapshot> history = new ArrayDeque<>();
    private volatile StatsSnapshot latest;

    public StatsAggregator(SystemProbe systemProbe,
                           NetworkProbe networkProbe,
                           OverlayProbe overlayProbe,
                           @Qualifier("probeExecutor") Executor probeExecutor,
                           Clock clock,
                           MeshProperties properties) {
        this.systemProbe = systemProbe;
        this.networkProbe = networkProbe;
        this.overlayProbe = overlayProbe;
        this.probeExecutor = probeExecutor;
        this.clock = clock;
        this.probeTimeout = properties.getCoordinator().getProbeTimeout();
        this.historySize = properties.getStats().getHistorySize();
        this.startedAt = clock.instant();
        this.latest = StatsSnapshot.empty(startedAt);
    }

    /**
     * Takes one snapshot. Each part is collected on its own; a part that fails or times out is
     * left empty and the rest of the snapshot is still recorded.
     */
    public StatsSnapshot collect() {
        SystemMetrics system = ProbeCalls.orDefault(probeExecutor, probeTimeout, "System stats collection",
                systemProbe::sample, SystemMetrics.empty());
        Map<String, Object> network = ProbeCalls.orDefault(probeExecutor, probeTimeout, "Network stats collection",
                systemProbe::networkInterfaces, new HashMap<>());
        MeshStats mesh = ProbeCalls.orDefault(probeExecutor, probeTimeout, "Mesh stats collection",
                this::collectMesh, MeshStats.empty());
        OverlayStats overlay = ProbeCalls.orDefault(probeExecutor, probeTimeout, "Overlay stats collection",
                this::collectOverlay, OverlayStats.empty());

        StatsSnapshot snapshot = StatsSnapshot.builder()
                .system(system)
                .network(network)
                .mesh(mesh)
                .overlay(overlay)
                .timestamp(clock.instant())
                .build();

        synchronized (history) {
            history.addLast(snapshot);
            while (history.size() > historySize) {
                history.removeFirst();
            }
            latest = snapshot;
        }
        log.debug("Collected stats: {} neighbors, {} routes, {} overlay peers",
                mesh.getNeighborCount(), mesh.getRouteCount(), overlay.getPeerCount());
        return snapshot;
    }

    private MeshStats collectMesh() {
        Map<String, Object> status = networkProbe.meshStatus();
        List<MeshNeighbor> neighbors = networkProbe.listNeighbors();
        List<MeshRoute> routes = networkProbe.listRoutes();
        MeshHealthScore health = MeshHealthCalculator.score(neighbors, routes);
        return MeshStats.builder()
                .status(status != null ? new LinkedHashMap<>(status) : new LinkedHashMap<>())
                .neighbors(new ArrayList<>(neighbors))
                .routes(new ArrayList<>(routes))
                .health(health)
                .neighborCount(neighbors.size())
                .routeCount(routes.size())
                .avgQuality(MeshHealthCalculator.averageQuality(neighbors))
                .build();
    }

    private OverlayStats collectOverlay() {
        Map<String, Object> status = overlayProbe.overlayStatus();
        List<OverlayNetwork> networks = overlayProbe.listNetworks();
        List<OverlayPeer> peers = overlayProbe.listPeers();
        int connected = (int) networks.stream().filter(n -> "OK".equals(n.getStatus())).count();
        return OverlayStats.builder()
                .status(status != null ? new LinkedHashMap<>(status) : new LinkedHashMap<>())
                .networks(new ArrayList<>(networks))
                .peers(new ArrayList<>(peers))
                .networkCount(networks.size())
                .connectedNetworks(connected)
                .peerCount(peers.size())
                .online(status != null && Boolean.TRUE.equals(status.get("online")))
                .build();
    }

    public StatsSnapshot latest() {
        return latest;
    }

    public List<StatsSnapshot> history() {
        synchronized (history) {
            return new ArrayList<>(history);
        }
    }

    public List<StatsSnapshot> history(int minutes) {
        Instant cutoff = clock.instant().minus(Duration.ofMinutes(minutes));
        List<StatsSnapshot> window = new ArrayList<>();
        synchronized (history) {
            for (StatsSnapshot snapshot : history) {
                if (!snapshot.getTimestamp().isBefore(cutoff)) {
                    window.add(snapshot);
                }
            }
        }
        return window;
    }

    /**
     * CPU, memory and neighbor-count trend over the trailing {@code minutes}.
     *
     * @return empty when no snapshot falls inside the window
     */
    public Optional<PerformanceReport> performanceWindow(int minutes) {
        List<StatsSnapshot> window = history(minutes);
        if (window.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new PerformanceReport(
                summarize(window, s -> s.getSystem().getCpuUsage()),
                summarize(window, s -> s.getSystem().getMemoryUsage()),
                summarize(window, s -> s.getMesh().getNeighborCount()),
                window.size(),
                window.get(0).getTimestamp(),
                window.get(window.size() - 1).getTimestamp()));
    }

    private static PerformanceReport.SeriesSummary summarize(List<StatsSnapshot> window,
                                                             ToDoubleFunction<StatsSnapshot> metric) {
        double sum = 0;
        double min = Double.MAX_VALUE;
        double max = -Double.MAX_VALUE;
        for (StatsSnapshot snapshot : window) {
            double value = metric.applyAsDouble(snapshot);
            sum += value;
            min = Math.min(min, value);
            max = Math.max(max, value);
        }
        double current = metric.applyAsDouble(window.get(window.size() - 1));
        return new PerformanceReport.SeriesSummary(current, sum / window.size(), min, max);
    }

    /**
     * Compact view of the latest snapshot for the status payload.
     */
    public Map<String, Object> systemSummary() {
        StatsSnapshot stats = latest;
        SystemMetrics system = stats.getSystem();

        long activeInterfaces = stats.getNetwork().values().stream()
                .filter(iface -> iface instanceof Map && Boolean.TRUE.equals(((Map<?, ?>) iface).get("up")))
                .count();

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("timestamp", stats.getTimestamp());
        summary.put("uptime", Duration.between(startedAt, clock.instant()).getSeconds());
        summary.put("cpu", Map.of("usage", system.getCpuUsage(), "cores", system.getCpuCores(),
                "loadAverage", system.getLoadAverage()));
        summary.put("memory", Map.of("usage", system.getMemoryUsage(), "total", system.getMemoryTotal(),
                "free", system.getMemoryFree()));
        summary.put("network", Map.of("interfaceCount", stats.getNetwork().size(),
                "activeInterfaces", activeInterfaces));
        summary.put("mesh", Map.of(
                "active", Boolean.TRUE.equals(stats.getMesh().getStatus().get("active")),
                "neighbors", stats.getMesh().getNeighborCount(),
                "health", stats.getMesh().getHealth().getStatus()));
        summary.put("overlay", Map.of(
                "online", stats.getOverlay().isOnline(),
                "networks", stats.getOverlay().getConnectedNetworks(),
                "peers", stats.getOverlay().getPeerCount()));
        return summary;
    }
}
