package com.meshnexus.service;

import com.meshnexus.config.CoordinatorRole;
import com.meshnexus.config.MeshProperties;
import com.meshnexus.model.MeshNeighbor;
import com.meshnexus.model.NetworkTopology;
import com.meshnexus.model.Node;
import com.meshnexus.model.OverlayPeer;
import com.meshnexus.model.SecurityFinding;
import com.meshnexus.model.StatsSnapshot;
import com.meshnexus.probe.AccessControl;
import com.meshnexus.probe.NetworkProbe;
import com.meshnexus.probe.OverlayProbe;
import com.meshnexus.realtime.RealtimeHub;
import com.meshnexus.util.ProbeCalls;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives the coordinator's periodic cycles. A cycle that is still running when its next slot
 * comes up is skipped rather than run twice, and no cycle failure reaches the scheduler thread.
 */
@Service
@CoordinatorRole
@Slf4j
public class MonitoringScheduler {

    static final String DISCOVERY = "discovery";
    static final String STATS = "stats";
    static final String ACCESS_CONTROL = "access-control";
    static final String SESSION_REAP = "session-reap";

    private final NodeRegistry nodeRegistry;
    private final StatsAggregator statsAggregator;
    private final TopologyService topologyService;
    private final CoordinatorStatusService statusService;
    private final RealtimeHub realtimeHub;
    private final NetworkProbe networkProbe;
    private final OverlayProbe overlayProbe;
    private final AccessControl accessControl;
    private final TaskScheduler taskScheduler;
    private final Executor probeExecutor;
    private final MeshProperties properties;

    private final Map<String, ScheduledFuture<?>> scheduledCycles = new ConcurrentHashMap<>();
    private final Map<String, AtomicBoolean> running = new ConcurrentHashMap<>();

    public MonitoringScheduler(NodeRegistry nodeRegistry,
                               StatsAggregator statsAggregator,
                               TopologyService topologyService,
                               CoordinatorStatusService statusService,
                               RealtimeHub realtimeHub,
                               NetworkProbe networkProbe,
                               OverlayProbe overlayProbe,
                               AccessControl accessControl,
                               TaskScheduler taskScheduler,
                               @Qualifier("probeExecutor") Executor probeExecutor,
                               MeshProperties properties) {
        this.nodeRegistry = nodeRegistry;
        this.statsAggregator = statsAggregator;
        this.topologyService = topologyService;
        this.statusService = statusService;
        this.realtimeHub = realtimeHub;
        this.networkProbe = networkProbe;
        this.overlayProbe = overlayProbe;
        this.accessControl = accessControl;
        this.taskScheduler = taskScheduler;
        this.probeExecutor = probeExecutor;
        this.properties = properties;
    }

    @PostConstruct
    public void start() {
        schedule(DISCOVERY, properties.getCoordinator().getDiscoveryInterval(), this::discoveryCycle);
        schedule(STATS, properties.getStats().getInterval(), this::statsCycle);
        schedule(ACCESS_CONTROL, properties.getCoordinator().getAccessControlInterval(), this::accessControlCycle);
        schedule(SESSION_REAP, properties.getRealtime().getReapInterval(), this::reapCycle);
        log.info("Monitoring cycles started: {}", scheduledCycles.keySet());
    }

    private void schedule(String kind, Duration interval, Runnable cycle) {
        running.put(kind, new AtomicBoolean(false));
        ScheduledFuture<?> future = taskScheduler.scheduleAtFixedRate(() -> runGuarded(kind, cycle), interval);
        scheduledCycles.put(kind, future);
    }

    /**
     * Runs one cycle of {@code kind} unless the previous one is still in progress.
     *
     * @return false if the run was skipped
     */
    boolean runGuarded(String kind, Runnable cycle) {
        AtomicBoolean flag = running.computeIfAbsent(kind, k -> new AtomicBoolean(false));
        if (!flag.compareAndSet(false, true)) {
            log.debug("Skipping {} cycle, previous run still active", kind);
            return false;
        }
        try {
            cycle.run();
        } catch (Exception e) {
            log.error("Error in {} cycle: {}", kind, e.getMessage(), e);
        } finally {
            flag.set(false);
        }
        return true;
    }

    void discoveryCycle() {
        Duration timeout = properties.getCoordinator().getProbeTimeout();
        List<MeshNeighbor> neighbors = ProbeCalls.orDefault(probeExecutor, timeout, "Neighbor discovery",
                networkProbe::listNeighbors, List.of());
        List<OverlayPeer> peers = ProbeCalls.orDefault(probeExecutor, timeout, "Overlay peer discovery",
                overlayProbe::listPeers, List.of());

        List<String> created = nodeRegistry.discover(neighbors, peers);
        if (!created.isEmpty()) {
            log.info("Discovered {} new node(s): {}", created.size(), created);
        }
        nodeRegistry.refreshHealth();

        List<Node> nodes = nodeRegistry.nodes();
        realtimeHub.broadcast(RealtimeHub.NODES_UPDATE, nodes);
        realtimeHub.publish(RealtimeHub.STREAM_NODES, RealtimeHub.NODES_UPDATE, nodes);

        NetworkTopology topology = topologyService.build();
        realtimeHub.broadcast(RealtimeHub.TOPOLOGY_UPDATE, topology);
        realtimeHub.publish(RealtimeHub.STREAM_TOPOLOGY, RealtimeHub.TOPOLOGY_UPDATE, topology);
    }

    void statsCycle() {
        StatsSnapshot snapshot = statsAggregator.collect();
        realtimeHub.broadcast(RealtimeHub.STATS_UPDATE, snapshot);
        realtimeHub.publish(RealtimeHub.STREAM_STATS, RealtimeHub.STATS_UPDATE, snapshot);
        statsAggregator.performanceWindow(properties.getStats().getPerformanceWindowMinutes())
                .ifPresent(report -> realtimeHub.publish(RealtimeHub.STREAM_PERFORMANCE,
                        RealtimeHub.PERFORMANCE_UPDATE, report));
        realtimeHub.publish(RealtimeHub.STREAM_GATEWAY, RealtimeHub.GATEWAY_STATUS, statusService.gatewayStatus());
    }

    void accessControlCycle() {
        List<SecurityFinding> findings = ProbeCalls.orDefault(probeExecutor,
                properties.getCoordinator().getProbeTimeout(), "Access-control audit", accessControl::audit, List.of());
        if (!findings.isEmpty()) {
            log.warn("Access-control sweep reported {} finding(s)", findings.size());
            realtimeHub.broadcastSecurityAlert(findings);
        }
    }

    void reapCycle() {
        int reaped = realtimeHub.reapIdleSessions();
        if (reaped > 0) {
            log.info("Closed {} idle realtime session(s)", reaped);
        }
    }

    public Set<String> scheduledKinds() {
        return Set.copyOf(scheduledCycles.keySet());
    }

    @PreDestroy
    public void stop() {
        scheduledCycles.forEach((kind, future) -> future.cancel(false));
        scheduledCycles.clear();
        log.info("Monitoring cycles stopped");
    }
}
