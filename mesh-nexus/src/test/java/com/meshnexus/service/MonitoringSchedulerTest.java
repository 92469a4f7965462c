package com.meshnexus.service;

import com.meshnexus.config.MeshProperties;
import com.meshnexus.model.MeshNeighbor;
import com.meshnexus.model.NetworkTopology;
import com.meshnexus.model.PerformanceReport;
import com.meshnexus.model.SecurityFinding;
import com.meshnexus.model.StatsSnapshot;
import com.meshnexus.probe.AccessControl;
import com.meshnexus.probe.NetworkProbe;
import com.meshnexus.probe.OverlayProbe;
import com.meshnexus.realtime.RealtimeHub;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MonitoringSchedulerTest {

    private NodeRegistry nodeRegistry;
    private StatsAggregator statsAggregator;
    private TopologyService topologyService;
    private CoordinatorStatusService statusService;
    private RealtimeHub realtimeHub;
    private NetworkProbe networkProbe;
    private OverlayProbe overlayProbe;
    private AccessControl accessControl;
    private TaskScheduler taskScheduler;
    private ScheduledFuture<?> future;
    private MonitoringScheduler scheduler;

    @BeforeEach
    void setUp() {
        nodeRegistry = mock(NodeRegistry.class);
        statsAggregator = mock(StatsAggregator.class);
        topologyService = mock(TopologyService.class);
        statusService = mock(CoordinatorStatusService.class);
        realtimeHub = mock(RealtimeHub.class);
        networkProbe = mock(NetworkProbe.class);
        overlayProbe = mock(OverlayProbe.class);
        accessControl = mock(AccessControl.class);
        taskScheduler = mock(TaskScheduler.class);
        future = mock(ScheduledFuture.class);
        doReturn(future).when(taskScheduler).scheduleAtFixedRate(any(Runnable.class), any(Duration.class));

        scheduler = new MonitoringScheduler(nodeRegistry, statsAggregator, topologyService, statusService,
                realtimeHub, networkProbe, overlayProbe, accessControl, taskScheduler, Runnable::run,
                new MeshProperties());
    }

    @Test
    void startSchedulesEveryCycleAtItsConfiguredRate() {
        scheduler.start();

        verify(taskScheduler).scheduleAtFixedRate(any(Runnable.class), eq(Duration.ofSeconds(10)));
        verify(taskScheduler).scheduleAtFixedRate(any(Runnable.class), eq(Duration.ofSeconds(5)));
        verify(taskScheduler).scheduleAtFixedRate(any(Runnable.class), eq(Duration.ofSeconds(30)));
        verify(taskScheduler).scheduleAtFixedRate(any(Runnable.class), eq(Duration.ofSeconds(60)));
        assertThat(scheduler.scheduledKinds()).containsExactlyInAnyOrder(
                MonitoringScheduler.DISCOVERY, MonitoringScheduler.STATS,
                MonitoringScheduler.ACCESS_CONTROL, MonitoringScheduler.SESSION_REAP);
    }

    @Test
    void stopCancelsEveryCycle() {
        scheduler.start();

        scheduler.stop();

        verify(future, times(4)).cancel(false);
        assertThat(scheduler.scheduledKinds()).isEmpty();
    }

    @Test
    void failingCycleIsContainedAndNextRunProceeds() {
        AtomicInteger runs = new AtomicInteger();

        boolean first = scheduler.runGuarded("stats", () -> {
            runs.incrementAndGet();
            throw new IllegalStateException("collector exploded");
        });
        boolean second = scheduler.runGuarded("stats", runs::incrementAndGet);

        assertThat(first).isTrue();
        assertThat(second).isTrue();
        assertThat(runs).hasValue(2);
    }

    @Test
    void overlappingRunOfSameKindIsSkipped() {
        AtomicBoolean nestedRan = new AtomicBoolean(true);
        AtomicBoolean otherKindRan = new AtomicBoolean(false);

        scheduler.runGuarded("discovery", () -> {
            nestedRan.set(scheduler.runGuarded("discovery", () -> { }));
            otherKindRan.set(scheduler.runGuarded("stats", () -> { }));
        });

        assertThat(nestedRan).isFalse();
        assertThat(otherKindRan).isTrue();
    }

    @Test
    void discoveryCycleMergesProbesThenBroadcasts() {
        List<MeshNeighbor> neighbors = List.of(MeshNeighbor.builder().address("10.0.0.2").quality("0.9").build());
        when(networkProbe.listNeighbors()).thenReturn(neighbors);
        when(overlayProbe.listPeers()).thenReturn(List.of());
        when(nodeRegistry.discover(neighbors, List.of())).thenReturn(List.of("10.0.0.2"));
        when(nodeRegistry.nodes()).thenReturn(List.of());
        NetworkTopology topology = new NetworkTopology();
        when(topologyService.build()).thenReturn(topology);

        scheduler.discoveryCycle();

        InOrder order = inOrder(nodeRegistry, realtimeHub);
        order.verify(nodeRegistry).discover(neighbors, List.of());
        order.verify(nodeRegistry).refreshHealth();
        order.verify(realtimeHub).broadcast(RealtimeHub.NODES_UPDATE, List.of());
        verify(realtimeHub).publish(RealtimeHub.STREAM_NODES, RealtimeHub.NODES_UPDATE, List.of());
        verify(realtimeHub).broadcast(RealtimeHub.TOPOLOGY_UPDATE, topology);
        verify(realtimeHub).publish(RealtimeHub.STREAM_TOPOLOGY, RealtimeHub.TOPOLOGY_UPDATE, topology);
    }

    @Test
    void discoveryCycleRunsWithEmptyDataWhenProbesFail() {
        when(networkProbe.listNeighbors()).thenThrow(new IllegalStateException("batctl missing"));
        when(overlayProbe.listPeers()).thenReturn(List.of());

        scheduler.discoveryCycle();

        verify(nodeRegistry).discover(List.of(), List.of());
        verify(nodeRegistry).refreshHealth();
    }

    @Test
    void statsCycleBroadcastsSnapshotAndPublishesStreams() {
        StatsSnapshot snapshot = StatsSnapshot.empty(Instant.parse("2024-05-01T10:00:00Z"));
        PerformanceReport report = new PerformanceReport();
        when(statsAggregator.collect()).thenReturn(snapshot);
        when(statsAggregator.performanceWindow(anyInt())).thenReturn(Optional.of(report));
        when(statusService.gatewayStatus()).thenReturn(Map.of("active", false));

        scheduler.statsCycle();

        verify(realtimeHub).broadcast(RealtimeHub.STATS_UPDATE, snapshot);
        verify(realtimeHub).publish(RealtimeHub.STREAM_STATS, RealtimeHub.STATS_UPDATE, snapshot);
        verify(realtimeHub).publish(RealtimeHub.STREAM_PERFORMANCE, RealtimeHub.PERFORMANCE_UPDATE, report);
        verify(realtimeHub).publish(RealtimeHub.STREAM_GATEWAY, RealtimeHub.GATEWAY_STATUS, Map.of("active", false));
    }

    @Test
    void statsCycleSkipsPerformanceWithoutData() {
        when(statsAggregator.collect()).thenReturn(StatsSnapshot.empty(Instant.EPOCH));
        when(statsAggregator.performanceWindow(anyInt())).thenReturn(Optional.empty());
        when(statusService.gatewayStatus()).thenReturn(Map.of());

        scheduler.statsCycle();

        verify(realtimeHub, never()).publish(eq(RealtimeHub.STREAM_PERFORMANCE), any(), any());
    }

    @Test
    void accessControlFindingsBecomeSecurityAlerts() {
        List<SecurityFinding> findings = List.of(
                new SecurityFinding("suspicious-connection", "warning", "Unexpected SSH session", "10.0.0.66"));
        when(accessControl.audit()).thenReturn(findings);

        scheduler.accessControlCycle();

        verify(realtimeHub).broadcastSecurityAlert(findings);
    }

    @Test
    void cleanAuditBroadcastsNothing() {
        when(accessControl.audit()).thenReturn(List.of());

        scheduler.accessControlCycle();

        verify(realtimeHub, never()).broadcastSecurityAlert(any());
    }

    @Test
    void reapCycleDelegatesToHub() {
        when(realtimeHub.reapIdleSessions()).thenReturn(2);

        scheduler.reapCycle();

        verify(realtimeHub).reapIdleSessions();
    }
}
