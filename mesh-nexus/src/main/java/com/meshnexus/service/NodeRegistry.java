package com.meshnexus.service;

import com.meshnexus.config.CoordinatorRole;
import com.meshnexus.config.MeshProperties;
import com.meshnexus.event.NodeStatusChangedEvent;
import com.meshnexus.exception.NodeNotFoundException;
import com.meshnexus.model.ActionResult;
import com.meshnexus.model.HeartbeatRecord;
import com.meshnexus.model.MeshNeighbor;
import com.meshnexus.model.Node;
import com.meshnexus.model.NodeAction;
import com.meshnexus.model.NodeCommand;
import com.meshnexus.model.NodeStatus;
import com.meshnexus.model.OverlayPeer;
import com.meshnexus.model.RegistrationRequest;
import com.meshnexus.probe.AccessControl;
import com.meshnexus.probe.NetworkProbe;
import com.meshnexus.util.ProbeCalls;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Authoritative table of known peers.
 *
 * <p>Every mutation goes through {@link #lock}, so overlapping discovery cycles, heartbeats and
 * actions cannot lose each other's updates. Collaborator calls (reachability probes, block and
 * unblock) run outside the lock; their results are applied under it against the node's state at
 * that moment.
 *
 * <p>Heartbeats carry the peer's own view of its status, and that view wins over the last probe
 * result until the next health cycle. Blocked nodes stay blocked until an explicit reconnect.
 */
@Service
@CoordinatorRole
@Slf4j
public class NodeRegistry {

    enum ProbeOutcome { REACHABLE, UNREACHABLE, ERROR }

    private final Map<String, Node> nodes = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    private final NetworkProbe networkProbe;
    private final AccessControl accessControl;
    private final ApplicationEventPublisher eventPublisher;
    private final Executor probeExecutor;
    private final Clock clock;
    private final Duration offlineThreshold;
    private final Duration probeTimeout;
    private final int reachabilityTimeoutMs;

    public NodeRegistry(NetworkProbe networkProbe,
                        AccessControl accessControl,
                        ApplicationEventPublisher eventPublisher,
                        @Qualifier("probeExecutor") Executor probeExecutor,
                        Clock clock,
                        MeshProperties properties) {
        this.networkProbe = networkProbe;
        this.accessControl = accessControl;
        this.eventPublisher = eventPublisher;
        this.probeExecutor = probeExecutor;
        this.clock = clock;
        this.offlineThreshold = properties.getCoordinator().getOfflineThreshold();
        this.probeTimeout = properties.getCoordinator().getProbeTimeout();
        this.reachabilityTimeoutMs = properties.getCoordinator().getReachabilityTimeoutMs();
    }

    /**
     * Merges one mesh/overlay snapshot. Unknown neighbor addresses become online nodes; known
     * ones only get their mesh descriptor refreshed. Overlay peers are attached to the node with
     * the same address and dropped when there is none.
     *
     * @return ids of the nodes created by this call
     */
    public List<String> discover(List<MeshNeighbor> neighbors, List<OverlayPeer> peers) {
        List<String> created = new ArrayList<>();
        lock.lock();
        try {
            Instant now = clock.instant();
            for (MeshNeighbor neighbor : neighbors) {
                if (neighbor == null || isBlank(neighbor.getAddress())) {
                    continue;
                }
                Node existing = findByAddress(neighbor.getAddress());
                if (existing != null) {
                    existing.setMeshInfo(neighbor.toBuilder().build());
                    continue;
                }
                Node node = new Node(neighbor.getAddress(), neighbor.getAddress(), now);
                node.setMeshInfo(neighbor.toBuilder().build());
                nodes.put(node.getId(), node);
                created.add(node.getId());
                log.info("New node discovered: {}", node.getId());
            }
            for (OverlayPeer peer : peers) {
                if (peer == null || isBlank(peer.getAddress())) {
                    continue;
                }
                Node match = findByAddress(peer.getAddress());
                if (match != null) {
                    match.setOverlayInfo(peer.toBuilder().build());
                }
            }
        } finally {
            lock.unlock();
        }
        return created;
    }

    /**
     * Probes every node that is not blocked and runs the health state machine on the results.
     *
     * @return status of each probed node after the cycle
     */
    public Map<String, NodeStatus> refreshHealth() {
        Map<String, String> targets = new LinkedHashMap<>();
        lock.lock();
        try {
            for (Node node : nodes.values()) {
                if (node.getStatus() != NodeStatus.BLOCKED) {
                    targets.put(node.getId(), node.getAddress());
                }
            }
        } finally {
            lock.unlock();
        }

        Map<String, CompletableFuture<ProbeOutcome>> probes = new LinkedHashMap<>();
        targets.forEach((nodeId, address) -> probes.put(nodeId, probe(nodeId, address)));

        Map<String, NodeStatus> results = new LinkedHashMap<>();
        List<NodeStatusChangedEvent> changes = new ArrayList<>();
        lock.lock();
        try {
            Instant now = clock.instant();
            for (Map.Entry<String, CompletableFuture<ProbeOutcome>> entry : probes.entrySet()) {
                Node node = nodes.get(entry.getKey());
                if (node == null || node.getStatus() == NodeStatus.BLOCKED) {
                    continue; // blocked while the probe was in flight
                }
                NodeStatus next = nextStatus(node, entry.getValue().join(), now);
                transition(node, next, "probe", changes);
                results.put(node.getId(), next);
            }
        } finally {
            lock.unlock();
        }
        changes.forEach(eventPublisher::publishEvent);
        return results;
    }

    private CompletableFuture<ProbeOutcome> probe(String nodeId, String address) {
        return CompletableFuture
                .supplyAsync(() -> networkProbe.isReachable(address, reachabilityTimeoutMs)
                        ? ProbeOutcome.REACHABLE : ProbeOutcome.UNREACHABLE, probeExecutor)
                .orTimeout(probeTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .exceptionally(e -> {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    log.error("Error checking health for node {}: {}", nodeId, cause.toString());
                    return ProbeOutcome.ERROR;
                });
    }

    private NodeStatus nextStatus(Node node, ProbeOutcome outcome, Instant now) {
        switch (outcome) {
            case REACHABLE:
                node.touch(now);
                return NodeStatus.ONLINE;
            case UNREACHABLE:
                Duration unseen = Duration.between(node.getLastSeen(), now);
                // transient loss inside the threshold only warns
                return unseen.compareTo(offlineThreshold) >= 0 ? NodeStatus.OFFLINE : NodeStatus.WARNING;
            default:
                return NodeStatus.ERROR;
        }
    }

    /**
     * Runs an operator action against a node.
     *
     * <p>{@code restart} is advisory: it queues a restart command that the peer only receives
     * in the response to its next heartbeat. Nodes known only through mesh discovery never
     * heartbeat, so for them the request has no effect.
     *
     * @throws NodeNotFoundException if no node has the given id
     */
    public ActionResult dispatchAction(String nodeId, NodeAction action) {
        Node node = find(nodeId).orElseThrow(() -> new NodeNotFoundException(nodeId));
        String address = node.getAddress();

        switch (action) {
            case PING:
                boolean reachable = ProbeCalls.withTimeout(probeExecutor, probeTimeout, "Ping " + address,
                        () -> networkProbe.isReachable(address, reachabilityTimeoutMs));
                return new ActionResult(nodeId, action, true, reachable,
                        reachable ? "Node " + nodeId + " is reachable" : "Node " + nodeId + " is unreachable");
            case DISCONNECT:
                ProbeCalls.withTimeout(probeExecutor, probeTimeout, "Block " + address, () -> {
                    accessControl.block(address);
                    return address;
                });
                applyActionStatus(nodeId, NodeStatus.BLOCKED);
                return new ActionResult(nodeId, action, true, null, "Node disconnected");
            case RECONNECT:
                ProbeCalls.withTimeout(probeExecutor, probeTimeout, "Unblock " + address, () -> {
                    accessControl.unblock(address);
                    return address;
                });
                applyActionStatus(nodeId, NodeStatus.ONLINE);
                return new ActionResult(nodeId, action, true, null, "Node reconnected");
            case RESTART:
                queueCommand(nodeId, new NodeCommand(NodeCommand.RESTART));
                log.info("Restart request for node {}", nodeId);
                return new ActionResult(nodeId, action, true, Map.of("queued", true),
                        "Restart signal queued; it is delivered only if the node sends a heartbeat");
            default:
                throw new IllegalArgumentException("Unknown action: " + action);
        }
    }

    private void applyActionStatus(String nodeId, NodeStatus status) {
        List<NodeStatusChangedEvent> changes = new ArrayList<>();
        lock.lock();
        try {
            Node node = nodes.get(nodeId);
            if (node == null) {
                throw new NodeNotFoundException(nodeId);
            }
            transition(node, status, "action", changes);
        } finally {
            lock.unlock();
        }
        changes.forEach(eventPublisher::publishEvent);
    }

    /**
     * Applies a heartbeat from a registered peer.
     *
     * @return the commands queued for the peer, or empty if the node is not registered
     */
    public Optional<List<NodeCommand>> ingestHeartbeat(String nodeId, HeartbeatRecord record) {
        List<NodeStatusChangedEvent> changes = new ArrayList<>();
        List<NodeCommand> commands;
        lock.lock();
        try {
            Node node = nodes.get(nodeId);
            if (node == null) {
                log.debug("Ignoring heartbeat from unregistered node {}", nodeId);
                return Optional.empty();
            }
            node.touch(clock.instant());
            NodeStatus reported = record.getStatus() != null ? record.getStatus() : NodeStatus.ONLINE;
            if (reported == NodeStatus.BLOCKED) {
                // only a disconnect action blocks a node
                log.warn("Node {} reported itself blocked, keeping {}", nodeId, node.getStatus().value());
            } else if (node.getStatus() != NodeStatus.BLOCKED) {
                transition(node, reported, "heartbeat", changes);
            }
            node.setStats(record.getSystem() != null ? new HashMap<>(record.getSystem()) : new HashMap<>());
            node.setNetwork(record.getNetwork() != null ? new HashMap<>(record.getNetwork()) : new HashMap<>());
            commands = new ArrayList<>(node.getPendingCommands());
            node.getPendingCommands().clear();
        } finally {
            lock.unlock();
        }
        changes.forEach(eventPublisher::publishEvent);
        return Optional.of(commands);
    }

    /**
     * Creates or refreshes the node for a registering peer. A node that was only known through
     * mesh discovery at the same address is taken over by the peer's id.
     */
    public Node register(RegistrationRequest request, String remoteAddress) {
        String nodeId = request.getNodeId();
        String address = !isBlank(request.getAddress()) ? request.getAddress() : remoteAddress;
        List<NodeStatusChangedEvent> changes = new ArrayList<>();
        Node registered;
        lock.lock();
        try {
            Instant now = clock.instant();
            Node node = nodes.get(nodeId);
            if (node == null && !isBlank(address)) {
                Node discovered = nodes.get(address);
                if (discovered != null && discovered.getId().equals(discovered.getAddress())) {
                    nodes.remove(address);
                    discovered.setId(nodeId);
                    node = discovered;
                    nodes.put(nodeId, node);
                }
            }
            if (node == null) {
                node = new Node(nodeId, address, now);
                nodes.put(nodeId, node);
                log.info("Node registered: {} ({})", nodeId, address);
            } else {
                log.info("Node re-registered: {} ({})", nodeId, address);
                if (!isBlank(address)) {
                    node.setAddress(address);
                }
                node.touch(now);
                if (node.getStatus() != NodeStatus.BLOCKED) {
                    transition(node, NodeStatus.ONLINE, "registration", changes);
                }
            }
            node.setRegistration(request.getDetails() != null ? new HashMap<>(request.getDetails()) : new HashMap<>());
            registered = node.copy();
        } finally {
            lock.unlock();
        }
        changes.forEach(eventPublisher::publishEvent);
        return registered;
    }

    public void recordStatusReport(String nodeId, Map<String, Object> report) {
        mutate(nodeId, node -> node.setReport(new HashMap<>(report)));
    }

    public void recordDiagnostics(String nodeId, Map<String, Object> diagnostics) {
        mutate(nodeId, node -> node.setDiagnostics(new HashMap<>(diagnostics)));
    }

    public void queueCommand(String nodeId, NodeCommand command) {
        mutate(nodeId, node -> node.getPendingCommands().add(command));
    }

    private void mutate(String nodeId, Consumer<Node> change) {
        lock.lock();
        try {
            Node node = nodes.get(nodeId);
            if (node == null) {
                throw new NodeNotFoundException(nodeId);
            }
            change.accept(node);
        } finally {
            lock.unlock();
        }
    }

    public List<Node> nodes() {
        lock.lock();
        try {
            List<Node> copies = new ArrayList<>(nodes.size());
            nodes.values().forEach(node -> copies.add(node.copy()));
            return copies;
        } finally {
            lock.unlock();
        }
    }

    public Optional<Node> find(String nodeId) {
        lock.lock();
        try {
            Node node = nodes.get(nodeId);
            return node != null ? Optional.of(node.copy()) : Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return nodes.size();
        } finally {
            lock.unlock();
        }
    }

    public Map<NodeStatus, Integer> statusCounts() {
        Map<NodeStatus, Integer> counts = new EnumMap<>(NodeStatus.class);
        for (NodeStatus status : NodeStatus.values()) {
            counts.put(status, 0);
        }
        lock.lock();
        try {
            nodes.values().forEach(node -> counts.merge(node.getStatus(), 1, Integer::sum));
        } finally {
            lock.unlock();
        }
        return counts;
    }

    private void transition(Node node, NodeStatus next, String reason, List<NodeStatusChangedEvent> changes) {
        NodeStatus previous = node.getStatus();
        node.setStatus(next);
        if (previous != next) {
            if (next == NodeStatus.ONLINE || next == NodeStatus.WARNING) {
                log.info("Node {} status {} -> {} ({})", node.getId(), previous, next, reason);
            } else {
                log.warn("Node {} status {} -> {} ({})", node.getId(), previous, next, reason);
            }
            changes.add(new NodeStatusChangedEvent(this, node.getId(), node.getAddress(), previous, next, reason));
        }
    }

    private Node findByAddress(String address) {
        for (Node node : nodes.values()) {
            if (address.equals(node.getAddress())) {
                return node;
            }
        }
        return null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
