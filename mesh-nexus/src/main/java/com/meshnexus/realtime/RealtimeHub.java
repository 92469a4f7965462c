package com.meshnexus.realtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.meshnexus.config.CoordinatorRole;
import com.meshnexus.config.MeshProperties;
import com.meshnexus.event.NodeStatusChangedEvent;
import com.meshnexus.exception.MeshNexusException;
import com.meshnexus.exception.SessionException;
import com.meshnexus.model.ActionResult;
import com.meshnexus.model.NodeAction;
import com.meshnexus.model.SecurityFinding;
import com.meshnexus.service.CoordinatorStatusService;
import com.meshnexus.service.NodeRegistry;
import com.meshnexus.service.StatsAggregator;
import com.meshnexus.service.TopologyService;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Session registry and fan-out for realtime observers.
 *
 * <p>Every session receives a single {@code bootstrap} frame before anything else. Replies to
 * pull requests go only to the requester, {@link #broadcast} reaches every session and
 * {@link #publish} only the sessions subscribed to the stream. A session whose send fails is
 * dropped without affecting the others.
 */
@Component
@CoordinatorRole
@Slf4j
public class RealtimeHub {

    public static final String STREAM_PERFORMANCE = "performance";
    public static final String STREAM_TOPOLOGY = "topology";
    public static final String STREAM_GATEWAY = "gateway";
    public static final String STREAM_STATS = "stats";
    public static final String STREAM_NODES = "nodes";
    static final Set<String> STREAMS = Set.of(STREAM_PERFORMANCE, STREAM_TOPOLOGY, STREAM_GATEWAY,
            STREAM_STATS, STREAM_NODES);

    public static final String BOOTSTRAP = "bootstrap";
    public static final String STATUS_UPDATE = "status-update";
    public static final String NODES_UPDATE = "nodes-update";
    public static final String STATS_UPDATE = "stats-update";
    public static final String PERFORMANCE_UPDATE = "performance-update";
    public static final String TOPOLOGY_UPDATE = "topology-update";
    public static final String GATEWAY_STATUS = "gateway-status";
    public static final String NODE_ACTION_RESULT = "node-action-result";
    public static final String NODE_STATUS_CHANGE = "node-status-change";
    public static final String ALERT = "alert";
    public static final String SECURITY_ALERT = "security-alert";
    public static final String SERVER_SHUTDOWN = "server-shutdown";
    public static final String ERROR = "error";

    private final Map<String, ClientSession> sessions = new ConcurrentHashMap<>();

    private final NodeRegistry nodeRegistry;
    private final StatsAggregator statsAggregator;
    private final TopologyService topologyService;
    private final CoordinatorStatusService statusService;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration idleTimeout;
    private final int defaultPerformanceMinutes;

    public RealtimeHub(NodeRegistry nodeRegistry,
                       StatsAggregator statsAggregator,
                       TopologyService topologyService,
                       CoordinatorStatusService statusService,
                       ObjectMapper objectMapper,
                       Clock clock,
                       MeshProperties properties) {
        this.nodeRegistry = nodeRegistry;
        this.statsAggregator = statsAggregator;
        this.topologyService = topologyService;
        this.statusService = statusService;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.idleTimeout = properties.getRealtime().getIdleTimeout();
        this.defaultPerformanceMinutes = properties.getStats().getPerformanceWindowMinutes();
    }

    public ClientSession connect(ObserverChannel channel) {
        ClientSession session = new ClientSession(channel, clock.instant());
        String bootstrap = encode(BOOTSTRAP, bootstrapPayload());

        // Holding the session monitor while it is published keeps broadcasts queued behind the bootstrap.
        synchronized (session) {
            sessions.put(session.getId(), session);
            try {
                session.deliver(bootstrap);
            } catch (IOException e) {
                log.warn("Failed to send bootstrap to {}: {}", session.getId(), e.getMessage());
                drop(session, "bootstrap failed");
                return session;
            }
        }
        log.info("Realtime client connected: {}", session.getId());
        return session;
    }

    private Map<String, Object> bootstrapPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", statusService.status(sessions.size() + 1));
        payload.put("nodes", nodeRegistry.nodes());
        payload.put("stats", statsAggregator.latest());
        payload.put("topology", topologyService.build());
        payload.put("gateway", statusService.gatewayStatus());
        return payload;
    }

    public void disconnect(String sessionId) {
        if (sessions.remove(sessionId) != null) {
            log.info("Realtime client disconnected: {}", sessionId);
        }
    }

    /**
     * Handles one inbound frame.
     *
     * @throws SessionException if the frame is not a JSON envelope or names an unknown event;
     *                          the caller closes the session
     */
    public void handleMessage(String sessionId, String text) {
        ClientSession session = sessions.get(sessionId);
        if (session == null) {
            throw new SessionException(sessionId, "Unknown session");
        }
        JsonNode frame;
        try {
            frame = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new SessionException(sessionId, "Malformed frame", e);
        }
        if (frame == null || !frame.hasNonNull("event")) {
            throw new SessionException(sessionId, "Frame has no event");
        }
        session.touch(clock.instant());

        String event = frame.get("event").asText();
        JsonNode data = frame.path("data");
        switch (event) {
            case "request-status":
                reply(session, STATUS_UPDATE, "status", () -> statusService.status(sessions.size()));
                break;
            case "request-nodes":
                reply(session, NODES_UPDATE, "nodes", nodeRegistry::nodes);
                break;
            case "request-stats":
                reply(session, STATS_UPDATE, "stats", statsAggregator::latest);
                break;
            case "request-performance":
                int minutes = data.path("minutes").asInt(defaultPerformanceMinutes);
                reply(session, PERFORMANCE_UPDATE, "performance metrics", () -> statsAggregator
                        .performanceWindow(minutes)
                        .<Object>map(report -> report)
                        .orElse(Map.of("status", "no_data")));
                break;
            case "request-topology":
                reply(session, TOPOLOGY_UPDATE, "topology", topologyService::build);
                break;
            case "request-gateway-status":
                reply(session, GATEWAY_STATUS, "gateway status", statusService::gatewayStatus);
                break;
            case "node-action":
                handleNodeAction(session, data);
                break;
            case "subscribe":
                changeSubscription(session, data, true);
                break;
            case "unsubscribe":
                changeSubscription(session, data, false);
                break;
            default:
                throw new SessionException(sessionId, "Unknown event: " + event);
        }
    }

    private void reply(ClientSession session, String event, String what, Supplier<Object> payload) {
        Object data;
        try {
            data = payload.get();
        } catch (RuntimeException e) {
            log.error("Error building {} for {}: {}", what, session.getId(), e.getMessage());
            send(session, ERROR, Map.of("message", "Failed to get " + what));
            return;
        }
        send(session, event, data);
    }

    private void handleNodeAction(ClientSession session, JsonNode data) {
        String nodeId = data.path("nodeId").asText(null);
        String action = data.path("action").asText(null);
        if (nodeId == null || action == null) {
            send(session, ERROR, Map.of("message", "Invalid node action request"));
            return;
        }
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("nodeId", nodeId);
        result.put("action", action);
        try {
            ActionResult outcome = nodeRegistry.dispatchAction(nodeId, NodeAction.fromValue(action));
            result.put("success", outcome.isSuccess());
            result.put("result", outcome.getResult());
            result.put("message", outcome.getMessage());
        } catch (MeshNexusException | IllegalArgumentException e) {
            log.warn("Node action {} on {} failed: {}", action, nodeId, e.getMessage());
            result.put("success", false);
            result.put("error", e.getMessage());
        }
        send(session, NODE_ACTION_RESULT, result);
    }

    private void changeSubscription(ClientSession session, JsonNode data, boolean subscribe) {
        String stream = data.path("stream").asText(null);
        if (stream == null || !STREAMS.contains(stream)) {
            send(session, ERROR, Map.of("message", "Unknown stream: " + stream));
            return;
        }
        if (subscribe) {
            session.getSubscriptions().add(stream);
        } else {
            session.getSubscriptions().remove(stream);
        }
        log.debug("Client {} {} {}", session.getId(), subscribe ? "subscribed to" : "unsubscribed from", stream);
    }

    public void broadcast(String event, Object data) {
        if (sessions.isEmpty()) {
            return;
        }
        String frame = encode(event, data);
        for (ClientSession session : sessions.values()) {
            deliver(session, frame);
        }
    }

    public void publish(String stream, String event, Object data) {
        List<ClientSession> subscribers = new ArrayList<>();
        for (ClientSession session : sessions.values()) {
            if (session.isSubscribed(stream)) {
                subscribers.add(session);
            }
        }
        if (subscribers.isEmpty()) {
            return;
        }
        String frame = encode(event, data);
        subscribers.forEach(session -> deliver(session, frame));
    }

    @EventListener
    public void onNodeStatusChanged(NodeStatusChangedEvent event) {
        Map<String, Object> change = new LinkedHashMap<>();
        change.put("nodeId", event.getNodeId());
        change.put("status", event.getNewStatus());
        change.put("timestamp", clock.instant());
        broadcast(NODE_STATUS_CHANGE, change);

        if (!event.isDegradation() && !event.isRecovery()) {
            return;
        }
        Map<String, Object> alert = new LinkedHashMap<>();
        alert.put("type", event.isRecovery() ? "node-recovered" : "node-" + event.getNewStatus().value());
        alert.put("severity", event.isRecovery() ? "info" : "warning");
        alert.put("nodeId", event.getNodeId());
        alert.put("address", event.getAddress());
        alert.put("previousStatus", event.getPreviousStatus());
        alert.put("status", event.getNewStatus());
        alert.put("message", "Node " + event.getNodeId() + " is " + event.getNewStatus().value());
        alert.put("timestamp", clock.instant());
        broadcast(ALERT, alert);
        log.info("Alert broadcasted: {} - {}", alert.get("type"), alert.get("message"));
    }

    public void broadcastSecurityAlert(List<SecurityFinding> findings) {
        for (SecurityFinding finding : findings) {
            Map<String, Object> alert = new LinkedHashMap<>();
            alert.put("type", finding.getType());
            alert.put("severity", finding.getSeverity());
            alert.put("message", finding.getMessage());
            alert.put("address", finding.getAddress());
            alert.put("timestamp", clock.instant());
            broadcast(SECURITY_ALERT, alert);
        }
    }

    /**
     * Closes sessions with no inbound activity for longer than the idle timeout.
     *
     * @return number of sessions closed
     */
    public int reapIdleSessions() {
        Instant cutoff = clock.instant().minus(idleTimeout);
        int reaped = 0;
        for (ClientSession session : sessions.values()) {
            if (session.getLastActivity().isBefore(cutoff)) {
                log.info("Closing idle realtime session {}", session.getId());
                drop(session, "idle timeout");
                reaped++;
            }
        }
        return reaped;
    }

    @PreDestroy
    public void shutdown() {
        broadcast(SERVER_SHUTDOWN, Map.of("message", "Coordinator is shutting down", "timestamp", clock.instant()));
        for (ClientSession session : sessions.values()) {
            drop(session, "server shutdown");
        }
    }

    public int sessionCount() {
        return sessions.size();
    }

    public Map<String, Object> clientInfo() {
        List<Map<String, Object>> clients = new ArrayList<>();
        for (ClientSession session : sessions.values()) {
            Map<String, Object> client = new LinkedHashMap<>();
            client.put("id", session.getId());
            client.put("connectedAt", session.getConnectedAt());
            client.put("lastActivity", session.getLastActivity());
            client.put("subscriptions", List.copyOf(session.getSubscriptions()));
            clients.add(client);
        }
        return Map.of("count", clients.size(), "clients", clients);
    }

    private void send(ClientSession session, String event, Object data) {
        deliver(session, encode(event, data));
    }

    private void deliver(ClientSession session, String frame) {
        try {
            session.deliver(frame);
        } catch (IOException | RuntimeException e) {
            log.warn("Dropping realtime session {} after failed send: {}", session.getId(), e.getMessage());
            drop(session, "send failed");
        }
    }

    private void drop(ClientSession session, String reason) {
        sessions.remove(session.getId());
        try {
            session.getChannel().close(reason);
        } catch (RuntimeException e) {
            log.debug("Error closing session {}: {}", session.getId(), e.getMessage());
        }
    }

    private String encode(String event, Object data) {
        try {
            return objectMapper.writeValueAsString(new RealtimeMessage(event, data));
        } catch (JsonProcessingException e) {
            throw new MeshNexusException("Failed to encode " + event + " frame", e);
        }
    }
}
