package com.meshnexus.heartbeat;

import com.meshnexus.config.MeshProperties;
import com.meshnexus.config.NodeRole;
import com.meshnexus.exception.HeartbeatTimeoutException;
import com.meshnexus.exception.RegistrationFailureException;
import com.meshnexus.exception.UnknownCommandException;
import com.meshnexus.model.HeartbeatRecord;
import com.meshnexus.model.HeartbeatResponse;
import com.meshnexus.model.NodeCommand;
import com.meshnexus.model.NodeStatus;
import com.meshnexus.model.RegistrationRequest;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

/**
 * Peer-side agent: finds the coordinator, registers, heartbeats and runs the commands the
 * coordinator hands back.
 *
 * <p>When no coordinator answers the peer keeps running on its own and retries on every tick.
 * After {@code maxFailures} consecutive heartbeat failures it rediscovers once and re-registers.
 */
@Component
@NodeRole
@Slf4j
public class HeartbeatClient {

    private final CoordinatorClient coordinatorClient;
    private final NodeIdentity nodeIdentity;
    private final TelemetryCollector telemetry;
    private final ProcessTerminator processTerminator;
    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final List<String> coordinatorCandidates;
    private final int coordinatorPort;
    private final int maxFailures;

    private volatile HeartbeatState state = HeartbeatState.UNREGISTERED;
    private volatile String nodeId;
    private volatile String coordinatorUrl;
    private volatile Instant lastHeartbeat;
    private volatile Duration interval;
    private volatile boolean running;
    private int failureCount;
    private ScheduledFuture<?> heartbeatTask;

    public HeartbeatClient(CoordinatorClient coordinatorClient,
                           NodeIdentity nodeIdentity,
                           TelemetryCollector telemetry,
                           ProcessTerminator processTerminator,
                           TaskScheduler taskScheduler,
                           Clock clock,
                           MeshProperties properties) {
        this.coordinatorClient = coordinatorClient;
        this.nodeIdentity = nodeIdentity;
        this.telemetry = telemetry;
        this.processTerminator = processTerminator;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
        this.coordinatorCandidates = List.copyOf(properties.getHeartbeat().getCoordinatorCandidates());
        this.coordinatorPort = properties.getHeartbeat().getCoordinatorPort();
        this.maxFailures = properties.getHeartbeat().getMaxFailures();
        this.interval = properties.getHeartbeat().getInterval();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        start();
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        nodeId = nodeIdentity.resolve();

        if (connect()) {
            sendHeartbeat();
        } else if (coordinatorUrl == null) {
            log.warn("Coordinator not found, running in standalone mode");
        }
        scheduleHeartbeat();
        log.info("Heartbeat service started for node {}", nodeId);
    }

    synchronized void tick() {
        if (!running) {
            return;
        }
        if (state == HeartbeatState.UNREGISTERED) {
            if (connect()) {
                sendHeartbeat();
            }
            return;
        }
        sendHeartbeat();
    }

    /**
     * Discovers the coordinator and registers with it.
     *
     * @return true if the peer ended up registered
     */
    boolean connect() {
        state = HeartbeatState.DISCOVERING;
        Optional<String> discovered = discoverCoordinator();
        if (discovered.isEmpty()) {
            coordinatorUrl = null;
            state = HeartbeatState.UNREGISTERED;
            return false;
        }
        coordinatorUrl = discovered.get();
        return register();
    }

    Optional<String> discoverCoordinator() {
        for (String candidate : coordinatorCandidates) {
            String url = "http://" + candidate + ":" + coordinatorPort;
            Optional<Map<String, Object>> status = coordinatorClient.fetchStatus(url);
            if (status.isPresent() && status.get().containsKey("coordinator")) {
                log.info("Coordinator discovered at {}", url);
                return Optional.of(url);
            }
        }
        log.warn("Could not discover coordinator among {}", coordinatorCandidates);
        return Optional.empty();
    }

    private boolean register() {
        try {
            coordinatorClient.register(coordinatorUrl,
                    new RegistrationRequest(nodeId, null, telemetry.registrationDetails()));
        } catch (RegistrationFailureException e) {
            log.error("Failed to register with coordinator: {}", e.getMessage());
            state = HeartbeatState.UNREGISTERED;
            return false;
        }
        state = HeartbeatState.REGISTERED;
        failureCount = 0;
        log.info("Successfully registered with coordinator {} as {}", coordinatorUrl, nodeId);
        return true;
    }

    private void sendHeartbeat() {
        HeartbeatRecord record = telemetry.heartbeat(nodeId, NodeStatus.ONLINE);
        HeartbeatResponse response;
        try {
            response = coordinatorClient.sendHeartbeat(coordinatorUrl, record);
        } catch (HeartbeatTimeoutException e) {
            handleHeartbeatFailure(e);
            return;
        }
        failureCount = 0;
        lastHeartbeat = clock.instant();

        if (!response.isRegistered()) {
            log.warn("Coordinator does not know node {}, registering again", nodeId);
            register();
            return;
        }
        state = HeartbeatState.HEARTBEATING;
        runCommands(response.getCommands());
    }

    private void handleHeartbeatFailure(HeartbeatTimeoutException e) {
        failureCount++;
        log.warn("Heartbeat failed ({}/{}): {}", failureCount, maxFailures, e.getMessage());
        if (failureCount < maxFailures) {
            return;
        }
        failureCount = 0;
        if (connect()) {
            log.info("Reconnected to coordinator");
        } else {
            log.warn("Could not rediscover coordinator, continuing in standalone mode");
        }
    }

    private void runCommands(List<NodeCommand> commands) {
        if (commands == null) {
            return;
        }
        for (NodeCommand command : commands) {
            try {
                executeCommand(command);
            } catch (UnknownCommandException e) {
                log.warn("Skipping command: {}", e.getMessage());
            } catch (RuntimeException e) {
                log.error("Command {} failed: {}", command.getType(), e.getMessage(), e);
            }
        }
    }

    void executeCommand(NodeCommand command) {
        log.info("Executing command from coordinator: {}", command.getType());
        String type = command.getType() != null ? command.getType() : "";
        switch (type) {
            case NodeCommand.RESTART:
                restart();
                break;
            case NodeCommand.APPLY_CONFIG:
                applyConfig(command.getConfig());
                break;
            case NodeCommand.RUN_DIAGNOSTICS:
                runDiagnostics();
                break;
            case NodeCommand.SEND_STATUS:
                sendFullStatus();
                break;
            default:
                throw new UnknownCommandException(command.getType());
        }
    }

    private void restart() {
        log.info("Restarting node by coordinator request");
        stop();
        processTerminator.terminate(0);
    }

    private void applyConfig(Map<String, Object> config) {
        if (config == null || !config.containsKey("heartbeatInterval")) {
            log.info("Configuration update carried no supported keys: {}", config);
            return;
        }
        long millis = toMillis(config.get("heartbeatInterval"));
        if (millis <= 0) {
            throw new IllegalArgumentException("heartbeatInterval must be positive: " + millis);
        }
        interval = Duration.ofMillis(millis);
        scheduleHeartbeat();
        log.info("Heartbeat interval updated to {}ms", millis);
    }

    private static long toMillis(Object value) {
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        try {
            return Long.parseLong(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid heartbeatInterval: " + value);
        }
    }

    private void runDiagnostics() {
        log.info("Running diagnostics");
        if (coordinatorClient.sendDiagnostics(coordinatorUrl, nodeId, telemetry.diagnostics(nodeId))) {
            log.info("Diagnostics completed and sent to coordinator");
        }
    }

    private void sendFullStatus() {
        if (coordinatorClient.sendStatus(coordinatorUrl, nodeId, telemetry.fullStatus(nodeId))) {
            log.debug("Full status sent to coordinator");
        }
    }

    private void scheduleHeartbeat() {
        if (heartbeatTask != null) {
            heartbeatTask.cancel(false);
        }
        heartbeatTask = taskScheduler.scheduleAtFixedRate(this::tick, clock.instant().plus(interval), interval);
    }

    @PreDestroy
    public synchronized void stop() {
        if (!running) {
            return;
        }
        log.info("Stopping heartbeat service");
        running = false;
        if (heartbeatTask != null) {
            heartbeatTask.cancel(false);
            heartbeatTask = null;
        }
        if (coordinatorUrl != null && nodeId != null) {
            HeartbeatRecord offline = HeartbeatRecord.builder()
                    .nodeId(nodeId)
                    .timestamp(clock.instant())
                    .status(NodeStatus.OFFLINE)
                    .build();
            coordinatorClient.sendFinalHeartbeat(coordinatorUrl, offline);
        }
        state = HeartbeatState.UNREGISTERED;
        log.info("Heartbeat service stopped");
    }

    public synchronized Map<String, Object> status() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("isRunning", running);
        status.put("state", state);
        status.put("nodeId", nodeId);
        status.put("coordinatorUrl", coordinatorUrl);
        status.put("failureCount", failureCount);
        status.put("lastHeartbeat", lastHeartbeat);
        status.put("interval", interval.toMillis());
        return status;
    }

    public HeartbeatState getState() {
        return state;
    }

    public synchronized int getFailureCount() {
        return failureCount;
    }

    Duration getInterval() {
        return interval;
    }
}
