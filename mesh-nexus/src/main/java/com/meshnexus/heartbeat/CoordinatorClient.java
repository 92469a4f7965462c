package com.meshnexus.heartbeat;

import com.meshnexus.config.MeshProperties;
import com.meshnexus.config.NodeRole;
import com.meshnexus.exception.HeartbeatTimeoutException;
import com.meshnexus.exception.RegistrationFailureException;
import com.meshnexus.model.HeartbeatRecord;
import com.meshnexus.model.HeartbeatResponse;
import com.meshnexus.model.RegistrationRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * HTTP calls from a peer to the coordinator's REST API. Each kind of call has its own timeout.
 */
@Component
@NodeRole
@Slf4j
public class CoordinatorClient {

    private final RestTemplate discoveryTemplate;
    private final RestTemplate heartbeatTemplate;
    private final RestTemplate requestTemplate;
    private final RestTemplate shutdownTemplate;

    public CoordinatorClient(RestTemplateBuilder builder, MeshProperties properties) {
        MeshProperties.Heartbeat heartbeat = properties.getHeartbeat();
        this.discoveryTemplate = build(builder, heartbeat.getDiscoveryTimeout());
        this.heartbeatTemplate = build(builder, heartbeat.getHeartbeatTimeout());
        this.requestTemplate = build(builder, heartbeat.getRequestTimeout());
        this.shutdownTemplate = build(builder, heartbeat.getShutdownTimeout());
    }

    private static RestTemplate build(RestTemplateBuilder builder, Duration timeout) {
        return builder.setConnectTimeout(timeout).setReadTimeout(timeout).build();
    }

    /**
     * Fetches {@code GET /api/status} from a candidate coordinator.
     *
     * @return the status body, or empty if nothing answered
     */
    @SuppressWarnings("unchecked")
    public Optional<Map<String, Object>> fetchStatus(String baseUrl) {
        try {
            Map<String, Object> body = discoveryTemplate.getForObject(baseUrl + "/api/status", Map.class);
            return Optional.ofNullable(body);
        } catch (RestClientException e) {
            log.debug("No coordinator at {}: {}", baseUrl, e.getMessage());
            return Optional.empty();
        }
    }

    public void register(String baseUrl, RegistrationRequest request) {
        try {
            requestTemplate.postForObject(baseUrl + "/api/nodes/register", request, Map.class);
        } catch (RestClientException e) {
            throw new RegistrationFailureException("Registration with " + baseUrl + " failed: " + e.getMessage(), e);
        }
    }

    public HeartbeatResponse sendHeartbeat(String baseUrl, HeartbeatRecord record) {
        HeartbeatResponse response;
        try {
            response = heartbeatTemplate.postForObject(heartbeatUrl(baseUrl, record.getNodeId()), record,
                    HeartbeatResponse.class);
        } catch (RestClientException e) {
            throw new HeartbeatTimeoutException("Heartbeat to " + baseUrl + " failed: " + e.getMessage(), e);
        }
        if (response == null) {
            throw new HeartbeatTimeoutException("Empty heartbeat response from " + baseUrl, null);
        }
        return response;
    }

    /**
     * Last heartbeat on shutdown. Uses the short shutdown timeout and never throws.
     */
    public boolean sendFinalHeartbeat(String baseUrl, HeartbeatRecord record) {
        try {
            shutdownTemplate.postForObject(heartbeatUrl(baseUrl, record.getNodeId()), record, HeartbeatResponse.class);
            return true;
        } catch (RestClientException e) {
            log.debug("Final heartbeat to {} not delivered: {}", baseUrl, e.getMessage());
            return false;
        }
    }

    public boolean sendStatus(String baseUrl, String nodeId, Map<String, Object> status) {
        return post(baseUrl + "/api/nodes/" + nodeId + "/status", status, "full status");
    }

    public boolean sendDiagnostics(String baseUrl, String nodeId, Map<String, Object> diagnostics) {
        return post(baseUrl + "/api/nodes/" + nodeId + "/diagnostics", diagnostics, "diagnostics");
    }

    private boolean post(String url, Map<String, Object> body, String what) {
        try {
            requestTemplate.postForObject(url, body, Map.class);
            return true;
        } catch (RestClientException e) {
            log.error("Failed to send {}: {}", what, e.getMessage());
            return false;
        }
    }

    private static String heartbeatUrl(String baseUrl, String nodeId) {
        return baseUrl + "/api/nodes/" + nodeId + "/heartbeat";
    }
}
