package com.meshnexus.controller;

import com.meshnexus.config.CoordinatorRole;
import com.meshnexus.exception.NodeNotFoundException;
import com.meshnexus.model.ActionResult;
import com.meshnexus.model.HeartbeatRecord;
import com.meshnexus.model.HeartbeatResponse;
import com.meshnexus.model.Node;
import com.meshnexus.model.NodeAction;
import com.meshnexus.model.NodeCommand;
import com.meshnexus.model.RegistrationRequest;
import com.meshnexus.realtime.RealtimeHub;
import com.meshnexus.service.NodeRegistry;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/nodes")
@CoordinatorRole
@Slf4j
public class NodeController {

    @Autowired
    private NodeRegistry nodeRegistry;

    @Autowired
    private RealtimeHub realtimeHub;

    @Autowired
    private Clock clock;

    @GetMapping
    public List<Node> getAllNodes() {
        return nodeRegistry.nodes();
    }

    @GetMapping("/{nodeId}")
    public Node getNode(@PathVariable String nodeId) {
        return nodeRegistry.find(nodeId).orElseThrow(() -> new NodeNotFoundException(nodeId));
    }

    @PostMapping("/register")
    public Map<String, Object> register(@Valid @RequestBody RegistrationRequest request, HttpServletRequest httpRequest) {
        Node node = nodeRegistry.register(request, httpRequest.getRemoteAddr());
        realtimeHub.broadcast(RealtimeHub.NODES_UPDATE, nodeRegistry.nodes());
        return Map.of(
            "success", true,
            "nodeId", node.getId(),
            "message", "Node " + node.getId() + " registered successfully"
        );
    }

    @PostMapping("/{nodeId}/heartbeat")
    public HeartbeatResponse heartbeat(@PathVariable String nodeId, @RequestBody HeartbeatRecord record) {
        record.setNodeId(nodeId);
        if (record.getTimestamp() == null) {
            record.setTimestamp(clock.instant());
        }
        return nodeRegistry.ingestHeartbeat(nodeId, record)
                .map(HeartbeatResponse::accepted)
                .orElseGet(HeartbeatResponse::notRegistered);
    }

    @PostMapping("/{nodeId}/status")
    public Map<String, Object> statusReport(@PathVariable String nodeId, @RequestBody Map<String, Object> report) {
        nodeRegistry.recordStatusReport(nodeId, report);
        return Map.of("success", true, "nodeId", nodeId);
    }

    @PostMapping("/{nodeId}/diagnostics")
    public Map<String, Object> diagnostics(@PathVariable String nodeId, @RequestBody Map<String, Object> diagnostics) {
        nodeRegistry.recordDiagnostics(nodeId, diagnostics);
        log.info("Diagnostics received from node {}", nodeId);
        return Map.of("success", true, "nodeId", nodeId);
    }

    @PostMapping("/{nodeId}/action")
    public ActionResult action(@PathVariable String nodeId, @RequestBody Map<String, String> body) {
        NodeAction action = NodeAction.fromValue(body.get("action"));
        ActionResult result = nodeRegistry.dispatchAction(nodeId, action);
        if (action == NodeAction.DISCONNECT || action == NodeAction.RECONNECT) {
            realtimeHub.broadcast(RealtimeHub.NODES_UPDATE, nodeRegistry.nodes());
        }
        return result;
    }

    @PostMapping("/{nodeId}/commands")
    public Map<String, Object> queueCommand(@PathVariable String nodeId, @RequestBody NodeCommand command) {
        if (command.getType() == null || command.getType().isBlank()) {
            throw new IllegalArgumentException("Command type is required");
        }
        nodeRegistry.queueCommand(nodeId, command);
        return Map.of(
            "success", true,
            "nodeId", nodeId,
            "queued", command.getType()
        );
    }
}
