package com.meshnexus.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Node {
    private String id;
    private String address;
    private NodeStatus status;
    private Instant lastSeen;
    private Instant discoveredAt;
    private MeshNeighbor meshInfo;
    private OverlayPeer overlayInfo;
    private Map<String, Object> stats = new HashMap<>();
    private Map<String, Object> network = new HashMap<>();
    private Map<String, Object> registration = new HashMap<>();
    private Map<String, Object> report = new HashMap<>();
    private Map<String, Object> diagnostics = new HashMap<>();
    private List<NodeCommand> pendingCommands = new ArrayList<>();

    public Node(String id, String address, Instant now) {
        this.id = id;
        this.address = address;
        this.status = NodeStatus.ONLINE;
        this.lastSeen = now;
        this.discoveredAt = now;
    }

    /**
     * Moves lastSeen forward. Older timestamps are ignored.
     */
    public void touch(Instant seen) {
        if (lastSeen == null || seen.isAfter(lastSeen)) {
            lastSeen = seen;
        }
    }

    public Node copy() {
        return new Node(id, address, status, lastSeen, discoveredAt,
                meshInfo != null ? meshInfo.toBuilder().build() : null,
                overlayInfo != null ? overlayInfo.toBuilder().build() : null,
                new HashMap<>(stats), new HashMap<>(network), new HashMap<>(registration),
                new HashMap<>(report), new HashMap<>(diagnostics), new ArrayList<>(pendingCommands));
    }
}
