package com.meshnexus.event;

import com.meshnexus.model.NodeStatus;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

@Getter
public class NodeStatusChangedEvent extends ApplicationEvent {
    private final String nodeId;
    private final String address;
    private final NodeStatus previousStatus;
    private final NodeStatus newStatus;
    private final String reason; // probe, heartbeat, registration or action

    public NodeStatusChangedEvent(Object source, String nodeId, String address,
                                  NodeStatus previousStatus, NodeStatus newStatus, String reason) {
        super(source);
        this.nodeId = nodeId;
        this.address = address;
        this.previousStatus = previousStatus;
        this.newStatus = newStatus;
        this.reason = reason;
    }

    public boolean isDegradation() {
        return newStatus == NodeStatus.OFFLINE || newStatus == NodeStatus.ERROR || newStatus == NodeStatus.BLOCKED;
    }

    public boolean isRecovery() {
        return newStatus == NodeStatus.ONLINE && previousStatus != null && previousStatus != NodeStatus.ONLINE;
    }
}
