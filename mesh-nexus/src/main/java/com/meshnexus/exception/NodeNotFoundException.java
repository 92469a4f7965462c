package com.meshnexus.exception;

import lombok.Getter;

@Getter
public class NodeNotFoundException extends MeshNexusException {
    private final String nodeId;

    public NodeNotFoundException(String nodeId) {
        super("Node " + nodeId + " not found");
        this.nodeId = nodeId;
    }
}
