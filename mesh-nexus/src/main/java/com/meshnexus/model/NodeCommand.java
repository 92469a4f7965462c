package com.meshnexus.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Command queued by the coordinator and carried back to a peer in a heartbeat response.
 * The type is a free string so that peers can skip types they do not understand.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class NodeCommand {
    public static final String RESTART = "restart";
    public static final String APPLY_CONFIG = "apply_config";
    public static final String RUN_DIAGNOSTICS = "run_diagnostics";
    public static final String SEND_STATUS = "send_status";

    private String type;
    private Map<String, Object> config = new HashMap<>();

    public NodeCommand(String type) {
        this.type = type;
    }
}
