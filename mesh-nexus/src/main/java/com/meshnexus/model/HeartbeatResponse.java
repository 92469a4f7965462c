package com.meshnexus.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class HeartbeatResponse {
    private boolean success;
    private boolean registered;
    private List<NodeCommand> commands = new ArrayList<>();

    public static HeartbeatResponse accepted(List<NodeCommand> commands) {
        return new HeartbeatResponse(true, true, new ArrayList<>(commands));
    }

    public static HeartbeatResponse notRegistered() {
        return new HeartbeatResponse(false, false, new ArrayList<>());
    }
}
