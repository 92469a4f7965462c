package com.meshnexus.probe;

import com.meshnexus.model.OverlayNetwork;
import com.meshnexus.model.OverlayPeer;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class StandaloneOverlayProbe implements OverlayProbe {

    @Override
    public List<OverlayPeer> listPeers() {
        return List.of();
    }

    @Override
    public List<OverlayNetwork> listNetworks() {
        return List.of();
    }

    @Override
    public Map<String, Object> overlayStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("online", false);
        status.put("configured", false);
        return status;
    }
}
