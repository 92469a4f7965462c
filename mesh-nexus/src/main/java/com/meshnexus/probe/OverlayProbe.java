package com.meshnexus.probe;

import com.meshnexus.model.OverlayNetwork;
import com.meshnexus.model.OverlayPeer;

import java.util.List;
import java.util.Map;

public interface OverlayProbe {

    List<OverlayPeer> listPeers();

    List<OverlayNetwork> listNetworks();

    /**
     * Overlay client state. {@code online} (boolean) is expected; other keys are passed through.
     */
    Map<String, Object> overlayStatus();
}
