package com.meshnexus.probe;

import com.meshnexus.exception.ProbeFailureException;
import com.meshnexus.model.MeshNeighbor;
import com.meshnexus.model.MeshRoute;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Used when no mesh routing layer is wired in. Reachability is checked with
 * {@link InetAddress#isReachable(int)}; neighbor and route tables are always empty.
 */
@Slf4j
public class StandaloneNetworkProbe implements NetworkProbe {
    private final String meshInterface;

    public StandaloneNetworkProbe(String meshInterface) {
        this.meshInterface = meshInterface;
    }

    @Override
    public List<MeshNeighbor> listNeighbors() {
        return List.of();
    }

    @Override
    public List<MeshRoute> listRoutes() {
        return List.of();
    }

    @Override
    public boolean isReachable(String address, int timeoutMs) {
        try {
            return InetAddress.getByName(address).isReachable(timeoutMs);
        } catch (UnknownHostException e) {
            log.debug("Cannot resolve {}: {}", address, e.getMessage());
            return false;
        } catch (IOException e) {
            throw new ProbeFailureException("Reachability check for " + address + " failed", e);
        }
    }

    @Override
    public Map<String, Object> meshStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("active", false);
        status.put("interface", meshInterface);
        status.put("gatewayMode", "off");
        status.put("neighborCount", 0);
        status.put("routeCount", 0);
        return status;
    }
}
