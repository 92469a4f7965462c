package com.meshnexus.probe;

import com.meshnexus.model.MeshNeighbor;
import com.meshnexus.model.MeshRoute;

import java.util.List;
import java.util.Map;

/**
 * Read side of the mesh routing layer. Implementations may throw
 * {@link com.meshnexus.exception.ProbeFailureException} when the underlying tooling fails;
 * an unreachable address is reported as {@code false}, not as an exception.
 */
public interface NetworkProbe {

    List<MeshNeighbor> listNeighbors();

    List<MeshRoute> listRoutes();

    boolean isReachable(String address, int timeoutMs);

    /**
     * Mesh interface state: {@code active}, {@code interface}, {@code gatewayMode} and any
     * implementation specific keys.
     */
    Map<String, Object> meshStatus();
}
