package com.meshnexus.heartbeat;

/**
 * Ends the peer process so that its supervisor can start it again.
 */
public interface ProcessTerminator {

    void terminate(int exitCode);
}
