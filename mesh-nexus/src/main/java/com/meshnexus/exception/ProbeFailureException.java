package com.meshnexus.exception;

/**
 * A collaborator call failed or timed out. Callers log it and carry on with partial data.
 */
public class ProbeFailureException extends MeshNexusException {
    public ProbeFailureException(String message) {
        super(message);
    }

    public ProbeFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
