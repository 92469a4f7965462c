package com.meshnexus.exception;

public class HeartbeatTimeoutException extends MeshNexusException {
    public HeartbeatTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
