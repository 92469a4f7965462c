package com.meshnexus.exception;

public class MeshNexusException extends RuntimeException {
    public MeshNexusException(String message) {
        super(message);
    }

    public MeshNexusException(String message, Throwable cause) {
        super(message, cause);
    }
}
