package com.meshnexus.exception;

public class RegistrationFailureException extends MeshNexusException {
    public RegistrationFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
