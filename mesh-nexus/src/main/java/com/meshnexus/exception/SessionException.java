package com.meshnexus.exception;

import lombok.Getter;

/**
 * Protocol violation by a realtime observer. The offending session is closed.
 */
@Getter
public class SessionException extends MeshNexusException {
    private final String sessionId;

    public SessionException(String sessionId, String message) {
        super(message);
        this.sessionId = sessionId;
    }

    public SessionException(String sessionId, String message, Throwable cause) {
        super(message, cause);
        this.sessionId = sessionId;
    }
}
