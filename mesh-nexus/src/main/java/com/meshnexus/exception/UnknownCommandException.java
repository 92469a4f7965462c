package com.meshnexus.exception;

import lombok.Getter;

@Getter
public class UnknownCommandException extends MeshNexusException {
    private final String commandType;

    public UnknownCommandException(String commandType) {
        super("Unknown command type: " + commandType);
        this.commandType = commandType;
    }
}
