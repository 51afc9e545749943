package com.agentdaemon.common.exception;

public class DaemonException extends RuntimeException {
    private final String component;

    public DaemonException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public DaemonException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
