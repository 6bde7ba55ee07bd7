package com.agentflow.orchestrator.bridge;

/**
 * Thrown by the subprocess bridge.
 *
 * {@code DELIVERY} is raised only by the companion path and always triggers
 * the direct-pipe fallback before anything is surfaced to the stage runner.
 */
public class BridgeException extends RuntimeException {

    public enum Kind { PROCESS, DELIVERY, CANCELLED }

    private final Kind kind;

    public BridgeException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public BridgeException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
