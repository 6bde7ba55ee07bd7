package com.agentflow.orchestrator.stage;

/**
 * Thrown when the pipeline itself cannot proceed (as opposed to a stage's
 * agent failing).
 */
public class StageException extends RuntimeException {

    public enum Kind { UNKNOWN_STAGE, PRECONDITION_FAILED, ALREADY_RUNNING }

    private final Kind kind;

    public StageException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
