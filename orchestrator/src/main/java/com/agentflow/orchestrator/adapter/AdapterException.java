package com.agentflow.orchestrator.adapter;

/**
 * Thrown when an adapter cannot do what was asked of it.
 *
 * Every kind here is a hard local failure for the stage that triggered it:
 * the stage runner never retries these. Unparseable agent output is not
 * one of them: parsers fall back to plain content instead of throwing.
 */
public class AdapterException extends RuntimeException {

    public enum Kind { VALIDATION, TEMPLATE, INITIALIZATION }

    private final Kind kind;

    public AdapterException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public AdapterException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
