package com.agentflow.orchestrator.stage;

import com.agentflow.orchestrator.adapter.AdapterException;
import com.agentflow.orchestrator.adapter.UnsupportedToolException;
import com.agentflow.orchestrator.bridge.BridgeException;
import com.agentflow.orchestrator.hosting.CodeHostingException;

/**
 * Classification of a stage failure, used for retry decisions and for the
 * escalation message.
 */
public enum FailureKind {

    VALIDATION(false),
    TEMPLATE(false),
    UNSUPPORTED_TOOL(false),
    INITIALIZATION(false),
    UNKNOWN_STAGE(false),
    CANCELLED(false),
    PROCESS(true),
    DELIVERY(true),
    EXTERNAL(true),
    INTERNAL(true);

    private final boolean transientFailure;

    FailureKind(boolean transientFailure) {
        this.transientFailure = transientFailure;
    }

    /** Whether a failure of this kind can succeed on a later attempt. */
    public boolean isTransient() {
        return transientFailure;
    }

    public static FailureKind classify(Throwable error) {
        if (interrupted(error)) return CANCELLED;
        if (error instanceof AdapterException e) {
            return switch (e.getKind()) {
                case VALIDATION     -> VALIDATION;
                case TEMPLATE       -> TEMPLATE;
                case INITIALIZATION -> INITIALIZATION;
            };
        }
        if (error instanceof UnsupportedToolException) return UNSUPPORTED_TOOL;
        if (error instanceof BridgeException e) {
            return switch (e.getKind()) {
                case PROCESS   -> PROCESS;
                case DELIVERY  -> DELIVERY;
                case CANCELLED -> CANCELLED;
            };
        }
        if (error instanceof CodeHostingException) return EXTERNAL;
        if (error instanceof StageException e && e.getKind() == StageException.Kind.UNKNOWN_STAGE) {
            return UNKNOWN_STAGE;
        }
        return INTERNAL;
    }

    // An interrupt anywhere in the chain means the worker was cancelled,
    // whichever collaborator happened to be blocked at the time.
    private static boolean interrupted(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof InterruptedException) return true;
        }
        return false;
    }
}
