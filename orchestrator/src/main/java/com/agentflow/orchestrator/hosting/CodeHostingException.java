package com.agentflow.orchestrator.hosting;

/**
 * Thrown when the code-hosting service cannot be reached or answers with a
 * non-2xx status.
 */
public class CodeHostingException extends RuntimeException {

    public CodeHostingException(String message) {
        super(message);
    }

    public CodeHostingException(String message, Throwable cause) {
        super(message, cause);
    }
}
