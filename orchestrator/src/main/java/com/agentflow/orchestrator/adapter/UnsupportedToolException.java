package com.agentflow.orchestrator.adapter;

public class UnsupportedToolException extends RuntimeException {
    public UnsupportedToolException(String toolId) {
        super("Unsupported CLI type: '" + toolId + "'");
    }
}
