package com.agentflow.orchestrator.adapter;

import java.util.Map;

/**
 * Minimal view of the container an agent runs in, passed to the adapter
 * lifecycle hooks. Name and working directory are required.
 */
public record ContainerContext(
        String              containerName,
        String              workingDirectory,
        String              namespace,
        Map<String, String> environment) {

    public ContainerContext {
        environment = environment == null ? Map.of() : Map.copyOf(environment);
    }

    public ContainerContext(String containerName, String workingDirectory) {
        this(containerName, workingDirectory, null, Map.of());
    }
}
