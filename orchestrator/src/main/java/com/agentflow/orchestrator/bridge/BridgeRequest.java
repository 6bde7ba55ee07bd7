package com.agentflow.orchestrator.bridge;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One agent process to spawn and the prompt to hand it.
 *
 * @param runKey           Identifies the run for cancellation (one live run per key).
 * @param command          Executable and arguments.
 * @param workingDirectory Process working directory.
 * @param environment      Extra environment variables.
 * @param prompt           Prompt text, already in the tool's envelope.
 */
public record BridgeRequest(
        String              runKey,
        List<String>        command,
        Path                workingDirectory,
        Map<String, String> environment,
        String              prompt) {

    public BridgeRequest {
        Objects.requireNonNull(runKey, "runKey");
        Objects.requireNonNull(prompt, "prompt");
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command cannot be empty");
        }
        command     = List.copyOf(command);
        environment = environment == null ? Map.of() : Map.copyOf(environment);
    }
}
