package com.agentflow.orchestrator.bridge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;
import java.util.Map;

/**
 * The structured message an agent reads from its input channel: one JSON
 * line in the stream-json user-message shape.
 * <pre>
 *   {"type":"user","message":{"role":"user","content":[{"type":"text","text":"..."}]}}
 * </pre>
 */
public final class AgentInputMessage {

    private AgentInputMessage() {}

    /** Encode text as one newline-terminated JSON line. */
    public static String jsonLine(ObjectMapper objectMapper, String text) {
        Map<String, Object> message = Map.of(
                "type", "user",
                "message", Map.of(
                        "role", "user",
                        "content", List.of(Map.of("type", "text", "text", text))));
        try {
            return objectMapper.writeValueAsString(message) + "\n";
        } catch (JsonProcessingException e) {
            throw new BridgeException(BridgeException.Kind.PROCESS, "Failed to encode agent input", e);
        }
    }
}
