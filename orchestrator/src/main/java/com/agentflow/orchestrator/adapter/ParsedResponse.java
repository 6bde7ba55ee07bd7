package com.agentflow.orchestrator.adapter;

import java.util.List;
import java.util.Map;

/**
 * Normalized output of one agent turn.
 *
 * @param content      Raw (or aggregated) text content.
 * @param toolCalls    Tool calls in emission order; ids are unique within a response.
 * @param finishReason Why the turn ended.
 * @param metadata     Token counts, echoed model, duration. Never null; fields may be.
 */
public record ParsedResponse(
        String           content,
        List<ToolCall>   toolCalls,
        FinishReason     finishReason,
        ResponseMetadata metadata) {

    public ParsedResponse {
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
        metadata  = metadata == null ? ResponseMetadata.empty() : metadata;
    }

    public enum FinishReason { STOP, LENGTH, TOOL_CALL, CONTENT_FILTER, ERROR }

    /**
     * One structured tool invocation.
     *
     * @param arguments Parameter name to value. Values are strings, numbers,
     *                  booleans, lists or maps as decoded from the tool's output.
     */
    public record ToolCall(String name, Map<String, Object> arguments, String id) {
        public ToolCall {
            arguments = arguments == null ? Map.of() : arguments;
        }
    }

    public record ResponseMetadata(
            Integer inputTokens,
            Integer outputTokens,
            Long    durationMs,
            String  model) {

        public static ResponseMetadata empty() {
            return new ResponseMetadata(null, null, null, null);
        }
    }
}
