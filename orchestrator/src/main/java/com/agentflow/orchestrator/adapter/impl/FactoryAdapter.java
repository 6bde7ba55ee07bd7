package com.agentflow.orchestrator.adapter.impl;

import com.agentflow.orchestrator.adapter.*;
import com.agentflow.orchestrator.adapter.CapabilityDescriptor.AuthMethod;
import com.agentflow.orchestrator.adapter.CapabilityDescriptor.ConfigFormat;
import com.agentflow.orchestrator.adapter.ParsedResponse.FinishReason;
import com.agentflow.orchestrator.adapter.ParsedResponse.ResponseMetadata;
import com.agentflow.orchestrator.adapter.ParsedResponse.ToolCall;
import com.agentflow.orchestrator.config.AdapterProperties;
import com.agentflow.orchestrator.template.TemplateRenderer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Adapter for the Factory "droid" CLI.
 *
 * The CLI prints one JSON event per line:
 * <pre>
 *   {"type":"message","role":"assistant","text":"Running tasks"}
 *   {"type":"tool_call","toolName":"Execute","parameters":{"command":"ls"},"id":"call_1"}
 *   {"type":"result","is_error":false,"result":"Done","model":"...","duration_ms":987,
 *    "usage":{"input_tokens":128,"output_tokens":256}}
 * </pre>
 * Lines that are not JSON are kept as plain content.
 */
@Component
public class FactoryAdapter implements AgentAdapter {

    private static final Logger log = LoggerFactory.getLogger(FactoryAdapter.class);

    public static final String TOOL_ID = "factory";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final AdapterSupport         support;
    private final AdapterProperties.Tool settings;
    private final ObjectMapper           objectMapper;
    private final CapabilityDescriptor   capabilities;

    public FactoryAdapter(TemplateRenderer renderer, AdapterProperties properties, ObjectMapper objectMapper) {
        this.settings     = properties.getFactory();
        this.support      = new AdapterSupport(TOOL_ID, renderer, settings.templatePaths(), properties);
        this.objectMapper = objectMapper;
        this.capabilities = new CapabilityDescriptor(
                true, false, true, true,
                settings.getMaxContextTokens(),
                "AGENTS.md",
                ConfigFormat.JSON,
                Set.of(AuthMethod.API_KEY));
    }

    @Override public String toolId() { return TOOL_ID; }

    @Override
    public boolean validateModel(String model) {
        return model != null && !model.isBlank();
    }

    @Override
    public String generateConfig(AgentConfig config) {
        support.validateBaseConfig(config);
        Map<String, Object> ctx = support.baseContext(config);
        ctx.put("autonomyLevel",   config.setting("autonomyLevel", "high"));
        ctx.put("reasoningEffort", config.setting("reasoningEffort", "high"));
        ctx.put("outputFormat",    config.setting("outputFormat", "stream-json"));
        return support.renderConfig(ctx);
    }

    @Override
    public String generateMemory(AgentConfig config) {
        support.validateBaseConfig(config);
        return support.renderMemory(support.baseContext(config));
    }

    /** droid reads the prompt line by line from stdin; a trailing newline submits it. */
    @Override
    public String formatPrompt(String prompt) {
        return prompt.endsWith("\n") ? prompt : prompt + "\n";
    }

    @Override
    public ParsedResponse parseResponse(String response) {
        String text = response == null ? "" : response;
        List<String>   messages = new ArrayList<>();
        List<String>   plain    = new ArrayList<>();
        List<ToolCall> calls    = new ArrayList<>();
        Set<String>    issuedIds = new HashSet<>();
        FinishReason   reason   = FinishReason.STOP;

        Integer inputTokens  = null;
        Integer outputTokens = null;
        Long    durationMs   = null;
        String  model        = null;

        for (String rawLine : text.split("\\R")) {
            String line = rawLine.trim();
            if (line.isEmpty()) continue;

            JsonNode event;
            try {
                event = objectMapper.readTree(line);
            } catch (JsonProcessingException e) {
                plain.add(line);
                continue;
            }
            if (event == null || !event.isObject()) {
                plain.add(line);
                continue;
            }

            switch (event.path("type").asText("")) {
                case "message" -> {
                    String role = event.path("role").asText("assistant");
                    if (role.equalsIgnoreCase("assistant") && event.hasNonNull("text")) {
                        messages.add(event.get("text").asText());
                    }
                }
                case "tool_call" -> {
                    String name = event.path("toolName").asText("tool_call");
                    String provided = event.hasNonNull("id") ? event.get("id").asText()
                            : event.hasNonNull("callId") ? event.get("callId").asText()
                            : null;
                    calls.add(new ToolCall(name, parameters(event.get("parameters")),
                            AdapterSupport.uniqueToolCallId(provided, issuedIds)));
                }
                case "result" -> {
                    JsonNode isError = event.has("is_error") ? event.get("is_error") : event.get("isError");
                    if (isError != null && isError.asBoolean(false)) {
                        reason = FinishReason.ERROR;
                    }
                    if (event.hasNonNull("result")) {
                        messages.add(event.get("result").asText());
                    } else if (event.hasNonNull("message")) {
                        messages.add(event.get("message").asText());
                    }
                    if (event.hasNonNull("model")) {
                        model = event.get("model").asText();
                    }
                    JsonNode duration = event.has("duration_ms") ? event.get("duration_ms") : event.get("durationMs");
                    if (duration != null && duration.canConvertToLong()) {
                        durationMs = duration.asLong();
                    }
                    JsonNode usage = event.path("usage");
                    inputTokens  = firstInt(usage, "input_tokens", "inputTokens", inputTokens);
                    outputTokens = firstInt(usage, "output_tokens", "outputTokens", outputTokens);
                }
                case "error" -> {
                    reason = FinishReason.ERROR;
                    if (event.hasNonNull("message")) {
                        messages.add(event.get("message").asText());
                    }
                }
                default -> {
                    if (event.hasNonNull("text")) {
                        messages.add(event.get("text").asText());
                    }
                }
            }
        }

        if (!plain.isEmpty()) {
            messages.add(String.join("\n", plain));
        }
        if (reason == FinishReason.STOP && !calls.isEmpty()) {
            reason = FinishReason.TOOL_CALL;
        }
        String content = messages.isEmpty() ? text.trim() : String.join("\n", messages);
        return new ParsedResponse(content, calls, reason,
                new ResponseMetadata(inputTokens, outputTokens, durationMs, model));
    }

    @Override public CapabilityDescriptor capabilities() { return capabilities; }
    @Override public String memoryFilename()             { return capabilities.memoryFile(); }
    @Override public String executableName()             { return settings.getExecutable(); }

    @Override
    public void initialize(ContainerContext container) {
        support.validateContainer(container);
        log.info("Initialized Factory adapter for container '{}'", container.containerName());
    }

    @Override
    public void cleanup(ContainerContext container) {
        log.info("Cleaning up Factory adapter for container '{}'",
                container == null ? "?" : container.containerName());
    }

    @Override
    public HealthStatus healthCheck() {
        Map<String, Callable<Boolean>> checks = new LinkedHashMap<>();
        checks.put("model_validation", () -> validateModel("gpt-5-factory"));
        checks.put("config_generation", () ->
                !generateConfig(new AgentConfig(TOOL_ID, "gpt-5-factory", 1024, 0.5)).isBlank());
        checks.put("response_parsing", () -> parseResponse(
                "{\"type\":\"result\",\"is_error\":false,\"result\":\"ok\",\"usage\":{\"input_tokens\":1}}")
                .metadata().inputTokens() != null);
        return support.selfTest(checks);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Map<String, Object> parameters(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Map.of();
        }
        return objectMapper.convertValue(node, MAP_TYPE);
    }

    private static Integer firstInt(JsonNode usage, String snake, String camel, Integer fallback) {
        JsonNode value = usage.has(snake) ? usage.get(snake) : usage.get(camel);
        return value != null && value.canConvertToInt() ? Integer.valueOf(value.asInt()) : fallback;
    }
}
