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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Adapter for the Codex CLI.
 *
 * Config is TOML. Responses are a JSON document whose {@code commands}
 * array lists the shell commands the agent wants to run; each command
 * becomes one tool call.
 */
@Component
public class CodexAdapter implements AgentAdapter {

    private static final Logger log = LoggerFactory.getLogger(CodexAdapter.class);

    public static final String TOOL_ID = "codex";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final AdapterSupport         support;
    private final AdapterProperties.Tool settings;
    private final ObjectMapper           objectMapper;
    private final CapabilityDescriptor   capabilities;

    public CodexAdapter(TemplateRenderer renderer, AdapterProperties properties, ObjectMapper objectMapper) {
        this.settings     = properties.getCodex();
        this.support      = new AdapterSupport(TOOL_ID, renderer, settings.templatePaths(), properties);
        this.objectMapper = objectMapper;
        this.capabilities = new CapabilityDescriptor(
                false, false, true, true,
                settings.getMaxContextTokens(),
                "AGENTS.md",
                ConfigFormat.TOML,
                Set.of(AuthMethod.API_KEY));
    }

    @Override public String toolId() { return TOOL_ID; }

    /** Codex accepts any model name; the CLI resolves it at runtime. */
    @Override
    public boolean validateModel(String model) {
        return true;
    }

    @Override
    public String generateConfig(AgentConfig config) {
        support.validateBaseConfig(config);
        Map<String, Object> ctx = support.baseContext(config);
        ctx.put("modelProvider",   config.setting("modelProvider", "openai"));
        ctx.put("reasoningEffort", config.setting("reasoningEffort", "high"));
        // Least restrictive unless the caller overrides it explicitly.
        ctx.put("approvalPolicy",  config.setting("approvalPolicy", "never"));
        ctx.put("sandboxMode",     config.setting("sandboxMode", "danger-full-access"));
        return support.renderConfig(ctx);
    }

    @Override
    public String generateMemory(AgentConfig config) {
        support.validateBaseConfig(config);
        return support.renderMemory(support.baseContext(config));
    }

    @Override
    public String formatPrompt(String prompt) {
        return prompt;
    }

    @Override
    public ParsedResponse parseResponse(String response) {
        String text = response == null ? "" : response;
        JsonNode root;
        try {
            root = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            // Plain text output: no structured fields to extract.
            return new ParsedResponse(text, List.of(), FinishReason.STOP, ResponseMetadata.empty());
        }
        if (root == null || !root.isObject()) {
            return new ParsedResponse(text, List.of(), FinishReason.STOP, ResponseMetadata.empty());
        }

        List<ToolCall> calls = new ArrayList<>();
        JsonNode commands = root.path("commands");
        if (commands.isArray()) {
            for (int idx = 0; idx < commands.size(); idx++) {
                JsonNode command = commands.get(idx);
                String name = command.path("command").asText("local_shell");
                calls.add(new ToolCall(name, arguments(command.get("args")), "tool_" + idx));
            }
        }

        JsonNode usage = root.path("usage");
        ResponseMetadata metadata = new ResponseMetadata(
                intOrNull(usage.get("input_tokens")),
                intOrNull(usage.get("output_tokens")),
                null,
                root.hasNonNull("model") ? root.get("model").asText() : null);

        FinishReason reason = calls.isEmpty() ? FinishReason.STOP : FinishReason.TOOL_CALL;
        return new ParsedResponse(text, calls, reason, metadata);
    }

    @Override public CapabilityDescriptor capabilities() { return capabilities; }
    @Override public String memoryFilename()             { return capabilities.memoryFile(); }
    @Override public String executableName()             { return settings.getExecutable(); }

    @Override
    public void initialize(ContainerContext container) {
        support.validateContainer(container);
        log.info("Initialized Codex adapter for container '{}'", container.containerName());
    }

    @Override
    public void cleanup(ContainerContext container) {
        log.info("Cleaning up Codex adapter for container '{}'",
                container == null ? "?" : container.containerName());
    }

    @Override
    public HealthStatus healthCheck() {
        Map<String, Callable<Boolean>> checks = new LinkedHashMap<>();
        checks.put("model_validation", () -> validateModel("gpt-5-codex"));
        checks.put("config_generation", () ->
                !generateConfig(new AgentConfig(TOOL_ID, "gpt-5-codex", 1024, 0.5)).isBlank());
        checks.put("response_parsing", () ->
                parseResponse("{\"commands\":[{\"command\":\"ls\"}]}").toolCalls().size() == 1);
        return support.selfTest(checks);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** Object args are kept as-is, arrays go under "args", missing args give an empty map. */
    private Map<String, Object> arguments(JsonNode args) {
        if (args == null || args.isNull()) {
            return Map.of();
        }
        if (args.isObject()) {
            return objectMapper.convertValue(args, MAP_TYPE);
        }
        Map<String, Object> wrapped = new LinkedHashMap<>();
        wrapped.put("args", objectMapper.convertValue(args, Object.class));
        return wrapped;
    }

    private static Integer intOrNull(JsonNode node) {
        return node != null && node.canConvertToInt() ? node.asInt() : null;
    }
}
