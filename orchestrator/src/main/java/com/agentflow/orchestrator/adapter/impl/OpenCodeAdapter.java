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
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Adapter for the OpenCode CLI.
 *
 * Settings in the passthrough may override the model, output limit and
 * temperature under either of their usual spellings ({@code maxTokens} or
 * {@code max_output_tokens}, {@code temperature} or {@code temp}); overrides
 * are checked against the same bounds as the request itself.
 *
 * Output is JSON lines:
 * <pre>
 *   {"message":"Started run","model":"opencode-sonnet"}
 *   {"commands":[{"command":"shell","args":{"cmd":"ls"}}],"usage":{"input_tokens":120,"output_tokens":32}}
 * </pre>
 */
@Component
public class OpenCodeAdapter implements AgentAdapter {

    private static final Logger log = LoggerFactory.getLogger(OpenCodeAdapter.class);

    public static final String TOOL_ID = "opencode";

    static final String DEFAULT_PROVIDER         = "openai";
    static final String DEFAULT_PROVIDER_ENV_KEY = "OPENAI_API_KEY";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final AdapterSupport         support;
    private final AdapterProperties.Tool settings;
    private final ObjectMapper           objectMapper;
    private final CapabilityDescriptor   capabilities;

    public OpenCodeAdapter(TemplateRenderer renderer, AdapterProperties properties, ObjectMapper objectMapper) {
        this.settings     = properties.getOpencode();
        this.support      = new AdapterSupport(TOOL_ID, renderer, settings.templatePaths(), properties);
        this.objectMapper = objectMapper;
        this.capabilities = new CapabilityDescriptor(
                true, true, true, true,
                settings.getMaxContextTokens(),
                "OPENCODE.md",
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
        AgentConfig effective = withOverrides(config);
        support.validateBaseConfig(effective);

        Map<String, Object> ctx = support.baseContext(effective);
        ctx.put("instructions",   config.setting("instructions", null));
        ctx.put("providerName",   providerSetting(config, "name", DEFAULT_PROVIDER));
        ctx.put("providerEnvKey", providerSetting(config, "envKey", DEFAULT_PROVIDER_ENV_KEY));
        String rendered = support.renderConfig(ctx);
        log.debug("OpenCode config generated ({} chars)", rendered.length());
        return rendered;
    }

    @Override
    public String generateMemory(AgentConfig config) {
        support.validateBaseConfig(config);
        Map<String, Object> ctx = support.baseContext(withOverrides(config));
        ctx.put("instructions", config.setting("instructions", null));
        return support.renderMemory(ctx);
    }

    /** The prompt is read as one line of input; a trailing newline submits it. */
    @Override
    public String formatPrompt(String prompt) {
        return prompt.endsWith("\n") ? prompt : prompt + "\n";
    }

    @Override
    public ParsedResponse parseResponse(String response) {
        String text = response == null ? "" : response;
        List<String>   messages  = new ArrayList<>();
        List<String>   plain     = new ArrayList<>();
        List<ToolCall> calls     = new ArrayList<>();
        Set<String>    issuedIds = new HashSet<>();

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

            String message = firstText(event, "message", "text");
            if (message != null) {
                messages.add(message);
            }
            JsonNode commands = event.path("commands");
            if (commands.isArray()) {
                for (JsonNode command : commands) {
                    String name = command.path("command").asText("opencode_command");
                    String provided = firstText(command, "id", "callId");
                    calls.add(new ToolCall(name, arguments(command.get("args")),
                            AdapterSupport.uniqueToolCallId(provided, issuedIds)));
                }
            }

            String lineModel = firstText(event, "model", "modelId");
            if (lineModel != null) {
                model = lineModel;
            }
            JsonNode usage = event.path("usage");
            inputTokens  = firstInt(usage, inputTokens, "input_tokens", "inputTokens", "prompt_tokens");
            outputTokens = firstInt(usage, outputTokens, "output_tokens", "outputTokens", "completion_tokens");
            Integer duration = firstInt(event, null, "duration_ms", "durationMs");
            if (duration != null) {
                durationMs = duration.longValue();
            }
        }

        if (!plain.isEmpty()) {
            messages.add(String.join("\n", plain));
        }
        String content = messages.isEmpty() ? text.trim() : String.join("\n", messages);
        FinishReason reason = calls.isEmpty() ? FinishReason.STOP : FinishReason.TOOL_CALL;
        return new ParsedResponse(content, calls, reason,
                new ResponseMetadata(inputTokens, outputTokens, durationMs, model));
    }

    @Override public CapabilityDescriptor capabilities() { return capabilities; }
    @Override public String memoryFilename()             { return capabilities.memoryFile(); }
    @Override public String executableName()             { return settings.getExecutable(); }

    @Override
    public void initialize(ContainerContext container) {
        support.validateContainer(container);
        log.info("Initialized OpenCode adapter for container '{}'", container.containerName());
    }

    @Override
    public void cleanup(ContainerContext container) {
        log.info("Cleaning up OpenCode adapter for container '{}'",
                container == null ? "?" : container.containerName());
    }

    @Override
    public HealthStatus healthCheck() {
        AgentConfig probe = new AgentConfig(TOOL_ID, "gpt-4.1", 4096, 0.3);
        Map<String, Callable<Boolean>> checks = new LinkedHashMap<>();
        checks.put("model_validation",  () -> validateModel(probe.model()));
        checks.put("config_generation", () -> !generateConfig(probe).isBlank());
        checks.put("memory_render",     () -> !generateMemory(probe).isBlank());
        checks.put("response_parsing",  () -> parseResponse("{}").finishReason() == FinishReason.STOP);
        return support.selfTest(checks);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    AgentConfig withOverrides(AgentConfig config) {
        String model = firstNonBlank(config.setting("model", null), config.setting("defaultModel", null), config.model());
        int maxTokens = firstNumber(config, "maxTokens", "max_output_tokens")
                .map(Number::intValue)
                .orElse(config.maxTokens());
        double temperature = firstNumber(config, "temperature", "temp")
                .map(Number::doubleValue)
                .orElse(config.temperature());
        return new AgentConfig(config.toolId(), model, maxTokens, temperature, config.tools(), config.passthrough());
    }

    private static Optional<Number> firstNumber(AgentConfig config, String... keys) {
        for (String key : keys) {
            if (config.settingValue(key) instanceof Number n) {
                return Optional.of(n);
            }
        }
        return Optional.empty();
    }

    private static String providerSetting(AgentConfig config, String key, String fallback) {
        if (config.settingValue("provider") instanceof Map<?, ?> provider
                && provider.get(key) instanceof String s && !s.isBlank()) {
            return s;
        }
        return fallback;
    }

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

    private static String firstText(JsonNode node, String... keys) {
        for (String key : keys) {
            JsonNode value = node.get(key);
            if (value != null && value.isTextual()) {
                return value.asText();
            }
        }
        return null;
    }

    private static Integer firstInt(JsonNode node, Integer fallback, String... keys) {
        for (String key : keys) {
            JsonNode value = node.get(key);
            if (value != null && value.isIntegralNumber() && value.canConvertToInt()) {
                return value.asInt();
            }
        }
        return fallback;
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) return value;
        }
        return null;
    }
}
