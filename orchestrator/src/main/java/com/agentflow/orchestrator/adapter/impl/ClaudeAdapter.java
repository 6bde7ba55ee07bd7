package com.agentflow.orchestrator.adapter.impl;

import com.agentflow.orchestrator.adapter.*;
import com.agentflow.orchestrator.adapter.CapabilityDescriptor.AuthMethod;
import com.agentflow.orchestrator.adapter.CapabilityDescriptor.ConfigFormat;
import com.agentflow.orchestrator.adapter.ParsedResponse.FinishReason;
import com.agentflow.orchestrator.adapter.ParsedResponse.ResponseMetadata;
import com.agentflow.orchestrator.adapter.ParsedResponse.ToolCall;
import com.agentflow.orchestrator.config.AdapterProperties;
import com.agentflow.orchestrator.template.TemplateRenderer;
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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Adapter for the {@code claude} CLI.
 *
 * Config is JSON with an {@code mcpServers} block; responses carry tool
 * calls as tagged markup:
 * <pre>
 *   &lt;function_calls&gt;
 *     &lt;invoke name="read_file"&gt;
 *       &lt;parameter name="path"&gt;src/Main.java&lt;/parameter&gt;
 *     &lt;/invoke&gt;
 *   &lt;/function_calls&gt;
 * </pre>
 */
@Component
public class ClaudeAdapter implements AgentAdapter {

    private static final Logger log = LoggerFactory.getLogger(ClaudeAdapter.class);

    public static final String TOOL_ID = "claude";

    private static final Pattern FUNCTION_CALLS = Pattern.compile(
            "<function_calls>(.*?)</function_calls>", Pattern.DOTALL);

    private static final Pattern INVOKE = Pattern.compile(
            "<invoke\\s+name=\"([^\"]+)\"\\s*>(.*?)</invoke>", Pattern.DOTALL);

    private static final Pattern PARAMETER = Pattern.compile(
            "<parameter\\s+name=\"([^\"]+)\"\\s*>(.*?)</parameter>", Pattern.DOTALL);

    // Known families; anything else is still accepted, just logged.
    private static final Pattern KNOWN_MODEL = Pattern.compile(
            "^(claude-.+|opus|sonnet|haiku)$", Pattern.CASE_INSENSITIVE);

    // Unattended runs: an approval prompt is a hang.
    private static final String DEFAULT_PERMISSION_MODE = "bypassPermissions";

    private final AdapterSupport           support;
    private final AdapterProperties.Tool   settings;
    private final ObjectMapper             objectMapper;
    private final CapabilityDescriptor     capabilities;

    public ClaudeAdapter(TemplateRenderer renderer, AdapterProperties properties, ObjectMapper objectMapper) {
        this.settings     = properties.getClaude();
        this.support      = new AdapterSupport(TOOL_ID, renderer, settings.templatePaths(), properties);
        this.objectMapper = objectMapper;
        this.capabilities = new CapabilityDescriptor(
                true, false, true, true,
                settings.getMaxContextTokens(),
                "CLAUDE.md",
                ConfigFormat.JSON,
                Set.of(AuthMethod.SESSION_TOKEN));
    }

    @Override public String toolId() { return TOOL_ID; }

    @Override
    public boolean validateModel(String model) {
        if (model == null || model.isBlank()) return false;
        if (!KNOWN_MODEL.matcher(model.trim()).matches()) {
            log.debug("Model '{}' does not look like a Claude model; accepting anyway", model);
        }
        return true;
    }

    @Override
    public String generateConfig(AgentConfig config) {
        support.validateBaseConfig(config);
        Map<String, Object> ctx = support.baseContext(config);
        ctx.put("permissionMode", config.setting("permissionMode", DEFAULT_PERMISSION_MODE));
        String rendered = support.renderConfig(ctx);
        log.debug("Generated Claude config ({} chars, {} tools)", rendered.length(), config.tools().remote().size());
        return rendered;
    }

    @Override
    public String generateMemory(AgentConfig config) {
        support.validateBaseConfig(config);
        return support.renderMemory(support.baseContext(config));
    }

    @Override
    public String formatPrompt(String prompt) {
        return "Human: " + prompt + "\n\nAssistant: ";
    }

    @Override
    public ParsedResponse parseResponse(String response) {
        String text = response == null ? "" : response;
        List<ToolCall> calls = new ArrayList<>();

        Matcher block = FUNCTION_CALLS.matcher(text);
        while (block.find()) {
            Matcher invoke = INVOKE.matcher(block.group(1));
            while (invoke.find()) {
                calls.add(new ToolCall(invoke.group(1).trim(),
                        parameters(invoke.group(2)),
                        "tool_" + calls.size()));
            }
        }

        FinishReason reason = calls.isEmpty() ? FinishReason.STOP : FinishReason.TOOL_CALL;
        return new ParsedResponse(text, calls, reason, ResponseMetadata.empty());
    }

    @Override public CapabilityDescriptor capabilities() { return capabilities; }
    @Override public String memoryFilename()             { return capabilities.memoryFile(); }
    @Override public String executableName()             { return settings.getExecutable(); }

    @Override
    public void initialize(ContainerContext container) {
        support.validateContainer(container);
        log.info("Initialized Claude adapter for container '{}' (memory file {}/{})",
                container.containerName(), container.workingDirectory(), memoryFilename());
    }

    @Override
    public void cleanup(ContainerContext container) {
        log.info("Cleaning up Claude adapter for container '{}'",
                container == null ? "?" : container.containerName());
    }

    @Override
    public HealthStatus healthCheck() {
        Map<String, Callable<Boolean>> checks = new LinkedHashMap<>();
        checks.put("model_validation", () -> validateModel("claude-3-opus"));
        checks.put("config_generation", () ->
                !generateConfig(new AgentConfig(TOOL_ID, "claude-3-opus", 1024, 0.5)).isBlank());
        checks.put("response_parsing", () ->
                "Hello, world!".equals(parseResponse("Hello, world!").content()));
        return support.selfTest(checks);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Map<String, Object> parameters(String invokeBody) {
        Map<String, Object> args = new LinkedHashMap<>();
        Matcher p = PARAMETER.matcher(invokeBody);
        while (p.find()) {
            args.put(p.group(1).trim(), parameterValue(p.group(2).trim()));
        }
        return args;
    }

    /** Structured values (objects, arrays) are decoded; everything else stays a string. */
    private Object parameterValue(String raw) {
        if (raw.startsWith("{") || raw.startsWith("[")) {
            try {
                return objectMapper.readValue(raw, Object.class);
            } catch (Exception e) {
                log.debug("Parameter value is not valid JSON, keeping raw text: {}", e.getMessage());
            }
        }
        return raw;
    }
}
