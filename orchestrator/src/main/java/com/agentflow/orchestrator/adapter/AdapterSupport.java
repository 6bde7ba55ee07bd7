package com.agentflow.orchestrator.adapter;

import com.agentflow.orchestrator.adapter.AgentConfig.LocalServer;
import com.agentflow.orchestrator.adapter.AgentConfig.ToolCapabilities;
import com.agentflow.orchestrator.config.AdapterProperties;
import com.agentflow.orchestrator.template.TemplatePaths;
import com.agentflow.orchestrator.template.TemplateRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;

/**
 * Behaviour every adapter shares: base validation, render-context assembly,
 * uniform tool rendering, container checks and the baseline health check.
 *
 * Each adapter owns one instance (composition). Instances are immutable and
 * safe to share across threads.
 */
public class AdapterSupport {

    private static final Logger log = LoggerFactory.getLogger(AdapterSupport.class);

    public static final int    MAX_TOKENS_LIMIT = 1_000_000;
    public static final double MIN_TEMPERATURE  = 0.0;
    public static final double MAX_TEMPERATURE  = 2.0;

    // Every tool entry runs through the same bridge-level runner.
    static final String TOOL_RUNNER = "tools";
    static final String TOOLS_URL_ENV = "TOOLS_SERVER_URL";

    private static final String HEALTH_TEMPLATE = "test: {{cliType}}";

    private final String           toolId;
    private final TemplateRenderer renderer;
    private final TemplatePaths    templatePaths;
    private final String           toolsUrl;
    private final Duration         healthCheckTimeout;

    public AdapterSupport(String toolId,
                          TemplateRenderer renderer,
                          TemplatePaths templatePaths,
                          AdapterProperties properties) {
        this.toolId             = Objects.requireNonNull(toolId, "toolId");
        this.renderer           = Objects.requireNonNull(renderer, "renderer");
        this.templatePaths      = Objects.requireNonNull(templatePaths, "templatePaths");
        this.toolsUrl           = properties.normalizedToolsServerUrl();
        this.healthCheckTimeout = properties.getHealthCheckTimeout();
    }

    public String toolId()   { return toolId; }
    public String toolsUrl() { return toolsUrl; }

    // ------------------------------------------------------------------
    // Validation
    // ------------------------------------------------------------------

    /**
     * Check the shape every tool relies on. Runs before any rendering.
     *
     * @throws AdapterException {@code VALIDATION}
     */
    public void validateBaseConfig(AgentConfig config) {
        if (config == null) {
            throw validation("Agent config is required");
        }
        if (config.toolId() == null || config.toolId().isBlank()) {
            throw validation("Tool id cannot be empty");
        }
        if (!toolId.equals(config.toolId())) {
            throw validation("CLI type mismatch: expected '" + toolId + "', got '" + config.toolId() + "'");
        }
        if (config.model() == null || config.model().isBlank()) {
            throw validation("Model cannot be empty");
        }
        if (config.maxTokens() < 1 || config.maxTokens() > MAX_TOKENS_LIMIT) {
            throw validation("Max tokens must be between 1 and 1,000,000");
        }
        // NaN fails both comparisons, so test the accepted range instead of the rejected one.
        if (!(config.temperature() >= MIN_TEMPERATURE && config.temperature() <= MAX_TEMPERATURE)) {
            throw validation("Temperature must be between 0.0 and 2.0");
        }
    }

    /** @throws AdapterException {@code INITIALIZATION} */
    public void validateContainer(ContainerContext container) {
        if (container == null) {
            throw new AdapterException(AdapterException.Kind.INITIALIZATION, "Container context is required");
        }
        if (container.containerName() == null || container.containerName().isBlank()) {
            throw new AdapterException(AdapterException.Kind.INITIALIZATION, "Container name cannot be empty");
        }
        if (container.workingDirectory() == null || container.workingDirectory().isBlank()) {
            throw new AdapterException(AdapterException.Kind.INITIALIZATION, "Working directory cannot be empty");
        }
    }

    // ------------------------------------------------------------------
    // Rendering
    // ------------------------------------------------------------------

    /**
     * Render context shared by all templates. Adapters add their own keys
     * on top of this map before rendering.
     */
    public Map<String, Object> baseContext(AgentConfig config) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("cliType",       toolId);
        ctx.put("correlationId", UUID.randomUUID().toString());
        ctx.put("timestamp",     Instant.now().toString());
        ctx.put("model",         config.model());
        ctx.put("maxTokens",     config.maxTokens());
        ctx.put("temperature",   config.temperature());
        ctx.put("toolsUrl",      toolsUrl);
        ctx.put("tools",         renderTools(config.tools()));
        return ctx;
    }

    /**
     * Turn the caller's capability list into tool entries, one per remote
     * name and one per enabled local integration, all with the same shape:
     * <pre>
     *   {name, command: "tools", args: [--url, URL, --tool|--server, name], env: {TOOLS_SERVER_URL}}
     * </pre>
     * Nothing is added that the caller did not ask for. Names are keys in
     * every config format, so a repeated name keeps only its first entry.
     */
    public List<Map<String, Object>> renderTools(ToolCapabilities tools) {
        List<Map<String, Object>> entries = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (String name : tools.remote()) {
            if (name == null || name.isBlank() || !seen.add(name.trim())) continue;
            entries.add(toolEntry(name.trim(), "--tool"));
        }
        for (LocalServer server : tools.localServers()) {
            if (!server.enabled() || server.name().isBlank() || !seen.add(server.name().trim())) continue;
            entries.add(toolEntry(server.name().trim(), "--server"));
        }
        return entries;
    }

    public String renderConfig(Map<String, Object> context) {
        return renderer.render(templatePaths.config(), context);
    }

    public String renderMemory(Map<String, Object> context) {
        return renderer.render(templatePaths.memory(), context);
    }

    // ------------------------------------------------------------------
    // Health
    // ------------------------------------------------------------------

    /**
     * Template engine liveness plus check latency.
     *
     * Healthy only if the probe template renders and the whole check took
     * less than the configured timeout.
     */
    public HealthStatus baselineHealthCheck() {
        long start = System.nanoTime();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("config_valid", true);

        boolean templatesWorking;
        try {
            String out = renderer.renderInline(HEALTH_TEMPLATE, Map.of("cliType", toolId));
            templatesWorking = out.contains(toolId);
        } catch (RuntimeException e) {
            log.warn("Template probe failed for adapter '{}': {}", toolId, e.getMessage());
            templatesWorking = false;
        }
        details.put("templates_working", templatesWorking);

        long durationMs = Duration.ofNanos(System.nanoTime() - start).toMillis();
        details.put("check_duration_ms", durationMs);

        if (templatesWorking && durationMs < healthCheckTimeout.toMillis()) {
            return HealthStatus.healthy("All health checks passed", details);
        }
        return HealthStatus.warning("Some health checks failed", details);
    }

    /**
     * Baseline check followed by the adapter's own synthetic checks.
     * A failing or throwing check lowers HEALTHY to WARNING.
     */
    public HealthStatus selfTest(Map<String, Callable<Boolean>> checks) {
        HealthStatus baseline = baselineHealthCheck();
        Map<String, Object> details = new LinkedHashMap<>(baseline.details());
        boolean allPassed = true;
        for (Map.Entry<String, Callable<Boolean>> check : checks.entrySet()) {
            boolean passed;
            try {
                passed = Boolean.TRUE.equals(check.getValue().call());
            } catch (Exception e) {
                log.debug("Self-test '{}' failed for adapter '{}': {}", check.getKey(), toolId, e.getMessage());
                passed = false;
            }
            details.put(check.getKey(), passed);
            allPassed &= passed;
        }
        HealthStatus combined = new HealthStatus(baseline.state(), baseline.message(), details, baseline.checkedAt());
        return allPassed ? combined : combined.degradeTo("Some adapter self-tests failed");
    }

    // ------------------------------------------------------------------
    // Parsing
    // ------------------------------------------------------------------

    /**
     * Id for the next tool call of one response. A provided id is kept unless
     * it was already issued; otherwise the first free {@code tool_n} is used.
     *
     * @param issued ids handed out so far for this response; updated in place
     */
    public static String uniqueToolCallId(String provided, Set<String> issued) {
        if (provided != null && !provided.isBlank() && issued.add(provided)) {
            return provided;
        }
        int n = issued.size();
        while (!issued.add("tool_" + n)) {
            n++;
        }
        return "tool_" + n;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Map<String, Object> toolEntry(String name, String selector) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("name",     name);
        entry.put("command",  TOOL_RUNNER);
        entry.put("args",     List.of("--url", toolsUrl, selector, name));
        entry.put("env",      Map.of(TOOLS_URL_ENV, toolsUrl));
        entry.put("toolsUrl", toolsUrl);
        return entry;
    }

    private static AdapterException validation(String message) {
        return new AdapterException(AdapterException.Kind.VALIDATION, message);
    }
}
