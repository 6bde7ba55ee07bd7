package com.agentflow.orchestrator.adapter;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One request to configure an agent run.
 *
 * Built per stage invocation and discarded once the config is rendered.
 * Bounds are checked by {@link AdapterSupport#validateBaseConfig}, not here,
 * so that a bad request surfaces as a {@code VALIDATION} error from the adapter.
 *
 * @param toolId      Must equal the target adapter's {@link AgentAdapter#toolId()}.
 * @param model       Opaque model id, passed through unvalidated.
 * @param maxTokens   Output token limit, 1..1,000,000.
 * @param temperature Sampling temperature, 0.0..2.0.
 * @param tools       Remote tool names and local integrations to expose to the agent.
 * @param passthrough Raw tool-specific settings; may carry a nested {@code settings} map.
 */
public record AgentConfig(
        String           toolId,
        String           model,
        int              maxTokens,
        double           temperature,
        ToolCapabilities tools,
        Map<String, Object> passthrough) {

    public AgentConfig {
        tools       = tools == null ? ToolCapabilities.none() : tools;
        passthrough = passthrough == null ? Map.of() : Map.copyOf(passthrough);
    }

    public AgentConfig(String toolId, String model, int maxTokens, double temperature) {
        this(toolId, model, maxTokens, temperature, ToolCapabilities.none(), Map.of());
    }

    public AgentConfig withTools(ToolCapabilities tools) {
        return new AgentConfig(toolId, model, maxTokens, temperature, tools, passthrough);
    }

    /**
     * Look up a string setting, first in the nested {@code settings} map and
     * then at the top level of the passthrough.
     */
    public String setting(String key, String fallback) {
        Object nested = passthrough.get("settings");
        if (nested instanceof Map<?, ?> settings && settings.get(key) instanceof String s && !s.isBlank()) {
            return s;
        }
        if (passthrough.get(key) instanceof String s && !s.isBlank()) {
            return s;
        }
        return fallback;
    }

    /** Raw setting of any type, same lookup order as {@link #setting}; null when absent. */
    public Object settingValue(String key) {
        Object nested = passthrough.get("settings");
        if (nested instanceof Map<?, ?> settings && settings.get(key) != null) {
            return settings.get(key);
        }
        return passthrough.get(key);
    }

    /**
     * Tool capability list. Entries are rendered uniformly; no name is special.
     *
     * @param remote       Tool names served by the shared tools endpoint.
     * @param localServers Local integrations; only enabled ones are rendered.
     */
    public record ToolCapabilities(List<String> remote, List<LocalServer> localServers) {

        public ToolCapabilities {
            remote       = remote == null ? List.of() : List.copyOf(remote);
            localServers = localServers == null ? List.of() : List.copyOf(localServers);
        }

        public static ToolCapabilities none() {
            return new ToolCapabilities(List.of(), List.of());
        }

        public static ToolCapabilities remote(String... names) {
            return new ToolCapabilities(List.of(names), List.of());
        }
    }

    public record LocalServer(String name, boolean enabled) {
        public LocalServer {
            Objects.requireNonNull(name, "name");
        }
    }
}
