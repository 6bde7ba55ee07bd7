package com.agentflow.orchestrator.config;

import com.agentflow.orchestrator.template.TemplatePaths;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Optional;

/**
 * Settings shared by all adapters plus one block per built-in tool.
 *
 * <pre>
 * agentflow:
 *   adapters:
 *     tools-server-url: ${TOOLS_SERVER_URL:...}
 *     claude:
 *       max-context-tokens: ${CLAUDE_MAX_CONTEXT_TOKENS:200000}
 * </pre>
 */
@ConfigurationProperties(prefix = "agentflow.adapters")
public class AdapterProperties {

    private String   toolsServerUrl     = "http://tools.cto.svc.cluster.local:3000/mcp";
    private Duration healthCheckTimeout = Duration.ofSeconds(10);

    private Tool claude   = new Tool("code/claude/config.json.hbs", "code/claude/memory.md.hbs",
            ".claude/settings.json", "claude", 200_000, 4096, 0.7);
    private Tool codex    = new Tool("code/codex/config.toml.hbs", "code/codex/agents.md.hbs",
            ".codex/config.toml", "codex", 128_000, 8192, 0.7);
    private Tool factory  = new Tool("code/factory/factory-cli-config.json.hbs", "code/factory/agents.md.hbs",
            ".factory/config.json", "droid", 200_000, 8192, 0.7);
    private Tool opencode = new Tool("code/opencode/config.json.hbs", "code/opencode/memory.md.hbs",
            "opencode.json", "opencode", 128_000, 4096, 0.7);

    public String getToolsServerUrl() { return toolsServerUrl; }
    public void setToolsServerUrl(String toolsServerUrl) { this.toolsServerUrl = toolsServerUrl; }

    public Duration getHealthCheckTimeout() { return healthCheckTimeout; }
    public void setHealthCheckTimeout(Duration healthCheckTimeout) { this.healthCheckTimeout = healthCheckTimeout; }

    public Tool getClaude() { return claude; }
    public void setClaude(Tool claude) { this.claude = claude; }

    public Tool getCodex() { return codex; }
    public void setCodex(Tool codex) { this.codex = codex; }

    public Tool getFactory() { return factory; }
    public void setFactory(Tool factory) { this.factory = factory; }

    public Tool getOpencode() { return opencode; }
    public void setOpencode(Tool opencode) { this.opencode = opencode; }

    /** Per-tool block by tool id, empty for tools without one. */
    public Optional<Tool> forTool(String toolId) {
        return switch (toolId) {
            case "claude"  -> Optional.of(claude);
            case "codex"   -> Optional.of(codex);
            case "factory" -> Optional.of(factory);
            case "opencode" -> Optional.of(opencode);
            default        -> Optional.empty();
        };
    }

    /** Tools URL with any trailing slash removed. */
    public String normalizedToolsServerUrl() {
        String url = toolsServerUrl == null ? "" : toolsServerUrl.trim();
        while (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        return url;
    }

    public static class Tool {

        private String configTemplate;
        private String memoryTemplate;
        // Where the rendered config is written, relative to the working directory.
        private String configFile;
        private String executable;
        private int    maxContextTokens;
        private int    defaultMaxTokens;
        private double defaultTemperature;

        public Tool() {}

        public Tool(String configTemplate, String memoryTemplate, String configFile, String executable,
                    int maxContextTokens, int defaultMaxTokens, double defaultTemperature) {
            this.configTemplate     = configTemplate;
            this.memoryTemplate     = memoryTemplate;
            this.configFile         = configFile;
            this.executable         = executable;
            this.maxContextTokens   = maxContextTokens;
            this.defaultMaxTokens   = defaultMaxTokens;
            this.defaultTemperature = defaultTemperature;
        }

        public TemplatePaths templatePaths() {
            return new TemplatePaths(configTemplate, memoryTemplate);
        }

        public String getConfigTemplate() { return configTemplate; }
        public void setConfigTemplate(String configTemplate) { this.configTemplate = configTemplate; }

        public String getMemoryTemplate() { return memoryTemplate; }
        public void setMemoryTemplate(String memoryTemplate) { this.memoryTemplate = memoryTemplate; }

        public String getConfigFile() { return configFile; }
        public void setConfigFile(String configFile) { this.configFile = configFile; }

        public String getExecutable() { return executable; }
        public void setExecutable(String executable) { this.executable = executable; }

        public int getMaxContextTokens() { return maxContextTokens; }
        public void setMaxContextTokens(int maxContextTokens) { this.maxContextTokens = maxContextTokens; }

        public int getDefaultMaxTokens() { return defaultMaxTokens; }
        public void setDefaultMaxTokens(int defaultMaxTokens) { this.defaultMaxTokens = defaultMaxTokens; }

        public double getDefaultTemperature() { return defaultTemperature; }
        public void setDefaultTemperature(double defaultTemperature) { this.defaultTemperature = defaultTemperature; }
    }
}
