package com.agentflow.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pipeline settings ({@code agentflow.pipeline.*}).
 *
 * <pre>
 * agentflow:
 *   pipeline:
 *     max-attempts: 3
 *     stages:
 *       implementation:
 *         tool: claude
 *         model: claude-sonnet-4-5
 *         remote-tools: [github_create_pull_request]
 * </pre>
 * Stage keys are the persisted stage names.
 */
@ConfigurationProperties(prefix = "agentflow.pipeline")
public class PipelineProperties {

    private int    maxAttempts   = 3;
    private int    workerThreads = 4;
    private String workspaceRoot = "/workspace";
    private String defaultTool   = "claude";
    private Map<String, Stage> stages = new LinkedHashMap<>();

    public int getMaxAttempts() { return maxAttempts; }
    public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

    public int getWorkerThreads() { return workerThreads; }
    public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }

    public String getWorkspaceRoot() { return workspaceRoot; }
    public void setWorkspaceRoot(String workspaceRoot) { this.workspaceRoot = workspaceRoot; }

    public String getDefaultTool() { return defaultTool; }
    public void setDefaultTool(String defaultTool) { this.defaultTool = defaultTool; }

    public Map<String, Stage> getStages() { return stages; }
    public void setStages(Map<String, Stage> stages) { this.stages = stages; }

    /** Settings for one stage; a stage without a block runs the default tool. */
    public Stage stage(String stageName) {
        Stage stage = stages.get(stageName);
        if (stage == null) {
            stage = new Stage();
        }
        if (stage.getTool() == null || stage.getTool().isBlank()) {
            stage.setTool(defaultTool);
        }
        return stage;
    }

    public static class Stage {

        private String       tool;
        private String       model;
        private Integer      maxTokens;
        private Double       temperature;
        private String       instruction;
        private List<String> remoteTools = new ArrayList<>();
        private List<String> localServers = new ArrayList<>();
        private List<String> args = new ArrayList<>();

        public String getTool() { return tool; }
        public void setTool(String tool) { this.tool = tool; }

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }

        public Integer getMaxTokens() { return maxTokens; }
        public void setMaxTokens(Integer maxTokens) { this.maxTokens = maxTokens; }

        public Double getTemperature() { return temperature; }
        public void setTemperature(Double temperature) { this.temperature = temperature; }

        public String getInstruction() { return instruction; }
        public void setInstruction(String instruction) { this.instruction = instruction; }

        public List<String> getRemoteTools() { return remoteTools; }
        public void setRemoteTools(List<String> remoteTools) { this.remoteTools = remoteTools; }

        public List<String> getLocalServers() { return localServers; }
        public void setLocalServers(List<String> localServers) { this.localServers = localServers; }

        public List<String> getArgs() { return args; }
        public void setArgs(List<String> args) { this.args = args; }
    }
}
