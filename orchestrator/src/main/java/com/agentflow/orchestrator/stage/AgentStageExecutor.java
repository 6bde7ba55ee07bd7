package com.agentflow.orchestrator.stage;

import com.agentflow.orchestrator.adapter.AdapterException;
import com.agentflow.orchestrator.adapter.AgentAdapter;
import com.agentflow.orchestrator.adapter.AgentConfig;
import com.agentflow.orchestrator.adapter.AgentConfig.LocalServer;
import com.agentflow.orchestrator.adapter.AgentConfig.ToolCapabilities;
import com.agentflow.orchestrator.adapter.ContainerContext;
import com.agentflow.orchestrator.adapter.ParsedResponse;
import com.agentflow.orchestrator.bridge.BridgeException;
import com.agentflow.orchestrator.bridge.BridgeRequest;
import com.agentflow.orchestrator.bridge.BridgeResult;
import com.agentflow.orchestrator.bridge.SubprocessBridge;
import com.agentflow.orchestrator.config.AdapterProperties;
import com.agentflow.orchestrator.config.PipelineProperties;
import com.agentflow.orchestrator.registry.AdapterRegistry;
import com.agentflow.orchestrator.template.TemplateRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs an agent-driven stage (implementation, quality, security, testing).
 *
 * For one attempt:
 *   1. Look up the stage's tool in the registry (advisory health only)
 *   2. Build the AgentConfig from the stage settings and the tool defaults
 *   3. Initialize the adapter and write its config and memory files
 *   4. Hand the formatted prompt to the agent through the subprocess bridge
 *   5. Parse what the agent printed; a non-zero exit or an error result fails the attempt
 */
@Component
public class AgentStageExecutor implements StageExecutor {

    private static final Logger log = LoggerFactory.getLogger(AgentStageExecutor.class);

    // Longest output tail quoted in a failure message.
    private static final int OUTPUT_TAIL = 400;

    private final AdapterRegistry    registry;
    private final AdapterProperties  adapterProperties;
    private final PipelineProperties pipelineProperties;
    private final TemplateRenderer   renderer;
    private final SubprocessBridge   bridge;

    public AgentStageExecutor(AdapterRegistry registry,
                              AdapterProperties adapterProperties,
                              PipelineProperties pipelineProperties,
                              TemplateRenderer renderer,
                              SubprocessBridge bridge) {
        this.registry           = registry;
        this.adapterProperties  = adapterProperties;
        this.pipelineProperties = pipelineProperties;
        this.renderer           = renderer;
        this.bridge             = bridge;
    }

    @Override
    public StageResult execute(StageRequest request) {
        PipelineProperties.Stage settings = pipelineProperties.stage(request.stage().value());
        AgentAdapter adapter = registry.create(settings.getTool());
        MDC.put("tool", adapter.toolId());

        AgentConfig config = agentConfig(adapter, settings);
        Path workDir = workingDirectory(request.repository());
        Map<String, String> env = environment(request);
        ContainerContext container = new ContainerContext(
                containerName(request), workDir.toString(), null, env);

        adapter.initialize(container);
        try {
            writeArtifacts(adapter, config, workDir);

            String prompt = adapter.formatPrompt(instruction(settings, request));
            List<String> command = new ArrayList<>();
            command.add(adapter.executableName());
            command.addAll(settings.getArgs());

            log.info("Running {} attempt {} with {} ({})",
                    request.stage().value(), request.attempt(), adapter.toolId(), config.model());
            BridgeResult result = bridge.run(new BridgeRequest(request.runKey(), command, workDir, env, prompt));

            if (!result.succeeded()) {
                throw new BridgeException(BridgeException.Kind.PROCESS,
                        adapter.executableName() + " exited with code " + result.exitCode()
                        + ": " + tail(result.output()));
            }
            ParsedResponse response = adapter.parseResponse(result.output());
            if (response.finishReason() == ParsedResponse.FinishReason.ERROR) {
                throw new BridgeException(BridgeException.Kind.PROCESS,
                        "Agent reported an error: " + tail(response.content()));
            }
            log.info("Stage {} finished via {} in {}s: finish={} toolCalls={} tokens(in={}, out={})",
                    request.stage().value(), result.deliveredVia(), result.duration().toSeconds(),
                    response.finishReason(), response.toolCalls().size(),
                    response.metadata().inputTokens(), response.metadata().outputTokens());
            return StageResult.SUCCEEDED;
        } finally {
            adapter.cleanup(container);
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    AgentConfig agentConfig(AgentAdapter adapter, PipelineProperties.Stage settings) {
        AdapterProperties.Tool defaults = adapterProperties.forTool(adapter.toolId()).orElse(null);
        int maxTokens = settings.getMaxTokens() != null ? settings.getMaxTokens()
                : defaults != null ? defaults.getDefaultMaxTokens() : 4096;
        double temperature = settings.getTemperature() != null ? settings.getTemperature()
                : defaults != null ? defaults.getDefaultTemperature() : 0.7;

        List<LocalServer> localServers = settings.getLocalServers().stream()
                .map(name -> new LocalServer(name, true))
                .toList();
        return new AgentConfig(adapter.toolId(), settings.getModel(), maxTokens, temperature,
                new ToolCapabilities(settings.getRemoteTools(), localServers), Map.of());
    }

    Path workingDirectory(String repository) {
        return Path.of(pipelineProperties.getWorkspaceRoot()).resolve(RepositorySlug.of(repository));
    }

    private void writeArtifacts(AgentAdapter adapter, AgentConfig config, Path workDir) {
        String configFile = adapterProperties.forTool(adapter.toolId())
                .map(AdapterProperties.Tool::getConfigFile)
                .orElse(null);
        String renderedConfig = adapter.generateConfig(config);
        String renderedMemory = adapter.generateMemory(config);
        try {
            Files.createDirectories(workDir);
            if (configFile != null && !configFile.isBlank()) {
                write(workDir.resolve(configFile), renderedConfig);
            } else {
                log.debug("No config file location for '{}'; config not written", adapter.toolId());
            }
            write(workDir.resolve(adapter.memoryFilename()), renderedMemory);
        } catch (IOException e) {
            throw new AdapterException(AdapterException.Kind.INITIALIZATION,
                    "Failed to write agent files under " + workDir + ": " + e.getMessage(), e);
        }
    }

    private static void write(Path file, String content) throws IOException {
        Path parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, content, StandardCharsets.UTF_8);
    }

    private String instruction(PipelineProperties.Stage settings, StageRequest request) {
        String template = settings.getInstruction();
        if (template == null || template.isBlank()) {
            template = "Run the {{stage}} stage for task {{taskId}} on {{repository}}.";
        }
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("repository", request.repository());
        ctx.put("taskId",     request.taskId());
        ctx.put("branch",     request.branch() == null ? "" : request.branch());
        ctx.put("stage",      request.stage().value());
        ctx.put("attempt",    request.attempt());
        return renderer.renderInline(template, ctx);
    }

    private static Map<String, String> environment(StageRequest request) {
        Map<String, String> env = new LinkedHashMap<>();
        env.put("REPOSITORY", request.repository());
        env.put("TASK_ID",    request.taskId());
        env.put("STAGE",      request.stage().value());
        if (request.branch() != null) {
            env.put("BRANCH", request.branch());
        }
        return env;
    }

    private static String containerName(StageRequest request) {
        return RepositorySlug.of(request.repository()) + "-" + request.stage().value();
    }

    private static String tail(String text) {
        if (text == null || text.isBlank()) return "(no output)";
        String trimmed = text.strip();
        return trimmed.length() <= OUTPUT_TAIL ? trimmed : "..." + trimmed.substring(trimmed.length() - OUTPUT_TAIL);
    }
}
