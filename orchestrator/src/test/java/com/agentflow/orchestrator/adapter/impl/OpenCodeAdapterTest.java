package com.agentflow.orchestrator.adapter.impl;

import com.agentflow.orchestrator.adapter.AdapterException;
import com.agentflow.orchestrator.adapter.AgentConfig;
import com.agentflow.orchestrator.adapter.AgentConfig.ToolCapabilities;
import com.agentflow.orchestrator.adapter.CapabilityDescriptor;
import com.agentflow.orchestrator.adapter.ContainerContext;
import com.agentflow.orchestrator.adapter.HealthStatus;
import com.agentflow.orchestrator.adapter.ParsedResponse;
import com.agentflow.orchestrator.adapter.ParsedResponse.FinishReason;
import com.agentflow.orchestrator.config.AdapterProperties;
import com.agentflow.orchestrator.template.HandlebarsTemplateRenderer;
import com.agentflow.orchestrator.template.TemplateRenderer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.mockito.Mockito;

import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;

class OpenCodeAdapterTest {

    private final ObjectMapper json = new ObjectMapper();

    OpenCodeAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new OpenCodeAdapter(
                new HandlebarsTemplateRenderer("classpath:/templates", json), new AdapterProperties(), json);
    }

    // ------------------------------------------------------------------
    // generateConfig
    // ------------------------------------------------------------------

    @Test
    void generateConfig_validJsonWithProviderDefaults() throws Exception {
        AgentConfig config = new AgentConfig("opencode", "gpt-4.1", 4096, 0.3)
                .withTools(ToolCapabilities.remote("github_get_issue"));

        JsonNode parsed = json.readTree(adapter.generateConfig(config));

        assertThat(parsed.get("model").asText()).isEqualTo("gpt-4.1");
        assertThat(parsed.get("maxOutputTokens").asInt()).isEqualTo(4096);
        assertThat(parsed.get("temperature").asDouble()).isEqualTo(0.3);
        assertThat(parsed.get("instructions").isNull()).isTrue();
        assertThat(parsed.at("/provider/name").asText()).isEqualTo("openai");
        assertThat(parsed.at("/provider/envKey").asText()).isEqualTo("OPENAI_API_KEY");
        assertThat(parsed.at("/metadata/cli").asText()).isEqualTo("opencode");
        assertThat(parsed.at("/metadata/correlationId").asText()).isNotBlank();
        assertThat(parsed.get("mcpServers").fieldNames()).toIterable().containsExactly("github_get_issue");
    }

    @Test
    void generateConfig_settingsOverrideModelLimitsAndProvider() throws Exception {
        AgentConfig config = new AgentConfig("opencode", "gpt-4.1", 4096, 0.3, ToolCapabilities.none(),
                Map.of("settings", Map.of(
                                "model", "anthropic/claude-sonnet-4-5",
                                "max_output_tokens", 16_000,
                                "temp", 0.9,
                                "instructions", "Stay on the feature branch."),
                        "provider", Map.of("name", "anthropic", "envKey", "ANTHROPIC_API_KEY")));

        JsonNode parsed = json.readTree(adapter.generateConfig(config));

        assertThat(parsed.get("model").asText()).isEqualTo("anthropic/claude-sonnet-4-5");
        assertThat(parsed.get("maxOutputTokens").asInt()).isEqualTo(16_000);
        assertThat(parsed.get("temperature").asDouble()).isEqualTo(0.9);
        assertThat(parsed.get("instructions").asText()).isEqualTo("Stay on the feature branch.");
        assertThat(parsed.at("/provider/name").asText()).isEqualTo("anthropic");
        assertThat(parsed.at("/provider/envKey").asText()).isEqualTo("ANTHROPIC_API_KEY");
    }

    @Test
    void generateConfig_noTools_emptyServerMap() throws Exception {
        JsonNode parsed = json.readTree(adapter.generateConfig(new AgentConfig("opencode", "m", 10, 0.5)));

        assertThat(parsed.get("mcpServers").isObject()).isTrue();
        assertThat(parsed.get("mcpServers").size()).isZero();
    }

    @Test
    void generateConfig_unseenToolNames_exactlyThoseEntries() throws Exception {
        AgentConfig config = new AgentConfig("opencode", "m", 10, 0.5)
                .withTools(ToolCapabilities.remote("alpha", "beta"));

        JsonNode servers = json.readTree(adapter.generateConfig(config)).get("mcpServers");

        assertThat(servers.fieldNames()).toIterable().containsExactly("alpha", "beta");
        assertThat(servers.at("/alpha/command").asText()).isEqualTo("tools");
        assertThat(servers.at("/beta/args/3").asText()).isEqualTo("beta");
    }

    static Stream<AgentConfig> outOfBounds() {
        return Stream.of(
                new AgentConfig("opencode", "m", 0, 0.5),
                new AgentConfig("opencode", "m", 1_000_001, 0.5),
                new AgentConfig("opencode", "m", 100, -0.1),
                new AgentConfig("opencode", "m", 100, 2.1),
                new AgentConfig("opencode", "m", 100, 0.5, ToolCapabilities.none(),
                        Map.of("settings", Map.of("maxTokens", 2_000_000))),
                new AgentConfig("opencode", "m", 100, 0.5, ToolCapabilities.none(),
                        Map.of("temperature", 3.5)));
    }

    @ParameterizedTest
    @MethodSource("outOfBounds")
    void generateConfig_outOfBounds_validationErrorAndNothingRendered(AgentConfig config) {
        TemplateRenderer renderer = Mockito.mock(TemplateRenderer.class);
        OpenCodeAdapter guarded = new OpenCodeAdapter(renderer, new AdapterProperties(), json);

        assertThatThrownBy(() -> guarded.generateConfig(config))
                .isInstanceOf(AdapterException.class)
                .extracting(e -> ((AdapterException) e).getKind())
                .isEqualTo(AdapterException.Kind.VALIDATION);
        verifyNoInteractions(renderer);
    }

    @Test
    void generateConfig_otherToolsConfig_rejectedBeforeRendering() {
        TemplateRenderer renderer = Mockito.mock(TemplateRenderer.class);
        OpenCodeAdapter guarded = new OpenCodeAdapter(renderer, new AdapterProperties(), json);

        assertThatThrownBy(() -> guarded.generateConfig(new AgentConfig("claude", "m", 10, 0.5)))
                .hasMessageContaining("CLI type mismatch: expected 'opencode', got 'claude'");
        verifyNoInteractions(renderer);
    }

    @Test
    void generateMemory_headerInstructionsAndTools() {
        AgentConfig config = new AgentConfig("opencode", "gpt-4.1", 4096, 0.3, ToolCapabilities.remote("alpha"),
                Map.of("instructions", "Never force-push."));

        String memory = adapter.generateMemory(config);

        assertThat(memory).startsWith("# OPENCODE.md")
                .contains("Never force-push.")
                .contains("`alpha`")
                .contains("model `gpt-4.1`");
    }

    // ------------------------------------------------------------------
    // formatPrompt / parseResponse
    // ------------------------------------------------------------------

    @Test
    void formatPrompt_appendsNewlineOnce() {
        assertThat(adapter.formatPrompt("fix the build")).isEqualTo("fix the build\n");
        assertThat(adapter.formatPrompt("fix the build\n")).isEqualTo("fix the build\n");
    }

    @Test
    void parseResponse_jsonLines_collectsMessageCommandsAndUsage() {
        String output = String.join("\n",
                "{\"message\":\"Started run\",\"model\":\"opencode-sonnet\"}",
                "{\"commands\":[{\"command\":\"shell\",\"args\":{\"cmd\":\"ls\"}}],"
                        + "\"usage\":{\"input_tokens\":120,\"output_tokens\":32},\"durationMs\":450}");

        ParsedResponse r = adapter.parseResponse(output);

        assertThat(r.content()).contains("Started run");
        assertThat(r.finishReason()).isEqualTo(FinishReason.TOOL_CALL);
        assertThat(r.toolCalls()).hasSize(1);
        assertThat(r.toolCalls().get(0).name()).isEqualTo("shell");
        assertThat(r.toolCalls().get(0).arguments()).containsEntry("cmd", "ls");
        assertThat(r.metadata().inputTokens()).isEqualTo(120);
        assertThat(r.metadata().outputTokens()).isEqualTo(32);
        assertThat(r.metadata().durationMs()).isEqualTo(450L);
        assertThat(r.metadata().model()).isEqualTo("opencode-sonnet");
    }

    @Test
    void parseResponse_alternateKeySpellings_read() {
        ParsedResponse r = adapter.parseResponse(
                "{\"text\":\"done\",\"modelId\":\"gpt-4.1\",\"usage\":{\"prompt_tokens\":7,\"completionTokens\":1,"
                        + "\"completion_tokens\":3}}");

        assertThat(r.content()).isEqualTo("done");
        assertThat(r.metadata().model()).isEqualTo("gpt-4.1");
        assertThat(r.metadata().inputTokens()).isEqualTo(7);
        assertThat(r.metadata().outputTokens()).isEqualTo(3);
        assertThat(r.finishReason()).isEqualTo(FinishReason.STOP);
    }

    @Test
    void parseResponse_commandsAcrossLines_idsNeverCollide() {
        String output = String.join("\n",
                "{\"commands\":[{\"command\":\"read\",\"id\":\"tool_1\"},{\"command\":\"edit\"}]}",
                "{\"commands\":[{\"command\":\"shell\",\"callId\":\"tool_1\"},{\"args\":[\"x\"]}]}");

        ParsedResponse r = adapter.parseResponse(output);

        assertThat(r.toolCalls()).extracting(ParsedResponse.ToolCall::name)
                .containsExactly("read", "edit", "shell", "opencode_command");
        assertThat(r.toolCalls()).extracting(ParsedResponse.ToolCall::id)
                .doesNotHaveDuplicates()
                .containsExactly("tool_1", "tool_2", "tool_3", "tool_4");
        assertThat(r.toolCalls().get(3).arguments()).containsKey("args");
    }

    @Test
    void parseResponse_plainLines_keptAsContent() {
        ParsedResponse r = adapter.parseResponse("booting agent\n\n{\"message\":\"ready\"}\nall good\n");

        assertThat(r.content()).isEqualTo("ready\nbooting agent\nall good");
        assertThat(r.finishReason()).isEqualTo(FinishReason.STOP);
        assertThat(r.toolCalls()).isEmpty();
    }

    @Test
    void parseResponse_empty_stopWithEmptyContent() {
        ParsedResponse r = adapter.parseResponse("");

        assertThat(r.content()).isEmpty();
        assertThat(r.finishReason()).isEqualTo(FinishReason.STOP);
        assertThat(r.metadata().inputTokens()).isNull();
    }

    // ------------------------------------------------------------------
    // Identity, lifecycle and health
    // ------------------------------------------------------------------

    @Test
    void capabilities_streamingMultimodalJsonConfig() {
        CapabilityDescriptor caps = adapter.capabilities();

        assertThat(caps.streaming()).isTrue();
        assertThat(caps.multimodal()).isTrue();
        assertThat(caps.configFormat()).isEqualTo(CapabilityDescriptor.ConfigFormat.JSON);
        assertThat(caps.maxContextTokens()).isEqualTo(128_000);
        assertThat(adapter.memoryFilename()).isEqualTo("OPENCODE.md");
        assertThat(adapter.executableName()).isEqualTo("opencode");
        assertThat(adapter.toolId()).isEqualTo("opencode");
    }

    @Test
    void initialize_blankContainerName_initializationError() {
        assertThatThrownBy(() -> adapter.initialize(new ContainerContext(" ", "/workspace")))
                .isInstanceOf(AdapterException.class)
                .extracting(e -> ((AdapterException) e).getKind())
                .isEqualTo(AdapterException.Kind.INITIALIZATION);
    }

    @Test
    void healthCheck_packagedTemplates_healthy() {
        HealthStatus status = adapter.healthCheck();

        assertThat(status.state()).isEqualTo(HealthStatus.State.HEALTHY);
        assertThat(status.details()).containsEntry("config_generation", true)
                .containsEntry("response_parsing", true);
    }
}
