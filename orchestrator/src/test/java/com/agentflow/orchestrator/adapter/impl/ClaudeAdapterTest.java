package com.agentflow.orchestrator.adapter.impl;

import com.agentflow.orchestrator.adapter.AdapterException;
import com.agentflow.orchestrator.adapter.AgentConfig;
import com.agentflow.orchestrator.adapter.AgentConfig.ToolCapabilities;
import com.agentflow.orchestrator.adapter.CapabilityDescriptor;
import com.agentflow.orchestrator.adapter.ContainerContext;
import com.agentflow.orchestrator.adapter.HealthStatus;
import com.agentflow.orchestrator.adapter.ParsedResponse;
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

import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * Tests for ClaudeAdapter against the packaged templates.
 *
 * No Spring context: the Handlebars renderer is built directly on
 * classpath:/templates.
 */
class ClaudeAdapterTest {

    private final ObjectMapper json = new ObjectMapper();

    ClaudeAdapter adapter;

    @BeforeEach
    void setUp() {
        TemplateRenderer renderer = new HandlebarsTemplateRenderer("classpath:/templates", json);
        adapter = new ClaudeAdapter(renderer, new AdapterProperties(), json);
    }

    // ------------------------------------------------------------------
    // generateConfig
    // ------------------------------------------------------------------

    @Test
    void generateConfig_rendersModelAndLimitsThatParseBack() throws Exception {
        AgentConfig config = new AgentConfig("claude", "claude-opus-4-1-20250805", 64_000, 1.25);

        JsonNode parsed = json.readTree(adapter.generateConfig(config));

        assertThat(parsed.get("model").asText()).isEqualTo("claude-opus-4-1-20250805");
        assertThat(parsed.get("maxTokens").asInt()).isEqualTo(64_000);
        assertThat(parsed.get("temperature").asDouble()).isEqualTo(1.25);
        assertThat(parsed.at("/permissions/defaultMode").asText()).isEqualTo("bypassPermissions");
        assertThat(parsed.at("/env/AGENTFLOW_CORRELATION_ID").asText()).isNotBlank();
    }

    @Test
    void generateConfig_modelWithQuotes_staysValidJson() throws Exception {
        AgentConfig config = new AgentConfig("claude", "weird \"model\" \\ name", 10, 0.1);

        JsonNode parsed = json.readTree(adapter.generateConfig(config));

        assertThat(parsed.get("model").asText()).isEqualTo("weird \"model\" \\ name");
    }

    @Test
    void generateConfig_noTools_zeroServerEntries() throws Exception {
        JsonNode parsed = json.readTree(adapter.generateConfig(new AgentConfig("claude", "m", 10, 0.5)));

        assertThat(parsed.get("mcpServers").size()).isZero();
    }

    @Test
    void generateConfig_unseenToolNames_exactlyThoseEntries() throws Exception {
        AgentConfig config = new AgentConfig("claude", "m", 10, 0.5)
                .withTools(ToolCapabilities.remote("alpha", "beta"));

        JsonNode servers = json.readTree(adapter.generateConfig(config)).get("mcpServers");

        assertThat(servers.fieldNames()).toIterable().containsExactly("alpha", "beta");
        assertThat(servers.at("/alpha/command").asText()).isEqualTo("tools");
        assertThat(servers.at("/beta/args/3").asText()).isEqualTo("beta");
        assertThat(servers.at("/beta/args/2").asText()).isEqualTo("--tool");
    }

    @Test
    void generateConfig_permissionModeOverride_fromSettings() throws Exception {
        AgentConfig config = new AgentConfig("claude", "m", 10, 0.5, ToolCapabilities.none(),
                Map.of("settings", Map.of("permissionMode", "acceptEdits")));

        JsonNode parsed = json.readTree(adapter.generateConfig(config));

        assertThat(parsed.at("/permissions/defaultMode").asText()).isEqualTo("acceptEdits");
    }

    static Stream<AgentConfig> outOfBounds() {
        return Stream.of(
                new AgentConfig("claude", "m", 0, 0.5),
                new AgentConfig("claude", "m", 1_000_001, 0.5),
                new AgentConfig("claude", "m", 100, -0.1),
                new AgentConfig("claude", "m", 100, 2.1));
    }

    @ParameterizedTest
    @MethodSource("outOfBounds")
    void generateConfig_outOfBounds_validationErrorAndNothingRendered(AgentConfig config) {
        TemplateRenderer renderer = Mockito.mock(TemplateRenderer.class);
        ClaudeAdapter guarded = new ClaudeAdapter(renderer, new AdapterProperties(), json);

        assertThatThrownBy(() -> guarded.generateConfig(config))
                .isInstanceOf(AdapterException.class)
                .extracting(e -> ((AdapterException) e).getKind())
                .isEqualTo(AdapterException.Kind.VALIDATION);
        verifyNoInteractions(renderer);
    }

    @Test
    void generateConfig_otherToolsConfig_rejectedBeforeRendering() {
        TemplateRenderer renderer = Mockito.mock(TemplateRenderer.class);
        ClaudeAdapter guarded = new ClaudeAdapter(renderer, new AdapterProperties(), json);

        assertThatThrownBy(() -> guarded.generateConfig(new AgentConfig("factory", "m", 10, 0.5)))
                .hasMessageContaining("CLI type mismatch: expected 'claude', got 'factory'");
        verifyNoInteractions(renderer);
    }

    @Test
    void generateConfig_missingTemplate_templateErrorNotValidation() {
        AdapterProperties props = new AdapterProperties();
        props.getClaude().setConfigTemplate("code/claude/does-not-exist.hbs");
        ClaudeAdapter broken = new ClaudeAdapter(
                new HandlebarsTemplateRenderer("classpath:/templates", json), props, json);

        assertThatThrownBy(() -> broken.generateConfig(new AgentConfig("claude", "m", 10, 0.5)))
                .isInstanceOf(AdapterException.class)
                .extracting(e -> ((AdapterException) e).getKind())
                .isEqualTo(AdapterException.Kind.TEMPLATE);
    }

    @Test
    void generateMemory_listsRequestedTools() {
        String memory = adapter.generateMemory(new AgentConfig("claude", "m", 10, 0.5)
                .withTools(ToolCapabilities.remote("github_create_pull_request")));

        assertThat(memory).contains("github_create_pull_request").contains("claude");
    }

    // ------------------------------------------------------------------
    // Prompt / response
    // ------------------------------------------------------------------

    @Test
    void formatPrompt_wrapsInRoleDelimiters() {
        assertThat(adapter.formatPrompt("fix the bug")).isEqualTo("Human: fix the bug\n\nAssistant: ");
    }

    @Test
    void parseResponse_plainText_stopWithoutToolCalls() {
        ParsedResponse r = adapter.parseResponse("All done.");

        assertThat(r.content()).isEqualTo("All done.");
        assertThat(r.toolCalls()).isEmpty();
        assertThat(r.finishReason()).isEqualTo(ParsedResponse.FinishReason.STOP);
        assertThat(r.metadata().inputTokens()).isNull();
    }

    @Test
    void parseResponse_manyInvokes_uniqueIdsInOrder() {
        String response = """
                Let me look around.
                <function_calls>
                <invoke name="read_file">
                <parameter name="path">src/Main.java</parameter>
                </invoke>
                <invoke name="search">
                <parameter name="query">retry policy</parameter>
                <parameter name="paths">["src", "test"]</parameter>
                </invoke>
                </function_calls>
                """;

        ParsedResponse r = adapter.parseResponse(response);

        assertThat(r.finishReason()).isEqualTo(ParsedResponse.FinishReason.TOOL_CALL);
        assertThat(r.toolCalls()).extracting(ParsedResponse.ToolCall::id).containsExactly("tool_0", "tool_1");
        assertThat(r.toolCalls()).extracting(ParsedResponse.ToolCall::name).containsExactly("read_file", "search");
        assertThat(r.toolCalls().get(0).arguments()).containsEntry("path", "src/Main.java");
        assertThat(r.toolCalls().get(1).arguments().get("paths")).isEqualTo(List.of("src", "test"));
    }

    @Test
    void parseResponse_null_emptyContent() {
        assertThat(adapter.parseResponse(null).content()).isEmpty();
    }

    // ------------------------------------------------------------------
    // Capabilities / lifecycle / health
    // ------------------------------------------------------------------

    @Test
    void validateModel_unknownModel_acceptedAnyway() {
        assertThat(adapter.validateModel("brand-new-model-2030")).isTrue();
        assertThat(adapter.validateModel("claude-sonnet-4-5")).isTrue();
        assertThat(adapter.validateModel("")).isFalse();
    }

    @Test
    void capabilities_describeClaude() {
        CapabilityDescriptor caps = adapter.capabilities();

        assertThat(caps.memoryFile()).isEqualTo("CLAUDE.md");
        assertThat(caps.configFormat()).isEqualTo(CapabilityDescriptor.ConfigFormat.JSON);
        assertThat(caps.maxContextTokens()).isEqualTo(200_000);
        assertThat(caps.authMethods()).containsExactly(CapabilityDescriptor.AuthMethod.SESSION_TOKEN);
        assertThat(adapter.executableName()).isEqualTo("claude");
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
        assertThat(status.details())
                .containsEntry("model_validation", true)
                .containsEntry("config_generation", true)
                .containsEntry("response_parsing", true);
    }
}
