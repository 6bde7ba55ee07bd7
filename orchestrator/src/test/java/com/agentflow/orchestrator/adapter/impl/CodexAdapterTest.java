package com.agentflow.orchestrator.adapter.impl;

import com.agentflow.orchestrator.adapter.AgentConfig;
import com.agentflow.orchestrator.adapter.AgentConfig.ToolCapabilities;
import com.agentflow.orchestrator.adapter.CapabilityDescriptor;
import com.agentflow.orchestrator.adapter.HealthStatus;
import com.agentflow.orchestrator.adapter.ParsedResponse;
import com.agentflow.orchestrator.config.AdapterProperties;
import com.agentflow.orchestrator.template.HandlebarsTemplateRenderer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for CodexAdapter. Rendered configs are parsed back with a TOML
 * mapper, so a template that emits invalid TOML fails here.
 */
class CodexAdapterTest {

    private final ObjectMapper json = new ObjectMapper();
    private final TomlMapper   toml = new TomlMapper();

    CodexAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new CodexAdapter(
                new HandlebarsTemplateRenderer("classpath:/templates", json), new AdapterProperties(), json);
    }

    // ------------------------------------------------------------------
    // generateConfig
    // ------------------------------------------------------------------

    @Test
    void generateConfig_rendersValidTomlWithUnattendedDefaults() throws Exception {
        JsonNode parsed = toml.readTree(adapter.generateConfig(new AgentConfig("codex", "gpt-5-codex", 32_000, 0.25)));

        assertThat(parsed.get("model").asText()).isEqualTo("gpt-5-codex");
        assertThat(parsed.get("model_provider").asText()).isEqualTo("openai");
        assertThat(parsed.get("approval_policy").asText()).isEqualTo("never");
        assertThat(parsed.get("sandbox_mode").asText()).isEqualTo("danger-full-access");
        assertThat(parsed.get("model_max_output_tokens").asInt()).isEqualTo(32_000);
        assertThat(parsed.get("temperature").asDouble()).isEqualTo(0.25);
        assertThat(parsed.has("mcp_servers")).isFalse();
    }

    @Test
    void generateConfig_tools_oneTablePerName() throws Exception {
        AgentConfig config = new AgentConfig("codex", "gpt-5", 100, 0.5)
                .withTools(ToolCapabilities.remote("brave_search", "memory_store"));

        JsonNode servers = toml.readTree(adapter.generateConfig(config)).get("mcp_servers");

        assertThat(servers.fieldNames()).toIterable().containsExactlyInAnyOrder("brave_search", "memory_store");
        assertThat(servers.at("/brave_search/command").asText()).isEqualTo("tools");
        assertThat(servers.at("/memory_store/args/3").asText()).isEqualTo("memory_store");
        assertThat(servers.at("/memory_store/env/TOOLS_SERVER_URL").asText())
                .isEqualTo("http://tools.cto.svc.cluster.local:3000/mcp");
    }

    @Test
    void generateConfig_explicitApprovalPolicy_overridesDefault() throws Exception {
        AgentConfig config = new AgentConfig("codex", "gpt-5", 100, 0.5, ToolCapabilities.none(),
                Map.of("approvalPolicy", "on-request"));

        JsonNode parsed = toml.readTree(adapter.generateConfig(config));

        assertThat(parsed.get("approval_policy").asText()).isEqualTo("on-request");
    }

    @Test
    void generateConfig_wrongTool_rejected() {
        assertThatThrownBy(() -> adapter.generateConfig(new AgentConfig("claude", "m", 100, 0.5)))
                .hasMessageContaining("expected 'codex', got 'claude'");
    }

    @Test
    void generateMemory_mentionsToolsEndpoint() {
        String memory = adapter.generateMemory(new AgentConfig("codex", "gpt-5", 100, 0.5)
                .withTools(ToolCapabilities.remote("brave_search")));

        assertThat(memory).startsWith("# AGENTS.md").contains("`brave_search`")
                .contains("http://tools.cto.svc.cluster.local:3000/mcp");
    }

    // ------------------------------------------------------------------
    // parseResponse
    // ------------------------------------------------------------------

    @Test
    void parseResponse_commands_becomeToolCallsWithUsage() {
        String response = """
                {"model":"gpt-5-codex",
                 "commands":[{"command":"shell","args":["ls","-la"]},
                             {"args":{"path":"README.md"}},
                             {"command":"git_status"}],
                 "usage":{"input_tokens":120,"output_tokens":48}}
                """;

        ParsedResponse r = adapter.parseResponse(response);

        assertThat(r.finishReason()).isEqualTo(ParsedResponse.FinishReason.TOOL_CALL);
        assertThat(r.toolCalls()).extracting(ParsedResponse.ToolCall::name)
                .containsExactly("shell", "local_shell", "git_status");
        assertThat(r.toolCalls()).extracting(ParsedResponse.ToolCall::id)
                .containsExactly("tool_0", "tool_1", "tool_2");
        assertThat(r.toolCalls().get(0).arguments()).containsEntry("args", List.of("ls", "-la"));
        assertThat(r.toolCalls().get(1).arguments()).containsEntry("path", "README.md");
        assertThat(r.toolCalls().get(2).arguments()).isEmpty();
        assertThat(r.metadata().inputTokens()).isEqualTo(120);
        assertThat(r.metadata().outputTokens()).isEqualTo(48);
        assertThat(r.metadata().model()).isEqualTo("gpt-5-codex");
    }

    @Test
    void parseResponse_plainText_stopWithRawContent() {
        ParsedResponse r = adapter.parseResponse("Applied the patch.");

        assertThat(r.content()).isEqualTo("Applied the patch.");
        assertThat(r.toolCalls()).isEmpty();
        assertThat(r.finishReason()).isEqualTo(ParsedResponse.FinishReason.STOP);
    }

    // ------------------------------------------------------------------
    // Capabilities / health
    // ------------------------------------------------------------------

    @Test
    void validateModel_anyName_accepted() {
        assertThat(adapter.validateModel("o3")).isTrue();
        assertThat(adapter.validateModel("something-else")).isTrue();
    }

    @Test
    void formatPrompt_unchanged() {
        assertThat(adapter.formatPrompt("do it")).isEqualTo("do it");
    }

    @Test
    void capabilities_tomlWithAgentsMemory() {
        assertThat(adapter.capabilities().configFormat()).isEqualTo(CapabilityDescriptor.ConfigFormat.TOML);
        assertThat(adapter.memoryFilename()).isEqualTo("AGENTS.md");
        assertThat(adapter.executableName()).isEqualTo("codex");
    }

    @Test
    void healthCheck_packagedTemplates_healthy() {
        assertThat(adapter.healthCheck().state()).isEqualTo(HealthStatus.State.HEALTHY);
    }
}
