package com.agentflow.orchestrator.registry;

import com.agentflow.orchestrator.adapter.AgentAdapter;
import com.agentflow.orchestrator.adapter.HealthStatus;
import com.agentflow.orchestrator.adapter.UnsupportedToolException;
import com.agentflow.orchestrator.config.RegistryProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AdapterRegistryTest {

    HealthMonitor   monitor;
    AdapterRegistry registry;

    StubAdapter claude = new StubAdapter("claude");
    StubAdapter codex  = new StubAdapter("codex");

    @BeforeEach
    void setUp() {
        monitor  = new HealthMonitor(new RegistryProperties(), new SimpleMeterRegistry());
        registry = new AdapterRegistry(List.of(codex, claude), monitor);
    }

    @AfterEach
    void tearDown() {
        monitor.shutdown();
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    @Test
    void create_registeredTool_returnsAdapter() {
        assertThat(registry.create("claude")).isSameAs(claude);
    }

    @Test
    void create_unregisteredTool_unsupportedNamingTheId() {
        assertThatThrownBy(() -> registry.create("nope"))
                .isInstanceOf(UnsupportedToolException.class)
                .hasMessage("Unsupported CLI type: 'nope'");
    }

    @Test
    void create_consistentlyUnhealthy_stillHandedOut() {
        claude.health = () -> HealthStatus.unhealthy("down");
        registry.healthSummary();
        registry.healthSummary();
        registry.healthSummary();

        assertThat(registry.isConsistentlyUnhealthy("claude")).isTrue();
        assertThat(registry.create("claude")).isSameAs(claude);
    }

    @Test
    void supportedTools_sortedById() {
        assertThat(registry.supportedTools()).containsExactly("claude", "codex");
        assertThat(registry.isSupported("codex")).isTrue();
        assertThat(registry.isSupported(null)).isFalse();
    }

    // ------------------------------------------------------------------
    // Registration
    // ------------------------------------------------------------------

    @Test
    void register_missingExecutable_rejected() {
        AgentAdapter invalid = new StubAdapter("x", 1000, " ", "AGENTS.md");

        assertThatThrownBy(() -> registry.register(invalid))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Adapter must specify an executable name");
    }

    @Test
    void register_zeroContextWindow_rejected() {
        assertThatThrownBy(() -> registry.register(new StubAdapter("x", 0, "x", "AGENTS.md")))
                .hasMessage("Adapter must specify max context tokens");
    }

    @Test
    void register_missingMemoryFile_rejected() {
        assertThatThrownBy(() -> registry.register(new StubAdapter("x", 10, "x", "")))
                .hasMessage("Adapter must specify a memory file name");
    }

    @Test
    void register_blankToolId_rejected() {
        assertThatThrownBy(() -> registry.register(new StubAdapter(" ")))
                .hasMessage("Adapter must specify a tool id");
    }

    @Test
    void register_runsInitialHealthCheck() {
        StubAdapter factory = new StubAdapter("factory");

        registry.register(factory);

        assertThat(registry.healthHistory("factory")).hasSize(1);
    }

    @Test
    void unregister_removesToolAndHistory() {
        assertThat(registry.unregister("codex")).isTrue();
        assertThat(registry.unregister("codex")).isFalse();

        assertThat(registry.isSupported("codex")).isFalse();
        assertThat(registry.healthHistory("codex")).isEmpty();
    }

    // ------------------------------------------------------------------
    // Stats
    // ------------------------------------------------------------------

    @Test
    void stats_countsLatestStatePerTool() {
        codex.health = () -> HealthStatus.warning("slow", null);
        registry.healthSummary();

        AdapterRegistry.RegistryStats stats = registry.stats();

        assertThat(stats.total()).isEqualTo(2);
        assertThat(stats.healthy()).isEqualTo(1);
        assertThat(stats.warning()).isEqualTo(1);
        assertThat(stats.unhealthy()).isZero();
    }
}
