package com.agentflow.orchestrator.registry;

import com.agentflow.orchestrator.adapter.AgentAdapter;
import com.agentflow.orchestrator.adapter.CapabilityDescriptor;
import com.agentflow.orchestrator.adapter.HealthStatus;
import com.agentflow.orchestrator.adapter.UnsupportedToolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Authoritative tool-id to adapter map.
 *
 * Every {@link AgentAdapter} bean is collected at startup via constructor
 * injection, validated and health-checked once. The registry is a single
 * Spring bean injected wherever adapter lookup is needed.
 *
 * <p>Adapters are immutable: changing a tool's behaviour means registering
 * a new instance under the same id, which replaces the old one atomically.
 * Lookups therefore never coordinate with writers.
 *
 * <p>Health is advisory. {@link #create} hands out an adapter even when its
 * last checks failed; callers decide whether to proceed.
 */
@Component
@EnableScheduling
public class AdapterRegistry {

    private static final Logger log = LoggerFactory.getLogger(AdapterRegistry.class);

    private final Map<String, AgentAdapter> adapters = new ConcurrentHashMap<>();
    private final HealthMonitor healthMonitor;

    public AdapterRegistry(List<AgentAdapter> allAdapters, HealthMonitor healthMonitor) {
        this.healthMonitor = healthMonitor;
        for (AgentAdapter adapter : allAdapters) {
            register(adapter);
        }
    }

    // ------------------------------------------------------------------
    // Registration
    // ------------------------------------------------------------------

    /**
     * Validate and register an adapter, then run its initial health check.
     *
     * @throws IllegalArgumentException if the adapter fails validation
     */
    public void register(AgentAdapter adapter) {
        validate(adapter);
        AgentAdapter previous = adapters.put(adapter.toolId(), adapter);
        if (previous != null && previous != adapter) {
            log.info("Replaced adapter for tool '{}'", adapter.toolId());
        }
        HealthStatus initial = healthMonitor.check(adapter);
        log.info("Registered adapter '{}' [executable={}, memory={}, config={}] initial health {}",
                adapter.toolId(),
                adapter.executableName(),
                adapter.memoryFilename(),
                adapter.capabilities().configFormat(),
                initial.state());
    }

    public boolean unregister(String toolId) {
        boolean removed = adapters.remove(toolId) != null;
        if (removed) {
            healthMonitor.forget(toolId);
            log.info("Unregistered adapter '{}'", toolId);
        }
        return removed;
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    /**
     * Adapter for the given tool id, regardless of its current health.
     *
     * @throws UnsupportedToolException if no adapter is registered for the id
     */
    public AgentAdapter create(String toolId) {
        AgentAdapter adapter = toolId == null ? null : adapters.get(toolId);
        if (adapter == null) {
            throw new UnsupportedToolException(toolId);
        }
        if (healthMonitor.isConsistentlyUnhealthy(toolId)) {
            log.warn("Adapter '{}' is consistently unhealthy; handing it out anyway", toolId);
        }
        return adapter;
    }

    public boolean isSupported(String toolId) {
        return toolId != null && adapters.containsKey(toolId);
    }

    /** Registered tool ids (sorted). */
    public List<String> supportedTools() {
        return adapters.keySet().stream().sorted().toList();
    }

    public boolean isConsistentlyUnhealthy(String toolId) {
        return healthMonitor.isConsistentlyUnhealthy(toolId);
    }

    public List<HealthStatus> healthHistory(String toolId) {
        return healthMonitor.history(toolId);
    }

    // ------------------------------------------------------------------
    // Health
    // ------------------------------------------------------------------

    /**
     * One fresh check per registered tool. A failure for one tool is
     * reported for that tool only.
     */
    public Map<String, HealthStatus> healthSummary() {
        List<AgentAdapter> snapshot = supportedTools().stream()
                .map(adapters::get)
                .filter(a -> a != null)
                .toList();
        return healthMonitor.checkAll(snapshot);
    }

    /** Counts per state, from the latest recorded check (no new checks). */
    public RegistryStats stats() {
        int healthy = 0, warning = 0, unhealthy = 0, unknown = 0;
        for (String toolId : supportedTools()) {
            HealthStatus.State state = healthMonitor.latest(toolId)
                    .map(HealthStatus::state)
                    .orElse(HealthStatus.State.UNKNOWN);
            switch (state) {
                case HEALTHY   -> healthy++;
                case WARNING   -> warning++;
                case UNHEALTHY -> unhealthy++;
                case UNKNOWN   -> unknown++;
            }
        }
        return new RegistryStats(healthy + warning + unhealthy + unknown, healthy, warning, unhealthy, unknown);
    }

    /** Background probe; interval from {@code agentflow.registry.health-check-interval-ms}. */
    @Scheduled(fixedDelayString  = "${agentflow.registry.health-check-interval-ms:60000}",
               initialDelayString = "${agentflow.registry.health-check-interval-ms:60000}")
    public void probe() {
        Map<String, HealthStatus> summary = healthSummary();
        log.debug("Health probe finished for {} adapters: {}", summary.size(), stats());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static void validate(AgentAdapter adapter) {
        if (adapter == null || adapter.toolId() == null || adapter.toolId().isBlank()) {
            throw new IllegalArgumentException("Adapter must specify a tool id");
        }
        CapabilityDescriptor caps = adapter.capabilities();
        if (caps == null || caps.maxContextTokens() <= 0) {
            throw new IllegalArgumentException("Adapter must specify max context tokens");
        }
        if (adapter.executableName() == null || adapter.executableName().isBlank()) {
            throw new IllegalArgumentException("Adapter must specify an executable name");
        }
        if (adapter.memoryFilename() == null || adapter.memoryFilename().isBlank()) {
            throw new IllegalArgumentException("Adapter must specify a memory file name");
        }
    }

    /** Adapter counts by latest health state. */
    public record RegistryStats(int total, int healthy, int warning, int unhealthy, int unknown) {}
}
