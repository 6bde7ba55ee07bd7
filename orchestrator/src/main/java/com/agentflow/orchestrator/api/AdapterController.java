package com.agentflow.orchestrator.api;

import com.agentflow.orchestrator.adapter.HealthStatus;
import com.agentflow.orchestrator.adapter.UnsupportedToolException;
import com.agentflow.orchestrator.api.dto.AdapterResponse;
import com.agentflow.orchestrator.registry.AdapterRegistry;
import com.agentflow.orchestrator.registry.AdapterRegistry.RegistryStats;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

/**
 * Read-only view of the adapter registry.
 *
 * GET /adapters                    supported tools with capabilities
 * GET /adapters/{toolId}           one tool
 * GET /adapters/{toolId}/history   health history, oldest first
 * GET /adapters/health             one fresh check per tool
 * GET /adapters/stats              counts by latest health state
 */
@RestController
@RequestMapping("/adapters")
public class AdapterController {

    private final AdapterRegistry registry;

    public AdapterController(AdapterRegistry registry) {
        this.registry = registry;
    }

    @GetMapping
    public List<AdapterResponse> list() {
        return registry.supportedTools().stream()
                .map(this::describe)
                .toList();
    }

    @GetMapping("/health")
    public Map<String, HealthStatus> health() {
        return registry.healthSummary();
    }

    @GetMapping("/stats")
    public RegistryStats stats() {
        return registry.stats();
    }

    @GetMapping("/{toolId}")
    public AdapterResponse get(@PathVariable String toolId) {
        return describe(toolId);
    }

    @GetMapping("/{toolId}/history")
    public List<HealthStatus> history(@PathVariable String toolId) {
        if (!registry.isSupported(toolId)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Unsupported CLI type: '" + toolId + "'");
        }
        return registry.healthHistory(toolId);
    }

    private AdapterResponse describe(String toolId) {
        try {
            return AdapterResponse.from(registry.create(toolId), registry.isConsistentlyUnhealthy(toolId));
        } catch (UnsupportedToolException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        }
    }
}
