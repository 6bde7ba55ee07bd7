package com.agentflow.orchestrator.registry;

import com.agentflow.orchestrator.adapter.HealthStatus;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Exposes adapter health under {@code /actuator/health}.
 *
 * Reads the latest recorded check per tool instead of running new ones, so
 * the endpoint never waits on a slow adapter. DOWN only when some adapter is
 * consistently unhealthy; single failed checks show up in the details.
 */
@Component
public class AdapterHealthIndicator implements HealthIndicator {

    private final AdapterRegistry registry;
    private final HealthMonitor   healthMonitor;

    public AdapterHealthIndicator(AdapterRegistry registry, HealthMonitor healthMonitor) {
        this.registry      = registry;
        this.healthMonitor = healthMonitor;
    }

    @Override
    public Health health() {
        Map<String, Object> adapters = new LinkedHashMap<>();
        boolean anyConsistentlyUnhealthy = false;
        for (String toolId : registry.supportedTools()) {
            HealthStatus latest = healthMonitor.latest(toolId).orElse(HealthStatus.unknown());
            boolean consistentlyUnhealthy = healthMonitor.isConsistentlyUnhealthy(toolId);
            anyConsistentlyUnhealthy |= consistentlyUnhealthy;
            adapters.put(toolId, Map.of(
                    "state",                 latest.state().name(),
                    "message",               String.valueOf(latest.message()),
                    "checkedAt",             latest.checkedAt().toString(),
                    "consistentlyUnhealthy", consistentlyUnhealthy));
        }
        Health.Builder builder = anyConsistentlyUnhealthy ? Health.down() : Health.up();
        return builder.withDetail("adapters", adapters)
                .withDetail("stats", registry.stats())
                .build();
    }
}
