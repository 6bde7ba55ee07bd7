package com.agentflow.orchestrator.registry;

import com.agentflow.orchestrator.adapter.AgentAdapter;
import com.agentflow.orchestrator.adapter.HealthStatus;
import com.agentflow.orchestrator.config.RegistryProperties;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs adapter health checks and keeps a bounded history per tool.
 *
 * Each check runs on a small dedicated pool and is bounded by
 * {@code agentflow.registry.health-check-timeout}. A check that throws or
 * times out is recorded as UNHEALTHY for that tool only; other tools are
 * unaffected.
 *
 * <p>Health is advisory. Nothing here blocks an adapter from being used.
 */
@Component
public class HealthMonitor {

    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);

    private final Map<String, HealthHistory> histories = new ConcurrentHashMap<>();
    private final RegistryProperties properties;
    private final MeterRegistry      meterRegistry;
    private final ExecutorService    probes;

    public HealthMonitor(RegistryProperties properties, MeterRegistry meterRegistry) {
        this.properties    = properties;
        this.meterRegistry = meterRegistry;
        this.probes        = Executors.newFixedThreadPool(Math.max(1, properties.getProbeThreads()));
    }

    // ------------------------------------------------------------------
    // Checks
    // ------------------------------------------------------------------

    /** Check one adapter and record the result. */
    public HealthStatus check(AgentAdapter adapter) {
        return await(adapter.toolId(), probes.submit(adapter::healthCheck));
    }

    /**
     * Check several adapters concurrently. The returned map keeps the
     * iteration order of {@code adapters}.
     */
    public Map<String, HealthStatus> checkAll(Collection<AgentAdapter> adapters) {
        Map<String, Future<HealthStatus>> pending = new LinkedHashMap<>();
        for (AgentAdapter adapter : adapters) {
            pending.put(adapter.toolId(), probes.submit(adapter::healthCheck));
        }
        Map<String, HealthStatus> results = new LinkedHashMap<>();
        pending.forEach((toolId, future) -> results.put(toolId, await(toolId, future)));
        return results;
    }

    // ------------------------------------------------------------------
    // History
    // ------------------------------------------------------------------

    public void record(String toolId, HealthStatus status) {
        histories.computeIfAbsent(toolId, id -> new HealthHistory(properties.getMaxHistoryEntries()))
                .append(status);
        meterRegistry.counter("agentflow.adapter.health.checks",
                "tool", toolId, "state", status.state().name().toLowerCase()).increment();
    }

    public Optional<HealthStatus> latest(String toolId) {
        HealthHistory history = histories.get(toolId);
        return history == null ? Optional.empty() : history.latest();
    }

    public List<HealthStatus> history(String toolId) {
        HealthHistory history = histories.get(toolId);
        return history == null ? List.of() : history.snapshot();
    }

    /**
     * True when the most recent N checks for the tool were all UNHEALTHY,
     * N being {@code agentflow.registry.unhealthy-threshold}.
     */
    public boolean isConsistentlyUnhealthy(String toolId) {
        HealthHistory history = histories.get(toolId);
        return history != null && history.lastAllUnhealthy(properties.getUnhealthyThreshold());
    }

    public void forget(String toolId) {
        histories.remove(toolId);
    }

    @PreDestroy
    void shutdown() {
        probes.shutdownNow();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private HealthStatus await(String toolId, Future<HealthStatus> future) {
        Timer.Sample sample = Timer.start(meterRegistry);
        HealthStatus status;
        try {
            status = future.get(properties.getHealthCheckTimeout().toMillis(), TimeUnit.MILLISECONDS);
            if (status == null) {
                status = HealthStatus.unhealthy("Health check returned no status");
            }
        } catch (TimeoutException e) {
            future.cancel(true);
            status = HealthStatus.unhealthy("Health check timeout");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            status = HealthStatus.unhealthy("Health check failed: " + cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            status = HealthStatus.unhealthy("Health check interrupted");
        } finally {
            sample.stop(meterRegistry.timer("agentflow.adapter.health.duration", "tool", toolId));
        }

        record(toolId, status);
        if (status.state() == HealthStatus.State.HEALTHY) {
            log.debug("Adapter '{}' healthy", toolId);
        } else {
            log.warn("Adapter '{}' health {}: {}", toolId, status.state(), status.message());
        }
        return status;
    }
}
