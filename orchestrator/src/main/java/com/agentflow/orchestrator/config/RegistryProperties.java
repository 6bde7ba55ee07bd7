package com.agentflow.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Adapter registry and health-monitor settings ({@code agentflow.registry.*}).
 * The probe interval itself is read by {@code @Scheduled} from
 * {@code agentflow.registry.health-check-interval-ms}.
 */
@ConfigurationProperties(prefix = "agentflow.registry")
public class RegistryProperties {

    private Duration healthCheckTimeout = Duration.ofSeconds(30);
    private int      maxHistoryEntries  = 100;
    private int      unhealthyThreshold = 3;
    private int      probeThreads       = 4;

    public Duration getHealthCheckTimeout() { return healthCheckTimeout; }
    public void setHealthCheckTimeout(Duration healthCheckTimeout) { this.healthCheckTimeout = healthCheckTimeout; }

    public int getMaxHistoryEntries() { return maxHistoryEntries; }
    public void setMaxHistoryEntries(int maxHistoryEntries) { this.maxHistoryEntries = maxHistoryEntries; }

    public int getUnhealthyThreshold() { return unhealthyThreshold; }
    public void setUnhealthyThreshold(int unhealthyThreshold) { this.unhealthyThreshold = unhealthyThreshold; }

    public int getProbeThreads() { return probeThreads; }
    public void setProbeThreads(int probeThreads) { this.probeThreads = probeThreads; }
}
