package com.agentflow.orchestrator.adapter;

import java.time.Instant;
import java.util.Map;

/**
 * Point-in-time health of one adapter.
 *
 * The most recent status is authoritative; older ones live in the
 * registry's bounded history.
 */
public record HealthStatus(
        State               state,
        String              message,
        Map<String, Object> details,
        Instant             checkedAt) {

    public enum State { HEALTHY, WARNING, UNHEALTHY, UNKNOWN }

    public HealthStatus {
        details   = details == null ? Map.of() : Map.copyOf(details);
        checkedAt = checkedAt == null ? Instant.now() : checkedAt;
    }

    public static HealthStatus healthy(String message, Map<String, Object> details) {
        return new HealthStatus(State.HEALTHY, message, details, Instant.now());
    }

    public static HealthStatus warning(String message, Map<String, Object> details) {
        return new HealthStatus(State.WARNING, message, details, Instant.now());
    }

    public static HealthStatus unhealthy(String message) {
        return new HealthStatus(State.UNHEALTHY, message, Map.of(), Instant.now());
    }

    public static HealthStatus unknown() {
        return new HealthStatus(State.UNKNOWN, "No health check recorded", Map.of(), Instant.now());
    }

    /** Same status with the state lowered to WARNING, unless it is already worse. */
    public HealthStatus degradeTo(String newMessage) {
        if (state != State.HEALTHY) return this;
        return new HealthStatus(State.WARNING, newMessage, details, checkedAt);
    }
}
