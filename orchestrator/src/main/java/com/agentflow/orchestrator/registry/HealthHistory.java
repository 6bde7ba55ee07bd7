package com.agentflow.orchestrator.registry;

import com.agentflow.orchestrator.adapter.HealthStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Bounded, time-ordered health history for one tool.
 *
 * Appends come from independent probe threads and may finish out of order;
 * each record is inserted at its {@code checkedAt} position so the history
 * stays monotonic in time. When full, the oldest record is dropped.
 */
class HealthHistory {

    private final int maxEntries;
    private final List<HealthStatus> entries = new ArrayList<>();

    HealthHistory(int maxEntries) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be at least 1, got " + maxEntries);
        }
        this.maxEntries = maxEntries;
    }

    synchronized void append(HealthStatus status) {
        int pos = entries.size();
        while (pos > 0 && entries.get(pos - 1).checkedAt().isAfter(status.checkedAt())) {
            pos--;
        }
        entries.add(pos, status);
        while (entries.size() > maxEntries) {
            entries.remove(0);
        }
    }

    synchronized Optional<HealthStatus> latest() {
        return entries.isEmpty() ? Optional.empty() : Optional.of(entries.get(entries.size() - 1));
    }

    synchronized List<HealthStatus> snapshot() {
        return List.copyOf(entries);
    }

    /** True when the last {@code threshold} records exist and are all UNHEALTHY. */
    synchronized boolean lastAllUnhealthy(int threshold) {
        if (threshold < 1 || entries.size() < threshold) {
            return false;
        }
        for (int i = entries.size() - threshold; i < entries.size(); i++) {
            if (entries.get(i).state() != HealthStatus.State.UNHEALTHY) {
                return false;
            }
        }
        return true;
    }
}
