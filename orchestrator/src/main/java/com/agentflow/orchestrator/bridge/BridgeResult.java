package com.agentflow.orchestrator.bridge;

import java.time.Duration;

/**
 * Exit status and captured output (stdout and stderr merged) of one agent process.
 */
public record BridgeResult(
        int          exitCode,
        String       output,
        DeliveryPath deliveredVia,
        Duration     duration) {

    public enum DeliveryPath { COMPANION, DIRECT }

    public boolean succeeded() {
        return exitCode == 0;
    }
}
