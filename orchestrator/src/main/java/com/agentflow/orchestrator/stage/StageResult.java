package com.agentflow.orchestrator.stage;

/** Non-failing result of a stage attempt. Failures are thrown. */
public enum StageResult {
    SUCCEEDED,
    // The stage depends on something outside the pipeline that is not ready yet.
    WAITING
}
