package com.agentflow.orchestrator.stage;

/** Per-stage result within one run. */
public enum StageOutcome {
    SUCCEEDED,
    SKIPPED,    // completed by an earlier run; counts as success for the next stage
    WAITING,
    FAILED
}
