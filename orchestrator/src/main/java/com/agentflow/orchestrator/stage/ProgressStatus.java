package com.agentflow.orchestrator.stage;

/**
 * Status of a pipeline run as persisted in {@code stage_progress.status}.
 */
public enum ProgressStatus {
    IN_PROGRESS,   // a stage is (or was, before a crash) executing
    SUSPENDED,     // parked in a waiting stage until the next trigger
    FAILED,        // stage failed and escalated; resumes at the same stage
    COMPLETED
}
