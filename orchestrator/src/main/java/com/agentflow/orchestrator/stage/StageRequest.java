package com.agentflow.orchestrator.stage;

/**
 * One attempt of one stage.
 *
 * @param runKey  Bridge run key; cancellation addresses the run through it.
 * @param attempt 1-based attempt number within the stage.
 */
public record StageRequest(
        String        repository,
        String        taskId,
        String        branch,
        PipelineStage stage,
        int           attempt,
        String        runKey) {
}
