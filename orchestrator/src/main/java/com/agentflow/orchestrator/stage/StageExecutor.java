package com.agentflow.orchestrator.stage;

/**
 * Runs one attempt of a stage.
 *
 * Implementations throw on failure; {@link FailureKind#classify} decides
 * what the thrown exception means for the retry policy.
 */
public interface StageExecutor {

    StageResult execute(StageRequest request);
}
