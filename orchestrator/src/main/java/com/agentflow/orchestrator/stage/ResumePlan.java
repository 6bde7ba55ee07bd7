package com.agentflow.orchestrator.stage;

import java.util.List;

/**
 * Where a run continues, and which earlier stages are marked skipped.
 *
 * @param resumeAt First stage to execute.
 * @param skipped  Every enumerated stage before {@code resumeAt}, in pipeline order.
 */
public record ResumePlan(PipelineStage resumeAt, List<PipelineStage> skipped) {

    public ResumePlan {
        skipped = List.copyOf(skipped);
    }

    public static ResumePlan fresh() {
        return new ResumePlan(PipelineStage.IMPLEMENTATION, List.of());
    }

    public boolean isResume() {
        return !skipped.isEmpty();
    }
}
