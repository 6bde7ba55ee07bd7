package com.agentflow.orchestrator.stage;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Result of one pass of {@link StageRunner#run}.
 *
 * @param stage    Stage the pass ended on, as persisted (may be unrecognized).
 * @param outcomes Outcome per stage touched in this pass, pipeline order.
 * @param error    Compact cause when {@code status} is FAILED, else null.
 */
public record RunOutcome(
        String                            repository,
        Status                            status,
        String                            stage,
        Map<PipelineStage, StageOutcome>  outcomes,
        String                            error) {

    public enum Status { COMPLETED, SUSPENDED, FAILED, CANCELLED }

    public RunOutcome {
        Map<PipelineStage, StageOutcome> ordered = new EnumMap<>(PipelineStage.class);
        ordered.putAll(outcomes);
        outcomes = Collections.unmodifiableMap(ordered);
    }
}
