package com.agentflow.orchestrator.stage;

import com.agentflow.orchestrator.config.PipelineProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.agentflow.orchestrator.stage.PipelineStage.*;

/**
 * Pure pipeline rules: resume point, retry policy, next stage and stage
 * preconditions. No I/O; {@link StageRunner} applies the results.
 *
 * <p>The switches below are exhaustive over {@link PipelineStage} and have no
 * default branch, so adding a stage without deciding its resume and retry
 * behaviour does not compile.
 */
@Component
public class StageStateMachine {

    private final int maxAttempts;

    public StageStateMachine(PipelineProperties properties) {
        this.maxAttempts = Math.max(1, properties.getMaxAttempts());
    }

    // ------------------------------------------------------------------
    // Resume
    // ------------------------------------------------------------------

    /**
     * Resume point for a persisted stage name.
     *
     * @throws StageException {@code UNKNOWN_STAGE} when the name is not an
     *         enumerated stage; the position of such a stage is never guessed
     */
    public ResumePlan resumePlan(String persistedStage) {
        PipelineStage stage = PipelineStage.fromValue(persistedStage)
                .orElseThrow(() -> new StageException(StageException.Kind.UNKNOWN_STAGE,
                        "Unrecognized stage '" + persistedStage + "'; reset progress or add a mapping"));
        return new ResumePlan(stage, skippableBefore(stage));
    }

    /** Stages already behind a run that resumes at {@code stage}. */
    static List<PipelineStage> skippableBefore(PipelineStage stage) {
        return switch (stage) {
            case IMPLEMENTATION               -> List.of();
            case QUALITY                      -> List.of(IMPLEMENTATION);
            case SECURITY                     -> List.of(IMPLEMENTATION, QUALITY);
            case TESTING                      -> List.of(IMPLEMENTATION, QUALITY, SECURITY);
            case WAITING_EXTERNAL_INTEGRATION -> List.of(IMPLEMENTATION, QUALITY, SECURITY, TESTING);
            case WAITING_MERGE                -> List.of(IMPLEMENTATION, QUALITY, SECURITY, TESTING,
                                                         WAITING_EXTERNAL_INTEGRATION);
            case COMPLETED                    -> List.of(IMPLEMENTATION, QUALITY, SECURITY, TESTING,
                                                         WAITING_EXTERNAL_INTEGRATION, WAITING_MERGE);
        };
    }

    // ------------------------------------------------------------------
    // Transitions
    // ------------------------------------------------------------------

    public Optional<PipelineStage> next(PipelineStage stage) {
        return switch (stage) {
            case IMPLEMENTATION               -> Optional.of(QUALITY);
            case QUALITY                      -> Optional.of(SECURITY);
            case SECURITY                     -> Optional.of(TESTING);
            case TESTING                      -> Optional.of(WAITING_EXTERNAL_INTEGRATION);
            case WAITING_EXTERNAL_INTEGRATION -> Optional.of(WAITING_MERGE);
            case WAITING_MERGE                -> Optional.of(COMPLETED);
            case COMPLETED                    -> Optional.empty();
        };
    }

    /**
     * A stage may run when the stage before it succeeded or was skipped.
     * The first stage has no precondition.
     */
    public boolean preconditionsMet(PipelineStage stage, Map<PipelineStage, StageOutcome> outcomes) {
        if (stage.ordinal() == 0) return true;
        PipelineStage previous = PipelineStage.values()[stage.ordinal() - 1];
        StageOutcome outcome = outcomes.get(previous);
        return outcome == StageOutcome.SUCCEEDED || outcome == StageOutcome.SKIPPED;
    }

    // ------------------------------------------------------------------
    // Retry policy
    // ------------------------------------------------------------------

    /**
     * Decide whether a failed attempt of {@code stage} is run again.
     *
     * @param failedAttempts failed attempts of this stage so far, including this one
     */
    public RetryDecision retryDecision(PipelineStage stage, FailureKind kind, int failedAttempts) {
        return switch (stage) {
            // Posts exactly one attestation; a re-run would post a second, conflicting one.
            case SECURITY  -> RetryDecision.noRetry("security stage is never retried");
            case COMPLETED -> RetryDecision.noRetry("pipeline already completed");
            case IMPLEMENTATION, QUALITY, TESTING,
                 WAITING_EXTERNAL_INTEGRATION, WAITING_MERGE -> boundedRetry(kind, failedAttempts);
        };
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    private RetryDecision boundedRetry(FailureKind kind, int failedAttempts) {
        if (!kind.isTransient()) {
            return RetryDecision.noRetry(kind + " failures are not retried");
        }
        if (failedAttempts >= maxAttempts) {
            return RetryDecision.noRetry("attempt budget exhausted (" + failedAttempts + "/" + maxAttempts + ")");
        }
        return RetryDecision.retry("attempt " + failedAttempts + "/" + maxAttempts + " failed with " + kind);
    }
}
