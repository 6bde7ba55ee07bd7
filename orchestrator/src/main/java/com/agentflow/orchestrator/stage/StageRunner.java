package com.agentflow.orchestrator.stage;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Drives one repository's pipeline from its persisted resume point until it
 * completes, suspends on a waiting stage, fails or is cancelled.
 *
 * Ordering rules:
 *   - progress is written before the next stage starts, so a crash between a
 *     stage's action and the write resumes at the prior stage, never later
 *   - every failed attempt is written before the retry decision is applied
 *   - progress is cleared only when the pipeline reaches COMPLETED
 *
 * Runs are invoked from {@link PipelineService}'s worker pool; this class
 * holds no per-run state.
 */
@Component
public class StageRunner {

    private static final Logger log = LoggerFactory.getLogger(StageRunner.class);

    // Longest cause string kept in progress and escalations.
    private static final int MAX_CAUSE = 500;

    private final StageStateMachine    stateMachine;
    private final ProgressStore        progressStore;
    private final AgentStageExecutor   agentExecutor;
    private final WaitingStageExecutor waitingExecutor;
    private final EscalationNotifier   notifier;
    private final MeterRegistry        meterRegistry;

    public StageRunner(StageStateMachine stateMachine,
                       ProgressStore progressStore,
                       AgentStageExecutor agentExecutor,
                       WaitingStageExecutor waitingExecutor,
                       EscalationNotifier notifier,
                       MeterRegistry meterRegistry) {
        this.stateMachine    = stateMachine;
        this.progressStore   = progressStore;
        this.agentExecutor   = agentExecutor;
        this.waitingExecutor = waitingExecutor;
        this.notifier        = notifier;
        this.meterRegistry   = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Entry point
    // ------------------------------------------------------------------

    public RunOutcome run(String repository, String taskId, String branch) {
        MDC.put("repository", repository);
        Timer.Sample sample = Timer.start(meterRegistry);
        RunOutcome outcome = null;
        try {
            outcome = runPipeline(repository, taskId, branch);
            return outcome;
        } finally {
            String status = outcome == null ? "ERROR" : outcome.status().name();
            sample.stop(meterRegistry.timer("agentflow.stage.run.duration", "outcome", status));
            meterRegistry.counter("agentflow.stage.runs", "outcome", status).increment();
            MDC.remove("repository");
            MDC.remove("stage");
            MDC.remove("tool");
        }
    }

    // ------------------------------------------------------------------
    // Pipeline
    // ------------------------------------------------------------------

    private RunOutcome runPipeline(String repository, String taskId, String branch) {
        StageProgress progress = loadOrCreate(repository, taskId, branch);
        Map<PipelineStage, StageOutcome> outcomes = new EnumMap<>(PipelineStage.class);

        ResumePlan plan;
        try {
            plan = stateMachine.resumePlan(progress.getStage());
        } catch (StageException e) {
            // Never guess a position for a stage this deployment does not know.
            String cause = compact(e);
            progress.setStatus(ProgressStatus.FAILED);
            progress.setLastError(cause);
            progressStore.write(progress);
            notifier.escalate(repository, progress.getBranch(), progress.getStage(),
                    FailureKind.UNKNOWN_STAGE, cause, "reset progress to restart the pipeline");
            return new RunOutcome(repository, RunOutcome.Status.FAILED, progress.getStage(), outcomes, cause);
        }

        plan.skipped().forEach(s -> outcomes.put(s, StageOutcome.SKIPPED));
        if (plan.isResume()) {
            log.info("Resuming {} at {} (skipping {})", repository, plan.resumeAt().value(), plan.skipped());
        } else {
            log.info("Starting pipeline for {} (task {})", repository, taskId);
        }
        progress.setStatus(plan.resumeAt().isTerminal() ? ProgressStatus.COMPLETED : ProgressStatus.IN_PROGRESS);
        progressStore.write(progress);

        PipelineStage stage = plan.resumeAt();
        while (!stage.isTerminal()) {
            MDC.put("stage", stage.value());
            if (!stateMachine.preconditionsMet(stage, outcomes)) {
                throw new StageException(StageException.Kind.PRECONDITION_FAILED,
                        "Stage " + stage.value() + " reached without its predecessor succeeding or being skipped");
            }

            Optional<RunOutcome> stopped = runStage(progress, stage, outcomes);
            if (stopped.isPresent()) {
                return stopped.get();
            }

            PipelineStage next = stateMachine.next(stage).orElseThrow();
            progress.advanceTo(next);
            progressStore.write(progress);       // persisted before the next stage starts
            log.info("{} advanced {} -> {}", repository, stage.value(), next.value());
            stage = next;
        }

        progressStore.clear(repository);
        log.info("Pipeline completed for {}", repository);
        return new RunOutcome(repository, RunOutcome.Status.COMPLETED, stage.value(), outcomes, null);
    }

    /**
     * Run one stage through its attempt budget.
     *
     * @return empty when the stage succeeded, otherwise the outcome that ends this pass
     */
    private Optional<RunOutcome> runStage(StageProgress progress,
                                          PipelineStage stage,
                                          Map<PipelineStage, StageOutcome> outcomes) {
        StageExecutor executor = executorFor(stage);
        String repository = progress.getRepository();

        while (true) {
            int attempt = progress.getAttempt() + 1;
            String runKey = progress.getProgressKey();
            progress.setRunHandle(runKey + "/" + stage.value() + "/" + attempt);
            progressStore.write(progress);

            StageResult result;
            try {
                result = executor.execute(new StageRequest(
                        repository, progress.getTaskId(), progress.getBranch(), stage, attempt, runKey));
            } catch (RuntimeException e) {
                // A cancel with no agent running interrupts the worker; retrying would fail at once.
                FailureKind kind = Thread.currentThread().isInterrupted()
                        ? FailureKind.CANCELLED
                        : FailureKind.classify(e);
                String cause = compact(e);
                progress.recordFailedAttempt(cause);
                progress.setRunHandle(null);

                if (kind == FailureKind.CANCELLED) {
                    progress.setStatus(ProgressStatus.SUSPENDED);
                    progressStore.write(progress);
                    log.warn("Stage {} of {} cancelled", stage.value(), repository);
                    outcomes.put(stage, StageOutcome.FAILED);
                    return Optional.of(new RunOutcome(repository, RunOutcome.Status.CANCELLED,
                            stage.value(), outcomes, cause));
                }

                progressStore.write(progress);   // the failed attempt is durable before deciding
                RetryDecision decision = stateMachine.retryDecision(stage, kind, progress.getAttempt());
                if (decision.retry()) {
                    log.warn("Stage {} failed ({}), retrying: {} [{}]", stage.value(), kind, cause, decision.reason());
                    continue;
                }

                progress.setStatus(ProgressStatus.FAILED);
                progressStore.write(progress);
                outcomes.put(stage, StageOutcome.FAILED);
                notifier.escalate(repository, progress.getBranch(), stage.value(), kind, cause, decision.reason());
                return Optional.of(new RunOutcome(repository, RunOutcome.Status.FAILED,
                        stage.value(), outcomes, "[" + stage.value() + "] " + kind + ": " + cause));
            }

            if (result == StageResult.WAITING) {
                progress.setRunHandle(null);
                progress.setStatus(ProgressStatus.SUSPENDED);
                progressStore.write(progress);
                outcomes.put(stage, StageOutcome.WAITING);
                return Optional.of(new RunOutcome(repository, RunOutcome.Status.SUSPENDED,
                        stage.value(), outcomes, null));
            }

            outcomes.put(stage, StageOutcome.SUCCEEDED);
            return Optional.empty();
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /**
     * Current record, or a fresh one. A record for another task, or one left
     * COMPLETED, is replaced; a FAILED record for the same task resumes at its
     * stage with a new attempt budget.
     */
    private StageProgress loadOrCreate(String repository, String taskId, String branch) {
        Optional<StageProgress> existing = progressStore.read(repository);
        if (existing.isEmpty()) {
            return new StageProgress(repository, taskId, branch);
        }
        StageProgress progress = existing.get();
        if (!progress.getTaskId().equals(taskId)) {
            log.info("Task {} replaces recorded task {} for {}", taskId, progress.getTaskId(), repository);
            return new StageProgress(repository, taskId, branch);
        }
        if (progress.getStatus() == ProgressStatus.COMPLETED) {
            return new StageProgress(repository, taskId, branch);
        }
        if (progress.getStatus() == ProgressStatus.FAILED && PipelineStage.fromValue(progress.getStage()).isPresent()) {
            progress.resetAttempts();
        }
        if (branch != null && !branch.isBlank()) {
            progress.setBranch(branch);
        }
        return progress;
    }

    private StageExecutor executorFor(PipelineStage stage) {
        return stage.isWaiting() ? waitingExecutor : agentExecutor;
    }

    static String compact(Throwable e) {
        String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        int newline = message.indexOf('\n');
        if (newline >= 0) {
            message = message.substring(0, newline);
        }
        return message.length() <= MAX_CAUSE ? message : message.substring(0, MAX_CAUSE) + "...";
    }
}
