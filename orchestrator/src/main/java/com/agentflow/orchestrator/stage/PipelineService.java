package com.agentflow.orchestrator.stage;

import com.agentflow.orchestrator.bridge.SubprocessBridge;
import com.agentflow.orchestrator.config.PipelineProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Entry point used by the event-trigger layer (through the REST API).
 *
 * Runs execute on a fixed worker pool so that the number of concurrent agent
 * processes is capped. At most one run per repository is live at a time; a
 * second start while one is live is rejected rather than queued.
 */
@Service
public class PipelineService {

    private static final Logger log = LoggerFactory.getLogger(PipelineService.class);

    private final StageRunner      runner;
    private final ProgressStore    progressStore;
    private final SubprocessBridge bridge;
    private final ExecutorService  workers;

    // Keyed by progress key; completed futures are replaced on the next start.
    private final Map<String, Future<RunOutcome>> live = new ConcurrentHashMap<>();

    public PipelineService(StageRunner runner,
                           ProgressStore progressStore,
                           SubprocessBridge bridge,
                           PipelineProperties properties) {
        this.runner        = runner;
        this.progressStore = progressStore;
        this.bridge        = bridge;
        this.workers       = Executors.newFixedThreadPool(Math.max(1, properties.getWorkerThreads()), r -> {
            Thread t = new Thread(r, "pipeline-worker");
            t.setDaemon(true);
            return t;
        });
    }

    // ------------------------------------------------------------------
    // Start / cancel
    // ------------------------------------------------------------------

    /**
     * Start or resume the repository's pipeline in the background.
     *
     * @throws StageException {@code ALREADY_RUNNING} if a run is live for the repository
     * @throws IllegalArgumentException if the repository name is empty
     */
    public void start(String repository, String taskId, String branch) {
        String key = RepositorySlug.progressKey(repository);
        live.compute(key, (k, existing) -> {
            if (existing != null && !existing.isDone()) {
                throw new StageException(StageException.Kind.ALREADY_RUNNING,
                        "A pipeline run is already live for " + repository);
            }
            log.info("Queueing pipeline run for {} (task {}, branch {})", repository, taskId, branch);
            return workers.submit(() -> runSafely(repository, taskId, branch));
        });
    }

    /**
     * Cancel the repository's live run: terminate its agent if one is running
     * and interrupt the worker.
     *
     * @return false when nothing is live for the repository
     */
    public boolean cancel(String repository) {
        String key = RepositorySlug.progressKey(repository);
        boolean agentCancelled = bridge.cancel(key);
        Future<RunOutcome> run = live.get(key);
        boolean workerCancelled = false;
        if (run != null && !run.isDone() && !agentCancelled) {
            workerCancelled = run.cancel(true);
        }
        if (agentCancelled || workerCancelled) {
            log.warn("Cancelled pipeline run for {}", repository);
            return true;
        }
        return false;
    }

    public boolean isRunning(String repository) {
        Future<RunOutcome> run = live.get(RepositorySlug.progressKey(repository));
        return run != null && !run.isDone();
    }

    // ------------------------------------------------------------------
    // Progress
    // ------------------------------------------------------------------

    public Optional<StageProgress> progress(String repository) {
        return progressStore.read(repository);
    }

    /**
     * Delete the repository's progress so the next start begins at the first stage.
     *
     * @throws StageException {@code ALREADY_RUNNING} while a run is live
     */
    public void reset(String repository) {
        if (isRunning(repository)) {
            throw new StageException(StageException.Kind.ALREADY_RUNNING,
                    "Cannot reset progress while a run is live for " + repository);
        }
        progressStore.clear(repository);
    }

    @PreDestroy
    void shutdown() {
        workers.shutdownNow();
    }

    private RunOutcome runSafely(String repository, String taskId, String branch) {
        try {
            RunOutcome outcome = runner.run(repository, taskId, branch);
            log.info("Pipeline run for {} ended {} at {}", repository, outcome.status(), outcome.stage());
            return outcome;
        } catch (Exception e) {
            log.error("Unhandled error in pipeline run for {}: {}", repository, e.getMessage(), e);
            throw e;
        }
    }
}
