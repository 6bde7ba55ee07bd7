package com.agentflow.orchestrator.api.dto;

import com.agentflow.orchestrator.stage.StageProgress;

import java.time.Instant;

/**
 * Response body for the pipeline endpoints.
 *
 * {@code status} is the persisted progress status, or {@code QUEUED} when a
 * run was accepted but has not written progress yet.
 */
public record ProgressResponse(
        String  repository,
        String  taskId,
        String  branch,
        String  stage,
        String  status,
        int     attempt,
        String  lastError,
        boolean running,
        Instant startedAt,
        Instant lastUpdated
) {
    public static ProgressResponse from(StageProgress p, boolean running) {
        return new ProgressResponse(
                p.getRepository(),
                p.getTaskId(),
                p.getBranch(),
                p.getStage(),
                p.getStatus().name(),
                p.getAttempt(),
                p.getLastError(),
                running,
                p.getStartedAt(),
                p.getLastUpdated()
        );
    }

    public static ProgressResponse queued(String repository, String taskId, String branch) {
        return new ProgressResponse(repository, taskId, branch, null, "QUEUED", 0, null, true, null, null);
    }
}
