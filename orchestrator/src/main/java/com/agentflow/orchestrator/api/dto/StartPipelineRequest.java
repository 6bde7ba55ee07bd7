package com.agentflow.orchestrator.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Request body for POST /pipelines.
 *
 * Required: repository, taskId
 * Optional: branch, used by the waiting stages to find the pull request.
 */
public record StartPipelineRequest(
        @NotBlank String repository,
        @NotBlank String taskId,
        String branch) {
}
