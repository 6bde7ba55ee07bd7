package com.agentflow.orchestrator.api;

import com.agentflow.orchestrator.api.dto.ProgressResponse;
import com.agentflow.orchestrator.api.dto.StartPipelineRequest;
import com.agentflow.orchestrator.stage.PipelineService;
import com.agentflow.orchestrator.stage.StageException;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

/**
 * REST API used by the event-trigger layer.
 *
 * POST   /pipelines                         start or resume a repository's pipeline
 * GET    /pipelines/progress?repository=    current progress record
 * DELETE /pipelines/progress?repository=    explicit reset (idempotent)
 * POST   /pipelines/cancel?repository=      cancel the live run
 */
@RestController
@RequestMapping("/pipelines")
public class PipelineController {

    private final PipelineService pipelineService;

    public PipelineController(PipelineService pipelineService) {
        this.pipelineService = pipelineService;
    }

    /**
     * Start or resume a pipeline run. The run proceeds in the background.
     *
     * Example:
     *   curl -X POST http://localhost:8080/pipelines \
     *     -H "Content-Type: application/json" \
     *     -d '{"repository":"https://github.com/acme/widgets","taskId":"42","branch":"task-42"}'
     *
     * HTTP 202 on acceptance, 409 while a run is already live, 400 on a bad repository.
     */
    @PostMapping
    public ResponseEntity<ProgressResponse> start(@Valid @RequestBody StartPipelineRequest req) {
        try {
            pipelineService.start(req.repository(), req.taskId(), req.branch());
        } catch (StageException e) {
            throw toHttp(e);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
        ProgressResponse body = pipelineService.progress(req.repository())
                .map(p -> ProgressResponse.from(p, true))
                .orElseGet(() -> ProgressResponse.queued(req.repository(), req.taskId(), req.branch()));
        return ResponseEntity.accepted().body(body);
    }

    @GetMapping("/progress")
    public ProgressResponse progress(@RequestParam String repository) {
        return pipelineService.progress(repository)
                .map(p -> ProgressResponse.from(p, pipelineService.isRunning(repository)))
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "No progress recorded for " + repository));
    }

    @DeleteMapping("/progress")
    public ResponseEntity<Void> reset(@RequestParam String repository) {
        try {
            pipelineService.reset(repository);
        } catch (StageException e) {
            throw toHttp(e);
        }
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/cancel")
    public ResponseEntity<Void> cancel(@RequestParam String repository) {
        if (!pipelineService.cancel(repository)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "No live run for " + repository);
        }
        return ResponseEntity.accepted().build();
    }

    private static ResponseStatusException toHttp(StageException e) {
        HttpStatus status = e.getKind() == StageException.Kind.ALREADY_RUNNING
                ? HttpStatus.CONFLICT
                : HttpStatus.UNPROCESSABLE_ENTITY;
        return new ResponseStatusException(status, e.getMessage());
    }
}
