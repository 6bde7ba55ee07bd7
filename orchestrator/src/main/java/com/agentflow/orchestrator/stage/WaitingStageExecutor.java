package com.agentflow.orchestrator.stage;

import com.agentflow.orchestrator.hosting.CodeHostingClient;
import com.agentflow.orchestrator.hosting.PullRequestStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Waiting stages: ask the code-hosting service whether the pull request is
 * ready to move on. Not ready means the run suspends at this stage.
 */
@Component
public class WaitingStageExecutor implements StageExecutor {

    private static final Logger log = LoggerFactory.getLogger(WaitingStageExecutor.class);

    private final CodeHostingClient codeHosting;

    public WaitingStageExecutor(CodeHostingClient codeHosting) {
        this.codeHosting = codeHosting;
    }

    @Override
    public StageResult execute(StageRequest request) {
        PullRequestStatus status = codeHosting.pullRequestStatus(request.repository(), request.branch());
        boolean ready = switch (request.stage()) {
            case WAITING_EXTERNAL_INTEGRATION -> status.readyForIntegration();
            case WAITING_MERGE                -> status.merged();
            default -> throw new IllegalArgumentException("Not a waiting stage: " + request.stage());
        };
        if (ready) {
            log.info("{} satisfied for {}", request.stage().value(), request.repository());
            return StageResult.SUCCEEDED;
        }
        log.info("{} not satisfied for {} (merged={}, blockers: {})",
                request.stage().value(), request.repository(), status.merged(), status.blockers());
        return StageResult.WAITING;
    }
}
