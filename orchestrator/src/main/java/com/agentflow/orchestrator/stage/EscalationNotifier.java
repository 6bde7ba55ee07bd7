package com.agentflow.orchestrator.stage;

import com.agentflow.orchestrator.hosting.CodeHostingClient;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Makes a stage failure human-visible: an ERROR log line, a counter and,
 * when enabled, a comment on the branch's pull request.
 *
 * Escalation never fails the caller; a comment that cannot be posted is logged.
 */
@Component
public class EscalationNotifier {

    private static final Logger log = LoggerFactory.getLogger(EscalationNotifier.class);

    private final CodeHostingClient codeHosting;
    private final MeterRegistry     meterRegistry;
    private final boolean           commentOnFailure;

    public EscalationNotifier(CodeHostingClient codeHosting,
                              MeterRegistry meterRegistry,
                              @Value("${agentflow.pipeline.comment-on-escalation:false}") boolean commentOnFailure) {
        this.codeHosting      = codeHosting;
        this.meterRegistry    = meterRegistry;
        this.commentOnFailure = commentOnFailure;
    }

    /**
     * @param stage  persisted stage name (may be one this deployment does not know)
     * @param cause  compact cause string
     * @param reason why the failure was not retried
     */
    public void escalate(String repository, String branch, String stage,
                         FailureKind kind, String cause, String reason) {
        log.error("ESCALATION repository={} stage={} kind={} cause=\"{}\" ({})",
                repository, stage, kind, cause, reason);
        meterRegistry.counter("agentflow.stage.escalations", "stage", stage, "kind", kind.name()).increment();

        if (!commentOnFailure || branch == null || branch.isBlank()) {
            return;
        }
        String body = "Pipeline stage `" + stage + "` failed (" + kind + "): " + cause
                + "\n\nNot retried: " + reason;
        try {
            codeHosting.comment(repository, branch, body);
        } catch (RuntimeException e) {
            log.warn("Could not post escalation comment for {}: {}", repository, e.getMessage());
        }
    }
}
