package com.agentflow.orchestrator.hosting;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * What the waiting stages need to know about a branch's pull request.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PullRequestStatus(
        @JsonProperty("merged")              boolean merged,
        @JsonProperty("has_conflicts")       boolean hasConflicts,
        @JsonProperty("checks_failing")      boolean checksFailing,
        @JsonProperty("unresolved_comments") int unresolvedComments,
        @JsonProperty("detail")              Map<String, Object> detail
) {
    public PullRequestStatus {
        detail = detail == null ? Map.of() : Map.copyOf(detail);
    }

    /** No conflicts, no failing checks and no open review threads. */
    public boolean readyForIntegration() {
        return !hasConflicts && !checksFailing && unresolvedComments == 0;
    }

    /** Compact reason for logs, e.g. "conflicts, 2 unresolved comments". */
    public String blockers() {
        StringBuilder sb = new StringBuilder();
        if (hasConflicts) sb.append("conflicts");
        if (checksFailing) sb.append(sb.isEmpty() ? "" : ", ").append("failing checks");
        if (unresolvedComments > 0) {
            sb.append(sb.isEmpty() ? "" : ", ").append(unresolvedComments).append(" unresolved comments");
        }
        return sb.isEmpty() ? "none" : sb.toString();
    }
}
