package com.agentflow.orchestrator.hosting;

/**
 * The code-hosting collaborator, consumed as yes/no answers plus detail.
 */
public interface CodeHostingClient {

    /**
     * Status of the open pull request for {@code branch}.
     *
     * @throws CodeHostingException if the service is unreachable
     */
    PullRequestStatus pullRequestStatus(String repository, String branch);

    /** Post a comment on the branch's pull request. */
    void comment(String repository, String branch, String text);
}
