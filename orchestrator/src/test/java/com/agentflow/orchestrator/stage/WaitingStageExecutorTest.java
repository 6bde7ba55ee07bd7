package com.agentflow.orchestrator.stage;

import com.agentflow.orchestrator.hosting.CodeHostingClient;
import com.agentflow.orchestrator.hosting.PullRequestStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WaitingStageExecutorTest {

    @Mock CodeHostingClient codeHosting;

    WaitingStageExecutor executor;

    @BeforeEach
    void setUp() {
        executor = new WaitingStageExecutor(codeHosting);
    }

    private static StageRequest request(PipelineStage stage) {
        return new StageRequest("acme/api", "task-1", "feature/x", stage, 1, "pipeline-progress-acme-api");
    }

    private static PullRequestStatus status(boolean merged, boolean conflicts, boolean failing, int comments) {
        return new PullRequestStatus(merged, conflicts, failing, comments, null);
    }

    @Test
    void integration_cleanPullRequest_succeeds() {
        when(codeHosting.pullRequestStatus("acme/api", "feature/x")).thenReturn(status(false, false, false, 0));

        assertThat(executor.execute(request(PipelineStage.WAITING_EXTERNAL_INTEGRATION)))
                .isEqualTo(StageResult.SUCCEEDED);
    }

    @Test
    void integration_unresolvedComments_waits() {
        when(codeHosting.pullRequestStatus("acme/api", "feature/x")).thenReturn(status(false, false, false, 2));

        assertThat(executor.execute(request(PipelineStage.WAITING_EXTERNAL_INTEGRATION)))
                .isEqualTo(StageResult.WAITING);
    }

    @Test
    void merge_notMerged_waits() {
        when(codeHosting.pullRequestStatus("acme/api", "feature/x")).thenReturn(status(false, false, false, 0));

        assertThat(executor.execute(request(PipelineStage.WAITING_MERGE))).isEqualTo(StageResult.WAITING);
    }

    @Test
    void merge_merged_succeeds() {
        when(codeHosting.pullRequestStatus("acme/api", "feature/x")).thenReturn(status(true, false, false, 0));

        assertThat(executor.execute(request(PipelineStage.WAITING_MERGE))).isEqualTo(StageResult.SUCCEEDED);
    }

    @Test
    void agentStage_rejected() {
        when(codeHosting.pullRequestStatus("acme/api", "feature/x")).thenReturn(status(true, false, false, 0));

        assertThatThrownBy(() -> executor.execute(request(PipelineStage.QUALITY)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
