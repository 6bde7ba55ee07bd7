package com.agentflow.orchestrator.stage;

/**
 * Outcome of the retry policy for one failed attempt.
 *
 * @param retry  Run the same stage again.
 * @param reason Short explanation, logged and included in escalations.
 */
public record RetryDecision(boolean retry, String reason) {

    public static RetryDecision retry(String reason) {
        return new RetryDecision(true, reason);
    }

    public static RetryDecision noRetry(String reason) {
        return new RetryDecision(false, reason);
    }
}
