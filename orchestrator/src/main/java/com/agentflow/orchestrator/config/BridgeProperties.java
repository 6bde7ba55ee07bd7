package com.agentflow.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Subprocess bridge and companion settings ({@code agentflow.bridge.*}).
 */
@ConfigurationProperties(prefix = "agentflow.bridge")
public class BridgeProperties {

    public enum InputMode { FIFO, STDIN }

    private InputMode inputMode         = InputMode.FIFO;
    private String    fifoPath          = "/workspace/agent-input.jsonl";
    private Duration  cancelGracePeriod = Duration.ofSeconds(10);
    // Zero means wait for the agent indefinitely.
    private Duration  maxRunDuration    = Duration.ZERO;
    private Duration  pipeOpenPoll      = Duration.ofMillis(200);

    private Companion companion = new Companion();

    public InputMode getInputMode() { return inputMode; }
    public void setInputMode(InputMode inputMode) { this.inputMode = inputMode; }

    public String getFifoPath() { return fifoPath; }
    public void setFifoPath(String fifoPath) { this.fifoPath = fifoPath; }

    public Duration getCancelGracePeriod() { return cancelGracePeriod; }
    public void setCancelGracePeriod(Duration cancelGracePeriod) { this.cancelGracePeriod = cancelGracePeriod; }

    public Duration getMaxRunDuration() { return maxRunDuration; }
    public void setMaxRunDuration(Duration maxRunDuration) { this.maxRunDuration = maxRunDuration; }

    public Duration getPipeOpenPoll() { return pipeOpenPoll; }
    public void setPipeOpenPoll(Duration pipeOpenPoll) { this.pipeOpenPoll = pipeOpenPoll; }

    public Companion getCompanion() { return companion; }
    public void setCompanion(Companion companion) { this.companion = companion; }

    public static class Companion {

        private boolean  enabled           = false;
        private String   url               = "http://localhost:8080";
        private int      readinessAttempts = 10;
        private Duration readinessBackoff  = Duration.ofMillis(500);
        private Duration requestTimeout    = Duration.ofSeconds(5);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }

        public int getReadinessAttempts() { return readinessAttempts; }
        public void setReadinessAttempts(int readinessAttempts) { this.readinessAttempts = readinessAttempts; }

        public Duration getReadinessBackoff() { return readinessBackoff; }
        public void setReadinessBackoff(Duration readinessBackoff) { this.readinessBackoff = readinessBackoff; }

        public Duration getRequestTimeout() { return requestTimeout; }
        public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }
    }
}
