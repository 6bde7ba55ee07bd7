package com.agentflow.orchestrator.bridge;

import com.agentflow.orchestrator.bridge.BridgeResult.DeliveryPath;
import com.agentflow.orchestrator.config.BridgeProperties;
import com.agentflow.orchestrator.config.BridgeProperties.InputMode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Spawns one agent process, hands it its initial message exactly once and
 * waits for it to exit.
 *
 * <p>The agent reads its input channel until end-of-stream and only then
 * starts working. The write end must therefore be closed before the bridge
 * waits for exit; waiting first leaves both sides blocked on each other.
 * {@link #deliverAndAwait} is the only code that writes the channel and it
 * encodes that order: open, write, close, then wait.
 *
 * <p>When the companion relay is enabled it is tried first, after a bounded
 * readiness probe. Any companion problem falls back to the direct path.
 *
 * <p>Exit waits are unbounded unless {@code agentflow.bridge.max-run-duration}
 * is set. {@link #cancel} closes the write end, then sends SIGTERM, then
 * force-kills after the grace period.
 */
@Component
public class SubprocessBridge {

    private static final Logger log = LoggerFactory.getLogger(SubprocessBridge.class);

    static final String FIFO_ENV = "INPUT_FIFO_PATH";

    private final BridgeProperties properties;
    private final CompanionClient  companion;
    private final ObjectMapper     objectMapper;
    private final MeterRegistry    meterRegistry;

    private final Map<String, AgentRun> active = new ConcurrentHashMap<>();
    private final ExecutorService outputPumps = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "agent-output");
        t.setDaemon(true);
        return t;
    });

    public SubprocessBridge(BridgeProperties properties,
                            CompanionClient companion,
                            ObjectMapper objectMapper,
                            MeterRegistry meterRegistry) {
        this.properties    = properties;
        this.companion     = companion;
        this.objectMapper  = objectMapper;
        this.meterRegistry = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Entry point
    // ------------------------------------------------------------------

    /**
     * Run one agent process to completion.
     *
     * @throws BridgeException {@code PROCESS} if the process cannot be spawned,
     *         cannot be given its input or exceeds the maximum run duration;
     *         {@code CANCELLED} if {@link #cancel} was called for the run
     */
    public BridgeResult run(BridgeRequest request) {
        if (active.containsKey(request.runKey())) {
            throw new BridgeException(BridgeException.Kind.PROCESS,
                    "An agent is already running for " + request.runKey());
        }
        Instant started = Instant.now();
        AgentRun run = spawn(request);
        if (active.putIfAbsent(request.runKey(), run) != null) {
            run.cancel(properties.getCancelGracePeriod());
            throw new BridgeException(BridgeException.Kind.PROCESS,
                    "An agent is already running for " + request.runKey());
        }

        try {
            DeliveryPath path = DeliveryPath.DIRECT;
            if (run.supportsCompanion() && properties.getCompanion().isEnabled()) {
                path = deliverViaCompanion(request.prompt()) ? DeliveryPath.COMPANION : DeliveryPath.DIRECT;
            }

            int exitCode = path == DeliveryPath.COMPANION
                    ? awaitExit(run)
                    : deliverAndAwait(run, AgentInputMessage.jsonLine(objectMapper, request.prompt()));

            String output = run.collectOutput();
            Duration took = Duration.between(started, Instant.now());
            log.info("Agent {} exited with {} after {}s (input via {})",
                    request.runKey(), exitCode, took.toSeconds(), path);
            return new BridgeResult(exitCode, output, path, took);
        } finally {
            active.remove(request.runKey(), run);
        }
    }

    /**
     * Cancel a running agent: close its input, SIGTERM, then force-kill after
     * the grace period.
     *
     * @return false when no run is active under the key
     */
    public boolean cancel(String runKey) {
        AgentRun run = active.get(runKey);
        if (run == null) {
            return false;
        }
        log.warn("Cancelling agent {}", runKey);
        run.cancel(properties.getCancelGracePeriod());
        return true;
    }

    public boolean isRunning(String runKey) {
        return active.containsKey(runKey);
    }

    @PreDestroy
    void shutdown() {
        active.keySet().forEach(this::cancel);
        outputPumps.shutdownNow();
    }

    // ------------------------------------------------------------------
    // Delivery protocol
    // ------------------------------------------------------------------

    /**
     * Open the write end, write the message, close the write end, and only
     * then wait for the process to exit.
     */
    int deliverAndAwait(AgentRun run, String message) {
        try {
            OutputStream out = run.openInput();                         // 1. open
            try {
                out.write(message.getBytes(StandardCharsets.UTF_8));    // 2. write
                out.flush();
            } finally {
                run.closeInput();                                       // 3. close: end-of-stream
            }
        } catch (IOException e) {
            meterRegistry.counter("agentflow.bridge.deliveries", "path", "direct", "outcome", "failure").increment();
            if (run.isCancelled()) {
                throw new BridgeException(BridgeException.Kind.CANCELLED, "Run cancelled during delivery");
            }
            run.cancel(properties.getCancelGracePeriod());
            throw new BridgeException(BridgeException.Kind.PROCESS,
                    "Failed to deliver input through " + run.channel().describe() + ": " + e.getMessage(), e);
        }
        meterRegistry.counter("agentflow.bridge.deliveries", "path", "direct", "outcome", "success").increment();
        return awaitExit(run);                                          // 4. wait
    }

    /**
     * @return true when the companion took the input, including a write it
     *         did not confirm in time; the pipe is then never written a second time
     */
    private boolean deliverViaCompanion(String prompt) {
        if (!companion.awaitReady()) {
            log.warn("Companion not ready; writing input pipe directly");
            meterRegistry.counter("agentflow.bridge.deliveries", "path", "companion", "outcome", "not_ready").increment();
            return false;
        }
        try {
            String outcome = companion.deliver(prompt) ? "success" : "unconfirmed";
            meterRegistry.counter("agentflow.bridge.deliveries", "path", "companion", "outcome", outcome).increment();
            return true;
        } catch (BridgeException e) {
            log.warn("Companion delivery failed, writing input pipe directly: {}", e.getMessage());
            meterRegistry.counter("agentflow.bridge.deliveries", "path", "companion", "outcome", "failure").increment();
            return false;
        }
    }

    private int awaitExit(AgentRun run) {
        Duration limit = properties.getMaxRunDuration();
        try {
            if (limit == null || limit.isZero() || limit.isNegative()) {
                run.process().waitFor();
            } else if (!run.process().waitFor(limit.toMillis(), TimeUnit.MILLISECONDS)) {
                log.error("Agent {} exceeded max run duration {}; terminating", run.runKey(), limit);
                run.cancel(properties.getCancelGracePeriod());
                throw new BridgeException(BridgeException.Kind.PROCESS,
                        "Agent exceeded max run duration of " + limit.toSeconds() + "s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            run.cancel(properties.getCancelGracePeriod());
            throw new BridgeException(BridgeException.Kind.CANCELLED, "Interrupted while waiting for agent", e);
        }
        if (run.isCancelled()) {
            throw new BridgeException(BridgeException.Kind.CANCELLED,
                    "Agent " + run.runKey() + " was cancelled (exit " + run.process().exitValue() + ")");
        }
        return run.process().exitValue();
    }

    // ------------------------------------------------------------------
    // Spawning
    // ------------------------------------------------------------------

    private AgentRun spawn(BridgeRequest request) {
        ProcessBuilder pb = new ProcessBuilder(request.command()).redirectErrorStream(true);
        if (request.workingDirectory() != null) {
            pb.directory(request.workingDirectory().toFile());
        }
        pb.environment().putAll(request.environment());

        NamedPipe pipe = null;
        if (properties.getInputMode() == InputMode.FIFO) {
            pipe = new NamedPipe(fifoPath(request), properties.getPipeOpenPoll());
            try {
                pipe.ensureExists();
            } catch (IOException e) {
                throw new BridgeException(BridgeException.Kind.PROCESS,
                        "Cannot create input pipe " + pipe.path() + ": " + e.getMessage(), e);
            }
            pb.environment().put(FIFO_ENV, pipe.path().toString());
        }

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new BridgeException(BridgeException.Kind.PROCESS,
                    "Failed to spawn " + request.command().get(0) + ": " + e.getMessage(), e);
        }
        log.info("Spawned agent {} (pid {}): {}", request.runKey(), process.pid(), request.command());

        InputChannel channel;
        if (pipe != null) {
            closeQuietly(process.getOutputStream());   // input arrives on the pipe, not stdin
            channel = pipe;
        } else {
            channel = new StdinChannel(process);
        }

        AgentRun run = new AgentRun(request.runKey(), process, channel, pipe != null);
        run.startPump(outputPumps);
        return run;
    }

    private Path fifoPath(BridgeRequest request) {
        Path configured = Path.of(properties.getFifoPath());
        if (configured.isAbsolute() || request.workingDirectory() == null) {
            return configured;
        }
        return request.workingDirectory().resolve(configured);
    }

    private static void closeQuietly(OutputStream out) {
        try {
            out.close();
        } catch (IOException e) {
            log.debug("Closing agent stdin failed: {}", e.getMessage());
        }
    }

    // ------------------------------------------------------------------
    // One running agent
    // ------------------------------------------------------------------

    /** Process handle plus the state needed to close its input exactly once. */
    static final class AgentRun {

        private final String        runKey;
        private final Process       process;
        private final InputChannel  channel;
        private final boolean       companionCapable;
        private final AtomicReference<OutputStream> input = new AtomicReference<>();
        private final AtomicBoolean cancelled = new AtomicBoolean();
        private final StringBuffer  output    = new StringBuffer();
        private volatile Future<?>  pump;

        AgentRun(String runKey, Process process, InputChannel channel, boolean companionCapable) {
            this.runKey           = runKey;
            this.process          = process;
            this.channel          = channel;
            this.companionCapable = companionCapable;
        }

        String       runKey()            { return runKey; }
        Process      process()           { return process; }
        InputChannel channel()           { return channel; }
        boolean      isCancelled()       { return cancelled.get(); }
        boolean      supportsCompanion() { return companionCapable; }

        OutputStream openInput() throws IOException {
            OutputStream out = channel.open(() -> process.isAlive() && !cancelled.get());
            input.set(out);
            if (cancelled.get()) {
                closeInput();
                throw new IOException("Run cancelled while opening input");
            }
            return out;
        }

        /** Idempotent; safe to call from the delivering thread and from cancel(). */
        void closeInput() {
            OutputStream out = input.getAndSet(null);
            if (out == null) return;
            try {
                out.close();
            } catch (IOException e) {
                log.warn("Closing input of agent {} failed: {}", runKey, e.getMessage());
            }
        }

        /** Close input first, then SIGTERM, then SIGKILL after the grace period. */
        void cancel(Duration grace) {
            cancelled.set(true);
            closeInput();
            if (!process.isAlive()) return;
            process.destroy();
            try {
                if (process.waitFor(grace.toMillis(), TimeUnit.MILLISECONDS)) return;
                log.warn("Agent {} ignored SIGTERM for {}s; killing", runKey, grace.toSeconds());
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
                if (!process.waitFor(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.error("Agent {} (pid {}) still alive after forced kill", runKey, process.pid());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
            }
        }

        void startPump(ExecutorService pool) {
            pump = pool.submit(() -> {
                try (BufferedReader reader = new BufferedReader(
                        new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                    String line;
                    while ((line = reader.readLine()) != null) {
                        output.append(line).append('\n');
                        log.debug("[{}] {}", runKey, line);
                    }
                } catch (IOException e) {
                    log.debug("Output stream of agent {} closed: {}", runKey, e.getMessage());
                }
            });
        }

        /**
         * Output captured so far. Waits briefly for the reader to drain; a
         * detached grandchild may keep the stream open after the agent exits.
         */
        String collectOutput() {
            Future<?> p = pump;
            if (p != null) {
                try {
                    p.get(5, TimeUnit.SECONDS);
                } catch (TimeoutException e) {
                    log.debug("Output of agent {} still open after exit; returning what was read", runKey);
                } catch (ExecutionException e) {
                    log.debug("Output reader of agent {} failed: {}", runKey, e.getMessage());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return output.toString();
        }
    }
}
