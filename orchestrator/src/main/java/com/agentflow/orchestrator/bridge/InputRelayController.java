package com.agentflow.orchestrator.bridge;

import com.agentflow.orchestrator.config.BridgeProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Companion input relay. Runs next to an agent when this service is deployed
 * as the sidecar and writes posted text to the agent's input pipe.
 *
 * <pre>
 *   GET  /health  → "OK"
 *   POST /input   {"text": "..."}  → 200 / 400 / 503
 * </pre>
 *
 * Every write is a complete open, write, close cycle so the agent sees
 * end-of-stream after each message.
 */
@RestController
@ConditionalOnProperty(name = "agentflow.companion.enabled", havingValue = "true")
public class InputRelayController {

    private static final Logger log = LoggerFactory.getLogger(InputRelayController.class);

    private final Path         fifoPath;
    private final ObjectMapper objectMapper;
    private final Duration     pipeOpenPoll;
    private final int          pipeWaitAttempts;
    private final Duration     pipeWaitInterval;

    public InputRelayController(
            BridgeProperties properties,
            ObjectMapper objectMapper,
            @Value("${agentflow.companion.pipe-wait-attempts:60}") int pipeWaitAttempts,
            @Value("${agentflow.companion.pipe-wait-interval:2s}") Duration pipeWaitInterval) {
        this.fifoPath         = Path.of(properties.getFifoPath());
        this.pipeOpenPoll     = properties.getPipeOpenPoll();
        this.objectMapper     = objectMapper;
        this.pipeWaitAttempts = pipeWaitAttempts;
        this.pipeWaitInterval = pipeWaitInterval;
    }

    @GetMapping("/health")
    public String health() {
        return "OK";
    }

    @PostMapping("/input")
    public ResponseEntity<Map<String, String>> input(@RequestBody Map<String, String> body) {
        String text = body == null ? null : body.get("text");
        if (text == null || text.isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "text is required"));
        }
        if (!awaitPipe()) {
            log.error("Input pipe {} never appeared", fifoPath);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of("error", "input pipe not available"));
        }

        NamedPipe pipe = new NamedPipe(fifoPath, pipeOpenPoll);
        try (OutputStream out = pipe.open(() -> Files.exists(fifoPath))) {
            out.write(AgentInputMessage.jsonLine(objectMapper, text).getBytes(StandardCharsets.UTF_8));
            out.flush();
        } catch (IOException e) {
            log.error("Writing to {} failed: {}", fifoPath, e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of("error", "write failed: " + e.getMessage()));
        }
        log.info("Relayed {} chars to {}", text.length(), fifoPath);
        return ResponseEntity.ok(Map.of("status", "delivered"));
    }

    private boolean awaitPipe() {
        for (int attempt = 0; attempt < pipeWaitAttempts; attempt++) {
            if (Files.exists(fifoPath)) {
                return true;
            }
            try {
                Thread.sleep(pipeWaitInterval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return Files.exists(fifoPath);
    }
}
