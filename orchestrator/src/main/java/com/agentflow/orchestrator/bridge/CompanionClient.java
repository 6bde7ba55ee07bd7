package com.agentflow.orchestrator.bridge;

import com.agentflow.orchestrator.config.BridgeProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Map;

/**
 * HTTP client for the companion input relay running next to the agent.
 *
 * The companion only starts listening once the agent's input pipe exists,
 * so it is routinely not up yet when the bridge first needs it. Callers
 * probe with {@link #awaitReady()} (bounded attempts, fixed backoff) and fall
 * back to writing the pipe themselves when it stays down.
 */
@Component
public class CompanionClient {

    private static final Logger log = LoggerFactory.getLogger(CompanionClient.class);

    private final HttpClient                 http;
    private final ObjectMapper               json;
    private final BridgeProperties.Companion settings;
    private final String                     baseUrl;

    public CompanionClient(BridgeProperties properties, ObjectMapper objectMapper) {
        this.settings = properties.getCompanion();
        this.json     = objectMapper;
        this.baseUrl  = trimSlash(settings.getUrl());
        this.http     = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(settings.getRequestTimeout())
                .build();
    }

    /**
     * Poll {@code GET /health} until it answers 2xx or the attempts run out.
     *
     * @return true when the companion is ready
     */
    public boolean awaitReady() {
        int attempts = Math.max(1, settings.getReadinessAttempts());
        Duration backoff = settings.getReadinessBackoff();
        for (int attempt = 1; attempt <= attempts; attempt++) {
            if (isReady()) {
                log.debug("Companion at {} ready after {} attempt(s)", baseUrl, attempt);
                return true;
            }
            if (attempt < attempts) {
                try {
                    Thread.sleep(backoff.toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
        }
        log.warn("Companion at {} not ready after {} attempts", baseUrl, attempts);
        return false;
    }

    public boolean isReady() {
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/health"))
                    .timeout(settings.getRequestTimeout())
                    .GET()
                    .build();
            HttpResponse<Void> resp = http.send(req, HttpResponse.BodyHandlers.discarding());
            return resp.statusCode() >= 200 && resp.statusCode() < 300;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (Exception e) {
            log.debug("Companion liveness probe failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Hand the prompt text to the companion, which writes it to the pipe.
     *
     * A reply that times out after the connection was made is not a failure:
     * the companion may already have written the pipe, and a second writer
     * would block until the agent exits.
     *
     * @return true when the companion confirmed the write, false when the
     *         request went out but no reply came back in time
     * @throws BridgeException {@code DELIVERY} when the companion could not be
     *         reached or rejected the input
     */
    public boolean deliver(String text) {
        String body;
        try {
            body = json.writeValueAsString(Map.of("text", text));
        } catch (JsonProcessingException e) {
            throw new BridgeException(BridgeException.Kind.DELIVERY, "Failed to encode companion request", e);
        }
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/input"))
                    .timeout(settings.getRequestTimeout())
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new BridgeException(BridgeException.Kind.DELIVERY,
                        "Companion rejected input: HTTP " + resp.statusCode() + ": " + resp.body());
            }
            return true;
        } catch (BridgeException e) {
            throw e;
        } catch (HttpConnectTimeoutException e) {
            throw new BridgeException(BridgeException.Kind.DELIVERY, "Companion unreachable at " + baseUrl, e);
        } catch (HttpTimeoutException e) {
            log.warn("Companion at {} took input but did not reply within {}", baseUrl, settings.getRequestTimeout());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BridgeException(BridgeException.Kind.DELIVERY, "Interrupted while delivering to companion", e);
        } catch (Exception e) {
            throw new BridgeException(BridgeException.Kind.DELIVERY, "Companion unreachable at " + baseUrl, e);
        }
    }

    private static String trimSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
