package com.agentflow.orchestrator.hosting;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * HTTP client for the code-hosting gateway.
 *
 * <pre>
 *   GET  /pull-requests/status?repository=..&amp;branch=..  → PullRequestStatus
 *   POST /pull-requests/comments {repository, branch, body}
 * </pre>
 */
@Component
public class HttpCodeHostingClient implements CodeHostingClient {

    private static final Logger log = LoggerFactory.getLogger(HttpCodeHostingClient.class);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final Duration     timeout;

    public HttpCodeHostingClient(
            @Value("${agentflow.code-hosting.base-url:http://localhost:8090}") String baseUrl,
            @Value("${agentflow.code-hosting.timeout:30s}") Duration timeout,
            ObjectMapper objectMapper) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.timeout = timeout;
        this.json    = objectMapper;
        this.http    = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public PullRequestStatus pullRequestStatus(String repository, String branch) {
        String query = "?repository=" + encode(repository) + "&branch=" + encode(branch == null ? "" : branch);
        String op = "pullRequestStatus for " + repository;
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/pull-requests/status" + query))
                    .timeout(timeout)
                    .header("Accept", "application/json")
                    .GET()
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new CodeHostingException(op + " failed: HTTP " + resp.statusCode() + ": " + resp.body());
            }
            return json.readValue(resp.body(), PullRequestStatus.class);
        } catch (CodeHostingException e) {
            throw e;
        } catch (JsonProcessingException e) {
            throw new CodeHostingException("Failed to parse " + op + " response", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CodeHostingException(op + " interrupted", e);
        } catch (Exception e) {
            throw new CodeHostingException(op + " failed", e);
        }
    }

    @Override
    public void comment(String repository, String branch, String text) {
        log.info("Commenting on {} @ {}", repository, branch);
        String body;
        try {
            body = json.writeValueAsString(Map.of(
                    "repository", repository,
                    "branch",     branch == null ? "" : branch,
                    "body",       text));
        } catch (JsonProcessingException e) {
            throw new CodeHostingException("JSON serialization failed", e);
        }
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/pull-requests/comments"))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .header("Accept",       "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new CodeHostingException(
                        "comment failed for " + repository + ": HTTP " + resp.statusCode() + ": " + resp.body());
            }
        } catch (CodeHostingException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CodeHostingException("comment interrupted for " + repository, e);
        } catch (Exception e) {
            throw new CodeHostingException("comment failed for " + repository, e);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
