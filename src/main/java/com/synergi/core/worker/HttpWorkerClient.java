package com.synergi.core.worker;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.synergi.core.execution.CancellationToken;
import com.synergi.core.model.PlannedStep;
import com.synergi.core.model.WorkerEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Invokes remote workers by POSTing the step parameters as JSON.
 */
@Component
public class HttpWorkerClient implements WorkerClient {

    private static final Logger log = LoggerFactory.getLogger(HttpWorkerClient.class);
    private static final TypeReference<Map<String, Object>> BODY_TYPE = new TypeReference<>() {};

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpWorkerClient(@Qualifier("collaboratorHttpClient") HttpClient httpClient, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean supports(String endpoint) {
        return endpoint != null && (endpoint.startsWith("http://") || endpoint.startsWith("https://"));
    }

    @Override
    public Map<String, Object> invoke(WorkerEntry worker, PlannedStep step, CancellationToken token) {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(URI.create(worker.endpoint()))
                    .header("Content-Type", "application/json")
                    .header("Accept", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(step.parameters())))
                    .build();
        } catch (IOException | IllegalArgumentException e) {
            throw new WorkerCallException("Cannot build request for worker " + worker.id() + ": " + e.getMessage(), e);
        }

        CompletableFuture<HttpResponse<String>> pending =
                httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString());
        CancellationToken.Registration hook = token.onCancel(() -> pending.cancel(true));
        HttpResponse<String> response;
        try {
            response = pending.get();
        } catch (CancellationException e) {
            throw new WorkerCallException("Call to worker " + worker.id() + " was cancelled", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkerCallException("Interrupted calling worker " + worker.id(), e);
        } catch (ExecutionException e) {
            throw new WorkerCallException("Worker " + worker.id() + " unreachable: " + e.getCause().getMessage(),
                    e.getCause());
        } finally {
            hook.remove();
        }

        if (response.statusCode() >= 400) {
            log.debug("Worker {} returned HTTP {}: {}", worker.id(), response.statusCode(), response.body());
            throw new WorkerCallException("HTTP " + response.statusCode() + " from worker " + worker.id(),
                    response.statusCode(), null);
        }
        try {
            return objectMapper.readValue(response.body(), BODY_TYPE);
        } catch (IOException e) {
            throw new WorkerCallException("Worker " + worker.id() + " returned invalid JSON: " + e.getMessage(), e);
        }
    }
}
