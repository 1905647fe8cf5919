package com.datapulse.etl.extract;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * {@link PageFetcher} on the JDK HTTP client. The request is sent asynchronously so that a
 * cancelled run can abandon it instead of waiting for the timeout.
 */
@Slf4j
public class HttpPageFetcher implements PageFetcher {

    private final HttpClient httpClient;
    private final Duration requestTimeout;
    private final String userAgent;

    public HttpPageFetcher(HttpClient httpClient, Duration requestTimeout, String userAgent) {
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout;
        this.userAgent = userAgent;
    }

    @Override
    public FetchOutcome get(String url, CancellationToken token) {
        token.throwIfCancelled();

        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(requestTimeout)
                    .header("User-Agent", userAgent)
                    .header("Accept", "text/html,application/json;q=0.9,*/*;q=0.8")
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            return FetchOutcome.terminalFailure(url, 0, "Invalid URL: " + e.getMessage());
        }

        CompletableFuture<HttpResponse<byte[]>> future =
                httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray());

        try (CancellationToken.Registration ignored = token.onCancel(() -> future.cancel(true))) {
            HttpResponse<byte[]> response = future.get();
            log.debug("GET {} -> {}", url, response.statusCode());
            return FetchOutcome.fromStatus(url, response.statusCode(), response.body());

        } catch (CancellationException e) {
            throw new PipelineCancelledException("Request cancelled: " + url);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new PipelineCancelledException("Interrupted during request: " + url);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof HttpTimeoutException) {
                return FetchOutcome.transientFailure(url, 0, "Timeout after " + requestTimeout.toSeconds() + "s");
            }
            if (cause instanceof IOException) {
                return FetchOutcome.transientFailure(url, 0, "Network error: " + cause.getMessage());
            }
            return FetchOutcome.terminalFailure(url, 0, String.valueOf(cause));
        }
    }
}
