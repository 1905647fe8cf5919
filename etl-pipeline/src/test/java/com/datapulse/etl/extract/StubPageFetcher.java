package com.datapulse.etl.extract;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Canned responses per URL. Unknown URLs answer 404. When several outcomes are queued for
 * a URL they are served in order and the last one repeats.
 */
public class StubPageFetcher implements PageFetcher {

    private final Map<String, Deque<FetchOutcome>> responses = new HashMap<>();
    private final List<String> requests = new ArrayList<>();

    public StubPageFetcher page(String url, String body) {
        return respond(url, FetchOutcome.ok(url, 200, body.getBytes(StandardCharsets.UTF_8)));
    }

    public StubPageFetcher respond(String url, FetchOutcome... outcomes) {
        responses.computeIfAbsent(url, u -> new ArrayDeque<>()).addAll(List.of(outcomes));
        return this;
    }

    public StubPageFetcher failing(String url, int status) {
        return respond(url, FetchOutcome.fromStatus(url, status, null));
    }

    @Override
    public FetchOutcome get(String url, CancellationToken token) {
        token.throwIfCancelled();
        requests.add(url);
        Deque<FetchOutcome> queue = responses.get(url);
        if (queue == null || queue.isEmpty()) {
            return FetchOutcome.notFound(url, 404);
        }
        return queue.size() > 1 ? queue.poll() : queue.peek();
    }

    public List<String> requests() {
        return requests;
    }

    public long calls(String url) {
        return requests.stream().filter(url::equals).count();
    }

    public int totalCalls() {
        return requests.size();
    }

    /** Wraps a fetcher with 3 attempts, 1 ms backoff and no throttling. */
    public static ResilientFetcher resilient(PageFetcher fetcher) {
        return new ResilientFetcher("test", fetcher,
                RetryPolicy.builder().maxAttempts(3).baseDelay(Duration.ofMillis(1)).build(),
                new RequestThrottle(Duration.ZERO));
    }
}
