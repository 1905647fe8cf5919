package com.datapulse.etl.extract;

import java.nio.charset.StandardCharsets;

/**
 * Result of one HTTP GET. Expected failures are values, not exceptions.
 */
public record FetchOutcome(Kind kind, String url, int statusCode, byte[] body, String reason) {

    public enum Kind {
        OK,
        /** 404 or 410: the resource definitively does not exist, never retried */
        NOT_FOUND,
        /** Timeout, network error, 429 or 5xx: worth retrying */
        TRANSIENT_FAILURE,
        /** Any other 4xx: retrying will not help */
        TERMINAL_FAILURE
    }

    public static FetchOutcome ok(String url, int statusCode, byte[] body) {
        return new FetchOutcome(Kind.OK, url, statusCode, body, null);
    }

    public static FetchOutcome notFound(String url, int statusCode) {
        return new FetchOutcome(Kind.NOT_FOUND, url, statusCode, null, "HTTP " + statusCode);
    }

    public static FetchOutcome transientFailure(String url, int statusCode, String reason) {
        return new FetchOutcome(Kind.TRANSIENT_FAILURE, url, statusCode, null, reason);
    }

    public static FetchOutcome terminalFailure(String url, int statusCode, String reason) {
        return new FetchOutcome(Kind.TERMINAL_FAILURE, url, statusCode, null, reason);
    }

    /** Maps an HTTP status to an outcome kind; the body is only kept for 2xx. */
    public static FetchOutcome fromStatus(String url, int statusCode, byte[] body) {
        if (statusCode >= 200 && statusCode < 300) {
            return ok(url, statusCode, body);
        }
        if (statusCode == 404 || statusCode == 410) {
            return notFound(url, statusCode);
        }
        if (statusCode == 429 || statusCode >= 500) {
            return transientFailure(url, statusCode, "HTTP " + statusCode);
        }
        return terminalFailure(url, statusCode, "HTTP " + statusCode);
    }

    public boolean isOk() {
        return kind == Kind.OK;
    }

    public boolean isTransient() {
        return kind == Kind.TRANSIENT_FAILURE;
    }

    public String text() {
        return body == null ? "" : new String(body, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "FetchOutcome[" + kind + " " + url + (reason == null ? "" : " " + reason) + "]";
    }
}
