package com.datapulse.etl.extract;

/**
 * One HTTP GET, without retry or throttling.
 */
@FunctionalInterface
public interface PageFetcher {

    FetchOutcome get(String url, CancellationToken token);
}
