package com.datapulse.etl.extract;

/**
 * Raised at the next page, row or record boundary once a run has been cancelled.
 */
public class PipelineCancelledException extends RuntimeException {

    public PipelineCancelledException(String message) {
        super(message);
    }
}
