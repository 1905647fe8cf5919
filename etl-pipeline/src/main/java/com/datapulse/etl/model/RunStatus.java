package com.datapulse.etl.model;

public enum RunStatus {
    RUNNING,
    /** All phases completed without any recorded error */
    SUCCESS,
    /** All phases completed, some records or domains failed */
    PARTIAL,
    FAILED,
    CANCELLED
}
