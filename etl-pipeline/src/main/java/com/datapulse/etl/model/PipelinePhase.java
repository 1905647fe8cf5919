package com.datapulse.etl.model;

public enum PipelinePhase {
    EXTRACT,
    TRANSFORM,
    LOAD,
    DONE,
    FAILED,
    CANCELLED
}
