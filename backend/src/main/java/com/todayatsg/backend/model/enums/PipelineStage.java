package com.todayatsg.backend.model.enums;

/**
 * Per-source progress through one run.
 */
public enum PipelineStage {
    PENDING,
    FETCHING,
    PARSING,
    NORMALIZING,
    DEDUPLICATING,
    GEOCODING,
    PERSISTED,
    FAILED,
    SKIPPED
}
