package com.chicu.aiforecast.ai.ml.training;

public enum TrainingStatus {
    PROMOTED,
    REJECTED,
    ABORTED_INSUFFICIENT_DATA,
    CANCELLED,
    ALREADY_RUNNING,
    FAILED
}
